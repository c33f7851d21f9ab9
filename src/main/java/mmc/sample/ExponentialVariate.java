package mmc.sample;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Inverse transform sampling of an exponential distribution: -mean * ln(U) with U uniform on (0,1).
 */
public class ExponentialVariate implements Variate {
    private final RandomGenerator _rng;

    public ExponentialVariate(RandomGenerator anRNG) {
        _rng = anRNG;
    }

    @Override
    public double sample(double aMean) {
        if (aMean <= 0)
            throw new IllegalArgumentException("Mean must be > 0: " + aMean);

        return -aMean * Math.log(nextOpenUniform());
    }

    // nextDouble() is [0, 1) so redraw the zero, ln(0) would schedule at infinity
    //
    private double nextOpenUniform() {
        double myU;

        do {
            myU = _rng.nextDouble();
        } while (myU == 0.0);

        return myU;
    }
}
