package mmc.sample;

import org.apache.commons.math3.random.AbstractRandomGenerator;
import org.apache.commons.math3.random.Well44497b;
import org.junit.Assert;
import org.junit.Test;

public class ExponentialVariateTest {
    private static class FixedUniforms extends AbstractRandomGenerator {
        private final double[] _uniforms;
        private int _next = 0;

        FixedUniforms(double... aUniforms) {
            _uniforms = aUniforms;
        }

        @Override
        public void setSeed(long aSeed) {
            _next = 0;
        }

        @Override
        public double nextDouble() {
            return _uniforms[_next++];
        }
    }

    @Test
    public void testInverseTransform() {
        Variate myVariate = new ExponentialVariate(new FixedUniforms(0.5, 1.0 / Math.E));

        Assert.assertEquals(4.0 * Math.log(2), myVariate.sample(4.0), 1e-12);
        Assert.assertEquals(4.0, myVariate.sample(4.0), 1e-12);
    }

    @Test
    public void testZeroDrawIsRedrawn() {
        Variate myVariate = new ExponentialVariate(new FixedUniforms(0.0, 0.0, 0.25));
        double mySample = myVariate.sample(2.0);

        Assert.assertFalse(Double.isInfinite(mySample));
        Assert.assertEquals(2.0 * Math.log(4), mySample, 1e-12);
    }

    @Test
    public void testMean() {
        Variate myVariate = new ExponentialVariate(new Well44497b(31));
        int myCount = 200000;
        double mySum = 0;

        for (int i = 0; i < myCount; i++) {
            double mySample = myVariate.sample(3.0);

            Assert.assertTrue(mySample >= 0);
            mySum += mySample;
        }

        Assert.assertEquals(3.0, mySum / myCount, 0.05);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroMeanFails() {
        new ExponentialVariate(new Well44497b(31)).sample(0.0);
    }
}
