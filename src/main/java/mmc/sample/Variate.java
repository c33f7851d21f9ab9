package mmc.sample;

public interface Variate {
    /**
     * @param aMean must be > 0
     */
    double sample(double aMean);
}
