package com.ttennebkram.cookieflip.model;

/**
 * Min, max, mean and standard deviation of an image restricted to a region.
 */
public class RegionStatistics {
    public static final RegionStatistics EMPTY = new RegionStatistics(0, 0, 0, 0, 0);

    public final double min;
    public final double max;
    public final double mean;
    public final double stdDev;
    public final int pixelCount;

    public RegionStatistics(double min, double max, double mean, double stdDev, int pixelCount) {
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.stdDev = stdDev;
        this.pixelCount = pixelCount;
    }

    /**
     * Statistics in feature order: min, max, mean, stdDev.
     */
    public double[] toArray() {
        return new double[]{min, max, mean, stdDev};
    }

    @Override
    public String toString() {
        return String.format("min=%.3f max=%.3f mean=%.3f std=%.3f (%d px)", min, max, mean, stdDev, pixelCount);
    }
}
