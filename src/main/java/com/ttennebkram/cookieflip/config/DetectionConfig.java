package com.ttennebkram.cookieflip.config;

/**
 * Blob detection parameters.
 */
public class DetectionConfig {
    public int thresholdLow = 0;
    public int thresholdHigh = 110;
    public int minArea = 15000;
    public int maxArea = 300000;
}
