package com.ttennebkram.cookieflip.config;

/**
 * Feature extraction parameters.
 */
public class FeatureConfig {
    /** Diameter of the elliptical erosion applied to each blob */
    public int erosionSize = 21;
    /** Sobel aperture: 1, 3, 5 or 7 */
    public int sobelKernelSize = 3;
}
