package com.ttennebkram.cookieflip.features;

import com.ttennebkram.cookieflip.config.FeatureConfig;
import com.ttennebkram.cookieflip.model.PixelRegion;
import com.ttennebkram.cookieflip.model.RegionStatistics;
import com.ttennebkram.cookieflip.processing.SobelMagnitudeProcessor;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Surface features of a cookie: min, max, mean and standard deviation of the
 * gradient magnitude over the central (eroded) part of the blob.
 */
public class CookieFeatureExtractor {

    public static final int FEATURE_COUNT = 4;
    public static final String[] FEATURE_NAMES = {"min", "max", "mean", "stdDev"};

    private final SobelMagnitudeProcessor sobelMagnitude;
    private final int erosionSize;

    public CookieFeatureExtractor(FeatureConfig config) {
        this(config.erosionSize, config.sobelKernelSize);
    }

    public CookieFeatureExtractor(int erosionSize) {
        this(erosionSize, 3);
    }

    public CookieFeatureExtractor(int erosionSize, int sobelKernelSize) {
        if (erosionSize < 1) {
            throw new IllegalArgumentException("Erosion size must be positive, got " + erosionSize);
        }
        this.erosionSize = erosionSize;
        this.sobelMagnitude = new SobelMagnitudeProcessor(sobelKernelSize);
    }

    public int getErosionSize() { return erosionSize; }

    public int getSobelKernelSize() { return sobelMagnitude.getKernelSize(); }

    @Override
    public String toString() {
        return sobelMagnitude + ", erosion " + erosionSize;
    }

    /**
     * Compute one feature row per cookie, in the order given.
     *
     * @throws IllegalArgumentException if cookies is empty
     */
    public FeatureMatrix computeCookieFeatures(Mat image, List<PixelRegion> cookies) {
        if (cookies == null || cookies.isEmpty()) {
            throw new IllegalArgumentException("No cookies to compute features for");
        }
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Cannot compute features on an empty image");
        }

        // Magnitude image once for all cookies
        Mat magnitude = sobelMagnitude.process(image);
        FeatureMatrix features = new FeatureMatrix(FEATURE_COUNT);
        try {
            for (PixelRegion cookie : cookies) {
                // Central part of the cookie only
                PixelRegion center = cookie.erode(erosionSize);
                try {
                    RegionStatistics stats = center.getStatistics(magnitude);
                    features.addRow(stats.toArray());
                } finally {
                    center.release();
                }
            }
        } finally {
            magnitude.release();
        }
        return features;
    }
}
