package com.ttennebkram.cookieflip.detection;

import com.ttennebkram.cookieflip.config.DetectionConfig;
import com.ttennebkram.cookieflip.model.PixelRegion;
import com.ttennebkram.cookieflip.processing.FillHolesProcessor;
import com.ttennebkram.cookieflip.processing.ImageProcessor;
import com.ttennebkram.cookieflip.processing.ThresholdRangeProcessor;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds cookie blobs: range threshold, hole filling, then connected components
 * filtered by pixel area.
 */
public class CookieDetector {

    private final ThresholdRangeProcessor threshold;
    private final FillHolesProcessor fillHoles = new FillHolesProcessor();
    private final ImageProcessor binarize;
    private final int minArea;
    private final int maxArea;

    public CookieDetector(DetectionConfig config) {
        this(config.thresholdLow, config.thresholdHigh, config.minArea, config.maxArea);
    }

    public CookieDetector(int thresholdLow, int thresholdHigh, int minArea, int maxArea) {
        if (minArea < 0 || minArea > maxArea) {
            throw new IllegalArgumentException("Invalid area range [" + minArea + ", " + maxArea + "]");
        }
        this.threshold = new ThresholdRangeProcessor(thresholdLow, thresholdHigh);
        this.binarize = threshold.andThen(fillHoles);
        this.minArea = minArea;
        this.maxArea = maxArea;
    }

    public int getMinArea() { return minArea; }
    public int getMaxArea() { return maxArea; }

    @Override
    public String toString() {
        return threshold + " -> " + fillHoles + ", area [" + minArea + ", " + maxArea + "]";
    }

    /**
     * Detect cookies in an image.
     *
     * @param image Grayscale or BGR image
     * @return One region per accepted component, in label order. May be empty.
     */
    public List<PixelRegion> detectCookies(Mat image) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Cannot detect cookies in an empty image");
        }

        Mat binary = null;
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        List<PixelRegion> cookies = new ArrayList<>();

        try {
            binary = binarize.process(image);
            int numLabels = Imgproc.connectedComponentsWithStats(binary, labels, stats, centroids, 8, CvType.CV_32S);

            // Label 0 is the background
            for (int i = 1; i < numLabels; i++) {
                int area = (int) stats.get(i, Imgproc.CC_STAT_AREA)[0];
                if (area < minArea || area > maxArea) {
                    continue;
                }
                Mat mask = new Mat();
                Core.compare(labels, new Scalar(i), mask, Core.CMP_EQ);
                cookies.add(new PixelRegion(mask));
            }
            return cookies;
        } finally {
            if (binary != null) binary.release();
            labels.release();
            stats.release();
            centroids.release();
        }
    }
}
