package com.ttennebkram.cookieflip;

import com.ttennebkram.cookieflip.ml.CookieLabel;

/**
 * Outcome of classifying the cookies of one test image.
 */
public class ClassificationResult {
    public final String imageName;
    private final int[] labels;
    public final long processingTimeMs;

    public ClassificationResult(String imageName, int[] labels, long processingTimeMs) {
        this.imageName = imageName;
        this.labels = labels.clone();
        this.processingTimeMs = processingTimeMs;
    }

    /** Predicted label per cookie, in detection order */
    public int[] getLabels() {
        return labels.clone();
    }

    public int getCookieCount() {
        return labels.length;
    }

    public int getFlippedCount() {
        int flipped = 0;
        for (int label : labels) {
            if (CookieLabel.isFlipped(label)) {
                flipped++;
            }
        }
        return flipped;
    }

    @Override
    public String toString() {
        return imageName + ": " + getFlippedCount() + " out of " + getCookieCount() + " cookies are flipped";
    }
}
