package com.ttennebkram.cookieflip.ml;

import com.ttennebkram.cookieflip.features.FeatureMatrix;

import java.util.Arrays;

/**
 * Per-column z-score standardization fitted on training data.
 * Columns without variance are only centered.
 */
public class FeatureScaler {

    private final double[] mean;
    private final double[] scale;

    private FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    public static FeatureScaler fit(FeatureMatrix features) {
        int n = features.rows();
        int cols = features.columns();
        if (n == 0) {
            throw new IllegalArgumentException("Cannot fit scaler on empty features");
        }
        double[] mean = new double[cols];
        double[] scale = new double[cols];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < cols; c++) {
                mean[c] += features.get(r, c);
            }
        }
        for (int c = 0; c < cols; c++) {
            mean[c] /= n;
        }
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < cols; c++) {
                double d = features.get(r, c) - mean[c];
                scale[c] += d * d;
            }
        }
        for (int c = 0; c < cols; c++) {
            double std = Math.sqrt(scale[c] / n);
            scale[c] = std > 1e-12 ? std : 1.0;
        }
        return new FeatureScaler(mean, scale);
    }

    /**
     * No-op scaler for the given column count.
     */
    public static FeatureScaler identity(int columns) {
        double[] mean = new double[columns];
        double[] scale = new double[columns];
        Arrays.fill(scale, 1.0);
        return new FeatureScaler(mean, scale);
    }

    public FeatureMatrix transform(FeatureMatrix features) {
        if (features.columns() != mean.length) {
            throw new IllegalArgumentException("Expected " + mean.length + " features, got " + features.columns());
        }
        FeatureMatrix scaled = new FeatureMatrix(features.columns());
        for (int r = 0; r < features.rows(); r++) {
            double[] row = features.getRow(r);
            for (int c = 0; c < row.length; c++) {
                row[c] = (row[c] - mean[c]) / scale[c];
            }
            scaled.addRow(row);
        }
        return scaled;
    }
}
