package com.ttennebkram.cookieflip.ml;

import java.util.Arrays;

/**
 * One feature vector with its class label.
 */
public class LabeledSample {
    private final double[] features;
    private final int label;

    public LabeledSample(double[] features, int label) {
        this.features = features.clone();
        this.label = label;
    }

    public double[] getFeatures() {
        return features.clone();
    }

    public int getLabel() {
        return label;
    }

    public int size() {
        return features.length;
    }

    @Override
    public String toString() {
        return label + " <- " + Arrays.toString(features);
    }
}
