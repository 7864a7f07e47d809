package com.ttennebkram.cookieflip.ml;

import com.ttennebkram.cookieflip.features.FeatureMatrix;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only collection of labeled samples for classification.
 */
public class TrainingDataSet {

    private final List<LabeledSample> samples = new ArrayList<>();
    private int featureCount = -1;

    /**
     * Append every row of the matrix with the given label, in row order.
     */
    public void append(FeatureMatrix features, int label) {
        if (features.isEmpty()) {
            return;
        }
        if (featureCount >= 0 && features.columns() != featureCount) {
            throw new IllegalArgumentException("Feature count " + features.columns()
                    + " does not match data set feature count " + featureCount);
        }
        featureCount = features.columns();
        for (int r = 0; r < features.rows(); r++) {
            samples.add(new LabeledSample(features.getRow(r), label));
        }
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * Number of features per sample, or -1 while empty.
     */
    public int getFeatureCount() {
        return featureCount;
    }

    public List<LabeledSample> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    /**
     * Sample count per label, ordered by label.
     */
    public Map<Integer, Integer> getLabelCounts() {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (LabeledSample sample : samples) {
            counts.merge(sample.getLabel(), 1, Integer::sum);
        }
        return counts;
    }

    public FeatureMatrix getFeatures() {
        if (samples.isEmpty()) {
            throw new IllegalStateException("Training data set is empty");
        }
        FeatureMatrix matrix = new FeatureMatrix(featureCount);
        for (LabeledSample sample : samples) {
            matrix.addRow(sample.getFeatures());
        }
        return matrix;
    }

    public int[] getLabels() {
        int[] labels = new int[samples.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = samples.get(i).getLabel();
        }
        return labels;
    }

    /**
     * Labels as a CV_32S column vector, the response layout OpenCV classifiers expect.
     */
    public Mat labelsToMat() {
        Mat responses = new Mat(samples.size(), 1, CvType.CV_32S);
        responses.put(0, 0, getLabels());
        return responses;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("DataSet (CLASSIFICATION): ").append(samples.size()).append(" samples");
        if (featureCount >= 0) {
            sb.append(", ").append(featureCount).append(" features");
        }
        for (Map.Entry<Integer, Integer> entry : getLabelCounts().entrySet()) {
            sb.append("\n  label ").append(entry.getKey()).append(": ").append(entry.getValue()).append(" samples");
        }
        return sb.toString();
    }
}
