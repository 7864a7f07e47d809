package com.ttennebkram.cookieflip.ml;

import com.ttennebkram.cookieflip.features.FeatureMatrix;

/**
 * A classifier that is trained once on a full data set and then predicts labels.
 */
public interface CookieClassifier {

    /**
     * Display name, e.g. "SVM".
     */
    String getName();

    /**
     * Fit on the complete data set.
     *
     * @return false if training failed; the classifier stays untrained
     */
    boolean train(TrainingDataSet data);

    boolean isTrained();

    /**
     * Predict one label per row, also for a single-row matrix.
     *
     * @throws IllegalStateException if the classifier is not trained
     */
    int[] predict(FeatureMatrix features);

    /**
     * Predict every sample of the data set and compare against its label.
     */
    default AccuracyReport getAccuracy(TrainingDataSet data) {
        int[] predicted = predict(data.getFeatures());
        return AccuracyReport.of(data.getLabels(), predicted);
    }
}
