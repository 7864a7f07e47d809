package com.ttennebkram.cookieflip.ml;

import com.ttennebkram.cookieflip.features.FeatureMatrix;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.ml.Ml;
import org.opencv.ml.StatModel;

/**
 * Base class for classifiers backed by an org.opencv.ml StatModel.
 * Subclasses create and configure the model; this class handles the data
 * layout, feature scaling and the trained/untrained state.
 */
public abstract class OpenCvClassifier implements CookieClassifier {

    private final boolean standardize;
    private StatModel model;
    private FeatureScaler scaler;
    private int featureCount = -1;

    protected OpenCvClassifier(boolean standardize) {
        this.standardize = standardize;
    }

    /**
     * Create a fresh, configured model for one training run.
     */
    protected abstract StatModel createModel();

    /**
     * Run prediction on scaled CV_32F samples; results are written as a CV_32F column.
     */
    protected void predictSamples(StatModel model, Mat samples, Mat results) {
        model.predict(samples, results, 0);
    }

    @Override
    public boolean train(TrainingDataSet data) {
        if (data.isEmpty()) {
            System.err.println("[" + getName() + "] ERROR: Training data set is empty");
            return false;
        }
        if (data.getLabelCounts().size() < 2) {
            System.err.println("[" + getName() + "] ERROR: Training needs at least two classes, got "
                    + data.getLabelCounts().keySet());
            return false;
        }

        FeatureMatrix features = data.getFeatures();
        FeatureScaler fitted = standardize ? FeatureScaler.fit(features) : FeatureScaler.identity(features.columns());
        Mat samples = fitted.transform(features).toMat();
        Mat responses = data.labelsToMat();
        try {
            StatModel candidate = createModel();
            boolean ok = candidate.train(samples, Ml.ROW_SAMPLE, responses);
            if (!ok || !candidate.isTrained()) {
                System.err.println("[" + getName() + "] ERROR: OpenCV reported training failure");
                return false;
            }
            model = candidate;
            scaler = fitted;
            featureCount = features.columns();
            return true;
        } catch (CvException e) {
            System.err.println("[" + getName() + "] ERROR: Training failed: " + e.getMessage());
            return false;
        } finally {
            samples.release();
            responses.release();
        }
    }

    @Override
    public boolean isTrained() {
        return model != null;
    }

    @Override
    public int[] predict(FeatureMatrix features) {
        if (!isTrained()) {
            throw new IllegalStateException(getName() + " classifier is not trained");
        }
        if (features.columns() != featureCount) {
            throw new IllegalArgumentException("Classifier was trained on " + featureCount
                    + " features, got " + features.columns());
        }
        if (features.isEmpty()) {
            return new int[0];
        }

        Mat samples = scaler.transform(features).toMat();
        Mat results = new Mat();
        try {
            predictSamples(model, samples, results);
            int[] labels = new int[features.rows()];
            for (int i = 0; i < labels.length; i++) {
                labels[i] = (int) Math.round(results.get(i, 0)[0]);
            }
            return labels;
        } finally {
            samples.release();
            results.release();
        }
    }
}
