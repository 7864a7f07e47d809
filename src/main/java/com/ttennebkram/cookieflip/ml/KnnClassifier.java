package com.ttennebkram.cookieflip.ml;

import org.opencv.core.Mat;
import org.opencv.ml.KNearest;
import org.opencv.ml.StatModel;

/**
 * k nearest neighbours with majority vote.
 */
public class KnnClassifier extends OpenCvClassifier {

    private final int k;

    public KnnClassifier(int k, boolean standardize) {
        super(standardize);
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        this.k = k;
    }

    public int getK() { return k; }

    @Override
    public String getName() {
        return "kNN";
    }

    @Override
    protected StatModel createModel() {
        KNearest knn = KNearest.create();
        knn.setIsClassifier(true);
        knn.setDefaultK(k);
        knn.setAlgorithmType(KNearest.BRUTE_FORCE);
        return knn;
    }

    @Override
    protected void predictSamples(StatModel model, Mat samples, Mat results) {
        ((KNearest) model).findNearest(samples, k, results);
    }
}
