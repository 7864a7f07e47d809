package com.ttennebkram.cookieflip.ml;

import org.opencv.ml.NormalBayesClassifier;
import org.opencv.ml.StatModel;

/**
 * Normal Bayes classifier: one multivariate Gaussian per class.
 */
public class BayesClassifier extends OpenCvClassifier {

    public BayesClassifier(boolean standardize) {
        super(standardize);
    }

    @Override
    public String getName() {
        return "Bayes";
    }

    @Override
    protected StatModel createModel() {
        return NormalBayesClassifier.create();
    }
}
