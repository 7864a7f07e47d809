package com.ttennebkram.cookieflip.config;

/**
 * Classifier selection and parameters.
 */
public class ClassifierConfig {
    /** "SVM", "kNN" or "Bayes" */
    public String type = "SVM";
    /** SVM cost; values <= 0 select the default cost */
    public double svmC = 0;
    /** "LINEAR", "RBF", "POLY" or "SIGMOID" */
    public String svmKernel = "LINEAR";
    public int knnK = 4;
    /** Standardize feature columns before fitting */
    public boolean standardize = true;
}
