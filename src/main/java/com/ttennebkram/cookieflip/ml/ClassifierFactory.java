package com.ttennebkram.cookieflip.ml;

import com.ttennebkram.cookieflip.config.ClassifierConfig;

/**
 * Builds the classifier selected in the configuration.
 */
public class ClassifierFactory {

    private ClassifierFactory() {
    }

    public static CookieClassifier create(ClassifierConfig config) {
        ClassifierType type = ClassifierType.parse(config.type);
        CookieClassifier classifier;
        switch (type) {
            case SVM:
                classifier = new SvmClassifier(config.svmC, SvmClassifier.Kernel.parse(config.svmKernel), config.standardize);
                break;
            case KNN:
                classifier = new KnnClassifier(config.knnK, config.standardize);
                break;
            case BAYES:
                classifier = new BayesClassifier(config.standardize);
                break;
            default:
                throw new IllegalStateException("Unhandled classifier type " + type);
        }
        System.out.println("Classifier type: " + type.displayName);
        return classifier;
    }
}
