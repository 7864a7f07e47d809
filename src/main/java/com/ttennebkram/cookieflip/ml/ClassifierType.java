package com.ttennebkram.cookieflip.ml;

/**
 * Supported classifier kinds.
 */
public enum ClassifierType {
    SVM("SVM"),
    KNN("kNN"),
    BAYES("Bayes");

    public final String displayName;

    ClassifierType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Parse "SVM", "kNN" or "Bayes", ignoring case.
     */
    public static ClassifierType parse(String name) {
        if (name != null) {
            for (ClassifierType type : values()) {
                if (type.displayName.equalsIgnoreCase(name.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Classifier type not specified correctly: " + name
                + " (expected SVM, kNN or Bayes)");
    }
}
