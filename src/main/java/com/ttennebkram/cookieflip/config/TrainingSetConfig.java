package com.ttennebkram.cookieflip.config;

/**
 * A numbered series of training images sharing one label.
 * The pattern is a String.format template taking the 1-based image index.
 */
public class TrainingSetConfig {
    public String title;
    public String pattern;
    public int count;
    public int label;

    public TrainingSetConfig() {
    }

    public TrainingSetConfig(String title, String pattern, int count, int label) {
        this.title = title;
        this.pattern = pattern;
        this.count = count;
        this.label = label;
    }
}
