package com.ttennebkram.cookieflip.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Where the training and test images live.
 */
public class DataConfig {
    public String resourceDir = "resources";
    public List<TrainingSetConfig> trainingSets = new ArrayList<>(List.of(
            new TrainingSetConfig("Train negatives", "Train/negatives_%d.png", 2, 1),
            new TrainingSetConfig("Train positives", "Train/positives_%d.png", 2, 2)));
    public String testPattern = "Test/mix_%d.png";
    public int testCount = 2;
}
