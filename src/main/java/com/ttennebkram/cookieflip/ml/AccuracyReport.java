package com.ttennebkram.cookieflip.ml;

/**
 * Accuracy of a classifier over a data set.
 */
public class AccuracyReport {
    public final double accuracy;
    public final ConfusionMatrix confusionMatrix;

    public AccuracyReport(double accuracy, ConfusionMatrix confusionMatrix) {
        this.accuracy = accuracy;
        this.confusionMatrix = confusionMatrix;
    }

    public static AccuracyReport of(int[] actual, int[] predicted) {
        ConfusionMatrix matrix = new ConfusionMatrix(actual, predicted);
        double accuracy = matrix.getTotal() == 0 ? 0.0 : (double) matrix.getCorrect() / matrix.getTotal();
        return new AccuracyReport(accuracy, matrix);
    }

    @Override
    public String toString() {
        return String.format("Accuracy: %.2f%%", accuracy * 100);
    }
}
