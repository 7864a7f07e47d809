package com.ttennebkram.cookieflip.ml;

import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Counts of actual (rows) versus predicted (columns) labels.
 */
public class ConfusionMatrix {

    private final int[] labels;
    private final int[][] counts;

    public ConfusionMatrix(int[] actual, int[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("Got " + actual.length + " actual labels but "
                    + predicted.length + " predictions");
        }
        SortedSet<Integer> seen = new TreeSet<>();
        for (int label : actual) seen.add(label);
        for (int label : predicted) seen.add(label);
        labels = seen.stream().mapToInt(Integer::intValue).toArray();
        counts = new int[labels.length][labels.length];
        for (int i = 0; i < actual.length; i++) {
            counts[indexOf(actual[i])][indexOf(predicted[i])]++;
        }
    }

    private int indexOf(int label) {
        int index = Arrays.binarySearch(labels, label);
        if (index < 0) {
            throw new IllegalArgumentException("Label " + label + " is not in the matrix");
        }
        return index;
    }

    public int[] getLabels() {
        return labels.clone();
    }

    public int getCount(int actualLabel, int predictedLabel) {
        return counts[indexOf(actualLabel)][indexOf(predictedLabel)];
    }

    public int getTotal() {
        int total = 0;
        for (int[] row : counts) {
            for (int c : row) total += c;
        }
        return total;
    }

    public int getCorrect() {
        int correct = 0;
        for (int i = 0; i < labels.length; i++) {
            correct += counts[i][i];
        }
        return correct;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s", "actual\\pred"));
        for (int label : labels) {
            sb.append(String.format("%8d", label));
        }
        for (int i = 0; i < labels.length; i++) {
            sb.append('\n').append(String.format("%-12d", labels[i]));
            for (int j = 0; j < labels.length; j++) {
                sb.append(String.format("%8d", counts[i][j]));
            }
        }
        return sb.toString();
    }
}
