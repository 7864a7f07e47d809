package com.ttennebkram.cookieflip.features;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Row-major matrix of feature vectors with a fixed column count.
 */
public class FeatureMatrix {

    private final int columns;
    private final List<double[]> rows = new ArrayList<>();

    public FeatureMatrix(int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("Feature matrix needs at least one column");
        }
        this.columns = columns;
    }

    public static FeatureMatrix of(double[]... rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot infer column count from zero rows");
        }
        FeatureMatrix matrix = new FeatureMatrix(rows[0].length);
        for (double[] row : rows) {
            matrix.addRow(row);
        }
        return matrix;
    }

    public void addRow(double[] row) {
        if (row.length != columns) {
            throw new IllegalArgumentException("Row has " + row.length + " values, expected " + columns);
        }
        rows.add(row.clone());
    }

    public int rows() { return rows.size(); }
    public int columns() { return columns; }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public double[] getRow(int index) {
        return rows.get(index).clone();
    }

    public double get(int row, int column) {
        return rows.get(row)[column];
    }

    /**
     * Single-row matrix holding a copy of one row.
     */
    public FeatureMatrix rowAsMatrix(int index) {
        FeatureMatrix single = new FeatureMatrix(columns);
        single.addRow(rows.get(index));
        return single;
    }

    public List<double[]> getRows() {
        List<double[]> copy = new ArrayList<>(rows.size());
        for (double[] row : rows) {
            copy.add(row.clone());
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Copy into a CV_32F Mat, one sample per row (caller releases).
     */
    public Mat toMat() {
        Mat mat = new Mat(rows.size(), columns, CvType.CV_32F);
        float[] buffer = new float[columns];
        for (int r = 0; r < rows.size(); r++) {
            double[] row = rows.get(r);
            for (int c = 0; c < columns; c++) {
                buffer[c] = (float) row[c];
            }
            mat.put(r, 0, buffer);
        }
        return mat;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("FeatureMatrix ").append(rows.size()).append("x").append(columns);
        for (double[] row : rows) {
            sb.append("\n  ").append(Arrays.toString(row));
        }
        return sb.toString();
    }
}
