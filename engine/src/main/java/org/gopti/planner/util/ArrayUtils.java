package org.gopti.planner.util;

import java.util.List;

public class ArrayUtils {

    /* Whole seconds, truncated the same way the estimate provider truncates */
    public static long[][] convertTo2DLongArray(List<List<Double>> list) {
        int cols = checkRectangular(list);

        int rows = list.size();
        long[][] result = new long[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result[i][j] = (long) valueAt(list, i, j);
            }
        }
        return result;
    }

    public static double[][] convertTo2DDoubleArray(List<List<Double>> list) {
        int cols = checkRectangular(list);

        int rows = list.size();
        double[][] result = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result[i][j] = valueAt(list, i, j);
            }
        }
        return result;
    }

    private static int checkRectangular(List<List<Double>> list) {
        if (list == null || list.isEmpty() || list.get(0) == null) {
            throw new IllegalArgumentException("Input list cannot be null or empty");
        }
        int cols = list.get(0).size();
        for (var row : list) {
            if (row == null || row.size() != cols) {
                throw new IllegalArgumentException("All inner lists must have the same number of elements");
            }
        }
        return cols;
    }

    /* OSRM reports unroutable pairs as null */
    private static double valueAt(List<List<Double>> list, int i, int j) {
        var value = list.get(i).get(j);
        if (value == null) {
            throw new IllegalArgumentException(String.format("No value for pair (%d, %d)", i, j));
        }
        return value;
    }
}
