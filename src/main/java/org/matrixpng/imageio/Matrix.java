package org.matrixpng.imageio;

import java.util.Arrays;

/**
 * An immutable rows x columns grid of doubles. Any cell may be NaN.
 *
 * @author tonyj
 */
public class Matrix {

    private final int rows;
    private final int columns;
    private final double[] data;

    /**
     * Create a matrix by copying a rectangular 2-D array, indexed
     * <code>values[row][column]</code>.
     *
     * @param values The values to copy
     * @throws InvalidConfigurationException if the array is empty or ragged
     */
    public Matrix(double[][] values) {
        if (values == null || values.length == 0 || values[0] == null || values[0].length == 0) {
            throw new InvalidConfigurationException("Matrix must have at least one row and one column");
        }
        this.rows = values.length;
        this.columns = values[0].length;
        this.data = new double[cellCount(rows, columns)];
        for (int row = 0; row < rows; row++) {
            if (values[row] == null || values[row].length != columns) {
                throw new InvalidConfigurationException("Row " + row + " does not have " + columns + " columns");
            }
            System.arraycopy(values[row], 0, data, row * columns, columns);
        }
    }

    /**
     * Create a matrix from row-major data.
     *
     * @param rows The number of rows
     * @param columns The number of columns
     * @param data The values, <code>data[row * columns + column]</code>
     */
    public Matrix(int rows, int columns, double[] data) {
        if (rows <= 0 || columns <= 0) {
            throw new InvalidConfigurationException("Matrix must have at least one row and one column");
        }
        int count = cellCount(rows, columns);
        if (data.length != count) {
            throw new InvalidConfigurationException("Expected " + count + " values, got " + data.length);
        }
        this.rows = rows;
        this.columns = columns;
        this.data = data.clone();
    }

    private static int cellCount(int rows, int columns) {
        try {
            return Math.multiplyExact(rows, columns);
        } catch (ArithmeticException x) {
            throw new InvalidConfigurationException("Matrix of " + rows + "x" + columns + " is too large", x);
        }
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public double get(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("(" + row + "," + column + ") outside " + rows + "x" + columns);
        }
        return data[row * columns + column];
    }

    /**
     * @return The smallest non-NaN value, or NaN if every cell is NaN
     */
    public double min() {
        double min = Double.NaN;
        for (double v : data) {
            if (!Double.isNaN(v) && (Double.isNaN(min) || v < min)) {
                min = v;
            }
        }
        return min;
    }

    /**
     * @return The largest non-NaN value, or NaN if every cell is NaN
     */
    public double max() {
        double max = Double.NaN;
        for (double v : data) {
            if (!Double.isNaN(v) && (Double.isNaN(max) || v > max)) {
                max = v;
            }
        }
        return max;
    }

    @Override
    public String toString() {
        return "Matrix{" + "rows=" + rows + ", columns=" + columns + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 53 * hash + rows;
        hash = 53 * hash + columns;
        hash = 53 * hash + Arrays.hashCode(data);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Matrix other = (Matrix) obj;
        return rows == other.rows && columns == other.columns && Arrays.equals(data, other.data);
    }
}
