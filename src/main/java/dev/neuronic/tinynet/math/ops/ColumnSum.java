package dev.neuronic.tinynet.math.ops;

/**
 * Column-wise sum of a batch-major matrix.
 */
public final class ColumnSum {

    public static float[] compute(float[][] matrix) {
        if (matrix.length == 0)
            throw new IllegalArgumentException("Cannot sum the columns of an empty matrix");

        float[] output = new float[matrix[0].length];
        for (float[] row : matrix) {
            if (row.length != output.length)
                throw new IllegalArgumentException("Ragged matrix: expected rows of " + output.length +
                                                 ", got " + row.length);
            for (int j = 0; j < row.length; j++)
                output[j] += row[j];
        }
        return output;
    }

    private ColumnSum() {}
}
