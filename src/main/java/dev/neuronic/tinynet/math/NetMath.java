package dev.neuronic.tinynet.math;

import dev.neuronic.tinynet.math.ops.*;

/**
 * Central entry point for all neural network mathematical operations.
 * Methods are prefixed by operation type for intuitive autocomplete.
 *
 * <p>Matrices are batch-major {@code float[rows][cols]}; weight matrices are laid out
 * {@code weights[input][output]}.
 */
public final class NetMath {

    // ========== MATRIX OPERATIONS ==========

    /**
     * Affine transform of a batch: output[b][o] = sum(input[b][i] * weights[i][o]) + bias[o]
     */
    public static float[][] matrixPreActivations(float[][] input, float[][] weights, float[] bias) {
        return PreActivations.compute(input, weights, bias);
    }

    /**
     * Weight gradients summed over the batch: output[i][o] = sum_b(input[b][i] * gradient[b][o])
     */
    public static float[][] matrixWeightGradients(float[][] input, float[][] gradient) {
        return WeightGradients.compute(input, gradient);
    }

    /**
     * Gradient with respect to the layer input: output[b][i] = sum_o(gradient[b][o] * weights[i][o])
     */
    public static float[][] matrixInputGradients(float[][] gradient, float[][] weights) {
        return InputGradients.compute(gradient, weights);
    }

    /**
     * Column sums of a batch-major matrix, used for bias gradients.
     */
    public static float[] matrixColumnSum(float[][] matrix) {
        return ColumnSum.compute(matrix);
    }

    /**
     * Deep copy of a matrix.
     */
    public static float[][] matrixCopy(float[][] matrix) {
        float[][] copy = new float[matrix.length][];
        for (int i = 0; i < matrix.length; i++)
            copy[i] = matrix[i].clone();
        return copy;
    }

    // ========== PARAMETER UPDATES ==========

    /**
     * In-place SGD step: param[i] -= learningRate * gradient[i]
     */
    public static void parameterUpdate(float[] parameters, float[] gradients, float learningRate) {
        ParameterUpdate.compute(parameters, gradients, learningRate);
    }

    /**
     * In-place SGD step over every row of a weight matrix.
     */
    public static void parameterUpdate(float[][] parameters, float[][] gradients, float learningRate) {
        if (parameters.length != gradients.length)
            throw new IllegalArgumentException("Weight and gradient arrays must have same outer dimension: " +
                                             parameters.length + " vs " + gradients.length);
        for (int i = 0; i < parameters.length; i++)
            ParameterUpdate.compute(parameters[i], gradients[i], learningRate);
    }

    // ========== SOFTMAX ==========

    /**
     * Row-wise log-softmax using the max-subtraction trick.
     */
    public static float[][] logSoftmaxRows(float[][] logits) {
        float[][] output = new float[logits.length][];
        for (int i = 0; i < logits.length; i++)
            output[i] = Softmax.logCompute(logits[i]);
        return output;
    }

    /**
     * Row-wise softmax using the max-subtraction trick.
     */
    public static float[][] softmaxRows(float[][] logits) {
        float[][] output = new float[logits.length][];
        for (int i = 0; i < logits.length; i++)
            output[i] = Softmax.compute(logits[i]);
        return output;
    }

    // ========== REDUCTIONS ==========

    /**
     * Index of the largest value; ties resolve to the lowest index and NaN is never selected.
     */
    public static int argmax(float[] values) {
        return Argmax.compute(values);
    }

    /**
     * Argmax of every row.
     */
    public static int[] argmaxRows(float[][] values) {
        int[] output = new int[values.length];
        for (int i = 0; i < values.length; i++)
            output[i] = Argmax.compute(values[i]);
        return output;
    }

    // ========== INITIALIZATION ==========

    public static void weightInitLecun(float[][] weights, int fanIn, RandomSource random) {
        WeightInit.lecun(weights, fanIn, random);
    }

    public static void weightInitXavier(float[][] weights, int fanIn, int fanOut, RandomSource random) {
        WeightInit.xavier(weights, fanIn, fanOut, random);
    }

    public static void weightInitHe(float[][] weights, int fanIn, RandomSource random) {
        WeightInit.he(weights, fanIn, random);
    }

    private NetMath() {}
}
