package dev.neuronic.tinynet.math.ops;

/**
 * Weight gradients for a batch: the sum over the batch of outer(input[b], gradient[b]).
 *
 * <p>No averaging happens here. Whatever scaling the upstream gradient carries is
 * passed through unchanged.
 */
public final class WeightGradients {

    /**
     * @param input cached layer input [batch][inputs]
     * @param gradient gradient w.r.t. the layer output [batch][outputs]
     * @return newly allocated [inputs][outputs] gradient matrix
     */
    public static float[][] compute(float[][] input, float[][] gradient) {
        if (input.length != gradient.length)
            throw new IllegalArgumentException("Input and gradient batch sizes differ: " +
                                             input.length + " vs " + gradient.length);
        if (input.length == 0)
            throw new IllegalArgumentException("Cannot compute weight gradients for an empty batch");

        int inputs = input[0].length;
        int outputs = gradient[0].length;
        float[][] output = new float[inputs][outputs];

        for (int b = 0; b < input.length; b++) {
            float[] x = input[b];
            float[] g = gradient[b];
            for (int i = 0; i < inputs; i++) {
                float xi = x[i];
                if (xi == 0.0f)
                    continue;
                float[] outputRow = output[i];
                for (int o = 0; o < outputs; o++)
                    outputRow[o] += xi * g[o];
            }
        }
        return output;
    }

    private WeightGradients() {}
}
