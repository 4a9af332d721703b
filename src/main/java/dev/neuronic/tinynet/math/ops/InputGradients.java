package dev.neuronic.tinynet.math.ops;

/**
 * Gradient w.r.t. a layer input: gradient · weightsᵀ.
 *
 * <p>output[b][i] = sum_o(gradient[b][o] * weights[i][o])
 */
public final class InputGradients {

    public static float[][] compute(float[][] gradient, float[][] weights) {
        int inputs = weights.length;
        float[][] output = new float[gradient.length][inputs];

        for (int b = 0; b < gradient.length; b++) {
            float[] g = gradient[b];
            float[] out = output[b];
            for (int i = 0; i < inputs; i++) {
                float[] weightRow = weights[i];
                if (weightRow.length != g.length)
                    throw new IllegalArgumentException("Gradient width " + g.length +
                                                     " does not match weight columns " + weightRow.length);
                float sum = 0.0f;
                for (int o = 0; o < g.length; o++)
                    sum += g[o] * weightRow[o];
                out[i] = sum;
            }
        }
        return output;
    }

    private InputGradients() {}
}
