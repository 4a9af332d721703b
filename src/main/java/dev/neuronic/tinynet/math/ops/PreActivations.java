package dev.neuronic.tinynet.math.ops;

/**
 * Affine transform of a batch with a [input][output] weight layout.
 *
 * <p>output[b][o] = bias[o] + sum_i(input[b][i] * weights[i][o])
 */
public final class PreActivations {

    /**
     * @param input batch-major input, every row of length weights.length
     * @param weights weight matrix weights[input][output]
     * @param bias bias values, one per output
     * @return newly allocated [batch][output] matrix
     * @throws IllegalArgumentException if any dimension disagrees
     */
    public static float[][] compute(float[][] input, float[][] weights, float[] bias) {
        int inputs = weights.length;
        int outputs = bias.length;
        if (inputs > 0 && weights[0].length != outputs)
            throw new IllegalArgumentException("Weight matrix second dimension must match bias length: " +
                                             weights[0].length + " vs " + outputs);

        float[][] output = new float[input.length][];
        for (int b = 0; b < input.length; b++) {
            float[] row = input[b];
            if (row.length != inputs)
                throw new IllegalArgumentException("Input row " + b + " has " + row.length +
                                                 " features, expected " + inputs);

            float[] out = bias.clone();
            for (int i = 0; i < inputs; i++) {
                float value = row[i];
                if (value == 0.0f)
                    continue;
                float[] weightRow = weights[i];
                for (int o = 0; o < outputs; o++)
                    out[o] += value * weightRow[o];
            }
            output[b] = out;
        }
        return output;
    }

    private PreActivations() {}
}
