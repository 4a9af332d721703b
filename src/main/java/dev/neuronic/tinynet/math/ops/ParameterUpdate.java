package dev.neuronic.tinynet.math.ops;

/**
 * Parameter update operation: param[i] = param[i] - learningRate * gradient[i]
 * Used by layers to update weights and biases in place.
 */
public final class ParameterUpdate {

    /**
     * Update parameters in-place using gradients.
     *
     * @param parameters the parameters to update (modified in-place)
     * @param gradients the gradients to apply
     * @param learningRate the learning rate multiplier
     * @throws IllegalArgumentException if arrays have different lengths
     */
    public static void compute(float[] parameters, float[] gradients, float learningRate) {
        if (parameters.length != gradients.length)
            throw new IllegalArgumentException("Parameters and gradients must have same length: params=" +
                                             parameters.length + ", gradients=" + gradients.length);

        for (int i = 0; i < parameters.length; i++)
            parameters[i] -= learningRate * gradients[i];
    }

    private ParameterUpdate() {}
}
