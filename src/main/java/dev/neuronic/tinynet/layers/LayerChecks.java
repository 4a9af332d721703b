package dev.neuronic.tinynet.layers;

/**
 * Shape and state checks shared by the layer implementations.
 */
final class LayerChecks {

    static void requireBatch(float[][] input, int width, String layerName) {
        if (input == null || input.length == 0)
            throw new IllegalArgumentException(layerName + " received an empty batch");
        for (int b = 0; b < input.length; b++) {
            if (input[b] == null || input[b].length != width)
                throw new IllegalArgumentException(layerName + " expected rows of " + width + " features, row " + b +
                                                 " has " + (input[b] == null ? "null" : input[b].length));
        }
    }

    static void requireGradient(float[][] gradient, int batchSize, int width, String layerName) {
        if (gradient == null || gradient.length != batchSize)
            throw new IllegalArgumentException(layerName + " expected a gradient for a batch of " + batchSize + ", got " +
                                             (gradient == null ? "null" : gradient.length));
        requireBatch(gradient, width, layerName);
    }

    static void requireLearningRate(float learningRate) {
        if (!(learningRate > 0) || Float.isInfinite(learningRate))
            throw new IllegalArgumentException("Learning rate must be positive: " + learningRate);
    }

    static <T> T requireContext(T context, String layerName) {
        if (context == null)
            throw new IllegalStateException("forward must be called on " + layerName + " before update");
        return context;
    }

    private LayerChecks() {}
}
