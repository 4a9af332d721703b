package dev.neuronic.tinynet.layers;

import dev.neuronic.tinynet.serialization.MapSerializable;

/**
 * A link in a strictly sequential chain.
 *
 * <p>Each layer follows a two-phase contract. {@link #forward} transforms a batch and
 * caches what the layer needs to differentiate itself; {@link #update} consumes the gradient
 * of the loss w.r.t. this layer's output, applies the layer's own parameter step and returns
 * the gradient w.r.t. its input for the layer below. The cache holds a single context: a
 * second forward call replaces the first, and an update with no cached context is an
 * invalid-state error.
 *
 * <p>Gradients arrive already scaled by the loss (for example divided by the batch size for a
 * mean reduction). Layers must not average again.
 */
public interface Layer extends MapSerializable {

    /**
     * Context object for caching backward invocations.
     * Contains the inputs, preactivations, and outputs from a layer's forward pass.
     * Can be extended by specific layer types to store additional intermediate states.
     */
    public static class LayerContext {
        public final float[][] inputs;         // inputs seen by the layer
        public final float[][] preActivations; // preactivations from forward call
        public final float[][] outputs;        // resulting outputs from this layer

        public LayerContext(float[][] inputs, float[][] preActivations, float[][] outputs) {
            this.inputs = inputs;
            this.preActivations = preActivations;
            this.outputs = outputs;
        }

        public float[][] inputs() { return inputs; }
        public float[][] preActivations() { return preActivations; }
        public float[][] outputs() { return outputs; }

        public int batchSize() { return inputs.length; }
    }

    /**
     * Run the layer over a batch and cache the resulting context.
     *
     * @param input batch-major input, every row of length {@link #getInputSize()}
     * @return the cached context; {@code outputs()} is the layer output
     * @throws IllegalArgumentException if the batch is empty or a row has the wrong width
     */
    LayerContext forward(float[][] input);

    /**
     * Back-propagate through the layer and update its parameters in place.
     *
     * @param outputGradient gradient of the loss w.r.t. the output of the latest forward call
     * @param learningRate positive step size
     * @return gradient of the loss w.r.t. the input of the latest forward call
     * @throws IllegalStateException if no forward call has been made
     * @throws IllegalArgumentException if the gradient shape does not match the cached output
     */
    float[][] update(float[][] outputGradient, float learningRate);

    int getInputSize();

    int getOutputSize();

    /**
     * Switch between training and evaluation behavior. Setting the current value is a no-op.
     * Layers without training-only behavior ignore it.
     */
    default void setEval(boolean eval) {
        // Default: no mode-dependent behavior
    }

    default boolean isEval() {
        return false;
    }
}
