package dev.neuronic.tinynet.losses;

import dev.neuronic.tinynet.serialization.MapSerializable;

/**
 * A differentiable objective over the logits produced by the last layer.
 *
 * <p>{@code forward} computes the scalar loss and caches what {@link #backward()} needs; the
 * cache holds one call and the newest call wins. {@code backward} returns the gradient of the
 * scalar w.r.t. the logits, already scaled for the reduction mode, so layers never average again.
 */
public interface Loss extends MapSerializable {

    float forward(float[][] logits, float[][] targets);

    float forward(float[][] logits, int[] labels);

    float forward(float[] logits, int label);

    float forward(float[] logits, float[] target);

    /**
     * @return gradient w.r.t. the logits of the latest forward call, same shape as those logits
     *         (a single row for unbatched input)
     * @throws IllegalStateException if forward has not been called
     */
    float[][] backward();

    Reduction getReduction();
}
