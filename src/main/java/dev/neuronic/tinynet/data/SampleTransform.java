package dev.neuronic.tinynet.data;

/**
 * A preprocessing step applied to each decoded feature vector, in pipeline order.
 */
@FunctionalInterface
public interface SampleTransform {

    /**
     * @return the transformed features; must be non-empty and the same width for every sample
     *         in a batch
     */
    float[] apply(float[] features);
}
