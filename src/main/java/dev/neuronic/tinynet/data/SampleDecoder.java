package dev.neuronic.tinynet.data;

import java.io.IOException;

/**
 * Turns a sample reference into a flat feature vector. Called lazily, once per sample per pass.
 *
 * @param <R> reference type
 */
@FunctionalInterface
public interface SampleDecoder<R> {

    float[] decode(R reference) throws IOException;
}
