package dev.neuronic.tinynet.serialization;

import java.util.Map;

/**
 * Components that can describe themselves as a plain map of configuration and learned state.
 *
 * <p>Every map carries a {@value #CLASS_KEY} discriminator naming the concrete type. Values are
 * restricted to {@code String}, {@code Integer}, {@code Long}, {@code Double}, {@code Boolean},
 * {@code List} and nested {@code Map}, so any medium that can encode those can persist a model.
 * The matching static {@code fromMap} factories reject a mismatched discriminator.
 */
public interface MapSerializable {

    String CLASS_KEY = "class";

    /**
     * @return a new mutable map holding this object's type, configuration and state
     */
    Map<String, Object> toMap();
}
