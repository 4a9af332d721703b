package dev.neuronic.tinynet.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransformsTest {

    @Test
    void testScale() {
        float[] input = {0.0f, 127.5f, 255.0f};
        float[] out = Transforms.scale(1.0f / 255.0f).apply(input);
        assertArrayEquals(new float[] {0.0f, 0.5f, 1.0f}, out, 1e-6f);
        assertEquals(255.0f, input[2], "Input must not be modified");
    }

    @Test
    void testStandardize() {
        float[] out = Transforms.standardize(2.0f, 4.0f).apply(new float[] {2.0f, 6.0f, -2.0f});
        assertArrayEquals(new float[] {0.0f, 1.0f, -1.0f}, out, 1e-6f);
        assertThrows(IllegalArgumentException.class, () -> Transforms.standardize(0.0f, 0.0f));
    }
}
