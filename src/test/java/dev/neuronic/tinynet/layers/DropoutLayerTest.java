package dev.neuronic.tinynet.layers;

import dev.neuronic.tinynet.math.RandomSource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DropoutLayerTest {

    private static final float DELTA = 1e-6f;

    @Test
    void testRateValidation() {
        RandomSource random = new RandomSource(1);
        assertThrows(IllegalArgumentException.class, () -> new DropoutLayer(-0.1f, 4, random));
        assertThrows(IllegalArgumentException.class, () -> new DropoutLayer(1.0f, 4, random));
        assertThrows(IllegalArgumentException.class, () -> new DropoutLayer(Float.NaN, 4, random));
        assertThrows(IllegalArgumentException.class, () -> new DropoutLayer(0.5f, 0, random));
    }

    @Test
    void testRandomSourceRequired() {
        assertThrows(NullPointerException.class, () -> new DropoutLayer(0.5f, 4, null));
    }

    @Test
    void testTrainingDropsAndScales() {
        DropoutLayer dropout = new DropoutLayer(0.5f, 1000, new RandomSource(9));
        float[][] input = new float[1][1000];
        java.util.Arrays.fill(input[0], 1.0f);

        float[] out = dropout.forward(input).outputs()[0];

        int kept = 0;
        for (float v : out) {
            assertTrue(v == 0.0f || Math.abs(v - 2.0f) < DELTA, "Kept units are scaled by 1/(1-rate)");
            if (v != 0.0f)
                kept++;
        }
        assertTrue(kept > 400 && kept < 600, "About half the units should survive, got " + kept);
    }

    @Test
    void testGradientFollowsMask() {
        DropoutLayer dropout = new DropoutLayer(0.5f, 100, new RandomSource(2));
        float[][] input = new float[1][100];
        java.util.Arrays.fill(input[0], 1.0f);
        float[] out = dropout.forward(input).outputs()[0];

        float[][] gradient = new float[1][100];
        java.util.Arrays.fill(gradient[0], 3.0f);
        float[] grad = dropout.update(gradient, 0.1f)[0];

        for (int i = 0; i < 100; i++)
            assertEquals(out[i] == 0.0f ? 0.0f : 6.0f, grad[i], DELTA);
    }

    @Test
    void testEvalModeIsIdentity() {
        DropoutLayer dropout = new DropoutLayer(0.9f, 3, new RandomSource(4));
        dropout.setEval(true);
        dropout.setEval(true);
        assertTrue(dropout.isEval());

        float[][] input = {{1.0f, -2.0f, 3.0f}};
        assertArrayEquals(input[0], dropout.forward(input).outputs()[0]);
        assertArrayEquals(new float[] {1.0f, 1.0f, 1.0f}, dropout.update(new float[][] {{1.0f, 1.0f, 1.0f}}, 0.1f)[0]);

        dropout.setEval(false);
        assertFalse(dropout.isEval());
    }

    @Test
    void testZeroRateKeepsEverything() {
        DropoutLayer dropout = new DropoutLayer(0.0f, 2, new RandomSource(4));
        assertArrayEquals(new float[] {1.0f, 2.0f}, dropout.forward(new float[][] {{1.0f, 2.0f}}).outputs()[0]);
    }

    @Test
    void testUpdateBeforeForwardFails() {
        assertThrows(IllegalStateException.class,
            () -> new DropoutLayer(0.5f, 1, new RandomSource(1)).update(new float[][] {{1.0f}}, 0.1f));
    }

    @Test
    void testRoundTrip() {
        DropoutLayer dropout = new DropoutLayer(0.25f, 8, new RandomSource(1));
        Map<String, Object> map = dropout.toMap();

        assertEquals("DropoutLayer", map.get("class"));
        assertEquals(0.25, (Double) map.get("rate"), 1e-9);
        assertEquals(dropout, DropoutLayer.fromMap(map));
    }
}
