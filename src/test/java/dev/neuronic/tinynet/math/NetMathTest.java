package dev.neuronic.tinynet.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NetMathTest {

    private static final float DELTA = 1e-5f;

    @Test
    void testSoftmaxRowsSumToOne() {
        float[][] logits = {
            {1.0f, 2.0f, 3.0f},
            {-5.0f, 0.0f, 5.0f},
            {0.0f, 0.0f, 0.0f}
        };
        float[][] probs = NetMath.softmaxRows(logits);

        for (float[] row : probs) {
            float sum = 0;
            for (float p : row) {
                assertTrue(p >= 0.0f, "Probability must not be negative");
                sum += p;
            }
            assertEquals(1.0f, sum, DELTA);
        }
        assertEquals(1.0f / 3.0f, probs[2][0], DELTA);
    }

    @Test
    void testSoftmaxLargeLogitsStayFinite() {
        float[][] probs = NetMath.softmaxRows(new float[][] {{1000.0f, 0.0f, -1000.0f}});
        assertEquals(1.0f, probs[0][0], DELTA);
        assertEquals(0.0f, probs[0][1], DELTA);
        assertFalse(Float.isNaN(probs[0][2]));

        float[][] logProbs = NetMath.logSoftmaxRows(new float[][] {{1000.0f, 0.0f}});
        assertEquals(0.0f, logProbs[0][0], DELTA);
        assertEquals(-1000.0f, logProbs[0][1], 1e-3f);
    }

    @Test
    void testArgmaxTiesAndNaN() {
        assertEquals(1, NetMath.argmax(new float[] {0.1f, 0.8f, 0.1f}));
        assertEquals(0, NetMath.argmax(new float[] {0.5f, 0.5f}));
        assertEquals(2, NetMath.argmax(new float[] {Float.NaN, -1.0f, 3.0f}));
        assertArrayEquals(new int[] {1, 0}, NetMath.argmaxRows(new float[][] {{0, 1}, {2, 1}}));
        assertThrows(IllegalArgumentException.class, () -> NetMath.argmax(new float[0]));
    }

    @Test
    void testPreActivations() {
        float[][] input = {{1.0f, 2.0f}};
        float[][] weights = {{1.0f, 0.0f, -1.0f}, {0.5f, 2.0f, 1.0f}};
        float[] bias = {0.1f, 0.2f, 0.3f};

        float[][] out = NetMath.matrixPreActivations(input, weights, bias);

        assertArrayEquals(new float[] {2.1f, 4.2f, 1.3f}, out[0], DELTA);
    }

    @Test
    void testWeightGradientsSumOverBatch() {
        float[][] input = {{1.0f, 0.0f}, {0.0f, 2.0f}};
        float[][] gradient = {{1.0f, 1.0f}, {2.0f, 0.0f}};

        float[][] dW = NetMath.matrixWeightGradients(input, gradient);

        assertArrayEquals(new float[] {1.0f, 1.0f}, dW[0], DELTA);
        assertArrayEquals(new float[] {4.0f, 0.0f}, dW[1], DELTA);
        assertThrows(IllegalArgumentException.class,
            () -> NetMath.matrixWeightGradients(input, new float[][] {{1.0f, 1.0f}}));
    }

    @Test
    void testInputGradientsAndColumnSum() {
        float[][] gradient = {{1.0f, 0.0f}, {0.0f, 1.0f}};
        float[][] weights = {{1.0f, 2.0f}, {3.0f, 4.0f}};

        float[][] dx = NetMath.matrixInputGradients(gradient, weights);

        assertArrayEquals(new float[] {1.0f, 3.0f}, dx[0], DELTA);
        assertArrayEquals(new float[] {2.0f, 4.0f}, dx[1], DELTA);
        assertArrayEquals(new float[] {1.0f, 1.0f}, NetMath.matrixColumnSum(gradient), DELTA);
    }

    @Test
    void testParameterUpdateInPlace() {
        float[][] weights = {{1.0f, 2.0f}};
        float[] bias = {0.5f};

        NetMath.parameterUpdate(weights, new float[][] {{1.0f, -1.0f}}, 0.1f);
        NetMath.parameterUpdate(bias, new float[] {2.0f}, 0.1f);

        assertArrayEquals(new float[] {0.9f, 2.1f}, weights[0], DELTA);
        assertEquals(0.3f, bias[0], DELTA);
    }

    @Test
    void testMatrixCopyIsDeep() {
        float[][] original = {{1.0f, 2.0f}};
        float[][] copy = NetMath.matrixCopy(original);
        original[0][0] = 5.0f;
        assertEquals(1.0f, copy[0][0]);
    }

    @Test
    void testLecunInitScale() {
        float[][] weights = new float[400][50];
        NetMath.weightInitLecun(weights, 400, new RandomSource(7));

        double sumSq = 0;
        for (float[] row : weights)
            for (float w : row)
                sumSq += w * w;
        double variance = sumSq / (400 * 50);
        assertEquals(1.0 / 400, variance, 0.25 / 400);
    }
}
