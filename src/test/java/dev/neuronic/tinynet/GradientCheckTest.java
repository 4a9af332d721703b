package dev.neuronic.tinynet;

import dev.neuronic.tinynet.layers.LinearLayer;
import dev.neuronic.tinynet.losses.CrossEntropyLoss;
import dev.neuronic.tinynet.losses.Reduction;
import dev.neuronic.tinynet.math.RandomSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compares the hand-derived weight gradients against central finite differences of the loss.
 */
class GradientCheckTest {

    private static final float EPSILON = 1e-2f;
    private static final float LEARNING_RATE = 1e-3f;
    private static final float TOLERANCE = 5e-3f;

    private static final float[][] INPUT = {
        {0.5f, -1.0f, 0.25f},
        {1.5f, 0.3f, -0.7f},
        {-0.2f, 0.8f, 1.1f}
    };
    private static final int[] LABELS = {0, 2, 1};

    @Test
    void testSingleLayerMeanReduction() {
        checkSingleLayer(Reduction.MEAN);
    }

    @Test
    void testSingleLayerSumReduction() {
        checkSingleLayer(Reduction.SUM);
    }

    @Test
    void testTwoLayerChain() {
        float[][] w1 = new LinearLayer(3, 4, 17L).getWeights();
        float[] b1 = {0.1f, -0.1f, 0.2f, 0.0f};
        float[][] w2 = new LinearLayer(4, 3, 23L).getWeights();
        float[] b2 = {0.05f, 0.0f, -0.05f};

        LinearLayer first = new LinearLayer(w1, b1);
        LinearLayer second = new LinearLayer(w2, b2);
        CrossEntropyLoss loss = new CrossEntropyLoss(Reduction.MEAN);
        loss.forward(second.forward(first.forward(INPUT).outputs()).outputs(), LABELS);
        float[][] grad = loss.backward();
        grad = second.update(grad, LEARNING_RATE);
        first.update(grad, LEARNING_RATE);

        float[][] updated = first.getWeights();
        for (int i = 0; i < w1.length; i++) {
            for (int o = 0; o < w1[i].length; o++) {
                float analytic = (w1[i][o] - updated[i][o]) / LEARNING_RATE;

                float[][] plus = copyWith(w1, i, o, EPSILON);
                float[][] minus = copyWith(w1, i, o, -EPSILON);
                float numeric = (chainLoss(plus, b1, w2, b2) - chainLoss(minus, b1, w2, b2)) / (2 * EPSILON);

                assertEquals(numeric, analytic, TOLERANCE, "dW1[" + i + "][" + o + "]");
            }
        }
    }

    @Test
    void testInputGradient() {
        float[][] w = new LinearLayer(3, 3, 5L).getWeights();
        float[] b = new float[3];
        LinearLayer layer = new LinearLayer(w, b);
        CrossEntropyLoss loss = new CrossEntropyLoss(Reduction.SUM);
        loss.forward(layer.forward(INPUT).outputs(), LABELS);
        float[][] dx = layer.update(loss.backward(), LEARNING_RATE);

        for (int r = 0; r < INPUT.length; r++) {
            for (int c = 0; c < INPUT[r].length; c++) {
                float[][] plus = copyWith(INPUT, r, c, EPSILON);
                float[][] minus = copyWith(INPUT, r, c, -EPSILON);
                float numeric = (lossOf(w, b, plus, Reduction.SUM) - lossOf(w, b, minus, Reduction.SUM)) / (2 * EPSILON);
                assertEquals(numeric, dx[r][c], TOLERANCE, "dx[" + r + "][" + c + "]");
            }
        }
    }

    private void checkSingleLayer(Reduction reduction) {
        float[][] w = new LinearLayer(3, 3, new RandomSource(99)).getWeights();
        float[] b = {0.1f, 0.0f, -0.1f};

        LinearLayer layer = new LinearLayer(w, b);
        CrossEntropyLoss loss = new CrossEntropyLoss(reduction);
        loss.forward(layer.forward(INPUT).outputs(), LABELS);
        layer.update(loss.backward(), LEARNING_RATE);

        float[][] updated = layer.getWeights();
        float[] updatedBias = layer.getBias();
        for (int i = 0; i < w.length; i++) {
            for (int o = 0; o < w[i].length; o++) {
                float analytic = (w[i][o] - updated[i][o]) / LEARNING_RATE;
                float numeric = (lossOf(copyWith(w, i, o, EPSILON), b, INPUT, reduction) -
                                 lossOf(copyWith(w, i, o, -EPSILON), b, INPUT, reduction)) / (2 * EPSILON);
                assertEquals(numeric, analytic, TOLERANCE, "dW[" + i + "][" + o + "]");
            }
        }
        for (int o = 0; o < b.length; o++) {
            float analytic = (b[o] - updatedBias[o]) / LEARNING_RATE;
            float[] plus = b.clone();
            float[] minus = b.clone();
            plus[o] += EPSILON;
            minus[o] -= EPSILON;
            float numeric = (lossOf(w, plus, INPUT, reduction) - lossOf(w, minus, INPUT, reduction)) / (2 * EPSILON);
            assertEquals(numeric, analytic, TOLERANCE, "db[" + o + "]");
        }
    }

    private static float lossOf(float[][] w, float[] b, float[][] input, Reduction reduction) {
        LinearLayer layer = new LinearLayer(w, b);
        return new CrossEntropyLoss(reduction).forward(layer.forward(input).outputs(), LABELS);
    }

    private static float chainLoss(float[][] w1, float[] b1, float[][] w2, float[] b2) {
        LinearLayer first = new LinearLayer(w1, b1);
        LinearLayer second = new LinearLayer(w2, b2);
        return new CrossEntropyLoss(Reduction.MEAN).forward(second.forward(first.forward(INPUT).outputs()).outputs(), LABELS);
    }

    private static float[][] copyWith(float[][] matrix, int row, int col, float delta) {
        float[][] copy = new float[matrix.length][];
        for (int i = 0; i < matrix.length; i++)
            copy[i] = matrix[i].clone();
        copy[row][col] += delta;
        return copy;
    }
}
