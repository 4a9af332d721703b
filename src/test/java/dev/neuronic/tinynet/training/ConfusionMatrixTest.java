package dev.neuronic.tinynet.training;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfusionMatrixTest {

    private static final double DELTA = 1e-9;

    private ConfusionMatrix matrix;

    @BeforeEach
    void setUp() {
        matrix = new ConfusionMatrix(2);
        matrix.add(new int[] {0, 0, 1, 1}, new int[] {0, 1, 1, 1});
    }

    @Test
    void testRowsArePredictedColumnsAreActual() {
        assertEquals(1, matrix.get(0, 0));
        assertEquals(1, matrix.get(0, 1));
        assertEquals(0, matrix.get(1, 0));
        assertEquals(2, matrix.get(1, 1));
        assertEquals(4, matrix.total());
    }

    @Test
    void testAccuracy() {
        assertEquals(0.75, matrix.accuracy(), DELTA);
        assertTrue(Double.isNaN(new ConfusionMatrix(3).accuracy()));
    }

    @Test
    void testPrecisionRecallF1() {
        assertEquals(0.5, matrix.precision(0), DELTA);
        assertEquals(1.0, matrix.precision(1), DELTA);
        assertEquals(1.0, matrix.recall(0), DELTA);
        assertEquals(2.0 / 3.0, matrix.recall(1), DELTA);
        assertEquals(2.0 / 3.0, matrix.f1Score(0), DELTA);
        assertEquals(0.8, matrix.f1Score(1), DELTA);
        assertEquals(0.75, matrix.macroPrecision(), DELTA);
        assertEquals((2.0 / 3.0 + 0.8) / 2, matrix.macroF1Score(), DELTA);
    }

    @Test
    void testClassNeverPredictedScoresZero() {
        ConfusionMatrix m = new ConfusionMatrix(3);
        m.add(0, 2);
        assertEquals(0.0, m.precision(2), DELTA);
        assertEquals(0.0, m.recall(1), DELTA);
        assertEquals(0.0, m.f1Score(1), DELTA);
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ConfusionMatrix(0));
        assertThrows(IllegalArgumentException.class, () -> matrix.add(2, 0));
        assertThrows(IllegalArgumentException.class, () -> matrix.add(new int[] {0}, new int[] {0, 1}));
    }

    @Test
    void testMetricsComputeFromMatrix() {
        assertEquals(1.25, Metric.LOSS.compute(matrix, 1.25), DELTA);
        assertEquals(0.75, Metric.ACCURACY.compute(matrix, 1.25), DELTA);
        assertEquals(matrix.macroRecall(), Metric.RECALL.compute(matrix, 0), DELTA);
        assertEquals(Metric.F1_SCORE, Metric.fromName("f1_score"));
        assertThrows(IllegalArgumentException.class, () -> Metric.fromName("perplexity"));
    }
}
