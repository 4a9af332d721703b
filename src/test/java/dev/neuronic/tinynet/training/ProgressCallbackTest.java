package dev.neuronic.tinynet.training;

import dev.neuronic.tinynet.Model;
import dev.neuronic.tinynet.layers.LinearLayer;
import dev.neuronic.tinynet.losses.CrossEntropyLoss;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ProgressCallbackTest {

    @Test
    void testTableListsEveryClass() {
        ConfusionMatrix matrix = new ConfusionMatrix(2);
        matrix.add(new int[] {0, 1}, new int[] {0, 0});
        EpochReport report = new EpochReport(EpochReport.Phase.TRAIN, 0, 1, matrix, 0.5, 1, List.of("cat", "dog"));

        String table = ProgressCallback.formatTable(report);

        assertTrue(table.contains("Precision"));
        assertTrue(table.contains("cat"));
        assertTrue(table.contains("dog"));
        assertTrue(table.contains("1.0000"));
    }

    @Test
    void testCallbackHooksRun() {
        ProgressCallback callback = new ProgressCallback(true);
        Model model = new Model(List.of(new LinearLayer(2, 2, 1L)), new CrossEntropyLoss());
        ConfusionMatrix matrix = new ConfusionMatrix(2);

        assertDoesNotThrow(() -> {
            callback.onTrainingStart(model, TrainingConfig.builder().build());
            callback.onEpochEnd(new EpochReport(EpochReport.Phase.VALIDATION, 0, 1, matrix, Double.NaN, 0, List.of("a", "b")));
            callback.onTrainingEnd(model);
        });
    }

    @Test
    void testTimeFormatIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
            assertEquals("250ms", ProgressCallback.formatTime(250));
            assertEquals("1.5s", ProgressCallback.formatTime(1500));
            assertEquals("2m 5s", ProgressCallback.formatTime(125_000));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
