package dev.neuronic.tinynet.training;

import dev.neuronic.tinynet.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Progress reporting callback that logs per-epoch metrics.
 *
 * Supports two modes:
 * - Simple: one line per pass with loss and accuracy
 * - Detailed: adds a per-class precision / recall / F1 table
 */
public class ProgressCallback implements TrainingCallback {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressCallback.class);

    private final boolean detailed;
    private long trainingStartTime;

    public ProgressCallback() {
        this(true);
    }

    public ProgressCallback(boolean detailed) {
        this.detailed = detailed;
    }

    @Override
    public void onTrainingStart(Model model, TrainingConfig config) {
        trainingStartTime = System.currentTimeMillis();
        LOG.info("Training started: {}", config);
    }

    @Override
    public void onEpochEnd(EpochReport report) {
        String phase = report.getPhase() == EpochReport.Phase.TRAIN ? "train" : "validation";
        LOG.info("Epoch {}/{} {} - loss: {} - acc: {}",
                 report.getEpoch() + 1, report.getTotalEpochs(), phase,
                 String.format(Locale.ROOT, "%.4f", report.getLoss()),
                 String.format(Locale.ROOT, "%.4f", report.getAccuracy()));
        if (detailed)
            LOG.info("{} metrics per class:\n{}", phase, formatTable(report));
    }

    @Override
    public void onTrainingEnd(Model model) {
        long totalTime = System.currentTimeMillis() - trainingStartTime;
        LOG.info("Training completed in {} ({} epochs total)", formatTime(totalTime), model.getTotalEpochs());
    }

    /**
     * Per-class precision, recall and F1 as a fixed-width table.
     */
    static String formatTable(EpochReport report) {
        ConfusionMatrix matrix = report.getConfusionMatrix();
        List<String> classes = report.getClassNames();
        int width = "Class".length();
        for (String name : classes)
            width = Math.max(width, name.length());

        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-" + width + "s  %9s  %9s  %9s%n", "Class", "Precision", "Recall", "F1"));
        sb.append("-".repeat(width + 33)).append(System.lineSeparator());
        for (int c = 0; c < matrix.getNumClasses(); c++) {
            String name = c < classes.size() ? classes.get(c) : String.valueOf(c);
            sb.append(String.format(Locale.ROOT, "%-" + width + "s  %9.4f  %9.4f  %9.4f%n",
                                    name, matrix.precision(c), matrix.recall(c), matrix.f1Score(c)));
        }
        return sb.toString();
    }

    static String formatTime(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60000) {
            return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
        } else {
            long minutes = millis / 60000;
            long seconds = (millis % 60000) / 1000;
            return String.format(Locale.ROOT, "%dm %ds", minutes, seconds);
        }
    }
}
