package dev.neuronic.tinynet.training;

import java.util.Locale;

/**
 * Metrics a model can record per epoch. Class-wise metrics are recorded as their macro average;
 * the per-class values are available from the {@link ConfusionMatrix} in each {@link EpochReport}.
 */
public enum Metric {
    LOSS,
    ACCURACY,
    PRECISION,
    RECALL,
    F1_SCORE;

    /**
     * Name used as the history key, e.g. {@code "f1_score"}.
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Value of this metric for one finished pass.
     */
    public double compute(ConfusionMatrix matrix, double loss) {
        switch (this) {
            case LOSS: return loss;
            case ACCURACY: return matrix.accuracy();
            case PRECISION: return matrix.macroPrecision();
            case RECALL: return matrix.macroRecall();
            case F1_SCORE: return matrix.macroF1Score();
            default: throw new IllegalStateException("Unhandled metric: " + this);
        }
    }

    /**
     * @throws IllegalArgumentException if no metric has this name
     */
    public static Metric fromName(String name) {
        for (Metric metric : values())
            if (metric.getName().equals(name))
                return metric;
        throw new IllegalArgumentException("An invalid metric was provided: " + name);
    }
}
