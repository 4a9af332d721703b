package dev.neuronic.tinynet.training;

import java.util.List;

/**
 * Results of one training or validation pass, handed to every {@link TrainingCallback}.
 */
public class EpochReport {

    public enum Phase { TRAIN, VALIDATION }

    private final Phase phase;
    private final int epoch;
    private final int totalEpochs;
    private final ConfusionMatrix confusionMatrix;
    private final double loss;
    private final int batches;
    private final List<String> classNames;

    public EpochReport(Phase phase, int epoch, int totalEpochs, ConfusionMatrix confusionMatrix, double loss,
                       int batches, List<String> classNames) {
        this.phase = phase;
        this.epoch = epoch;
        this.totalEpochs = totalEpochs;
        this.confusionMatrix = confusionMatrix;
        this.loss = loss;
        this.batches = batches;
        this.classNames = List.copyOf(classNames);
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Epoch within the current train call, 0-based.
     */
    public int getEpoch() {
        return epoch;
    }

    /**
     * Epochs requested by the current train call.
     */
    public int getTotalEpochs() {
        return totalEpochs;
    }

    public ConfusionMatrix getConfusionMatrix() {
        return confusionMatrix;
    }

    /**
     * Mean batch loss, NaN for a pass with no batches.
     */
    public double getLoss() {
        return loss;
    }

    public int getBatches() {
        return batches;
    }

    public double getAccuracy() {
        return confusionMatrix.accuracy();
    }

    public List<String> getClassNames() {
        return classNames;
    }
}
