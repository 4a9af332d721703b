package dev.neuronic.tinynet.training;

import dev.neuronic.tinynet.Model;

/**
 * Interface for training callbacks that monitor the training process.
 *
 * Callbacks provide hooks at various points during training:
 * - Training start/end
 * - End of each train and validation pass
 *
 * Exceptions thrown by a callback propagate out of {@link Model#train}.
 */
public interface TrainingCallback {

    /**
     * Called at the beginning of a train call.
     *
     * @param model the model being trained
     * @param config settings of this train call
     */
    default void onTrainingStart(Model model, TrainingConfig config) {}

    /**
     * Called after each train pass and, when the source has test samples, each validation pass.
     */
    default void onEpochEnd(EpochReport report) {}

    /**
     * Called at the end of a train call, after the epoch counter has been advanced.
     */
    default void onTrainingEnd(Model model) {}
}
