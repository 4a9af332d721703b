package dev.neuronic.tinynet.data;

/**
 * A batch of decoded samples containing inputs and their class labels.
 *
 * <p>This class represents a mini-batch produced by a {@link DatasetIterator}, containing
 * aligned arrays of feature rows and their corresponding labels.
 */
public class DataBatch {
    private final float[][] inputs;
    private final int[] labels;

    /**
     * Create a new data batch.
     *
     * @param inputs batch-major feature rows
     * @param labels class indices (must be same length as inputs)
     * @throws IllegalArgumentException if lengths don't match
     */
    public DataBatch(float[][] inputs, int[] labels) {
        if (inputs.length != labels.length) {
            throw new IllegalArgumentException(
                "Inputs and labels must have same length: " +
                inputs.length + " vs " + labels.length);
        }
        this.inputs = inputs;
        this.labels = labels;
    }

    public float[][] getInputs() {
        return inputs;
    }

    public int[] getLabels() {
        return labels;
    }

    /**
     * Get the batch size.
     *
     * @return number of examples in this batch
     */
    public int size() {
        return inputs.length;
    }

    @Override
    public String toString() {
        return "DataBatch[size=" + size() + "]";
    }
}
