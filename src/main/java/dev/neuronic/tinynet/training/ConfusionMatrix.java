package dev.neuronic.tinynet.training;

/**
 * Square count matrix of predictions against ground truth. Rows are predicted classes,
 * columns are actual classes.
 *
 * <p>Per-class precision and recall treat an empty row or column as 0 rather than NaN, so a
 * class the model never predicts scores 0 precision instead of poisoning the macro average.
 */
public class ConfusionMatrix {

    private final long[][] counts;

    public ConfusionMatrix(int numClasses) {
        if (numClasses <= 0)
            throw new IllegalArgumentException("Number of classes must be positive: " + numClasses);
        this.counts = new long[numClasses][numClasses];
    }

    /**
     * Record one batch of predictions.
     *
     * @throws IllegalArgumentException if the arrays differ in length or hold an out-of-range class
     */
    public void add(int[] predicted, int[] actual) {
        if (predicted.length != actual.length)
            throw new IllegalArgumentException("Predicted and actual must have same length: " +
                                             predicted.length + " vs " + actual.length);
        for (int i = 0; i < predicted.length; i++)
            add(predicted[i], actual[i]);
    }

    public void add(int predicted, int actual) {
        checkClass(predicted);
        checkClass(actual);
        counts[predicted][actual]++;
    }

    public int getNumClasses() {
        return counts.length;
    }

    public long get(int predicted, int actual) {
        return counts[predicted][actual];
    }

    public long total() {
        long total = 0;
        for (long[] row : counts)
            for (long count : row)
                total += count;
        return total;
    }

    /**
     * Fraction of correct predictions, NaN when nothing has been recorded.
     */
    public double accuracy() {
        long total = total();
        if (total == 0)
            return Double.NaN;
        long correct = 0;
        for (int c = 0; c < counts.length; c++)
            correct += counts[c][c];
        return (double) correct / total;
    }

    /**
     * True positives / (true positives + false positives) for one class.
     */
    public double precision(int cls) {
        checkClass(cls);
        long predicted = 0;
        for (long count : counts[cls])
            predicted += count;
        return predicted == 0 ? 0.0 : (double) counts[cls][cls] / predicted;
    }

    /**
     * True positives / (true positives + false negatives) for one class.
     */
    public double recall(int cls) {
        checkClass(cls);
        long actual = 0;
        for (long[] row : counts)
            actual += row[cls];
        return actual == 0 ? 0.0 : (double) counts[cls][cls] / actual;
    }

    /**
     * Harmonic mean of precision and recall for one class.
     */
    public double f1Score(int cls) {
        double p = precision(cls);
        double r = recall(cls);
        return p + r == 0.0 ? 0.0 : 2 * p * r / (p + r);
    }

    public double[] precisionPerClass() {
        double[] values = new double[counts.length];
        for (int c = 0; c < values.length; c++)
            values[c] = precision(c);
        return values;
    }

    public double[] recallPerClass() {
        double[] values = new double[counts.length];
        for (int c = 0; c < values.length; c++)
            values[c] = recall(c);
        return values;
    }

    public double[] f1ScorePerClass() {
        double[] values = new double[counts.length];
        for (int c = 0; c < values.length; c++)
            values[c] = f1Score(c);
        return values;
    }

    public double macroPrecision() {
        return mean(precisionPerClass());
    }

    public double macroRecall() {
        return mean(recallPerClass());
    }

    public double macroF1Score() {
        return mean(f1ScorePerClass());
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double value : values)
            sum += value;
        return sum / values.length;
    }

    private void checkClass(int cls) {
        if (cls < 0 || cls >= counts.length)
            throw new IllegalArgumentException("Class " + cls + " is outside [0, " + counts.length + ")");
    }
}
