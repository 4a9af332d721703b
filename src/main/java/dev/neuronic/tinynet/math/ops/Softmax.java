package dev.neuronic.tinynet.math.ops;

/**
 * Numerically stable softmax and log-softmax for a single row of logits.
 *
 * <p>The row maximum is subtracted before exponentiating, and log-softmax is computed as
 * {@code shifted - log(sum(exp(shifted)))} rather than {@code log(softmax(x))}, so a
 * probability that underflows to zero still yields a finite log-probability.
 */
public final class Softmax {

    public static float[] compute(float[] logits) {
        float[] logProbabilities = logCompute(logits);
        float[] output = new float[logits.length];
        for (int i = 0; i < output.length; i++)
            output[i] = (float) Math.exp(logProbabilities[i]);
        return output;
    }

    public static float[] logCompute(float[] logits) {
        if (logits.length == 0)
            throw new IllegalArgumentException("Logits cannot be empty");

        float max = Float.NEGATIVE_INFINITY;
        for (float value : logits)
            if (value > max)
                max = value;

        double sum = 0.0;
        for (float value : logits)
            sum += Math.exp(value - max);
        double logSum = Math.log(sum);

        float[] output = new float[logits.length];
        for (int i = 0; i < logits.length; i++)
            output[i] = (float) ((logits[i] - max) - logSum);
        return output;
    }

    private Softmax() {}
}
