package dev.neuronic.tinynet.losses;

import dev.neuronic.tinynet.math.NetMath;
import dev.neuronic.tinynet.serialization.SerializationService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Softmax cross-entropy over raw logits for multi-class classification.
 *
 * <p>Loss: CrossEntropy = -sum(target[i] * logSoftmax(logits)[i])
 * <p>Gradient: dCrossEntropy/dlogits[i] = softmax(logits)[i] - target[i]
 *
 * <p>The softmax is folded into the loss so the log never sees a zero probability: each row is
 * shifted by its maximum before exponentiation and the log-probabilities come straight from the
 * shifted values.
 *
 * <p><strong>Gradient scaling:</strong> with {@link Reduction#MEAN} and batched input the
 * gradient is divided by the batch size. With {@link Reduction#SUM}, or a single unbatched
 * sample, it is left as {@code p - t}. This is the only place the batch size is divided out.
 *
 * <p><strong>Example Usage:</strong>
 * <pre>
 * CrossEntropyLoss loss = new CrossEntropyLoss(Reduction.MEAN);
 * float value = loss.forward(model.forward(batch.getInputs()), batch.getLabels());
 * float[][] grad = loss.backward();
 * </pre>
 */
public final class CrossEntropyLoss implements Loss {

    public static final String CLASS_NAME = "CrossEntropyLoss";

    private final Reduction reduction;

    // Cache of the latest forward call
    private float[][] probabilities;
    private float[][] targets;
    private boolean batched;

    public CrossEntropyLoss() {
        this(Reduction.MEAN);
    }

    public CrossEntropyLoss(Reduction reduction) {
        if (reduction == null)
            throw new IllegalArgumentException("Reduction cannot be null");
        this.reduction = reduction;
    }

    @Override
    public float forward(float[][] logits, float[][] targets) {
        requireLogits(logits);
        if (targets == null || targets.length == 0)
            throw new IllegalArgumentException("Targets cannot be empty");
        if (targets.length != logits.length)
            throw new IllegalArgumentException("Expected targets for " + logits.length + " samples, got " + targets.length);
        int numClasses = logits[0].length;
        float[][] copy = new float[targets.length][];
        for (int b = 0; b < targets.length; b++) {
            if (targets[b] == null || targets[b].length != numClasses)
                throw new IllegalArgumentException("Target row " + b + " must have " + numClasses + " classes, got " +
                                                 (targets[b] == null ? "null" : targets[b].length));
            copy[b] = targets[b].clone();
        }
        return compute(logits, copy, true);
    }

    @Override
    public float forward(float[][] logits, int[] labels) {
        requireLogits(logits);
        if (labels == null || labels.length == 0)
            throw new IllegalArgumentException("Labels cannot be empty");
        if (labels.length != logits.length)
            throw new IllegalArgumentException("Expected labels for " + logits.length + " samples, got " + labels.length);
        int numClasses = logits[0].length;
        float[][] oneHot = new float[labels.length][numClasses];
        for (int b = 0; b < labels.length; b++)
            oneHot[b][checkLabel(labels[b], numClasses)] = 1.0f;
        return compute(logits, oneHot, true);
    }

    @Override
    public float forward(float[] logits, int label) {
        if (logits == null || logits.length == 0)
            throw new IllegalArgumentException("Logits cannot be empty");
        float[][] oneHot = new float[1][logits.length];
        oneHot[0][checkLabel(label, logits.length)] = 1.0f;
        return compute(new float[][] { logits }, oneHot, false);
    }

    @Override
    public float forward(float[] logits, float[] target) {
        if (logits == null || logits.length == 0)
            throw new IllegalArgumentException("Logits cannot be empty");
        if (target == null || target.length == 0)
            throw new IllegalArgumentException("Target cannot be empty");
        if (target.length != logits.length)
            throw new IllegalArgumentException("Target must have " + logits.length + " classes, got " + target.length);
        return compute(new float[][] { logits }, new float[][] { target.clone() }, false);
    }

    @Override
    public float[][] backward() {
        if (probabilities == null)
            throw new IllegalStateException("forward must be called on " + CLASS_NAME + " before backward");

        int batchSize = probabilities.length;
        float n = reduction == Reduction.MEAN && batched ? batchSize : 1.0f;
        float[][] gradient = new float[batchSize][];
        for (int b = 0; b < batchSize; b++) {
            float[] p = probabilities[b];
            float[] t = targets[b];
            float[] row = new float[p.length];
            for (int c = 0; c < p.length; c++)
                row[c] = (p[c] - t[c]) / n;
            gradient[b] = row;
        }
        return gradient;
    }

    /**
     * @return copy of the softmax probabilities cached by the latest forward call
     */
    public float[][] getProbabilities() {
        if (probabilities == null)
            throw new IllegalStateException("forward must be called on " + CLASS_NAME + " before reading probabilities");
        return NetMath.matrixCopy(probabilities);
    }

    @Override
    public Reduction getReduction() {
        return reduction;
    }

    private float compute(float[][] logits, float[][] expandedTargets, boolean isBatched) {
        float[][] logProbs = NetMath.logSoftmaxRows(logits);
        float[][] probs = new float[logProbs.length][];
        double[] perSample = new double[logProbs.length];

        for (int b = 0; b < logProbs.length; b++) {
            float[] logProb = logProbs[b];
            float[] t = expandedTargets[b];
            float[] p = new float[logProb.length];
            double sampleLoss = 0.0;
            for (int c = 0; c < logProb.length; c++) {
                p[c] = (float) Math.exp(logProb[c]);
                if (t[c] != 0.0f)
                    sampleLoss -= (double) t[c] * logProb[c];
            }
            probs[b] = p;
            perSample[b] = sampleLoss;
        }

        this.probabilities = probs;
        this.targets = expandedTargets;
        this.batched = isBatched;
        return (float) reduction.reduce(perSample);
    }

    private static void requireLogits(float[][] logits) {
        if (logits == null || logits.length == 0)
            throw new IllegalArgumentException("Logits cannot be empty");
        if (logits[0] == null || logits[0].length == 0)
            throw new IllegalArgumentException("Logits rows cannot be empty");
        int numClasses = logits[0].length;
        for (int b = 1; b < logits.length; b++) {
            if (logits[b] == null || logits[b].length != numClasses)
                throw new IllegalArgumentException("Logits rows must all have " + numClasses + " classes, row " + b +
                                                 " has " + (logits[b] == null ? "null" : logits[b].length));
        }
    }

    private static int checkLabel(int label, int numClasses) {
        if (label < 0 || label >= numClasses)
            throw new IllegalArgumentException("Label " + label + " is outside [0, " + numClasses + ")");
        return label;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CLASS_KEY, CLASS_NAME);
        map.put("reduction", reduction.getName());
        return map;
    }

    public static CrossEntropyLoss fromMap(Map<String, Object> map) {
        SerializationService.requireClass(map, CLASS_NAME);
        return new CrossEntropyLoss(Reduction.fromName(SerializationService.getString(map, "reduction")));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CrossEntropyLoss && ((CrossEntropyLoss) o).reduction == reduction;
    }

    @Override
    public int hashCode() {
        return reduction.hashCode();
    }

    @Override
    public String toString() {
        return CLASS_NAME + "(" + reduction.getName() + ")";
    }
}
