package dev.neuronic.tinynet.layers;

import dev.neuronic.tinynet.math.RandomSource;
import dev.neuronic.tinynet.serialization.SerializationService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dropout layer for regularization during training.
 *
 * <p><b>What it does:</b> Randomly "drops out" (sets to zero) a percentage of units
 * during training, which helps prevent overfitting by forcing the network to learn
 * redundant representations.
 *
 * <p><b>Key features:</b>
 * <ul>
 *   <li>Uses inverted dropout: scales kept activations during training so no scaling is needed at inference</li>
 *   <li>Identity in eval mode; the model switches modes around validation passes</li>
 *   <li>Masks are drawn from an explicit {@link RandomSource}, so runs are reproducible</li>
 * </ul>
 *
 * <p><b>Common dropout rates:</b>
 * <ul>
 *   <li>0.1-0.2: Light regularization for small networks</li>
 *   <li>0.3-0.5: Standard regularization for hidden layers</li>
 * </ul>
 */
public class DropoutLayer implements Layer {

    public static final String CLASS_NAME = "DropoutLayer";

    /**
     * Dropout-specific context that stores the mask for the update pass.
     */
    public static class DropoutContext extends LayerContext {
        public final boolean[][] mask;  // Which units were kept (true) or dropped (false)
        public final float scale;

        public DropoutContext(float[][] inputs, float[][] outputs, boolean[][] mask, float scale) {
            super(inputs, null, outputs); // No preactivations in dropout
            this.mask = mask;
            this.scale = scale;
        }
    }

    private final float dropoutRate;      // Probability of dropping a unit (0.0 to 1.0)
    private final float scale;            // 1 / keepProbability (for inverted dropout)
    private final int size;
    private final RandomSource random;

    private boolean eval;
    private DropoutContext context;

    /**
     * @param dropoutRate probability of dropping each unit, in [0, 1)
     * @param size input/output width
     * @param random source for the dropout masks
     */
    public DropoutLayer(float dropoutRate, int size, RandomSource random) {
        if (!(dropoutRate >= 0.0f && dropoutRate < 1.0f))
            throw new IllegalArgumentException("Dropout rate must be in [0, 1): " + dropoutRate);
        if (size <= 0)
            throw new IllegalArgumentException("Size must be positive: " + size);

        this.dropoutRate = dropoutRate;
        this.scale = 1.0f / (1.0f - dropoutRate);
        this.size = size;
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public LayerContext forward(float[][] input) {
        LayerChecks.requireBatch(input, size, CLASS_NAME);

        float[][] outputs = new float[input.length][size];
        boolean[][] mask = new boolean[input.length][size];
        boolean active = !eval && dropoutRate > 0.0f;
        float appliedScale = active ? scale : 1.0f;

        for (int b = 0; b < input.length; b++) {
            for (int i = 0; i < size; i++) {
                boolean keep = !active || random.nextFloat() >= dropoutRate;
                mask[b][i] = keep;
                outputs[b][i] = keep ? input[b][i] * appliedScale : 0.0f;
            }
        }

        context = new DropoutContext(input, outputs, mask, appliedScale);
        return context;
    }

    @Override
    public float[][] update(float[][] outputGradient, float learningRate) {
        DropoutContext ctx = LayerChecks.requireContext(context, CLASS_NAME);
        LayerChecks.requireGradient(outputGradient, ctx.batchSize(), size, CLASS_NAME);

        float[][] inputGradients = new float[outputGradient.length][size];
        for (int b = 0; b < outputGradient.length; b++)
            for (int i = 0; i < size; i++)
                inputGradients[b][i] = ctx.mask[b][i] ? outputGradient[b][i] * ctx.scale : 0.0f;
        return inputGradients;
    }

    @Override
    public void setEval(boolean eval) {
        this.eval = eval;
    }

    @Override
    public boolean isEval() {
        return eval;
    }

    public float getDropoutRate() {
        return dropoutRate;
    }

    @Override
    public int getInputSize() {
        return size;
    }

    @Override
    public int getOutputSize() {
        return size;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CLASS_KEY, CLASS_NAME);
        map.put("rate", (double) dropoutRate);
        map.put("size", size);
        return map;
    }

    /**
     * Rebuild a dropout layer. Masks are not persisted, so the restored layer draws from a
     * freshly seeded source.
     */
    public static DropoutLayer fromMap(Map<String, Object> map) {
        SerializationService.requireClass(map, CLASS_NAME);
        float rate = (float) SerializationService.getDouble(map, "rate");
        int size = SerializationService.getInt(map, "size");
        return new DropoutLayer(rate, size, new RandomSource());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DropoutLayer)) return false;
        DropoutLayer other = (DropoutLayer) o;
        return size == other.size && Float.compare(dropoutRate, other.dropoutRate) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Float.hashCode(dropoutRate) + size;
    }

    @Override
    public String toString() {
        return CLASS_NAME + "(" + dropoutRate + ", " + size + ")";
    }
}
