package dev.neuronic.tinynet.data;

/**
 * Common preprocessing steps.
 *
 * <pre>{@code
 * List<SampleTransform> pipeline = List.of(Transforms.scale(1f / 255f), Transforms.standardize(0.1307f, 0.3081f));
 * }</pre>
 */
public final class Transforms {

    /**
     * Multiply every feature by {@code factor}, e.g. {@code 1/255} to bring pixels into [0, 1].
     */
    public static SampleTransform scale(float factor) {
        if (!Float.isFinite(factor))
            throw new IllegalArgumentException("Scale factor must be finite: " + factor);
        return features -> {
            float[] out = new float[features.length];
            for (int i = 0; i < features.length; i++)
                out[i] = features[i] * factor;
            return out;
        };
    }

    /**
     * {@code (x - mean) / std} for every feature.
     */
    public static SampleTransform standardize(float mean, float std) {
        if (!(std > 0) || !Float.isFinite(std))
            throw new IllegalArgumentException("Standard deviation must be positive: " + std);
        return features -> {
            float[] out = new float[features.length];
            for (int i = 0; i < features.length; i++)
                out[i] = (features[i] - mean) / std;
            return out;
        };
    }

    private Transforms() {}
}
