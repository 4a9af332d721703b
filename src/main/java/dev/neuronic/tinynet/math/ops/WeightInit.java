package dev.neuronic.tinynet.math.ops;

import dev.neuronic.tinynet.math.RandomSource;

/**
 * Weight initialization schemes for [fanIn][fanOut] weight matrices.
 *
 * <ul>
 *   <li><b>LeCun:</b> Gaussian with stddev sqrt(1 / fanIn). Keeps pre-activation variance near
 *       one for linear chains and is the default for {@code LinearLayer}.</li>
 *   <li><b>Xavier/Glorot:</b> uniform in [-limit, +limit] with limit = sqrt(6 / (fanIn + fanOut)).</li>
 *   <li><b>He:</b> Gaussian with stddev sqrt(2 / fanIn), for ReLU chains.</li>
 * </ul>
 */
public final class WeightInit {

    public static void lecun(float[][] weights, int fanIn, RandomSource random) {
        gaussian(weights, fanIn, 1.0, random);
    }

    public static void he(float[][] weights, int fanIn, RandomSource random) {
        gaussian(weights, fanIn, 2.0, random);
    }

    public static void xavier(float[][] weights, int fanIn, int fanOut, RandomSource random) {
        if (fanIn <= 0 || fanOut <= 0)
            throw new IllegalArgumentException("fanIn and fanOut must be positive, got: " + fanIn + ", " + fanOut);

        float limit = (float) Math.sqrt(6.0f / (fanIn + fanOut));
        for (float[] row : weights)
            random.fillUniform(row, -limit, limit);
    }

    private static void gaussian(float[][] weights, int fanIn, double gain, RandomSource random) {
        if (fanIn <= 0)
            throw new IllegalArgumentException("fanIn must be positive, got: " + fanIn);

        float stddev = (float) Math.sqrt(gain / fanIn);
        for (float[] row : weights)
            random.fillGaussian(row, 0.0f, stddev);
    }

    private WeightInit() {}
}
