package dev.neuronic.tinynet.math;

import java.util.List;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Seedable random source shared by weight initialization, dropout masks and dataset shuffling.
 *
 * <p>Every component that needs randomness receives one of these explicitly, so a run built
 * from the same seed reproduces the same weights, masks and sample order.
 */
public final class RandomSource {

    private static final String ALGORITHM = "Xoroshiro128PlusPlus";

    private final RandomGenerator rng;
    private final long seed;

    /**
     * Create a source with a fixed seed.
     */
    public RandomSource(long seed) {
        this.seed = seed;
        this.rng = RandomGeneratorFactory.of(ALGORITHM).create(seed);
    }

    /**
     * Create a source seeded from the clock.
     */
    public RandomSource() {
        this(System.nanoTime());
    }

    public long getSeed() {
        return seed;
    }

    public float nextFloat() {
        return rng.nextFloat();
    }

    public double nextGaussian() {
        return rng.nextGaussian();
    }

    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Fill buffer with Gaussian-distributed floats (mean, stddev).
     */
    public void fillGaussian(float[] buffer, float mean, float stddev) {
        for (int i = 0, len = buffer.length; i < len; i++) {
            buffer[i] = (float) (rng.nextGaussian() * stddev + mean);
        }
    }

    /**
     * Fill buffer with uniform floats in [min, max).
     */
    public void fillUniform(float[] buffer, float min, float max) {
        float range = max - min;
        for (int i = 0; i < buffer.length; i++) {
            buffer[i] = rng.nextFloat() * range + min;
        }
    }

    /**
     * In-place Fisher-Yates shuffle.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }
}
