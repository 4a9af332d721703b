package dev.neuronic.tinynet.math.ops;

/**
 * Index of the maximum value in an array.
 *
 * <p>Example: [0.1, 0.8, 0.1] returns 1. Ties resolve to the lowest index; NaN entries are
 * skipped, and an all-NaN row returns 0.
 */
public final class Argmax {

    public static int compute(float[] array) {
        if (array == null || array.length == 0)
            throw new IllegalArgumentException("Array cannot be null or empty");

        int maxIndex = 0;
        float maxValue = Float.NEGATIVE_INFINITY;
        boolean found = false;

        for (int i = 0; i < array.length; i++) {
            float value = array[i];
            if (Float.isNaN(value))
                continue;
            if (!found || value > maxValue) {
                maxValue = value;
                maxIndex = i;
                found = true;
            }
        }
        return maxIndex;
    }

    private Argmax() {}
}
