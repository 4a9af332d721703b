package dev.neuronic.tinynet.losses;

import java.util.Locale;

/**
 * How per-sample losses are combined into the scalar returned by a loss.
 */
public enum Reduction {

    /** Arithmetic mean over the batch; gradients are divided by the batch size. */
    MEAN {
        @Override
        public double reduce(double[] perSample) {
            if (perSample.length == 0)
                throw new IllegalArgumentException("Cannot reduce an empty batch");
            return SUM.reduce(perSample) / perSample.length;
        }
    },

    /** Plain sum over the batch; gradients are left unscaled. */
    SUM {
        @Override
        public double reduce(double[] perSample) {
            double total = 0.0;
            for (double value : perSample)
                total += value;
            return total;
        }
    };

    public abstract double reduce(double[] perSample);

    /**
     * Lower-case name used in serialized maps.
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a reduction name, ignoring case.
     *
     * @throws IllegalArgumentException for anything other than mean or sum
     */
    public static Reduction fromName(String name) {
        if (name != null) {
            for (Reduction reduction : values())
                if (reduction.name().equalsIgnoreCase(name))
                    return reduction;
        }
        throw new IllegalArgumentException("Unknown reduction: " + name + ". Expected mean or sum.");
    }
}
