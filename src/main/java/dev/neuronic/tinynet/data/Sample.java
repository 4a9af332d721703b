package dev.neuronic.tinynet.data;

import java.util.Objects;

/**
 * A labeled sample: an undecoded reference (a file path, a row of an array) and its class index.
 *
 * @param <R> reference type, turned into features by a {@link SampleDecoder}
 */
public final class Sample<R> {
    private final R reference;
    private final int label;

    public Sample(R reference, int label) {
        this.reference = Objects.requireNonNull(reference, "reference");
        if (label < 0)
            throw new IllegalArgumentException("Label must be non-negative: " + label);
        this.label = label;
    }

    public R getReference() {
        return reference;
    }

    public int getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Sample)) return false;
        Sample<?> other = (Sample<?>) o;
        return label == other.label && reference.equals(other.reference);
    }

    @Override
    public int hashCode() {
        return 31 * reference.hashCode() + label;
    }

    @Override
    public String toString() {
        return "Sample[" + reference + " -> " + label + "]";
    }
}
