package dev.neuronic.tinynet.data;

import dev.neuronic.tinynet.math.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory dataset over a feature matrix. Sample references are row indices.
 *
 * <pre>{@code
 * ArrayDatasetSource xor = new ArrayDatasetSource(
 *     new float[][] {{0, 0}, {0, 1}, {1, 0}, {1, 1}},
 *     new int[] {0, 1, 1, 0},
 *     List.of("false", "true"),
 *     1.0, false, new RandomSource(42));
 * }</pre>
 */
public class ArrayDatasetSource extends DatasetSource<Integer> {

    public ArrayDatasetSource(float[][] features, int[] labels, List<String> classes, double trainFraction,
                              boolean shuffle, RandomSource random) {
        this(features, labels, classes, trainFraction, shuffle, random, List.of());
    }

    public ArrayDatasetSource(float[][] features, int[] labels, List<String> classes, double trainFraction,
                              boolean shuffle, RandomSource random, List<SampleTransform> preprocessing) {
        super(samples(features, labels), classes, trainFraction, shuffle, random, rowDecoder(features), preprocessing);
    }

    private static List<Sample<Integer>> samples(float[][] features, int[] labels) {
        if (features == null || labels == null)
            throw new IllegalArgumentException("Features and labels cannot be null");
        if (features.length != labels.length)
            throw new IllegalArgumentException("Features and labels must have same length: " +
                                             features.length + " vs " + labels.length);
        List<Sample<Integer>> samples = new ArrayList<>(labels.length);
        for (int i = 0; i < labels.length; i++)
            samples.add(new Sample<>(i, labels[i]));
        return samples;
    }

    // Snapshot of the caller's rows
    private static SampleDecoder<Integer> rowDecoder(float[][] features) {
        float[][] rows = new float[features.length][];
        for (int i = 0; i < features.length; i++) {
            if (features[i] == null)
                throw new IllegalArgumentException("Feature row " + i + " is null");
            rows[i] = features[i].clone();
        }
        return index -> rows[index].clone();
    }
}
