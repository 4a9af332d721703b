package dev.neuronic.tinynet.data;

import dev.neuronic.tinynet.math.RandomSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fixed set of labeled samples split once into a train and a test subset.
 *
 * <p>The split is computed at construction: the discovered samples are optionally shuffled,
 * then the first {@code floor(trainFraction * n)} go to {@code "train"} and the rest to
 * {@code "test"}. Nothing is lost and nothing is duplicated.
 *
 * <p>Class names are sorted and numbered by their sorted position. Discovered samples carry
 * labels that index into the class list handed to the constructor; they are renumbered to the
 * sorted order here.
 *
 * @param <R> sample reference type
 */
public abstract class DatasetSource<R> {

    public static final String TRAIN = "train";
    public static final String TEST = "test";

    private final List<String> classes;
    private final Map<String, Integer> classToIndex;
    private final List<Sample<R>> trainSamples;
    private final List<Sample<R>> testSamples;
    private final SampleDecoder<R> decoder;
    private final List<SampleTransform> preprocessing;
    private final RandomSource random;

    protected DatasetSource(List<Sample<R>> discovered, List<String> classes, double trainFraction, boolean shuffle,
                            RandomSource random, SampleDecoder<R> decoder, List<SampleTransform> preprocessing) {
        Objects.requireNonNull(discovered, "discovered");
        Objects.requireNonNull(classes, "classes");
        if (!Double.isFinite(trainFraction) || trainFraction < 0.0 || trainFraction > 1.0)
            throw new IllegalArgumentException("Train fraction must be in [0, 1]: " + trainFraction);
        if (classes.stream().distinct().count() != classes.size())
            throw new IllegalArgumentException("Class names must be unique: " + classes);

        this.random = Objects.requireNonNull(random, "random");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.preprocessing = List.copyOf(Objects.requireNonNull(preprocessing, "preprocessing"));

        List<String> sorted = new ArrayList<>(classes);
        Collections.sort(sorted);
        this.classes = Collections.unmodifiableList(sorted);

        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < sorted.size(); i++)
            index.put(sorted.get(i), i);
        this.classToIndex = Collections.unmodifiableMap(index);

        List<Sample<R>> all = new ArrayList<>(discovered.size());
        for (Sample<R> sample : discovered) {
            if (sample.getLabel() >= classes.size())
                throw new IllegalArgumentException("Sample " + sample.getReference() + " has label " + sample.getLabel() +
                                                 " but there are only " + classes.size() + " classes");
            int label = index.get(classes.get(sample.getLabel()));
            all.add(new Sample<>(sample.getReference(), label));
        }
        if (shuffle)
            random.shuffle(all);

        int splitIndex = (int) Math.floor(trainFraction * all.size());
        this.trainSamples = List.copyOf(all.subList(0, splitIndex));
        this.testSamples = List.copyOf(all.subList(splitIndex, all.size()));
    }

    /**
     * Iterator over {@code "train"} or {@code "test"} that keeps the remainder batch and shuffles
     * only the train subset.
     */
    public DatasetIterator<R> iterator(String name, int batchSize) {
        return iterator(name, batchSize, false, TRAIN.equals(name));
    }

    /**
     * @throws IllegalArgumentException if {@code name} is not {@code "train"} or {@code "test"}
     */
    public DatasetIterator<R> iterator(String name, int batchSize, boolean dropLast, boolean shuffle) {
        return iterator(name, batchSize, dropLast, shuffle, random);
    }

    /**
     * Same as {@link #iterator(String, int, boolean, boolean)} but shuffling with {@code random}
     * instead of the source's own random.
     */
    public DatasetIterator<R> iterator(String name, int batchSize, boolean dropLast, boolean shuffle,
                                       RandomSource random) {
        List<Sample<R>> samples;
        if (TRAIN.equals(name))
            samples = trainSamples;
        else if (TEST.equals(name))
            samples = testSamples;
        else
            throw new IllegalArgumentException("Unknown subset: " + name + ". Expected train or test.");

        return new DatasetIterator<>(samples, decoder, preprocessing, classToIndex, batchSize, dropLast, shuffle, random);
    }

    public List<String> getClasses() {
        return classes;
    }

    public Map<String, Integer> getClassToIndex() {
        return classToIndex;
    }

    public List<Sample<R>> getTrainSamples() {
        return trainSamples;
    }

    public List<Sample<R>> getTestSamples() {
        return testSamples;
    }
}
