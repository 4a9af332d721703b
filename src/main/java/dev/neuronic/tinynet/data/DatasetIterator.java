package dev.neuronic.tinynet.data;

import dev.neuronic.tinynet.math.RandomSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Batches a fixed list of labeled samples, decoding each one lazily when its batch is requested.
 *
 * <p>Each call to {@link #iterator()} starts a new pass over the samples. With shuffling enabled
 * the samples are permuted once at construction, the first pass uses that order and every later
 * pass reshuffles before it starts. Each pass keeps the order it started with, so passes may
 * overlap. The caller's list is never touched.
 *
 * <p><b>Batching:</b>
 * <ul>
 *   <li>{@code dropLast == false}: {@code ceil(n / batchSize)} batches, the last one possibly short</li>
 *   <li>{@code dropLast == true}: {@code n / batchSize} full batches, the remainder is skipped</li>
 * </ul>
 *
 * <pre>{@code
 * for (DataBatch batch : source.iterator("train", 32)) {
 *     float[][] logits = model.forward(batch.getInputs());
 *     ...
 * }
 * }</pre>
 *
 * @param <R> sample reference type
 */
public class DatasetIterator<R> implements Iterable<DataBatch> {

    private List<Sample<R>> samples;
    private final SampleDecoder<R> decoder;
    private final List<SampleTransform> preprocessing;
    private final Map<String, Integer> classToIndex;
    private final int batchSize;
    private final boolean dropLast;
    private final boolean shuffle;
    private final RandomSource random;

    private boolean firstPass = true;

    public DatasetIterator(List<Sample<R>> samples, SampleDecoder<R> decoder, List<SampleTransform> preprocessing,
                           Map<String, Integer> classToIndex, int batchSize, boolean dropLast, boolean shuffle,
                           RandomSource random) {
        Objects.requireNonNull(samples, "samples");
        if (batchSize <= 0)
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        if (shuffle)
            Objects.requireNonNull(random, "random is required when shuffling");

        this.samples = new ArrayList<>(samples);
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.preprocessing = List.copyOf(Objects.requireNonNull(preprocessing, "preprocessing"));
        this.classToIndex = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(classToIndex, "classToIndex")));
        this.batchSize = batchSize;
        this.dropLast = dropLast;
        this.shuffle = shuffle;
        this.random = random;

        if (shuffle)
            random.shuffle(this.samples);
    }

    /**
     * Number of batches one pass produces.
     */
    public int length() {
        int n = samples.size();
        return dropLast ? n / batchSize : (n + batchSize - 1) / batchSize;
    }

    /**
     * Start a new pass. Reshuffles first when shuffling is enabled and this is not the first pass.
     */
    @Override
    public Iterator<DataBatch> iterator() {
        if (shuffle && !firstPass) {
            List<Sample<R>> reshuffled = new ArrayList<>(samples);
            random.shuffle(reshuffled);
            samples = reshuffled;
        }
        firstPass = false;
        return new Pass(samples, length());
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isDropLast() {
        return dropLast;
    }

    public boolean isShuffle() {
        return shuffle;
    }

    public Map<String, Integer> getClassToIndex() {
        return classToIndex;
    }

    /**
     * Number of samples, including any a {@code dropLast} pass would skip.
     */
    public int size() {
        return samples.size();
    }

    /**
     * Read-only view of the samples in their current order.
     */
    public List<Sample<R>> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    private DataBatch loadBatch(List<Sample<R>> order, int start, int end) {
        int count = end - start;
        float[][] inputs = new float[count][];
        int[] labels = new int[count];
        int width = -1;

        for (int i = 0; i < count; i++) {
            Sample<R> sample = order.get(start + i);
            float[] features = decode(sample);
            for (SampleTransform transform : preprocessing)
                features = transform.apply(features);

            if (features == null || features.length == 0)
                throw new IllegalArgumentException("Preprocessing produced no features for " + sample.getReference());
            if (width < 0)
                width = features.length;
            else if (features.length != width)
                throw new IllegalArgumentException("Preprocessing produced " + features.length + " features for " +
                                                 sample.getReference() + ", expected " + width);
            inputs[i] = features;
            labels[i] = sample.getLabel();
        }
        return new DataBatch(inputs, labels);
    }

    private float[] decode(Sample<R> sample) {
        try {
            return decoder.decode(sample.getReference());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode " + sample.getReference(), e);
        }
    }

    private class Pass implements Iterator<DataBatch> {
        private final List<Sample<R>> order;
        private final int batches;
        private int cursor;

        Pass(List<Sample<R>> order, int batches) {
            this.order = order;
            this.batches = batches;
        }

        @Override
        public boolean hasNext() {
            return cursor < batches;
        }

        @Override
        public DataBatch next() {
            if (!hasNext())
                throw new NoSuchElementException("Pass finished after " + batches + " batches");
            int start = cursor * batchSize;
            int end = Math.min(start + batchSize, order.size());
            cursor++;
            return loadBatch(order, start, end);
        }
    }
}
