package dev.neuronic.tinynet;

import dev.neuronic.tinynet.data.DataBatch;
import dev.neuronic.tinynet.data.DatasetIterator;
import dev.neuronic.tinynet.data.DatasetSource;
import dev.neuronic.tinynet.layers.Layer;
import dev.neuronic.tinynet.losses.Loss;
import dev.neuronic.tinynet.math.NetMath;
import dev.neuronic.tinynet.math.RandomSource;
import dev.neuronic.tinynet.serialization.MapSerializable;
import dev.neuronic.tinynet.serialization.ModelSerializer;
import dev.neuronic.tinynet.serialization.SerializationService;
import dev.neuronic.tinynet.training.ConfusionMatrix;
import dev.neuronic.tinynet.training.EpochReport;
import dev.neuronic.tinynet.training.Metric;
import dev.neuronic.tinynet.training.TrainingCallback;
import dev.neuronic.tinynet.training.TrainingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A strictly sequential chain of layers trained with plain SGD against a single loss.
 *
 * <p><b>Training step:</b> forward through every layer, record the argmax predictions, compute
 * the loss, take its gradient and hand it to the layers in reverse order. Each layer updates its
 * own parameters and returns the gradient for the layer below.
 *
 * <pre>{@code
 * Model model = new Model(
 *     List.of(new LinearLayer(784, 128, random), new ReluLayer(128), new LinearLayer(128, 10, random)),
 *     new CrossEntropyLoss(Reduction.MEAN));
 *
 * DatasetSource<Path> mnist = new ImageFolderSource(root, 0.8, true, random,
 *                                                   List.of(Transforms.scale(1f / 255f)));
 * model.train(mnist, 0.01f, 32, 10);
 * model.save(Path.of("mnist.zst"));
 * }</pre>
 *
 * <p><b>Metric histories:</b> one list per tracked metric, one value appended per epoch for the
 * train pass and, when the source has test samples, for the validation pass. Class-wise metrics
 * record their macro average.
 */
public class Model implements MapSerializable {

    public static final String CLASS_NAME = "Model";

    private static final Logger LOG = LoggerFactory.getLogger(Model.class);

    private final List<Layer> layers;
    private final Loss loss;
    private final Map<String, List<Double>> trainMetrics;
    private final Map<String, List<Double>> validationMetrics;
    private int totalEpochs;
    private boolean eval;

    /**
     * Create an untrained model tracking loss and accuracy.
     *
     * @throws IllegalArgumentException if the layer list is empty, holds a null, or adjacent
     *         layers disagree on their width
     */
    public Model(List<Layer> layers, Loss loss) {
        this(layers, loss, 0, null, null);
    }

    /**
     * @param totalEpochs epochs already trained, at least 0
     * @param trainMetrics train history keyed by metric name, or null for loss and accuracy
     * @param validationMetrics validation history keyed by metric name, or null for loss and accuracy
     */
    public Model(List<Layer> layers, Loss loss, int totalEpochs, Map<String, List<Double>> trainMetrics,
                 Map<String, List<Double>> validationMetrics) {
        if (layers == null || layers.isEmpty())
            throw new IllegalArgumentException("layers cannot be an empty list.");
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i) == null)
                throw new IllegalArgumentException("Invalid layer at index " + i + ". Expected all list elements to be layers.");
        }
        for (int i = 1; i < layers.size(); i++) {
            Layer previous = layers.get(i - 1);
            Layer current = layers.get(i);
            if (previous.getOutputSize() != current.getInputSize())
                throw new IllegalArgumentException("Layer " + (i - 1) + " outputs " + previous.getOutputSize() +
                                                 " features but layer " + i + " expects " + current.getInputSize());
        }
        if (loss == null)
            throw new IllegalArgumentException("loss cannot be null.");
        if (totalEpochs < 0)
            throw new IllegalArgumentException("total epochs must be >= 0: " + totalEpochs);

        this.layers = List.copyOf(layers);
        this.loss = loss;
        this.totalEpochs = totalEpochs;
        this.trainMetrics = copyHistory(trainMetrics, "train");
        this.validationMetrics = copyHistory(validationMetrics, "validation");
    }

    /**
     * An empty history tracking the given metrics, for the full constructor.
     */
    public static Map<String, List<Double>> history(Metric... metrics) {
        Map<String, List<Double>> history = new LinkedHashMap<>();
        for (Metric metric : metrics)
            history.put(metric.getName(), new ArrayList<>());
        return history;
    }

    private static Map<String, List<Double>> copyHistory(Map<String, List<Double>> source, String kind) {
        if (source == null)
            return history(Metric.LOSS, Metric.ACCURACY);

        Map<String, List<Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : source.entrySet()) {
            try {
                Metric.fromName(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("An invalid metric was provided to " + kind + " metrics: " +
                                                 entry.getKey(), e);
            }
            if (entry.getValue() == null)
                throw new IllegalArgumentException("All " + kind + " metric histories must be a list.");
            copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    // ===============================
    // INFERENCE
    // ===============================

    /**
     * Run the batch through every layer.
     *
     * @return output of the last layer (the logits)
     */
    public float[][] forward(float[][] input) {
        float[][] output = input;
        for (Layer layer : layers)
            output = layer.forward(output).outputs();
        return output;
    }

    /**
     * Predicted class per row.
     */
    public int[] predict(float[][] input) {
        return NetMath.argmaxRows(forward(input));
    }

    public boolean isEval() {
        return eval;
    }

    /**
     * Switch every layer between training and evaluation behavior. Setting the current value does nothing.
     */
    public void setEval(boolean eval) {
        if (this.eval == eval)
            return;
        for (Layer layer : layers)
            layer.setEval(eval);
        this.eval = eval;
    }

    // ===============================
    // TRAINING
    // ===============================

    /**
     * Train for {@code epochs} epochs, shuffling the train subset and validating on the test
     * subset after each epoch when it has samples.
     *
     * @throws IllegalArgumentException if the learning rate is not positive, the batch size is
     *         not positive or the epoch count is negative
     */
    public void train(DatasetSource<?> source, float learningRate, int batchSize, int epochs) {
        train(source, TrainingConfig.builder()
            .learningRate(learningRate)
            .batchSize(batchSize)
            .epochs(epochs)
            .build());
    }

    public void train(DatasetSource<?> source, TrainingConfig config, TrainingCallback... callbacks) {
        if (source == null)
            throw new IllegalArgumentException("source cannot be null.");
        if (config == null)
            throw new IllegalArgumentException("config cannot be null.");

        List<TrainingCallback> listeners = Arrays.asList(callbacks);
        RandomSource random = config.randomSeed == null ? null : new RandomSource(config.randomSeed);
        int numClasses = layers.get(layers.size() - 1).getOutputSize();
        List<String> classNames = source.getClasses();

        LOG.info("Training for {} epochs on {} train / {} test samples ({} classes)", config.epochs,
                 source.getTrainSamples().size(), source.getTestSamples().size(), numClasses);
        for (TrainingCallback callback : listeners)
            callback.onTrainingStart(this, config);

        for (int epoch = 0; epoch < config.epochs; epoch++) {
            DatasetIterator<?> trainData = random == null
                ? source.iterator(DatasetSource.TRAIN, config.batchSize, config.dropLast, config.shuffle)
                : source.iterator(DatasetSource.TRAIN, config.batchSize, config.dropLast, config.shuffle, random);

            ConfusionMatrix trainMatrix = new ConfusionMatrix(numClasses);
            double totalLoss = 0.0;
            int batches = 0;
            for (DataBatch batch : trainData) {
                float batchLoss = trainStep(batch, config.learningRate, trainMatrix);
                totalLoss += batchLoss;
                batches++;
                LOG.debug("Epoch {} batch {}/{} loss {}", epoch + 1, batches, trainData.length(), batchLoss);
            }
            double trainLoss = batches == 0 ? Double.NaN : totalLoss / batches;
            recordMetrics(trainMetrics, trainMatrix, trainLoss);
            LOG.info("Epoch {}/{} train loss {} accuracy {}", epoch + 1, config.epochs, trainLoss, trainMatrix.accuracy());
            notify(listeners, new EpochReport(EpochReport.Phase.TRAIN, epoch, config.epochs, trainMatrix, trainLoss,
                                              batches, classNames));

            DatasetIterator<?> testData = source.iterator(DatasetSource.TEST, config.batchSize, false, false);
            if (testData.length() == 0)
                continue;

            ConfusionMatrix validationMatrix = new ConfusionMatrix(numClasses);
            double validationLoss;
            try {
                setEval(true);
                double total = 0.0;
                for (DataBatch batch : testData)
                    total += evaluateStep(batch, validationMatrix);
                validationLoss = total / testData.length();
            } finally {
                setEval(false);
            }
            recordMetrics(validationMetrics, validationMatrix, validationLoss);
            LOG.info("Epoch {}/{} validation loss {} accuracy {}", epoch + 1, config.epochs, validationLoss,
                     validationMatrix.accuracy());
            notify(listeners, new EpochReport(EpochReport.Phase.VALIDATION, epoch, config.epochs, validationMatrix,
                                              validationLoss, testData.length(), classNames));
        }

        totalEpochs += config.epochs;
        LOG.info("Training finished, {} epochs total", totalEpochs);
        for (TrainingCallback callback : listeners)
            callback.onTrainingEnd(this);
    }

    /**
     * Forward, loss and backward over one batch, updating every layer.
     *
     * @return the batch loss
     */
    float trainStep(DataBatch batch, float learningRate, ConfusionMatrix matrix) {
        float batchLoss = lossWithConfusionMatrix(batch, matrix);
        float[][] grad = loss.backward();
        for (int i = layers.size() - 1; i >= 0; i--)
            grad = layers.get(i).update(grad, learningRate);
        return batchLoss;
    }

    float evaluateStep(DataBatch batch, ConfusionMatrix matrix) {
        return lossWithConfusionMatrix(batch, matrix);
    }

    private float lossWithConfusionMatrix(DataBatch batch, ConfusionMatrix matrix) {
        float[][] logits = forward(batch.getInputs());
        matrix.add(NetMath.argmaxRows(logits), batch.getLabels());
        return loss.forward(logits, batch.getLabels());
    }

    private static void recordMetrics(Map<String, List<Double>> history, ConfusionMatrix matrix, double loss) {
        for (Map.Entry<String, List<Double>> entry : history.entrySet())
            entry.getValue().add(Metric.fromName(entry.getKey()).compute(matrix, loss));
    }

    private static void notify(List<TrainingCallback> callbacks, EpochReport report) {
        for (TrainingCallback callback : callbacks)
            callback.onEpochEnd(report);
    }

    // ===============================
    // ACCESSORS
    // ===============================

    public List<Layer> getLayers() {
        return layers;
    }

    public Loss getLoss() {
        return loss;
    }

    public int getTotalEpochs() {
        return totalEpochs;
    }

    /**
     * Read-only view of the train history.
     */
    public Map<String, List<Double>> getTrainMetrics() {
        return readOnly(trainMetrics);
    }

    /**
     * Read-only view of the validation history.
     */
    public Map<String, List<Double>> getValidationMetrics() {
        return readOnly(validationMetrics);
    }

    private static Map<String, List<Double>> readOnly(Map<String, List<Double>> history) {
        Map<String, List<Double>> view = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : history.entrySet())
            view.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
        return Collections.unmodifiableMap(view);
    }

    // ===============================
    // SERIALIZATION
    // ===============================

    @Override
    public Map<String, Object> toMap() {
        List<Object> layerMaps = new ArrayList<>(layers.size());
        for (Layer layer : layers)
            layerMaps.add(layer.toMap());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CLASS_KEY, CLASS_NAME);
        map.put("layers", layerMaps);
        map.put("loss", loss.toMap());
        map.put("epochs", totalEpochs);
        map.put("train_metrics", historyToMap(trainMetrics));
        map.put("validation_metrics", historyToMap(validationMetrics));
        return map;
    }

    private static Map<String, Object> historyToMap(Map<String, List<Double>> history) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : history.entrySet())
            map.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        return map;
    }

    /**
     * Rebuild a model from {@link #toMap()} output.
     *
     * @throws IllegalArgumentException if the discriminator is not {@code "Model"} or any nested
     *         map is invalid
     */
    @SuppressWarnings("unchecked")
    public static Model fromMap(Map<String, Object> map) {
        SerializationService.requireClass(map, CLASS_NAME);

        List<Layer> layers = new ArrayList<>();
        for (Object layerMap : SerializationService.getList(map, "layers")) {
            if (!(layerMap instanceof Map))
                throw new IllegalArgumentException("Layer attributes must be a map, got " + layerMap);
            layers.add(SerializationService.layerFromMap((Map<String, Object>) layerMap));
        }
        Loss loss = SerializationService.lossFromMap(SerializationService.getMap(map, "loss"));
        int epochs = SerializationService.getInt(map, "epochs");

        return new Model(layers, loss, epochs,
                         SerializationService.toHistory(SerializationService.require(map, "train_metrics")),
                         SerializationService.toHistory(SerializationService.require(map, "validation_metrics")));
    }

    /**
     * Save to a {@code .zst} (compressed) or {@code .bin} file.
     */
    public void save(Path path) throws IOException {
        ModelSerializer.save(this, path);
    }

    public static Model load(Path path) throws IOException {
        return ModelSerializer.load(path);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Model)) return false;
        Model other = (Model) o;
        return layers.equals(other.layers) && loss.equals(other.loss);
    }

    @Override
    public int hashCode() {
        return 31 * layers.hashCode() + loss.hashCode();
    }

    @Override
    public String toString() {
        return CLASS_NAME + layers + " -> " + loss;
    }
}
