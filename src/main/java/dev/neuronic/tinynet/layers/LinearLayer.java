package dev.neuronic.tinynet.layers;

import dev.neuronic.tinynet.WeightInitStrategy;
import dev.neuronic.tinynet.math.NetMath;
import dev.neuronic.tinynet.math.RandomSource;
import dev.neuronic.tinynet.serialization.SerializationService;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully connected layer: y = x · W + b.
 *
 * <p>Weights are stored {@code weights[input][output]} so a batch row multiplies straight into
 * the weight rows. On {@link #update} the layer computes
 * <ul>
 *   <li>dW = xᵀ · g (summed over the batch, no extra averaging)</li>
 *   <li>db = column sums of g</li>
 *   <li>dx = g · Wᵀ, using the weights from before this step</li>
 * </ul>
 * then applies {@code param -= learningRate * grad} in place and returns dx.
 */
public class LinearLayer implements Layer {

    public static final String CLASS_NAME = "LinearLayer";

    protected final float[][] weights; // weights[input][output]
    protected final float[] bias;
    protected final int inChannels;
    protected final int outChannels;

    private LayerContext context;

    /**
     * Create a layer with LeCun-initialized weights and zero bias.
     */
    public LinearLayer(int inChannels, int outChannels, RandomSource random) {
        this(inChannels, outChannels, WeightInitStrategy.LECUN, random);
    }

    public LinearLayer(int inChannels, int outChannels, long seed) {
        this(inChannels, outChannels, WeightInitStrategy.LECUN, new RandomSource(seed));
    }

    public LinearLayer(int inChannels, int outChannels, WeightInitStrategy initStrategy, RandomSource random) {
        validateChannels(inChannels, outChannels);
        this.inChannels = inChannels;
        this.outChannels = outChannels;
        this.weights = new float[inChannels][outChannels];
        this.bias = new float[outChannels];

        switch (initStrategy) {
            case LECUN -> NetMath.weightInitLecun(weights, inChannels, random);
            case XAVIER -> NetMath.weightInitXavier(weights, inChannels, outChannels, random);
            case HE -> NetMath.weightInitHe(weights, inChannels, random);
        }
    }

    /**
     * Create a layer holding copies of the given parameters.
     */
    public LinearLayer(float[][] weights, float[] bias) {
        validateChannels(weights.length, bias.length);
        this.inChannels = weights.length;
        this.outChannels = bias.length;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i].length != outChannels)
                throw new IllegalArgumentException("Weight row " + i + " has " + weights[i].length +
                                                 " columns, expected " + outChannels);
        }
        this.weights = NetMath.matrixCopy(weights);
        this.bias = bias.clone();
    }

    private static void validateChannels(int inChannels, int outChannels) {
        if (inChannels <= 0)
            throw new IllegalArgumentException("in_channels must be positive: " + inChannels);
        if (outChannels <= 0)
            throw new IllegalArgumentException("out_channels must be positive: " + outChannels);
    }

    @Override
    public LayerContext forward(float[][] input) {
        LayerChecks.requireBatch(input, inChannels, CLASS_NAME);

        float[][] preActivations = NetMath.matrixPreActivations(input, weights, bias);
        context = new LayerContext(NetMath.matrixCopy(input), preActivations, preActivations);
        return context;
    }

    @Override
    public float[][] update(float[][] outputGradient, float learningRate) {
        LayerContext ctx = LayerChecks.requireContext(context, CLASS_NAME);
        LayerChecks.requireGradient(outputGradient, ctx.batchSize(), outChannels, CLASS_NAME);
        LayerChecks.requireLearningRate(learningRate);

        float[][] weightGradients = NetMath.matrixWeightGradients(ctx.inputs(), outputGradient);
        float[] biasGradients = NetMath.matrixColumnSum(outputGradient);
        float[][] inputGradients = NetMath.matrixInputGradients(outputGradient, weights);

        NetMath.parameterUpdate(weights, weightGradients, learningRate);
        NetMath.parameterUpdate(bias, biasGradients, learningRate);

        return inputGradients;
    }

    @Override
    public int getInputSize() {
        return inChannels;
    }

    @Override
    public int getOutputSize() {
        return outChannels;
    }

    /**
     * @return a copy of the weight matrix, [inChannels][outChannels]
     */
    public float[][] getWeights() {
        return NetMath.matrixCopy(weights);
    }

    /**
     * @return a copy of the bias vector
     */
    public float[] getBias() {
        return bias.clone();
    }

    /**
     * Set a specific weight for testing purposes.
     */
    public void setWeight(int input, int output, float value) {
        weights[input][output] = value;
    }

    /**
     * Set a specific bias for testing purposes.
     */
    public void setBias(int index, float value) {
        bias[index] = value;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CLASS_KEY, CLASS_NAME);
        map.put("in_channels", inChannels);
        map.put("out_channels", outChannels);
        map.put("weights", SerializationService.toList(weights));
        map.put("bias", SerializationService.toList(bias));
        return map;
    }

    /**
     * Rebuild a layer from {@link #toMap()} output.
     *
     * @throws IllegalArgumentException on a mismatched discriminator or inconsistent shapes
     */
    public static LinearLayer fromMap(Map<String, Object> map) {
        SerializationService.requireClass(map, CLASS_NAME);
        int inChannels = SerializationService.getInt(map, "in_channels");
        int outChannels = SerializationService.getInt(map, "out_channels");
        float[][] weights = SerializationService.toFloatMatrix(SerializationService.require(map, "weights"));
        float[] bias = SerializationService.toFloatArray(SerializationService.require(map, "bias"));

        if (weights.length != inChannels || bias.length != outChannels)
            throw new IllegalArgumentException("Stored parameters do not match " + inChannels + "x" + outChannels);
        return new LinearLayer(weights, bias);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearLayer)) return false;
        LinearLayer other = (LinearLayer) o;
        return inChannels == other.inChannels
            && outChannels == other.outChannels
            && Arrays.deepEquals(weights, other.weights)
            && Arrays.equals(bias, other.bias);
    }

    @Override
    public int hashCode() {
        int result = 31 * inChannels + outChannels;
        result = 31 * result + Arrays.deepHashCode(weights);
        return 31 * result + Arrays.hashCode(bias);
    }

    @Override
    public String toString() {
        return CLASS_NAME + "(" + inChannels + " -> " + outChannels + ")";
    }
}
