package dev.neuronic.tinynet.layers;

import dev.neuronic.tinynet.math.NetMath;
import dev.neuronic.tinynet.serialization.SerializationService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rectified linear unit: y = max(0, x).
 *
 * <p>Parameter-free. The gradient passes through where the cached input was positive and is
 * zero elsewhere (including at exactly zero).
 */
public class ReluLayer implements Layer {

    public static final String CLASS_NAME = "ReluLayer";

    private final int size;
    private LayerContext context;

    public ReluLayer(int size) {
        if (size <= 0)
            throw new IllegalArgumentException("Size must be positive: " + size);
        this.size = size;
    }

    @Override
    public LayerContext forward(float[][] input) {
        LayerChecks.requireBatch(input, size, CLASS_NAME);

        float[][] outputs = new float[input.length][size];
        for (int b = 0; b < input.length; b++)
            for (int i = 0; i < size; i++)
                outputs[b][i] = Math.max(0.0f, input[b][i]);

        float[][] cached = NetMath.matrixCopy(input);
        context = new LayerContext(cached, cached, outputs);
        return context;
    }

    @Override
    public float[][] update(float[][] outputGradient, float learningRate) {
        LayerContext ctx = LayerChecks.requireContext(context, CLASS_NAME);
        LayerChecks.requireGradient(outputGradient, ctx.batchSize(), size, CLASS_NAME);

        float[][] inputGradients = new float[outputGradient.length][size];
        for (int b = 0; b < outputGradient.length; b++) {
            float[] x = ctx.inputs()[b];
            for (int i = 0; i < size; i++)
                inputGradients[b][i] = x[i] > 0.0f ? outputGradient[b][i] : 0.0f;
        }
        return inputGradients;
    }

    @Override
    public int getInputSize() {
        return size;
    }

    @Override
    public int getOutputSize() {
        return size;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CLASS_KEY, CLASS_NAME);
        map.put("size", size);
        return map;
    }

    public static ReluLayer fromMap(Map<String, Object> map) {
        SerializationService.requireClass(map, CLASS_NAME);
        return new ReluLayer(SerializationService.getInt(map, "size"));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReluLayer && ((ReluLayer) o).size == size;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(size);
    }

    @Override
    public String toString() {
        return CLASS_NAME + "(" + size + ")";
    }
}
