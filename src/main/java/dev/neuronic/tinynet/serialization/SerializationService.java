package dev.neuronic.tinynet.serialization;

import dev.neuronic.tinynet.layers.DropoutLayer;
import dev.neuronic.tinynet.layers.Layer;
import dev.neuronic.tinynet.layers.LinearLayer;
import dev.neuronic.tinynet.layers.ReluLayer;
import dev.neuronic.tinynet.losses.CrossEntropyLoss;
import dev.neuronic.tinynet.losses.Loss;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type dispatch and value conversion for {@link MapSerializable} maps, plus the binary
 * encoding used by {@link ModelSerializer}.
 */
public final class SerializationService {

    private SerializationService() {}

    // ===============================
    // TYPE DISPATCH
    // ===============================

    /**
     * Rebuild a layer from its map, dispatching on the class discriminator.
     */
    public static Layer layerFromMap(Map<String, Object> map) {
        String className = getString(map, MapSerializable.CLASS_KEY);
        return switch (className) {
            case LinearLayer.CLASS_NAME -> LinearLayer.fromMap(map);
            case ReluLayer.CLASS_NAME -> ReluLayer.fromMap(map);
            case DropoutLayer.CLASS_NAME -> DropoutLayer.fromMap(map);
            default -> throw new IllegalArgumentException("Unknown layer class: " + className);
        };
    }

    /**
     * Rebuild a loss from its map, dispatching on the class discriminator.
     */
    public static Loss lossFromMap(Map<String, Object> map) {
        String className = getString(map, MapSerializable.CLASS_KEY);
        return switch (className) {
            case CrossEntropyLoss.CLASS_NAME -> CrossEntropyLoss.fromMap(map);
            default -> throw new IllegalArgumentException("Unknown loss class: " + className);
        };
    }

    /**
     * @throws IllegalArgumentException if the map's discriminator is not {@code expected}
     */
    public static void requireClass(Map<String, Object> map, String expected) {
        Object actual = map.get(MapSerializable.CLASS_KEY);
        if (!expected.equals(actual))
            throw new IllegalArgumentException("Invalid class value in attributes. Expected " + expected +
                                             ", got " + actual + ".");
    }

    // ===============================
    // VALUE CONVERSION
    // ===============================

    public static Object require(Map<String, Object> map, String key) {
        if (!map.containsKey(key))
            throw new IllegalArgumentException("Missing attribute: " + key);
        return map.get(key);
    }

    public static String getString(Map<String, Object> map, String key) {
        Object value = require(map, key);
        if (!(value instanceof String))
            throw new IllegalArgumentException("Attribute " + key + " must be a string, got " + describe(value));
        return (String) value;
    }

    public static int getInt(Map<String, Object> map, String key) {
        Object value = require(map, key);
        if (!(value instanceof Integer) && !(value instanceof Long))
            throw new IllegalArgumentException("Attribute " + key + " must be an integer, got " + describe(value));
        return Math.toIntExact(((Number) value).longValue());
    }

    public static double getDouble(Map<String, Object> map, String key) {
        Object value = require(map, key);
        if (!(value instanceof Number))
            throw new IllegalArgumentException("Attribute " + key + " must be a number, got " + describe(value));
        return ((Number) value).doubleValue();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = require(map, key);
        if (!(value instanceof Map))
            throw new IllegalArgumentException("Attribute " + key + " must be a map, got " + describe(value));
        return (Map<String, Object>) value;
    }

    public static List<?> getList(Map<String, Object> map, String key) {
        Object value = require(map, key);
        if (!(value instanceof List))
            throw new IllegalArgumentException("Attribute " + key + " must be a list, got " + describe(value));
        return (List<?>) value;
    }

    public static List<Double> toList(float[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (float value : values)
            list.add((double) value);
        return list;
    }

    public static List<List<Double>> toList(float[][] values) {
        List<List<Double>> list = new ArrayList<>(values.length);
        for (float[] row : values)
            list.add(toList(row));
        return list;
    }

    public static float[] toFloatArray(Object value) {
        if (!(value instanceof List))
            throw new IllegalArgumentException("Expected a list of numbers, got " + describe(value));
        List<?> list = (List<?>) value;
        float[] result = new float[list.size()];
        for (int i = 0; i < result.length; i++) {
            Object element = list.get(i);
            if (!(element instanceof Number))
                throw new IllegalArgumentException("Expected a number at index " + i + ", got " + describe(element));
            result[i] = ((Number) element).floatValue();
        }
        return result;
    }

    public static float[][] toFloatMatrix(Object value) {
        if (!(value instanceof List))
            throw new IllegalArgumentException("Expected a list of rows, got " + describe(value));
        List<?> rows = (List<?>) value;
        float[][] result = new float[rows.size()][];
        for (int i = 0; i < result.length; i++)
            result[i] = toFloatArray(rows.get(i));
        return result;
    }

    /**
     * Convert a metric history map into mutable {@code Map<String, List<Double>>} form.
     */
    public static Map<String, List<Double>> toHistory(Object value) {
        if (!(value instanceof Map))
            throw new IllegalArgumentException("Expected a metric history map, got " + describe(value));
        Map<String, List<Double>> history = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getValue() instanceof List))
                throw new IllegalArgumentException("All metric histories must be a list.");
            List<Double> values = new ArrayList<>();
            for (Object element : (List<?>) entry.getValue()) {
                if (!(element instanceof Number))
                    throw new IllegalArgumentException("Metric history for " + entry.getKey() + " holds " + describe(element));
                values.add(((Number) element).doubleValue());
            }
            history.put(String.valueOf(entry.getKey()), values);
        }
        return history;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    // ===============================
    // BINARY ENCODING
    // ===============================

    /**
     * Write a map tree as tagged binary values.
     */
    public static void writeMap(DataOutputStream out, Map<String, Object> map) throws IOException {
        out.writeInt(map.size());
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            out.writeUTF(entry.getKey());
            writeValue(out, entry.getValue());
        }
    }

    /**
     * Read a map tree written by {@link #writeMap}.
     */
    public static Map<String, Object> readMap(DataInputStream in) throws IOException {
        int size = in.readInt();
        if (size < 0)
            throw new IOException("Corrupt map size: " + size);
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            String key = in.readUTF();
            map.put(key, readValue(in));
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private static void writeValue(DataOutputStream out, Object value) throws IOException {
        if (value == null) {
            out.writeByte(SerializationConstants.TAG_NULL);
        } else if (value instanceof String) {
            out.writeByte(SerializationConstants.TAG_STRING);
            out.writeUTF((String) value);
        } else if (value instanceof Integer) {
            out.writeByte(SerializationConstants.TAG_INT);
            out.writeInt((Integer) value);
        } else if (value instanceof Long) {
            out.writeByte(SerializationConstants.TAG_LONG);
            out.writeLong((Long) value);
        } else if (value instanceof Double || value instanceof Float) {
            out.writeByte(SerializationConstants.TAG_DOUBLE);
            out.writeDouble(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            out.writeByte(SerializationConstants.TAG_BOOLEAN);
            out.writeBoolean((Boolean) value);
        } else if (value instanceof List && isNumericList((List<?>) value)) {
            // Weight rows dominate file size, so numeric lists skip the per-element tag
            List<?> list = (List<?>) value;
            out.writeByte(SerializationConstants.TAG_DOUBLE_ARRAY);
            out.writeInt(list.size());
            for (Object element : list)
                out.writeDouble(((Number) element).doubleValue());
        } else if (value instanceof List) {
            List<?> list = (List<?>) value;
            out.writeByte(SerializationConstants.TAG_LIST);
            out.writeInt(list.size());
            for (Object element : list)
                writeValue(out, element);
        } else if (value instanceof Map) {
            out.writeByte(SerializationConstants.TAG_MAP);
            writeMap(out, (Map<String, Object>) value);
        } else {
            throw new IllegalArgumentException("Unsupported attribute type: " + value.getClass().getName());
        }
    }

    private static Object readValue(DataInputStream in) throws IOException {
        byte tag = in.readByte();
        switch (tag) {
            case SerializationConstants.TAG_NULL:
                return null;
            case SerializationConstants.TAG_STRING:
                return in.readUTF();
            case SerializationConstants.TAG_INT:
                return in.readInt();
            case SerializationConstants.TAG_LONG:
                return in.readLong();
            case SerializationConstants.TAG_DOUBLE:
                return in.readDouble();
            case SerializationConstants.TAG_BOOLEAN:
                return in.readBoolean();
            case SerializationConstants.TAG_DOUBLE_ARRAY: {
                int size = readSize(in);
                List<Double> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++)
                    list.add(in.readDouble());
                return list;
            }
            case SerializationConstants.TAG_LIST: {
                int size = readSize(in);
                List<Object> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++)
                    list.add(readValue(in));
                return list;
            }
            case SerializationConstants.TAG_MAP:
                return readMap(in);
            default:
                throw new IOException("Unknown value tag: " + tag);
        }
    }

    private static int readSize(DataInputStream in) throws IOException {
        int size = in.readInt();
        if (size < 0)
            throw new IOException("Corrupt list size: " + size);
        return size;
    }

    private static boolean isNumericList(List<?> list) {
        if (list.isEmpty())
            return false;
        for (Object element : list)
            if (!(element instanceof Double) && !(element instanceof Float))
                return false;
        return true;
    }
}
