package dev.neuronic.tinynet.serialization;

import dev.neuronic.tinynet.layers.Layer;
import dev.neuronic.tinynet.layers.ReluLayer;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SerializationServiceTest {

    @Test
    void testBinaryEncodingPreservesValueTypes() throws IOException {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("flag", true);
        nested.put("empty", new ArrayList<>());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "net");
        map.put("count", 3);
        map.put("big", 1L << 40);
        map.put("ratio", 0.1);
        map.put("missing", null);
        map.put("values", List.of(1.5, Double.NaN, -2.0));
        map.put("mixed", List.of("a", 1));
        map.put("nested", nested);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            SerializationService.writeMap(out, map);
        }
        Map<String, Object> read;
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            read = SerializationService.readMap(in);
        }

        assertEquals(map, read);
        assertEquals(List.of("name", "count", "big", "ratio", "missing", "values", "mixed", "nested"),
                     new ArrayList<>(read.keySet()));
    }

    @Test
    void testUnsupportedValueType() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("bad", new Object());
        assertThrows(IllegalArgumentException.class,
            () -> SerializationService.writeMap(new DataOutputStream(new ByteArrayOutputStream()), map));
    }

    @Test
    void testLayerDispatch() {
        Layer layer = SerializationService.layerFromMap(new ReluLayer(3).toMap());
        assertEquals(new ReluLayer(3), layer);

        Map<String, Object> unknown = new LinkedHashMap<>();
        unknown.put("class", "Conv2dLayer");
        assertThrows(IllegalArgumentException.class, () -> SerializationService.layerFromMap(unknown));
        assertThrows(IllegalArgumentException.class, () -> SerializationService.lossFromMap(unknown));
    }

    @Test
    void testAccessorsValidateTypes() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("size", "three");
        assertThrows(IllegalArgumentException.class, () -> SerializationService.getInt(map, "size"));
        assertThrows(IllegalArgumentException.class, () -> SerializationService.getString(map, "absent"));
        assertThrows(IllegalArgumentException.class, () -> SerializationService.toFloatArray(List.of("x")));
        assertThrows(IllegalArgumentException.class, () -> SerializationService.toHistory(Map.of("loss", 1.0)));
    }
}
