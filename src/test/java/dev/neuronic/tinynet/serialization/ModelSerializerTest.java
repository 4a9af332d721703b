package dev.neuronic.tinynet.serialization;

import dev.neuronic.tinynet.Model;
import dev.neuronic.tinynet.data.ArrayDatasetSource;
import dev.neuronic.tinynet.layers.DropoutLayer;
import dev.neuronic.tinynet.layers.LinearLayer;
import dev.neuronic.tinynet.layers.ReluLayer;
import dev.neuronic.tinynet.losses.CrossEntropyLoss;
import dev.neuronic.tinynet.losses.Reduction;
import dev.neuronic.tinynet.math.RandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelSerializerTest {

    @TempDir
    Path tempDir;

    private Model model;

    @BeforeEach
    void setUp() {
        RandomSource random = new RandomSource(21);
        model = new Model(List.of(new LinearLayer(2, 4, random), new ReluLayer(4), new DropoutLayer(0.1f, 4, random),
                                  new LinearLayer(4, 2, random)),
                          new CrossEntropyLoss(Reduction.MEAN));
        ArrayDatasetSource source = new ArrayDatasetSource(
            new float[][] {{1, 0}, {0, 1}, {1, 1}, {0, 0}}, new int[] {0, 1, 0, 1}, List.of("a", "b"), 0.5, false, random);
        model.train(source, 0.05f, 2, 2);
    }

    @Test
    void testCompressedRoundTrip() throws IOException {
        Path path = tempDir.resolve("model.zst");

        model.save(path);
        Model loaded = Model.load(path);

        assertEquals(model, loaded);
        assertEquals(2, loaded.getTotalEpochs());
        assertEquals(model.getTrainMetrics(), loaded.getTrainMetrics());
        assertEquals(model.getValidationMetrics(), loaded.getValidationMetrics());
    }

    @Test
    void testBinaryRoundTrip() throws IOException {
        Path path = tempDir.resolve("model.bin");

        ModelSerializer.save(model, path);
        Model loaded = ModelSerializer.load(path);

        assertEquals(model, loaded);
        float[][] input = {{0.3f, 0.7f}};
        model.setEval(true);
        loaded.setEval(true);
        assertArrayEquals(model.forward(input)[0], loaded.forward(input)[0]);
    }

    @Test
    void testUnsupportedExtension() {
        assertThrows(IllegalArgumentException.class, () -> model.save(tempDir.resolve("model.json")));
        assertThrows(IllegalArgumentException.class, () -> Model.load(tempDir.resolve("model.pkl")));
    }

    @Test
    void testWrongMagicNumber() throws IOException {
        Path path = tempDir.resolve("junk.bin");
        try (DataOutputStream out = new DataOutputStream(Files.newOutputStream(path))) {
            out.writeInt(0xCAFEBABE);
            out.writeInt(1);
            out.writeLong(0L);
        }
        IOException e = assertThrows(IOException.class, () -> Model.load(path));
        assertTrue(e.getMessage().contains("magic"));
    }

    @Test
    void testTruncatedFile() throws IOException {
        Path full = tempDir.resolve("full.bin");
        model.save(full);
        byte[] bytes = Files.readAllBytes(full);
        Path truncated = tempDir.resolve("truncated.bin");
        Files.write(truncated, java.util.Arrays.copyOf(bytes, bytes.length - 4));

        assertThrows(IOException.class, () -> Model.load(truncated));
    }
}
