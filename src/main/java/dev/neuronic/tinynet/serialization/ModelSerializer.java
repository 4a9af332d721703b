package dev.neuronic.tinynet.serialization;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import dev.neuronic.tinynet.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Model files: the {@link Model#toMap()} tree in the tagged binary encoding of
 * {@link SerializationService}, framed by a header and an end marker.
 *
 * Features:
 * - Zstd compression for {@code .zst} files
 * - Plain binary for {@code .bin} files
 * - Version-aware header (magic number, format version, timestamp)
 */
public final class ModelSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ModelSerializer.class);

    // Compression level: 1=fast, 22=max compression, 3=good balance
    private static final int COMPRESSION_LEVEL = 3;
    private static final int BUFFER_SIZE = 64 * 1024;

    private ModelSerializer() {}

    /**
     * Save a model, choosing the medium from the file extension.
     *
     * @throws IllegalArgumentException if the extension is neither {@code .zst} nor {@code .bin}
     * @throws IOException if writing fails
     */
    public static void save(Model model, Path filePath) throws IOException {
        boolean compressed = isCompressed(filePath);
        try (OutputStream fileOut = Files.newOutputStream(filePath);
             BufferedOutputStream buffered = new BufferedOutputStream(fileOut, BUFFER_SIZE);
             OutputStream medium = compressed ? new ZstdOutputStream(buffered, COMPRESSION_LEVEL) : buffered;
             DataOutputStream out = new DataOutputStream(medium)) {

            writeHeader(out);
            SerializationService.writeMap(out, model.toMap());
            out.writeInt(SerializationConstants.SECTION_END);
        }
        LOG.debug("Saved model to {}", filePath);
    }

    /**
     * Load a model saved by {@link #save}.
     *
     * @throws IllegalArgumentException if the extension is neither {@code .zst} nor {@code .bin}
     * @throws IOException if reading fails or the file is not a valid model file
     */
    public static Model load(Path filePath) throws IOException {
        boolean compressed = isCompressed(filePath);
        Map<String, Object> attributes;
        try (InputStream fileIn = Files.newInputStream(filePath);
             BufferedInputStream buffered = new BufferedInputStream(fileIn, BUFFER_SIZE);
             InputStream medium = compressed ? new ZstdInputStream(buffered) : buffered;
             DataInputStream in = new DataInputStream(medium)) {

            validateHeader(in);
            attributes = SerializationService.readMap(in);

            int endMarker = in.readInt();
            if (endMarker != SerializationConstants.SECTION_END)
                throw new IOException("Invalid file format: missing end marker");
        }

        try {
            Model model = Model.fromMap(attributes);
            LOG.debug("Loaded model from {}", filePath);
            return model;
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid model data in " + filePath + ": " + e.getMessage(), e);
        }
    }

    private static boolean isCompressed(Path filePath) {
        String name = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(SerializationConstants.EXTENSION_COMPRESSED))
            return true;
        if (name.endsWith(SerializationConstants.EXTENSION_BINARY))
            return false;
        throw new IllegalArgumentException("File format of " + filePath.getFileName() + " not supported. Select from " +
                                         SerializationConstants.EXTENSION_COMPRESSED + " or " +
                                         SerializationConstants.EXTENSION_BINARY + ".");
    }

    private static void writeHeader(DataOutputStream out) throws IOException {
        out.writeInt(SerializationConstants.MAGIC_NUMBER);
        out.writeInt(SerializationConstants.CURRENT_VERSION);
        out.writeLong(System.currentTimeMillis()); // Timestamp
    }

    private static void validateHeader(DataInputStream in) throws IOException {
        int magic = in.readInt();
        if (magic != SerializationConstants.MAGIC_NUMBER)
            throw new IOException("Invalid file format: wrong magic number");

        int version = in.readInt();
        if (version > SerializationConstants.CURRENT_VERSION)
            throw new IOException("Unsupported file version: " + version +
                                " (current version: " + SerializationConstants.CURRENT_VERSION + ")");

        in.readLong(); // Timestamp, informational only
    }
}
