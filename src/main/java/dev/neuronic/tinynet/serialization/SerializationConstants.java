package dev.neuronic.tinynet.serialization;

/**
 * Constants for the tinynet model file format.
 */
public final class SerializationConstants {

    // File format identification
    public static final int MAGIC_NUMBER = 0x544E4E4D; // "TNNM" - TinyNet Neural Model
    public static final int CURRENT_VERSION = 1;

    // File extensions selecting the medium
    public static final String EXTENSION_COMPRESSED = ".zst";
    public static final String EXTENSION_BINARY = ".bin";

    // Value tags for the binary map encoding
    public static final byte TAG_NULL = 0;
    public static final byte TAG_STRING = 1;
    public static final byte TAG_INT = 2;
    public static final byte TAG_LONG = 3;
    public static final byte TAG_DOUBLE = 4;
    public static final byte TAG_BOOLEAN = 5;
    public static final byte TAG_LIST = 6;
    public static final byte TAG_MAP = 7;
    public static final byte TAG_DOUBLE_ARRAY = 8;

    // File structure markers
    public static final int SECTION_END = 0x1999;

    private SerializationConstants() {} // Prevent instantiation
}
