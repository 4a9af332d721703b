package dev.neuronic.tinynet.data;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes an image file into grayscale intensities in {@code [0, 255]}, flattened row-major.
 */
public final class ImageSampleDecoder implements SampleDecoder<Path> {

    public static final ImageSampleDecoder INSTANCE = new ImageSampleDecoder();

    private ImageSampleDecoder() {}

    @Override
    public float[] decode(Path path) throws IOException {
        BufferedImage image;
        try (InputStream in = Files.newInputStream(path)) {
            image = ImageIO.read(in);
        }
        if (image == null)
            throw new IOException("No registered image reader can decode " + path);

        Raster raster = toGray(image).getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        float[] pixels = new float[width * height];
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                pixels[y * width + x] = raster.getSample(x, y, 0);
        return pixels;
    }

    private static BufferedImage toGray(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY)
            return image;
        BufferedImage gray = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return gray;
    }
}
