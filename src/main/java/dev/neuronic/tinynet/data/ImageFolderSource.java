package dev.neuronic.tinynet.data;

import dev.neuronic.tinynet.math.RandomSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Image dataset laid out one directory per class:
 *
 * <pre>
 * root/
 *   cat/  a.png  nested/b.png
 *   dog/  c.png
 * </pre>
 *
 * <p>Every immediate subdirectory of the root is a class; its images are collected recursively
 * at any depth and filtered by a case-insensitive extension set. Files directly under the root
 * belong to no class and are ignored. Paths are sorted before the split so discovery does not
 * depend on file system order.
 */
public class ImageFolderSource extends DatasetSource<Path> {

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(".png");

    private final Path root;

    public ImageFolderSource(Path root, double trainFraction, boolean shuffle, RandomSource random) {
        this(root, trainFraction, shuffle, random, List.of(), DEFAULT_EXTENSIONS);
    }

    public ImageFolderSource(Path root, double trainFraction, boolean shuffle, RandomSource random,
                             List<SampleTransform> preprocessing) {
        this(root, trainFraction, shuffle, random, preprocessing, DEFAULT_EXTENSIONS);
    }

    public ImageFolderSource(Path root, double trainFraction, boolean shuffle, RandomSource random,
                             List<SampleTransform> preprocessing, Set<String> extensions) {
        this(root, Discovery.scan(root, extensions), trainFraction, shuffle, random, preprocessing);
    }

    private ImageFolderSource(Path root, Discovery discovery, double trainFraction, boolean shuffle,
                              RandomSource random, List<SampleTransform> preprocessing) {
        super(discovery.samples, discovery.classes, trainFraction, shuffle, random, ImageSampleDecoder.INSTANCE,
              preprocessing);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    private static final class Discovery {
        final List<String> classes;
        final List<Sample<Path>> samples;

        private Discovery(List<String> classes, List<Sample<Path>> samples) {
            this.classes = classes;
            this.samples = samples;
        }

        static Discovery scan(Path root, Set<String> extensions) {
            if (root == null || !Files.isDirectory(root))
                throw new IllegalArgumentException("Dataset root is not a directory: " + root);
            if (extensions == null || extensions.isEmpty())
                throw new IllegalArgumentException("At least one file extension is required");
            Set<String> suffixes = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

            try {
                List<Path> classDirs;
                try (Stream<Path> children = Files.list(root)) {
                    classDirs = children.filter(Files::isDirectory).sorted().collect(Collectors.toList());
                }

                List<String> classes = new ArrayList<>(classDirs.size());
                for (Path dir : classDirs)
                    classes.add(dir.getFileName().toString());
                Collections.sort(classes);

                List<Path> files;
                try (Stream<Path> walk = Files.walk(root)) {
                    files = walk.filter(Files::isRegularFile)
                        .filter(p -> !p.getParent().equals(root))
                        .filter(p -> hasExtension(p, suffixes))
                        .sorted()
                        .collect(Collectors.toList());
                }

                List<Sample<Path>> samples = new ArrayList<>(files.size());
                for (Path file : files) {
                    String category = root.relativize(file).getName(0).toString();
                    samples.add(new Sample<>(file, classes.indexOf(category)));
                }
                return new Discovery(classes, samples);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to scan dataset root " + root, e);
            }
        }

        private static boolean hasExtension(Path path, Set<String> suffixes) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            for (String suffix : suffixes)
                if (name.endsWith(suffix))
                    return true;
            return false;
        }
    }
}
