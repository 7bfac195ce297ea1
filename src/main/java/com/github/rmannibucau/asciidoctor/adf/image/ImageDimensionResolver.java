package com.github.rmannibucau.asciidoctor.adf.image;

import static java.util.stream.Collectors.joining;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the display size of an image from the author's attributes and the image itself.
 * Never fails: an unreadable image just leaves the missing sides unknown.
 */
public class ImageDimensionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ImageDimensionResolver.class);

    private final ImageProber prober;

    public ImageDimensionResolver(final ImageProber prober) {
        this.prober = prober;
    }

    /**
     * @param target    image target as written in the document.
     * @param width     author width, can be null.
     * @param height    author height, can be null.
     * @param baseDir   directory relative targets are resolved against, can be null.
     * @param imagesDir {@code imagesdir} attribute value, can be null.
     * @param inline    inline images only log at debug level.
     * @return the resolved dimensions.
     */
    public Dimensions resolve(final String target, final Integer width, final Integer height,
                              final String baseDir, final String imagesDir, final boolean inline) {
        if (width != null && height != null) {
            return new Dimensions(width, height);
        }
        if (target == null || target.isBlank()) {
            return new Dimensions(width, height);
        }
        try {
            if (ImageIoProber.isUrl(target)) {
                return probe(target, width, height, inline);
            }
            if (imagesDir != null && ImageIoProber.isUrl(imagesDir)) {
                return probe(imagesDir.replaceFirst("/+$", "") + '/' + target.replaceFirst("^/+", ""), width, height, inline);
            }

            final List<Path> searchPaths = searchPaths(target, baseDir, imagesDir);
            final Optional<Path> found = searchPaths.stream().filter(Files::isRegularFile).findFirst();
            if (found.isEmpty()) {
                if (inline) {
                    LOG.debug("Can't find inline image '{}' in {}", target, searchPaths);
                } else {
                    LOG.warn("Can't find image '{}', tried:\n{}", target,
                            searchPaths.stream().map(p -> "  - " + p).collect(joining("\n")));
                }
                return new Dimensions(width, height);
            }
            return probe(found.get().toString(), width, height, inline);
        } catch (final RuntimeException | IOException e) {
            if (inline) {
                LOG.debug("Can't compute inline image '{}' dimensions: {}", target, e.getMessage());
            } else {
                LOG.warn("Can't compute image '{}' dimensions: {}", target, e.getMessage());
            }
            return new Dimensions(width, height);
        }
    }

    List<Path> searchPaths(final String target, final String baseDir, final String imagesDir) {
        final Path base = baseDir == null || baseDir.isBlank() ? Path.of("") : Path.of(baseDir);
        final List<Path> paths = new ArrayList<>(2);
        if (imagesDir != null && !imagesDir.isBlank()) {
            paths.add(base.resolve(imagesDir).resolve(target).normalize());
        }
        final Path direct = base.resolve(target).normalize();
        if (!paths.contains(direct)) {
            paths.add(direct);
        }
        return paths;
    }

    private Dimensions probe(final String location, final Integer width, final Integer height,
                             final boolean inline) throws IOException {
        final Optional<Dimensions> probed = prober.probeSize(location).filter(Dimensions::isComplete);
        if (probed.isEmpty()) {
            if (!inline) {
                LOG.warn("Unsupported image format for '{}'", location);
            }
            return new Dimensions(width, height);
        }
        return scale(width, height, probed.get());
    }

    static Dimensions scale(final Integer width, final Integer height, final Dimensions original) {
        if (width != null && height == null && original.getWidth() > 0) {
            return new Dimensions(width, (int) Math.round(width * (double) original.getHeight() / original.getWidth()));
        }
        if (height != null && width == null && original.getHeight() > 0) {
            return new Dimensions((int) Math.round(height * (double) original.getWidth() / original.getHeight()), height);
        }
        return new Dimensions(width != null ? width : original.getWidth(), height != null ? height : original.getHeight());
    }
}
