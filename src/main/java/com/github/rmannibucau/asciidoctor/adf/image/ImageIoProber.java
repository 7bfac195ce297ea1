package com.github.rmannibucau.asciidoctor.adf.image;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * {@link ImageProber} reading only image headers through {@code javax.imageio}.
 */
public class ImageIoProber implements ImageProber {

    private final HttpClient client;

    public ImageIoProber() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public ImageIoProber(final HttpClient client) {
        this.client = client;
    }

    @Override
    public Optional<Dimensions> probeSize(final String pathOrUrl) throws IOException {
        if (isUrl(pathOrUrl)) {
            final HttpResponse<byte[]> response;
            try {
                response = client.send(HttpRequest.newBuilder(URI.create(pathOrUrl)).GET().build(),
                        HttpResponse.BodyHandlers.ofByteArray());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while reading " + pathOrUrl, e);
            }
            if (response.statusCode() / 100 != 2) {
                throw new IOException("Can't read " + pathOrUrl + ": HTTP " + response.statusCode());
            }
            try (final InputStream stream = new ByteArrayInputStream(response.body())) {
                return read(stream);
            }
        }
        try (final InputStream stream = Files.newInputStream(Path.of(pathOrUrl))) {
            return read(stream);
        }
    }

    private Optional<Dimensions> read(final InputStream stream) throws IOException {
        try (final ImageInputStream input = ImageIO.createImageInputStream(stream)) {
            if (input == null) {
                return Optional.empty();
            }
            final Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            final ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return Optional.of(new Dimensions(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        }
    }

    static boolean isUrl(final String target) {
        return target != null && (target.startsWith("http://") || target.startsWith("https://"));
    }
}
