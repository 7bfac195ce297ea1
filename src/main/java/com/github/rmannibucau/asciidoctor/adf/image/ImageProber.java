package com.github.rmannibucau.asciidoctor.adf.image;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads the intrinsic size of an image.
 */
public interface ImageProber {

    /**
     * @param pathOrUrl a local path or an absolute http(s) URL.
     * @return the size if the image format is readable.
     * @throws IOException if the image can't be read at all.
     */
    Optional<Dimensions> probeSize(String pathOrUrl) throws IOException;
}
