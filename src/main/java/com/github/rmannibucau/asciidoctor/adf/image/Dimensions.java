package com.github.rmannibucau.asciidoctor.adf.image;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Image size, a side is null when unknown.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class Dimensions {

    public static final Dimensions UNKNOWN = new Dimensions(null, null);

    private final Integer width;

    private final Integer height;

    public boolean isComplete() {
        return width != null && height != null;
    }
}
