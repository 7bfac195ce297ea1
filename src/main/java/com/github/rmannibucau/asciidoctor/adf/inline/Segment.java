package com.github.rmannibucau.asciidoctor.adf.inline;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A piece of scanned text: either a literal span or a parsed JSON fragment,
 * {@code text} always holds the source characters.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Segment {

    private final String text;

    private final JsonNode json;

    public static Segment text(final String text) {
        return new Segment(text, null);
    }

    public static Segment json(final String source, final JsonNode json) {
        return new Segment(source, json);
    }

    public boolean isText() {
        return json == null;
    }
}
