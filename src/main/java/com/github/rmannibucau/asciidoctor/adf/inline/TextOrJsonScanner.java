package com.github.rmannibucau.asciidoctor.adf.inline;

import static org.apache.commons.text.StringEscapeUtils.unescapeHtml4;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Splits text in literal spans and embedded JSON objects/arrays (what macros output).
 * Malformed, empty or unterminated fragments stay literal text.
 */
public class TextOrJsonScanner {

    private final ObjectMapper mapper;

    public TextOrJsonScanner(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Segment> scan(final String raw) {
        return scan(raw, true);
    }

    /**
     * @param raw      the text to scan.
     * @param unescape should HTML entities be decoded first, Asciidoctor output is escaped.
     * @return the segments in document order.
     */
    public List<Segment> scan(final String raw, final boolean unescape) {
        final List<Segment> segments = new ArrayList<>();
        if (raw == null || raw.isEmpty()) {
            return segments;
        }

        final String text = unescape ? unescapeHtml4(raw) : raw;
        final StringBuilder buffer = new StringBuilder();
        final StringBuilder fragment = new StringBuilder();
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (depth == 0) {
                if (c == '{' || c == '[') {
                    depth = 1;
                    fragment.append(c);
                } else {
                    buffer.append(c);
                }
                continue;
            }

            fragment.append(c);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) {
                    flush(fragment.toString(), buffer, segments);
                    fragment.setLength(0);
                    inString = false;
                }
            }
        }
        if (fragment.length() > 0) { // unbalanced
            buffer.append(fragment);
        }
        if (buffer.length() > 0) {
            segments.add(Segment.text(buffer.toString()));
        }
        return segments;
    }

    private void flush(final String fragment, final StringBuilder buffer, final List<Segment> segments) {
        final JsonNode parsed;
        try {
            parsed = mapper.readTree(fragment);
        } catch (final JsonProcessingException e) {
            buffer.append(fragment);
            return;
        }
        if (parsed == null || !parsed.isContainerNode() || parsed.isEmpty()) {
            buffer.append(fragment);
            return;
        }
        if (buffer.length() > 0) {
            segments.add(Segment.text(buffer.toString()));
            buffer.setLength(0);
        }
        segments.add(Segment.json(fragment, parsed));
    }
}
