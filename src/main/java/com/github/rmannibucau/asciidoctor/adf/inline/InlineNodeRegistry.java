package com.github.rmannibucau.asciidoctor.adf.inline;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Inline nodes built while Asciidoctor substitutes text.
 * Asciidoctor only carries strings between inline conversions so each node travels as a
 * NUL delimited token, NUL can't appear in a source document.
 * One instance per conversion, nested cell documents reuse it.
 */
public class InlineNodeRegistry {

    public static final char DELIMITER = '\u0000';

    public static final String PREFIX = "ADFNODE";

    public static final Pattern PLACEHOLDER = Pattern.compile(DELIMITER + PREFIX + "([0-9a-f]+)" + DELIMITER);

    private final List<ObjectNode> nodes = new ArrayList<>();

    public String register(final ObjectNode node) {
        nodes.add(node);
        return DELIMITER + PREFIX + Integer.toHexString(nodes.size() - 1) + DELIMITER;
    }

    public Optional<ObjectNode> resolve(final int id) {
        if (id < 0 || id >= nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(id));
    }

    public Optional<ObjectNode> resolve(final String hexId) {
        try {
            return resolve(Integer.parseInt(hexId, 16));
        } catch (final NumberFormatException nfe) {
            return Optional.empty();
        }
    }

    public boolean hasPlaceholder(final String text) {
        return text != null && text.indexOf(DELIMITER) >= 0 && PLACEHOLDER.matcher(text).find();
    }

    /**
     * Flattens tokens to the text they stand for, non textual nodes vanish.
     */
    public String toPlainText(final String text) {
        if (!hasPlaceholder(text)) {
            return text;
        }
        final Matcher matcher = PLACEHOLDER.matcher(text);
        final StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            final String replacement = resolve(matcher.group(1))
                    .filter(node -> "text".equals(node.path("type").asText()))
                    .map(node -> toPlainText(node.path("text").asText()))
                    .orElse("");
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public int size() {
        return nodes.size();
    }
}
