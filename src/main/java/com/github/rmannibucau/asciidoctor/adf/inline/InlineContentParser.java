package com.github.rmannibucau.asciidoctor.adf.inline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;

/**
 * Turns converted inline text into ADF inline nodes, keeping the left to right order.
 * JSON fragments which are ADF nodes (or arrays of nodes) are spliced, anything else stays text.
 */
public class InlineContentParser {

    private final TextOrJsonScanner scanner;

    public InlineContentParser(final ObjectMapper mapper) {
        this(new TextOrJsonScanner(mapper));
    }

    public InlineContentParser(final TextOrJsonScanner scanner) {
        this.scanner = scanner;
    }

    public List<JsonNode> parseOrEscape(final String text) {
        return toNodes(scanner.scan(text), null);
    }

    /**
     * Second chance for literal spans: structured nodes which reached the text without a placeholder.
     *
     * @param text  an already unescaped span.
     * @param marks marks to keep on the literal parts.
     * @return the nodes if the span embeds at least one node, empty otherwise.
     */
    public Optional<List<JsonNode>> tryParseInlineJson(final String text, final Collection<? extends JsonNode> marks) {
        if (text == null || (text.indexOf('{') < 0 && text.indexOf('[') < 0)) {
            return Optional.empty();
        }
        final List<Segment> segments = scanner.scan(text, false);
        if (segments.stream().noneMatch(s -> !s.isText() && isNodeOrNodes(s.getJson()))) {
            return Optional.empty();
        }
        return Optional.of(toNodes(segments, marks));
    }

    private List<JsonNode> toNodes(final List<Segment> segments, final Collection<? extends JsonNode> marks) {
        final List<JsonNode> nodes = new ArrayList<>();
        final StringBuilder pending = new StringBuilder();
        for (final Segment segment : segments) {
            if (segment.isText() || !isNodeOrNodes(segment.getJson())) {
                pending.append(segment.getText());
                continue;
            }
            flush(pending, marks, nodes);
            final JsonNode json = segment.getJson();
            if (json.isArray()) {
                json.forEach(node -> addNode(node, nodes));
            } else {
                addNode(json, nodes);
            }
        }
        flush(pending, marks, nodes);
        return nodes;
    }

    // text nodes never carry an empty text
    private static void addNode(final JsonNode node, final List<JsonNode> nodes) {
        if ("text".equals(node.path("type").asText()) && node.path("text").asText("").isEmpty()) {
            return;
        }
        nodes.add(node);
    }

    private void flush(final StringBuilder pending, final Collection<? extends JsonNode> marks, final List<JsonNode> nodes) {
        if (pending.length() == 0) {
            return;
        }
        nodes.add(AdfNodes.text(pending.toString(), marks));
        pending.setLength(0);
    }

    public static boolean isNode(final JsonNode node) {
        return node != null && node.isObject() && node.path("type").isTextual() && !node.path("type").asText().isEmpty();
    }

    private static boolean isNodeOrNodes(final JsonNode json) {
        if (json.isArray()) {
            return json.size() > 0 && StreamSupport.stream(json.spliterator(), false).allMatch(InlineContentParser::isNode);
        }
        return isNode(json);
    }
}
