package com.github.rmannibucau.asciidoctor.adf.inline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;

/**
 * Final pass of a conversion: replaces registry tokens found in paragraph and heading text
 * by the nodes they stand for. Unknown tokens are kept as visible text.
 */
public class PlaceholderExpander {

    private static final Set<String> INLINE_CONTAINERS = Set.of("paragraph", "heading");

    private final InlineNodeRegistry registry;

    private final InlineContentParser parser;

    public PlaceholderExpander(final InlineNodeRegistry registry, final InlineContentParser parser) {
        this.registry = registry;
        this.parser = parser;
    }

    public void expand(final Collection<? extends JsonNode> nodes) {
        nodes.forEach(this::expand);
    }

    public void expand(final JsonNode node) {
        if (node == null || !node.isObject() || !node.path("content").isArray()) {
            return;
        }
        final ObjectNode object = (ObjectNode) node;
        final ArrayNode content = (ArrayNode) object.get("content");
        if (INLINE_CONTAINERS.contains(object.path("type").asText())) {
            final ArrayNode expanded = JsonNodeFactory.instance.arrayNode();
            content.forEach(child -> {
                if (isText(child)) {
                    expanded.addAll(expandText((ObjectNode) child));
                } else {
                    expanded.add(child);
                }
            });
            object.set("content", expanded);
        } else {
            content.forEach(this::expand);
        }
    }

    private List<JsonNode> expandText(final ObjectNode textNode) {
        final String text = textNode.path("text").asText();
        final List<JsonNode> marks = marksOf(textNode);
        if (!registry.hasPlaceholder(text)) {
            return parser.tryParseInlineJson(text, copy(marks)).orElseGet(() -> List.of(textNode));
        }

        final List<JsonNode> out = new ArrayList<>();
        final Matcher matcher = InlineNodeRegistry.PLACEHOLDER.matcher(text);
        int last = 0;
        while (matcher.find()) {
            literal(text.substring(last, matcher.start()), marks, out);
            final Optional<ObjectNode> resolved = registry.resolve(matcher.group(1));
            if (resolved.isPresent()) {
                final ObjectNode node = resolved.get().deepCopy();
                if (isText(node)) {
                    out.addAll(expandText(withMarks(node, marks)));
                } else {
                    out.add(node);
                }
            } else {
                out.add(AdfNodes.text(matcher.group(), copy(marks)));
            }
            last = matcher.end();
        }
        literal(text.substring(last), marks, out);
        return out;
    }

    private void literal(final String span, final List<JsonNode> marks, final List<JsonNode> out) {
        if (span.isEmpty()) {
            return;
        }
        out.addAll(parser.tryParseInlineJson(span, copy(marks)).orElseGet(() -> List.of(AdfNodes.text(span, copy(marks)))));
    }

    // outer marks first, a mark type is never duplicated
    private ObjectNode withMarks(final ObjectNode node, final List<JsonNode> outer) {
        if (outer.isEmpty()) {
            return node;
        }
        final List<JsonNode> merged = new ArrayList<>();
        final Set<String> types = new HashSet<>();
        for (final JsonNode mark : outer) {
            if (types.add(mark.path("type").asText())) {
                merged.add(mark.deepCopy());
            }
        }
        for (final JsonNode mark : marksOf(node)) {
            if (types.add(mark.path("type").asText())) {
                merged.add(mark);
            }
        }
        return AdfNodes.text(node.path("text").asText(), merged);
    }

    private static List<JsonNode> marksOf(final JsonNode node) {
        final List<JsonNode> marks = new ArrayList<>();
        node.path("marks").forEach(marks::add);
        return marks;
    }

    private static List<JsonNode> copy(final List<JsonNode> marks) {
        final List<JsonNode> copy = new ArrayList<>(marks.size());
        marks.forEach(m -> copy.add(m.deepCopy()));
        return copy;
    }

    private static boolean isText(final JsonNode node) {
        return node.isObject() && "text".equals(node.path("type").asText());
    }
}
