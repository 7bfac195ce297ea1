package com.github.rmannibucau.asciidoctor.adf.reverse;

import static java.util.stream.Collectors.joining;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

/**
 * Renders an ADF tree as AsciiDoc text. Unknown node types only contribute their children.
 */
public class AdfToAsciidocConverter {

    private static final Map<String, String> ADMONITIONS = Map.of(
            "info", "NOTE",
            "note", "NOTE",
            "success", "TIP",
            "warning", "WARNING",
            "error", "CAUTION");

    private final ObjectMapper mapper;

    public AdfToAsciidocConverter() {
        this(new ObjectMapper());
    }

    public AdfToAsciidocConverter(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param adf the serialized ADF document (or any ADF node).
     * @return the AsciiDoc rendering.
     * @throws IllegalArgumentException if the input is not JSON.
     */
    public String convert(final String adf) {
        try {
            return convert(mapper.readTree(adf));
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid ADF: " + e.getMessage(), e);
        }
    }

    public String convert(final JsonNode adf) {
        return render(adf, ListContext.ROOT);
    }

    private String render(final JsonNode node, final ListContext context) {
        if (node == null || !node.isObject()) {
            return "";
        }
        switch (node.path("type").asText()) {
        case "doc":
            return renderChildren(node.get("content"), context);
        case "paragraph":
            return onParagraph(node, context);
        case "text":
            return onText(node);
        case "hardBreak":
            return "\n";
        case "heading":
            return "\n" + "=".repeat(node.path("attrs").path("level").asInt(1)) + " "
                    + renderChildren(node.get("content"), context) + "\n";
        case "bulletList":
            return onList(node, context, "*");
        case "orderedList":
            return onList(node, context, ".");
        case "listItem":
            return onListItem(node, context);
        case "codeBlock":
            return onCodeBlock(node);
        case "rule":
            return "\n'''\n";
        case "panel":
            return onPanel(node, context);
        case "mention":
            return onMention(node);
        default:
            return renderChildren(node.get("content"), context);
        }
    }

    private String renderChildren(final JsonNode content, final ListContext context) {
        if (content == null || !content.isArray()) {
            return "";
        }
        return StreamSupport.stream(content.spliterator(), false).map(child -> render(child, context)).collect(joining());
    }

    private String onParagraph(final JsonNode node, final ListContext context) {
        final String text = renderChildren(node.get("content"), context);
        if (text.isEmpty()) {
            return "";
        }
        return context.depth > 0 ? text : "\n" + text + "\n";
    }

    private String onText(final JsonNode node) {
        String text = node.path("text").asText("");
        for (final JsonNode mark : node.path("marks")) {
            switch (mark.path("type").asText()) {
            case "strong":
                text = "*" + text + "*";
                break;
            case "em":
                text = "_" + text + "_";
                break;
            case "strike":
                text = "[line-through]#_" + text + "_#";
                break;
            case "code":
                text = "`" + text + "`";
                break;
            case "link":
                text = "link:" + mark.path("attrs").path("href").asText("") + "[" + text + "]";
                break;
            default:
            }
        }
        return text;
    }

    private String onList(final JsonNode node, final ListContext context, final String marker) {
        final ListContext itemContext = new ListContext(context.depth + 1, marker);
        final String items = renderChildren(node.get("content"), itemContext);
        if (context.depth == 0) {
            return "\n" + items.strip() + "\n";
        }
        return items;
    }

    private String onListItem(final JsonNode node, final ListContext context) {
        final String marker = context.marker == null ? "*" : context.marker;
        final List<String> parts = new ArrayList<>();
        int index = 0;
        for (final JsonNode child : node.path("content")) {
            final String rendered = render(child, context);
            final boolean nestedList = child.path("type").asText().endsWith("List");
            if (index > 0 && nestedList && !parts.get(parts.size() - 1).endsWith("\n")) {
                parts.add("\n" + rendered);
            } else {
                parts.add(rendered);
            }
            index++;
        }
        return marker.repeat(context.depth) + " " + String.join("", parts).strip() + "\n";
    }

    private String onCodeBlock(final JsonNode node) {
        final String language = node.path("attrs").path("language").asText("");
        final String code = StreamSupport.stream(node.path("content").spliterator(), false)
                .map(text -> text.path("text").asText(""))
                .collect(joining("\n"));
        return "\n[source," + language + "]\n----\n" + code + "\n----\n";
    }

    private String onPanel(final JsonNode node, final ListContext context) {
        final String type = ADMONITIONS.getOrDefault(node.path("attrs").path("panelType").asText(""), "NOTE");
        return "\n[" + type + "]\n====\n" + renderChildren(node.get("content"), context).strip() + "\n====\n";
    }

    private String onMention(final JsonNode node) {
        final String name = node.path("attrs").path("text").asText("").replaceFirst("^@", "").trim();
        if (name.isEmpty()) {
            return "";
        }
        return "atlasMention:" + name.replaceAll("\\s+", "_") + "[]";
    }

    @RequiredArgsConstructor
    private static class ListContext {

        private static final ListContext ROOT = new ListContext(0, null);

        private final int depth;

        private final String marker;
    }
}
