package com.github.rmannibucau.asciidoctor.adf.model;

import static java.util.Objects.requireNonNull;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Factories for the ADF nodes the converter emits.
 * Keys are always inserted in the same order so serialized output is stable.
 */
public final class AdfNodes {

    public static final int DOCUMENT_VERSION = 1;

    public static final String CONFLUENCE_MACRO = "com.atlassian.confluence.macro.core";

    public static final String DEFAULT_HIGHLIGHT = "#FFFF00";

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private AdfNodes() {
        // no-op
    }

    public static ObjectNode doc(final Collection<? extends JsonNode> content) {
        final ObjectNode doc = FACTORY.objectNode();
        doc.put("version", DOCUMENT_VERSION);
        doc.put("type", "doc");
        doc.set("content", array(content));
        return doc;
    }

    /**
     * @param text  the text, never empty.
     * @param marks the marks, dropped when null or empty.
     * @return a text node.
     * @throws IllegalArgumentException if the text is null or empty, it is a caller bug.
     */
    public static ObjectNode text(final String text, final Collection<? extends JsonNode> marks) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Text cannot be null or empty");
        }
        final ObjectNode node = typed("text");
        node.put("text", text);
        if (marks != null && !marks.isEmpty()) {
            node.set("marks", array(marks));
        }
        return node;
    }

    public static ObjectNode text(final String text) {
        return text(text, null);
    }

    public static ObjectNode paragraph(final Collection<? extends JsonNode> content) {
        return container("paragraph", content);
    }

    public static ObjectNode heading(final int level, final Collection<? extends JsonNode> content) {
        final ObjectNode node = typed("heading");
        node.putObject("attrs").put("level", level);
        node.set("content", array(content));
        return node;
    }

    public static ObjectNode bulletList(final Collection<? extends JsonNode> items) {
        return container("bulletList", items);
    }

    public static ObjectNode orderedList(final Collection<? extends JsonNode> items) {
        return container("orderedList", items);
    }

    public static ObjectNode listItem(final Collection<? extends JsonNode> content) {
        return container("listItem", content);
    }

    public static ObjectNode table(final Collection<? extends JsonNode> rows) {
        return container("table", rows);
    }

    public static ObjectNode tableRow(final Collection<? extends JsonNode> cells) {
        return container("tableRow", cells);
    }

    /**
     * @param kind    {@code tableCell} or {@code tableHeader}.
     * @param colspan span, anything lower than 1 means unspecified.
     * @param rowspan span, anything lower than 1 means unspecified.
     * @param content block content of the cell.
     * @return the cell node.
     */
    public static ObjectNode tableCell(final String kind, final int colspan, final int rowspan,
                                       final Collection<? extends JsonNode> content) {
        final ObjectNode node = typed(kind);
        final ObjectNode attrs = node.putObject("attrs");
        attrs.put("colspan", Math.max(1, colspan));
        attrs.put("rowspan", Math.max(1, rowspan));
        node.set("content", array(content));
        return node;
    }

    public static ObjectNode codeBlock(final String language, final String text) {
        final ObjectNode node = typed("codeBlock");
        node.putObject("attrs").put("language", language == null || language.isBlank() ? "plaintext" : language);
        node.set("content", text == null || text.isEmpty() ? FACTORY.arrayNode() : array(List.of(text(text))));
        return node;
    }

    public static ObjectNode panel(final String panelType, final Collection<? extends JsonNode> content) {
        final ObjectNode node = typed("panel");
        node.putObject("attrs").put("panelType", panelType);
        node.set("content", array(content));
        return node;
    }

    public static ObjectNode blockquote(final Collection<? extends JsonNode> content) {
        return container("blockquote", content);
    }

    public static ObjectNode rule() {
        return typed("rule");
    }

    public static ObjectNode hardBreak() {
        return typed("hardBreak");
    }

    public static ObjectNode mark(final String type) {
        return typed(type);
    }

    public static ObjectNode linkMark(final String href) {
        final ObjectNode mark = typed("link");
        mark.putObject("attrs").put("href", href);
        return mark;
    }

    public static ObjectNode backgroundColorMark(final String color) {
        final ObjectNode mark = typed("backgroundColor");
        mark.putObject("attrs").put("color", color);
        return mark;
    }

    public static ObjectNode inlineExtension(final String extensionType, final String extensionKey,
                                             final ObjectNode parameters) {
        final ObjectNode node = typed("inlineExtension");
        final ObjectNode attrs = node.putObject("attrs");
        attrs.put("extensionType", extensionType);
        attrs.put("extensionKey", extensionKey);
        attrs.set("parameters", parameters);
        return node;
    }

    /**
     * Block extension, {@code attributes} come first then the extension type and key.
     */
    public static ObjectNode extension(final String extensionType, final String extensionKey,
                                       final Map<String, ? extends JsonNode> attributes) {
        final ObjectNode node = typed("extension");
        final ObjectNode attrs = node.putObject("attrs");
        if (attributes != null) {
            attributes.forEach(attrs::set);
        }
        attrs.put("extensionType", extensionType);
        attrs.put("extensionKey", extensionKey);
        return node;
    }

    public static ObjectNode media(final ObjectNode attrs) {
        final ObjectNode node = typed("media");
        node.set("attrs", attrs);
        return node;
    }

    /**
     * @param width the display width, omitted with its unit when null.
     */
    public static ObjectNode mediaSingle(final String layout, final Integer width, final ObjectNode media) {
        final ObjectNode node = typed("mediaSingle");
        final ObjectNode attrs = node.putObject("attrs");
        attrs.put("layout", layout);
        if (width != null) {
            attrs.put("width", width);
            attrs.put("widthType", "pixel");
        }
        node.set("content", FACTORY.arrayNode().add(requireNonNull(media, "media")));
        return node;
    }

    public static ObjectNode mediaInline(final ObjectNode attrs) {
        final ObjectNode node = typed("mediaInline");
        node.set("attrs", attrs);
        return node;
    }

    public static ObjectNode mention(final String id, final String text) {
        final ObjectNode node = typed("mention");
        final ObjectNode attrs = node.putObject("attrs");
        attrs.put("id", id);
        attrs.put("text", text);
        return node;
    }

    /**
     * Confluence anchor macro, {@code LEGACY-} key keeps links of pages migrated from the editor v1 working.
     */
    public static ObjectNode anchor(final String id) {
        final String localId = UUID.randomUUID().toString();

        final ObjectNode parameters = FACTORY.objectNode();
        final ObjectNode macroParams = parameters.putObject("macroParams");
        macroParams.putObject("").put("value", id);
        macroParams.putObject("legacyAnchorId").put("value", "LEGACY-" + id);
        macroParams.putObject("_parentId").put("value", UUID.randomUUID().toString());
        final ObjectNode metadata = parameters.putObject("macroMetadata");
        metadata.putObject("macroId").put("value", localId);
        metadata.putObject("schemaVersion").put("value", "1");
        metadata.put("title", "Anchor");

        final ObjectNode node = inlineExtension(CONFLUENCE_MACRO, "anchor", parameters);
        ((ObjectNode) node.get("attrs")).put("localId", localId);
        return node;
    }

    public static ObjectNode tableOfContents() {
        final ObjectNode parameters = FACTORY.objectNode();
        parameters.putObject("macroParams");
        final ObjectNode metadata = parameters.putObject("macroMetadata");
        metadata.putObject("schemaVersion").put("value", "1");
        metadata.put("title", "Table of Contents");
        return inlineExtension(CONFLUENCE_MACRO, "toc", parameters);
    }

    public static ObjectNode object() {
        return FACTORY.objectNode();
    }

    private static ObjectNode container(final String type, final Collection<? extends JsonNode> content) {
        final ObjectNode node = typed(type);
        node.set("content", array(content));
        return node;
    }

    private static ObjectNode typed(final String type) {
        return FACTORY.objectNode().put("type", type);
    }

    // null entries are compacted
    private static ArrayNode array(final Collection<? extends JsonNode> content) {
        final ArrayNode array = FACTORY.arrayNode();
        if (content != null) {
            content.stream().filter(it -> it != null && !it.isNull()).forEach(array::add);
        }
        return array;
    }
}
