package com.github.rmannibucau.asciidoctor.adf.visitor;

import static java.util.Locale.ROOT;
import static java.util.Optional.ofNullable;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;
import static org.apache.commons.text.StringEscapeUtils.unescapeHtml4;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import org.apache.commons.text.StringEscapeUtils;
import org.asciidoctor.ast.Cell;
import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.ast.DescriptionList;
import org.asciidoctor.ast.Document;
import org.asciidoctor.ast.ListItem;
import org.asciidoctor.ast.PhraseNode;
import org.asciidoctor.ast.Row;
import org.asciidoctor.ast.Section;
import org.asciidoctor.ast.StructuralNode;
import org.asciidoctor.ast.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rmannibucau.asciidoctor.adf.image.Dimensions;
import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;
import com.github.rmannibucau.asciidoctor.adf.model.SourceKind;

/**
 * Builds the ADF tree of a document.
 * Block handlers return the nodes they produce, inline handlers return the text Asciidoctor splices
 * in the parent content: a registry token for anything structured.
 */
public class AdfVisitor {

    private static final Logger LOG = LoggerFactory.getLogger(AdfVisitor.class);

    private static final Map<String, String> PANEL_TYPES = Map.of(
            "note", "info",
            "tip", "info",
            "warning", "warning",
            "important", "error",
            "caution", "error");

    private static final Map<String, String> QUOTED_MARKS = Map.of(
            "strong", "strong",
            "emphasis", "em",
            "monospaced", "code",
            "superscript", "sup",
            "subscript", "sub");

    private static final Map<String, String> ROLE_MARKS = Map.of(
            "underline", "underline",
            "line-through", "strike",
            "strikethrough", "strike");

    private static final Set<String> STRUCTURED_INLINE_TYPES = Set.of("inlineExtension", "extension", "mention", "inlineCard");

    private final ConversionContext context;

    private final AsciidocCellParser cellParser;

    public AdfVisitor(final ConversionContext context) {
        this.context = context;
        this.cellParser = new AsciidocCellParser(this, context);
    }

    public ConversionContext getContext() {
        return context;
    }

    public ObjectNode onDocument(final Document document) {
        indexAnchors(document.getBlocks());

        final List<ObjectNode> content = new ArrayList<>();
        if (hasAutoToc(document)) {
            content.add(AdfNodes.tableOfContents());
        }
        content.addAll(convertBlocks(document.getBlocks()));

        final ObjectNode doc = AdfNodes.doc(content);
        context.getExpander().expand(doc);
        return doc;
    }

    public List<ObjectNode> convertBlocks(final Collection<StructuralNode> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return List.of();
        }
        final List<ObjectNode> out = new ArrayList<>();
        blocks.forEach(block -> out.addAll(convertBlock(block)));
        return out;
    }

    public List<ObjectNode> convertBlock(final StructuralNode node) {
        final SourceKind kind = SourceKind.of(node);
        try {
            switch (kind) {
            case DOCUMENT:
            case EMBEDDED:
            case PREAMBLE:
            case OPEN:
                return convertBlocks(node.getBlocks());
            case PARAGRAPH:
                return List.of(AdfNodes.paragraph(parse(contentOf(node))));
            case SECTION:
                return onSection((Section) node);
            case ULIST:
                return List.of(AdfNodes.bulletList(listItems(node)));
            case OLIST:
                return List.of(AdfNodes.orderedList(listItems(node)));
            case TABLE:
                return List.of(onTable((Table) node));
            case QUOTE:
                return List.of(AdfNodes.blockquote(simpleOrCompound(node)));
            case ADMONITION:
                return List.of(AdfNodes.panel(panelType(node), simpleOrCompound(node)));
            case IMAGE:
                return List.of(onImage(node));
            case LISTING:
            case LITERAL:
                return List.of(AdfNodes.codeBlock(
                        attribute(node, "language"), unescapeHtml4(context.getRegistry().toPlainText(contentOf(node)))));
            case PASS:
                return onPass(node);
            case PAGE_BREAK:
                return List.of(AdfNodes.rule());
            case TOC:
                return List.of(AdfNodes.tableOfContents());
            case SIDEBAR:
            case FLOATING_TITLE:
            case THEMATIC_BREAK:
                return List.of();
            case INLINE_ANCHOR:
            case INLINE_QUOTED:
            case INLINE_IMAGE:
            case INLINE_BREAK:
            case INLINE_OTHER:
            case UNSUPPORTED:
                LOG.warn("Unsupported node '{}'{}, skipping it", node.getContext(), describe(node));
                return List.of();
            default:
                throw new IllegalArgumentException("Unknown kind " + kind);
            }
        } catch (final RuntimeException re) {
            LOG.warn("Can't convert node '{}'{}, skipping it: {}", node.getContext(), describe(node), re.getMessage(), re);
            return List.of();
        }
    }

    public String onPhrase(final PhraseNode node) {
        final SourceKind kind = SourceKind.of(node);
        switch (kind) {
        case INLINE_ANCHOR:
            return onAnchor(node);
        case INLINE_QUOTED:
            return onQuoted(node);
        case INLINE_IMAGE:
            return onInlineImage(node);
        case INLINE_BREAK:
            return ofNullable(node.getText()).orElse("") + context.getRegistry().register(AdfNodes.hardBreak());
        default:
            return onOtherInline(node);
        }
    }

    public List<JsonNode> parse(final String text) {
        return context.getParser().parseOrEscape(text);
    }

    private List<ObjectNode> onSection(final Section section) {
        final List<JsonNode> title = new ArrayList<>(parse(section.getTitle()));
        final String id = sectionId(section);
        if (id != null) {
            title.add(AdfNodes.anchor(id));
        }
        final List<ObjectNode> out = new ArrayList<>();
        out.add(AdfNodes.heading(section.getLevel() + 1, title));
        out.addAll(convertBlocks(section.getBlocks()));
        return out;
    }

    private List<ObjectNode> listItems(final StructuralNode node) {
        return ((org.asciidoctor.ast.List) node).getItems().stream()
                .filter(ListItem.class::isInstance)
                .map(ListItem.class::cast)
                .map(item -> {
                    final List<ObjectNode> content = new ArrayList<>();
                    content.add(AdfNodes.paragraph(parse(item.getText())));
                    content.addAll(convertBlocks(item.getBlocks()));
                    return AdfNodes.listItem(content);
                })
                .collect(toList());
    }

    private ObjectNode onTable(final Table table) {
        final List<ObjectNode> rows = new ArrayList<>();
        table.getHeader().forEach(row -> rows.add(toRow(row, this::headerCell)));
        table.getBody().forEach(row -> rows.add(toRow(row, this::bodyCell)));
        table.getFooter().forEach(row -> rows.add(toRow(row, this::bodyCell)));
        return AdfNodes.table(rows);
    }

    private ObjectNode toRow(final Row row, final Function<Cell, ObjectNode> cellConverter) {
        return AdfNodes.tableRow(row.getCells().stream().map(cellConverter).collect(toList()));
    }

    private ObjectNode headerCell(final Cell cell) {
        return AdfNodes.tableCell("tableHeader", cell.getColspan(), cell.getRowspan(),
                List.of(AdfNodes.paragraph(parse(cell.getText()))));
    }

    private ObjectNode bodyCell(final Cell cell) {
        final String style = ofNullable(cell.getStyle()).orElse("").toLowerCase(ROOT);
        final String kind = "header".equals(style) ? "tableHeader" : "tableCell";
        final List<ObjectNode> content = "asciidoc".equals(style) ? cellParser.parse(cell)
                : List.of(AdfNodes.paragraph(parse(cell.getText())));
        return AdfNodes.tableCell(kind, cell.getColspan(), cell.getRowspan(), content);
    }

    private List<? extends JsonNode> simpleOrCompound(final StructuralNode node) {
        if ("compound".equals(node.getContentModel())) {
            return convertBlocks(node.getBlocks());
        }
        return List.of(AdfNodes.paragraph(parse(contentOf(node))));
    }

    private String panelType(final StructuralNode node) {
        return ofNullable(attribute(node, "name")).map(n -> n.toLowerCase(ROOT)).map(PANEL_TYPES::get).orElse("info");
    }

    private ObjectNode onImage(final StructuralNode node) {
        final String target = attribute(node, "target");
        final Document document = node.getDocument();
        final Dimensions dimensions = context.getImages().resolve(target,
                toInteger(node.getAttribute("width")), toInteger(node.getAttribute("height")),
                baseDir(document), attribute(document, "imagesdir"), false);
        return AdfNodes.mediaSingle("wide", dimensions.getWidth(), AdfNodes.media(mediaAttributes(node, target, dimensions)));
    }

    private List<ObjectNode> onPass(final StructuralNode node) {
        final List<JsonNode> content = parse(contentOf(node));
        return content.isEmpty() ? List.of() : List.of(AdfNodes.paragraph(content));
    }

    private String onAnchor(final PhraseNode node) {
        final String type = ofNullable(node.getType()).orElse("");
        switch (type) {
        case "xref": {
            final String refId = ofNullable(attribute(node, "refid"))
                    .orElseGet(() -> ofNullable(node.getTarget()).map(t -> t.replaceFirst("^#", "")).orElse(""));
            final String text = nonBlank(node.getText())
                    .map(StringEscapeUtils::unescapeHtml4)
                    .or(() -> context.findAnchorTitle(refId))
                    .or(() -> findReferencedTitle(node.getDocument(), refId))
                    .orElseGet(() -> "[" + refId + "]");
            return register(AdfNodes.text(text, List.of(AdfNodes.linkMark("#" + refId))));
        }
        case "ref":
        case "bibref": {
            final String id = node.getId();
            if (id == null) {
                return "";
            }
            final String anchor = register(AdfNodes.anchor(id));
            return "bibref".equals(type) ? anchor + "[" + nonBlank(attribute(node, "reftext")).orElse(id) + "]" : anchor;
        }
        default: {
            final String target = node.getTarget();
            final Optional<String> text = nonBlank(node.getText()).or(() -> nonBlank(attribute(node, "reftext"))).or(() -> nonBlank(target));
            if (text.isEmpty()) {
                return "";
            }
            final String unescaped = unescapeHtml4(text.get());
            if (target == null || target.isBlank()) {
                return register(AdfNodes.text(unescaped));
            }
            return register(AdfNodes.text(unescaped, List.of(AdfNodes.linkMark(target))));
        }
        }
    }

    private String onQuoted(final PhraseNode node) {
        final String text = ofNullable(node.getText()).orElse("");
        if (text.isEmpty()) {
            return "";
        }

        final Optional<ObjectNode> structured = asStructuredInline(text);
        if (structured.isPresent()) {
            return register(structured.get());
        }

        final String type = ofNullable(node.getType()).orElse("");
        final String value;
        switch (type) {
        case "double":
            value = "“" + text + "”";
            break;
        case "single":
            value = "‘" + text + "’";
            break;
        default:
            value = text;
        }
        return register(AdfNodes.text(unescapeHtml4(value), marksOf(node, type)));
    }

    private List<JsonNode> marksOf(final PhraseNode node, final String type) {
        final Set<String> seen = new HashSet<>();
        final List<JsonNode> marks = new ArrayList<>();
        if ("mark".equals(type) && seen.add("backgroundColor")) {
            marks.add(AdfNodes.backgroundColorMark(AdfNodes.DEFAULT_HIGHLIGHT));
        } else {
            ofNullable(QUOTED_MARKS.get(type)).filter(seen::add).ifPresent(m -> marks.add(AdfNodes.mark(m)));
        }
        ofNullable(node.getRoles()).ifPresent(roles -> roles.stream()
                .map(ROLE_MARKS::get)
                .filter(m -> m != null && seen.add(m))
                .forEach(m -> marks.add(AdfNodes.mark(m))));
        return marks;
    }

    private Optional<ObjectNode> asStructuredInline(final String text) {
        final String trimmed = text.trim();
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return Optional.empty();
        }
        try {
            final JsonNode json = context.getMapper().readTree(trimmed);
            if (json != null && json.isObject() && STRUCTURED_INLINE_TYPES.contains(json.path("type").asText())) {
                return Optional.of((ObjectNode) json);
            }
        } catch (final JsonProcessingException e) {
            LOG.debug("'{}' is not an inline node: {}", trimmed, e.getMessage());
        }
        return Optional.empty();
    }

    private String onInlineImage(final PhraseNode node) {
        try {
            final String target = ofNullable(node.getTarget()).orElse("unknown-id");
            final Document document = node.getDocument();
            final Dimensions dimensions = context.getImages().resolve(target,
                    toInteger(node.getAttribute("width")), toInteger(node.getAttribute("height")),
                    baseDir(document), attribute(document, "imagesdir"), true);
            final ObjectNode attributes = mediaAttributes(node, target, dimensions);
            attributes.putObject("data");
            return register(AdfNodes.mediaInline(attributes));
        } catch (final RuntimeException re) {
            LOG.debug("Can't convert inline image {}: {}", node.getTarget(), re.getMessage());
            return "";
        }
    }

    private String onOtherInline(final PhraseNode node) {
        final String text = node.getText();
        switch (ofNullable(node.getContext()).orElse("")) {
        case "callout":
            return text == null ? "" : "<" + text + ">";
        case "kbd":
            if (text == null) {
                final Object keys = node.getAttribute("keys");
                if (Collection.class.isInstance(keys)) {
                    return ((Collection<?>) keys).stream().map(String::valueOf).collect(joining("+"));
                }
                return ofNullable(keys).map(String::valueOf).orElse("");
            }
            return text;
        case "menu":
            if (text == null) {
                return ofNullable(attribute(node, "menu")).orElse("")
                        + ofNullable(attribute(node, "menuitem")).map(i -> " > " + i).orElse("");
            }
            return text;
        default:
            return ofNullable(text).orElse("");
        }
    }

    private ObjectNode mediaAttributes(final ContentNode node, final String target,
                                       final Dimensions dimensions) {
        final ObjectNode attributes = AdfNodes.object();
        attributes.put("type", "file");
        attributes.put("id", target);
        attributes.put("collection", "attachments");
        attributes.put("alt", ofNullable(attribute(node, "alt")).orElse(""));
        attributes.put("occurrenceKey", ofNullable(attribute(node, "occurrenceKey")).orElseGet(() -> UUID.randomUUID().toString()));
        if (dimensions.getWidth() != null) {
            attributes.put("width", dimensions.getWidth());
        }
        if (dimensions.getHeight() != null) {
            attributes.put("height", dimensions.getHeight());
        }
        return attributes;
    }

    private String register(final ObjectNode node) {
        return context.getRegistry().register(node);
    }

    private void indexAnchors(final Collection<StructuralNode> blocks) {
        if (blocks == null) {
            return;
        }
        for (final StructuralNode block : blocks) {
            if (block.getId() != null && block.getTitle() != null) {
                final String title = unescapeHtml4(context.getRegistry().toPlainText(block.getTitle()));
                context.registerAnchor(block.getId(), title);
                if (Section.class.isInstance(block)) {
                    context.registerAnchor(sectionId(Section.class.cast(block)), title);
                }
            }
            if (!DescriptionList.class.isInstance(block) && !Table.class.isInstance(block)) {
                indexAnchors(block.getBlocks());
            }
        }
    }

    // ids generated from a title holding tokens get the token names, generate them from the title text
    private String sectionId(final Section section) {
        final String id = section.getId();
        final String title = section.getTitle();
        if (id == null || !context.getRegistry().hasPlaceholder(title)) {
            return id;
        }
        final Document document = section.getDocument();
        final String generated = SectionIds.generate(title, document);
        if (!id.startsWith(generated)) {
            return id;
        }
        return SectionIds.generate(context.getRegistry().toPlainText(title), document) + id.substring(generated.length());
    }

    // blocks of AsciiDoc table cells are not in the anchor table
    private Optional<String> findReferencedTitle(final Document document, final String refId) {
        if (document == null || refId.isEmpty()) {
            return Optional.empty();
        }
        final Map<Object, Object> selector = new HashMap<>();
        selector.put("id", refId);
        selector.put("traverse_documents", true);
        try {
            return document.findBy(selector).stream()
                    .map(StructuralNode::getTitle)
                    .filter(t -> t != null && !t.isBlank())
                    .map(t -> unescapeHtml4(context.getRegistry().toPlainText(t)))
                    .findFirst();
        } catch (final RuntimeException re) {
            LOG.debug("Can't look up '{}': {}", refId, re.getMessage());
            return Optional.empty();
        }
    }

    private static boolean hasAutoToc(final Document document) {
        return document.hasAttribute("toc")
                && "auto".equals(String.valueOf(document.getAttribute("toc-placement")))
                && document.getBlocks().stream().anyMatch(Section.class::isInstance);
    }

    static String baseDir(final Document document) {
        if (document == null) {
            return null;
        }
        return nonBlank(attribute(document, "docdir"))
                .or(() -> ofNullable(document.getOptions().get("base_dir")).map(String::valueOf).filter(s -> !s.isBlank()))
                .orElse(null);
    }

    static Integer toInteger(final Object value) {
        if (value == null) {
            return null;
        }
        if (Number.class.isInstance(value)) {
            return Number.class.cast(value).intValue();
        }
        final String string = String.valueOf(value).trim();
        int end = 0;
        while (end < string.length() && Character.isDigit(string.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return null;
        }
        try {
            return Integer.valueOf(string.substring(0, end));
        } catch (final NumberFormatException nfe) { // too large for a size
            LOG.debug("Ignoring size '{}': {}", string, nfe.getMessage());
            return null;
        }
    }

    private static String contentOf(final StructuralNode node) {
        return ofNullable(node.getContent()).map(String::valueOf).orElse("");
    }

    private static String attribute(final ContentNode node, final String name) {
        return ofNullable(node.getAttribute(name)).map(String::valueOf).orElse(null);
    }

    private static Optional<String> nonBlank(final String value) {
        return ofNullable(value).filter(v -> !v.isBlank());
    }

    private static String describe(final StructuralNode node) {
        return ofNullable(node.getSourceLocation()).map(l -> " at " + l.getPath() + ":" + l.getLineNumber()).orElse("");
    }
}
