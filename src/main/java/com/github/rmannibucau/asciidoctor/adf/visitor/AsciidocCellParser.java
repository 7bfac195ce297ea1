package com.github.rmannibucau.asciidoctor.adf.visitor;

import static java.util.Optional.ofNullable;

import java.util.List;

import org.asciidoctor.ast.Cell;
import org.asciidoctor.ast.Document;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;

/**
 * Converts {@code a|} table cells: the blocks of their nested document, or their source parsed
 * again when Asciidoctor didn't, or a single paragraph.
 */
public class AsciidocCellParser {

    private final AdfVisitor visitor;

    private final ConversionContext context;

    public AsciidocCellParser(final AdfVisitor visitor, final ConversionContext context) {
        this.visitor = visitor;
        this.context = context;
    }

    public List<ObjectNode> parse(final Cell cell) {
        final Document inner = cell.getInnerDocument();
        final String text = ofNullable(cell.getText()).orElse("");

        List<ObjectNode> content = inner == null ? List.of() : visitor.convertBlocks(inner.getBlocks());
        if (content.isEmpty() && !text.isBlank() && (inner == null || inner.getBlocks().isEmpty())) {
            content = context.markupParser()
                    .flatMap(parser -> parser.parse(text, cell.getDocument()))
                    .map(document -> visitor.convertBlocks(document.getBlocks()))
                    .orElse(List.of());
        }
        if (content.isEmpty() && !text.isEmpty()) {
            content = List.of(AdfNodes.paragraph(visitor.parse(text)));
        }
        return content;
    }
}
