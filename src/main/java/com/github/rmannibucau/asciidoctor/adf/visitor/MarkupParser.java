package com.github.rmannibucau.asciidoctor.adf.visitor;

import java.util.Optional;

import org.asciidoctor.ast.Document;

/**
 * Parses a standalone AsciiDoc fragment, used for table cells which only carry their source.
 */
public interface MarkupParser {

    /**
     * @param source  the AsciiDoc fragment.
     * @param context the enclosing document, its safe mode, attributes and base directory are inherited.
     * @return the parsed document, empty if the fragment can't be parsed.
     */
    Optional<Document> parse(String source, Document context);
}
