package com.github.rmannibucau.asciidoctor.adf.model;

import static java.util.Locale.ROOT;
import static java.util.Optional.ofNullable;

import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.ast.Document;
import org.asciidoctor.ast.PhraseNode;

/**
 * Closed set of Asciidoctor node kinds the ADF backend knows about.
 */
public enum SourceKind {
    DOCUMENT,
    EMBEDDED,
    PREAMBLE,
    OPEN,
    PARAGRAPH,
    SECTION,
    ULIST,
    OLIST,
    TABLE,
    QUOTE,
    IMAGE,
    ADMONITION,
    LISTING,
    LITERAL,
    PASS,
    PAGE_BREAK,
    TOC,
    SIDEBAR,
    FLOATING_TITLE,
    THEMATIC_BREAK,
    INLINE_ANCHOR,
    INLINE_QUOTED,
    INLINE_IMAGE,
    INLINE_BREAK,
    INLINE_OTHER,
    UNSUPPORTED;

    public static SourceKind of(final ContentNode node) {
        if (Document.class.isInstance(node)) {
            return DOCUMENT;
        }
        final String context = ofNullable(node.getContext()).orElse("").toLowerCase(ROOT);
        if (PhraseNode.class.isInstance(node)) {
            switch (context) {
            case "anchor":
                return INLINE_ANCHOR;
            case "quoted":
                return INLINE_QUOTED;
            case "image":
                return INLINE_IMAGE;
            case "break":
                return INLINE_BREAK;
            default:
                return INLINE_OTHER;
            }
        }
        switch (context) {
        case "embedded":
            return EMBEDDED;
        case "preamble":
            return PREAMBLE;
        case "open":
            return OPEN;
        case "paragraph":
            return PARAGRAPH;
        case "section":
            return SECTION;
        case "ulist":
            return ULIST;
        case "olist":
            return OLIST;
        case "table":
            return TABLE;
        case "quote":
            return QUOTE;
        case "image":
            return IMAGE;
        case "admonition":
            return ADMONITION;
        case "listing":
            return LISTING;
        case "literal":
            return LITERAL;
        case "pass":
            return PASS;
        case "page_break":
            return PAGE_BREAK;
        case "toc":
            return TOC;
        case "sidebar":
            return SIDEBAR;
        case "floating_title":
            return FLOATING_TITLE;
        case "thematic_break":
            return THEMATIC_BREAK;
        default:
            return UNSUPPORTED;
        }
    }
}
