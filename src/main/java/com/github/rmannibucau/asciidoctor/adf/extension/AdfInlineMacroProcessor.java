package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Optional.ofNullable;

import java.util.HashMap;
import java.util.Map;

import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.ast.PhraseNode;
import org.asciidoctor.extension.InlineMacroProcessor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rmannibucau.asciidoctor.adf.AdfConverter;

/**
 * Inline macros emitting either plain text or an ADF node serialized as JSON,
 * the ADF backend turns the JSON back into a node.
 */
public abstract class AdfInlineMacroProcessor extends InlineMacroProcessor {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected boolean isAdf(final ContentNode parent) {
        return AdfConverter.BACKEND.equals(ofNullable(parent.getDocument())
                .map(document -> document.getAttribute("backend"))
                .map(String::valueOf)
                .orElse(null));
    }

    protected PhraseNode text(final ContentNode parent, final String text) {
        return createPhraseNode(parent, "quoted", text, new HashMap<>(), new HashMap<>(Map.of("type", ":unquoted")));
    }

    protected PhraseNode json(final ContentNode parent, final JsonNode node) {
        try {
            return text(parent, MAPPER.writeValueAsString(node));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    protected PhraseNode link(final ContentNode parent, final String text, final String url) {
        return createPhraseNode(parent, "anchor", text, new HashMap<>(), new HashMap<>(Map.of("type", ":link", "target", url)));
    }

    /**
     * @return the source of the invocation, {@code name:target[text]}.
     */
    protected String invocation(final String name, final String target, final Map<String, Object> attributes) {
        return name + ':' + ofNullable(target).orElse("") + '['
                + ofNullable(attributes).map(a -> a.get("text")).map(String::valueOf).orElse("") + ']';
    }
}
