package com.github.rmannibucau.asciidoctor.adf.visitor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rmannibucau.asciidoctor.adf.image.ImageDimensionResolver;
import com.github.rmannibucau.asciidoctor.adf.inline.InlineContentParser;
import com.github.rmannibucau.asciidoctor.adf.inline.InlineNodeRegistry;
import com.github.rmannibucau.asciidoctor.adf.inline.PlaceholderExpander;

import lombok.Getter;

/**
 * State of one document conversion, nested documents of table cells share it.
 */
@Getter
public class ConversionContext {

    private final ObjectMapper mapper;

    private final InlineNodeRegistry registry = new InlineNodeRegistry();

    private final InlineContentParser parser;

    private final PlaceholderExpander expander;

    private final ImageDimensionResolver images;

    private final MarkupParser markupParser;

    // id -> plain title, used by cross references without text
    private final Map<String, String> anchors = new HashMap<>();

    public ConversionContext(final ObjectMapper mapper, final ImageDimensionResolver images,
                             final MarkupParser markupParser) {
        this.mapper = mapper;
        this.parser = new InlineContentParser(mapper);
        this.expander = new PlaceholderExpander(registry, parser);
        this.images = images;
        this.markupParser = markupParser;
    }

    public Optional<MarkupParser> markupParser() {
        return Optional.ofNullable(markupParser);
    }

    public void registerAnchor(final String id, final String title) {
        if (id != null && title != null && !title.isBlank()) {
            anchors.putIfAbsent(id, title);
        }
    }

    public Optional<String> findAnchorTitle(final String id) {
        return Optional.ofNullable(anchors.get(id));
    }

    /**
     * Releases the markup parser resources, it is recreated if the context is used again.
     */
    public void close() {
        if (AutoCloseable.class.isInstance(markupParser)) {
            try {
                AutoCloseable.class.cast(markupParser).close();
            } catch (final Exception e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
