package com.github.rmannibucau.asciidoctor.adf.visitor;

import static java.util.Locale.ROOT;
import static java.util.Optional.ofNullable;

import java.io.File;
import java.util.Map;
import java.util.Optional;

import org.asciidoctor.Asciidoctor;
import org.asciidoctor.Attributes;
import org.asciidoctor.Options;
import org.asciidoctor.OptionsBuilder;
import org.asciidoctor.SafeMode;
import org.asciidoctor.ast.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MarkupParser} backed by an {@link Asciidoctor} instance, created on first use when not provided.
 * Closing it only releases the instance it created.
 */
public class AsciidoctorMarkupParser implements MarkupParser, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AsciidoctorMarkupParser.class);

    private final Asciidoctor provided;

    private Asciidoctor created;

    public AsciidoctorMarkupParser() {
        this(null);
    }

    public AsciidoctorMarkupParser(final Asciidoctor asciidoctor) {
        this.provided = asciidoctor;
    }

    @Override
    public Optional<Document> parse(final String source, final Document context) {
        if (source == null || source.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(getAsciidoctor().load(source, options(context)));
        } catch (final RuntimeException re) {
            LOG.warn("Can't parse nested content: {}", re.getMessage());
            return Optional.empty();
        }
    }

    Options options(final Document context) {
        final OptionsBuilder builder = Options.builder().backend("adf").safe(SafeMode.SAFE);
        if (context == null) {
            return builder.build();
        }
        final Map<Object, Object> contextOptions = context.getOptions();
        ofNullable(contextOptions.get("safe")).map(AsciidoctorMarkupParser::toSafeMode).ifPresent(builder::safe);
        ofNullable(contextOptions.get("base_dir")).map(String::valueOf).map(File::new).ifPresent(builder::baseDir);

        final Attributes attributes = Attributes.builder().build();
        context.getAttributes().forEach(attributes::setAttribute);
        return builder.attributes(attributes).build();
    }

    private synchronized Asciidoctor getAsciidoctor() {
        if (provided != null) {
            return provided;
        }
        if (created == null) {
            created = Asciidoctor.Factory.create();
        }
        return created;
    }

    synchronized boolean hasCreatedInstance() {
        return created != null;
    }

    @Override
    public synchronized void close() {
        if (created != null) {
            created.close();
            created = null;
        }
    }

    private static SafeMode toSafeMode(final Object value) {
        if (Number.class.isInstance(value)) {
            return SafeMode.safeMode(Number.class.cast(value).intValue());
        }
        try {
            return SafeMode.valueOf(String.valueOf(value).replace(":", "").trim().toUpperCase(ROOT));
        } catch (final IllegalArgumentException iae) {
            return SafeMode.SAFE;
        }
    }
}
