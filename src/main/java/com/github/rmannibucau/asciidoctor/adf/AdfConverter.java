package com.github.rmannibucau.asciidoctor.adf;

import static java.util.Collections.emptyMap;
import static java.util.Optional.ofNullable;

import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.asciidoctor.Asciidoctor;
import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.ast.Document;
import org.asciidoctor.ast.PhraseNode;
import org.asciidoctor.ast.StructuralNode;
import org.asciidoctor.converter.ConverterFor;
import org.asciidoctor.converter.StringConverter;
import org.asciidoctor.jruby.converter.spi.ConverterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rmannibucau.asciidoctor.adf.image.ImageDimensionResolver;
import com.github.rmannibucau.asciidoctor.adf.image.ImageIoProber;
import com.github.rmannibucau.asciidoctor.adf.image.ImageProber;
import com.github.rmannibucau.asciidoctor.adf.visitor.AdfVisitor;
import com.github.rmannibucau.asciidoctor.adf.visitor.AsciidoctorMarkupParser;
import com.github.rmannibucau.asciidoctor.adf.visitor.ConversionContext;
import com.github.rmannibucau.asciidoctor.adf.visitor.MarkupParser;

/**
 * Asciidoctor backend producing Atlassian Document Format JSON.
 */
@ConverterFor(value = AdfConverter.BACKEND, suffix = ".adf")
public class AdfConverter extends StringConverter implements ConverterRegistry, AutoCloseable {

    public static final String BACKEND = "adf";

    public static final String IMAGE_PROBER_OPTION = "adf.imageProber";

    public static final String MARKUP_PARSER_OPTION = "adf.markupParser";

    private static final Logger LOG = LoggerFactory.getLogger(AdfConverter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // documents parsed while a conversion runs (table cells parsed again) get their own converter,
    // their inline conversions must still land in the visitor of the running conversion
    private static final ThreadLocal<AdfVisitor> CONTEXTUAL_VISITOR = new ThreadLocal<>();

    // one converter per root document (nested documents reuse it): section titles are converted
    // while parsing, before convertDocument, and their tokens must resolve in the same registry
    private AdfVisitor visitor;

    public AdfConverter() { // for the SPI
        this(BACKEND, emptyMap());
    }

    public AdfConverter(final String backend, final Map<String, Object> opts) {
        super(backend, opts);
    }

    @Override
    public String convert(final ContentNode node, final String transform, final Map<Object, Object> opts) {
        if (Document.class.isInstance(node)) {
            return convertDocument(Document.class.cast(node));
        }
        if (PhraseNode.class.isInstance(node)) {
            return currentVisitor(node).onPhrase(PhraseNode.class.cast(node));
        }
        if (StructuralNode.class.isInstance(node)) {
            final AdfVisitor visitor = currentVisitor(node);
            final List<ObjectNode> nodes = visitor.convertBlock(StructuralNode.class.cast(node));
            visitor.getContext().getExpander().expand(nodes);
            final ArrayNode array = MAPPER.createArrayNode();
            nodes.forEach(array::add);
            return write(array);
        }
        throw new IllegalArgumentException("Unsupported node " + node);
    }

    private String convertDocument(final Document document) {
        final AdfVisitor previous = CONTEXTUAL_VISITOR.get();
        final AdfVisitor current = ownVisitor(document);
        CONTEXTUAL_VISITOR.set(current);
        try {
            return write(current.onDocument(document));
        } finally {
            current.getContext().close();
            if (previous == null) {
                CONTEXTUAL_VISITOR.remove();
            } else {
                CONTEXTUAL_VISITOR.set(previous);
            }
        }
    }

    private AdfVisitor currentVisitor(final ContentNode node) {
        return ofNullable(CONTEXTUAL_VISITOR.get()).orElseGet(() -> {
            LOG.debug("Converting '{}' while parsing", node.getContext());
            return ownVisitor(node.getDocument());
        });
    }

    private synchronized AdfVisitor ownVisitor(final Document document) {
        if (visitor == null) {
            visitor = createVisitor(document);
        }
        return visitor;
    }

    private AdfVisitor createVisitor(final Document document) {
        final Map<Object, Object> documentOptions = document == null ? emptyMap() : document.getOptions();
        final ImageProber prober = createComponent(option(documentOptions, IMAGE_PROBER_OPTION), ImageProber.class,
                ImageIoProber::new);
        final MarkupParser markupParser = createComponent(option(documentOptions, MARKUP_PARSER_OPTION),
                MarkupParser.class, AsciidoctorMarkupParser::new);
        return new AdfVisitor(new ConversionContext(MAPPER, new ImageDimensionResolver(prober), markupParser));
    }

    private Object option(final Map<Object, Object> documentOptions, final String key) {
        return ofNullable(documentOptions.get(key)).orElseGet(() -> getOptions().get(key));
    }

    private String write(final Object json) {
        try {
            return MAPPER.writeValueAsString(json);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public void register(final Asciidoctor asciidoctor) {
        asciidoctor.javaConverterRegistry().register(AdfConverter.class);
    }

    @Override
    public void close() {
        CONTEXTUAL_VISITOR.remove();
        final AdfVisitor current;
        synchronized (this) {
            current = visitor;
            visitor = null;
        }
        if (current != null) {
            current.getContext().close();
        }
    }

    static <T> T createComponent(final Object value, final Class<T> api, final Supplier<T> defaultValue) {
        if (value == null) {
            return defaultValue.get();
        }
        if (api.isInstance(value)) {
            return api.cast(value);
        }
        Class<?> type = null;
        if (String.class.isInstance(value)) {
            try {
                type = Thread.currentThread().getContextClassLoader().loadClass(String.valueOf(value).trim());
            } catch (final ClassNotFoundException e) {
                throw new IllegalArgumentException(e);
            }
        }
        if (Class.class.isInstance(value)) {
            type = Class.class.cast(value);
        }
        if (type != null) {
            try {
                return api.cast(type.getConstructor().newInstance());
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException e) {
                throw new IllegalStateException(e);
            } catch (final InvocationTargetException e) {
                throw new IllegalStateException(e.getTargetException());
            }
        }
        throw new IllegalArgumentException("Unsupported " + api.getSimpleName() + ": " + value);
    }
}
