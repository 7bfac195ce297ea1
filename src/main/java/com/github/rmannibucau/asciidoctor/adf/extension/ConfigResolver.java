package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Collections.emptyMap;
import static java.util.Optional.ofNullable;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.asciidoctor.ast.ContentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks a setting up in the document attributes, then in an explicit configuration (keyed by attribute name),
 * then in the environment (keyed by variable name). Blank values are ignored.
 */
public class ConfigResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigResolver.class);

    private final Map<String, String> configuration;

    private final Function<String, String> environment;

    private final Set<String> warnings = ConcurrentHashMap.newKeySet();

    public ConfigResolver() {
        this(emptyMap(), System::getenv);
    }

    public ConfigResolver(final Map<String, String> configuration, final Function<String, String> environment) {
        this.configuration = configuration == null ? emptyMap() : configuration;
        this.environment = environment == null ? key -> null : environment;
    }

    /**
     * @param node         any node of the document, its document attributes are read.
     * @param attribute    document attribute name, also the configuration key.
     * @param variableName environment variable name.
     * @return the first non blank value.
     */
    public Optional<String> resolve(final ContentNode node, final String attribute, final String variableName) {
        return fromDocument(node, attribute)
                .or(() -> nonBlank(configuration.get(attribute)))
                .or(() -> variableName == null ? Optional.empty() : nonBlank(environment.apply(variableName)));
    }

    /**
     * Logs a warning the first time a key is seen by this resolver.
     */
    public void warnOnce(final String key, final String message) {
        if (warnings.add(key)) {
            LOG.warn(message);
        }
    }

    private static Optional<String> fromDocument(final ContentNode node, final String attribute) {
        if (node == null) {
            return Optional.empty();
        }
        final ContentNode document = ofNullable((ContentNode) node.getDocument()).orElse(node);
        return nonBlank(ofNullable(document.getAttribute(attribute)).map(String::valueOf).orElse(null));
    }

    private static Optional<String> nonBlank(final String value) {
        return ofNullable(value).filter(v -> !v.isBlank());
    }
}
