package com.github.rmannibucau.asciidoctor.adf.extension;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;

/**
 * Confluence extension nodes of the Appfox Workflows app.
 */
final class AppfoxWorkflows {

    static final String ICON_URL = "https://ac-cloud.com/workflows/images/logo.png";

    static final String SCHEMA_VERSION = "1";

    static final String LAYOUT = "default";

    private AppfoxWorkflows() {
        // no-op
    }

    /**
     * @param value the parameter shown by the macro, {@code null} for none.
     */
    static ObjectNode parameters(final String title, final String value, final boolean indexedFirst) {
        final ObjectNode parameters = AdfNodes.object();
        final ObjectNode macroParams = parameters.putObject("macroParams");
        if (value != null) {
            macroParams.putObject("data").put("value", value);
        }
        final ObjectNode metadata = parameters.putObject("macroMetadata");
        metadata.putObject("schemaVersion").put("value", SCHEMA_VERSION);
        if (value != null && indexedFirst) {
            indexed(metadata, value);
        }
        metadata.putArray("placeholder").addObject()
                .put("type", "icon")
                .putObject("data").put("url", ICON_URL);
        metadata.put("title", title);
        if (value != null && !indexedFirst) {
            indexed(metadata, value);
        }
        return parameters;
    }

    static ObjectNode inlineMacro(final String key, final ObjectNode parameters) {
        return AdfNodes.inlineExtension(AdfNodes.CONFLUENCE_MACRO, key, parameters);
    }

    static ObjectNode blockMacro(final String key, final ObjectNode parameters) {
        final ObjectNode node = AdfNodes.extension(AdfNodes.CONFLUENCE_MACRO, key,
                Map.<String, JsonNode>of("layout", JsonNodeFactory.instance.textNode(LAYOUT)));
        ((ObjectNode) node.get("attrs")).set("parameters", parameters);
        return node;
    }

    private static void indexed(final ObjectNode metadata, final String value) {
        metadata.putObject("indexedMacroParams")
                .put("text", value)
                .put("type", "text");
    }
}
