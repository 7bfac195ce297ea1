package com.github.rmannibucau.asciidoctor.adf.model;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Rewrites media references of a converted document once its images are uploaded as attachments.
 */
public final class AdfMedia {

    private AdfMedia() {
        // no-op
    }

    /**
     * @param adf             the converted document, left untouched.
     * @param fileIdsByName   attachment file id per image target.
     * @return a copy where every {@code media} and {@code mediaInline} id found in the mapping is replaced.
     */
    public static JsonNode updateMediaIds(final JsonNode adf, final Map<String, String> fileIdsByName) {
        if (adf == null || fileIdsByName == null || fileIdsByName.isEmpty()) {
            return adf;
        }
        final JsonNode copy = adf.deepCopy();
        update(copy, fileIdsByName);
        return copy;
    }

    private static void update(final JsonNode node, final Map<String, String> fileIdsByName) {
        if (node.isObject()) {
            final String type = node.path("type").asText();
            final JsonNode attrs = node.path("attrs");
            if (("media".equals(type) || "mediaInline".equals(type)) && attrs.isObject()) {
                final String fileId = fileIdsByName.get(attrs.path("id").asText(""));
                if (fileId != null) {
                    ObjectNode.class.cast(attrs).put("id", fileId);
                }
            }
        }
        if (node.isContainerNode()) {
            node.forEach(child -> update(child, fileIdsByName));
        }
    }
}
