package com.github.rmannibucau.asciidoctor.adf.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

class AdfMediaTest {

    private static ObjectNode attrs(final String id) {
        final ObjectNode attrs = AdfNodes.object();
        attrs.put("type", "file");
        attrs.put("id", id);
        attrs.put("collection", "attachments");
        return attrs;
    }

    private static ObjectNode media(final String id) {
        return AdfNodes.media(attrs(id));
    }

    @Test
    @DisplayName("block and inline media ids are replaced at any depth")
    void replacesIds() {
        final ObjectNode inline = AdfNodes.mediaInline(attrs("icon.png"));
        final ObjectNode doc = AdfNodes.doc(List.of(
                AdfNodes.mediaSingle("wide", null, media("diagram.png")),
                AdfNodes.paragraph(List.of(AdfNodes.text("see "), inline))));

        final JsonNode updated = AdfMedia.updateMediaIds(doc, Map.of("diagram.png", "id-1", "icon.png", "id-2"));

        assertThat(updated.at("/content/0/content/0/attrs/id").asText()).isEqualTo("id-1");
        assertThat(updated.at("/content/1/content/1/attrs/id").asText()).isEqualTo("id-2");
        assertThat(doc.at("/content/0/content/0/attrs/id").asText()).isEqualTo("diagram.png");
    }

    @Test
    void unknownNamesAreKept() {
        final ObjectNode doc = AdfNodes.doc(List.of(AdfNodes.mediaSingle("wide", null, media("other.png"))));
        assertThat(AdfMedia.updateMediaIds(doc, Map.of("diagram.png", "id-1")).at("/content/0/content/0/attrs/id").asText())
                .isEqualTo("other.png");
    }

    @Test
    void emptyMapping() {
        final ObjectNode doc = AdfNodes.doc(List.of());
        assertThat(AdfMedia.updateMediaIds(doc, Map.of())).isSameAs(doc);
        assertThat(AdfMedia.updateMediaIds(null, Map.of("a", "b"))).isNull();
    }
}
