package com.github.rmannibucau.asciidoctor.adf.inline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;

class InlineContentParserTest {

    private final InlineContentParser parser = new InlineContentParser(new ObjectMapper());

    @Nested
    class ParseOrEscape {

        @Test
        void plainParagraph() {
            final List<JsonNode> nodes = parser.parseOrEscape("Hello world");
            assertThat(nodes).containsExactly(AdfNodes.text("Hello world"));
        }

        @Test
        @DisplayName("'{}' and '[]' are text, not nodes")
        void emptyContainers() {
            assertThat(parser.parseOrEscape("{}")).containsExactly(AdfNodes.text("{}"));
            assertThat(parser.parseOrEscape("[]")).containsExactly(AdfNodes.text("[]"));
        }

        @Test
        void embeddedNodeIsSpliced() {
            final List<JsonNode> nodes = parser.parseOrEscape("Hi {\"type\":\"mention\",\"attrs\":{\"id\":\"42\",\"text\":\"@Bob\"}}!");
            assertThat(nodes).hasSize(3);
            assertThat(nodes.get(0).path("text").asText()).isEqualTo("Hi ");
            assertThat(nodes.get(1).path("type").asText()).isEqualTo("mention");
            assertThat(nodes.get(2).path("text").asText()).isEqualTo("!");
        }

        @Test
        @DisplayName("JSON which is not a node stays text")
        void jsonData() {
            assertThat(parser.parseOrEscape("config {\"a\":1}")).containsExactly(AdfNodes.text("config {\"a\":1}"));
        }

        @Test
        @DisplayName("text nodes without text are dropped")
        void emptyTextNode() {
            assertThat(parser.parseOrEscape("{\"type\":\"text\",\"text\":\"\"}")).isEmpty();
            assertThat(parser.parseOrEscape("a [{\"type\":\"text\"},{\"type\":\"hardBreak\"}] b"))
                    .extracting(n -> n.path("type").asText())
                    .containsExactly("text", "hardBreak", "text");
        }

        @Test
        void entitiesAreDecoded() {
            assertThat(parser.parseOrEscape("a &amp; b")).containsExactly(AdfNodes.text("a & b"));
        }
    }

    @Nested
    class TryParseInlineJson {

        @Test
        void noBrace() {
            assertThat(parser.tryParseInlineJson("nothing", List.of())).isEmpty();
        }

        @Test
        void keepsMarksOnLiterals() {
            final Optional<List<JsonNode>> nodes = parser.tryParseInlineJson("x {\"type\":\"hardBreak\"} y",
                    List.of(AdfNodes.mark("strong")));
            assertThat(nodes).isPresent();
            assertThat(nodes.get()).hasSize(3);
            assertThat(nodes.get().get(0).path("marks").get(0).path("type").asText()).isEqualTo("strong");
            assertThat(nodes.get().get(1).path("type").asText()).isEqualTo("hardBreak");
        }

        @Test
        void arrayOfNodes() {
            final Optional<List<JsonNode>> nodes = parser.tryParseInlineJson("[{\"type\":\"hardBreak\"},{\"type\":\"rule\"}]", null);
            assertThat(nodes).hasValueSatisfying(list -> assertThat(list).hasSize(2));
        }
    }

    @Test
    void isNode() {
        assertThat(InlineContentParser.isNode(AdfNodes.rule())).isTrue();
        assertThat(InlineContentParser.isNode(AdfNodes.object())).isFalse();
        assertThat(InlineContentParser.isNode(null)).isFalse();
    }
}
