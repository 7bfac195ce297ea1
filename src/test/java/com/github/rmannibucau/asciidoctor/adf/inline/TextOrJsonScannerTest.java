package com.github.rmannibucau.asciidoctor.adf.inline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class TextOrJsonScannerTest {

    private final TextOrJsonScanner scanner = new TextOrJsonScanner(new ObjectMapper());

    @Nested
    class Literals {

        @Test
        void plainText() {
            assertThat(scanner.scan("just some text")).containsExactly(Segment.text("just some text"));
        }

        @Test
        void emptyInput() {
            assertThat(scanner.scan("")).isEmpty();
            assertThat(scanner.scan(null)).isEmpty();
        }

        @Test
        @DisplayName("empty object and array stay literal")
        void emptyContainers() {
            assertThat(scanner.scan("a {} b [] c")).containsExactly(Segment.text("a {} b [] c"));
        }

        @Test
        @DisplayName("unbalanced fragments never throw and stay literal")
        void unbalanced() {
            assertThat(scanner.scan("before {\"type\":\"text\"")).containsExactly(Segment.text("before {\"type\":\"text\""));
            assertThat(scanner.scan("a ] b } c")).containsExactly(Segment.text("a ] b } c"));
        }

        @Test
        void malformedJson() {
            assertThat(scanner.scan("see {not json} here")).containsExactly(Segment.text("see {not json} here"));
        }
    }

    @Nested
    class Fragments {

        @Test
        void objectBetweenText() {
            final List<Segment> segments = scanner.scan("Hello {\"type\":\"mention\",\"attrs\":{\"id\":\"1\"}} world");
            assertThat(segments).hasSize(3);
            assertThat(segments.get(0)).isEqualTo(Segment.text("Hello "));
            assertThat(segments.get(1).isText()).isFalse();
            assertThat(segments.get(1).getJson().path("attrs").path("id").asText()).isEqualTo("1");
            assertThat(segments.get(2)).isEqualTo(Segment.text(" world"));
        }

        @Test
        @DisplayName("braces inside JSON strings don't change the nesting")
        void bracesInStrings() {
            final List<Segment> segments = scanner.scan("{\"type\":\"text\",\"text\":\"a } b { \\\" ]\"}");
            assertThat(segments).hasSize(1);
            assertThat(segments.get(0).getJson().path("text").asText()).isEqualTo("a } b { \" ]");
        }

        @Test
        void htmlEntitiesAreDecodedByDefault() {
            final List<Segment> segments = scanner.scan("{&quot;type&quot;:&quot;rule&quot;}");
            assertThat(segments).hasSize(1);
            assertThat(segments.get(0).getJson().path("type").asText()).isEqualTo("rule");
        }

        @Test
        void rawScanKeepsEntities() {
            assertThat(scanner.scan("{&quot;a&quot;:1}", false)).containsExactly(Segment.text("{&quot;a&quot;:1}"));
        }

        @Test
        void arrays() {
            final List<Segment> segments = scanner.scan("[{\"type\":\"hardBreak\"}]");
            assertThat(segments).hasSize(1);
            assertThat(segments.get(0).getJson().isArray()).isTrue();
        }
    }
}
