package com.github.rmannibucau.asciidoctor.adf.reverse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.asciidoctor.Asciidoctor;
import org.asciidoctor.Options;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.github.rmannibucau.asciidoctor.adf.AdfConverter;

class AdfToAsciidocConverterTest {

    private final AdfToAsciidocConverter converter = new AdfToAsciidocConverter();

    private String doc(final String content) {
        return converter.convert("{\"version\":1,\"type\":\"doc\",\"content\":[" + content + "]}");
    }

    @Nested
    class Text {

        @Test
        void paragraph() {
            assertThat(doc("{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"Hello\"}]}"))
                    .isEqualTo("\nHello\n");
        }

        @Test
        void emptyParagraph() {
            assertThat(doc("{\"type\":\"paragraph\",\"content\":[]}")).isEmpty();
        }

        @Test
        @DisplayName("marks wrap the text in their order")
        void marks() {
            assertThat(doc("{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"x\",\"marks\":["
                    + "{\"type\":\"strong\"},{\"type\":\"em\"}]}]}")).isEqualTo("\n_*x*_\n");
            assertThat(doc("{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"gone\",\"marks\":["
                    + "{\"type\":\"strike\"}]}]}")).isEqualTo("\n[line-through]#_gone_#\n");
        }

        @Test
        void link() {
            assertThat(doc("{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"site\",\"marks\":["
                    + "{\"type\":\"link\",\"attrs\":{\"href\":\"https://example.com\"}}]}]}"))
                    .isEqualTo("\nlink:https://example.com[site]\n");
        }

        @Test
        void hardBreakAndCode() {
            assertThat(doc("{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"a\"},{\"type\":\"hardBreak\"},"
                    + "{\"type\":\"text\",\"text\":\"b\",\"marks\":[{\"type\":\"code\"}]}]}")).isEqualTo("\na\n`b`\n");
        }

        @Test
        void mention() {
            assertThat(doc("{\"type\":\"paragraph\",\"content\":[{\"type\":\"mention\",\"attrs\":{\"id\":\"1\",\"text\":\"@John Doe\"}}]}"))
                    .isEqualTo("\natlasMention:John_Doe[]\n");
        }
    }

    @Nested
    class Blocks {

        @Test
        void heading() {
            assertThat(doc("{\"type\":\"heading\",\"attrs\":{\"level\":2},\"content\":[{\"type\":\"text\",\"text\":\"Intro\"}]}"))
                    .isEqualTo("\n== Intro\n");
        }

        @Test
        void nestedBulletList() {
            final String adf = "{\"type\":\"bulletList\",\"content\":["
                    + "{\"type\":\"listItem\",\"content\":[{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"one\"}]}]},"
                    + "{\"type\":\"listItem\",\"content\":[{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"two\"}]},"
                    + "{\"type\":\"bulletList\",\"content\":[{\"type\":\"listItem\",\"content\":["
                    + "{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"nested\"}]}]}]}]}]}";
            assertThat(doc(adf)).isEqualTo("\n* one\n* two\n** nested\n");
        }

        @Test
        void orderedList() {
            final String adf = "{\"type\":\"orderedList\",\"content\":["
                    + "{\"type\":\"listItem\",\"content\":[{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"first\"}]}]}]}";
            assertThat(doc(adf)).isEqualTo("\n. first\n");
        }

        @Test
        void codeBlock() {
            assertThat(doc("{\"type\":\"codeBlock\",\"attrs\":{\"language\":\"java\"},\"content\":[{\"type\":\"text\",\"text\":\"int a;\"}]}"))
                    .isEqualTo("\n[source,java]\n----\nint a;\n----\n");
        }

        @Test
        void rule() {
            assertThat(doc("{\"type\":\"rule\"}")).isEqualTo("\n'''\n");
        }

        @Test
        void panels() {
            assertThat(doc("{\"type\":\"panel\",\"attrs\":{\"panelType\":\"success\"},\"content\":["
                    + "{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"Done\"}]}]}"))
                    .isEqualTo("\n[TIP]\n====\nDone\n====\n");
            assertThat(doc("{\"type\":\"panel\",\"attrs\":{\"panelType\":\"custom\"},\"content\":[]}"))
                    .isEqualTo("\n[NOTE]\n====\n\n====\n");
        }

        @Test
        @DisplayName("unknown nodes only render their children")
        void unknownNode() {
            assertThat(doc("{\"type\":\"expand\",\"content\":[{\"type\":\"paragraph\",\"content\":[{\"type\":\"text\",\"text\":\"inside\"}]}]}"))
                    .isEqualTo("\ninside\n");
        }
    }

    @Test
    void invalidJson() {
        assertThatThrownBy(() -> converter.convert("{not json")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a plain paragraph survives a round trip")
    void roundTrip() {
        try (final Asciidoctor asciidoctor = Asciidoctor.Factory.create()) {
            final String adf = asciidoctor.convert("This is a paragraph.", Options.builder().backend(AdfConverter.BACKEND).build());
            assertThat(converter.convert(adf).strip()).isEqualTo("This is a paragraph.");
        }
    }
}
