package com.github.rmannibucau.asciidoctor.adf.visitor;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.asciidoctor.Asciidoctor;
import org.asciidoctor.Options;
import org.asciidoctor.SafeMode;
import org.asciidoctor.ast.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AsciidoctorMarkupParserTest {

    private static Asciidoctor asciidoctor;

    @BeforeAll
    static void start() {
        asciidoctor = Asciidoctor.Factory.create();
    }

    @AfterAll
    static void stop() {
        asciidoctor.close();
    }

    @Test
    void blankSource() {
        final AsciidoctorMarkupParser parser = new AsciidoctorMarkupParser(asciidoctor);
        assertThat(parser.parse(null, null)).isEmpty();
        assertThat(parser.parse("  \n", null)).isEmpty();
    }

    @Test
    void parse() {
        final Document document = new AsciidoctorMarkupParser(asciidoctor).parse("* one\n* two\n\nAfter.", null).orElseThrow();
        assertThat(document.getBlocks()).extracting(b -> b.getContext()).containsExactly("ulist", "paragraph");
    }

    @Test
    void inheritsEnclosingDocument() {
        final Document context = asciidoctor.load(":product: Widget\n\nText.", Options.builder()
                .safe(SafeMode.SERVER)
                .build());
        final Document cell = new AsciidoctorMarkupParser(asciidoctor).parse("The {product}.", context).orElseThrow();

        assertThat(cell.getAttribute("product")).isEqualTo("Widget");
        assertThat(cell.getBlocks()).hasSize(1);
    }

    @Test
    void defaults() {
        final Map<String, Object> options = new AsciidoctorMarkupParser(asciidoctor).options(null).map();
        assertThat(options).containsEntry("backend", "adf").containsEntry("safe", SafeMode.SAFE.getLevel());
    }

    @Test
    @DisplayName("closing releases the instance created on first use")
    void closeCreatedInstance() {
        final AsciidoctorMarkupParser parser = new AsciidoctorMarkupParser();
        assertThat(parser.hasCreatedInstance()).isFalse();

        assertThat(parser.parse("Text.", null)).isPresent();
        assertThat(parser.hasCreatedInstance()).isTrue();

        parser.close();
        assertThat(parser.hasCreatedInstance()).isFalse();
    }

    @Test
    @DisplayName("a provided instance stays usable after close")
    void closeKeepsProvidedInstance() {
        final AsciidoctorMarkupParser parser = new AsciidoctorMarkupParser(asciidoctor);
        parser.close();

        assertThat(parser.hasCreatedInstance()).isFalse();
        assertThat(asciidoctor.load("Still open.", Options.builder().build()).getBlocks()).hasSize(1);
        assertThat(parser.parse("Again.", null)).isPresent();
    }
}
