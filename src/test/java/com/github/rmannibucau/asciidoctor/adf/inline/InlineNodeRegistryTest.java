package com.github.rmannibucau.asciidoctor.adf.inline;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;

class InlineNodeRegistryTest {

    private final InlineNodeRegistry registry = new InlineNodeRegistry();

    @Test
    void registerReturnsDelimitedHexToken() {
        assertThat(registry.register(AdfNodes.hardBreak())).isEqualTo("\u0000ADFNODE0\u0000");
        for (int i = 1; i < 10; i++) {
            registry.register(AdfNodes.rule());
        }
        assertThat(registry.register(AdfNodes.text("x"))).isEqualTo("\u0000ADFNODEa\u0000");
        assertThat(registry.size()).isEqualTo(11);
    }

    @Test
    void resolve() {
        registry.register(AdfNodes.text("first"));
        assertThat(registry.resolve("0")).hasValueSatisfying(n -> assertThat(n.path("text").asText()).isEqualTo("first"));
        assertThat(registry.resolve(3)).isEmpty();
        assertThat(registry.resolve("zz")).isEmpty();
    }

    @Test
    void hasPlaceholder() {
        final String token = registry.register(AdfNodes.text("a"));
        assertThat(registry.hasPlaceholder("before " + token + " after")).isTrue();
        assertThat(registry.hasPlaceholder("ADFNODE0")).isFalse();
        assertThat(registry.hasPlaceholder(null)).isFalse();
    }

    @Test
    void toPlainTextKeepsTextAndDropsOtherNodes() {
        final String text = registry.register(AdfNodes.text("bold"));
        final String hardBreak = registry.register(AdfNodes.hardBreak());
        assertThat(registry.toPlainText("a " + text + hardBreak + " b")).isEqualTo("a bold b");
    }
}
