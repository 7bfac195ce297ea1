package com.github.rmannibucau.asciidoctor.adf.visitor;

import static java.util.Locale.ROOT;
import static java.util.Optional.ofNullable;

import java.util.regex.Pattern;

import org.asciidoctor.ast.Document;

/**
 * Section id generation as Asciidoctor does it ({@code idprefix}, {@code idseparator}),
 * without the duplicate suffix which is kept from the parsed id.
 */
final class SectionIds {

    private static final Pattern INVALID_CHARS = Pattern.compile(
            "<[^>]+>|&(?:[a-z][a-z]+\\d{0,2}|#\\d\\d\\d{0,4}|#x[\\da-f][\\da-f][\\da-f]{0,3});|[^ \\w\\-.]+?",
            Pattern.UNICODE_CHARACTER_CLASS);

    private SectionIds() {
        // no-op
    }

    static String generate(final String title, final Document document) {
        final String prefix = ofNullable(attribute(document, "idprefix")).orElse("_");
        final String configuredSeparator = attribute(document, "idseparator");
        final String id = prefix + INVALID_CHARS.matcher(title.toLowerCase(ROOT)).replaceAll("");
        if (configuredSeparator != null && configuredSeparator.isEmpty()) {
            return id.replace(" ", "");
        }

        final char separator = configuredSeparator == null ? '_' : configuredSeparator.charAt(0);
        final String replaced = separator == '-' || separator == '.' ? " .-" : " " + separator + ".-";
        final StringBuilder out = new StringBuilder(id.length());
        boolean squeezing = false;
        for (final char c : id.toCharArray()) {
            if (replaced.indexOf(c) >= 0) {
                if (!squeezing) {
                    out.append(separator);
                    squeezing = true;
                }
            } else {
                out.append(c);
                squeezing = false;
            }
        }
        if (out.length() > 0 && out.charAt(out.length() - 1) == separator) {
            out.setLength(out.length() - 1);
        }
        if (prefix.isEmpty() && out.length() > 0 && out.charAt(0) == separator) {
            out.deleteCharAt(0);
        }
        return out.toString();
    }

    private static String attribute(final Document document, final String name) {
        return document == null ? null : ofNullable(document.getAttribute(name)).map(String::valueOf).orElse(null);
    }
}
