package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.stream.Collectors.toList;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.text.StringTokenizer;

/**
 * Parses the {@code fields} attribute of the issues table macro: a CSV line where tokens may be
 * double quoted ({@code "a, b"}) or single quoted ({@code 'a, b'} with {@code ''} as escaped quote).
 */
final class JiraFieldList {

    static final List<String> DEFAULT_FIELDS = List.of("key", "summary", "status");

    // only whole single quoted tokens, single quotes inside a double quoted token are kept
    private static final Pattern SINGLE_QUOTED = Pattern.compile("(^|,)\\s*'([^']*(?:''[^']*)*)'\\s*(?=,|$)");

    private JiraFieldList() {
        // no-op
    }

    static List<String> parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_FIELDS;
        }
        final StringTokenizer tokenizer = StringTokenizer.getCSVInstance(toDoubleQuotes(raw));
        tokenizer.setIgnoreEmptyTokens(true);
        return tokenizer.getTokenList().stream()
                .map(String::strip)
                .filter(field -> !field.isEmpty())
                .collect(toList());
    }

    static String toDoubleQuotes(final String raw) {
        final Matcher matcher = SINGLE_QUOTED.matcher(raw);
        final StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            final String inner = matcher.group(2).replace("''", "'");
            matcher.appendReplacement(out, Matcher.quoteReplacement(
                    matcher.group(1) + '"' + inner.replace("\"", "\"\"") + '"'));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
