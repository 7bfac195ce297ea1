package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Locale.ROOT;
import static java.util.stream.Collectors.joining;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rmannibucau.asciidoctor.adf.reverse.AdfToAsciidocConverter;

/**
 * Renders Jira issues as an AsciiDoc table, rich values (ADF documents, multi-line text, bullets)
 * become {@code a|} cells.
 */
public class JiraIssuesTableWriter {

    private static final String BLOCK_CELL = "a|\n";

    private static final Pattern WIKI_LINK_WITH_TEXT = Pattern.compile("\\[(https?://[^\\]]+?)\\|([^\\]|]+?)(?:\\|[^\\]]+?)?\\]");

    private static final Pattern WIKI_LINK = Pattern.compile("\\[(https?://[^\\]|]+)\\]");

    private static final Pattern BULLET = Pattern.compile("^[ \\t]*[*\\-][ \\t]+", Pattern.MULTILINE);

    private static final Pattern STAR_BULLET = Pattern.compile("^[ \\t]*\\*[ \\t]+.*");

    private final AdfToAsciidocConverter adfConverter;

    public JiraIssuesTableWriter(final AdfToAsciidocConverter adfConverter) {
        this.adfConverter = adfConverter;
    }

    /**
     * @param issues     the {@code issues} array of a search response.
     * @param fields     resolved field ids, one column each.
     * @param fieldNames field id to display name, used for custom field headers.
     * @param baseUrl    Jira site, issue keys link to {@code <baseUrl>/browse/<key>}.
     */
    public String write(final JsonNode issues, final List<String> fields, final Map<String, String> fieldNames,
                        final String baseUrl) {
        final StringBuilder table = new StringBuilder()
                .append("[cols=\"").append(fields.stream().map(this::columnWidth).collect(joining(",")))
                .append("\", options=\"header,autowidth\"]\n")
                .append("|===\n")
                .append("| ").append(fields.stream().map(f -> header(f, fieldNames)).collect(joining(" | "))).append('\n');
        if (issues != null) {
            issues.forEach(issue -> table.append(row(issue, fields, baseUrl)));
        }
        return table.append("|===\n").toString();
    }

    private String columnWidth(final String field) {
        switch (field) {
        case "summary":
            return "2";
        case "description":
            return "3";
        default:
            return "1";
        }
    }

    private String header(final String field, final Map<String, String> fieldNames) {
        if (field.startsWith("customfield_") && fieldNames.get(field) != null) {
            return fieldNames.get(field);
        }
        return capitalize(field);
    }

    private String row(final JsonNode issue, final List<String> fields, final String baseUrl) {
        final StringBuilder row = new StringBuilder();
        for (final String field : fields) {
            final JsonNode value = issue.path("fields").get(field);
            final String cell;
            switch (field) {
            case "key":
                cell = key(issue.path("key").asText(""), baseUrl);
                break;
            case "status":
                cell = status(value);
                break;
            default:
                cell = value(value);
            }
            if (cell.startsWith("a|")) {
                row.append(cell);
            } else {
                row.append("| ").append(cell.replace("|", "\\|"));
            }
            if (row.charAt(row.length() - 1) != '\n') {
                row.append('\n');
            }
        }
        return row.toString();
    }

    String key(final String key, final String baseUrl) {
        return "link:" + baseUrl + "/browse/" + key + "[" + key + "]";
    }

    String status(final JsonNode status) {
        if (status == null || status.isNull()) {
            return "";
        }
        if (!status.isObject()) {
            return status.asText();
        }
        final JsonNode category = status.path("statusCategory").get("name");
        final String name = status.hasNonNull("name") ? status.get("name").asText() : null;
        if (category != null && !category.isNull()) {
            return name + " (" + category.asText() + ")";
        }
        return name != null ? name : status.toString();
    }

    String value(final JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        if (value.isArray()) {
            return array(value);
        }
        if (value.isObject()) {
            if ("doc".equals(value.path("type").asText())) {
                final String converted = adfConverter.convert(value).replaceAll("^\\n+", "").replaceAll("\\n+$", "");
                return BLOCK_CELL + ensureBlankLineBeforeLists(converted);
            }
            return object(value);
        }
        if (value.isTextual()) {
            return text(value.asText());
        }
        return value.asText();
    }

    private String array(final JsonNode array) {
        if (array.isEmpty()) {
            return "";
        }
        final JsonNode first = array.get(0);
        if (!first.isObject()) {
            return stream(array).map(JsonNode::asText).collect(joining(", "));
        }
        final String property = first.has("value") ? "value"
                : first.has("name") ? "name"
                : first.has("displayName") ? "displayName"
                : null;
        return stream(array)
                .map(item -> property == null ? item.toString() : item.path(property).asText(""))
                .collect(joining(", "));
    }

    private String object(final JsonNode object) {
        for (final String property : List.of("value", "name", "displayName")) {
            if (object.has(property)) {
                return object.get(property).asText();
            }
        }
        return object.toString();
    }

    private String text(final String raw) {
        if (raw.isEmpty()) {
            return "";
        }
        final String content = wikiLinks(raw);
        if (content.contains("\n") || BULLET.matcher(content).find()) {
            return BLOCK_CELL + complexContent(content);
        }
        return content.replaceAll("[\\r\\n]+", " ");
    }

    static String wikiLinks(final String content) {
        final Matcher withText = WIKI_LINK_WITH_TEXT.matcher(content);
        final StringBuilder out = new StringBuilder();
        while (withText.find()) {
            withText.appendReplacement(out, Matcher.quoteReplacement("link:" + withText.group(1) + "[" + withText.group(2) + "]"));
        }
        withText.appendTail(out);
        return WIKI_LINK.matcher(out.toString()).replaceAll(m -> Matcher.quoteReplacement("link:" + m.group(1) + "[" + m.group(1) + "]"));
    }

    private String complexContent(final String content) {
        final List<String> lines = new ArrayList<>();
        for (final String line : content.split("\\r?\\n")) {
            if (STAR_BULLET.matcher(line).matches()) {
                final String previous = lastNonBlank(lines);
                if (previous != null && !previous.startsWith("* ")) {
                    lines.add("");
                }
                lines.add(line.replaceFirst("^[ \\t]*\\*", "*").replaceFirst("\\*[ ]+", "* "));
            } else {
                lines.add(line);
            }
        }
        return ensureBlankLineBeforeLists(String.join("\n", lines));
    }

    static String ensureBlankLineBeforeLists(final String text) {
        final List<String> out = new ArrayList<>();
        String previousNonBlank = null;
        for (final String line : text.split("\n")) {
            if (line.startsWith("* ") && previousNonBlank != null && !previousNonBlank.startsWith("* ")
                    && !out.isEmpty() && !out.get(out.size() - 1).isEmpty()) {
                out.add("");
            }
            out.add(line);
            if (!line.isBlank()) {
                previousNonBlank = line;
            }
        }
        return String.join("\n", out);
    }

    private static String lastNonBlank(final List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) {
                return lines.get(i);
            }
        }
        return null;
    }

    private static String capitalize(final String value) {
        if (value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(ROOT) + value.substring(1).toLowerCase(ROOT);
    }

    private static Stream<JsonNode> stream(final JsonNode array) {
        return StreamSupport.stream(array.spliterator(), false);
    }
}
