package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Locale.ROOT;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rmannibucau.asciidoctor.adf.client.ApiResult;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Maps user facing field names to Jira field ids using the field metadata of the instance.
 */
public class JiraFieldResolver {

    private static final Pattern CUSTOM_FIELD = Pattern.compile("^customfield_\\d+$");

    private static final Set<String> BUILTIN_FIELDS = Set.of("key", "summary", "status", "description");

    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final ApiResult<JsonNode> metadata;

    private Map<String, String> idsByName;

    public JiraFieldResolver(final ApiResult<JsonNode> metadata) {
        this.metadata = metadata;
    }

    /**
     * When the metadata is unavailable every field is returned as resolved, unchanged.
     */
    public Resolution resolve(final List<String> fields) {
        if (!isAvailable()) {
            return new Resolution(List.copyOf(fields), List.of());
        }
        final Map<String, String> lookup = idsByName();
        final List<String> resolved = new ArrayList<>();
        final List<String> unknown = new ArrayList<>();
        for (final String field : fields) {
            if (CUSTOM_FIELD.matcher(field).matches() || BUILTIN_FIELDS.contains(field)) {
                resolved.add(field);
                continue;
            }
            final String id = lookup.get(normalize(field));
            if (id == null) {
                unknown.add(field);
            } else {
                resolved.add(id);
            }
        }
        return new Resolution(resolved, unknown);
    }

    /**
     * @return field id to display name (trailing spaces removed), empty without metadata.
     */
    public Map<String, String> fieldNames() {
        final Map<String, String> names = new LinkedHashMap<>();
        if (isAvailable()) {
            metadata.getValue().forEach(field -> {
                final JsonNode id = field.get("id");
                if (id != null && id.isTextual()) {
                    names.put(id.asText(), field.hasNonNull("name") ? field.get("name").asText().stripTrailing() : null);
                }
            });
        }
        return names;
    }

    private boolean isAvailable() {
        return metadata != null && metadata.isSuccess() && metadata.getValue() != null && metadata.getValue().isArray();
    }

    private Map<String, String> idsByName() {
        if (idsByName == null) {
            idsByName = new HashMap<>();
            metadata.getValue().forEach(field -> {
                if (field.hasNonNull("name") && field.hasNonNull("id")) {
                    idsByName.put(normalize(field.get("name").asText().stripTrailing()), field.get("id").asText());
                }
            });
        }
        return idsByName;
    }

    static String normalize(final String name) {
        return SPACES.matcher(name.strip().toLowerCase(ROOT)).replaceAll(" ");
    }

    @Getter
    @RequiredArgsConstructor
    public static class Resolution {

        private final List<String> resolved;

        private final List<String> unknown;
    }
}
