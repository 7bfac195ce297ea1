package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Optional.ofNullable;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.StreamSupport;

import org.asciidoctor.ast.Document;
import org.asciidoctor.ast.StructuralNode;
import org.asciidoctor.extension.BlockMacroProcessor;
import org.asciidoctor.extension.Name;
import org.asciidoctor.extension.PositionalAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rmannibucau.asciidoctor.adf.client.ApiResult;
import com.github.rmannibucau.asciidoctor.adf.client.AtlassianClient;
import com.github.rmannibucau.asciidoctor.adf.client.AtlassianClientFactory;
import com.github.rmannibucau.asciidoctor.adf.reverse.AdfToAsciidocConverter;

/**
 * {@code jiraIssuesTable::['project = DEMO', fields='key,summary,Story Points', title='Backlog']}:
 * table of the issues matching the JQL query.
 * Any failure keeps the invocation in the output as a paragraph.
 */
@Name("jiraIssuesTable")
@PositionalAttributes("jql")
public class JiraIssuesTableBlockMacro extends BlockMacroProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(JiraIssuesTableBlockMacro.class);

    static final String FIELD_REFERENCE_LOGGED = "adf-jira-field-reference-logged";

    private static final Set<String> ATTRIBUTES = Set.of("jql", "fields", "title");

    private final ConfigResolver configResolver;

    private final AtlassianClientFactory clientFactory;

    private final JiraIssuesTableWriter writer = new JiraIssuesTableWriter(new AdfToAsciidocConverter());

    public JiraIssuesTableBlockMacro() {
        this(new ConfigResolver(), AtlassianClientFactory.http());
    }

    public JiraIssuesTableBlockMacro(final ConfigResolver configResolver, final AtlassianClientFactory clientFactory) {
        this.configResolver = configResolver;
        this.clientFactory = clientFactory;
    }

    @Override
    public Object process(final StructuralNode parent, final String target, final Map<String, Object> attributes) {
        final String rawFields = string(attributes, "fields");
        final List<String> unknownAttributes = attributes.keySet().stream()
                .map(String::valueOf)
                .filter(key -> !ATTRIBUTES.contains(key) && !key.startsWith("_") && !key.matches("\\d+"))
                .sorted()
                .collect(toList());
        if (!unknownAttributes.isEmpty()) {
            LOG.warn("Unknown attributes for jiraIssuesTable macro: {}", String.join(", ", unknownAttributes));
            return invocation(parent, jql(target, attributes), "INVALID ATTRIBUTES");
        }

        final JiraCredentials credentials = JiraCredentials.from(parent, configResolver);
        if (!credentials.isValid()) {
            LOG.warn("Missing Jira API credentials for jiraIssuesTable macro.");
            return invocation(parent, jql(target, attributes), rawFields);
        }

        final String jql = jql(target, attributes);
        if (jql == null || jql.isEmpty()) {
            LOG.warn("Missing JQL query for jiraIssuesTable macro.");
            return invocation(parent, "", rawFields);
        }

        final AtlassianClient client = clientFactory.create(credentials);
        final ApiResult<JsonNode> metadata = client.getFieldMetadata();
        final JiraFieldResolver resolver = new JiraFieldResolver(metadata);
        final JiraFieldResolver.Resolution resolution = resolver.resolve(JiraFieldList.parse(rawFields));
        if (!resolution.getUnknown().isEmpty()) {
            logFieldReference(parent.getDocument(), metadata);
            LOG.error("Unknown Jira field name(s): {}. Use an exact field name as shown above or the custom field id (e.g. customfield_12345).",
                    resolution.getUnknown().stream().map(f -> '"' + f + '"').collect(joining(", ")));
            return invocation(parent, jql, rawFields);
        }

        final ApiResult<JsonNode> result = client.queryIssues(jql, resolution.getResolved());
        final JsonNode issues = result.isSuccess() && result.getValue() != null ? result.getValue().get("issues") : null;
        if (issues == null || !issues.isArray()) {
            LOG.warn("Jira API query failed or returned no issues: {}", ofNullable(result.getError()).orElse("Unknown error"));
            return invocation(parent, jql, rawFields);
        }

        String content = writer.write(issues, resolution.getResolved(), resolver.fieldNames(),
                credentials.getBaseUrl().replaceFirst("/+$", ""));
        final String title = string(attributes, "title");
        if (title != null) {
            content = "**" + title + "**\n\n" + content;
        }
        final StructuralNode container = createBlock(parent, "open", List.of());
        parseContent(container, Arrays.asList(content.split("\n")));
        return container;
    }

    private StructuralNode invocation(final StructuralNode parent, final String jql, final String fields) {
        return createBlock(parent, "paragraph",
                "jiraIssuesTable::['" + ofNullable(jql).orElse("") + "', fields='" + ofNullable(fields).orElse("") + "']");
    }

    // once per document, listing custom fields first
    private void logFieldReference(final Document document, final ApiResult<JsonNode> metadata) {
        if (document != null && document.hasAttribute(FIELD_REFERENCE_LOGGED)) {
            return;
        }
        if (!metadata.isSuccess() || metadata.getValue() == null) {
            LOG.warn("Unable to fetch field metadata: {}", metadata.getError());
            return;
        }
        final List<JsonNode> fields = StreamSupport.stream(metadata.getValue().spliterator(), false).collect(toList());
        LOG.info("JIRA FIELD REFERENCE:");
        LOG.info("=====================");
        LOG.info("Custom Fields:");
        LOG.info("-------------");
        fields.stream().filter(f -> f.path("custom").asBoolean(false)).forEach(field -> {
            LOG.info(describe(field));
            if (field.hasNonNull("description")) {
                LOG.info(String.format("   Description: %s", field.get("description").asText()));
            }
        });
        LOG.info("");
        LOG.info("Standard Fields:");
        LOG.info("---------------");
        fields.stream().filter(f -> !f.path("custom").asBoolean(false)).forEach(field -> LOG.info(describe(field)));
        LOG.info("");
        LOG.info("USAGE EXAMPLE: jiraIssuesTable::['project = DEMO', fields='key,summary,status,customfield_10984']");
        LOG.info("=============");
        if (document != null) {
            document.setAttribute(FIELD_REFERENCE_LOGGED, "", true);
        }
    }

    private static String describe(final JsonNode field) {
        return String.format("%-25s = %-30s [%s]",
                field.path("id").asText(),
                '"' + field.path("name").asText("").stripTrailing() + '"',
                field.path("schema").path("type").asText("unknown"));
    }

    private static String jql(final String target, final Map<String, Object> attributes) {
        if (target != null && !target.isEmpty()) {
            return target;
        }
        return ofNullable(string(attributes, "jql")).orElseGet(() -> string(attributes, "1"));
    }

    private static String string(final Map<String, Object> attributes, final String key) {
        return ofNullable(attributes.get(key)).map(String::valueOf).orElse(null);
    }
}
