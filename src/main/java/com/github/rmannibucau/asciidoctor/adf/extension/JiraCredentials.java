package com.github.rmannibucau.asciidoctor.adf.extension;

import org.asciidoctor.ast.ContentNode;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Atlassian site and API token used by the macros.
 */
@Getter
@RequiredArgsConstructor
@ToString(exclude = "apiToken")
public class JiraCredentials {

    private final String baseUrl;

    private final String confluenceBaseUrl;

    private final String apiToken;

    private final String userEmail;

    /**
     * {@code atlassian-base-url} wins over the deprecated {@code jira-base-url} and {@code confluence-base-url}.
     */
    public static JiraCredentials from(final ContentNode node, final ConfigResolver resolver) {
        final String unified = resolver.resolve(node, "atlassian-base-url", "ATLASSIAN_BASE_URL").orElse(null);
        final String jira = resolver.resolve(node, "jira-base-url", "JIRA_BASE_URL").orElse(null);
        final String confluence = resolver.resolve(node, "confluence-base-url", "CONFLUENCE_BASE_URL").orElse(null);
        if (unified == null) {
            if (jira != null) {
                resolver.warnOnce("jira-base-url",
                        "'jira-base-url' / JIRA_BASE_URL is deprecated. Use 'atlassian-base-url' / ATLASSIAN_BASE_URL instead.");
            }
            if (confluence != null) {
                resolver.warnOnce("confluence-base-url",
                        "'confluence-base-url' / CONFLUENCE_BASE_URL is deprecated. Use 'atlassian-base-url' / ATLASSIAN_BASE_URL instead.");
            }
        }
        return new JiraCredentials(
                first(unified, jira, confluence),
                first(unified, confluence, jira),
                resolver.resolve(node, "confluence-api-token", "CONFLUENCE_API_TOKEN").orElse(null),
                resolver.resolve(node, "confluence-user-email", "CONFLUENCE_USER_EMAIL").orElse(null));
    }

    public boolean isValid() {
        return baseUrl != null && apiToken != null && userEmail != null;
    }

    private static String first(final String... values) {
        for (final String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
