package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Optional.ofNullable;

import java.util.Map;

import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.extension.Name;
import org.asciidoctor.extension.PositionalAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code jira:KEY-1[optional text]}: link to the issue.
 */
@Name("jira")
@PositionalAttributes("text")
public class JiraInlineMacro extends AdfInlineMacroProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(JiraInlineMacro.class);

    private final ConfigResolver configResolver;

    public JiraInlineMacro() {
        this(new ConfigResolver());
    }

    public JiraInlineMacro(final ConfigResolver configResolver) {
        this.configResolver = configResolver;
    }

    @Override
    public Object process(final ContentNode parent, final String target, final Map<String, Object> attributes) {
        final String baseUrl = configResolver.resolve(parent, "jira-base-url", "JIRA_BASE_URL")
                .or(() -> configResolver.resolve(parent, "atlassian-base-url", "ATLASSIAN_BASE_URL"))
                .map(url -> url.replaceFirst("/+$", ""))
                .orElse(null);
        if (baseUrl == null) {
            LOG.warn("No Jira base URL found, the Jira extension may not work as expected.");
            return text(parent, invocation("jira", target, attributes));
        }
        final String text = ofNullable(attributes.get("text")).map(String::valueOf).filter(t -> !t.isBlank()).orElse(target);
        return link(parent, text, baseUrl + "/browse/" + target);
    }
}
