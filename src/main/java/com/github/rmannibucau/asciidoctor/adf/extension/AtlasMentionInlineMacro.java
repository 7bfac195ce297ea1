package com.github.rmannibucau.asciidoctor.adf.extension;

import java.util.Map;
import java.util.Optional;

import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.extension.Name;
import org.asciidoctor.extension.PositionalAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rmannibucau.asciidoctor.adf.client.AtlassianClientFactory;
import com.github.rmannibucau.asciidoctor.adf.client.AtlassianUser;
import com.github.rmannibucau.asciidoctor.adf.model.AdfNodes;

/**
 * {@code atlasMention:First_Last[]}: mention of the Confluence user with this full name.
 */
@Name("atlasMention")
@PositionalAttributes("text")
public class AtlasMentionInlineMacro extends AdfInlineMacroProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(AtlasMentionInlineMacro.class);

    private final ConfigResolver configResolver;

    private final AtlassianClientFactory clientFactory;

    public AtlasMentionInlineMacro() {
        this(new ConfigResolver(), AtlassianClientFactory.http());
    }

    public AtlasMentionInlineMacro(final ConfigResolver configResolver, final AtlassianClientFactory clientFactory) {
        this.configResolver = configResolver;
        this.clientFactory = clientFactory;
    }

    @Override
    public Object process(final ContentNode parent, final String target, final Map<String, Object> attributes) {
        final String name = target.replace('_', ' ');
        final String plain = "@" + name;
        if (!isAdf(parent)) {
            return text(parent, plain);
        }

        final JiraCredentials credentials = JiraCredentials.from(parent, configResolver);
        if (credentials.getConfluenceBaseUrl() == null || credentials.getApiToken() == null || credentials.getUserEmail() == null) {
            LOG.warn("Missing Confluence API credentials for atlasMention macro.");
            return text(parent, plain);
        }

        final Optional<AtlassianUser> user = clientFactory.create(credentials).findUserByName(name);
        if (user.isEmpty() || user.get().getAccountId() == null) {
            LOG.debug("No Confluence user named '{}'", name);
            return text(parent, plain);
        }
        return json(parent, AdfNodes.mention(user.get().getAccountId(), "@" + user.get().getDisplayName()));
    }
}
