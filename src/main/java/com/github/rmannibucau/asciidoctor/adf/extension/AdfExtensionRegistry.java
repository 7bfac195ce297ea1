package com.github.rmannibucau.asciidoctor.adf.extension;

import org.asciidoctor.Asciidoctor;
import org.asciidoctor.extension.JavaExtensionRegistry;
import org.asciidoctor.jruby.extension.spi.ExtensionRegistry;

import com.github.rmannibucau.asciidoctor.adf.client.AtlassianClientFactory;

/**
 * Registers the Jira, Confluence and Appfox Workflows macros.
 */
public class AdfExtensionRegistry implements ExtensionRegistry {

    private final ConfigResolver configResolver;

    private final AtlassianClientFactory clientFactory;

    public AdfExtensionRegistry() { // for the SPI
        this(new ConfigResolver(), AtlassianClientFactory.http());
    }

    public AdfExtensionRegistry(final ConfigResolver configResolver, final AtlassianClientFactory clientFactory) {
        this.configResolver = configResolver;
        this.clientFactory = clientFactory;
    }

    @Override
    public void register(final Asciidoctor asciidoctor) {
        final JavaExtensionRegistry registry = asciidoctor.javaExtensionRegistry();
        registry.inlineMacro(new JiraInlineMacro(configResolver));
        registry.inlineMacro(new AtlasMentionInlineMacro(configResolver, clientFactory));
        registry.blockMacro(new JiraIssuesTableBlockMacro(configResolver, clientFactory));
        registry.inlineMacro(new AppfoxWorkflowMetadataInlineMacro());
        registry.inlineMacro(new WorkflowApprovalInlineMacro());
        registry.inlineMacro(new WorkflowChangeTableInlineMacro());
    }
}
