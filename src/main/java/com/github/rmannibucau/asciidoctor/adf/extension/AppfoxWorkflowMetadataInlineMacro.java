package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Locale.ROOT;

import java.util.Map;

import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.extension.Name;
import org.asciidoctor.extension.PositionalAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code appfoxWorkflowMetadata:status[]}: inline workflow metadata value.
 */
@Name("appfoxWorkflowMetadata")
@PositionalAttributes("text")
public class AppfoxWorkflowMetadataInlineMacro extends AdfInlineMacroProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(AppfoxWorkflowMetadataInlineMacro.class);

    private static final String TITLE = "Workflows Metadata";

    private static final Map<String, String> KEYWORDS = Map.of(
            "approvers", "Approvers for Current Status",
            "versiondesc", "Current Official Version Description",
            "version", "Current Official Version",
            "expiry", "Expiry Date",
            "transition", "Transition Date",
            "pageid", "Unique Page ID",
            "status", "Workflow Status");

    @Override
    public Object process(final ContentNode parent, final String target, final Map<String, Object> attributes) {
        if (target == null) {
            throw new IllegalArgumentException("Target cannot be null");
        }
        final String value = KEYWORDS.get(target.toLowerCase(ROOT));
        if (value == null) {
            LOG.warn("Unknown appfoxWorkflowMetadata keyword '{}'.", target);
        }
        if (value == null || !isAdf(parent)) {
            return text(parent, "appfoxWorkflowMetadata:" + target + "[]");
        }
        return json(parent, AppfoxWorkflows.inlineMacro("metadata-macro", AppfoxWorkflows.parameters(TITLE, value, true)));
    }
}
