package com.github.rmannibucau.asciidoctor.adf.extension;

import static java.util.Locale.ROOT;
import static java.util.Optional.ofNullable;

import java.util.Map;

import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.extension.Name;
import org.asciidoctor.extension.PositionalAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code workflowApproval:all[]} or {@code workflowApproval:latest[]}: workflow approvers table.
 */
@Name("workflowApproval")
@PositionalAttributes("text")
public class WorkflowApprovalInlineMacro extends AdfInlineMacroProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowApprovalInlineMacro.class);

    private static final String TITLE = "Workflows Approvers Metadata";

    @Override
    public Object process(final ContentNode parent, final String target, final Map<String, Object> attributes) {
        final String option = ofNullable(target).orElse("").toLowerCase(ROOT);
        final String value;
        switch (option) {
        case "all":
            value = null;
            break;
        case "latest":
            value = "Latest Approvals for Current Workflow";
            break;
        default:
            LOG.warn("Unknown workflowApproval option '{}'.", target);
            return text(parent, "workflowApproval:" + target + "[]");
        }
        if (!isAdf(parent)) {
            return text(parent, "workflowApproval:" + target + "[]");
        }
        return json(parent, AppfoxWorkflows.blockMacro("approvers-macro", AppfoxWorkflows.parameters(TITLE, value, false)));
    }
}
