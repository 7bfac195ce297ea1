package com.github.rmannibucau.asciidoctor.adf.extension;

import java.util.Map;

import org.asciidoctor.ast.ContentNode;
import org.asciidoctor.extension.Name;
import org.asciidoctor.extension.PositionalAttributes;

@Name("workflowChangeTable")
@PositionalAttributes("text")
public class WorkflowChangeTableInlineMacro extends AdfInlineMacroProcessor {

    private static final String TITLE = "Workflows Document Control Table";

    @Override
    public Object process(final ContentNode parent, final String target, final Map<String, Object> attributes) {
        if (!isAdf(parent)) {
            return text(parent, "workflowChangeTable:" + target + "[]");
        }
        return json(parent, AppfoxWorkflows.blockMacro("document-control-table-macro", AppfoxWorkflows.parameters(TITLE, null, false)));
    }
}
