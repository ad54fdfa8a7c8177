package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.graph.BlueprintGraph;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about components that no binding touches.
 *
 * <p>A system with a single component is allowed to stand alone.
 */
public class OrphanCheck implements ValidationCheck {

    public static final String ORPHANED_COMPONENT = "orphaned_component";

    @Override
    public String getId() {
        return "orphan";
    }

    @Override
    public int getPriority() {
        return 15;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        BlueprintGraph graph = context.graph();
        List<ValidationIssue> issues = new ArrayList<>();
        if (graph.nodeCount() < 2) {
            return issues;
        }

        for (String node : graph.nodes().keySet()) {
            if (graph.inDegree(node) == 0 && graph.outDegree(node) == 0) {
                issues.add(ValidationIssue.warning(IssueKind.CONNECTIVITY, ORPHANED_COMPONENT,
                        String.format("Component '%s' has no connections to other components", node))
                    .withComponent(node)
                    .withSuggestion("Connect component to other components or verify it can operate standalone"));
            }
        }
        return issues;
    }
}
