package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.graph.BlueprintGraph;
import com.blueprintarchitect.core.graph.GraphEdge;
import com.blueprintarchitect.core.model.ComponentRole;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags storage feeding origins (error) and excessive fan-out (warning).
 */
public class AntiPatternCheck implements ValidationCheck {

    public static final String ARCHITECTURAL_ANTIPATTERN = "architectural_antipattern";
    public static final String EXCESSIVE_FAN_OUT = "excessive_fan_out";

    @Override
    public String getId() {
        return "antipattern";
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        BlueprintGraph graph = context.graph();
        List<ValidationIssue> issues = new ArrayList<>();

        for (GraphEdge edge : graph.edges()) {
            ComponentType fromType = graph.typeOf(edge.from()).orElseThrow();
            ComponentType toType = graph.typeOf(edge.to()).orElseThrow();
            if (fromType.role() == ComponentRole.STORAGE && toType.role() == ComponentRole.ORIGIN) {
                issues.add(ValidationIssue.error(IssueKind.ANTIPATTERN, ARCHITECTURAL_ANTIPATTERN,
                        String.format("%s '%s' feeds %s '%s' directly; data must not flow from storage back to an origin",
                            fromType.blueprintName(), edge.from(), toType.blueprintName(), edge.to()))
                    .withComponent(edge.from())
                    .withBinding(edge.from() + " -> " + edge.to())
                    .withSuggestion("Remove the binding from '" + edge.from() + "' to '" + edge.to() + "'"));
            }
        }

        int limit = context.settings().excessiveFanOut();
        for (String node : graph.nodes().keySet()) {
            int outDegree = graph.outDegree(node);
            if (outDegree > limit) {
                issues.add(ValidationIssue.warning(IssueKind.ANTIPATTERN, EXCESSIVE_FAN_OUT,
                        String.format("Component '%s' sends to %d components", node, outDegree))
                    .withComponent(node)
                    .withSuggestion("Insert a Router after '" + node + "'"));
            }
        }
        return issues;
    }
}
