package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Hard lint: a component declared terminal must have no outputs and no outgoing edges.
 *
 * <p>These errors are never resolved by healing; the author must change the document.
 */
public class LintContradictionCheck implements ValidationCheck {

    public static final String TERMINAL_OUTPUTS = "terminal_hint_outputs";
    public static final String TERMINAL_OUT_DEGREE = "terminal_hint_out_degree";

    @Override
    public String getId() {
        return "lint";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Component component : context.blueprint().components()) {
            if (!component.terminalHint()) {
                continue;
            }
            if (!component.outputs().isEmpty()) {
                issues.add(ValidationIssue.error(IssueKind.LINT, TERMINAL_OUTPUTS,
                        String.format("Component '%s' has terminal_hint but declares %d output(s)",
                            component.name(), component.outputs().size()))
                    .withComponent(component.name())
                    .withSuggestion("Remove the outputs or drop terminal_hint"));
            }
            int outDegree = context.graph().outDegree(component.name());
            if (outDegree > 0) {
                issues.add(ValidationIssue.error(IssueKind.LINT, TERMINAL_OUT_DEGREE,
                        String.format("Component '%s' has terminal_hint but sends to %d component(s)",
                            component.name(), outDegree))
                    .withComponent(component.name())
                    .withSuggestion("Remove the outgoing bindings or drop terminal_hint"));
            }
        }
        return issues;
    }
}
