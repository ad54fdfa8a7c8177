package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.connectivity.ConnectivityMatrix;
import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tests every binding target against the connectivity matrix.
 */
public class ConnectivityCheck implements ValidationCheck {

    public static final String INVALID_CONNECTION = "invalid_connection";

    @Override
    public String getId() {
        return "connectivity";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        ConnectivityMatrix matrix = context.matrix();
        List<ValidationIssue> issues = new ArrayList<>();

        for (Binding binding : context.blueprint().bindings()) {
            Optional<Component> from = context.blueprint().component(binding.fromComponent());
            if (from.isEmpty()) {
                continue;
            }
            ComponentType fromType = from.get().type();
            for (Binding.Target target : binding.targets()) {
                Optional<Component> to = context.blueprint().component(target.component());
                if (to.isEmpty() || matrix.allows(fromType, to.get().type())) {
                    continue;
                }
                ComponentType toType = to.get().type();
                issues.add(ValidationIssue.error(IssueKind.CONNECTIVITY, INVALID_CONNECTION,
                        String.format("%s '%s' cannot send to %s '%s'",
                            fromType.blueprintName(), binding.fromComponent(),
                            toType.blueprintName(), target.component()))
                    .withComponent(binding.fromComponent())
                    .withBinding(binding.describe())
                    .withSuggestion(fromType.blueprintName() + " can connect to: "
                        + names(matrix.allowedTargets(fromType))));
            }
        }
        return issues;
    }

    private static String names(Set<ComponentType> types) {
        if (types.isEmpty()) {
            return "nothing (terminal type)";
        }
        return types.stream().map(ComponentType::blueprintName).collect(Collectors.joining(", "));
    }
}
