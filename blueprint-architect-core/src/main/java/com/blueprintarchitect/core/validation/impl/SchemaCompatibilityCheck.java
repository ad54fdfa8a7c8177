package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Port;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.schema.SchemaCompatibility;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks that every bound port pair carries compatible schema labels.
 *
 * <p>A declared transformation reconciles any pair. In strict mode the transformation
 * must also be registered. Ports not yet declared are skipped; port inference adds them.
 */
public class SchemaCompatibilityCheck implements ValidationCheck {

    public static final String SCHEMA_MISMATCH = "schema_mismatch";
    public static final String UNREGISTERED_TRANSFORMATION = "unregistered_transformation";

    @Override
    public String getId() {
        return "schema";
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        SystemBlueprint blueprint = context.blueprint();
        SchemaCompatibility schemas = context.schemas();
        List<ValidationIssue> issues = new ArrayList<>();

        for (Binding binding : blueprint.bindings()) {
            if (binding.hasTransformation()) {
                if (!schemas.isKnownTransformation(binding.transformation())) {
                    issues.add(ValidationIssue.error(IssueKind.SCHEMA, UNREGISTERED_TRANSFORMATION,
                            "Transformation '" + binding.transformation() + "' is not registered")
                        .withComponent(binding.fromComponent())
                        .withBinding(binding.describe())
                        .withSuggestion("Register the transformation under schema.registeredTransformations"));
                }
                continue;
            }

            Optional<Port> fromPort = blueprint.component(binding.fromComponent())
                .flatMap(c -> c.output(binding.fromPort()));
            if (fromPort.isEmpty()) {
                continue;
            }
            for (Binding.Target target : binding.targets()) {
                Optional<Port> toPort = blueprint.component(target.component()).flatMap(c -> c.input(target.port()));
                if (toPort.isEmpty()) {
                    continue;
                }
                String from = fromPort.get().schemaId();
                String to = toPort.get().schemaId();
                if (!schemas.isCompatible(from, to)) {
                    issues.add(ValidationIssue.error(IssueKind.SCHEMA, SCHEMA_MISMATCH,
                            String.format("Schema mismatch: %s.%s (%s) -> %s.%s (%s)",
                                binding.fromComponent(), binding.fromPort(), from,
                                target.component(), target.port(), to))
                        .withComponent(binding.fromComponent())
                        .withBinding(binding.describe())
                        .withSuggestion("Declare transformation: " + SchemaCompatibility.transformationLabel(from, to)));
                }
            }
        }
        return issues;
    }
}
