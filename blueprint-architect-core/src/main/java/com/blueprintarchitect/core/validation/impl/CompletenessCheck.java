package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compares what the descriptions promise with the component types present.
 *
 * <p>Mentioning an API or REST without an {@code APIEndpoint} is an error; mentioning
 * storing, persisting or saving without a {@code Store} is a warning. Keywords match
 * whole words, case-insensitively.
 */
public class CompletenessCheck implements ValidationCheck {

    public static final String MISSING_API_COMPONENT = "missing_api_component";
    public static final String MISSING_STORE_COMPONENT = "missing_store_component";

    private static final Pattern API_WORDS = Pattern.compile(
        "\\b(api|apis|rest|restful)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern STORE_WORDS = Pattern.compile(
        "\\b(store[sd]?|storing|persist\\w*|save[sd]?|saving)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String getId() {
        return "completeness";
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        SystemBlueprint blueprint = context.blueprint();
        String text = descriptions(blueprint);
        if (text.isBlank()) {
            return List.of();
        }

        List<ValidationIssue> issues = new ArrayList<>();
        if (API_WORDS.matcher(text).find() && !blueprint.hasComponentOfType(ComponentType.API_ENDPOINT)) {
            issues.add(ValidationIssue.error(IssueKind.COMPLETENESS, MISSING_API_COMPONENT,
                    "Description mentions an API but no APIEndpoint component is declared")
                .withSuggestion("Add an APIEndpoint component"));
        }
        if (STORE_WORDS.matcher(text).find() && !blueprint.hasComponentOfType(ComponentType.STORE)) {
            issues.add(ValidationIssue.warning(IssueKind.COMPLETENESS, MISSING_STORE_COMPONENT,
                    "Description mentions storage but no Store component is declared")
                .withSuggestion("Add a Store component"));
        }
        return issues;
    }

    private static String descriptions(SystemBlueprint blueprint) {
        StringBuilder text = new StringBuilder();
        if (blueprint.description() != null) {
            text.append(blueprint.description());
        }
        for (Component component : blueprint.components()) {
            if (component.description() != null) {
                text.append('\n').append(component.description());
            }
        }
        return text.toString();
    }
}
