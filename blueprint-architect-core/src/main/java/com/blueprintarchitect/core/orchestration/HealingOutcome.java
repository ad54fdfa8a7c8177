package com.blueprintarchitect.core.orchestration;

import com.blueprintarchitect.core.healing.HealingRecord;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.validation.ValidationIssue;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * Successful heal-and-validate run.
 *
 * @param blueprint healed, validated blueprint
 * @param document healed raw document the blueprint was parsed from
 * @param issues remaining non-error issues (warnings and info)
 * @param history healing records of every pass, in order
 * @param attempts attempts used, including the successful one
 */
public record HealingOutcome(
    SystemBlueprint blueprint,
    ObjectNode document,
    List<ValidationIssue> issues,
    List<HealingRecord> history,
    int attempts
) {
    public HealingOutcome {
        Objects.requireNonNull(blueprint, "blueprint must not be null");
        Objects.requireNonNull(document, "document must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * All operations applied across the run, flattened in order.
     *
     * @return operation descriptions
     */
    public List<String> operations() {
        return history.stream().flatMap(r -> r.operations().stream()).toList();
    }
}
