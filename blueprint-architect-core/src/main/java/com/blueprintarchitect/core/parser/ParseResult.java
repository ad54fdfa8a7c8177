package com.blueprintarchitect.core.parser;

import com.blueprintarchitect.core.model.SystemBlueprint;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a typed parse: a blueprint, or the structural errors that prevented one.
 *
 * <p>A successful result may still carry warning-level entries.
 *
 * @param blueprint parsed blueprint, null on failure
 * @param problems structural errors and warnings
 */
public record ParseResult(SystemBlueprint blueprint, List<StructuralError> problems) {

    public ParseResult {
        problems = problems == null ? List.of() : List.copyOf(problems);
        if (blueprint == null && problems.stream().noneMatch(StructuralError::isError)) {
            throw new IllegalArgumentException("a failed parse must report at least one error");
        }
    }

    public static ParseResult success(SystemBlueprint blueprint, List<StructuralError> warnings) {
        return new ParseResult(blueprint, warnings);
    }

    public static ParseResult failure(List<StructuralError> errors) {
        return new ParseResult(null, errors);
    }

    public boolean isSuccess() {
        return blueprint != null;
    }

    public Optional<SystemBlueprint> blueprintIfPresent() {
        return Optional.ofNullable(blueprint);
    }

    /**
     * Returns only the error-level entries.
     *
     * @return errors
     */
    public List<StructuralError> errors() {
        return problems.stream().filter(StructuralError::isError).toList();
    }
}
