package com.blueprintarchitect.core.validation;

import java.util.List;

/**
 * One independent pass of the architectural validator.
 *
 * <p>Checks are stateless and never mutate the blueprint. A check reports every
 * problem it finds rather than stopping at the first.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}; register
 * them in {@code META-INF/services/com.blueprintarchitect.core.validation.ValidationCheck}.
 */
public interface ValidationCheck {

    /**
     * Returns a short identifier, e.g. {@code connectivity}.
     *
     * @return check identifier
     */
    String getId();

    /**
     * Returns execution priority for this check.
     *
     * <p>Lower values run first. Connectivity runs before the hard lint, which runs
     * before the more forgiving heuristics.
     *
     * @return priority value (lower = earlier execution)
     */
    int getPriority();

    /**
     * Runs the check.
     *
     * @param context blueprint and shared lookup tables
     * @return issues found, empty if none
     */
    List<ValidationIssue> check(ValidationContext context);
}
