package com.blueprintarchitect.core.orchestration;

import com.blueprintarchitect.core.healing.HealingRecord;
import com.blueprintarchitect.core.parser.StructuralError;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.List;

/**
 * Thrown when a blueprint is still invalid after the attempt budget is spent or
 * healing stopped making progress.
 *
 * <p>The message lists every unresolved structural error and validation issue of the
 * final attempt with its location, severity and text.
 */
public class BlueprintHealingException extends RuntimeException {

    private final List<ValidationIssue> issues;
    private final List<StructuralError> structuralErrors;
    private final List<HealingRecord> history;
    private final int attempts;

    public BlueprintHealingException(String reason, List<ValidationIssue> issues,
                                     List<StructuralError> structuralErrors,
                                     List<HealingRecord> history, int attempts) {
        super(describe(reason, issues, structuralErrors, attempts));
        this.issues = List.copyOf(issues);
        this.structuralErrors = List.copyOf(structuralErrors);
        this.history = List.copyOf(history);
        this.attempts = attempts;
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    public List<StructuralError> structuralErrors() {
        return structuralErrors;
    }

    public List<HealingRecord> history() {
        return history;
    }

    public int attempts() {
        return attempts;
    }

    private static String describe(String reason, List<ValidationIssue> issues,
                                   List<StructuralError> structuralErrors, int attempts) {
        StringBuilder sb = new StringBuilder()
            .append("Blueprint could not be healed after ").append(attempts).append(" attempt(s): ").append(reason);
        for (StructuralError error : structuralErrors) {
            sb.append(System.lineSeparator()).append("  ").append(error);
        }
        for (ValidationIssue issue : issues) {
            sb.append(System.lineSeparator()).append("  ").append(issue);
        }
        return sb.toString();
    }
}
