package com.blueprintarchitect.core.report;

import com.blueprintarchitect.core.model.IssueSeverity;
import com.blueprintarchitect.core.parser.StructuralError;
import com.blueprintarchitect.core.validation.ValidationIssue;

import java.util.List;
import java.util.Objects;

/**
 * Result of checking one blueprint without healing it.
 *
 * @param blueprintName system name, or the file name when the document has none
 * @param structuralErrors problems found by the typed parse
 * @param issues issues found by the validator; empty if the parse failed
 */
public record ValidationReport(
    String blueprintName,
    List<StructuralError> structuralErrors,
    List<ValidationIssue> issues
) {
    public ValidationReport {
        Objects.requireNonNull(blueprintName, "blueprintName must not be null");
        structuralErrors = structuralErrors == null ? List.of() : List.copyOf(structuralErrors);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public long errorCount() {
        return structuralErrors.stream().filter(StructuralError::isError).count()
            + issues.stream().filter(ValidationIssue::isError).count();
    }

    public long warningCount() {
        return structuralErrors.stream().filter(e -> e.severity() == IssueSeverity.WARNING).count()
            + issues.stream().filter(i -> i.severity() == IssueSeverity.WARNING).count();
    }

    public long infoCount() {
        return issues.stream().filter(i -> i.severity() == IssueSeverity.INFO).count();
    }

    /**
     * Whether the blueprint parsed and has no error-severity issue.
     *
     * @return true if the blueprint is acceptable
     */
    public boolean passed() {
        return errorCount() == 0;
    }

    /**
     * Whether the document failed the typed parse.
     *
     * @return true if structural errors prevented validation
     */
    public boolean structurallyBroken() {
        return structuralErrors.stream().anyMatch(StructuralError::isError);
    }

    /**
     * Renders the report as plain text, one line per problem.
     *
     * @return report text
     */
    public String render() {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append("Blueprint: ").append(blueprintName).append(nl);
        sb.append("Result: ").append(passed() ? "PASSED" : "FAILED")
            .append(" (").append(errorCount()).append(" errors, ")
            .append(warningCount()).append(" warnings, ")
            .append(infoCount()).append(" info)").append(nl);

        for (StructuralError error : structuralErrors) {
            sb.append("  ").append(error).append(nl);
        }
        for (ValidationIssue issue : issues) {
            sb.append("  [").append(issue.severity()).append("] ")
                .append(issue.kind().reportName()).append('/').append(issue.code())
                .append(" at ").append(issue.location()).append(": ").append(issue.message()).append(nl);
            if (issue.suggestion() != null) {
                sb.append("      suggestion: ").append(issue.suggestion()).append(nl);
            }
        }
        return sb.toString();
    }
}
