package com.blueprintarchitect.core.validation;

import com.blueprintarchitect.core.model.IssueSeverity;

import java.util.Objects;

/**
 * Problem found by the architectural validator.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationIssue issue = ValidationIssue.error(IssueKind.ANTIPATTERN, "architectural_antipattern",
 *         "Store 'orders_db' feeds Source 'ingest' directly")
 *     .withComponent("orders_db")
 *     .withSuggestion("Remove the binding");
 * }</pre>
 *
 * @param kind issue category
 * @param severity severity
 * @param code stable machine-readable code
 * @param message human-readable description
 * @param component optional component the issue is about
 * @param binding optional binding description ({@code a.out -> b.in})
 * @param suggestion optional remediation hint
 */
public record ValidationIssue(
    IssueKind kind,
    IssueSeverity severity,
    String code,
    String message,
    String component,
    String binding,
    String suggestion
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationIssue error(IssueKind kind, String code, String message) {
        return new ValidationIssue(kind, IssueSeverity.ERROR, code, message, null, null, null);
    }

    public static ValidationIssue warning(IssueKind kind, String code, String message) {
        return new ValidationIssue(kind, IssueSeverity.WARNING, code, message, null, null, null);
    }

    public static ValidationIssue info(IssueKind kind, String code, String message) {
        return new ValidationIssue(kind, IssueSeverity.INFO, code, message, null, null, null);
    }

    public ValidationIssue withComponent(String componentName) {
        return new ValidationIssue(kind, severity, code, message, componentName, binding, suggestion);
    }

    public ValidationIssue withBinding(String bindingDescription) {
        return new ValidationIssue(kind, severity, code, message, component, bindingDescription, suggestion);
    }

    public ValidationIssue withSuggestion(String hint) {
        return new ValidationIssue(kind, severity, code, message, component, binding, hint);
    }

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    /**
     * Location for reports: the binding if present, else the component, else {@code system}.
     *
     * @return location string
     */
    public String location() {
        if (binding != null) {
            return binding;
        }
        return component != null ? component : "system";
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + kind.reportName() + "/" + code + " at " + location() + ": " + message
            + (suggestion != null ? " (suggestion: " + suggestion + ")" : "");
    }
}
