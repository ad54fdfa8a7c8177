package com.blueprintarchitect.core.validation;

import java.util.Locale;

/**
 * Category of a validation issue.
 */
public enum IssueKind {
    /** Binding between types the connectivity matrix does not allow */
    CONNECTIVITY,

    /** Ingress that never reaches a commitment point, or a reply that is never sent */
    BOUNDARY_TERMINATION,

    /** Self-contradictory document; only a structural change resolves it */
    LINT,

    /** Legal but architecturally unsound shape */
    ANTIPATTERN,

    /** Description promises something no component provides */
    COMPLETENESS,

    /** Port schema labels that cannot be reconciled */
    SCHEMA,

    /** Topology classification */
    PATTERN;

    /**
     * Lower-case name used in reports, e.g. {@code boundary_termination}.
     *
     * @return report name
     */
    public String reportName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
