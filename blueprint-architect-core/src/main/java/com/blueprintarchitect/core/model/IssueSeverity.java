package com.blueprintarchitect.core.model;

/**
 * Severity of a validation issue or structural error.
 */
public enum IssueSeverity {
    /** Blocks acceptance; the orchestrator keeps healing */
    ERROR,

    /** Reported but never blocks */
    WARNING,

    /** Informational */
    INFO
}
