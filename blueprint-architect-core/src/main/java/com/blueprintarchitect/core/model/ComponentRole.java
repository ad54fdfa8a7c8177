package com.blueprintarchitect.core.model;

/**
 * Coarse architectural role of a component type.
 *
 * <p>Healing heuristics reason about roles rather than concrete types when they
 * look for plausible data-flow relationships (origin to processor, processor to
 * terminal, and so on).
 */
public enum ComponentRole {
    /** Produces data without receiving any (Source, EventSource) */
    ORIGIN,

    /** Consumes data and emits derived data */
    PROCESSOR,

    /** Externally facing request/response surface */
    ENDPOINT,

    /** Issues commands to peers */
    ORCHESTRATOR,

    /** Durable terminal that persists what it receives */
    STORAGE,

    /** Non-durable terminal */
    TERMINAL
}
