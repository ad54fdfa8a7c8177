package com.blueprintarchitect.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of component kinds a blueprint may declare.
 *
 * <p>Every consumer that branches on the type uses an exhaustive {@code switch},
 * so adding a constant here is a compile error until each of them handles it.
 */
public enum ComponentType {
    /** Polled or generated input */
    SOURCE("Source"),

    /** Push-based input (webhooks, queues) */
    EVENT_SOURCE("EventSource"),

    /** Maps each item to a derived item */
    TRANSFORMER("Transformer"),

    /** Drops items that fail a predicate */
    FILTER("Filter"),

    /** Sends items to one of several outputs */
    ROUTER("Router"),

    /** Joins several inputs into one output */
    AGGREGATOR("Aggregator"),

    /** Windowed or continuous stream processing */
    STREAM_PROCESSOR("StreamProcessor"),

    /** Orchestrates peers through commands */
    CONTROLLER("Controller"),

    /** HTTP/RPC request/response surface */
    API_ENDPOINT("APIEndpoint"),

    /** Durable storage */
    STORE("Store"),

    /** Terminal consumer (log, metrics, external push) */
    SINK("Sink");

    private final String blueprintName;

    ComponentType(String blueprintName) {
        this.blueprintName = blueprintName;
    }

    /**
     * Returns the spelling used in blueprint documents, e.g. {@code APIEndpoint}.
     *
     * @return canonical blueprint name
     */
    public String blueprintName() {
        return blueprintName;
    }

    /**
     * Returns the architectural role of this type.
     *
     * @return role, never null
     */
    public ComponentRole role() {
        return switch (this) {
            case SOURCE, EVENT_SOURCE -> ComponentRole.ORIGIN;
            case TRANSFORMER, FILTER, ROUTER, AGGREGATOR, STREAM_PROCESSOR -> ComponentRole.PROCESSOR;
            case CONTROLLER -> ComponentRole.ORCHESTRATOR;
            case API_ENDPOINT -> ComponentRole.ENDPOINT;
            case STORE -> ComponentRole.STORAGE;
            case SINK -> ComponentRole.TERMINAL;
        };
    }

    /**
     * Whether components of this type are durable unless the document says otherwise.
     *
     * @return true for storage types
     */
    public boolean durableByDefault() {
        return role() == ComponentRole.STORAGE;
    }

    /**
     * Whether this type ends a data flow (Store, Sink).
     *
     * @return true for terminal types
     */
    public boolean isTerminal() {
        return role() == ComponentRole.STORAGE || role() == ComponentRole.TERMINAL;
    }

    /**
     * Resolves a type name leniently.
     *
     * <p>Matching ignores case, underscores, dashes and spaces, so {@code api_endpoint},
     * {@code apiendpoint}, {@code API_ENDPOINT} and {@code APIEndpoint} all resolve to
     * {@link #API_ENDPOINT}.
     *
     * @param name type name as written in a document
     * @return matching type, or empty if unknown
     */
    public static Optional<ComponentType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = squash(name);
        for (ComponentType type : values()) {
            if (squash(type.blueprintName).equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String squash(String name) {
        return name.replaceAll("[_\\-\\s]", "").toLowerCase(Locale.ROOT);
    }
}
