package com.blueprintarchitect.core.ports;

import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.Port;

import java.util.List;

/**
 * Default ports for each component type.
 *
 * <pre>
 * Source           -            / output (common_object_schema)
 * EventSource      -            / events (EventSchema)
 * Transformer      input        / output
 * Filter           input        / output
 * Router           input        / output
 * Aggregator       input1,input2/ output
 * StreamProcessor  stream       / processed
 * Controller       control      / command (SignalSchema)
 * APIEndpoint      request      / response (APIRequestSchema, APIResponseSchema)
 * Store            input        / -
 * Sink             input        / -
 * </pre>
 */
public final class PortTemplates {

    /** Schema of ports implied by bindings and of most template ports. */
    public static final String ITEM_SCHEMA = "ItemSchema";

    private PortTemplates() {
    }

    /**
     * Default input ports for a type.
     *
     * @param type component type
     * @return template inputs, empty for origin types
     */
    public static List<Port> inputs(ComponentType type) {
        return switch (type) {
            case SOURCE, EVENT_SOURCE -> List.of();
            case TRANSFORMER, FILTER, ROUTER, STORE, SINK -> List.of(Port.of("input", ITEM_SCHEMA));
            case AGGREGATOR -> List.of(Port.of("input1", ITEM_SCHEMA), Port.of("input2", ITEM_SCHEMA));
            case STREAM_PROCESSOR -> List.of(Port.of("stream", ITEM_SCHEMA));
            case CONTROLLER -> List.of(Port.of("control", "SignalSchema"));
            case API_ENDPOINT -> List.of(Port.of("request", "APIRequestSchema"));
        };
    }

    /**
     * Default output ports for a type.
     *
     * @param type component type
     * @return template outputs, empty for terminal types
     */
    public static List<Port> outputs(ComponentType type) {
        return switch (type) {
            case SOURCE -> List.of(Port.of("output", "common_object_schema"));
            case EVENT_SOURCE -> List.of(Port.of("events", "EventSchema"));
            case TRANSFORMER, FILTER, ROUTER, AGGREGATOR -> List.of(Port.of("output", ITEM_SCHEMA));
            case STREAM_PROCESSOR -> List.of(Port.of("processed", ITEM_SCHEMA));
            case CONTROLLER -> List.of(Port.of("command", "SignalSchema"));
            case API_ENDPOINT -> List.of(Port.of("response", "APIResponseSchema"));
            case STORE, SINK -> List.of();
        };
    }

    /**
     * Name of the port a new binding should leave from.
     *
     * @param type component type
     * @return first template output, or {@code output} for types without one
     */
    public static String defaultOutputName(ComponentType type) {
        List<Port> outputs = outputs(type);
        return outputs.isEmpty() ? "output" : outputs.get(0).name();
    }

    /**
     * Name of the port a new binding should arrive on.
     *
     * @param type component type
     * @return first template input, or {@code input} for types without one
     */
    public static String defaultInputName(ComponentType type) {
        List<Port> inputs = inputs(type);
        return inputs.isEmpty() ? "input" : inputs.get(0).name();
    }
}
