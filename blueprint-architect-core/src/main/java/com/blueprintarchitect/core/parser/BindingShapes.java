package com.blueprintarchitect.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.blueprintarchitect.core.parser.BlueprintFields.*;

/**
 * Reads the accepted binding spellings and produces the canonical shape.
 *
 * <p>Accepted forms:
 * <pre>{@code
 * # canonical
 * {from_component: a, from_port: out, to_components: [b, c], to_ports: [in, in]}
 * # singular target
 * {from_component: a, from_port: out, to_component: b, to_port: in}
 * # legacy dotted strings
 * {from: a.out, to: b.in}
 * {from: a.out, to: [b.in, c.in]}
 * }</pre>
 *
 * <p>Missing port names default to {@code output} and {@code input}. Parallel arrays of
 * different length are kept as written so the caller can report or drop them.
 */
public final class BindingShapes {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private BindingShapes() {
    }

    /**
     * Canonicalizes one binding entry.
     *
     * @param entry raw binding entry
     * @return canonical binding node, or empty if the entry names no source or no target
     */
    public static Optional<ObjectNode> canonicalize(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }

        String fromComponent;
        String fromPort;
        if (hasText(entry, FROM_COMPONENT)) {
            fromComponent = entry.get(FROM_COMPONENT).asText().trim();
            fromPort = hasText(entry, FROM_PORT) ? entry.get(FROM_PORT).asText().trim() : DEFAULT_OUTPUT_PORT;
        } else if (hasText(entry, FROM)) {
            String[] parts = splitEndpoint(entry.get(FROM).asText(), DEFAULT_OUTPUT_PORT);
            fromComponent = parts[0];
            fromPort = parts[1];
        } else {
            return Optional.empty();
        }
        if (fromComponent.isEmpty()) {
            return Optional.empty();
        }

        List<String> toComponents = new ArrayList<>();
        List<String> toPorts = new ArrayList<>();
        JsonNode plural = entry.get(TO_COMPONENTS);
        if (plural != null && plural.isArray()) {
            plural.forEach(node -> toComponents.add(node.asText().trim()));
            JsonNode ports = entry.get(TO_PORTS);
            if (ports != null && ports.isArray()) {
                ports.forEach(node -> toPorts.add(node.asText().trim()));
            } else if (ports != null && ports.isTextual()) {
                toPorts.add(ports.asText().trim());
            } else {
                toComponents.forEach(c -> toPorts.add(DEFAULT_INPUT_PORT));
            }
        } else if (plural != null && plural.isTextual()) {
            toComponents.add(plural.asText().trim());
            toPorts.add(firstPort(entry));
        } else if (hasText(entry, TO_COMPONENT)) {
            toComponents.add(entry.get(TO_COMPONENT).asText().trim());
            toPorts.add(firstPort(entry));
        } else if (entry.has(TO)) {
            JsonNode to = entry.get(TO);
            List<JsonNode> endpoints = new ArrayList<>();
            if (to.isArray()) {
                to.forEach(endpoints::add);
            } else {
                endpoints.add(to);
            }
            for (JsonNode endpoint : endpoints) {
                if (!endpoint.isTextual() || endpoint.asText().isBlank()) {
                    continue;
                }
                String[] parts = splitEndpoint(endpoint.asText(), DEFAULT_INPUT_PORT);
                toComponents.add(parts[0]);
                toPorts.add(parts[1]);
            }
        }

        if (toComponents.isEmpty() || toComponents.stream().anyMatch(String::isEmpty)) {
            return Optional.empty();
        }

        ObjectNode canonical = NODES.objectNode();
        canonical.put(FROM_COMPONENT, fromComponent);
        canonical.put(FROM_PORT, fromPort);
        ArrayNode components = canonical.putArray(TO_COMPONENTS);
        toComponents.forEach(components::add);
        ArrayNode ports = canonical.putArray(TO_PORTS);
        toPorts.forEach(ports::add);
        copyText(entry, canonical, TRANSFORMATION);
        copyText(entry, canonical, CONDITION);
        return Optional.of(canonical);
    }

    /**
     * Whether an entry is already in canonical shape with matching array lengths.
     *
     * @param entry raw binding entry
     * @return true if canonicalizing it would not change its structure
     */
    public static boolean isCanonical(JsonNode entry) {
        return entry != null && entry.isObject()
            && hasText(entry, FROM_COMPONENT) && hasText(entry, FROM_PORT)
            && entry.path(TO_COMPONENTS).isArray() && entry.path(TO_PORTS).isArray()
            && entry.get(TO_COMPONENTS).size() == entry.get(TO_PORTS).size()
            && !entry.has(FROM) && !entry.has(TO) && !entry.has(TO_COMPONENT) && !entry.has(TO_PORT);
    }

    private static String firstPort(JsonNode entry) {
        if (hasText(entry, TO_PORT)) {
            return entry.get(TO_PORT).asText().trim();
        }
        JsonNode ports = entry.get(TO_PORTS);
        if (ports != null && ports.isArray() && ports.size() > 0) {
            return ports.get(0).asText().trim();
        }
        if (ports != null && ports.isTextual()) {
            return ports.asText().trim();
        }
        return DEFAULT_INPUT_PORT;
    }

    private static String[] splitEndpoint(String endpoint, String defaultPort) {
        String trimmed = endpoint.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return new String[] {trimmed, defaultPort};
        }
        String port = trimmed.substring(dot + 1).trim();
        return new String[] {trimmed.substring(0, dot).trim(), port.isEmpty() ? defaultPort : port};
    }

    private static boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank();
    }

    private static void copyText(JsonNode from, ObjectNode to, String field) {
        if (hasText(from, field)) {
            to.put(field, from.get(field).asText());
        }
    }
}
