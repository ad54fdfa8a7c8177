package com.blueprintarchitect.core.healing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.blueprintarchitect.core.parser.BlueprintFields.*;

/**
 * Renames the system, its components and their ports to snake_case so they match
 * {@link com.blueprintarchitect.core.parser.BlueprintFields#NAME_PATTERN}.
 *
 * <p>Bindings are rewritten to follow every rename. Expects canonical bindings, so it
 * runs after {@link BindingNormalizer}. A rename that would collide with an existing
 * name gets a numeric suffix.
 *
 * <p><b>Examples:</b>
 * <pre>
 * OrderIngest   -> order_ingest
 * HTTPServer    -> http_server
 * Broken-System -> broken_system
 * 2fast         -> component_2fast
 * </pre>
 */
public class NameNormalizer {

    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    static final String FALLBACK_NAME = "unnamed_component";
    private static final String DIGIT_PREFIX = "component_";

    /**
     * Converts a name to snake_case.
     *
     * @param name name as written
     * @return lowercase name made of letters, digits and single underscores, starting with a letter
     */
    public static String toSnakeCase(String name) {
        String normalized = name
            .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replaceAll("[^a-zA-Z0-9_]", "_")
            .replaceAll("_+", "_")
            .toLowerCase(Locale.ROOT)
            .replaceAll("^_|_$", "");
        if (normalized.isEmpty()) {
            return FALLBACK_NAME;
        }
        return Character.isLetter(normalized.charAt(0)) ? normalized : DIGIT_PREFIX + normalized;
    }

    /**
     * Normalizes names inside a raw {@code system} block in place.
     *
     * @param system raw system block
     * @return operations applied, empty if every name already matched
     */
    public List<String> normalize(ObjectNode system) {
        List<String> operations = new ArrayList<>();

        JsonNode systemName = system.get(NAME);
        if (systemName != null && systemName.isTextual() && !NAME_PATTERN.matcher(systemName.asText()).matches()) {
            String renamed = toSnakeCase(systemName.asText());
            system.put(NAME, renamed);
            operations.add("Normalized system name " + systemName.asText() + " -> " + renamed);
        }

        JsonNode components = system.get(COMPONENTS);
        if (components == null || !components.isArray()) {
            return operations;
        }
        ArrayNode bindings = system.path(BINDINGS).isArray() ? (ArrayNode) system.get(BINDINGS) : null;

        Set<String> taken = new HashSet<>();
        for (JsonNode node : components) {
            taken.add(node.path(NAME).asText());
        }
        for (JsonNode node : components) {
            if (!node.isObject() || !node.path(NAME).isTextual()) {
                continue;
            }
            ObjectNode component = (ObjectNode) node;
            String name = component.get(NAME).asText();
            if (!NAME_PATTERN.matcher(name).matches()) {
                String renamed = unique(toSnakeCase(name), taken);
                component.put(NAME, renamed);
                renameComponentReferences(bindings, name, renamed);
                log.debug("Renamed component {} to {}", name, renamed);
                operations.add("Normalized component name " + name + " -> " + renamed);
                name = renamed;
            }
            for (String direction : List.of(INPUTS, OUTPUTS)) {
                normalizePorts(component, name, direction, bindings, operations);
            }
        }
        return operations;
    }

    private void normalizePorts(ObjectNode component, String componentName, String direction,
                                ArrayNode bindings, List<String> operations) {
        JsonNode ports = component.get(direction);
        if (ports == null || !ports.isArray()) {
            return;
        }
        Set<String> taken = new HashSet<>();
        for (JsonNode port : ports) {
            taken.add(port.path(NAME).asText());
        }
        for (JsonNode node : ports) {
            if (!node.isObject() || !node.path(NAME).isTextual()) {
                continue;
            }
            String name = node.get(NAME).asText();
            if (NAME_PATTERN.matcher(name).matches()) {
                continue;
            }
            String renamed = unique(toSnakeCase(name), taken);
            ((ObjectNode) node).put(NAME, renamed);
            renamePortReferences(bindings, componentName, direction, name, renamed);
            operations.add("Normalized port name " + componentName + "." + name + " -> " + componentName + "." + renamed);
        }
    }

    private static void renameComponentReferences(ArrayNode bindings, String from, String to) {
        if (bindings == null) {
            return;
        }
        for (JsonNode node : bindings) {
            if (!node.isObject()) {
                continue;
            }
            ObjectNode binding = (ObjectNode) node;
            if (from.equals(binding.path(FROM_COMPONENT).asText(null))) {
                binding.put(FROM_COMPONENT, to);
            }
            JsonNode targets = binding.get(TO_COMPONENTS);
            if (targets != null && targets.isArray()) {
                ArrayNode array = (ArrayNode) targets;
                for (int i = 0; i < array.size(); i++) {
                    if (from.equals(array.get(i).asText())) {
                        array.set(i, TextNode.valueOf(to));
                    }
                }
            }
        }
    }

    private static void renamePortReferences(ArrayNode bindings, String component, String direction,
                                             String from, String to) {
        if (bindings == null) {
            return;
        }
        for (JsonNode node : bindings) {
            if (!node.isObject()) {
                continue;
            }
            ObjectNode binding = (ObjectNode) node;
            if (OUTPUTS.equals(direction)) {
                if (component.equals(binding.path(FROM_COMPONENT).asText(null))
                    && from.equals(binding.path(FROM_PORT).asText(null))) {
                    binding.put(FROM_PORT, to);
                }
                continue;
            }
            JsonNode targets = binding.path(TO_COMPONENTS);
            JsonNode ports = binding.get(TO_PORTS);
            if (ports == null || !ports.isArray()) {
                continue;
            }
            ArrayNode array = (ArrayNode) ports;
            for (int i = 0; i < targets.size() && i < array.size(); i++) {
                if (component.equals(targets.get(i).asText()) && from.equals(array.get(i).asText())) {
                    array.set(i, TextNode.valueOf(to));
                }
            }
        }
    }

    private static String unique(String base, Set<String> taken) {
        String candidate = base;
        for (int i = 2; taken.contains(candidate); i++) {
            candidate = base + "_" + i;
        }
        taken.add(candidate);
        return candidate;
    }
}
