package com.blueprintarchitect.core.healing;

import com.blueprintarchitect.core.parser.BindingShapes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.blueprintarchitect.core.parser.BlueprintFields.*;

/**
 * Rewrites every binding of a raw document into the canonical
 * {@code from_component/from_port/to_components/to_ports} shape.
 *
 * <p>Bindings declared at the document root are moved into {@code system}. Entries
 * that name no source or no target, or whose target arrays differ in length, are
 * dropped and logged.
 */
public class BindingNormalizer {

    private static final Logger log = LoggerFactory.getLogger(BindingNormalizer.class);

    /**
     * Normalizes bindings in place.
     *
     * @param document raw document root
     * @return operations applied, empty if the bindings were already canonical
     */
    public List<String> normalize(ObjectNode document) {
        List<String> operations = new ArrayList<>();
        JsonNode systemNode = document.get(SYSTEM);
        if (systemNode == null || !systemNode.isObject()) {
            return operations;
        }
        ObjectNode system = (ObjectNode) systemNode;

        JsonNode rootBindings = document.get(BINDINGS);
        if (rootBindings != null && rootBindings.isArray()) {
            ArrayNode target = system.path(BINDINGS).isArray()
                ? (ArrayNode) system.get(BINDINGS) : system.putArray(BINDINGS);
            target.addAll((ArrayNode) rootBindings);
            document.remove(BINDINGS);
            operations.add("Moved " + rootBindings.size() + " root-level binding(s) into system");
        }

        JsonNode bindingsNode = system.get(BINDINGS);
        if (bindingsNode == null || !bindingsNode.isArray()) {
            return operations;
        }

        ArrayNode bindings = (ArrayNode) bindingsNode;
        ArrayNode normalized = bindings.arrayNode();
        for (int i = 0; i < bindings.size(); i++) {
            JsonNode entry = bindings.get(i);
            if (BindingShapes.isCanonical(entry)) {
                normalized.add(entry);
                continue;
            }

            Optional<ObjectNode> canonical = BindingShapes.canonicalize(entry);
            if (canonical.isEmpty()) {
                log.warn("Dropping malformed binding [{}]: {}", i, entry);
                operations.add("Dropped malformed binding [" + i + "]");
                continue;
            }
            ObjectNode binding = canonical.get();
            if (binding.get(TO_COMPONENTS).size() != binding.get(TO_PORTS).size()) {
                log.warn("Dropping binding [{}] with {} targets but {} ports", i,
                    binding.get(TO_COMPONENTS).size(), binding.get(TO_PORTS).size());
                operations.add("Dropped binding [" + i + "] with mismatched to_components/to_ports");
                continue;
            }
            normalized.add(binding);
            operations.add("Normalized binding [" + i + "] from " + binding.get(FROM_COMPONENT).asText()
                + " to canonical form");
        }

        if (!operations.isEmpty()) {
            system.set(BINDINGS, normalized);
            operations.forEach(op -> log.debug("Normalize: {}", op));
        }
        return operations;
    }
}
