package com.blueprintarchitect.core.orchestration;

import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.Port;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.blueprintarchitect.core.parser.BlueprintFields.*;

/**
 * Copies ports added by inference back into the raw working document, so the next
 * parse and the schema healer see them.
 */
final class WorkingDocumentSync {

    private WorkingDocumentSync() {
    }

    /**
     * Appends every port of {@code blueprint} that the raw document does not declare.
     *
     * @param document raw working document, modified in place
     * @param blueprint blueprint after port inference
     * @return number of ports written
     */
    static int syncPorts(ObjectNode document, SystemBlueprint blueprint) {
        JsonNode components = document.path(SYSTEM).path(COMPONENTS);
        if (!components.isArray()) {
            return 0;
        }
        Map<String, ObjectNode> byName = new HashMap<>();
        for (JsonNode node : components) {
            if (node.isObject() && node.path(NAME).isTextual()) {
                byName.putIfAbsent(node.get(NAME).asText(), (ObjectNode) node);
            }
        }

        int written = 0;
        for (Component component : blueprint.components()) {
            ObjectNode raw = byName.get(component.name());
            if (raw == null) {
                continue;
            }
            written += appendMissing(raw, INPUTS, component.inputs());
            written += appendMissing(raw, OUTPUTS, component.outputs());
        }
        return written;
    }

    private static int appendMissing(ObjectNode component, String field, List<Port> ports) {
        if (ports.isEmpty()) {
            return 0;
        }
        ArrayNode array = component.path(field).isArray() ? (ArrayNode) component.get(field) : component.putArray(field);
        int written = 0;
        for (Port port : ports) {
            boolean present = false;
            for (JsonNode existing : array) {
                if (port.name().equals(existing.path(NAME).asText(null))) {
                    present = true;
                    break;
                }
            }
            if (!present) {
                toNode(array.addObject(), port);
                written++;
            }
        }
        return written;
    }

    private static void toNode(ObjectNode node, Port port) {
        node.put(NAME, port.name());
        node.put(SCHEMA, port.schemaId());
        node.put(REQUIRED, port.required());
        if (port.boundaryIngress()) {
            node.put(BOUNDARY_INGRESS, true);
        }
        if (port.boundaryEgress()) {
            node.put(BOUNDARY_EGRESS, true);
        }
        if (port.replyRequired()) {
            node.put(REPLY_REQUIRED, true);
        }
        if (port.satisfiesReply()) {
            node.put(SATISFIES_REPLY, true);
        }
        if (port.dataClassification() != null) {
            node.put(DATA_CLASSIFICATION, port.dataClassification());
        }
    }
}
