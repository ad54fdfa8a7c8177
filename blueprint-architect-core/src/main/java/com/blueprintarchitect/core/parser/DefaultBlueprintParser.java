package com.blueprintarchitect.core.parser;

import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.Port;
import com.blueprintarchitect.core.model.Statefulness;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.blueprintarchitect.core.parser.BlueprintFields.*;

/**
 * Default {@link BlueprintParser} for the {@code system}-rooted document layout.
 *
 * <p>Checks, reporting every problem rather than stopping at the first:
 * <ul>
 *   <li>{@code system} section present, {@code name} matches {@code ^[a-z][a-z0-9_]*$}</li>
 *   <li>{@code components} is a non-empty array of uniquely named, known-typed components</li>
 *   <li>{@code inputs}/{@code outputs} are arrays of named ports</li>
 *   <li>{@code bindings} is an array whose entries reference existing components
 *       with matching {@code to_components}/{@code to_ports} lengths</li>
 * </ul>
 *
 * <p>Defaults: {@code durable} follows the component type, {@code statefulness} is
 * stateless, a port without a schema gets {@value BlueprintFields#DEFAULT_PORT_SCHEMA}.
 */
public class DefaultBlueprintParser implements BlueprintParser {

    private static final Logger log = LoggerFactory.getLogger(DefaultBlueprintParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public ParseResult parse(JsonNode document) {
        List<StructuralError> problems = new ArrayList<>();
        if (document == null || !document.isObject()) {
            problems.add(StructuralError.error("$", "document must be an object"));
            return ParseResult.failure(problems);
        }

        JsonNode system = document.get(SYSTEM);
        if (system == null || !system.isObject()) {
            problems.add(StructuralError.error(SYSTEM, "missing 'system' section"));
            return ParseResult.failure(problems);
        }

        String name = text(system, NAME);
        if (name == null) {
            problems.add(StructuralError.error("system.name", "system name is required"));
        } else if (!NAME_PATTERN.matcher(name).matches()) {
            problems.add(StructuralError.error("system.name",
                "system name '" + name + "' must match " + NAME_PATTERN.pattern()));
        }

        String schemaVersion = text(document, SCHEMA_VERSION);
        if (schemaVersion == null) {
            problems.add(StructuralError.warning(SCHEMA_VERSION, "no schema_version marker"));
        }

        List<Component> components = parseComponents(system.get(COMPONENTS), problems);
        Set<String> names = new HashSet<>();
        components.forEach(c -> names.add(c.name()));
        List<Binding> bindings = parseBindings(system.get(BINDINGS), names, problems);

        if (problems.stream().anyMatch(StructuralError::isError)) {
            log.debug("Parse of '{}' failed with {} problems", name, problems.size());
            return ParseResult.failure(problems);
        }

        SystemBlueprint blueprint = new SystemBlueprint(
            name,
            text(system, DESCRIPTION),
            text(system, VERSION),
            schemaVersion,
            components,
            bindings,
            toMap(system.get(POLICY)),
            toMap(system.get(SCHEMAS))
        );
        log.debug("Parsed blueprint '{}': {} components, {} bindings",
            name, components.size(), bindings.size());
        return ParseResult.success(blueprint, problems);
    }

    private List<Component> parseComponents(JsonNode node, List<StructuralError> problems) {
        List<Component> components = new ArrayList<>();
        if (node == null || !node.isArray() || node.isEmpty()) {
            problems.add(StructuralError.error("system.components", "at least one component is required"));
            return components;
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            String path = "system.components[" + i + "]";
            JsonNode entry = node.get(i);
            if (!entry.isObject()) {
                problems.add(StructuralError.error(path, "component must be an object"));
                continue;
            }

            String name = text(entry, NAME);
            if (name == null) {
                problems.add(StructuralError.error(path + ".name", "component name is required"));
                continue;
            }
            if (!NAME_PATTERN.matcher(name).matches()) {
                problems.add(StructuralError.error(path + ".name",
                    "component name '" + name + "' must match " + NAME_PATTERN.pattern()));
            }
            if (!seen.add(name)) {
                problems.add(StructuralError.error(path + ".name", "duplicate component name '" + name + "'"));
                continue;
            }

            String typeName = text(entry, TYPE);
            Optional<ComponentType> type = ComponentType.fromName(typeName);
            if (type.isEmpty()) {
                problems.add(StructuralError.error(path + ".type",
                    typeName == null ? "component type is required" : "unknown component type '" + typeName + "'"));
                continue;
            }

            List<Port> inputs = parsePorts(entry.get(INPUTS), path + ".inputs", problems);
            List<Port> outputs = parsePorts(entry.get(OUTPUTS), path + ".outputs", problems);
            boolean durable = entry.has(DURABLE) ? entry.get(DURABLE).asBoolean() : type.get().durableByDefault();

            components.add(new Component(
                name,
                type.get(),
                text(entry, DESCRIPTION),
                inputs,
                outputs,
                durable,
                entry.path(TERMINAL_HINT).asBoolean(false),
                Statefulness.parse(text(entry, STATEFULNESS))
            ));
        }
        return components;
    }

    private List<Port> parsePorts(JsonNode node, String path, List<StructuralError> problems) {
        List<Port> ports = new ArrayList<>();
        if (node == null || node.isNull()) {
            return ports;
        }
        if (!node.isArray()) {
            problems.add(StructuralError.error(path, "ports must be a list"));
            return ports;
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            String name = entry.isObject() ? text(entry, NAME) : null;
            if (name == null) {
                problems.add(StructuralError.error(path + "[" + i + "]", "port must be an object with a name"));
                continue;
            }
            if (!seen.add(name)) {
                problems.add(StructuralError.error(path + "[" + i + "]", "duplicate port name '" + name + "'"));
                continue;
            }
            String schema = text(entry, SCHEMA);
            ports.add(new Port(
                name,
                schema == null ? DEFAULT_PORT_SCHEMA : schema,
                entry.path(REQUIRED).asBoolean(true),
                entry.path(BOUNDARY_INGRESS).asBoolean(false),
                entry.path(BOUNDARY_EGRESS).asBoolean(false),
                entry.path(REPLY_REQUIRED).asBoolean(false),
                entry.path(SATISFIES_REPLY).asBoolean(false),
                text(entry, DATA_CLASSIFICATION)
            ));
        }
        return ports;
    }

    private List<Binding> parseBindings(JsonNode node, Set<String> components, List<StructuralError> problems) {
        List<Binding> bindings = new ArrayList<>();
        if (node == null || node.isNull()) {
            return bindings;
        }
        if (!node.isArray()) {
            problems.add(StructuralError.error("system.bindings", "bindings must be a list"));
            return bindings;
        }

        for (int i = 0; i < node.size(); i++) {
            String path = "system.bindings[" + i + "]";
            Optional<ObjectNode> canonical = BindingShapes.canonicalize(node.get(i));
            if (canonical.isEmpty()) {
                problems.add(StructuralError.error(path, "binding must name a source and at least one target"));
                continue;
            }

            ObjectNode entry = canonical.get();
            String from = entry.get(FROM_COMPONENT).asText();
            List<String> toComponents = strings(entry.get(TO_COMPONENTS));
            List<String> toPorts = strings(entry.get(TO_PORTS));

            boolean valid = true;
            if (!components.contains(from)) {
                problems.add(StructuralError.error(path + ".from_component", "unknown component '" + from + "'"));
                valid = false;
            }
            for (String target : toComponents) {
                if (!components.contains(target)) {
                    problems.add(StructuralError.error(path + ".to_components", "unknown component '" + target + "'"));
                    valid = false;
                }
            }
            if (toComponents.size() != toPorts.size()) {
                problems.add(StructuralError.error(path + ".to_ports", "to_components has " + toComponents.size()
                    + " entries but to_ports has " + toPorts.size()));
                valid = false;
            }
            if (valid) {
                bindings.add(new Binding(from, entry.get(FROM_PORT).asText(), toComponents, toPorts,
                    text(entry, TRANSFORMATION), text(entry, CONDITION)));
            }
        }
        return bindings;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(node -> values.add(node.asText()));
        return values;
    }

    private static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, Object> map = MAPPER.convertValue(node, MAP_TYPE);
        map.values().removeIf(v -> v == null);
        return map;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
