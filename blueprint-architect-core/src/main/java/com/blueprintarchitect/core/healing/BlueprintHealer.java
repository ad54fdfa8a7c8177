package com.blueprintarchitect.core.healing;

import com.blueprintarchitect.core.connectivity.ConnectivityMatrix;
import com.blueprintarchitect.core.model.ComponentRole;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.ports.PortTemplates;
import com.blueprintarchitect.core.schema.SchemaCompatibility;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.blueprintarchitect.core.parser.BlueprintFields.*;

/**
 * Deterministic repairs on the raw blueprint document.
 *
 * <p>The healer works on a deep copy of the document it is given and reports what it
 * changed in a {@link HealingRecord}. Typed model objects are never touched; callers
 * re-parse the healed document.
 *
 * <p><b>Structural phase</b>, in order:
 * <ol>
 *   <li>wrap top-level {@code components} into a {@code system} block</li>
 *   <li>canonicalize binding shapes, dropping malformed entries</li>
 *   <li>ensure a {@code schema_version} marker and a default {@code policy} block</li>
 *   <li>fix component type casing and non-list port fields</li>
 *   <li>rename the system, components and ports to snake_case, following them in bindings</li>
 *   <li>propose bindings for unconnected components along plausible data flows</li>
 *   <li>add a terminal component when none exists</li>
 *   <li>connect origins and processors that still send nowhere to the first terminal</li>
 * </ol>
 * Every proposed binding must pass {@link ConnectivityMatrix#allows} and must not
 * repeat a pair the {@link HealingSession} has already generated or rejected.
 *
 * <p><b>Schema phase</b>: for each binding without a transformation whose port schemas
 * are incompatible, injects a {@code convert_<from>_to_<to>} label.
 */
public class BlueprintHealer {

    private static final Logger log = LoggerFactory.getLogger(BlueprintHealer.class);

    static final String DEFAULT_SCHEMA_VERSION = "1.0.0";
    static final String DEFAULT_SYSTEM_NAME = "generated_system";
    static final String SYNTHESIZED_STORE = "primary_store";
    static final String SYNTHESIZED_SINK = "data_sink";

    private static final int CONTROLLER_PEERS = 2;

    private final ConnectivityMatrix matrix;
    private final SchemaCompatibility schemas;
    private final BindingNormalizer normalizer = new BindingNormalizer();
    private final NameNormalizer names = new NameNormalizer();

    public BlueprintHealer(ConnectivityMatrix matrix) {
        this(matrix, SchemaCompatibility.defaults());
    }

    public BlueprintHealer(ConnectivityMatrix matrix, SchemaCompatibility schemas) {
        this.matrix = Objects.requireNonNull(matrix, "matrix must not be null");
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
    }

    /**
     * Runs one healing phase.
     *
     * @param document raw document; not modified
     * @param phase phase to run
     * @param session state of the current heal-and-validate run
     * @return healed copy and the operations applied
     */
    public HealingResult heal(ObjectNode document, HealingPhase phase, HealingSession session) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(session, "session must not be null");

        ObjectNode working = document.deepCopy();
        List<String> operations = switch (phase) {
            case STRUCTURAL -> healStructure(working, session);
            case SCHEMA -> healSchemas(working);
        };
        operations.forEach(op -> log.debug("{} heal: {}", phase, op));
        return new HealingResult(working, new HealingRecord(phase, operations));
    }

    private List<String> healStructure(ObjectNode document, HealingSession session) {
        List<String> operations = new ArrayList<>();
        wrapSystemBlock(document, operations);
        operations.addAll(normalizer.normalize(document));
        healSchemaVersion(document, operations);

        JsonNode systemNode = document.get(SYSTEM);
        if (systemNode == null || !systemNode.isObject()) {
            return operations;
        }
        ObjectNode system = (ObjectNode) systemNode;
        healPolicy(system, operations);
        healSystemBlock(system, operations);
        operations.addAll(names.normalize(system));

        if (!system.path(COMPONENTS).isArray()) {
            return operations;
        }
        RawSystem raw = new RawSystem(system);
        generateMissingBindings(raw, session, operations);
        ensureTerminal(raw, operations);
        connectToTerminals(raw, session, operations);
        return operations;
    }

    private void wrapSystemBlock(ObjectNode document, List<String> operations) {
        if (document.has(SYSTEM) || !document.path(COMPONENTS).isArray()) {
            return;
        }
        ObjectNode system = document.objectNode();
        for (String field : List.of(NAME, DESCRIPTION, VERSION, COMPONENTS, BINDINGS, POLICY, SCHEMAS)) {
            JsonNode value = document.remove(field);
            if (value != null) {
                system.set(field, value);
            }
        }
        document.set(SYSTEM, system);
        operations.add("Wrapped top-level components into system block");
    }

    private void healSchemaVersion(ObjectNode document, List<String> operations) {
        JsonNode system = document.get(SYSTEM);
        if (system != null && system.isObject() && system.has(SCHEMA_VERSION)) {
            JsonNode misplaced = ((ObjectNode) system).remove(SCHEMA_VERSION);
            if (!document.has(SCHEMA_VERSION)) {
                document.set(SCHEMA_VERSION, misplaced);
            }
            operations.add("Moved schema_version out of system block");
        }

        JsonNode version = document.get(SCHEMA_VERSION);
        if (version == null || version.isNull() || version.asText().isBlank()) {
            document.put(SCHEMA_VERSION, DEFAULT_SCHEMA_VERSION);
            operations.add("Added schema_version " + DEFAULT_SCHEMA_VERSION);
        } else if ("1.0".equals(version.asText())) {
            document.put(SCHEMA_VERSION, DEFAULT_SCHEMA_VERSION);
            operations.add("Upgraded schema_version 1.0 to " + DEFAULT_SCHEMA_VERSION);
        } else if (!version.isTextual()) {
            document.put(SCHEMA_VERSION, version.asText());
            operations.add("Converted schema_version " + version.asText() + " to text");
        }
    }

    private void healPolicy(ObjectNode system, List<String> operations) {
        if (system.path(POLICY).isObject()) {
            return;
        }
        ObjectNode policy = system.putObject(POLICY);
        ObjectNode security = policy.putObject("security");
        security.put("encryption_at_rest", true);
        security.put("encryption_in_transit", true);
        security.put("authentication_required", true);
        ObjectNode limits = policy.putObject("resource_limits");
        limits.put("max_memory_per_component", "512Mi");
        limits.put("max_cpu_per_component", "500m");
        policy.putObject("validation").put("strict_mode", true);
        operations.add("Added default policy block");
    }

    private void healSystemBlock(ObjectNode system, List<String> operations) {
        if (!system.path(NAME).isTextual() || system.get(NAME).asText().isBlank()) {
            system.put(NAME, DEFAULT_SYSTEM_NAME);
            operations.add("Added system name " + DEFAULT_SYSTEM_NAME);
        }
        if (!system.has(VERSION)) {
            system.put(VERSION, DEFAULT_SCHEMA_VERSION);
            operations.add("Added system version " + DEFAULT_SCHEMA_VERSION);
        }
        if (system.has(COMPONENTS) && !system.get(COMPONENTS).isArray()) {
            system.putArray(COMPONENTS);
            operations.add("Replaced non-list components with empty list");
        }
        if (!system.path(BINDINGS).isArray()) {
            boolean existed = system.has(BINDINGS);
            system.putArray(BINDINGS);
            operations.add(existed ? "Replaced non-list bindings with empty list" : "Added empty bindings list");
        }

        for (JsonNode node : system.path(COMPONENTS)) {
            if (!node.isObject()) {
                continue;
            }
            ObjectNode component = (ObjectNode) node;
            String name = component.path(NAME).asText("?");
            JsonNode type = component.get(TYPE);
            if (type != null && type.isTextual()) {
                Optional<ComponentType> resolved = ComponentType.fromName(type.asText());
                if (resolved.isPresent() && !resolved.get().blueprintName().equals(type.asText())) {
                    component.put(TYPE, resolved.get().blueprintName());
                    operations.add("Fixed type casing of " + name + ": " + type.asText()
                        + " -> " + resolved.get().blueprintName());
                }
            }
            for (String field : List.of(INPUTS, OUTPUTS)) {
                JsonNode ports = component.get(field);
                if (ports != null && !ports.isArray()) {
                    component.putArray(field);
                    operations.add("Replaced non-list " + field + " of " + name + " with empty list");
                }
            }
        }
    }

    private void generateMissingBindings(RawSystem raw, HealingSession session, List<String> operations) {
        List<RawComponent> components = raw.components();
        for (RawComponent from : components) {
            if (from.terminalHint() || raw.outgoingCount(from.name()) > 0) {
                continue;
            }
            switch (from.type().role()) {
                case ORIGIN -> {
                    List<RawComponent> candidates = ofRole(components, from, ComponentRole.PROCESSOR);
                    if (candidates.isEmpty()) {
                        candidates = terminals(components);
                    }
                    proposeFirst(raw, from, candidates, session, operations);
                }
                case PROCESSOR -> proposeFirst(raw, from, terminals(components), session, operations);
                case ENDPOINT -> proposeFirst(raw, from, ofType(components, ComponentType.STORE), session, operations);
                case STORAGE -> proposeFirst(raw, from, ofRole(components, from, ComponentRole.ENDPOINT), session, operations);
                case ORCHESTRATOR -> {
                    int proposed = 0;
                    for (RawComponent peer : components) {
                        if (proposed == CONTROLLER_PEERS) {
                            break;
                        }
                        if (peer != from && peer.type() != ComponentType.CONTROLLER
                            && propose(raw, from, peer, session, operations)) {
                            proposed++;
                        }
                    }
                }
                case TERMINAL -> {
                    // sinks never send
                }
            }
        }
    }

    private void ensureTerminal(RawSystem raw, List<String> operations) {
        List<RawComponent> components = raw.components();
        if (!terminals(components).isEmpty()) {
            return;
        }
        boolean wantsStore = components.stream().anyMatch(c ->
            c.type().role() == ComponentRole.PROCESSOR || c.type().role() == ComponentRole.ENDPOINT);
        ComponentType type = wantsStore ? ComponentType.STORE : ComponentType.SINK;
        String name = raw.uniqueName(wantsStore ? SYNTHESIZED_STORE : SYNTHESIZED_SINK);

        ObjectNode component = raw.componentsArray().addObject();
        component.put(NAME, name);
        component.put(TYPE, type.blueprintName());
        component.put(DESCRIPTION, "Terminal added during healing");
        component.putArray(INPUTS);
        component.putArray(OUTPUTS);
        operations.add("Added terminal component " + name + " (" + type.blueprintName() + ")");
    }

    private void connectToTerminals(RawSystem raw, HealingSession session, List<String> operations) {
        List<RawComponent> components = raw.components();
        List<RawComponent> terminals = terminals(components);
        for (RawComponent from : components) {
            ComponentRole role = from.type().role();
            if ((role != ComponentRole.ORIGIN && role != ComponentRole.PROCESSOR) || from.terminalHint()
                || raw.outgoingCount(from.name()) > 0) {
                continue;
            }
            proposeFirst(raw, from, terminals, session, operations);
        }
    }

    private void proposeFirst(RawSystem raw, RawComponent from, List<RawComponent> candidates,
                              HealingSession session, List<String> operations) {
        for (RawComponent to : candidates) {
            if (propose(raw, from, to, session, operations)) {
                return;
            }
        }
    }

    private boolean propose(RawSystem raw, RawComponent from, RawComponent to,
                            HealingSession session, List<String> operations) {
        if (from.name().equals(to.name()) || raw.hasPair(from.name(), to.name())
            || !session.isUndecided(from.name(), to.name())) {
            return false;
        }
        if (!matrix.allows(from.type(), to.type())) {
            session.markRejected(from.name(), to.name());
            log.debug("Rejected binding {} -> {}: {} cannot send to {}", from.name(), to.name(),
                from.type().blueprintName(), to.type().blueprintName());
            return false;
        }

        String fromPort = from.firstOutput().orElse(PortTemplates.defaultOutputName(from.type()));
        String toPort = to.firstInput().orElse(PortTemplates.defaultInputName(to.type()));
        ObjectNode binding = raw.bindingsArray().addObject();
        binding.put(FROM_COMPONENT, from.name());
        binding.put(FROM_PORT, fromPort);
        binding.putArray(TO_COMPONENTS).add(to.name());
        binding.putArray(TO_PORTS).add(toPort);
        session.markGenerated(from.name(), to.name());
        operations.add("Generated binding " + from.name() + "." + fromPort + " -> " + to.name() + "." + toPort);
        return true;
    }

    private List<String> healSchemas(ObjectNode document) {
        List<String> operations = new ArrayList<>();
        JsonNode system = document.get(SYSTEM);
        if (system == null || !system.path(COMPONENTS).isArray() || !system.path(BINDINGS).isArray()) {
            return operations;
        }
        RawSystem raw = new RawSystem((ObjectNode) system);

        for (JsonNode node : system.get(BINDINGS)) {
            if (!node.isObject() || !node.path(TRANSFORMATION).asText("").isBlank()) {
                continue;
            }
            ObjectNode binding = (ObjectNode) node;
            String fromName = binding.path(FROM_COMPONENT).asText();
            Optional<String> fromSchema = raw.component(fromName)
                .flatMap(c -> c.portSchema(OUTPUTS, binding.path(FROM_PORT).asText()));
            if (fromSchema.isEmpty()) {
                continue;
            }

            JsonNode targets = binding.path(TO_COMPONENTS);
            JsonNode ports = binding.path(TO_PORTS);
            for (int i = 0; i < targets.size() && i < ports.size(); i++) {
                String toName = targets.get(i).asText();
                String toPort = ports.get(i).asText();
                Optional<String> toSchema = raw.component(toName).flatMap(c -> c.portSchema(INPUTS, toPort));
                if (toSchema.isEmpty() || schemas.isCompatible(fromSchema.get(), toSchema.get())) {
                    continue;
                }

                String label = SchemaCompatibility.transformationLabel(fromSchema.get(), toSchema.get());
                if (!schemas.isKnownTransformation(label)) {
                    log.warn("Schema mismatch {} ({}) -> {} ({}) has no registered transformation '{}'",
                        fromName, fromSchema.get(), toName, toSchema.get(), label);
                    break;
                }
                binding.put(TRANSFORMATION, label);
                operations.add("Injected transformation " + label + " on " + fromName + " -> " + toName);
                break;
            }
        }
        return operations;
    }

    private static List<RawComponent> terminals(List<RawComponent> components) {
        return components.stream().filter(c -> c.type().isTerminal()).toList();
    }

    private static List<RawComponent> ofType(List<RawComponent> components, ComponentType type) {
        return components.stream().filter(c -> c.type() == type).toList();
    }

    private static List<RawComponent> ofRole(List<RawComponent> components, RawComponent self, ComponentRole role) {
        return components.stream().filter(c -> c != self && c.type().role() == role).toList();
    }

    /**
     * Read helpers over the raw {@code system} block.
     */
    private static final class RawSystem {

        private final ObjectNode system;

        RawSystem(ObjectNode system) {
            this.system = system;
        }

        ArrayNode componentsArray() {
            return (ArrayNode) system.get(COMPONENTS);
        }

        ArrayNode bindingsArray() {
            return (ArrayNode) system.get(BINDINGS);
        }

        /**
         * Components with a name and a known type, in document order.
         */
        List<RawComponent> components() {
            List<RawComponent> components = new ArrayList<>();
            for (JsonNode node : componentsArray()) {
                if (!node.isObject() || !node.path(NAME).isTextual()) {
                    continue;
                }
                ComponentType.fromName(node.path(TYPE).asText(null))
                    .ifPresent(type -> components.add(new RawComponent((ObjectNode) node, type)));
            }
            return components;
        }

        Optional<RawComponent> component(String name) {
            return components().stream().filter(c -> c.name().equals(name)).findFirst();
        }

        int outgoingCount(String name) {
            int count = 0;
            for (JsonNode binding : system.path(BINDINGS)) {
                if (name.equals(binding.path(FROM_COMPONENT).asText(null))) {
                    count++;
                }
            }
            return count;
        }

        boolean hasPair(String from, String to) {
            for (JsonNode binding : system.path(BINDINGS)) {
                if (!from.equals(binding.path(FROM_COMPONENT).asText(null))) {
                    continue;
                }
                for (JsonNode target : binding.path(TO_COMPONENTS)) {
                    if (to.equals(target.asText())) {
                        return true;
                    }
                }
            }
            return false;
        }

        String uniqueName(String base) {
            Set<String> taken = new HashSet<>();
            for (JsonNode node : componentsArray()) {
                taken.add(node.path(NAME).asText());
            }
            String candidate = base;
            for (int i = 2; taken.contains(candidate); i++) {
                candidate = base + "_" + i;
            }
            return candidate;
        }
    }

    /**
     * Raw component node with its resolved type.
     */
    private record RawComponent(ObjectNode node, ComponentType type) {

        String name() {
            return node.path(NAME).asText();
        }

        boolean terminalHint() {
            return node.path(TERMINAL_HINT).asBoolean(false);
        }

        Optional<String> firstOutput() {
            return firstPortName(OUTPUTS);
        }

        Optional<String> firstInput() {
            return firstPortName(INPUTS);
        }

        Optional<String> portSchema(String direction, String portName) {
            for (JsonNode port : node.path(direction)) {
                if (portName.equals(port.path(NAME).asText(null))) {
                    String schema = port.path(SCHEMA).asText("");
                    return Optional.of(schema.isBlank() ? DEFAULT_PORT_SCHEMA : schema);
                }
            }
            return Optional.empty();
        }

        private Optional<String> firstPortName(String direction) {
            for (JsonNode port : node.path(direction)) {
                String name = port.path(NAME).asText("");
                if (!name.isBlank()) {
                    return Optional.of(name);
                }
            }
            return Optional.empty();
        }
    }
}
