package com.blueprintarchitect.core.connectivity;

import com.blueprintarchitect.core.model.ComponentType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link ConnectivityMatrix} from YAML.
 *
 * <p>The bundled table lives at {@value #DEFAULT_RESOURCE} on the classpath. Each
 * call returns a fresh immutable instance; callers keep the reference.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * rules:
 *   Source:
 *     can_connect_to: [Transformer, Store, Sink]
 *     can_receive_from: []
 *     expected_inputs: 0
 *     expected_outputs: 1
 *     is_terminal: false
 *     is_source: true
 * }</pre>
 */
public final class ConnectivityMatrixLoader {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityMatrixLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath location of the bundled matrix. */
    public static final String DEFAULT_RESOURCE = "/connectivity-matrix.yaml";

    private ConnectivityMatrixLoader() {
    }

    /**
     * Loads the bundled matrix.
     *
     * @return matrix
     * @throws MatrixLoadException if the resource is missing or invalid
     */
    public static ConnectivityMatrix loadDefault() {
        try (InputStream in = ConnectivityMatrixLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new MatrixLoadException("Bundled connectivity matrix not found: " + DEFAULT_RESOURCE);
            }
            return load(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new MatrixLoadException("Failed to read bundled connectivity matrix", e);
        }
    }

    /**
     * Loads a matrix from a YAML file.
     *
     * @param path matrix file
     * @return matrix
     * @throws MatrixLoadException if the file is missing or invalid
     */
    public static ConnectivityMatrix load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MatrixLoadException("Connectivity matrix file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new MatrixLoadException("Failed to read connectivity matrix: " + path, e);
        }
    }

    /**
     * Loads the matrix from {@code path} when given, otherwise the bundled one.
     *
     * @param path optional override file, may be null
     * @return matrix
     */
    public static ConnectivityMatrix loadOrDefault(Path path) {
        return path == null ? loadDefault() : load(path);
    }

    static ConnectivityMatrix load(InputStream in, String origin) throws IOException {
        MatrixDocument document = YAML_MAPPER.readValue(in, MatrixDocument.class);
        if (document == null || document.rules() == null || document.rules().isEmpty()) {
            throw new MatrixLoadException("Connectivity matrix has no rules: " + origin);
        }

        Map<ComponentType, ConnectivityRule> rules = new EnumMap<>(ComponentType.class);
        document.rules().forEach((typeName, entry) -> {
            ComponentType type = resolve(typeName, origin);
            rules.put(type, new ConnectivityRule(
                type,
                resolveAll(entry.canConnectTo(), origin),
                resolveAll(entry.canReceiveFrom(), origin),
                entry.expectedInputs(),
                entry.expectedOutputs(),
                entry.terminal(),
                entry.source()
            ));
        });

        ConnectivityMatrix matrix = new ConnectivityMatrix(rules);
        log.debug("Loaded connectivity matrix from {} ({} rules)", origin, rules.size());
        List<String> violations = matrix.symmetryViolations();
        if (!violations.isEmpty()) {
            log.warn("Connectivity matrix {} is not symmetric: {}", origin, violations);
        }
        return matrix;
    }

    private static ComponentType resolve(String typeName, String origin) {
        return ComponentType.fromName(typeName)
            .orElseThrow(() -> new MatrixLoadException("Unknown component type '" + typeName + "' in " + origin));
    }

    private static Set<ComponentType> resolveAll(List<String> typeNames, String origin) {
        Set<ComponentType> types = EnumSet.noneOf(ComponentType.class);
        if (typeNames != null) {
            for (String typeName : typeNames) {
                types.add(resolve(typeName, origin));
            }
        }
        return types;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MatrixDocument(@JsonProperty("rules") Map<String, RuleEntry> rules) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleEntry(
        @JsonProperty("can_connect_to") List<String> canConnectTo,
        @JsonProperty("can_receive_from") List<String> canReceiveFrom,
        @JsonProperty("expected_inputs") int expectedInputs,
        @JsonProperty("expected_outputs") int expectedOutputs,
        @JsonProperty("is_terminal") boolean terminal,
        @JsonProperty("is_source") boolean source
    ) {}
}
