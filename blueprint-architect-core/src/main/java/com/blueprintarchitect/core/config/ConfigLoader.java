package com.blueprintarchitect.core.config;

import com.blueprintarchitect.core.config.EngineConfig.HealingSettings;
import com.blueprintarchitect.core.config.EngineConfig.MatrixSettings;
import com.blueprintarchitect.core.config.EngineConfig.SchemaSettings;
import com.blueprintarchitect.core.config.EngineConfig.ValidationSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Loads engine configuration from {@code blueprint-architect.yaml}.
 *
 * <p>Each top-level section is read on its own. A section holding an out-of-range
 * value falls back to its own defaults while the other sections are kept; an
 * unreadable or malformed file yields {@link EngineConfig#defaults()}. Unknown
 * sections are reported and ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EngineConfig config = ConfigLoader.load(Paths.get("blueprint-architect.yaml"));
 * int attempts = config.healing().maxAttempts();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "blueprint-architect.yaml";

    static final String HEALING = "healing";
    static final String VALIDATION = "validation";
    static final String SCHEMA = "schema";
    static final String MATRIX = "matrix";

    private static final Set<String> SECTIONS = Set.of(HEALING, VALIDATION, SCHEMA, MATRIX);

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code blueprint-architect.yaml}, may be {@code null}
     * @return loaded configuration, with defaults for absent or invalid sections
     */
    public static EngineConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        JsonNode root;
        try {
            log.debug("Loading configuration from: {}", configPath);
            root = YAML_MAPPER.readTree(configPath.toFile());
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return EngineConfig.defaults();
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }
        if (!root.isObject()) {
            log.error("Configuration file {} must be a mapping of sections. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        for (Iterator<String> names = root.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (!SECTIONS.contains(name)) {
                log.warn("Ignoring unknown configuration section '{}' in {}", name, configPath);
            }
        }

        EngineConfig config = new EngineConfig(
            section(root, HEALING, HealingSettings.class, HealingSettings::defaults),
            section(root, VALIDATION, ValidationSettings.class, ValidationSettings::defaults),
            section(root, SCHEMA, SchemaSettings.class, SchemaSettings::defaults),
            section(root, MATRIX, MatrixSettings.class, () -> new MatrixSettings(null)));
        log.info("Loaded configuration from: {} (maxAttempts={}, matrix={})", configPath,
            config.healing().maxAttempts(), config.matrix().path() == null ? "bundled" : config.matrix().path());
        return config;
    }

    private static <T> T section(JsonNode root, String name, Class<T> type, Supplier<T> defaults) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return defaults.get();
        }
        try {
            T value = YAML_MAPPER.treeToValue(node, type);
            return value == null ? defaults.get() : value;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Invalid '{}' configuration section, using its defaults. Error: {}", name, rootCause(e));
            return defaults.get();
        }
    }

    private static String rootCause(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
