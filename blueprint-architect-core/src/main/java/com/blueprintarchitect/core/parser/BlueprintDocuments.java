package com.blueprintarchitect.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes raw blueprint documents.
 *
 * <p>Files ending in {@code .json} are read as JSON, everything else as YAML.
 * Output is always YAML.
 */
public final class BlueprintDocuments {

    private static final Logger log = LoggerFactory.getLogger(BlueprintDocuments.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private BlueprintDocuments() {
    }

    /**
     * Reads a blueprint file.
     *
     * @param path YAML or JSON file
     * @return document root
     * @throws BlueprintReadException if the file is unreadable or not an object
     */
    public static ObjectNode read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new BlueprintReadException("Blueprint file not found: " + path);
        }
        ObjectMapper mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
            ? JSON_MAPPER : YAML_MAPPER;
        try {
            log.debug("Reading blueprint from: {}", path);
            return asObject(mapper.readTree(path.toFile()), path.toString());
        } catch (IOException e) {
            throw new BlueprintReadException("Failed to parse blueprint " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses YAML (or JSON, which YAML accepts) text.
     *
     * @param content document text
     * @return document root
     * @throws BlueprintReadException if the text is not a YAML/JSON object
     */
    public static ObjectNode parse(String content) {
        try {
            return asObject(YAML_MAPPER.readTree(content), "<string>");
        } catch (JsonProcessingException e) {
            throw new BlueprintReadException("Failed to parse blueprint: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Renders a document as YAML.
     *
     * @param document document root
     * @return YAML text
     */
    public static String toYaml(JsonNode document) {
        try {
            return YAML_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render blueprint as YAML", e);
        }
    }

    /**
     * Writes a document as YAML, creating parent directories.
     *
     * @param document document root
     * @param path target file
     * @throws IOException if the file cannot be written
     */
    public static void write(JsonNode document, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toYaml(document));
        log.debug("Wrote blueprint to: {}", path);
    }

    private static ObjectNode asObject(JsonNode node, String origin) {
        if (node == null || !node.isObject()) {
            throw new BlueprintReadException("Blueprint " + origin + " is not a mapping");
        }
        return (ObjectNode) node;
    }
}
