package com.blueprintarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for the validation and healing engine.
 *
 * <p>Loaded from {@code blueprint-architect.yaml}. Every section is optional; a
 * missing section or field takes its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * healing:
 *   maxAttempts: 4
 *   stagnationWarnThreshold: 2
 *   stagnationStopThreshold: 3
 *
 * validation:
 *   fanOutThreshold: 2
 *   excessiveFanOut: 3
 *
 * schema:
 *   strictTransformations: true
 *   registeredTransformations:
 *     - convert_order_to_invoice
 *   compatiblePairs:
 *     - "OrderV1->OrderV2"
 *
 * matrix:
 *   path: ./my-matrix.yaml
 * }</pre>
 *
 * @param healing healing loop settings
 * @param validation validator thresholds
 * @param schema schema compatibility settings
 * @param matrix connectivity matrix location
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("healing") HealingSettings healing,
    @JsonProperty("validation") ValidationSettings validation,
    @JsonProperty("schema") SchemaSettings schema,
    @JsonProperty("matrix") MatrixSettings matrix
) {
    /**
     * Compact constructor applying section defaults.
     */
    public EngineConfig {
        if (healing == null) {
            healing = HealingSettings.defaults();
        }
        if (validation == null) {
            validation = ValidationSettings.defaults();
        }
        if (schema == null) {
            schema = SchemaSettings.defaults();
        }
        if (matrix == null) {
            matrix = new MatrixSettings(null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null);
    }

    /**
     * Returns a copy with a different attempt budget.
     *
     * @param maxAttempts total attempts including the first
     * @return new configuration
     */
    public EngineConfig withMaxAttempts(int maxAttempts) {
        return new EngineConfig(
            new HealingSettings(maxAttempts, healing.stagnationWarnThreshold(), healing.stagnationStopThreshold()),
            validation, schema, matrix);
    }

    /**
     * Healing loop settings.
     *
     * @param maxAttempts total attempts including the first
     * @param stagnationWarnThreshold consecutive stagnant passes that trigger a warning
     * @param stagnationStopThreshold consecutive stagnant passes that stop the loop
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HealingSettings(
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("stagnationWarnThreshold") Integer stagnationWarnThreshold,
        @JsonProperty("stagnationStopThreshold") Integer stagnationStopThreshold
    ) {
        public HealingSettings {
            maxAttempts = positiveOr(maxAttempts, 4, "maxAttempts");
            stagnationWarnThreshold = positiveOr(stagnationWarnThreshold, 2, "stagnationWarnThreshold");
            stagnationStopThreshold = positiveOr(stagnationStopThreshold, 3, "stagnationStopThreshold");
            if (stagnationStopThreshold < stagnationWarnThreshold) {
                throw new IllegalArgumentException("stagnationStopThreshold must be >= stagnationWarnThreshold");
            }
        }

        public static HealingSettings defaults() {
            return new HealingSettings(null, null, null);
        }
    }

    /**
     * Validator thresholds.
     *
     * <p>Pattern thresholds are heuristics; they tune classification only and never
     * turn a graph into an error.
     *
     * @param pipelineEdgeSlack edges allowed above node count for a pipeline
     * @param fanOutThreshold out-degree above which a graph is fan-out shaped
     * @param fanInThreshold in-degree above which a graph is fan-in shaped
     * @param excessiveFanOut out-degree above which a routing component is suggested
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("pipelineEdgeSlack") Integer pipelineEdgeSlack,
        @JsonProperty("fanOutThreshold") Integer fanOutThreshold,
        @JsonProperty("fanInThreshold") Integer fanInThreshold,
        @JsonProperty("excessiveFanOut") Integer excessiveFanOut
    ) {
        public ValidationSettings {
            pipelineEdgeSlack = pipelineEdgeSlack == null ? 2 : pipelineEdgeSlack;
            fanOutThreshold = positiveOr(fanOutThreshold, 2, "fanOutThreshold");
            fanInThreshold = positiveOr(fanInThreshold, 2, "fanInThreshold");
            excessiveFanOut = positiveOr(excessiveFanOut, 3, "excessiveFanOut");
        }

        public static ValidationSettings defaults() {
            return new ValidationSettings(null, null, null, null);
        }
    }

    /**
     * Schema compatibility settings.
     *
     * @param strictTransformations only registered transformation labels are accepted
     * @param registeredTransformations known transformation labels
     * @param compatiblePairs additional freely compatible pairs written as {@code from->to}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SchemaSettings(
        @JsonProperty("strictTransformations") boolean strictTransformations,
        @JsonProperty("registeredTransformations") List<String> registeredTransformations,
        @JsonProperty("compatiblePairs") List<String> compatiblePairs
    ) {
        public SchemaSettings {
            registeredTransformations = registeredTransformations == null
                ? List.of() : List.copyOf(registeredTransformations);
            compatiblePairs = compatiblePairs == null ? List.of() : List.copyOf(compatiblePairs);
        }

        public static SchemaSettings defaults() {
            return new SchemaSettings(false, null, null);
        }
    }

    /**
     * Connectivity matrix location.
     *
     * @param path override matrix file, or null for the bundled matrix
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MatrixSettings(@JsonProperty("path") String path) {}

    private static Integer positiveOr(Integer value, int fallback, String field) {
        if (value == null) {
            return fallback;
        }
        if (value < 1) {
            throw new IllegalArgumentException(field + " must be positive, was " + value);
        }
        return value;
    }
}
