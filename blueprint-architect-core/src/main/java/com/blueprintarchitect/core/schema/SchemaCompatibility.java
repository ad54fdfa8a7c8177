package com.blueprintarchitect.core.schema;

import com.blueprintarchitect.core.config.EngineConfig.SchemaSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether two port schema labels can be connected without a transformation.
 *
 * <p>Compatibility is directional: {@code integer -> number} is free, the reverse is not.
 * Labels are compared literally; this class reconciles names, it does not inspect
 * schema bodies.
 *
 * <p>The validator and the healer share one instance, so a pair the healer leaves
 * untouched is never reported by the validator.
 */
public final class SchemaCompatibility {

    private static final Logger log = LoggerFactory.getLogger(SchemaCompatibility.class);

    /** Label that accepts every schema. */
    public static final String ANY = "any";

    private static final List<String[]> BUILT_IN_PAIRS = List.of(
        pair("integer", "number"),
        pair("float", "number"),
        pair("array", "list"),
        pair("list", "array"),
        pair("object", "common_object_schema"),
        pair("common_object_schema", "object"),
        pair("array", "common_array_schema"),
        pair("string", "common_string_schema"),
        pair("number", "common_number_schema"),
        pair("integer", "common_integer_schema"),
        pair("boolean", "common_boolean_schema"),
        pair("common_integer_schema", "common_number_schema"),
        pair("common_array_schema", "common_object_schema"),
        pair("common_object_schema", "common_array_schema"),
        pair("common_string_schema", "common_object_schema"),
        pair("common_number_schema", "common_object_schema"),
        pair("common_boolean_schema", "common_object_schema")
    );

    private final Set<String> pairs;
    private final boolean strictTransformations;
    private final Set<String> registeredTransformations;

    private SchemaCompatibility(Set<String> pairs, boolean strictTransformations, Set<String> registeredTransformations) {
        this.pairs = Set.copyOf(pairs);
        this.strictTransformations = strictTransformations;
        this.registeredTransformations = Set.copyOf(registeredTransformations);
    }

    /**
     * Creates the permissive built-in compatibility table.
     *
     * @return compatibility with no extra pairs and no transformation registry
     */
    public static SchemaCompatibility defaults() {
        return from(SchemaSettings.defaults());
    }

    /**
     * Creates a compatibility table from configuration.
     *
     * <p>Extra pairs are written {@code from->to}; malformed entries are logged and skipped.
     *
     * @param settings schema settings
     * @return compatibility table
     */
    public static SchemaCompatibility from(SchemaSettings settings) {
        Set<String> pairs = new HashSet<>();
        for (String[] builtIn : BUILT_IN_PAIRS) {
            pairs.add(key(builtIn[0], builtIn[1]));
        }
        for (String entry : settings.compatiblePairs()) {
            String[] parts = entry.split("->");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                log.warn("Ignoring malformed compatible pair '{}', expected 'from->to'", entry);
                continue;
            }
            pairs.add(key(parts[0].trim(), parts[1].trim()));
        }
        return new SchemaCompatibility(pairs, settings.strictTransformations(),
            new HashSet<>(settings.registeredTransformations()));
    }

    /**
     * Whether data labelled {@code from} may flow into a port labelled {@code to} as-is.
     *
     * <p>A missing label on either side cannot be checked and counts as compatible.
     *
     * @param from source port schema label
     * @param to target port schema label
     * @return true if no transformation is needed
     */
    public boolean isCompatible(String from, String to) {
        if (from == null || to == null || from.isBlank() || to.isBlank()) {
            return true;
        }
        if (from.equals(to) || ANY.equals(to)) {
            return true;
        }
        return pairs.contains(key(from, to));
    }

    /**
     * Builds the synthetic transformation label for a mismatched pair.
     *
     * @param from source schema label
     * @param to target schema label
     * @return label of the form {@code convert_<from>_to_<to>}
     */
    public static String transformationLabel(String from, String to) {
        return "convert_" + slug(from) + "_to_" + slug(to);
    }

    public boolean strictTransformations() {
        return strictTransformations;
    }

    /**
     * Whether a transformation label is acceptable.
     *
     * <p>In permissive mode every non-blank label is accepted. In strict mode the label
     * must be registered in configuration.
     *
     * @param label transformation label
     * @return true if the label may be used
     */
    public boolean isKnownTransformation(String label) {
        if (label == null || label.isBlank()) {
            return false;
        }
        return !strictTransformations || registeredTransformations.contains(label);
    }

    private static String slug(String label) {
        return label.trim().replaceAll("[^A-Za-z0-9]+", "_").toLowerCase(Locale.ROOT);
    }

    private static String[] pair(String from, String to) {
        return new String[] {from, to};
    }

    private static String key(String from, String to) {
        return from + "\u0000" + to;
    }
}
