package com.blueprintarchitect.core.validation;

import com.blueprintarchitect.core.config.EngineConfig.ValidationSettings;
import com.blueprintarchitect.core.connectivity.ConnectivityMatrix;
import com.blueprintarchitect.core.graph.BlueprintGraph;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.schema.SchemaCompatibility;

import java.util.Objects;

/**
 * Everything a {@link ValidationCheck} may read while checking one blueprint.
 *
 * @param blueprint blueprint under validation
 * @param graph graph view of the blueprint
 * @param matrix shared connectivity matrix
 * @param schemas shared schema compatibility table
 * @param settings validator thresholds
 */
public record ValidationContext(
    SystemBlueprint blueprint,
    BlueprintGraph graph,
    ConnectivityMatrix matrix,
    SchemaCompatibility schemas,
    ValidationSettings settings
) {
    public ValidationContext {
        Objects.requireNonNull(blueprint, "blueprint must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(schemas, "schemas must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
    }
}
