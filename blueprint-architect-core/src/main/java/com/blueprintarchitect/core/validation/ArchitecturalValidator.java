package com.blueprintarchitect.core.validation;

import com.blueprintarchitect.core.config.EngineConfig.ValidationSettings;
import com.blueprintarchitect.core.connectivity.ConnectivityMatrix;
import com.blueprintarchitect.core.graph.BlueprintGraph;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.schema.SchemaCompatibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Runs every {@link ValidationCheck} over a blueprint and concatenates their issues.
 *
 * <p>The validator holds only immutable collaborators, so one instance may validate
 * many blueprints, including concurrently. It never mutates its input and never
 * stops at the first issue.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConnectivityMatrix matrix = ConnectivityMatrixLoader.loadDefault();
 * ArchitecturalValidator validator = new ArchitecturalValidator(matrix);
 * List<ValidationIssue> issues = validator.validate(blueprint);
 * }</pre>
 */
public class ArchitecturalValidator {

    private static final Logger log = LoggerFactory.getLogger(ArchitecturalValidator.class);

    private final ConnectivityMatrix matrix;
    private final SchemaCompatibility schemas;
    private final ValidationSettings settings;
    private final List<ValidationCheck> checks;

    /**
     * Creates a validator with default thresholds and schema table.
     *
     * @param matrix shared connectivity matrix
     */
    public ArchitecturalValidator(ConnectivityMatrix matrix) {
        this(matrix, SchemaCompatibility.defaults(), ValidationSettings.defaults());
    }

    /**
     * Creates a validator running the checks discovered on the classpath.
     *
     * @param matrix shared connectivity matrix
     * @param schemas shared schema compatibility table
     * @param settings thresholds
     */
    public ArchitecturalValidator(ConnectivityMatrix matrix, SchemaCompatibility schemas, ValidationSettings settings) {
        this(matrix, schemas, settings, discoverChecks());
    }

    /**
     * Creates a validator running an explicit set of checks.
     *
     * @param matrix shared connectivity matrix
     * @param schemas shared schema compatibility table
     * @param settings thresholds
     * @param checks checks, run in priority order
     */
    public ArchitecturalValidator(ConnectivityMatrix matrix, SchemaCompatibility schemas,
                                  ValidationSettings settings, List<ValidationCheck> checks) {
        this.matrix = Objects.requireNonNull(matrix, "matrix must not be null");
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        List<ValidationCheck> ordered = new ArrayList<>(checks);
        ordered.sort(Comparator.comparingInt(ValidationCheck::getPriority));
        this.checks = List.copyOf(ordered);
    }

    /**
     * Validates a blueprint.
     *
     * @param blueprint typed blueprint
     * @return all issues from all checks, in check order
     */
    public List<ValidationIssue> validate(SystemBlueprint blueprint) {
        Objects.requireNonNull(blueprint, "blueprint must not be null");
        ValidationContext context = new ValidationContext(
            blueprint, BlueprintGraph.of(blueprint), matrix, schemas, settings);

        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationCheck check : checks) {
            List<ValidationIssue> found = check.check(context);
            if (!found.isEmpty()) {
                log.debug("Check '{}' reported {} issue(s) for '{}'", check.getId(), found.size(), blueprint.name());
            }
            issues.addAll(found);
        }

        long errors = issues.stream().filter(ValidationIssue::isError).count();
        log.debug("Validated '{}': {} issue(s), {} error(s)", blueprint.name(), issues.size(), errors);
        return issues;
    }

    public List<ValidationCheck> checks() {
        return checks;
    }

    public ConnectivityMatrix matrix() {
        return matrix;
    }

    public SchemaCompatibility schemas() {
        return schemas;
    }

    private static List<ValidationCheck> discoverChecks() {
        List<ValidationCheck> found = new ArrayList<>();
        ServiceLoader.load(ValidationCheck.class, ArchitecturalValidator.class.getClassLoader()).forEach(found::add);
        if (found.isEmpty()) {
            throw new IllegalStateException("No ValidationCheck implementations registered");
        }
        return found;
    }
}
