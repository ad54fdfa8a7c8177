package com.blueprintarchitect.core.orchestration;

import com.blueprintarchitect.core.config.EngineConfig;
import com.blueprintarchitect.core.connectivity.ConnectivityMatrix;
import com.blueprintarchitect.core.connectivity.ConnectivityMatrixLoader;
import com.blueprintarchitect.core.healing.BindingNormalizer;
import com.blueprintarchitect.core.healing.BlueprintHealer;
import com.blueprintarchitect.core.healing.HealingPhase;
import com.blueprintarchitect.core.healing.HealingRecord;
import com.blueprintarchitect.core.healing.HealingResult;
import com.blueprintarchitect.core.healing.HealingSession;
import com.blueprintarchitect.core.healing.StagnationTracker;
import com.blueprintarchitect.core.model.SystemBlueprint;
import com.blueprintarchitect.core.parser.BlueprintParser;
import com.blueprintarchitect.core.parser.DefaultBlueprintParser;
import com.blueprintarchitect.core.parser.ParseResult;
import com.blueprintarchitect.core.parser.StructuralError;
import com.blueprintarchitect.core.ports.PortInference;
import com.blueprintarchitect.core.ports.TemplatePortInference;
import com.blueprintarchitect.core.report.ValidationReport;
import com.blueprintarchitect.core.schema.SchemaCompatibility;
import com.blueprintarchitect.core.validation.ArchitecturalValidator;
import com.blueprintarchitect.core.validation.ValidationIssue;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.blueprintarchitect.core.parser.BlueprintFields.NAME;
import static com.blueprintarchitect.core.parser.BlueprintFields.SYSTEM;

/**
 * Drives parse, heal and validate to a fixed point.
 *
 * <p>One attempt runs:
 * <pre>
 * structural heal -> parse -> infer ports -> sync working document
 *                 -> schema heal -> parse -> validate
 * </pre>
 * Binding formats are normalized once before the first attempt. Every attempt works on
 * the same working document, so earlier repairs are kept. The run succeeds as soon as
 * validation reports no error-severity issue. It fails when the attempt budget is spent
 * or the {@link StagnationTracker} calls a stop.
 *
 * <p>The orchestrator holds only shared immutable collaborators; every call to
 * {@link #healAndValidate(ObjectNode)} starts a fresh {@link HealingSession}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HealingOrchestrator orchestrator = HealingOrchestrator.create(EngineConfig.defaults());
 * HealingOutcome outcome = orchestrator.healAndValidate(BlueprintDocuments.read(path));
 * SystemBlueprint healed = outcome.blueprint();
 * }</pre>
 */
public class HealingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(HealingOrchestrator.class);

    private final EngineConfig config;
    private final BlueprintParser parser;
    private final PortInference portInference;
    private final BlueprintHealer healer;
    private final ArchitecturalValidator validator;
    private final BindingNormalizer normalizer = new BindingNormalizer();

    public HealingOrchestrator(EngineConfig config, BlueprintParser parser, PortInference portInference,
                               BlueprintHealer healer, ArchitecturalValidator validator) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.portInference = Objects.requireNonNull(portInference, "portInference must not be null");
        this.healer = Objects.requireNonNull(healer, "healer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Wires the default collaborators around a shared matrix.
     *
     * @param config engine configuration
     * @param matrix connectivity matrix
     * @return orchestrator
     */
    public static HealingOrchestrator create(EngineConfig config, ConnectivityMatrix matrix) {
        SchemaCompatibility schemas = SchemaCompatibility.from(config.schema());
        return new HealingOrchestrator(
            config,
            new DefaultBlueprintParser(),
            new TemplatePortInference(),
            new BlueprintHealer(matrix, schemas),
            new ArchitecturalValidator(matrix, schemas, config.validation())
        );
    }

    /**
     * Wires the default collaborators, loading the matrix named by the configuration.
     *
     * @param config engine configuration
     * @return orchestrator
     */
    public static HealingOrchestrator create(EngineConfig config) {
        String matrixPath = config.matrix().path();
        ConnectivityMatrix matrix = ConnectivityMatrixLoader.loadOrDefault(
            matrixPath == null ? null : Path.of(matrixPath));
        return create(config, matrix);
    }

    /**
     * Heals and validates using the configured attempt budget.
     *
     * @param document raw document; not modified
     * @return healed blueprint
     * @throws BlueprintHealingException if the blueprint is still invalid at the end
     */
    public HealingOutcome healAndValidate(ObjectNode document) {
        return healAndValidate(document, config.healing().maxAttempts());
    }

    /**
     * Heals and validates with an explicit attempt budget.
     *
     * @param document raw document; not modified
     * @param maxAttempts total attempts including the first
     * @return healed blueprint
     * @throws BlueprintHealingException if the blueprint is still invalid at the end
     */
    public HealingOutcome healAndValidate(ObjectNode document, int maxAttempts) {
        Objects.requireNonNull(document, "document must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive, was " + maxAttempts);
        }

        HealingSession session = HealingSession.start(config.healing());
        List<HealingRecord> history = new ArrayList<>();
        ObjectNode working = document.deepCopy();

        List<String> normalizeOps = normalizer.normalize(working);
        if (!normalizeOps.isEmpty()) {
            history.add(new HealingRecord(HealingPhase.STRUCTURAL, normalizeOps));
        }

        List<ValidationIssue> lastIssues = List.of();
        List<StructuralError> lastStructural = List.of();
        String reason = "attempt budget exhausted";
        int attempt = 0;

        while (attempt < maxAttempts) {
            attempt++;
            List<String> attemptOps = new ArrayList<>(attempt == 1 ? normalizeOps : List.of());

            HealingResult structural = healer.heal(working, HealingPhase.STRUCTURAL, session);
            working = structural.document();
            history.add(structural.record());
            attemptOps.addAll(structural.record().operations());

            ParseResult parsed = parser.parse(working);
            if (parsed.isSuccess()) {
                SystemBlueprint inferred = portInference.inferPorts(parsed.blueprint());
                int synced = WorkingDocumentSync.syncPorts(working, inferred);
                if (synced > 0) {
                    log.debug("Attempt {}: synced {} inferred port(s) into working document", attempt, synced);
                }

                HealingResult schema = healer.heal(working, HealingPhase.SCHEMA, session);
                working = schema.document();
                history.add(schema.record());
                attemptOps.addAll(schema.record().operations());
                parsed = parser.parse(working);
            }

            if (parsed.isSuccess()) {
                lastStructural = List.of();
                lastIssues = validator.validate(parsed.blueprint());
                long errors = lastIssues.stream().filter(ValidationIssue::isError).count();
                log.info("Attempt {}/{} for '{}': {} healing operation(s), {} error(s)",
                    attempt, maxAttempts, parsed.blueprint().name(), attemptOps.size(), errors);
                if (errors == 0) {
                    return new HealingOutcome(parsed.blueprint(), working, lastIssues, history, attempt);
                }
            } else {
                lastIssues = List.of();
                lastStructural = parsed.errors();
                log.info("Attempt {}/{} for '{}': {} structural error(s)",
                    attempt, maxAttempts, nameOf(working), lastStructural.size());
            }

            if (session.stagnation().observe(attemptOps) == StagnationTracker.Verdict.STOP) {
                reason = "healing stagnated";
                break;
            }
        }

        log.error("Blueprint '{}' still invalid after {} attempt(s): {}", nameOf(working), attempt, reason);
        throw new BlueprintHealingException(reason, lastIssues, lastStructural, history, attempt);
    }

    /**
     * Validates a typed blueprint without healing.
     *
     * @param blueprint typed blueprint
     * @return validation issues
     */
    public List<ValidationIssue> validate(SystemBlueprint blueprint) {
        return validator.validate(blueprint);
    }

    /**
     * Parses, infers ports and validates a raw document without healing it.
     *
     * @param document raw document; not modified
     * @return report of structural errors and validation issues
     */
    public ValidationReport inspect(ObjectNode document) {
        ParseResult parsed = parser.parse(document);
        if (!parsed.isSuccess()) {
            return new ValidationReport(nameOf(document), parsed.problems(), List.of());
        }
        SystemBlueprint blueprint = portInference.inferPorts(parsed.blueprint());
        return new ValidationReport(blueprint.name(), parsed.problems(), validator.validate(blueprint));
    }

    private static String nameOf(ObjectNode document) {
        return document.path(SYSTEM).path(NAME).asText("<unnamed>");
    }
}
