package com.blueprintarchitect.cli;

import com.blueprintarchitect.core.config.EngineConfig;
import com.blueprintarchitect.core.orchestration.HealingOrchestrator;
import com.blueprintarchitect.core.parser.BlueprintDocuments;
import com.blueprintarchitect.core.parser.BlueprintReadException;
import com.blueprintarchitect.core.report.ValidationReport;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a blueprint without healing it.
 *
 * <p>Exit codes: {@code 0} when the blueprint has no errors, {@code 1} when validation
 * reports errors, {@code 2} when the file cannot be read or fails the typed parse.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * blueprint-architect validate orders.yaml
 * blueprint-architect validate orders.yaml --config strict.yaml
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate a blueprint against the connectivity matrix and architectural rules",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_INVALID = 1;
    static final int EXIT_UNREADABLE = 2;

    @Parameters(index = "0", description = "Blueprint file (YAML or JSON)")
    private Path blueprintFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: blueprint-architect.yaml if present)"
    )
    private Path configPath;

    @Override
    public Integer call() {
        log.info("Validating blueprint: {}", blueprintFile);

        ObjectNode document;
        try {
            document = BlueprintDocuments.read(blueprintFile);
        } catch (BlueprintReadException e) {
            log.error("Cannot read blueprint {}", blueprintFile, e);
            System.err.println("✗ " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        EngineConfig config = EngineConfigs.resolve(configPath);
        ValidationReport report = HealingOrchestrator.create(config).inspect(document);
        System.out.print(report.render());

        if (report.structurallyBroken()) {
            System.err.println("✗ Blueprint is structurally broken; run 'heal' to attempt repair");
            return EXIT_UNREADABLE;
        }
        if (!report.passed()) {
            System.err.println("✗ Validation failed with " + report.errorCount() + " error(s)");
            return EXIT_INVALID;
        }
        System.out.println("✓ Blueprint is valid");
        return 0;
    }
}
