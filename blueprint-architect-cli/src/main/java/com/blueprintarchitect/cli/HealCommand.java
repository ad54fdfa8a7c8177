package com.blueprintarchitect.cli;

import com.blueprintarchitect.core.config.EngineConfig;
import com.blueprintarchitect.core.healing.HealingRecord;
import com.blueprintarchitect.core.orchestration.BlueprintHealingException;
import com.blueprintarchitect.core.orchestration.HealingOrchestrator;
import com.blueprintarchitect.core.orchestration.HealingOutcome;
import com.blueprintarchitect.core.parser.BlueprintDocuments;
import com.blueprintarchitect.core.parser.BlueprintReadException;
import com.blueprintarchitect.core.parser.StructuralError;
import com.blueprintarchitect.core.report.MermaidFlowchartWriter;
import com.blueprintarchitect.core.validation.ValidationIssue;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to heal a blueprint and write the repaired document.
 *
 * <p>Runs the heal-and-validate loop. On success the healed working document is written
 * as YAML (to {@code --output}, or standard output) followed by the healing history and
 * any remaining warnings. When the YAML goes to standard output, the history goes to
 * standard error so the output can be redirected into a file. On failure every
 * unresolved issue is printed and the command exits with {@code 1}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Heal and print the result
 * blueprint-architect heal orders.yaml
 *
 * # Heal with a larger budget, write the result and a diagram
 * blueprint-architect heal orders.yaml -o healed.yaml --max-attempts 6 --diagram healed.md
 * }</pre>
 */
@Command(
    name = "heal",
    description = "Heal a blueprint and write the repaired document",
    mixinStandardHelpOptions = true
)
public class HealCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HealCommand.class);

    @Parameters(index = "0", description = "Blueprint file (YAML or JSON)")
    private Path blueprintFile;

    @Option(names = {"-o", "--output"}, description = "Write the healed blueprint here (default: stdout)")
    private Path outputFile;

    @Option(names = {"--max-attempts"}, description = "Total healing attempts (overrides config)")
    private Integer maxAttempts;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: blueprint-architect.yaml if present)"
    )
    private Path configPath;

    @Option(names = {"--diagram"}, description = "Write a Mermaid flowchart of the healed blueprint")
    private Path diagramFile;

    @Override
    public Integer call() {
        ObjectNode document;
        try {
            document = BlueprintDocuments.read(blueprintFile);
        } catch (BlueprintReadException e) {
            log.error("Cannot read blueprint {}", blueprintFile, e);
            System.err.println("✗ " + e.getMessage());
            return ValidateCommand.EXIT_UNREADABLE;
        }

        if (maxAttempts != null && maxAttempts < 1) {
            System.err.println("✗ --max-attempts must be at least 1, was " + maxAttempts);
            return ValidateCommand.EXIT_UNREADABLE;
        }

        EngineConfig config = EngineConfigs.resolve(configPath);
        if (maxAttempts != null) {
            config = config.withMaxAttempts(maxAttempts);
        }
        log.info("Healing blueprint {} with up to {} attempt(s)", blueprintFile, config.healing().maxAttempts());

        HealingOutcome outcome;
        try {
            outcome = HealingOrchestrator.create(config).healAndValidate(document);
        } catch (BlueprintHealingException e) {
            printFailure(e);
            return ValidateCommand.EXIT_INVALID;
        }

        try {
            writeResult(outcome);
        } catch (IOException e) {
            log.error("Failed to write healing output", e);
            System.err.println("✗ Failed to write output: " + e.getMessage());
            return ValidateCommand.EXIT_UNREADABLE;
        }
        printSummary(outcome);
        return 0;
    }

    private void writeResult(HealingOutcome outcome) throws IOException {
        if (outputFile != null) {
            BlueprintDocuments.write(outcome.document(), outputFile);
            System.out.println("✓ Wrote healed blueprint to: " + outputFile);
        } else {
            System.out.print(BlueprintDocuments.toYaml(outcome.document()));
            System.out.flush();
        }

        if (diagramFile != null) {
            Path parent = diagramFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(diagramFile, new MermaidFlowchartWriter().write(outcome.blueprint()));
            summaryStream().println("✓ Wrote diagram to: " + diagramFile);
        }
    }

    private void printSummary(HealingOutcome outcome) {
        PrintStream out = summaryStream();
        out.println();
        out.println("✓ Blueprint '" + outcome.blueprint().name() + "' healed in "
            + outcome.attempts() + " attempt(s)");

        for (HealingRecord record : outcome.history()) {
            for (String operation : record.operations()) {
                out.println("  • [" + record.phase() + "] " + operation);
            }
        }
        if (!outcome.issues().isEmpty()) {
            out.println();
            out.println("Remaining issues:");
            outcome.issues().forEach(issue -> out.println("  " + issue));
        }
    }

    // standard output carries the YAML when no output file is given
    private PrintStream summaryStream() {
        return outputFile != null ? System.out : System.err;
    }

    private void printFailure(BlueprintHealingException e) {
        System.err.println("✗ Healing failed after " + e.attempts() + " attempt(s)");
        for (StructuralError error : e.structuralErrors()) {
            System.err.println("  " + error);
        }
        for (ValidationIssue issue : e.issues()) {
            System.err.println("  " + issue);
            if (issue.suggestion() != null) {
                System.err.println("      suggestion: " + issue.suggestion());
            }
        }
    }
}
