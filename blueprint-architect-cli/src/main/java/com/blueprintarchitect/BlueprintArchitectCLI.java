package com.blueprintarchitect;

import ch.qos.logback.classic.Level;
import com.blueprintarchitect.cli.HealCommand;
import com.blueprintarchitect.cli.MatrixCommand;
import com.blueprintarchitect.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for BlueprintArchitect.
 *
 * <p>BlueprintArchitect checks system blueprints against the connectivity matrix and
 * architectural rules, and repairs them where it can.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Validate a blueprint without changing it</li>
 *   <li>{@code heal} - Heal a blueprint and write the repaired document</li>
 *   <li>{@code matrix} - Print the connectivity matrix and check its consistency</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate a blueprint
 * blueprint-architect validate orders.yaml
 *
 * # Heal with verbose output and write the result
 * blueprint-architect -v heal orders.yaml -o orders.healed.yaml
 * }</pre>
 */
@Command(
    name = "blueprint-architect",
    mixinStandardHelpOptions = true,
    version = "BlueprintArchitect 1.0.0-SNAPSHOT",
    description = "Semantic validation and healing for system blueprints",
    subcommands = {
        ValidateCommand.class,
        HealCommand.class,
        MatrixCommand.class
    }
)
public class BlueprintArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BlueprintArchitectCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("BlueprintArchitect - Semantic validation and healing for system blueprints");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'blueprint-architect --help' to see available commands");
        System.out.println("Use 'blueprint-architect <command> --help' for command-specific help");
    }

    /**
     * Applies the global logging options, then runs the most specific command.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with the global logging options wired in.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        BlueprintArchitectCLI cli = new BlueprintArchitectCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
