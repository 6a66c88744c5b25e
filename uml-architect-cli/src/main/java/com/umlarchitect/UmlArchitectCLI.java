package com.umlarchitect;

import com.umlarchitect.cli.GenerateCommand;
import com.umlarchitect.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for UML Architect.
 *
 * <p>UML Architect reads source files and writes PlantUML class diagrams for the types they
 * declare.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate class diagrams from a source file or directory</li>
 *   <li>{@code list} - List available generators or renderers</li>
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
 * # One diagram per Java file below src/main/java
 * umlarchitect generate src/main/java -o docs/uml --index
 *
 * # Print a single diagram without @startuml/@enduml
 * umlarchitect generate Order.java --renderer console --no-wrap
 * }</pre>
 */
@Command(
    name = "umlarchitect",
    mixinStandardHelpOptions = true,
    version = "UML Architect 1.0.0-SNAPSHOT",
    description = "PlantUML class diagram generator for source code",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class
    }
)
public class UmlArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(UmlArchitectCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("UML Architect - PlantUML Class Diagram Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'umlarchitect --help' to see available commands");
        System.out.println("Use 'umlarchitect <command> --help' for command-specific help");
    }

    /**
     * Creates the command line for this root command.
     *
     * <p>Global options are applied to the logging configuration before the selected
     * subcommand runs.
     *
     * @return configured command line
     */
    public CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(this);
        commandLine.setExecutionStrategy(parseResult -> {
            configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
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

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new UmlArchitectCLI().createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
