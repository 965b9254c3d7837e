package com.framelint;

import ch.qos.logback.classic.Level;
import com.framelint.cli.AnalyzeCommand;
import com.framelint.cli.ListCommand;
import com.framelint.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Frame Lint.
 *
 * <p>Frame Lint checks design documents exported from a design tool against layout,
 * responsiveness and naming rules and scores how ready they are for code generation.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a design document and report its score</li>
 *   <li>{@code list} - List available rules or renderers</li>
 *   <li>{@code validate} - Validate a configuration file (and optionally a document)</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * framelint analyze landing.json
 * framelint analyze landing.json -f markdown -f json -o ./report --fail-on code
 * framelint list rules
 * }</pre>
 */
@Command(
    name = "framelint",
    mixinStandardHelpOptions = true,
    version = "Frame Lint 1.0.0-SNAPSHOT",
    description = "Layout rule checks and conformance scoring for design documents",
    subcommands = {
        AnalyzeCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class FrameLintCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FrameLintCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Frame Lint - design document layout checks");
        System.out.println();
        System.out.println("Use 'framelint --help' to see available commands");
        System.out.println("Use 'framelint <command> --help' for command-specific help");
    }

    /**
     * Builds the configured command line; logging is set up before any subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        FrameLintCLI cli = new FrameLintCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
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
        log.debug("Log level set to {}", root.getLevel());
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
