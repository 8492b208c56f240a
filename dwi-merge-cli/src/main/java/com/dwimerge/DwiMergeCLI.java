package com.dwimerge;

import com.dwimerge.cli.ListCommand;
import com.dwimerge.cli.MergeCommand;
import com.dwimerge.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for dwi-merge.
 *
 * <p>dwi-merge combines the distortion groups of a diffusion MRI session (series acquired
 * with different phase-encoding directions) into one series, with its gradient table and
 * quality-control record.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code merge} - Run the merge workflow described by a configuration file</li>
 *   <li>{@code validate} - Check configuration, inputs and workflow graph without merging</li>
 *   <li>{@code list} - List available merge strategies</li>
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
 * # Merge using dwimerge.yaml in the current directory
 * dwimerge merge
 *
 * # Concatenate instead of averaging, with 4 worker threads
 * dwimerge -v merge session/dwimerge.yaml --strategy concat --threads 4
 *
 * # List merge strategies
 * dwimerge list strategies
 * }</pre>
 */
@Command(
    name = "dwimerge",
    mixinStandardHelpOptions = true,
    version = "dwi-merge 1.0.0-SNAPSHOT",
    description = "Merges distortion groups of a diffusion MRI session into one series",
    subcommands = {
        MergeCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class DwiMergeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DwiMergeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("dwi-merge - Distortion group merging for diffusion MRI");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'dwimerge --help' to see available commands");
        System.out.println("Use 'dwimerge <command> --help' for command-specific help");
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
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DwiMergeCLI cli = new DwiMergeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
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
