package com.luacomposer;

import ch.qos.logback.classic.Level;
import com.luacomposer.cli.BuildCommand;
import com.luacomposer.cli.CheckCommand;
import com.luacomposer.cli.OrderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the DCS Lua composer.
 *
 * <p>Combines a multi-file Lua project into a single sanitized script that runs
 * in the DCS World mission scripting environment.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Fetch dependencies, compose and write the output script</li>
 *   <li>{@code check} - Run every check of a build without fetching or writing</li>
 *   <li>{@code order} - Print the resolved core-module order</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * luacomposer build src dist/mission_script.lua --namespace namespace.lua --entrypoint main.lua
 * luacomposer -v check --scope local
 * }</pre>
 */
@Command(
    name = "luacomposer",
    mixinStandardHelpOptions = true,
    version = "DCS Lua Composer 1.0.0-SNAPSHOT",
    description = "Combines and sanitizes Lua projects for the DCS World mission scripting environment",
    subcommands = {
        BuildCommand.class,
        CheckCommand.class,
        OrderCommand.class
    }
)
public class LuaComposerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LuaComposerCLI.class);

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

        System.out.println("DCS Lua Composer");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'luacomposer --help' to see available commands");
        System.out.println("Use 'luacomposer <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options. Subcommands
     * call this before doing any work.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new LuaComposerCLI()).execute(args);
        System.exit(exitCode);
    }
}
