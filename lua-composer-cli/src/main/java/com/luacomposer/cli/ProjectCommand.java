package com.luacomposer.cli;

import com.luacomposer.LuaComposerCLI;
import com.luacomposer.core.config.BuildSettings;
import com.luacomposer.core.config.ComposerConfig;
import com.luacomposer.core.config.ConfigLoader;
import com.luacomposer.core.config.ConfigValidator;
import com.luacomposer.core.config.DependencyConfig;
import com.luacomposer.core.error.ComposerException;
import com.luacomposer.core.model.BuildWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Options and settings resolution shared by the commands that read a project.
 *
 * <p>Settings are layered: command line options over the configuration file
 * over built-in defaults. Subclasses implement {@link #execute(BuildSettings)};
 * a {@link ComposerException} thrown from it is reported and turned into exit
 * code {@code 1}.
 */
abstract class ProjectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProjectCommand.class);

    @ParentCommand
    LuaComposerCLI parent;

    @Option(names = {"--header"}, description = "Header file relative to the source directory")
    String header;

    @Option(names = {"--namespace"}, description = "Namespace file relative to the source directory")
    String namespace;

    @Option(names = {"--entrypoint"}, description = "Entrypoint file relative to the source directory")
    String entrypoint;

    @Option(names = {"--footer"}, description = "Footer file relative to the source directory")
    String footer;

    @Option(
        names = {"--strict-sanitize", "--dcs-strict-sanitize"},
        arity = "1",
        description = "Fail on os, io and lfs usage (default: true)"
    )
    Boolean strictSanitize;

    @Option(names = {"--scope"}, description = "Output scope: global or local (default: global)")
    String scope;

    @Option(names = {"--dependencies"}, description = "JSON list of external dependencies (overrides config)")
    String dependenciesJson;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: .composerrc)")
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--cache-dir"}, description = "Download cache directory")
    String cacheDirectory;

    Clock clock = Clock.systemUTC();

    /**
     * @return source directory given on the command line, or {@code null}
     */
    abstract String sourceDirectoryArgument();

    /**
     * @return output file given on the command line, or {@code null}
     */
    abstract String outputFileArgument();

    /**
     * Runs the command with resolved settings.
     *
     * @param settings validated settings
     * @return exit code
     */
    abstract int execute(BuildSettings settings);

    /**
     * @return verb used in the failure line, e.g. {@code Build}
     */
    abstract String actionName();

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        try {
            return execute(resolveSettings());
        } catch (ComposerException | IllegalStateException e) {
            log.error("{} failed: {}", actionName(), e.getMessage());
            log.debug("Failure details", e);
            System.err.println("✗ " + actionName() + " failed: " + e.getMessage());
            return 1;
        }
    }

    BuildSettings resolveSettings() {
        List<DependencyConfig> dependencies = dependenciesJson != null
            ? ConfigLoader.parseDependencies(dependenciesJson)
            : null;
        ComposerConfig commandLine = new ComposerConfig(sourceDirectoryArgument(), outputFileArgument(), header,
            namespace, entrypoint, footer, strictSanitize, null, scope, dependencies, cacheDirectory);

        ComposerConfig merged = ComposerConfig.defaults()
            .overriddenBy(ConfigLoader.load(configPath))
            .overriddenBy(commandLine);
        return new ConfigValidator().validate(merged, Paths.get("").toAbsolutePath());
    }

    static void printWarnings(List<BuildWarning> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println("Warnings (" + warnings.size() + "):");
        for (BuildWarning warning : warnings) {
            System.out.println("  ! " + warning);
        }
    }
}
