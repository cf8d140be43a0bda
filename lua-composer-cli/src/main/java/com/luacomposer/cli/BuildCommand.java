package com.luacomposer.cli;

import com.luacomposer.core.build.BuildRequest;
import com.luacomposer.core.build.BuildResult;
import com.luacomposer.core.build.ComposerPipeline;
import com.luacomposer.core.config.BuildSettings;
import com.luacomposer.core.dependency.DependencyResolver;
import com.luacomposer.core.dependency.ResolvedDependencies;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.output.OutputWriter;
import com.luacomposer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the composed script.
 *
 * <p>Steps:
 * <ol>
 *   <li>Resolve settings from the command line, {@code .composerrc} and defaults</li>
 *   <li>Fetch external dependencies in parallel</li>
 *   <li>Run the build pipeline</li>
 *   <li>Write the output file</li>
 * </ol>
 * Nothing is written when any step fails.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * luacomposer build src dist/mission_script.lua --namespace namespace.lua --entrypoint main.lua
 * luacomposer build --scope local --strict-sanitize=false
 * }</pre>
 */
@Command(
    name = "build",
    description = "Combine, sanitize and write the output script",
    mixinStandardHelpOptions = true
)
public class BuildCommand extends ProjectCommand {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Parameters(index = "0", arity = "0..1", description = "Source directory (default: src)")
    String sourceDirectory;

    @Parameters(index = "1", arity = "0..1", description = "Output file (default: dist/mission_script.lua)")
    String outputFile;

    @Override
    String sourceDirectoryArgument() {
        return sourceDirectory;
    }

    @Override
    String outputFileArgument() {
        return outputFile;
    }

    @Override
    String actionName() {
        return "Build";
    }

    @Override
    int execute(BuildSettings settings) {
        log.info("Starting build of: {}", settings.sourceDirectory());
        System.out.println("Building project: " + settings.sourceDirectory());
        System.out.println();

        ResolvedDependencies dependencies = DependencyResolver
            .createDefault(Paths.get("").toAbsolutePath(), settings.cacheDirectory())
            .resolve(settings.dependencies());
        if (!dependencies.dependencies().isEmpty()) {
            System.out.println("✓ Fetched " + dependencies.dependencies().size() + " external dependencies");
        }

        BuildResult result = new ComposerPipeline().build(BuildRequest.of(settings, dependencies, clock));
        System.out.println("✓ Module order: " + (result.order().isEmpty() ? "None" : String.join(", ", result.order())));

        Path written = new OutputWriter().write(settings.outputFile(), result.text());
        System.out.println("✓ Wrote " + written);
        System.out.println("  Total lines in output: " + FileUtils.countLines(result.text()));

        List<BuildWarning> warnings = new ArrayList<>(dependencies.warnings());
        warnings.addAll(result.warnings());
        printWarnings(warnings);

        System.out.println();
        System.out.println("✓ Build complete");
        return 0;
    }
}
