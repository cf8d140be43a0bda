package com.luacomposer.cli;

import com.luacomposer.core.build.BuildRequest;
import com.luacomposer.core.build.BuildResult;
import com.luacomposer.core.build.ComposerPipeline;
import com.luacomposer.core.config.BuildSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Runs every check a build performs without fetching dependencies or writing output.
 *
 * <p>Declared dependencies count as present, so requires on them resolve.
 */
@Command(
    name = "check",
    description = "Check the project without fetching dependencies or writing output",
    mixinStandardHelpOptions = true
)
public class CheckCommand extends ProjectCommand {

    @Parameters(index = "0", arity = "0..1", description = "Source directory (default: src)")
    String sourceDirectory;

    @Override
    String sourceDirectoryArgument() {
        return sourceDirectory;
    }

    @Override
    String outputFileArgument() {
        return null;
    }

    @Override
    String actionName() {
        return "Check";
    }

    @Override
    int execute(BuildSettings settings) {
        BuildResult result = new ComposerPipeline().build(BuildRequest.withoutFetching(settings, clock));
        System.out.println("✓ " + result.order().size() + " core modules ordered and sanitized");
        printWarnings(result.warnings());
        System.out.println();
        System.out.println("✓ Check passed");
        return 0;
    }
}
