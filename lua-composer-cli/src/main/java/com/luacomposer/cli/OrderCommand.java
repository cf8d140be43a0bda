package com.luacomposer.cli;

import com.luacomposer.core.build.BuildRequest;
import com.luacomposer.core.build.ComposerPipeline;
import com.luacomposer.core.build.ProjectAnalysis;
import com.luacomposer.core.config.BuildSettings;
import com.luacomposer.core.model.Module;
import com.luacomposer.core.model.RequireReference;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.stream.Collectors;

/**
 * Prints the core modules in the order they are emitted, with what each requires.
 */
@Command(
    name = "order",
    description = "Print the resolved core-module order",
    mixinStandardHelpOptions = true
)
public class OrderCommand extends ProjectCommand {

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
        return "Order";
    }

    @Override
    int execute(BuildSettings settings) {
        ProjectAnalysis analysis = new ComposerPipeline().analyze(BuildRequest.withoutFetching(settings, clock));
        if (analysis.order().isEmpty()) {
            System.out.println("No core modules");
            return 0;
        }
        int position = 1;
        for (String identity : analysis.order()) {
            Module module = analysis.module(identity);
            String requires = module.requires().stream()
                .map(RequireReference::identity)
                .collect(Collectors.joining(", "));
            System.out.printf("%3d. %-30s %s%n", position++, identity, module.relativePath());
            if (!requires.isEmpty()) {
                System.out.println("       requires: " + requires);
            }
        }
        return 0;
    }
}
