package com.luacomposer.core.build;

import com.luacomposer.core.config.BuildSettings;
import com.luacomposer.core.dependency.DependencyDeclaration;
import com.luacomposer.core.dependency.ResolvedDependencies;
import com.luacomposer.core.model.ExternalDependency;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inputs of one build.
 *
 * @param sourceDirectory source root
 * @param headerFile header relative to the source root, or {@code null}
 * @param namespaceFile namespace relative to the source root
 * @param entrypointFile entrypoint relative to the source root
 * @param footerFile footer relative to the source root, or {@code null}
 * @param dependencies fetched dependencies to inject, in declaration order
 * @param externalNames names that satisfy a {@code require} by being injected
 * @param options build options
 */
public record BuildRequest(
    Path sourceDirectory,
    String headerFile,
    String namespaceFile,
    String entrypointFile,
    String footerFile,
    List<ExternalDependency> dependencies,
    Set<String> externalNames,
    BuildOptions options
) {
    public BuildRequest {
        Objects.requireNonNull(sourceDirectory, "sourceDirectory must not be null");
        Objects.requireNonNull(options, "options must not be null");
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        Set<String> names = new LinkedHashSet<>(externalNames != null ? externalNames : Set.of());
        dependencies.forEach(dependency -> names.add(dependency.name()));
        externalNames = Set.copyOf(names);
    }

    /**
     * Request for a full build with fetched dependencies.
     */
    public static BuildRequest of(BuildSettings settings, ResolvedDependencies dependencies, Clock clock) {
        return new BuildRequest(settings.sourceDirectory(), settings.headerFile(), settings.namespaceFile(),
            settings.entrypointFile(), settings.footerFile(), dependencies.dependencies(), Set.of(),
            new BuildOptions(settings.strict(), settings.scope(), clock));
    }

    /**
     * Request that treats declared dependencies as present without fetching them.
     */
    public static BuildRequest withoutFetching(BuildSettings settings, Clock clock) {
        Set<String> names = new LinkedHashSet<>();
        settings.dependencies().stream().map(DependencyDeclaration::name).forEach(names::add);
        return new BuildRequest(settings.sourceDirectory(), settings.headerFile(), settings.namespaceFile(),
            settings.entrypointFile(), settings.footerFile(), List.of(), names,
            new BuildOptions(settings.strict(), settings.scope(), clock));
    }
}
