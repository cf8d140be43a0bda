package com.luacomposer.core.config;

import com.luacomposer.core.dependency.DependencyDeclaration;
import com.luacomposer.core.model.ScopeMode;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Validated, fully resolved build settings.
 *
 * @param sourceDirectory source root
 * @param outputFile output script path
 * @param headerFile header relative to the source root, or {@code null}
 * @param namespaceFile namespace relative to the source root
 * @param entrypointFile entrypoint relative to the source root
 * @param footerFile footer relative to the source root, or {@code null}
 * @param strict strict DCS sanitization
 * @param scope scope mode
 * @param dependencies external dependencies in declaration order
 * @param cacheDirectory download cache directory
 */
public record BuildSettings(
    Path sourceDirectory,
    Path outputFile,
    String headerFile,
    String namespaceFile,
    String entrypointFile,
    String footerFile,
    boolean strict,
    ScopeMode scope,
    List<DependencyDeclaration> dependencies,
    Path cacheDirectory
) {
    public BuildSettings {
        Objects.requireNonNull(sourceDirectory, "sourceDirectory must not be null");
        Objects.requireNonNull(outputFile, "outputFile must not be null");
        Objects.requireNonNull(namespaceFile, "namespaceFile must not be null");
        Objects.requireNonNull(entrypointFile, "entrypointFile must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(cacheDirectory, "cacheDirectory must not be null");
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }
}
