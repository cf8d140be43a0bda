package com.luacomposer.core.compose;

import com.luacomposer.core.model.ExternalDependency;
import com.luacomposer.core.model.ScopeMode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything the planner lays out.
 *
 * @param header optional header, verbatim
 * @param dependencies fetched external dependencies in declaration order
 * @param namespace sanitized namespace module
 * @param coreModules sanitized core modules in sorted order
 * @param entrypoint sanitized entrypoint module
 * @param footer optional footer, verbatim
 * @param scope scope mode
 * @param generatedAt timestamp written into the banner
 */
public record CompositionInput(
    ComposedModule header,
    List<ExternalDependency> dependencies,
    ComposedModule namespace,
    List<ComposedModule> coreModules,
    ComposedModule entrypoint,
    ComposedModule footer,
    ScopeMode scope,
    Instant generatedAt
) {
    public CompositionInput {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(entrypoint, "entrypoint must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        coreModules = coreModules != null ? List.copyOf(coreModules) : List.of();
    }
}
