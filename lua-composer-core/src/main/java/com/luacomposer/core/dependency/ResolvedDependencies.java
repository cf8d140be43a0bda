package com.luacomposer.core.dependency;

import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.ExternalDependency;

import java.util.List;

/**
 * Fetched dependencies in declaration order, with the warnings collected while fetching.
 */
public record ResolvedDependencies(List<ExternalDependency> dependencies, List<BuildWarning> warnings) {

    public ResolvedDependencies {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ResolvedDependencies empty() {
        return new ResolvedDependencies(List.of(), List.of());
    }

    public List<String> names() {
        return dependencies.stream().map(ExternalDependency::name).toList();
    }
}
