package com.luacomposer.core.build;

import com.luacomposer.core.discovery.ProjectLayout;
import com.luacomposer.core.graph.DependencyGraph;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.Module;

import java.util.List;
import java.util.Map;

/**
 * Parsed project with its resolved core-module order, before sanitization.
 *
 * @param layout discovered files
 * @param modules {@code .lua} modules by identity, role files included
 * @param header header module, or {@code null}
 * @param footer footer module, or {@code null}
 * @param graph core-module dependency graph
 * @param order core-module identities in emission order
 * @param warnings warnings raised so far
 */
public record ProjectAnalysis(
    ProjectLayout layout,
    Map<String, Module> modules,
    Module header,
    Module footer,
    DependencyGraph graph,
    List<String> order,
    List<BuildWarning> warnings
) {
    public ProjectAnalysis {
        modules = Map.copyOf(modules);
        order = List.copyOf(order);
        warnings = List.copyOf(warnings);
    }

    public Module module(String identity) {
        Module module = modules.get(identity);
        if (module == null) {
            throw new IllegalArgumentException("Unknown module: " + identity);
        }
        return module;
    }
}
