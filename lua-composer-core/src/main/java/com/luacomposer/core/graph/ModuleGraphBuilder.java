package com.luacomposer.core.graph;

import com.luacomposer.core.error.UnresolvedDependencyException;
import com.luacomposer.core.model.Module;
import com.luacomposer.core.model.ModuleRole;
import com.luacomposer.core.model.RequireReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the dependency graph of the core modules and checks every literal
 * require against where its target ends up in the composed script.
 *
 * <p>The output is laid out as header, external dependencies, namespace, core
 * modules, entrypoint, footer. Therefore:
 * <ul>
 *   <li>requires on the namespace, a Lua header or an external dependency are
 *       satisfied by placement and add no edge;</li>
 *   <li>a require between core modules becomes an edge;</li>
 *   <li>a core module or the namespace requiring the entrypoint or a Lua footer
 *       is unresolvable, as is the namespace requiring a core module;</li>
 *   <li>the entrypoint may require any known identity;</li>
 *   <li>any other target is unknown.</li>
 * </ul>
 * Header and footer requires are not checked; those files are copied verbatim.
 */
public class ModuleGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModuleGraphBuilder.class);

    /**
     * Builds the core-module graph.
     *
     * @param modules every discovered module, all roles
     * @param externalNames names of the declared external dependencies
     * @return graph whose nodes are the core modules
     * @throws UnresolvedDependencyException if a require cannot be satisfied
     * @throws com.luacomposer.core.error.CycleException if a core module requires itself
     */
    public DependencyGraph build(Collection<Module> modules, Collection<String> externalNames) {
        Map<String, Module> core = modules.stream()
            .filter(module -> module.role() == ModuleRole.CORE)
            .collect(Collectors.toMap(Module::identity, Function.identity()));

        Set<String> placedBefore = new HashSet<>(externalNames);
        Set<String> placedAfter = new HashSet<>();
        for (Module module : modules) {
            switch (module.role()) {
                case NAMESPACE -> placedBefore.add(module.identity());
                case HEADER -> {
                    if (module.hasLuaExtension()) {
                        placedBefore.add(module.identity());
                    }
                }
                case ENTRYPOINT -> placedAfter.add(module.identity());
                case FOOTER -> {
                    if (module.hasLuaExtension()) {
                        placedAfter.add(module.identity());
                    }
                }
                case CORE -> {
                    // graph nodes
                }
            }
        }

        DependencyGraph.Builder graph = DependencyGraph.builder();
        modules.stream()
            .filter(module -> module.role() == ModuleRole.CORE)
            .forEach(module -> graph.addNode(module.identity(), module.directoryKey()));

        int edges = 0;
        for (Module module : modules) {
            for (RequireReference require : module.requires()) {
                String target = require.identity();
                switch (module.role()) {
                    case CORE -> {
                        if (core.containsKey(target)) {
                            graph.addEdge(module.identity(), target);
                            edges++;
                        } else if (!placedBefore.contains(target)) {
                            throw unresolved(module, require, placedAfter.contains(target)
                                ? "it is placed after the core modules"
                                : "no such module or dependency");
                        }
                    }
                    case NAMESPACE -> {
                        if (!placedBefore.contains(target)) {
                            throw unresolved(module, require,
                                core.containsKey(target) || placedAfter.contains(target)
                                    ? "it is placed after the namespace"
                                    : "no such module or dependency");
                        }
                    }
                    case ENTRYPOINT -> {
                        if (!placedBefore.contains(target) && !core.containsKey(target)
                            && !placedAfter.contains(target)) {
                            throw unresolved(module, require, "no such module or dependency");
                        }
                    }
                    case HEADER, FOOTER -> {
                        // copied verbatim
                    }
                }
            }
        }

        log.debug("Built dependency graph: {} core modules, {} edges", core.size(), edges);
        return graph.build();
    }

    private static UnresolvedDependencyException unresolved(Module module, RequireReference require, String reason) {
        return new UnresolvedDependencyException(module.relativePath(), require.identity(),
            require.line(), require.column(), reason);
    }
}
