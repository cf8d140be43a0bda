package com.luacomposer.core.graph;

import com.luacomposer.core.error.CycleException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed "requires" graph over module identities.
 *
 * <p>An edge {@code a -> b} means module {@code a} requires {@code b}, so
 * {@code b} must be emitted first. Every edge target must be a node of the
 * graph. Instances are immutable; use {@link #builder()}.
 */
public final class DependencyGraph {

    private final Map<String, String> directoryKeys;
    private final Map<String, Set<String>> requires;
    private final Map<String, Set<String>> dependents;

    private DependencyGraph(Map<String, String> directoryKeys,
                            Map<String, Set<String>> requires,
                            Map<String, Set<String>> dependents) {
        this.directoryKeys = directoryKeys;
        this.requires = requires;
        this.dependents = dependents;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> nodes() {
        return directoryKeys.keySet();
    }

    public boolean contains(String identity) {
        return directoryKeys.containsKey(identity);
    }

    public String directoryKey(String identity) {
        return directoryKeys.get(identity);
    }

    /**
     * Returns what a module requires.
     *
     * @param identity module identity
     * @return required identities, sorted
     */
    public Set<String> requiresOf(String identity) {
        return requires.getOrDefault(identity, Set.of());
    }

    /**
     * Returns the modules that require a module.
     *
     * @param identity module identity
     * @return dependent identities, sorted
     */
    public Set<String> dependentsOf(String identity) {
        return dependents.getOrDefault(identity, Set.of());
    }

    public int size() {
        return directoryKeys.size();
    }

    /**
     * Collects nodes and edges. Edges may be added before their target node;
     * targets are checked in {@link #build()}.
     */
    public static final class Builder {

        private final Map<String, String> directoryKeys = new LinkedHashMap<>();
        private final Map<String, Set<String>> requires = new TreeMap<>();

        private Builder() {
        }

        public Builder addNode(String identity, String directoryKey) {
            Objects.requireNonNull(identity, "identity must not be null");
            if (directoryKeys.putIfAbsent(identity, directoryKey != null ? directoryKey : "") != null) {
                throw new IllegalArgumentException("Duplicate module identity: " + identity);
            }
            return this;
        }

        /**
         * Adds a "requires" edge.
         *
         * @param from requiring module
         * @param to required module
         * @return this builder
         * @throws CycleException if {@code from} requires itself
         */
        public Builder addEdge(String from, String to) {
            if (from.equals(to)) {
                throw new CycleException(List.of(from));
            }
            requires.computeIfAbsent(from, ignored -> new TreeSet<>()).add(to);
            return this;
        }

        public DependencyGraph build() {
            Map<String, Set<String>> dependents = new TreeMap<>();
            Map<String, Set<String>> frozenRequires = new TreeMap<>();
            requires.forEach((from, targets) -> {
                if (!directoryKeys.containsKey(from)) {
                    throw new IllegalStateException("Edge from unknown module: " + from);
                }
                for (String to : targets) {
                    if (!directoryKeys.containsKey(to)) {
                        throw new IllegalStateException("Edge to unknown module: " + from + " -> " + to);
                    }
                    dependents.computeIfAbsent(to, ignored -> new TreeSet<>()).add(from);
                }
                frozenRequires.put(from, Collections.unmodifiableSet(new TreeSet<>(targets)));
            });
            dependents.replaceAll((ignored, set) -> Collections.unmodifiableSet(set));
            return new DependencyGraph(
                Collections.unmodifiableMap(new LinkedHashMap<>(directoryKeys)),
                Collections.unmodifiableMap(frozenRequires),
                Collections.unmodifiableMap(dependents)
            );
        }
    }
}
