package com.luacomposer.core.graph;

import com.luacomposer.core.error.CycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Orders a {@link DependencyGraph} so every module follows the modules it requires.
 *
 * <p>Kahn's algorithm with a directory-affinity tie-break. Among the modules
 * whose requirements are all emitted, the lexicographically smallest one in the
 * same directory as the last emitted module wins. If there is none, or nothing
 * has been emitted yet, the lexicographically smallest eligible module wins.
 * The result is fully deterministic for a given graph.
 */
public class TopologicalSorter {

    private static final Logger log = LoggerFactory.getLogger(TopologicalSorter.class);

    /**
     * Sorts the graph.
     *
     * @param graph graph to order
     * @return identities in emission order
     * @throws CycleException listing every module left unsorted if the graph has a cycle
     */
    public List<String> sort(DependencyGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        NavigableSet<String> eligible = new TreeSet<>();
        Map<String, NavigableSet<String>> eligibleByDirectory = new HashMap<>();

        for (String node : graph.nodes()) {
            int degree = graph.requiresOf(node).size();
            inDegree.put(node, degree);
            if (degree == 0) {
                admit(node, graph, eligible, eligibleByDirectory);
            }
        }

        List<String> order = new ArrayList<>(graph.size());
        String lastDirectory = null;
        while (!eligible.isEmpty()) {
            String next = pick(lastDirectory, eligible, eligibleByDirectory);
            eligible.remove(next);
            eligibleByDirectory.get(graph.directoryKey(next)).remove(next);
            order.add(next);
            lastDirectory = graph.directoryKey(next);
            log.debug("Emitted module {} (directory '{}')", next, lastDirectory);

            for (String dependent : graph.dependentsOf(next)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    admit(dependent, graph, eligible, eligibleByDirectory);
                }
            }
        }

        if (order.size() != graph.size()) {
            List<String> unsorted = new ArrayList<>(new TreeSet<>(graph.nodes()));
            unsorted.removeAll(order);
            throw new CycleException(unsorted);
        }
        return List.copyOf(order);
    }

    private static void admit(String node, DependencyGraph graph, NavigableSet<String> eligible,
                              Map<String, NavigableSet<String>> eligibleByDirectory) {
        eligible.add(node);
        eligibleByDirectory.computeIfAbsent(graph.directoryKey(node), ignored -> new TreeSet<>()).add(node);
    }

    private static String pick(String lastDirectory, NavigableSet<String> eligible,
                               Map<String, NavigableSet<String>> eligibleByDirectory) {
        if (lastDirectory != null) {
            NavigableSet<String> sameDirectory = eligibleByDirectory.get(lastDirectory);
            if (sameDirectory != null && !sameDirectory.isEmpty()) {
                return sameDirectory.first();
            }
        }
        return eligible.first();
    }
}
