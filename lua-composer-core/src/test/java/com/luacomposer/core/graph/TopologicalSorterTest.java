package com.luacomposer.core.graph;

import com.luacomposer.core.error.CycleException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TopologicalSorter}.
 */
class TopologicalSorterTest {

    private final TopologicalSorter sorter = new TopologicalSorter();

    @Test
    void sort_dependencies_placesRequiredModulesFirst() {
        DependencyGraph graph = DependencyGraph.builder()
            .addNode("app", "")
            .addNode("util", "")
            .addNode("log", "")
            .addEdge("app", "util")
            .addEdge("util", "log")
            .build();

        assertThat(sorter.sort(graph)).containsExactly("log", "util", "app");
    }

    @Test
    void sort_independentModules_isLexicographic() {
        DependencyGraph graph = DependencyGraph.builder()
            .addNode("c", "")
            .addNode("a", "")
            .addNode("b", "")
            .build();

        assertThat(sorter.sort(graph)).containsExactly("a", "b", "c");
    }

    @Test
    void sort_independentModulesInDirectories_keepsDirectoryTogether() {
        DependencyGraph graph = DependencyGraph.builder()
            .addNode("b.z", "b")
            .addNode("a.y", "a")
            .addNode("a.x", "a")
            .build();

        assertThat(sorter.sort(graph)).containsExactly("a.x", "a.y", "b.z");
    }

    @Test
    void sort_directoryAffinity_prefersLastDirectoryOverSmallerIdentity() {
        DependencyGraph graph = DependencyGraph.builder()
            .addNode("a.one", "a")
            .addNode("a.two", "a")
            .addNode("b.one", "b")
            .addNode("b.two", "b")
            .addEdge("a.two", "b.one")
            .build();

        // a.two becomes eligible after b.one, but b.two shares b.one's directory
        assertThat(sorter.sort(graph)).containsExactly("a.one", "b.one", "b.two", "a.two");
    }

    @Test
    void sort_everyModuleAfterItsRequirements() {
        DependencyGraph graph = DependencyGraph.builder()
            .addNode("m1", "x").addNode("m2", "y").addNode("m3", "x").addNode("m4", "y").addNode("m5", "")
            .addEdge("m1", "m4")
            .addEdge("m3", "m2")
            .addEdge("m4", "m5")
            .addEdge("m2", "m5")
            .build();

        List<String> order = sorter.sort(graph);

        assertThat(order).hasSize(5);
        for (String node : graph.nodes()) {
            for (String required : graph.requiresOf(node)) {
                assertThat(order.indexOf(required)).isLessThan(order.indexOf(node));
            }
        }
    }

    @Test
    void sort_twoModuleCycle_listsBothModules() {
        DependencyGraph graph = DependencyGraph.builder()
            .addNode("A", "")
            .addNode("B", "")
            .addNode("C", "")
            .addEdge("A", "B")
            .addEdge("B", "A")
            .build();

        assertThatThrownBy(() -> sorter.sort(graph))
            .isInstanceOf(CycleException.class)
            .satisfies(e -> assertThat(((CycleException) e).getRemaining()).containsExactly("A", "B"));
    }

    @Test
    void sort_cycleWithDependents_listsEveryUnsortedModule() {
        DependencyGraph graph = DependencyGraph.builder()
            .addNode("a", "").addNode("b", "").addNode("c", "").addNode("d", "")
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("c", "a")
            .addEdge("d", "a")
            .build();

        assertThatThrownBy(() -> sorter.sort(graph))
            .isInstanceOf(CycleException.class)
            .hasMessageContaining("a, b, c, d");
    }

    @Test
    void builder_selfEdge_isACycle() {
        assertThatThrownBy(() -> DependencyGraph.builder().addNode("a", "").addEdge("a", "a"))
            .isInstanceOf(CycleException.class)
            .hasMessageContaining("a");
    }

    @Test
    void sort_emptyGraph_returnsEmptyOrder() {
        assertThat(sorter.sort(DependencyGraph.builder().build())).isEmpty();
    }
}
