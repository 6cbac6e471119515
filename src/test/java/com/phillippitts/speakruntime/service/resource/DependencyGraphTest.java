package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.exception.CircularDependencyException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

    @Test
    void shouldRejectEdgeThatClosesCycleAndLeaveGraphUnchanged() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("C", Set.of());
        graph.add("B", Set.of("C"));
        graph.add("A", Set.of("B"));

        // C -> A would close A -> B -> C -> A
        assertThatThrownBy(() -> graph.add("C", Set.of("A")))
                .isInstanceOf(CircularDependencyException.class)
                .satisfies(e -> {
                    CircularDependencyException ex = (CircularDependencyException) e;
                    assertThat(ex.getResourceId()).isEqualTo("C");
                    assertThat(ex.getViaDependency()).isEqualTo("A");
                });

        assertThat(graph.dependenciesOf("C")).isEmpty();
        assertThat(graph.hasEdge("A", "B")).isTrue();
        assertThat(graph.hasEdge("B", "C")).isTrue();
        assertThat(graph.size()).isEqualTo(3);
    }

    @Test
    void shouldListDependentsInRegistrationOrder() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("core", Set.of());
        graph.add("second", Set.of("core"));
        graph.add("first", Set.of("core"));

        assertThat(graph.dependentsOf("core")).containsExactly("second", "first");
    }

    @Test
    void shouldPruneIncomingEdgesOnRemove() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("A", Set.of());
        graph.add("B", Set.of("A"));

        graph.remove("A");

        assertThat(graph.contains("A")).isFalse();
        assertThat(graph.dependenciesOf("B")).isEmpty();
        assertThat(graph.dependentsOf("A")).isEmpty();
    }

    @Test
    void shouldAllowDiamondShapes() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("D", Set.of());
        graph.add("B", Set.of("D"));
        graph.add("C", Set.of("D"));
        graph.add("A", Set.of("B", "C"));

        assertThat(graph.dependentsOf("D")).containsExactly("B", "C");
        assertThat(graph.dependenciesOf("A")).containsExactly("B", "C");
    }

    @Test
    void uncheckedEdgeShouldBypassCycleDetection() {
        DependencyGraph graph = new DependencyGraph();
        graph.add("A", Set.of());
        graph.add("B", Set.of("A"));

        graph.addEdgeUnchecked("A", "B");

        assertThat(graph.hasEdge("A", "B")).isTrue();
        assertThat(graph.dependentsOf("A")).containsExactly("B");
        assertThat(graph.dependentsOf("B")).containsExactly("A");
    }
}
