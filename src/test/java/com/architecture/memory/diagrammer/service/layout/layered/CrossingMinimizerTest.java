package com.architecture.memory.diagrammer.service.layout.layered;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CrossingMinimizerTest {

    private final CrossingMinimizer minimizer = new CrossingMinimizer();

    @Test
    void untanglesCrossedPair() {
        LayoutGraph graph = new LayoutGraph();
        int a = graph.addNode("A", "A", 120, 60);
        int b = graph.addNode("B", "B", 120, 60);
        int c = graph.addNode("C", "C", 120, 60);
        int d = graph.addNode("D", "D", 120, 60);
        graph.addEdge(a, d, "");
        graph.addEdge(b, c, "");
        graph.removeCycles();
        graph.assignRanks();
        graph.insertVirtualNodes();

        minimizer.minimize(graph, 4);

        assertThat(graph.node(a).getOrder()).isLessThan(graph.node(b).getOrder());
        assertThat(graph.node(d).getOrder()).isLessThan(graph.node(c).getOrder());
    }

    @Test
    void zeroIterationsKeepsArenaOrder() {
        LayoutGraph graph = new LayoutGraph();
        int a = graph.addNode("A", "A", 120, 60);
        int b = graph.addNode("B", "B", 120, 60);
        int c = graph.addNode("C", "C", 120, 60);
        int d = graph.addNode("D", "D", 120, 60);
        graph.addEdge(a, d, "");
        graph.addEdge(b, c, "");
        graph.removeCycles();
        graph.assignRanks();
        graph.insertVirtualNodes();

        minimizer.minimize(graph, 0);

        assertThat(graph.node(c).getOrder()).isZero();
        assertThat(graph.node(d).getOrder()).isEqualTo(1);
    }
}
