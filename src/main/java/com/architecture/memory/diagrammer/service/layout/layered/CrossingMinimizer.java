package com.architecture.memory.diagrammer.service.layout.layered;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Barycenter crossing reduction over a rank-assigned, virtual-expanded {@link LayoutGraph}.
 * Runs a fixed number of forward and backward sweeps rather than iterating to a fixed point.
 */
@Component
@Slf4j
public class CrossingMinimizer {

    /**
     * Orders every rank. Initial order is each node's position within its rank in arena
     * order; each iteration is one forward sweep (by predecessors) and one backward sweep
     * (by successors).
     */
    public void minimize(LayoutGraph graph, int iterations) {
        List<List<LayoutNode>> ranks = graph.ranks();
        for (List<LayoutNode> rankNodes : ranks) {
            for (int i = 0; i < rankNodes.size(); i++) {
                rankNodes.get(i).setOrder(i);
            }
        }

        int maxRank = ranks.size() - 1;
        for (int iteration = 0; iteration < iterations; iteration++) {
            for (int r = 1; r <= maxRank; r++) {
                reorder(graph, ranks.get(r), true);
            }
            for (int r = maxRank - 1; r >= 0; r--) {
                reorder(graph, ranks.get(r), false);
            }
        }
        log.debug("Crossing minimization finished after {} sweeps over {} ranks", iterations, ranks.size());
    }

    private void reorder(LayoutGraph graph, List<LayoutNode> rankNodes, boolean usePredecessors) {
        if (rankNodes.isEmpty()) {
            return;
        }
        Map<Integer, Double> barycenters = new HashMap<>();
        for (LayoutNode node : rankNodes) {
            List<Integer> neighbors = usePredecessors
                    ? graph.predecessors(node.getIndex())
                    : graph.successors(node.getIndex());
            barycenters.put(node.getIndex(), barycenter(graph, neighbors, node.getOrder()));
        }

        // List.sort is stable, so equal barycenters keep their relative order
        rankNodes.sort(Comparator.comparingDouble(n -> barycenters.get(n.getIndex())));
        for (int i = 0; i < rankNodes.size(); i++) {
            rankNodes.get(i).setOrder(i);
        }
    }

    private double barycenter(LayoutGraph graph, List<Integer> neighbors, double fallback) {
        if (neighbors.isEmpty()) {
            return fallback;
        }
        double sum = 0;
        for (int neighbor : neighbors) {
            sum += graph.node(neighbor).getOrder();
        }
        return sum / neighbors.size();
    }
}
