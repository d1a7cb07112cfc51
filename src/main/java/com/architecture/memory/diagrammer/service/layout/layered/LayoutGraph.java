package com.architecture.memory.diagrammer.service.layout.layered;

import java.util.*;

/**
 * Arena of layout nodes addressed by dense integer index. Keys map to indices once, in
 * first-appearance order; adjacency is stored as index lists.
 *
 * <p>Lifecycle of one layout run: add nodes and edges, then {@link #removeCycles()},
 * {@link #assignRanks()} and {@link #insertVirtualNodes()}, after which
 * {@link #predecessors(int)} / {@link #successors(int)} describe the expanded, unit-span graph.
 */
public class LayoutGraph {

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    private final List<LayoutNode> nodes = new ArrayList<>();
    private final List<LayoutEdge> edges = new ArrayList<>();
    private final Map<String, Integer> indexByKey = new HashMap<>();

    private final List<List<Integer>> predecessors = new ArrayList<>();
    private final List<List<Integer>> successors = new ArrayList<>();

    private int virtualCount = 0;

    /**
     * Adds a real node, or returns the existing index when the key is already known.
     */
    public int addNode(String key, String label, double width, double height) {
        Integer existing = indexByKey.get(key);
        if (existing != null) {
            return existing;
        }
        int index = nodes.size();
        nodes.add(LayoutNode.builder()
                .index(index)
                .key(key)
                .label(label)
                .width(width)
                .height(height)
                .build());
        indexByKey.put(key, index);
        return index;
    }

    public LayoutEdge addEdge(int source, int target, String label) {
        LayoutEdge edge = LayoutEdge.builder()
                .source(source)
                .target(target)
                .label(label == null ? "" : label)
                .build();
        edges.add(edge);
        return edge;
    }

    public List<LayoutNode> getNodes() {
        return nodes;
    }

    public List<LayoutEdge> getEdges() {
        return edges;
    }

    public LayoutNode node(int index) {
        return nodes.get(index);
    }

    public Optional<LayoutNode> findByKey(String key) {
        Integer index = indexByKey.get(key);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public int size() {
        return nodes.size();
    }

    // ========================= CYCLE REMOVAL =========================

    /**
     * Marks back edges found by an iterative depth-first traversal as reversed. Roots are
     * visited in index order and out-edges in insertion order, so the result is
     * deterministic. Self-loops are left untouched.
     *
     * @return number of edges reversed
     */
    public int removeCycles() {
        List<List<LayoutEdge>> outEdges = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            outEdges.add(new ArrayList<>());
        }
        for (LayoutEdge edge : edges) {
            edge.setReversed(false);
            if (!edge.isSelfLoop()) {
                outEdges.get(edge.getSource()).add(edge);
            }
        }

        int[] color = new int[nodes.size()];
        int reversedCount = 0;

        for (int root = 0; root < nodes.size(); root++) {
            if (color[root] != WHITE) {
                continue;
            }
            // Each frame: node index and the position of the next out-edge to inspect
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[]{root, 0});
            color[root] = GRAY;

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<LayoutEdge> out = outEdges.get(frame[0]);
                if (frame[1] >= out.size()) {
                    color[frame[0]] = BLACK;
                    stack.pop();
                    continue;
                }
                LayoutEdge edge = out.get(frame[1]++);
                int next = edge.getTarget();
                if (color[next] == GRAY) {
                    edge.setReversed(true);
                    reversedCount++;
                } else if (color[next] == WHITE) {
                    color[next] = GRAY;
                    stack.push(new int[]{next, 0});
                }
            }
        }
        return reversedCount;
    }

    // ========================= RANK ASSIGNMENT =========================

    /**
     * Longest-path layering over the effective (cycle-free) edges: sources get rank 0 and
     * every node sits one rank below its deepest effective predecessor. Processed
     * breadth-first in topological order. When no node lacks a predecessor the walk is
     * seeded from node 0; anything left unreached keeps rank 0.
     */
    public void assignRanks() {
        int n = nodes.size();
        List<List<Integer>> effectiveOut = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            effectiveOut.add(new ArrayList<>());
        }
        int[] inDegree = new int[n];
        for (LayoutEdge edge : edges) {
            if (edge.isSelfLoop()) {
                continue;
            }
            effectiveOut.get(edge.effectiveSource()).add(edge.effectiveTarget());
            inDegree[edge.effectiveTarget()]++;
        }

        int[] rank = new int[n];
        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                queue.add(i);
            }
        }
        if (queue.isEmpty() && n > 0) {
            queue.add(0);
            inDegree[0] = 0;
        }

        boolean[] done = new boolean[n];
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (done[current]) {
                continue;
            }
            done[current] = true;
            for (int next : effectiveOut.get(current)) {
                rank[next] = Math.max(rank[next], rank[current] + 1);
                if (--inDegree[next] == 0) {
                    queue.add(next);
                }
            }
        }

        for (int i = 0; i < n; i++) {
            nodes.get(i).setRank(rank[i]);
        }
    }

    // ========================= VIRTUAL NODES =========================

    /**
     * Replaces every effective edge spanning more than one rank with a chain of 1x1 virtual
     * nodes, one per intermediate rank, and rebuilds the unit-span adjacency lists.
     *
     * @return number of virtual nodes created
     */
    public int insertVirtualNodes() {
        List<int[]> segments = new ArrayList<>();
        int created = 0;

        for (LayoutEdge edge : edges) {
            edge.getVirtualChain().clear();
            if (edge.isSelfLoop()) {
                continue;
            }
            int from = edge.effectiveSource();
            int to = edge.effectiveTarget();
            int fromRank = nodes.get(from).getRank();
            int toRank = nodes.get(to).getRank();

            int previous = from;
            for (int r = fromRank + 1; r < toRank; r++) {
                int virtualIndex = addVirtualNode(r);
                edge.getVirtualChain().add(virtualIndex);
                segments.add(new int[]{previous, virtualIndex});
                previous = virtualIndex;
                created++;
            }
            segments.add(new int[]{previous, to});
        }

        predecessors.clear();
        successors.clear();
        for (int i = 0; i < nodes.size(); i++) {
            predecessors.add(new ArrayList<>());
            successors.add(new ArrayList<>());
        }
        for (int[] segment : segments) {
            successors.get(segment[0]).add(segment[1]);
            predecessors.get(segment[1]).add(segment[0]);
        }
        return created;
    }

    private int addVirtualNode(int rank) {
        int index = nodes.size();
        String key = "__virtual_" + virtualCount++;
        nodes.add(LayoutNode.builder()
                .index(index)
                .key(key)
                .label("")
                .width(1)
                .height(1)
                .rank(rank)
                .virtual(true)
                .build());
        indexByKey.put(key, index);
        return index;
    }

    public List<Integer> predecessors(int index) {
        return index < predecessors.size() ? predecessors.get(index) : Collections.emptyList();
    }

    public List<Integer> successors(int index) {
        return index < successors.size() ? successors.get(index) : Collections.emptyList();
    }

    // ========================= RANK QUERIES =========================

    public int maxRank() {
        int max = 0;
        for (LayoutNode node : nodes) {
            max = Math.max(max, node.getRank());
        }
        return max;
    }

    /**
     * Nodes grouped by rank, each group in arena order. Ranks without nodes yield empty lists.
     */
    public List<List<LayoutNode>> ranks() {
        List<List<LayoutNode>> byRank = new ArrayList<>();
        for (int r = 0; r <= maxRank(); r++) {
            byRank.add(new ArrayList<>());
        }
        for (LayoutNode node : nodes) {
            byRank.get(node.getRank()).add(node);
        }
        return byRank;
    }

    /**
     * Nodes grouped by rank, each group sorted by its current order.
     */
    public List<List<LayoutNode>> orderedRanks() {
        List<List<LayoutNode>> byRank = ranks();
        for (List<LayoutNode> rankNodes : byRank) {
            rankNodes.sort(Comparator.comparingDouble(LayoutNode::getOrder));
        }
        return byRank;
    }

    public List<LayoutNode> realNodes() {
        List<LayoutNode> real = new ArrayList<>();
        for (LayoutNode node : nodes) {
            if (!node.isVirtual()) {
                real.add(node);
            }
        }
        return real;
    }
}
