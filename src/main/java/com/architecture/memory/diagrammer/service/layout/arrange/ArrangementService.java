package com.architecture.memory.diagrammer.service.layout.arrange;

import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.service.layout.geometry.GridSnapper;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Simple placements that add new shapes to a diagram without running the full layered
 * engine: row, column, grid and breadth-first tree.
 */
@Service
@Slf4j
public class ArrangementService {

    public static final String DEFAULT_TREE_EDGE_STYLE = "edgeStyle=orthogonalEdgeStyle;rounded=0;html=1;endArrow=classic;";

    private static final double MIN_GAP = 10;

    public List<String> row(Diagram diagram, List<String> labels, String style, ArrangementConfig config, Double y) {
        List<String> ids = new ArrayList<>();
        double rowY = GridSnapper.snap(y != null ? y : config.getStartY(), config.getGridSize());
        for (int i = 0; i < labels.size(); i++) {
            double x = GridSnapper.snap(config.getStartX() + i * (config.getDefaultWidth() + config.getHorizontalSpacing()),
                    config.getGridSize());
            ids.add(diagram.addVertex(labels.get(i), x, rowY, config.getDefaultWidth(), config.getDefaultHeight(), style));
        }
        log.info("Placed {} shapes in a row", ids.size());
        return ids;
    }

    public List<String> column(Diagram diagram, List<String> labels, String style, ArrangementConfig config, Double x) {
        List<String> ids = new ArrayList<>();
        double columnX = GridSnapper.snap(x != null ? x : config.getStartX(), config.getGridSize());
        for (int i = 0; i < labels.size(); i++) {
            double y = GridSnapper.snap(config.getStartY() + i * (config.getDefaultHeight() + config.getVerticalSpacing()),
                    config.getGridSize());
            ids.add(diagram.addVertex(labels.get(i), columnX, y, config.getDefaultWidth(), config.getDefaultHeight(), style));
        }
        log.info("Placed {} shapes in a column", ids.size());
        return ids;
    }

    public List<String> grid(Diagram diagram, List<String> labels, int columns, String style, ArrangementConfig config) {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be at least 1, got " + columns);
        }
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            int col = i % columns;
            int row = i / columns;
            double x = GridSnapper.snap(config.getStartX() + col * (config.getDefaultWidth() + config.getHorizontalSpacing()),
                    config.getGridSize());
            double y = GridSnapper.snap(config.getStartY() + row * (config.getDefaultHeight() + config.getVerticalSpacing()),
                    config.getGridSize());
            ids.add(diagram.addVertex(labels.get(i), x, y, config.getDefaultWidth(), config.getDefaultHeight(), style));
        }
        log.info("Placed {} shapes in a {}-column grid", ids.size(), columns);
        return ids;
    }

    /**
     * Lays out the part of {@code adjacency} reachable from {@code root}. Levels come from a
     * breadth-first walk; each level is ordered by one forward (parents) and one backward
     * (children) barycenter sweep, then centered against the widest level.
     *
     * @return label to created cell id
     */
    public Map<String, String> tree(Diagram diagram, Map<String, List<String>> adjacency, String root,
                                    String style, String edgeStyle, ArrangementConfig config,
                                    LayoutDirection direction) {
        Map<String, Integer> levels = new LinkedHashMap<>();
        levels.put(root, 0);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            for (String child : adjacency.getOrDefault(node, Collections.emptyList())) {
                if (!levels.containsKey(child)) {
                    levels.put(child, levels.get(node) + 1);
                    queue.add(child);
                }
            }
        }

        int maxLevel = Collections.max(levels.values());
        List<List<String>> byLevel = new ArrayList<>();
        for (int l = 0; l <= maxLevel; l++) {
            byLevel.add(new ArrayList<>());
        }
        levels.forEach((label, level) -> byLevel.get(level).add(label));

        Map<String, List<String>> parentsOf = new HashMap<>();
        adjacency.forEach((parent, children) -> {
            for (String child : children) {
                parentsOf.computeIfAbsent(child, k -> new ArrayList<>()).add(parent);
            }
        });

        Map<String, Double> position = new HashMap<>();
        List<String> firstLevel = byLevel.get(0);
        for (int i = 0; i < firstLevel.size(); i++) {
            position.put(firstLevel.get(i), (double) i);
        }

        // Forward sweep: parents placed so far
        for (int l = 1; l <= maxLevel; l++) {
            List<String> nodes = byLevel.get(l);
            Map<String, Double> barycenters = new HashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                String node = nodes.get(i);
                barycenters.put(node, mean(parentsOf.getOrDefault(node, Collections.emptyList()), position, i));
            }
            sortAndNumber(nodes, barycenters, position);
        }

        // Backward sweep: children
        for (int l = maxLevel - 1; l >= 0; l--) {
            List<String> nodes = byLevel.get(l);
            Map<String, Double> barycenters = new HashMap<>();
            for (String node : nodes) {
                barycenters.put(node, mean(adjacency.getOrDefault(node, Collections.emptyList()),
                        position, position.getOrDefault(node, 0.0)));
            }
            sortAndNumber(nodes, barycenters, position);
        }

        int widestCount = byLevel.stream().mapToInt(List::size).max().orElse(1);
        double width = config.getDefaultWidth();
        double height = config.getDefaultHeight();
        boolean vertical = direction.isVertical();
        double crossStep = vertical ? width + config.getHorizontalSpacing() : height + config.getVerticalSpacing();
        double levelStep = vertical ? height + config.getVerticalSpacing() : width + config.getHorizontalSpacing();
        double crossItem = vertical ? width : height;
        double crossGap = vertical ? config.getHorizontalSpacing() : config.getVerticalSpacing();
        double widestSpan = widestCount * crossItem + (widestCount - 1) * crossGap;

        Map<String, String> labelToId = new LinkedHashMap<>();
        for (int l = 0; l <= maxLevel; l++) {
            List<String> nodes = byLevel.get(l);
            double span = nodes.size() * crossItem + (nodes.size() - 1) * crossGap;
            double offset = (widestSpan - span) / 2;
            int levelSlot = direction.isReversed() ? maxLevel - l : l;

            for (int i = 0; i < nodes.size(); i++) {
                double x;
                double y;
                if (vertical) {
                    x = config.getStartX() + offset + i * crossStep;
                    y = config.getStartY() + levelSlot * levelStep;
                } else {
                    x = config.getStartX() + levelSlot * levelStep;
                    y = config.getStartY() + offset + i * crossStep;
                }
                x = GridSnapper.snap(x, config.getGridSize());
                y = GridSnapper.snap(y, config.getGridSize());
                labelToId.put(nodes.get(i), diagram.addVertex(nodes.get(i), x, y, width, height, style));
            }
        }

        String connectorStyle = edgeStyle != null ? edgeStyle : DEFAULT_TREE_EDGE_STYLE;
        adjacency.forEach((parent, children) -> {
            for (String child : children) {
                if (labelToId.containsKey(parent) && labelToId.containsKey(child)) {
                    diagram.addEdge(labelToId.get(parent), labelToId.get(child), "", connectorStyle);
                }
            }
        });

        log.info("Placed tree rooted at '{}': {} shapes over {} levels", root, labelToId.size(), maxLevel + 1);
        return labelToId;
    }

    /**
     * Connects consecutive ids; {@code labels.get(i)} labels the i-th connector when present.
     *
     * @return created connector ids
     */
    public List<String> connectChain(Diagram diagram, List<String> ids, String style, List<String> labels) {
        List<String> edgeIds = new ArrayList<>();
        for (int i = 0; i + 1 < ids.size(); i++) {
            String label = labels != null && i < labels.size() ? labels.get(i) : "";
            edgeIds.add(diagram.addEdge(ids.get(i), ids.get(i + 1), label, style));
        }
        return edgeIds;
    }

    /**
     * Start positions spreading items of the given sizes evenly over {@code start..end},
     * never closer than 10px. A single item stays at {@code start}.
     */
    public List<Double> distributeEvenly(List<Double> sizes, double start, double end) {
        List<Double> positions = new ArrayList<>();
        if (sizes.isEmpty()) {
            return positions;
        }
        if (sizes.size() == 1) {
            positions.add(start);
            return positions;
        }
        double total = sizes.stream().mapToDouble(Double::doubleValue).sum();
        double gap = Math.max(((end - start) - total) / (sizes.size() - 1), MIN_GAP);

        double current = start;
        for (double size : sizes) {
            positions.add(current);
            current += size + gap;
        }
        return positions;
    }

    private double mean(List<String> neighbors, Map<String, Double> position, double fallback) {
        double sum = 0;
        int count = 0;
        for (String neighbor : neighbors) {
            Double p = position.get(neighbor);
            if (p != null) {
                sum += p;
                count++;
            }
        }
        return count == 0 ? fallback : sum / count;
    }

    private void sortAndNumber(List<String> nodes, Map<String, Double> barycenters, Map<String, Double> position) {
        nodes.sort(Comparator.comparingDouble(barycenters::get));
        for (int i = 0; i < nodes.size(); i++) {
            position.put(nodes.get(i), (double) i);
        }
    }
}
