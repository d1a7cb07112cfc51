package com.architecture.memory.diagrammer.service.layout.layered;

import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.model.diagram.Point;
import com.architecture.memory.diagrammer.service.layout.geometry.GridSnapper;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapResolution;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapResolver;
import com.architecture.memory.diagrammer.service.layout.routing.OrthogonalEdgeRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Sugiyama-style layered layout.
 *
 * Pipeline:
 * 1. Cycle removal (back edges flagged as reversed)
 * 2. Longest-path rank assignment
 * 3. Virtual node chains for edges spanning several ranks
 * 4. Barycenter crossing minimization
 * 5. Rank-size equalization and coordinate assignment
 * 6. Overlap removal over the real nodes
 * 7. Shapes, connectors and (optionally) routed waypoints written to the diagram
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LayeredLayoutEngine {

    public static final String DEFAULT_EDGE_STYLE =
            "edgeStyle=orthogonalEdgeStyle;rounded=1;orthogonalLoop=1;jettySize=auto;html=1;endArrow=classic;";

    private final CrossingMinimizer crossingMinimizer;
    private final CoordinateAssigner coordinateAssigner;
    private final NodeSizeEstimator nodeSizeEstimator;
    private final OverlapResolver overlapResolver;
    private final OrthogonalEdgeRouter edgeRouter;

    /**
     * Creates one shape per distinct label and one connector per edge, positioned by the
     * layered algorithm.
     *
     * @param nodeStyles optional per-label style overrides
     * @param edgeStyle  connector style, {@link #DEFAULT_EDGE_STYLE} when null
     * @return label to created cell id, in first-appearance order
     */
    public Map<String, String> layout(Diagram diagram, List<EdgeDefinition> edges, Map<String, String> nodeStyles,
                                      String edgeStyle, LayoutEngineConfig config, LayoutDirection direction) {
        if (edges == null || edges.isEmpty()) {
            return new LinkedHashMap<>();
        }
        log.info("Layered layout of {} edges, direction {}", edges.size(), direction);

        LayoutGraph graph = new LayoutGraph();
        for (EdgeDefinition edge : edges) {
            int source = addLabelNode(graph, edge.source(), config);
            int target = addLabelNode(graph, edge.target(), config);
            graph.addEdge(source, target, edge.label());
        }

        arrange(graph, config, direction);

        Map<String, String> styles = nodeStyles != null ? nodeStyles : Collections.emptyMap();
        Map<String, String> labelToId = new LinkedHashMap<>();
        for (LayoutNode node : graph.realNodes()) {
            String cellId = diagram.addVertex(node.getLabel(),
                    GridSnapper.snap(node.getX(), config.getGridSize()),
                    GridSnapper.snap(node.getY(), config.getGridSize()),
                    node.getWidth(), node.getHeight(),
                    styles.getOrDefault(node.getKey(), Diagram.DEFAULT_VERTEX_STYLE));
            labelToId.put(node.getKey(), cellId);
        }

        String connectorStyle = edgeStyle != null ? edgeStyle : DEFAULT_EDGE_STYLE;
        for (LayoutEdge edge : graph.getEdges()) {
            String sourceId = labelToId.get(graph.node(edge.getSource()).getKey());
            String targetId = labelToId.get(graph.node(edge.getTarget()).getKey());
            edge.setCellId(diagram.addEdge(sourceId, targetId, edge.getLabel(), connectorStyle));
        }

        if (config.isRouteEdges()) {
            edgeRouter.routeAll(diagram, config.getEdgeMargin(), config.getMaxRouteExpansions());
        }

        log.info("Layered layout placed {} shapes and {} connectors", labelToId.size(), graph.getEdges().size());
        return labelToId;
    }

    /**
     * Repositions the top-level shapes of an existing diagram from its own connectors.
     * Shapes keep their sizes except for rank equalization. Without any usable connector
     * the shapes are put on a near-square grid instead.
     *
     * @return cell id to new top-left position
     */
    public Map<String, Point> relayout(Diagram diagram, LayoutDirection direction, LayoutEngineConfig config) {
        Map<String, DiagramCell> vertices = new LinkedHashMap<>();
        for (DiagramCell cell : diagram.getVertices()) {
            if (Diagram.isTopLevelParent(cell.getParent())) {
                vertices.put(cell.getId(), cell);
            }
        }
        if (vertices.isEmpty()) {
            return new LinkedHashMap<>();
        }

        LayoutGraph graph = new LayoutGraph();
        for (DiagramCell cell : vertices.values()) {
            CellGeometry g = cell.getGeometry();
            graph.addNode(cell.getId(), cell.getValue(), g.getWidth(), g.getHeight());
        }
        int usableEdges = 0;
        for (DiagramCell connector : diagram.getConnectors()) {
            Optional<LayoutNode> source = graph.findByKey(connector.getSource());
            Optional<LayoutNode> target = graph.findByKey(connector.getTarget());
            if (source.isPresent() && target.isPresent()) {
                graph.addEdge(source.get().getIndex(), target.get().getIndex(), connector.getValue());
                usableEdges++;
            }
        }

        Map<String, Point> moved;
        if (usableEdges == 0) {
            log.info("Relayout of diagram {}: no usable connectors, arranging {} shapes in a grid",
                    diagram.getId(), vertices.size());
            moved = relayoutGrid(new ArrayList<>(vertices.values()), config);
        } else {
            log.info("Relayout of diagram {}: {} shapes, {} connectors, direction {}",
                    diagram.getId(), vertices.size(), usableEdges, direction);
            arrange(graph, config, direction);

            moved = new LinkedHashMap<>();
            for (LayoutNode node : graph.realNodes()) {
                CellGeometry g = vertices.get(node.getKey()).getGeometry();
                double x = GridSnapper.snap(node.getX(), config.getGridSize());
                double y = GridSnapper.snap(node.getY(), config.getGridSize());
                g.setX(x);
                g.setY(y);
                g.setWidth(node.getWidth());
                g.setHeight(node.getHeight());
                moved.put(node.getKey(), new Point(x, y));
            }
        }

        if (config.isRouteEdges()) {
            edgeRouter.routeAll(diagram, config.getEdgeMargin(), config.getMaxRouteExpansions());
        }
        return moved;
    }

    /**
     * Runs cycle removal through overlap removal on a populated graph, leaving final
     * coordinates on its nodes.
     */
    public OverlapResolution arrange(LayoutGraph graph, LayoutEngineConfig config, LayoutDirection direction) {
        int reversed = graph.removeCycles();
        graph.assignRanks();
        int virtualNodes = graph.insertVirtualNodes();
        log.debug("Layout graph: {} nodes, {} back edges reversed, {} virtual nodes, {} ranks",
                graph.size(), reversed, virtualNodes, graph.maxRank() + 1);

        crossingMinimizer.minimize(graph, config.getBarycenterIterations());
        coordinateAssigner.equalizeRankSizes(graph, direction);
        coordinateAssigner.assign(graph, config, direction);

        return overlapResolver.resolve(graph.realNodes(), config.getOverlapPadding(),
                config.getMaxOverlapIterations(), config.getGridSize());
    }

    private int addLabelNode(LayoutGraph graph, String label, LayoutEngineConfig config) {
        Optional<LayoutNode> existing = graph.findByKey(label);
        if (existing.isPresent()) {
            return existing.get().getIndex();
        }
        NodeSizeEstimator.NodeSize size = nodeSizeEstimator.estimate(label,
                config.getDefaultWidth(), config.getDefaultHeight());
        return graph.addNode(label, label,
                GridSnapper.snapUp(size.width(), config.getGridSize()),
                GridSnapper.snapUp(size.height(), config.getGridSize()));
    }

    private Map<String, Point> relayoutGrid(List<DiagramCell> cells, LayoutEngineConfig config) {
        int columns = Math.max(1, (int) Math.sqrt(cells.size()));
        Map<String, Point> moved = new LinkedHashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            CellGeometry g = cells.get(i).getGeometry();
            int col = i % columns;
            int row = i / columns;
            double x = GridSnapper.snap(config.getStartX() + col * (g.getWidth() + config.getNodeSpacing()),
                    config.getGridSize());
            double y = GridSnapper.snap(config.getStartY() + row * (g.getHeight() + config.getRankSpacing()),
                    config.getGridSize());
            g.setX(x);
            g.setY(y);
            moved.put(cells.get(i).getId(), new Point(x, y));
        }
        return moved;
    }
}
