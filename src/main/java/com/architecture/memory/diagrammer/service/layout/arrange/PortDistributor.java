package com.architecture.memory.diagrammer.service.layout.arrange;

import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.service.layout.geometry.Bounds;
import com.architecture.memory.diagrammer.service.layout.geometry.DiagramBoundsResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Picks connector attachment points. Connectors leaving (or entering) the same side of
 * the same shape are spread along that side, ordered by where their far end lies, so
 * they do not stack on the side's midpoint.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortDistributor {

    private static final double BATCH_DOMINANCE = 1.2;
    private static final double SINGLE_DOMINANCE = 1.5;
    private static final double SIDE_INSET = 0.15;

    private final DiagramBoundsResolver boundsResolver;

    /**
     * Ports for a single connector. {@code direction} is "auto", "horizontal" or
     * "vertical"; auto picks horizontal when |dx| exceeds 1.5 |dy|, vertical in the mirrored
     * case, and otherwise whichever delta is larger (vertical on a tie).
     */
    public PortAssignment chooseBestPorts(Bounds source, Bounds target, String direction) {
        double dx = target.centerX() - source.centerX();
        double dy = target.centerY() - source.centerY();

        String mode = direction == null ? "auto" : direction.trim().toLowerCase(Locale.ROOT);
        if ("auto".equals(mode)) {
            if (Math.abs(dx) > Math.abs(dy) * SINGLE_DOMINANCE) {
                mode = "horizontal";
            } else if (Math.abs(dy) > Math.abs(dx) * SINGLE_DOMINANCE) {
                mode = "vertical";
            } else {
                mode = Math.abs(dy) >= Math.abs(dx) ? "vertical" : "horizontal";
            }
        }

        switch (mode) {
            case "horizontal":
                return dx >= 0
                        ? new PortAssignment(PortSide.RIGHT.center(), PortSide.LEFT.center())
                        : new PortAssignment(PortSide.LEFT.center(), PortSide.RIGHT.center());
            case "vertical":
                return dy >= 0
                        ? new PortAssignment(PortSide.BOTTOM.center(), PortSide.TOP.center())
                        : new PortAssignment(PortSide.TOP.center(), PortSide.BOTTOM.center());
            default:
                throw new IllegalArgumentException("Unknown port direction: " + direction);
        }
    }

    /**
     * Ports for a batch of connections, one assignment per connection in input order.
     * Connections with an unknown endpoint fall back to right-to-left sides.
     */
    public List<PortAssignment> distributePortsForBatch(List<Connection> connections, Map<String, Bounds> bounds) {
        if (connections == null || connections.isEmpty()) {
            return new ArrayList<>();
        }

        List<PortSide[]> sides = new ArrayList<>();
        for (Connection connection : connections) {
            Bounds source = bounds.get(connection.sourceId());
            Bounds target = bounds.get(connection.targetId());
            sides.add(source != null && target != null
                    ? determineSides(source, target)
                    : new PortSide[]{PortSide.RIGHT, PortSide.LEFT});
        }

        // Siblings: connections sharing (shape, side), keyed in first-seen order
        Map<String, List<Integer>> exitGroups = new LinkedHashMap<>();
        Map<String, List<Integer>> entryGroups = new LinkedHashMap<>();
        for (int i = 0; i < connections.size(); i++) {
            Connection connection = connections.get(i);
            exitGroups.computeIfAbsent(groupKey(connection.sourceId(), sides.get(i)[0]), k -> new ArrayList<>()).add(i);
            entryGroups.computeIfAbsent(groupKey(connection.targetId(), sides.get(i)[1]), k -> new ArrayList<>()).add(i);
        }

        for (List<Integer> group : exitGroups.values()) {
            PortSide side = sides.get(group.get(0))[0];
            sortByFarEnd(group, connections, bounds, side, false);
        }
        for (List<Integer> group : entryGroups.values()) {
            PortSide side = sides.get(group.get(0))[1];
            sortByFarEnd(group, connections, bounds, side, true);
        }

        List<PortAssignment> assignments = new ArrayList<>();
        for (int i = 0; i < connections.size(); i++) {
            Connection connection = connections.get(i);
            PortSide exitSide = sides.get(i)[0];
            PortSide entrySide = sides.get(i)[1];
            List<Integer> exitSiblings = exitGroups.get(groupKey(connection.sourceId(), exitSide));
            List<Integer> entrySiblings = entryGroups.get(groupKey(connection.targetId(), entrySide));
            assignments.add(new PortAssignment(
                    spread(exitSide, exitSiblings.size(), exitSiblings.indexOf(i)),
                    spread(entrySide, entrySiblings.size(), entrySiblings.indexOf(i))));
        }
        return assignments;
    }

    /**
     * Computes distributed ports for every connector of the diagram and stores them as the
     * connectors' exit/entry fractions.
     *
     * @return number of connectors updated
     */
    public int applyDistributedPorts(Diagram diagram) {
        Map<String, Bounds> bounds = boundsResolver.resolveAll(diagram);
        List<DiagramCell> connectors = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();
        for (DiagramCell connector : diagram.getConnectors()) {
            if (bounds.containsKey(connector.getSource()) && bounds.containsKey(connector.getTarget())) {
                connectors.add(connector);
                connections.add(new Connection(connector.getSource(), connector.getTarget()));
            }
        }

        List<PortAssignment> assignments = distributePortsForBatch(connections, bounds);
        for (int i = 0; i < connectors.size(); i++) {
            DiagramCell connector = connectors.get(i);
            PortAssignment assignment = assignments.get(i);
            connector.setExitX(assignment.exit().x());
            connector.setExitY(assignment.exit().y());
            connector.setEntryX(assignment.entry().x());
            connector.setEntryY(assignment.entry().y());
        }
        log.info("Distributed ports for {} connectors in diagram {}", connectors.size(), diagram.getId());
        return connectors.size();
    }

    /**
     * Exit and entry side. A connection counts as horizontal or vertical when that delta
     * exceeds the other by 1.2x; diagonal connections attach vertically.
     */
    PortSide[] determineSides(Bounds source, Bounds target) {
        double dx = target.centerX() - source.centerX();
        double dy = target.centerY() - source.centerY();

        if (Math.abs(dx) > Math.abs(dy) * BATCH_DOMINANCE) {
            return dx >= 0
                    ? new PortSide[]{PortSide.RIGHT, PortSide.LEFT}
                    : new PortSide[]{PortSide.LEFT, PortSide.RIGHT};
        }
        return dy >= 0
                ? new PortSide[]{PortSide.BOTTOM, PortSide.TOP}
                : new PortSide[]{PortSide.TOP, PortSide.BOTTOM};
    }

    /**
     * Evenly spaced position {@code index} of {@code count} along a side, kept clear of the
     * corners. A lone connector gets the side's midpoint.
     */
    static PortPosition spread(PortSide side, int count, int index) {
        if (count <= 1) {
            return side.center();
        }
        double t = SIDE_INSET + (1.0 - 2 * SIDE_INSET) * index / (count - 1);
        return side.at(t);
    }

    private void sortByFarEnd(List<Integer> group, List<Connection> connections, Map<String, Bounds> bounds,
                              PortSide side, boolean farEndIsSource) {
        if (group.size() < 2) {
            return;
        }
        group.sort(Comparator.comparingDouble(index -> farEndPosition(
                connections.get(index), bounds, side, farEndIsSource)));
    }

    private double farEndPosition(Connection connection, Map<String, Bounds> bounds,
                                  PortSide side, boolean farEndIsSource) {
        Bounds farEnd = bounds.get(farEndIsSource ? connection.sourceId() : connection.targetId());
        if (farEnd == null) {
            return 0.0;
        }
        return side.isHorizontalEdge() ? farEnd.centerX() : farEnd.centerY();
    }

    private String groupKey(String shapeId, PortSide side) {
        return shapeId + "#" + side.name();
    }
}
