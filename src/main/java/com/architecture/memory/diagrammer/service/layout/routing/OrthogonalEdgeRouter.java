package com.architecture.memory.diagrammer.service.layout.routing;

import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.model.diagram.Point;
import com.architecture.memory.diagrammer.service.layout.geometry.Bounds;
import com.architecture.memory.diagrammer.service.layout.geometry.DiagramBoundsResolver;
import com.architecture.memory.diagrammer.service.layout.geometry.GridSnapper;
import com.architecture.memory.diagrammer.service.layout.geometry.SegmentGeometry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Obstacle-aware orthogonal connector router.
 *
 * Searches a sparse visibility grid, built from the obstacle edges pushed out by the
 * clearance margin, with A* (Manhattan heuristic plus a bend penalty). Every returned
 * segment keeps at least {@code margin} away from every obstacle, up to grid snapping of
 * the source and target centers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrthogonalEdgeRouter {

    public static final double BEND_PENALTY = 5;
    public static final int DEFAULT_MAX_EXPANSIONS = 20000;

    private static final int[][] MOVES = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};

    private final DiagramBoundsResolver boundsResolver;

    // ========================= DIAGRAM ROUTING =========================

    public int routeAll(Diagram diagram, double margin) {
        return routeAll(diagram, margin, DEFAULT_MAX_EXPANSIONS);
    }

    /**
     * Reroutes every connector of the diagram. A connector's obstacles are all shapes except
     * its own endpoints and the containers enclosing them. Connectors whose endpoints have
     * no bounds are skipped.
     *
     * @return number of connectors routed
     */
    public int routeAll(Diagram diagram, double margin, int maxExpansions) {
        Map<String, Bounds> bounds = boundsResolver.resolveAll(diagram);
        if (bounds.isEmpty()) {
            return 0;
        }

        int routed = 0;
        for (DiagramCell connector : diagram.getConnectors()) {
            Bounds source = bounds.get(connector.getSource());
            Bounds target = bounds.get(connector.getTarget());
            if (source == null || target == null) {
                log.warn("Skipping connector {}: no bounds for endpoint {} or {}",
                        connector.getId(), connector.getSource(), connector.getTarget());
                continue;
            }

            Set<String> excluded = new HashSet<>();
            excluded.add(connector.getSource());
            excluded.add(connector.getTarget());
            excluded.addAll(boundsResolver.ancestorsOf(diagram, connector.getSource()));
            excluded.addAll(boundsResolver.ancestorsOf(diagram, connector.getTarget()));

            List<Bounds> obstacles = new ArrayList<>();
            for (Map.Entry<String, Bounds> entry : bounds.entrySet()) {
                if (!excluded.contains(entry.getKey())) {
                    obstacles.add(entry.getValue());
                }
            }

            List<Point> waypoints = route(source, target, obstacles, margin, diagram.getGridSize(), maxExpansions);
            if (connector.getGeometry() == null) {
                connector.setGeometry(CellGeometry.builder().relative(true).build());
            }
            connector.getGeometry().setPoints(waypoints);
            routed++;
        }

        log.info("Routed {} connectors in diagram {}", routed, diagram.getId());
        return routed;
    }

    // ========================= SINGLE ROUTE =========================

    public List<Point> route(Bounds source, Bounds target, List<Bounds> obstacles, double margin, int gridSize) {
        return route(source, target, obstacles, margin, gridSize, DEFAULT_MAX_EXPANSIONS);
    }

    /**
     * Intermediate waypoints from the source center to the target center. Empty when the
     * straight line already clears every obstacle.
     */
    public List<Point> route(Bounds source, Bounds target, List<Bounds> obstacles,
                             double margin, int gridSize, int maxExpansions) {
        double sx = source.centerX();
        double sy = source.centerY();
        double tx = target.centerX();
        double ty = target.centerY();

        if (!SegmentGeometry.anyObstacleOnSegment(sx, sy, tx, ty, obstacles, margin)) {
            return new ArrayList<>();
        }

        List<Bounds> expanded = new ArrayList<>();
        for (Bounds obstacle : obstacles) {
            expanded.add(obstacle.expand(margin));
        }

        double[] xs = candidateCoordinates(true, source, target, expanded, margin, gridSize);
        double[] ys = candidateCoordinates(false, source, target, expanded, margin, gridSize);
        VisibilityGrid grid = new VisibilityGrid(xs, ys, expanded);

        int start = grid.closestFree(sx, sy);
        int goal = grid.closestFree(tx, ty);
        if (start < 0 || goal < 0) {
            log.debug("No free grid point near an endpoint, using fallback route");
            return fallbackRoute(source, target, obstacles, margin, gridSize);
        }
        if (start == goal) {
            // Both centers share one free grid point but the straight line is blocked
            return fallbackRoute(source, target, obstacles, margin, gridSize);
        }

        List<Integer> states = search(grid, start, goal, maxExpansions);
        if (states == null) {
            return fallbackRoute(source, target, obstacles, margin, gridSize);
        }

        List<double[]> path = new ArrayList<>();
        for (int state : states) {
            path.add(new double[]{grid.x(state), grid.y(state)});
        }

        List<Point> waypoints = new ArrayList<>();
        for (double[] p : innerCorners(path)) {
            waypoints.add(new Point(GridSnapper.snap(p[0], gridSize), GridSnapper.snap(p[1], gridSize)));
        }
        return waypoints;
    }

    /**
     * Endpoint centers plus the expanded edges of every obstacle and of both endpoints,
     * snapped outward so a grid line never lies closer to a shape than the margin.
     */
    private double[] candidateCoordinates(boolean horizontal, Bounds source, Bounds target,
                                          List<Bounds> expanded, double margin, int gridSize) {
        TreeSet<Double> values = new TreeSet<>();
        values.add(horizontal ? source.centerX() : source.centerY());
        values.add(horizontal ? target.centerX() : target.centerY());

        List<Bounds> boxes = new ArrayList<>(expanded);
        boxes.add(source.expand(margin));
        boxes.add(target.expand(margin));
        for (Bounds box : boxes) {
            values.add(GridSnapper.snapDown(horizontal ? box.x() : box.y(), gridSize));
            values.add(GridSnapper.snapUp(horizontal ? box.right() : box.bottom(), gridSize));
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    // ========================= A* =========================

    // Search states pair a grid point with the move that entered it, so the bend penalty
    // is paid exactly once per turn
    private static final int NO_MOVE = MOVES.length;
    private static final int HEADINGS = MOVES.length + 1;

    private record QueueEntry(double f, long sequence, int state, double g) {
    }

    /**
     * @return grid states from start to goal, or null when the goal is unreachable or the
     * expansion cap is hit
     */
    private List<Integer> search(VisibilityGrid grid, int start, int goal, int maxExpansions) {
        int stateCount = grid.stateCount() * HEADINGS;
        double[] gScore = new double[stateCount];
        Arrays.fill(gScore, Double.POSITIVE_INFINITY);
        int[] parents = new int[stateCount];
        Arrays.fill(parents, -1);

        PriorityQueue<QueueEntry> open = new PriorityQueue<>(
                Comparator.comparingDouble(QueueEntry::f).thenComparingLong(QueueEntry::sequence));
        long sequence = 0;
        int initial = start * HEADINGS + NO_MOVE;
        gScore[initial] = 0;
        open.add(new QueueEntry(grid.manhattan(start, goal), sequence++, initial, 0));

        int expansions = 0;
        while (!open.isEmpty()) {
            QueueEntry entry = open.poll();
            int current = entry.state();
            if (entry.g() > gScore[current]) {
                continue;
            }
            int point = current / HEADINGS;
            int heading = current % HEADINGS;
            if (point == goal) {
                log.debug("A* reached goal after {} expansions", expansions);
                return unwind(parents, current);
            }
            if (++expansions > maxExpansions) {
                log.debug("A* expansion cap {} reached, using fallback route", maxExpansions);
                return null;
            }

            int xi = grid.xi(point);
            int yi = grid.yi(point);
            for (int m = 0; m < MOVES.length; m++) {
                int nxi = xi + MOVES[m][0];
                int nyi = yi + MOVES[m][1];
                if (!grid.inRange(nxi, nyi)) {
                    continue;
                }
                int nextPoint = grid.state(nxi, nyi);
                if (grid.segmentBlocked(point, nextPoint)) {
                    continue;
                }

                double cost = grid.manhattan(point, nextPoint);
                if (heading != NO_MOVE && heading != m) {
                    cost += BEND_PENALTY;
                }

                int next = nextPoint * HEADINGS + m;
                double tentative = gScore[current] + cost;
                if (tentative < gScore[next]) {
                    gScore[next] = tentative;
                    parents[next] = current;
                    open.add(new QueueEntry(tentative + grid.manhattan(nextPoint, goal), sequence++, next, tentative));
                }
            }
        }
        log.debug("A* exhausted the grid without reaching the goal");
        return null;
    }

    private List<Integer> unwind(int[] parents, int last) {
        List<Integer> points = new ArrayList<>();
        for (int state = last; state >= 0; state = parents[state]) {
            points.add(state / HEADINGS);
        }
        Collections.reverse(points);
        return points;
    }

    // ========================= PATH HELPERS =========================

    /**
     * Keeps only the points where the path turns, then drops the first and last point,
     * which stand in for the source and target connection points.
     */
    static List<double[]> innerCorners(List<double[]> path) {
        if (path.size() <= 2) {
            return new ArrayList<>();
        }
        List<double[]> corners = new ArrayList<>();
        for (int i = 1; i < path.size() - 1; i++) {
            double[] previous = path.get(i - 1);
            double[] current = path.get(i);
            double[] next = path.get(i + 1);
            double dx1 = current[0] - previous[0];
            double dy1 = current[1] - previous[1];
            double dx2 = next[0] - current[0];
            double dy2 = next[1] - current[1];
            boolean turns = (Math.abs(dx1) > 0.5 && Math.abs(dy2) > 0.5)
                    || (Math.abs(dy1) > 0.5 && Math.abs(dx2) > 0.5);
            if (turns) {
                corners.add(current);
            }
        }
        return corners;
    }

    /**
     * Wide detour when A* fails: a band beyond every obstacle, above/below for mostly
     * horizontal connections and left/right for mostly vertical ones, on whichever side is
     * closer to the midpoint.
     */
    List<Point> fallbackRoute(Bounds source, Bounds target, List<Bounds> obstacles, double margin, int gridSize) {
        double dx = target.centerX() - source.centerX();
        double dy = target.centerY() - source.centerY();

        if (Math.abs(dx) > Math.abs(dy)) {
            double above = source.centerY();
            double below = source.centerY();
            if (!obstacles.isEmpty()) {
                above = obstacles.stream().mapToDouble(Bounds::y).min().getAsDouble() - margin * 2;
                below = obstacles.stream().mapToDouble(Bounds::bottom).max().getAsDouble() + margin * 2;
            }
            double midY = (source.centerY() + target.centerY()) / 2;
            double bandY = Math.abs(above - midY) < Math.abs(below - midY) ? above : below;
            return new ArrayList<>(List.of(
                    new Point(GridSnapper.snap(source.centerX(), gridSize), GridSnapper.snap(bandY, gridSize)),
                    new Point(GridSnapper.snap(target.centerX(), gridSize), GridSnapper.snap(bandY, gridSize))));
        }

        double left = source.centerX();
        double right = source.centerX();
        if (!obstacles.isEmpty()) {
            left = obstacles.stream().mapToDouble(Bounds::x).min().getAsDouble() - margin * 2;
            right = obstacles.stream().mapToDouble(Bounds::right).max().getAsDouble() + margin * 2;
        }
        double midX = (source.centerX() + target.centerX()) / 2;
        double bandX = Math.abs(left - midX) < Math.abs(right - midX) ? left : right;
        return new ArrayList<>(List.of(
                new Point(GridSnapper.snap(bandX, gridSize), GridSnapper.snap(source.centerY(), gridSize)),
                new Point(GridSnapper.snap(bandX, gridSize), GridSnapper.snap(target.centerY(), gridSize))));
    }

    /**
     * Grid intersections over sorted candidate coordinates, addressed as
     * {@code state = xi * ys.length + yi}.
     */
    private static final class VisibilityGrid {
        private final double[] xs;
        private final double[] ys;
        private final List<Bounds> expandedObstacles;

        private VisibilityGrid(double[] xs, double[] ys, List<Bounds> expandedObstacles) {
            this.xs = xs;
            this.ys = ys;
            this.expandedObstacles = expandedObstacles;
        }

        int stateCount() {
            return xs.length * ys.length;
        }

        int state(int xi, int yi) {
            return xi * ys.length + yi;
        }

        int xi(int state) {
            return state / ys.length;
        }

        int yi(int state) {
            return state % ys.length;
        }

        double x(int state) {
            return xs[xi(state)];
        }

        double y(int state) {
            return ys[yi(state)];
        }

        boolean inRange(int xi, int yi) {
            return xi >= 0 && xi < xs.length && yi >= 0 && yi < ys.length;
        }

        double manhattan(int a, int b) {
            return Math.abs(x(a) - x(b)) + Math.abs(y(a) - y(b));
        }

        boolean blocked(double px, double py) {
            for (Bounds box : expandedObstacles) {
                if (box.interiorContains(px, py)) {
                    return true;
                }
            }
            return false;
        }

        boolean segmentBlocked(int from, int to) {
            for (Bounds box : expandedObstacles) {
                if (SegmentGeometry.orthogonalSegmentCrossesInterior(x(from), y(from), x(to), y(to), box)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Nearest unblocked intersection by Manhattan distance; the first one found (xi, then
         * yi ascending) wins ties. -1 when every intersection is blocked.
         */
        int closestFree(double px, double py) {
            int best = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int xi = 0; xi < xs.length; xi++) {
                for (int yi = 0; yi < ys.length; yi++) {
                    if (blocked(xs[xi], ys[yi])) {
                        continue;
                    }
                    double distance = Math.abs(xs[xi] - px) + Math.abs(ys[yi] - py);
                    if (distance < bestDistance) {
                        bestDistance = distance;
                        best = state(xi, yi);
                    }
                }
            }
            return best;
        }
    }
}
