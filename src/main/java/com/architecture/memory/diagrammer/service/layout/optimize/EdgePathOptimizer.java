package com.architecture.memory.diagrammer.service.layout.optimize;

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
 * Post-processes routed connectors: drops redundant bends, straightens near-orthogonal
 * segments, removes detours, recenters segments in the free channel between shapes and
 * spreads connectors that share a corridor.
 *
 * A path here is the connector's waypoints framed by the source and target centers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EdgePathOptimizer {

    // Whole pipeline (per-path passes plus corridor separation) repeats until nothing moves
    private static final int MAX_PASSES = 12;

    private final DiagramBoundsResolver boundsResolver;

    private record Routed(DiagramCell connector, Bounds source, Bounds target, List<Bounds> obstacles) {
    }

    /**
     * Optimizes every connector that has waypoints and resolvable endpoints. The result is
     * a fixed point: optimizing it again changes nothing.
     *
     * @return number of connectors whose waypoint list changed
     */
    public int optimize(Diagram diagram, EdgeOptimizationOptions options) {
        Map<String, Bounds> bounds = boundsResolver.resolveAll(diagram);
        if (bounds.isEmpty()) {
            return 0;
        }
        int grid = diagram.getGridSize() > 0 ? diagram.getGridSize() : 10;
        double corridor = options.getNudgeSpacing() * 2;

        List<Routed> routed = new ArrayList<>();
        List<DiagramCell> connectors = new ArrayList<>();
        Map<String, List<double[]>> originals = new HashMap<>();

        for (DiagramCell connector : diagram.getConnectors()) {
            Bounds source = bounds.get(connector.getSource());
            Bounds target = bounds.get(connector.getTarget());
            if (source == null || target == null) {
                log.warn("Skipping connector {}: no bounds for its endpoints", connector.getId());
                continue;
            }
            List<Point> points = connector.getGeometry() == null ? null : connector.getGeometry().getPoints();
            if (points == null || points.isEmpty()) {
                continue;
            }
            List<Bounds> obstacles = new ArrayList<>();
            for (Map.Entry<String, Bounds> entry : bounds.entrySet()) {
                if (!entry.getKey().equals(connector.getSource()) && !entry.getKey().equals(connector.getTarget())) {
                    obstacles.add(entry.getValue());
                }
            }
            routed.add(new Routed(connector, source, target, obstacles));
            connectors.add(connector);
            originals.put(connector.getId(), coordinates(points));
        }

        boolean converged = false;
        for (int pass = 0; pass < MAX_PASSES && !converged; pass++) {
            boolean changed = false;
            for (Routed item : routed) {
                DiagramCell connector = item.connector();
                List<double[]> path = framedPath(item.source(), item.target(), connector.getGeometry().getPoints());
                List<Segment> neighbours = new ArrayList<>();
                for (Segment segment : collectSegments(connectors, bounds)) {
                    if (segment.connector() != connector) {
                        neighbours.add(segment);
                    }
                }
                List<double[]> next = optimizePath(path, item.obstacles(), neighbours, corridor, options, grid);
                if (!samePath(next, path)) {
                    connector.getGeometry().setPoints(toPoints(next.subList(1, next.size() - 1)));
                    changed = true;
                }
            }
            if (separateParallelSegments(connectors, bounds, options.getNudgeSpacing(), grid) > 0) {
                changed = true;
            }
            converged = !changed;
        }
        if (!converged) {
            log.debug("Connector paths in diagram {} still moving after {} passes", diagram.getId(), MAX_PASSES);
        }

        int modified = 0;
        for (DiagramCell connector : connectors) {
            if (!samePath(coordinates(connector.getGeometry().getPoints()), originals.get(connector.getId()))) {
                modified++;
            }
        }
        log.info("Optimized connector paths in diagram {}: {} of {} connectors changed",
                diagram.getId(), modified, connectors.size());
        return modified;
    }

    private List<double[]> optimizePath(List<double[]> path, List<Bounds> obstacles, List<Segment> neighbours,
                                        double corridor, EdgeOptimizationOptions options, int grid) {
        List<double[]> result = removeCollinear(path);
        result = straighten(result, options.getStraightenThreshold());
        result = shorten(result, obstacles, options.getMargin());
        result = centerInChannels(result, obstacles, options.getMargin(), neighbours, corridor);

        List<double[]> snapped = new ArrayList<>();
        snapped.add(result.get(0));
        for (int i = 1; i < result.size() - 1; i++) {
            double[] p = result.get(i);
            snapped.add(new double[]{GridSnapper.snap(p[0], grid), GridSnapper.snap(p[1], grid)});
        }
        snapped.add(result.get(result.size() - 1));
        return snapped;
    }

    // ========================= PER-PATH PASSES =========================

    /**
     * Drops interior points that share an x or a y (within 1px) with both neighbors.
     */
    static List<double[]> removeCollinear(List<double[]> path) {
        if (path.size() <= 2) {
            return new ArrayList<>(path);
        }
        List<double[]> result = new ArrayList<>();
        result.add(path.get(0));
        for (int i = 1; i < path.size() - 1; i++) {
            double[] previous = path.get(i - 1);
            double[] current = path.get(i);
            double[] next = path.get(i + 1);
            boolean sameX = Math.abs(previous[0] - current[0]) < 1 && Math.abs(current[0] - next[0]) < 1;
            boolean sameY = Math.abs(previous[1] - current[1]) < 1 && Math.abs(current[1] - next[1]) < 1;
            if (!sameX && !sameY) {
                result.add(current);
            }
        }
        result.add(path.get(path.size() - 1));
        return result;
    }

    /**
     * Aligns a point with its predecessor on one axis when it is within {@code threshold}
     * on that axis and at least {@code threshold} away on the other. The target center is
     * never moved.
     */
    static List<double[]> straighten(List<double[]> path, double threshold) {
        if (path.size() <= 1) {
            return new ArrayList<>(path);
        }
        List<double[]> result = new ArrayList<>();
        result.add(path.get(0));
        for (int i = 1; i < path.size(); i++) {
            double[] previous = result.get(result.size() - 1);
            double x = path.get(i)[0];
            double y = path.get(i)[1];
            boolean last = i == path.size() - 1;
            if (!last && Math.abs(x - previous[0]) < threshold && Math.abs(y - previous[1]) >= threshold) {
                x = previous[0];
            } else if (!last && Math.abs(y - previous[1]) < threshold && Math.abs(x - previous[0]) >= threshold) {
                y = previous[1];
            }
            result.add(new double[]{x, y});
        }
        return result;
    }

    /**
     * Removes interior points whose neighbors can see each other directly, repeating until
     * no more can go.
     */
    static List<double[]> shorten(List<double[]> path, List<Bounds> obstacles, double margin) {
        List<double[]> result = new ArrayList<>(path);
        if (result.size() <= 3) {
            return result;
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            int i = 1;
            while (i < result.size() - 1) {
                double[] previous = result.get(i - 1);
                double[] next = result.get(i + 1);
                if (!SegmentGeometry.anyObstacleOnSegment(previous[0], previous[1], next[0], next[1], obstacles, margin)) {
                    result.remove(i);
                    changed = true;
                } else {
                    i++;
                }
            }
        }
        return result;
    }

    /**
     * Moves each axis-aligned segment to the middle of the channel between the nearest
     * shapes on either side, when the channel is at least two margins wide and the move is
     * under 40% of the channel width. Segments touching an endpoint center keep that end.
     */
    static List<double[]> centerInChannels(List<double[]> path, List<Bounds> obstacles, double margin) {
        return centerInChannels(path, obstacles, margin, List.of(), 0);
    }

    /**
     * As {@link #centerInChannels(List, List, double)}, but a segment that shares a corridor
     * with a parallel segment of another connector (within {@code corridor}, overlapping in
     * range) keeps its position, since corridor separation owns it.
     */
    static List<double[]> centerInChannels(List<double[]> path, List<Bounds> obstacles, double margin,
                                           List<Segment> neighbours, double corridor) {
        List<double[]> result = new ArrayList<>();
        for (double[] p : path) {
            result.add(new double[]{p[0], p[1]});
        }
        int last = result.size() - 1;

        for (int i = 0; i < last; i++) {
            // Only segments between two waypoints can move as a whole
            if (i == 0 || i + 1 == last) {
                continue;
            }
            double[] a = result.get(i);
            double[] b = result.get(i + 1);

            if (Math.abs(a[0] - b[0]) < 1) {
                if (inSharedCorridor(false, a[0], a[1], b[1], neighbours, corridor)) {
                    continue;
                }
                double[] channel = channel(a[0], Math.min(a[1], b[1]), Math.max(a[1], b[1]), obstacles, margin, true);
                if (channel != null) {
                    a[0] = channel[0];
                    b[0] = channel[0];
                }
            } else if (Math.abs(a[1] - b[1]) < 1) {
                if (inSharedCorridor(true, a[1], a[0], b[0], neighbours, corridor)) {
                    continue;
                }
                double[] channel = channel(a[1], Math.min(a[0], b[0]), Math.max(a[0], b[0]), obstacles, margin, false);
                if (channel != null) {
                    a[1] = channel[0];
                    b[1] = channel[0];
                }
            }
        }
        return result;
    }

    private static boolean inSharedCorridor(boolean horizontal, double fixed, double from, double to,
                                            List<Segment> neighbours, double corridor) {
        double low = Math.min(from, to);
        double high = Math.max(from, to);
        for (Segment other : neighbours) {
            if (other.horizontal() == horizontal
                    && Math.abs(other.fixed() - fixed) <= corridor
                    && other.rangeEnd() >= low && high >= other.rangeStart()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Channel center for a segment at {@code fixed} spanning {@code from..to}, or null when
     * the segment should stay put.
     */
    private static double[] channel(double fixed, double from, double to, List<Bounds> obstacles,
                                    double margin, boolean vertical) {
        double low = Double.NEGATIVE_INFINITY;
        double high = Double.POSITIVE_INFINITY;
        for (Bounds obstacle : obstacles) {
            double spanStart = vertical ? obstacle.y() : obstacle.x();
            double spanEnd = vertical ? obstacle.bottom() : obstacle.right();
            if (spanEnd + margin < from || spanStart - margin > to) {
                continue;
            }
            double near = vertical ? obstacle.right() + margin : obstacle.bottom() + margin;
            double far = vertical ? obstacle.x() - margin : obstacle.y() - margin;
            if (near <= fixed) {
                low = Math.max(low, near);
            } else if (far >= fixed) {
                high = Math.min(high, far);
            }
        }
        if (Double.isInfinite(low) || Double.isInfinite(high)) {
            return null;
        }
        double width = high - low;
        double center = (low + high) / 2;
        if (width >= margin * 2 && Math.abs(center - fixed) < width * 0.4) {
            return new double[]{center};
        }
        return null;
    }

    // ========================= CORRIDOR SEPARATION =========================

    record Segment(DiagramCell connector, int index, boolean horizontal,
                   double fixed, double rangeStart, double rangeEnd) {
    }

    /**
     * Axis-aligned segments between two waypoints, in connector order. {@code index} is the
     * segment's start in the path framed by the endpoint centers.
     */
    private static List<Segment> collectSegments(List<DiagramCell> connectors, Map<String, Bounds> bounds) {
        List<Segment> segments = new ArrayList<>();
        for (DiagramCell connector : connectors) {
            List<Point> points = connector.getGeometry().getPoints();
            if (points.size() < 2) {
                continue;
            }
            List<double[]> full = framedPath(bounds.get(connector.getSource()), bounds.get(connector.getTarget()), points);
            for (int si = 1; si < full.size() - 2; si++) {
                double[] a = full.get(si);
                double[] b = full.get(si + 1);
                if (Math.abs(a[1] - b[1]) < 1) {
                    segments.add(new Segment(connector, si, true, a[1], Math.min(a[0], b[0]), Math.max(a[0], b[0])));
                } else if (Math.abs(a[0] - b[0]) < 1) {
                    segments.add(new Segment(connector, si, false, a[0], Math.min(a[1], b[1]), Math.max(a[1], b[1])));
                }
            }
        }
        return segments;
    }

    private static boolean shareCorridor(Segment a, Segment b, double spacing) {
        return a.horizontal() == b.horizontal()
                && a.connector() != b.connector()
                && Math.abs(a.fixed() - b.fixed()) <= spacing * 2
                && a.rangeEnd() >= b.rangeStart()
                && b.rangeEnd() >= a.rangeStart();
    }

    /**
     * Spreads segments of different connectors that share orientation, lie within two
     * spacings of each other and overlap in range, evenly around their mean position.
     * Clusters are transitive, and members keep their current order across the corridor,
     * so spreading an already spread cluster moves nothing. The step is the spacing rounded
     * to a grid multiple. Only segments between two waypoints are moved.
     *
     * @return number of segments moved
     */
    int separateParallelSegments(List<DiagramCell> connectors, Map<String, Bounds> bounds,
                                 double spacing, int grid) {
        if (connectors.size() < 2) {
            return 0;
        }
        List<Segment> segments = collectSegments(connectors, bounds);
        int step = (int) Math.max(grid, GridSnapper.snap(spacing, grid));

        int[] cluster = new int[segments.size()];
        Arrays.fill(cluster, -1);
        int moved = 0;
        for (int i = 0; i < segments.size(); i++) {
            if (cluster[i] >= 0) {
                continue;
            }
            List<Integer> members = new ArrayList<>();
            Deque<Integer> pending = new ArrayDeque<>();
            cluster[i] = i;
            pending.add(i);
            while (!pending.isEmpty()) {
                int current = pending.poll();
                members.add(current);
                for (int j = 0; j < segments.size(); j++) {
                    if (cluster[j] < 0 && shareCorridor(segments.get(current), segments.get(j), spacing)) {
                        cluster[j] = i;
                        pending.add(j);
                    }
                }
            }
            if (members.size() < 2) {
                continue;
            }

            members.sort(Comparator.<Integer>comparingDouble(m -> segments.get(m).fixed())
                    .thenComparingInt(m -> m));
            double average = members.stream().mapToDouble(m -> segments.get(m).fixed()).average().orElse(0);
            double start = GridSnapper.snap(average - (members.size() - 1) * step / 2.0, grid);
            for (int k = 0; k < members.size(); k++) {
                Segment segment = segments.get(members.get(k));
                double coordinate = start + k * step;
                if (Math.abs(coordinate - segment.fixed()) < 1e-9) {
                    continue;
                }
                List<Point> points = segment.connector().getGeometry().getPoints();
                // Full-path index si maps to waypoints si - 1 and si
                for (int wp = segment.index() - 1; wp <= segment.index(); wp++) {
                    Point point = points.get(wp);
                    if (segment.horizontal()) {
                        point.setY(coordinate);
                    } else {
                        point.setX(coordinate);
                    }
                }
                moved++;
            }
            log.debug("Separated {} parallel segments around {}", members.size(), average);
        }
        return moved;
    }

    // ========================= HELPERS =========================

    private static List<double[]> framedPath(Bounds source, Bounds target, List<Point> points) {
        List<double[]> path = new ArrayList<>();
        path.add(new double[]{source.centerX(), source.centerY()});
        path.addAll(coordinates(points));
        path.add(new double[]{target.centerX(), target.centerY()});
        return path;
    }

    private static List<double[]> coordinates(List<Point> points) {
        List<double[]> coordinates = new ArrayList<>();
        for (Point point : points) {
            coordinates.add(new double[]{point.getX(), point.getY()});
        }
        return coordinates;
    }

    private static List<Point> toPoints(List<double[]> coordinates) {
        List<Point> points = new ArrayList<>();
        for (double[] c : coordinates) {
            points.add(new Point(c[0], c[1]));
        }
        return points;
    }

    private static boolean samePath(List<double[]> a, List<double[]> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!Arrays.equals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
}
