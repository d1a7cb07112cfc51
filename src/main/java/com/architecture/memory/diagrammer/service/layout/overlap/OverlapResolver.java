package com.architecture.memory.diagrammer.service.layout.overlap;

import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.service.layout.geometry.Bounds;
import com.architecture.memory.diagrammer.service.layout.geometry.DiagramBoundsResolver;
import com.architecture.memory.diagrammer.service.layout.geometry.GridSnapper;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Separates shapes whose margin-padded boxes intersect by pushing each overlapping pair
 * apart along its axis of smaller overlap.
 *
 * Works on layout nodes straight out of the layered engine, and on any placed diagram.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OverlapResolver {

    private final DiagramBoundsResolver boundsResolver;

    // ========================= DIAGRAM LEVEL =========================

    /**
     * All vertex pairs whose absolute boxes come closer than {@code margin}. A container and
     * anything nested inside it are never reported as a pair.
     */
    public List<OverlapPair> findOverlaps(Diagram diagram, double margin) {
        Map<String, Bounds> bounds = boundsResolver.resolveAll(diagram);
        List<String> ids = new ArrayList<>(bounds.keySet());

        Map<String, Set<String>> ancestors = new HashMap<>();
        for (String id : ids) {
            ancestors.put(id, boundsResolver.ancestorsOf(diagram, id));
        }

        List<OverlapPair> overlaps = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                String a = ids.get(i);
                String b = ids.get(j);
                if (ancestors.get(a).contains(b) || ancestors.get(b).contains(a)) {
                    continue;
                }
                if (bounds.get(a).intersects(bounds.get(b), margin)) {
                    overlaps.add(new OverlapPair(a, b));
                }
            }
        }
        log.debug("Found {} overlapping pairs among {} shapes", overlaps.size(), ids.size());
        return overlaps;
    }

    /**
     * Pushes overlapping shapes apart until every pair keeps {@code margin} clearance or the
     * iteration cap is hit. Shapes are resolved among their siblings (same parent), so a
     * moved container carries its children along. Only shapes that had to move are
     * touched, and those end on the diagram grid.
     *
     * @return number of distinct shapes moved
     */
    public int resolveOverlaps(Diagram diagram, double margin, int maxIterations) {
        Map<String, List<DiagramCell>> siblings = new LinkedHashMap<>();
        for (DiagramCell cell : diagram.getVertices()) {
            String parent = Diagram.isTopLevelParent(cell.getParent()) ? Diagram.DEFAULT_LAYER_ID : cell.getParent();
            siblings.computeIfAbsent(parent, k -> new ArrayList<>()).add(cell);
        }

        int moved = 0;
        for (Map.Entry<String, List<DiagramCell>> group : siblings.entrySet()) {
            List<DiagramCell> cells = group.getValue();
            if (cells.size() < 2) {
                continue;
            }
            List<Box> boxes = new ArrayList<>();
            for (DiagramCell cell : cells) {
                CellGeometry g = cell.getGeometry();
                boxes.add(new Box(g.getX(), g.getY(), g.getWidth(), g.getHeight()));
            }

            OverlapResolution result = separate(boxes, margin, maxIterations, diagram.getGridSize(), false);
            if (!result.isConverged()) {
                log.warn("Overlap resolution under parent {} stopped at the {} iteration cap with overlap left",
                        group.getKey(), maxIterations);
            }

            for (int i = 0; i < cells.size(); i++) {
                Box box = boxes.get(i);
                if (box.moved) {
                    cells.get(i).getGeometry().setX(box.x);
                    cells.get(i).getGeometry().setY(box.y);
                }
            }
            moved += result.getMovedCount();
        }

        log.info("Resolved overlaps in diagram {}: {} shapes moved", diagram.getId(), moved);
        return moved;
    }

    // ========================= LAYOUT LEVEL =========================

    /**
     * Separates layout nodes in place and snaps every node to the grid. When snapping
     * brings a padded pair back into contact, the remaining budget is spent on pushes
     * rounded up to whole grid steps, so a converged result is both on-grid and clear.
     */
    public OverlapResolution resolve(List<LayoutNode> nodes, double padding, int maxIterations, int gridSize) {
        List<Box> boxes = new ArrayList<>();
        for (LayoutNode node : nodes) {
            boxes.add(new Box(node.getX(), node.getY(), node.getWidth(), node.getHeight()));
        }

        OverlapResolution result = separate(boxes, padding, maxIterations, gridSize, true);

        for (int i = 0; i < nodes.size(); i++) {
            nodes.get(i).setX(boxes.get(i).x);
            nodes.get(i).setY(boxes.get(i).y);
        }
        if (!result.isConverged()) {
            log.warn("Layout overlap removal hit the {} iteration cap with overlap left", maxIterations);
        }
        log.debug("Layout overlap removal: {} passes, {} nodes moved", result.getIterations(), result.getMovedCount());
        return result;
    }

    // ========================= CORE =========================

    private OverlapResolution separate(List<Box> boxes, double padding, int maxIterations,
                                       int gridSize, boolean snapAll) {
        int iterations = 0;
        boolean clean = false;

        while (iterations < maxIterations) {
            iterations++;
            if (!pushPass(boxes, padding, 0)) {
                clean = true;
                break;
            }
        }

        for (Box box : boxes) {
            if (snapAll || box.moved) {
                box.x = GridSnapper.snap(box.x, gridSize);
                box.y = GridSnapper.snap(box.y, gridSize);
            }
        }

        // Snapping can shave up to half a grid step off a gap
        if (clean) {
            clean = !hasOverlap(boxes, padding);
        }
        while (!clean && iterations < maxIterations) {
            iterations++;
            if (!pushPass(boxes, padding, gridSize)) {
                clean = true;
            }
        }

        int movedCount = 0;
        for (Box box : boxes) {
            if (box.moved && (box.x != box.originX || box.y != box.originY)) {
                movedCount++;
            } else {
                box.moved = false;
            }
        }
        return OverlapResolution.builder()
                .iterations(iterations)
                .converged(clean)
                .movedCount(movedCount)
                .build();
    }

    /**
     * One scan over all unordered pairs. A positive {@code gridStep} rounds each push up to
     * whole grid steps.
     *
     * @return whether any box moved
     */
    private boolean pushPass(List<Box> boxes, double padding, int gridStep) {
        boolean moved = false;
        for (int i = 0; i < boxes.size(); i++) {
            for (int j = i + 1; j < boxes.size(); j++) {
                Box a = boxes.get(i);
                Box b = boxes.get(j);
                double overlapX = Math.min(a.right(), b.right()) + padding - Math.max(a.x, b.x);
                double overlapY = Math.min(a.bottom(), b.bottom()) + padding - Math.max(a.y, b.y);
                if (overlapX <= 0 || overlapY <= 0) {
                    continue;
                }

                if (overlapX <= overlapY) {
                    double push = pushDistance(overlapX, gridStep);
                    double direction = a.centerX() <= b.centerX() ? -1 : 1;
                    a.x += direction * push;
                    b.x -= direction * push;
                } else {
                    double push = pushDistance(overlapY, gridStep);
                    double direction = a.centerY() <= b.centerY() ? -1 : 1;
                    a.y += direction * push;
                    b.y -= direction * push;
                }
                a.moved = true;
                b.moved = true;
                moved = true;
            }
        }
        return moved;
    }

    private double pushDistance(double overlap, int gridStep) {
        double push = overlap / 2 + 1;
        return gridStep > 0 ? GridSnapper.snapUp(push, gridStep) : push;
    }

    private boolean hasOverlap(List<Box> boxes, double padding) {
        for (int i = 0; i < boxes.size(); i++) {
            for (int j = i + 1; j < boxes.size(); j++) {
                if (boxes.get(i).toBounds().intersects(boxes.get(j).toBounds(), padding)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static final class Box {
        private double x;
        private double y;
        private final double width;
        private final double height;
        private final double originX;
        private final double originY;
        private boolean moved;

        private Box(double x, double y, double width, double height) {
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
            this.originX = x;
            this.originY = y;
        }

        private double right() {
            return x + width;
        }

        private double bottom() {
            return y + height;
        }

        private double centerX() {
            return x + width / 2;
        }

        private double centerY() {
            return y + height / 2;
        }

        private Bounds toBounds() {
            return new Bounds(x, y, width, height);
        }
    }
}
