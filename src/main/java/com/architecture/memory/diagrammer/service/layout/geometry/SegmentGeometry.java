package com.architecture.memory.diagrammer.service.layout.geometry;

import java.util.Collection;

/**
 * Segment-versus-box predicates shared by the router and the path optimizer.
 */
public final class SegmentGeometry {

    private static final double EPSILON = 1e-9;

    private SegmentGeometry() {
    }

    /**
     * Liang-Barsky clipping: does the segment touch or cross the box?
     * A segment that only grazes the border counts as a hit.
     */
    public static boolean lineIntersectsBox(double x1, double y1, double x2, double y2, Bounds box) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        double[] p = {-dx, dx, -dy, dy};
        double[] q = {x1 - box.x(), box.right() - x1, y1 - box.y(), box.bottom() - y1};

        double t0 = 0.0;
        double t1 = 1.0;
        for (int i = 0; i < 4; i++) {
            if (Math.abs(p[i]) < EPSILON) {
                if (q[i] < 0) {
                    return false;
                }
            } else {
                double t = q[i] / p[i];
                if (p[i] < 0) {
                    t0 = Math.max(t0, t);
                } else {
                    t1 = Math.min(t1, t);
                }
            }
        }
        return t0 <= t1;
    }

    /**
     * Does an axis-aligned segment pass through the open interior of the box?
     * Running along the border is allowed. Diagonal segments fall back to
     * {@link #lineIntersectsBox}.
     */
    public static boolean orthogonalSegmentCrossesInterior(double x1, double y1, double x2, double y2, Bounds box) {
        if (Math.abs(x1 - x2) < 0.5) {
            double minY = Math.min(y1, y2);
            double maxY = Math.max(y1, y2);
            return box.x() < x1 && x1 < box.right()
                    && maxY > box.y() && minY < box.bottom();
        }
        if (Math.abs(y1 - y2) < 0.5) {
            double minX = Math.min(x1, x2);
            double maxX = Math.max(x1, x2);
            return box.y() < y1 && y1 < box.bottom()
                    && maxX > box.x() && minX < box.right();
        }
        return lineIntersectsBox(x1, y1, x2, y2, box);
    }

    /**
     * True when any obstacle, grown by {@code margin}, is touched by the straight segment.
     */
    public static boolean anyObstacleOnSegment(double x1, double y1, double x2, double y2,
                                               Collection<Bounds> obstacles, double margin) {
        for (Bounds obstacle : obstacles) {
            if (lineIntersectsBox(x1, y1, x2, y2, obstacle.expand(margin))) {
                return true;
            }
        }
        return false;
    }
}
