package com.architecture.memory.diagrammer.model.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Position and size of a cell. Vertex coordinates are relative to the parent
 * container; connectors carry {@code relative = true} and only use {@link #points}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CellGeometry {

    private double x;
    private double y;

    @Builder.Default
    private double width = 120;

    @Builder.Default
    private double height = 60;

    private boolean relative;

    @Builder.Default
    private List<Point> points = new ArrayList<>();

    public CellGeometry copy() {
        List<Point> pointCopies = new ArrayList<>();
        if (points != null) {
            for (Point point : points) {
                pointCopies.add(new Point(point.getX(), point.getY()));
            }
        }
        return toBuilder().points(pointCopies).build();
    }
}
