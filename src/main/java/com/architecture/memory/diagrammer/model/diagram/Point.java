package com.architecture.memory.diagrammer.model.diagram;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A connector waypoint in absolute diagram coordinates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Point {

    private double x;
    private double y;
}
