package com.architecture.memory.diagrammer.service.layout.layered;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node of the layout arena. {@code x}/{@code y} is the top-left corner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutNode {

    private int index;
    private String key;
    private String label;
    private double width;
    private double height;
    private int rank;
    private double order;
    private double x;
    private double y;

    // Synthetic chain node for an edge spanning several ranks, never emitted
    private boolean virtual;

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }
}
