package com.architecture.memory.diagrammer.model.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single cell of a diagram: a vertex (shape or container), a connector, or one of the
 * two structural root cells.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DiagramCell {

    private String id;

    @Builder.Default
    private String value = "";

    @Builder.Default
    private String style = "";

    @Builder.Default
    private String parent = Diagram.DEFAULT_LAYER_ID;

    private boolean vertex;
    private boolean edge;

    private String source;
    private String target;

    private CellGeometry geometry;

    // Connection port constraints, 0..1 relative to the shape (0.5,0 = top-center)
    private Double exitX;
    private Double exitY;
    private Double entryX;
    private Double entryY;

    public boolean isConnected() {
        return edge && source != null && target != null;
    }

    /**
     * Copy that shares no mutable state with this cell.
     */
    public DiagramCell copy() {
        return toBuilder().geometry(geometry == null ? null : geometry.copy()).build();
    }
}
