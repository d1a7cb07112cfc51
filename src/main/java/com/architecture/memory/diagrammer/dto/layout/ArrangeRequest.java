package com.architecture.memory.diagrammer.dto.layout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Input for the row, column, grid and tree arrangements. Row/column/grid read
 * {@code labels}; tree reads {@code adjacency} and {@code root}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArrangeRequest {

    private List<String> labels;

    private Integer columns;

    private Map<String, List<String>> adjacency;

    private String root;

    private String direction;

    private String style;

    private String edgeStyle;

    private Double startX;

    private Double startY;

    // Connect the placed shapes in order (row/column/grid only)
    private boolean connect;
}
