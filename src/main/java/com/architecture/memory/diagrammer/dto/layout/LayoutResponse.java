package com.architecture.memory.diagrammer.dto.layout;

import com.architecture.memory.diagrammer.model.diagram.Point;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapPair;
import com.architecture.memory.diagrammer.service.layout.polish.PolishReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result of a layout operation. Only the fields the operation produces are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LayoutResponse {

    private String diagramId;
    private String operation;

    // Shapes or connectors changed by the operation
    private int affected;

    // Label to created cell id
    private Map<String, String> cellIds;

    private List<String> createdIds;

    private Map<String, Point> positions;

    private List<OverlapPair> overlaps;

    private Double width;
    private Double height;

    private PolishReport report;
}
