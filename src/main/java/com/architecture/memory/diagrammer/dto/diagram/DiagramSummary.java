package com.architecture.memory.diagrammer.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagramSummary {

    private String id;
    private String name;
    private int shapeCount;
    private int connectorCount;
}
