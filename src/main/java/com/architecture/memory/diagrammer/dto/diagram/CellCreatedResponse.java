package com.architecture.memory.diagrammer.dto.diagram;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CellCreatedResponse {

    private String diagramId;
    private String cellId;
}
