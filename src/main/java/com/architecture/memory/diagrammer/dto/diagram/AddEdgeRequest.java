package com.architecture.memory.diagrammer.dto.diagram;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddEdgeRequest {

    @NotBlank(message = "Source cell id is required")
    private String source;

    @NotBlank(message = "Target cell id is required")
    private String target;

    private String label;

    private String style;
}
