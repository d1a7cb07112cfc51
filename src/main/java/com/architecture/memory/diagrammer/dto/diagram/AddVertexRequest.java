package com.architecture.memory.diagrammer.dto.diagram;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddVertexRequest {

    private String label;

    @NotNull(message = "x is required")
    private Double x;

    @NotNull(message = "y is required")
    private Double y;

    @Positive(message = "Width must be positive")
    private Double width;

    @Positive(message = "Height must be positive")
    private Double height;

    private String style;

    // Container id; the default layer when absent
    private String parent;
}
