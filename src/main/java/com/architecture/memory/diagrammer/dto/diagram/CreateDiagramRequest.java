package com.architecture.memory.diagrammer.dto.diagram;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDiagramRequest {

    @NotBlank(message = "Diagram name is required")
    private String name;

    @Min(value = 1, message = "Grid size must be at least 1")
    private Integer gridSize;

    @Min(value = 1, message = "Page width must be positive")
    private Integer pageWidth;

    @Min(value = 1, message = "Page height must be positive")
    private Integer pageHeight;
}
