package com.architecture.memory.diagrammer.dto.layout;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayoutRequest {

    private String direction;

    @Positive(message = "Rank spacing must be positive")
    private Double rankSpacing;

    @Positive(message = "Node spacing must be positive")
    private Double nodeSpacing;

    private Boolean routeEdges;
}
