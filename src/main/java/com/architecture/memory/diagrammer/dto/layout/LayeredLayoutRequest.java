package com.architecture.memory.diagrammer.dto.layout;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayeredLayoutRequest {

    @NotEmpty(message = "At least one edge is required")
    @Valid
    private List<EdgeRequest> edges;

    // TB, BT, LR or RL; TB when absent
    private String direction;

    @Positive(message = "Rank spacing must be positive")
    private Double rankSpacing;

    @Positive(message = "Node spacing must be positive")
    private Double nodeSpacing;

    // Per-label style overrides
    private Map<String, String> nodeStyles;

    private String edgeStyle;

    private Boolean routeEdges;
}
