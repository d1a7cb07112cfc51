package com.architecture.memory.diagrammer.dto.layout;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One edge of a layered layout request, endpoints given by label.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeRequest {

    @NotBlank(message = "Edge source is required")
    private String source;

    @NotBlank(message = "Edge target is required")
    private String target;

    private String label;
}
