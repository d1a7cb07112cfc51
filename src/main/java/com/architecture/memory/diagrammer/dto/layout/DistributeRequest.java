package com.architecture.memory.diagrammer.dto.layout;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributeRequest {

    @NotEmpty(message = "Cell ids are required")
    private List<String> cellIds;

    // "horizontal" or "vertical"; horizontal when absent
    private String direction;
}
