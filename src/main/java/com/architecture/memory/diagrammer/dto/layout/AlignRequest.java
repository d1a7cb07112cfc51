package com.architecture.memory.diagrammer.dto.layout;

import jakarta.validation.constraints.NotBlank;
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
public class AlignRequest {

    @NotEmpty(message = "Cell ids are required")
    private List<String> cellIds;

    @NotBlank(message = "Alignment is required")
    private String alignment;
}
