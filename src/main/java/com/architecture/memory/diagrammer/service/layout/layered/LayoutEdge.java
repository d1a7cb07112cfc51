package com.architecture.memory.diagrammer.service.layout.layered;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A caller-supplied edge between two arena nodes. {@code source}/{@code target} keep the
 * caller's direction; {@code reversed} marks a back edge whose effective direction for
 * ranking and expansion runs target to source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutEdge {

    private int source;
    private int target;
    private String label;
    private boolean reversed;

    // Connector created for this edge, set once cells exist
    private String cellId;

    @Builder.Default
    private List<Integer> virtualChain = new ArrayList<>();

    public int effectiveSource() {
        return reversed ? target : source;
    }

    public int effectiveTarget() {
        return reversed ? source : target;
    }

    public boolean isSelfLoop() {
        return source == target;
    }
}
