package com.architecture.memory.diagrammer.service.layout.polish;

import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.service.layout.layered.LayeredLayoutEngine;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutDirection;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutEngineConfig;
import com.architecture.memory.diagrammer.service.layout.optimize.EdgeOptimizationOptions;
import com.architecture.memory.diagrammer.service.layout.optimize.EdgePathOptimizer;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapResolver;
import com.architecture.memory.diagrammer.service.layout.routing.OrthogonalEdgeRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One-shot clean-up of a whole diagram: relayout, overlap removal, compaction, alignment,
 * page placement, then connector routing and optimization. Connectors go last so their
 * waypoints match the final shape positions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagramPolishService {

    private static final double OVERLAP_MARGIN = 20;
    private static final double COMPACT_MARGIN = 40;
    private static final double CENTER_MARGIN = 50;
    private static final double PAGE_MARGIN = 40;
    private static final double EDGE_MARGIN = 15;

    private final LayeredLayoutEngine layoutEngine;
    private final OverlapResolver overlapResolver;
    private final DiagramAlignmentService alignmentService;
    private final OrthogonalEdgeRouter edgeRouter;
    private final EdgePathOptimizer pathOptimizer;

    public PolishReport polish(Diagram diagram, LayoutDirection direction, LayoutEngineConfig defaults) {
        log.info("Polishing diagram {} ({})", diagram.getId(), direction);

        LayoutEngineConfig config = defaults.toBuilder()
                .gridSize(diagram.getGridSize())
                .routeEdges(false)
                .build();

        PolishReport report = PolishReport.builder()
                .relaidOut(layoutEngine.relayout(diagram, direction, config).size())
                .overlapsFixed(overlapResolver.resolveOverlaps(diagram, OVERLAP_MARGIN, config.getMaxOverlapIterations()))
                .compacted(alignmentService.compact(diagram, COMPACT_MARGIN))
                .rowsAligned(alignmentService.alignRankBaselines(diagram, DiagramAlignmentService.DEFAULT_GROUPING_THRESHOLD))
                .columnsAligned(alignmentService.alignColumnCenters(diagram, DiagramAlignmentService.DEFAULT_GROUPING_THRESHOLD))
                .sizesEqualized(alignmentService.equalizeConnectedSizes(diagram, direction,
                        DiagramAlignmentService.DEFAULT_GROUPING_THRESHOLD))
                .centered(alignmentService.centerOnPage(diagram, CENTER_MARGIN))
                .marginShifted(alignmentService.ensurePageMargins(diagram, PAGE_MARGIN))
                .edgesRouted(edgeRouter.routeAll(diagram, EDGE_MARGIN, config.getMaxRouteExpansions()))
                .edgesOptimized(pathOptimizer.optimize(diagram,
                        EdgeOptimizationOptions.builder().margin(EDGE_MARGIN).build()))
                .build();

        log.info("Polished diagram {}: {}", diagram.getId(), report);
        return report;
    }
}
