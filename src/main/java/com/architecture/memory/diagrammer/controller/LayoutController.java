package com.architecture.memory.diagrammer.controller;

import com.architecture.memory.diagrammer.dto.layout.*;
import com.architecture.memory.diagrammer.service.DiagramService;
import com.architecture.memory.diagrammer.service.layout.optimize.EdgeOptimizationOptions;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for layout operations on a stored diagram.
 * Every endpoint mutates the diagram in place and reports what changed.
 */
@RestController
@RequestMapping("/api/diagrams/{id}/layout")
@RequiredArgsConstructor
public class LayoutController {

    private final DiagramService diagramService;

    /**
     * Create shapes and connectors from labelled edges and place them in ranks
     */
    @PostMapping("/layered")
    public ResponseEntity<LayoutResponse> layered(
            @PathVariable String id,
            @Valid @RequestBody LayeredLayoutRequest request) {
        return ResponseEntity.ok(diagramService.layered(id, request));
    }

    /**
     * Reposition the existing top-level shapes from their connectors
     */
    @PostMapping("/relayout")
    public ResponseEntity<LayoutResponse> relayout(
            @PathVariable String id,
            @Valid @RequestBody(required = false) RelayoutRequest request) {
        return ResponseEntity.ok(diagramService.relayout(id, request != null ? request : new RelayoutRequest()));
    }

    @GetMapping("/overlaps")
    public ResponseEntity<LayoutResponse> findOverlaps(
            @PathVariable String id,
            @RequestParam(required = false, defaultValue = "10") double margin) {
        return ResponseEntity.ok(diagramService.findOverlaps(id, margin));
    }

    @PostMapping("/overlaps")
    public ResponseEntity<LayoutResponse> resolveOverlaps(
            @PathVariable String id,
            @RequestParam(required = false, defaultValue = "20") double margin,
            @RequestParam(required = false, defaultValue = "50") int maxIterations) {
        return ResponseEntity.ok(diagramService.resolveOverlaps(id, margin, maxIterations));
    }

    @PostMapping("/route")
    public ResponseEntity<LayoutResponse> route(
            @PathVariable String id,
            @RequestParam(required = false, defaultValue = "15") double margin) {
        return ResponseEntity.ok(diagramService.routeConnectors(id, margin));
    }

    @PostMapping("/optimize")
    public ResponseEntity<LayoutResponse> optimize(
            @PathVariable String id,
            @RequestParam(required = false, defaultValue = "15") double margin,
            @RequestParam(required = false, defaultValue = "8") double straightenThreshold,
            @RequestParam(required = false, defaultValue = "10") double nudgeSpacing) {
        EdgeOptimizationOptions options = EdgeOptimizationOptions.builder()
                .margin(margin)
                .straightenThreshold(straightenThreshold)
                .nudgeSpacing(nudgeSpacing)
                .build();
        return ResponseEntity.ok(diagramService.optimizeConnectors(id, options));
    }

    @PostMapping("/ports")
    public ResponseEntity<LayoutResponse> distributePorts(@PathVariable String id) {
        return ResponseEntity.ok(diagramService.distributePorts(id));
    }

    /**
     * Place new shapes as a row, column, grid or tree
     */
    @PostMapping("/arrange/{mode}")
    public ResponseEntity<LayoutResponse> arrange(
            @PathVariable String id,
            @PathVariable String mode,
            @RequestBody ArrangeRequest request) {
        return ResponseEntity.ok(diagramService.arrange(id, mode, request));
    }

    @PostMapping("/compact")
    public ResponseEntity<LayoutResponse> compact(
            @PathVariable String id,
            @RequestParam(required = false, defaultValue = "40") double margin) {
        return ResponseEntity.ok(diagramService.compact(id, margin));
    }

    @PostMapping("/align")
    public ResponseEntity<LayoutResponse> align(
            @PathVariable String id,
            @Valid @RequestBody AlignRequest request) {
        return ResponseEntity.ok(diagramService.align(id, request));
    }

    @PostMapping("/distribute")
    public ResponseEntity<LayoutResponse> distribute(
            @PathVariable String id,
            @Valid @RequestBody DistributeRequest request) {
        return ResponseEntity.ok(diagramService.distribute(id, request));
    }

    @PostMapping("/fit-container/{containerId}")
    public ResponseEntity<LayoutResponse> fitContainer(
            @PathVariable String id,
            @PathVariable String containerId,
            @RequestParam(required = false, defaultValue = "20") double padding) {
        return ResponseEntity.ok(diagramService.fitContainer(id, containerId, padding));
    }

    /**
     * Full clean-up: relayout, overlap removal, compaction, alignment, page placement,
     * connector routing and optimization
     */
    @PostMapping("/polish")
    public ResponseEntity<LayoutResponse> polish(
            @PathVariable String id,
            @RequestParam(required = false, defaultValue = "TB") String direction) {
        return ResponseEntity.ok(diagramService.polish(id, direction));
    }
}
