package com.architecture.memory.diagrammer.service;

import com.architecture.memory.diagrammer.dto.diagram.AddEdgeRequest;
import com.architecture.memory.diagrammer.dto.diagram.AddVertexRequest;
import com.architecture.memory.diagrammer.dto.diagram.CreateDiagramRequest;
import com.architecture.memory.diagrammer.dto.diagram.DiagramSummary;
import com.architecture.memory.diagrammer.dto.layout.AlignRequest;
import com.architecture.memory.diagrammer.dto.layout.ArrangeRequest;
import com.architecture.memory.diagrammer.dto.layout.DistributeRequest;
import com.architecture.memory.diagrammer.dto.layout.EdgeRequest;
import com.architecture.memory.diagrammer.dto.layout.LayeredLayoutRequest;
import com.architecture.memory.diagrammer.dto.layout.LayoutResponse;
import com.architecture.memory.diagrammer.dto.layout.RelayoutRequest;
import com.architecture.memory.diagrammer.exception.CellNotFoundException;
import com.architecture.memory.diagrammer.exception.DiagramNotFoundException;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.model.diagram.Point;
import com.architecture.memory.diagrammer.repository.DiagramRepository;
import com.architecture.memory.diagrammer.service.layout.arrange.ArrangementConfig;
import com.architecture.memory.diagrammer.service.layout.arrange.ArrangementService;
import com.architecture.memory.diagrammer.service.layout.arrange.PortDistributor;
import com.architecture.memory.diagrammer.service.layout.layered.EdgeDefinition;
import com.architecture.memory.diagrammer.service.layout.layered.LayeredLayoutEngine;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutDirection;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutEngineConfig;
import com.architecture.memory.diagrammer.service.layout.optimize.EdgeOptimizationOptions;
import com.architecture.memory.diagrammer.service.layout.optimize.EdgePathOptimizer;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapPair;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapResolver;
import com.architecture.memory.diagrammer.service.layout.polish.CellAlignment;
import com.architecture.memory.diagrammer.service.layout.polish.DiagramAlignmentService;
import com.architecture.memory.diagrammer.service.layout.polish.DiagramPolishService;
import com.architecture.memory.diagrammer.service.layout.polish.PolishReport;
import com.architecture.memory.diagrammer.service.layout.routing.OrthogonalEdgeRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Diagram lifecycle plus the layout operations exposed over REST. Every operation runs
 * under a per-diagram lock, so concurrent requests against the same diagram are applied
 * one after another while different diagrams proceed in parallel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagramService {

    private final DiagramRepository diagramRepository;
    private final LayeredLayoutEngine layoutEngine;
    private final OverlapResolver overlapResolver;
    private final OrthogonalEdgeRouter edgeRouter;
    private final EdgePathOptimizer pathOptimizer;
    private final PortDistributor portDistributor;
    private final ArrangementService arrangementService;
    private final DiagramAlignmentService alignmentService;
    private final DiagramPolishService polishService;
    private final LayoutEngineConfig layoutDefaults;
    private final ArrangementConfig arrangementDefaults;

    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    // ========================= DIAGRAMS =========================

    public Diagram createDiagram(CreateDiagramRequest request) {
        Diagram diagram = new Diagram(request.getName());
        if (request.getGridSize() != null) {
            diagram.setGridSize(request.getGridSize());
        }
        if (request.getPageWidth() != null) {
            diagram.setPageWidth(request.getPageWidth());
        }
        if (request.getPageHeight() != null) {
            diagram.setPageHeight(request.getPageHeight());
        }
        Diagram saved = diagramRepository.save(diagram);
        log.info("Created diagram {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Snapshot of the diagram, copied under its lock so serialization never sees a half-applied
     * operation.
     */
    public Diagram getDiagram(String id) {
        Object lock = lockFor(id);
        synchronized (lock) {
            return require(id, lock).copy();
        }
    }

    public List<DiagramSummary> listDiagrams() {
        List<DiagramSummary> summaries = new ArrayList<>();
        for (Diagram d : diagramRepository.findAll()) {
            Object lock = lockFor(d.getId());
            synchronized (lock) {
                if (!diagramRepository.existsById(d.getId())) {
                    locks.remove(d.getId(), lock);
                    continue;
                }
                summaries.add(DiagramSummary.builder()
                        .id(d.getId())
                        .name(d.getName())
                        .shapeCount(d.getVertices().size())
                        .connectorCount(d.getConnectors().size())
                        .build());
            }
        }
        return summaries;
    }

    /**
     * Waits for any operation in flight on the diagram, then removes it.
     */
    public void deleteDiagram(String id) {
        Object lock = lockFor(id);
        synchronized (lock) {
            try {
                if (!diagramRepository.existsById(id)) {
                    throw new DiagramNotFoundException("Diagram not found with id: " + id);
                }
                diagramRepository.deleteById(id);
            } finally {
                locks.remove(id, lock);
            }
        }
        log.info("Deleted diagram {}", id);
    }

    public String addVertex(String diagramId, AddVertexRequest request) {
        return withDiagram(diagramId, diagram -> {
            if (request.getParent() != null && !Diagram.isTopLevelParent(request.getParent())) {
                requireShape(diagram, request.getParent());
            }
            return diagram.addVertex(request.getLabel(), request.getX(), request.getY(),
                    request.getWidth() != null ? request.getWidth() : layoutDefaults.getDefaultWidth(),
                    request.getHeight() != null ? request.getHeight() : layoutDefaults.getDefaultHeight(),
                    request.getStyle(), request.getParent());
        });
    }

    public String addEdge(String diagramId, AddEdgeRequest request) {
        return withDiagram(diagramId, diagram -> {
            requireShape(diagram, request.getSource());
            requireShape(diagram, request.getTarget());
            return diagram.addEdge(request.getSource(), request.getTarget(), request.getLabel(), request.getStyle());
        });
    }

    // ========================= LAYERED LAYOUT =========================

    public LayoutResponse layered(String diagramId, LayeredLayoutRequest request) {
        LayoutDirection direction = LayoutDirection.fromString(request.getDirection());
        List<EdgeDefinition> edges = new ArrayList<>();
        for (EdgeRequest edge : request.getEdges()) {
            edges.add(new EdgeDefinition(edge.getSource(), edge.getTarget(),
                    edge.getLabel() != null ? edge.getLabel() : ""));
        }

        return withDiagram(diagramId, diagram -> {
            LayoutEngineConfig config = engineConfig(diagram, request.getRankSpacing(),
                    request.getNodeSpacing(), request.getRouteEdges());
            Map<String, String> cellIds = layoutEngine.layout(diagram, edges, request.getNodeStyles(),
                    request.getEdgeStyle(), config, direction);
            return response(diagram, "layered", cellIds.size())
                    .cellIds(cellIds)
                    .build();
        });
    }

    public LayoutResponse relayout(String diagramId, RelayoutRequest request) {
        LayoutDirection direction = LayoutDirection.fromString(request.getDirection());
        return withDiagram(diagramId, diagram -> {
            LayoutEngineConfig config = engineConfig(diagram, request.getRankSpacing(),
                    request.getNodeSpacing(), request.getRouteEdges());
            Map<String, Point> positions = layoutEngine.relayout(diagram, direction, config);
            return response(diagram, "relayout", positions.size())
                    .positions(positions)
                    .build();
        });
    }

    // ========================= OVERLAPS / CONNECTORS =========================

    public LayoutResponse findOverlaps(String diagramId, double margin) {
        return withDiagram(diagramId, diagram -> {
            List<OverlapPair> overlaps = overlapResolver.findOverlaps(diagram, margin);
            return response(diagram, "find-overlaps", overlaps.size())
                    .overlaps(overlaps)
                    .build();
        });
    }

    public LayoutResponse resolveOverlaps(String diagramId, double margin, int maxIterations) {
        return withDiagram(diagramId, diagram ->
                response(diagram, "resolve-overlaps", overlapResolver.resolveOverlaps(diagram, margin, maxIterations))
                        .build());
    }

    public LayoutResponse routeConnectors(String diagramId, double margin) {
        return withDiagram(diagramId, diagram ->
                response(diagram, "route", edgeRouter.routeAll(diagram, margin, layoutDefaults.getMaxRouteExpansions()))
                        .build());
    }

    public LayoutResponse optimizeConnectors(String diagramId, EdgeOptimizationOptions options) {
        return withDiagram(diagramId, diagram ->
                response(diagram, "optimize", pathOptimizer.optimize(diagram, options)).build());
    }

    public LayoutResponse distributePorts(String diagramId) {
        return withDiagram(diagramId, diagram ->
                response(diagram, "distribute-ports", portDistributor.applyDistributedPorts(diagram)).build());
    }

    // ========================= ARRANGEMENTS =========================

    public LayoutResponse arrange(String diagramId, String mode, ArrangeRequest request) {
        String normalized = mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
        if ("tree".equals(normalized)) {
            return arrangeTree(diagramId, request);
        }
        if (request.getLabels() == null || request.getLabels().isEmpty()) {
            throw new IllegalArgumentException("labels are required for a " + normalized + " arrangement");
        }

        return withDiagram(diagramId, diagram -> {
            ArrangementConfig config = arrangementConfig(diagram, request);
            List<String> ids;
            switch (normalized) {
                case "row":
                    ids = arrangementService.row(diagram, request.getLabels(), request.getStyle(), config, null);
                    break;
                case "column":
                    ids = arrangementService.column(diagram, request.getLabels(), request.getStyle(), config, null);
                    break;
                case "grid":
                    int columns = request.getColumns() != null
                            ? request.getColumns()
                            : Math.max(1, (int) Math.ceil(Math.sqrt(request.getLabels().size())));
                    ids = arrangementService.grid(diagram, request.getLabels(), columns, request.getStyle(), config);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown arrangement: " + mode);
            }
            List<String> created = new ArrayList<>(ids);
            if (request.isConnect()) {
                created.addAll(arrangementService.connectChain(diagram, ids, request.getEdgeStyle(), null));
            }
            return response(diagram, "arrange-" + normalized, ids.size())
                    .createdIds(created)
                    .build();
        });
    }

    private LayoutResponse arrangeTree(String diagramId, ArrangeRequest request) {
        if (request.getRoot() == null || request.getRoot().isBlank()) {
            throw new IllegalArgumentException("root is required for a tree arrangement");
        }
        Map<String, List<String>> adjacency = request.getAdjacency() != null
                ? request.getAdjacency()
                : Collections.emptyMap();
        LayoutDirection direction = LayoutDirection.fromString(request.getDirection());

        return withDiagram(diagramId, diagram -> {
            Map<String, String> cellIds = arrangementService.tree(diagram, adjacency, request.getRoot(),
                    request.getStyle(), request.getEdgeStyle(), arrangementConfig(diagram, request), direction);
            return response(diagram, "arrange-tree", cellIds.size())
                    .cellIds(cellIds)
                    .build();
        });
    }

    // ========================= ALIGNMENT =========================

    public LayoutResponse compact(String diagramId, double margin) {
        return withDiagram(diagramId, diagram ->
                response(diagram, "compact", alignmentService.compact(diagram, margin)).build());
    }

    public LayoutResponse align(String diagramId, AlignRequest request) {
        CellAlignment alignment = CellAlignment.fromString(request.getAlignment());
        return withDiagram(diagramId, diagram ->
                response(diagram, "align", alignmentService.alignCells(diagram, request.getCellIds(), alignment))
                        .build());
    }

    public LayoutResponse distribute(String diagramId, DistributeRequest request) {
        boolean horizontal = isHorizontal(request.getDirection());
        return withDiagram(diagramId, diagram ->
                response(diagram, "distribute", alignmentService.distributeCells(diagram, request.getCellIds(), horizontal))
                        .build());
    }

    public LayoutResponse fitContainer(String diagramId, String containerId, double padding) {
        return withDiagram(diagramId, diagram -> {
            DiagramCell container = requireShape(diagram, containerId);
            double[] size = alignmentService.fitContainer(diagram, container, padding);
            return response(diagram, "fit-container", 1)
                    .width(size[0])
                    .height(size[1])
                    .build();
        });
    }

    public LayoutResponse polish(String diagramId, String direction) {
        LayoutDirection layoutDirection = LayoutDirection.fromString(direction);
        return withDiagram(diagramId, diagram -> {
            PolishReport report = polishService.polish(diagram, layoutDirection, layoutDefaults);
            return response(diagram, "polish", report.getRelaidOut())
                    .report(report)
                    .build();
        });
    }

    // ========================= HELPERS =========================

    /**
     * Runs {@code action} on the stored diagram under its lock. The lookup happens inside the
     * lock, so an operation queued behind a delete fails instead of saving the diagram back.
     */
    private <T> T withDiagram(String diagramId, Function<Diagram, T> action) {
        Object lock = lockFor(diagramId);
        synchronized (lock) {
            Diagram diagram = require(diagramId, lock);
            T result = action.apply(diagram);
            diagramRepository.save(diagram);
            return result;
        }
    }

    private Object lockFor(String diagramId) {
        return locks.computeIfAbsent(diagramId, k -> new Object());
    }

    // Caller holds lock
    private Diagram require(String diagramId, Object lock) {
        Optional<Diagram> diagram = diagramRepository.findById(diagramId);
        if (diagram.isEmpty()) {
            locks.remove(diagramId, lock);
            throw new DiagramNotFoundException("Diagram not found with id: " + diagramId);
        }
        return diagram.get();
    }

    private DiagramCell requireShape(Diagram diagram, String cellId) {
        return diagram.findCell(cellId)
                .filter(DiagramCell::isVertex)
                .orElseThrow(() -> new CellNotFoundException(
                        "Shape not found with id: " + cellId + " in diagram " + diagram.getId()));
    }

    private LayoutEngineConfig engineConfig(Diagram diagram, Double rankSpacing, Double nodeSpacing,
                                            Boolean routeEdges) {
        LayoutEngineConfig.LayoutEngineConfigBuilder builder = layoutDefaults.toBuilder()
                .gridSize(diagram.getGridSize());
        if (rankSpacing != null) {
            builder.rankSpacing(rankSpacing);
        }
        if (nodeSpacing != null) {
            builder.nodeSpacing(nodeSpacing);
        }
        if (routeEdges != null) {
            builder.routeEdges(routeEdges);
        }
        return builder.build();
    }

    private ArrangementConfig arrangementConfig(Diagram diagram, ArrangeRequest request) {
        ArrangementConfig.ArrangementConfigBuilder builder = arrangementDefaults.toBuilder()
                .gridSize(diagram.getGridSize());
        if (request.getStartX() != null) {
            builder.startX(request.getStartX());
        }
        if (request.getStartY() != null) {
            builder.startY(request.getStartY());
        }
        return builder.build();
    }

    private boolean isHorizontal(String direction) {
        if (direction == null || direction.isBlank()) {
            return true;
        }
        switch (direction.trim().toLowerCase(Locale.ROOT)) {
            case "horizontal":
            case "h":
                return true;
            case "vertical":
            case "v":
                return false;
            default:
                throw new IllegalArgumentException("Unknown distribution direction: " + direction);
        }
    }

    private LayoutResponse.LayoutResponseBuilder response(Diagram diagram, String operation, int affected) {
        log.info("Diagram {}: {} affected {}", diagram.getId(), operation, affected);
        return LayoutResponse.builder()
                .diagramId(diagram.getId())
                .operation(operation)
                .affected(affected);
    }
}
