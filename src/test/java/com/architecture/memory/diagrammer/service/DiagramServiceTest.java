package com.architecture.memory.diagrammer.service;

import com.architecture.memory.diagrammer.dto.diagram.AddEdgeRequest;
import com.architecture.memory.diagrammer.dto.diagram.AddVertexRequest;
import com.architecture.memory.diagrammer.dto.diagram.CreateDiagramRequest;
import com.architecture.memory.diagrammer.dto.diagram.DiagramSummary;
import com.architecture.memory.diagrammer.dto.layout.ArrangeRequest;
import com.architecture.memory.diagrammer.dto.layout.DistributeRequest;
import com.architecture.memory.diagrammer.dto.layout.EdgeRequest;
import com.architecture.memory.diagrammer.dto.layout.LayeredLayoutRequest;
import com.architecture.memory.diagrammer.dto.layout.LayoutResponse;
import com.architecture.memory.diagrammer.exception.CellNotFoundException;
import com.architecture.memory.diagrammer.exception.DiagramNotFoundException;
import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.repository.DiagramRepository;
import com.architecture.memory.diagrammer.service.layout.arrange.ArrangementConfig;
import com.architecture.memory.diagrammer.service.layout.arrange.ArrangementService;
import com.architecture.memory.diagrammer.service.layout.arrange.PortDistributor;
import com.architecture.memory.diagrammer.service.layout.layered.EdgeDefinition;
import com.architecture.memory.diagrammer.service.layout.layered.LayeredLayoutEngine;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutDirection;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutEngineConfig;
import com.architecture.memory.diagrammer.service.layout.optimize.EdgePathOptimizer;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapResolver;
import com.architecture.memory.diagrammer.service.layout.polish.DiagramAlignmentService;
import com.architecture.memory.diagrammer.service.layout.polish.DiagramPolishService;
import com.architecture.memory.diagrammer.service.layout.polish.PolishReport;
import com.architecture.memory.diagrammer.service.layout.routing.OrthogonalEdgeRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiagramServiceTest {

    @Mock
    private DiagramRepository diagramRepository;

    @Mock
    private LayeredLayoutEngine layoutEngine;

    @Mock
    private OverlapResolver overlapResolver;

    @Mock
    private OrthogonalEdgeRouter edgeRouter;

    @Mock
    private EdgePathOptimizer pathOptimizer;

    @Mock
    private PortDistributor portDistributor;

    @Mock
    private DiagramPolishService polishService;

    private final LayoutEngineConfig layoutDefaults = LayoutEngineConfig.builder().maxRouteExpansions(5000).build();

    private DiagramService diagramService;

    private Diagram diagram;

    @BeforeEach
    void setUp() {
        ArrangementService arrangementService = new ArrangementService();
        diagramService = new DiagramService(diagramRepository, layoutEngine, overlapResolver, edgeRouter,
                pathOptimizer, portDistributor, arrangementService, new DiagramAlignmentService(arrangementService),
                polishService, layoutDefaults, ArrangementConfig.builder().build());
        diagram = new Diagram("Orders");
    }

    private void stored() {
        when(diagramRepository.findById(diagram.getId())).thenReturn(Optional.of(diagram));
    }

    private CellGeometry geometry(String id) {
        return diagram.findCell(id).orElseThrow().getGeometry();
    }

    // ========================= DIAGRAMS =========================

    @Test
    void createDiagramAppliesGridAndPageSettings() {
        when(diagramRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        Diagram created = diagramService.createDiagram(CreateDiagramRequest.builder()
                .name("Payments")
                .gridSize(20)
                .pageWidth(1000)
                .build());

        assertThat(created.getName()).isEqualTo("Payments");
        assertThat(created.getGridSize()).isEqualTo(20);
        assertThat(created.getPageWidth()).isEqualTo(1000);
        assertThat(created.getPageHeight()).isEqualTo(1169);
        verify(diagramRepository).save(created);
    }

    @Test
    void getDiagramThrowsWhenMissing() {
        when(diagramRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> diagramService.getDiagram("nope"))
                .isInstanceOf(DiagramNotFoundException.class)
                .hasMessage("Diagram not found with id: nope");
    }

    @Test
    void listDiagramsCountsShapesAndConnectors() {
        String a = diagram.addVertex("A", 0, 0, 100, 60, null);
        String b = diagram.addVertex("B", 200, 0, 100, 60, null);
        diagram.addEdge(a, b, "", null);
        when(diagramRepository.findAll()).thenReturn(List.of(diagram));
        when(diagramRepository.existsById(diagram.getId())).thenReturn(true);

        List<DiagramSummary> summaries = diagramService.listDiagrams();

        assertThat(summaries).hasSize(1);
        assertThat(summaries.get(0).getName()).isEqualTo("Orders");
        assertThat(summaries.get(0).getShapeCount()).isEqualTo(2);
        assertThat(summaries.get(0).getConnectorCount()).isEqualTo(1);
    }

    @Test
    void listDiagramsSkipsDiagramsDeletedMeanwhile() {
        when(diagramRepository.findAll()).thenReturn(List.of(diagram));
        when(diagramRepository.existsById(diagram.getId())).thenReturn(false);

        assertThat(diagramService.listDiagrams()).isEmpty();
    }

    @Test
    void getDiagramReturnsADetachedSnapshot() {
        String a = diagram.addVertex("A", 10, 20, 100, 60, null);
        stored();

        Diagram snapshot = diagramService.getDiagram(diagram.getId());
        snapshot.findCell(a).orElseThrow().getGeometry().setX(500);
        snapshot.addVertex("B", 0, 0, 100, 60, null);

        assertThat(snapshot.getId()).isEqualTo(diagram.getId());
        assertThat(geometry(a).getX()).isEqualTo(10);
        assertThat(diagram.getVertices()).hasSize(1);
        assertThat(diagram.nextCellId()).isEqualTo("3");
    }

    @Test
    void deleteDiagramRejectsUnknownId() {
        when(diagramRepository.existsById("nope")).thenReturn(false);

        assertThatThrownBy(() -> diagramService.deleteDiagram("nope"))
                .isInstanceOf(DiagramNotFoundException.class);
        verify(diagramRepository, never()).deleteById(any());
    }

    @Test
    void addVertexFallsBackToDefaultSize() {
        stored();

        String id = diagramService.addVertex(diagram.getId(), AddVertexRequest.builder()
                .label("Gateway").x(40.0).y(80.0).build());

        assertThat(geometry(id).getWidth()).isEqualTo(120.0);
        assertThat(geometry(id).getHeight()).isEqualTo(60.0);
        verify(diagramRepository).save(diagram);
    }

    @Test
    void addVertexRejectsUnknownContainer() {
        stored();

        assertThatThrownBy(() -> diagramService.addVertex(diagram.getId(), AddVertexRequest.builder()
                .label("Child").x(0.0).y(0.0).parent("42").build()))
                .isInstanceOf(CellNotFoundException.class)
                .hasMessageContaining("42");
    }

    @Test
    void addEdgeRequiresBothShapes() {
        stored();
        String a = diagram.addVertex("A", 0, 0, 100, 60, null);

        assertThatThrownBy(() -> diagramService.addEdge(diagram.getId(), AddEdgeRequest.builder()
                .source(a).target("missing").build()))
                .isInstanceOf(CellNotFoundException.class)
                .hasMessageContaining("Shape not found with id: missing");
        assertThat(diagram.getConnectors()).isEmpty();
    }

    // ========================= LAYOUT =========================

    @Test
    @SuppressWarnings("unchecked")
    void layeredPassesEdgesAndRequestOverrides() {
        stored();
        diagram.setGridSize(20);
        when(layoutEngine.layout(eq(diagram), anyList(), isNull(), isNull(), any(), eq(LayoutDirection.LR)))
                .thenReturn(Map.of("A", "2", "B", "3"));

        LayoutResponse response = diagramService.layered(diagram.getId(), LayeredLayoutRequest.builder()
                .edges(List.of(EdgeRequest.builder().source("A").target("B").build()))
                .direction("left-to-right")
                .rankSpacing(150.0)
                .routeEdges(false)
                .build());

        assertThat(response.getOperation()).isEqualTo("layered");
        assertThat(response.getAffected()).isEqualTo(2);
        assertThat(response.getCellIds()).containsEntry("A", "2");

        ArgumentCaptor<List<EdgeDefinition>> edges = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<LayoutEngineConfig> config = ArgumentCaptor.forClass(LayoutEngineConfig.class);
        verify(layoutEngine).layout(eq(diagram), edges.capture(), isNull(), isNull(), config.capture(),
                eq(LayoutDirection.LR));
        assertThat(edges.getValue()).containsExactly(new EdgeDefinition("A", "B", ""));
        assertThat(config.getValue().getRankSpacing()).isEqualTo(150.0);
        assertThat(config.getValue().getNodeSpacing()).isEqualTo(layoutDefaults.getNodeSpacing());
        assertThat(config.getValue().getGridSize()).isEqualTo(20);
        assertThat(config.getValue().isRouteEdges()).isFalse();
    }

    @Test
    void layeredRejectsUnknownDirectionBeforeTouchingTheDiagram() {
        LayeredLayoutRequest request = LayeredLayoutRequest.builder()
                .edges(List.of(EdgeRequest.builder().source("A").target("B").build()))
                .direction("sideways")
                .build();

        assertThatThrownBy(() -> diagramService.layered("any", request))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(diagramRepository, layoutEngine);
    }

    @Test
    void routeConnectorsUsesConfiguredExpansionCap() {
        stored();
        when(edgeRouter.routeAll(diagram, 25.0, 5000)).thenReturn(4);

        LayoutResponse response = diagramService.routeConnectors(diagram.getId(), 25);

        assertThat(response.getAffected()).isEqualTo(4);
        assertThat(response.getOperation()).isEqualTo("route");
    }

    @Test
    void polishReportsRelaidShapes() {
        stored();
        PolishReport report = PolishReport.builder().relaidOut(3).edgesRouted(2).build();
        when(polishService.polish(diagram, LayoutDirection.LR, layoutDefaults)).thenReturn(report);

        LayoutResponse response = diagramService.polish(diagram.getId(), "LR");

        assertThat(response.getAffected()).isEqualTo(3);
        assertThat(response.getReport()).isSameAs(report);
    }

    // ========================= ARRANGEMENTS =========================

    @Test
    void gridArrangementDefaultsToSquareColumnsAndCanConnect() {
        stored();

        LayoutResponse response = diagramService.arrange(diagram.getId(), "Grid", ArrangeRequest.builder()
                .labels(List.of("A", "B", "C", "D", "E"))
                .startX(100.0)
                .connect(true)
                .build());

        assertThat(response.getOperation()).isEqualTo("arrange-grid");
        assertThat(response.getAffected()).isEqualTo(5);
        assertThat(response.getCreatedIds()).hasSize(9);
        // Five labels give three columns, so D starts the second row
        String d = response.getCreatedIds().get(3);
        assertThat(geometry(d).getX()).isEqualTo(100.0);
        assertThat(geometry(d).getY()).isEqualTo(170.0);
        assertThat(diagram.getConnectors()).hasSize(4);
    }

    @Test
    void unknownArrangementIsRejected() {
        stored();

        assertThatThrownBy(() -> diagramService.arrange(diagram.getId(), "spiral",
                ArrangeRequest.builder().labels(List.of("A")).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spiral");
    }

    @Test
    void treeArrangementNeedsRoot() {
        assertThatThrownBy(() -> diagramService.arrange("any", "tree",
                ArrangeRequest.builder().adjacency(Map.of("A", List.of("B"))).build()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(diagramRepository);
    }

    @Test
    void treeArrangementReturnsCellIdsByLabel() {
        stored();

        LayoutResponse response = diagramService.arrange(diagram.getId(), "tree", ArrangeRequest.builder()
                .adjacency(Map.of("Root", List.of("Left", "Right")))
                .root("Root")
                .build());

        assertThat(response.getCellIds()).containsOnlyKeys("Root", "Left", "Right");
        assertThat(response.getAffected()).isEqualTo(3);
    }

    // ========================= ALIGNMENT =========================

    @Test
    void distributeRejectsUnknownDirection() {
        assertThatThrownBy(() -> diagramService.distribute("any", DistributeRequest.builder()
                .cellIds(List.of("2", "3"))
                .direction("diagonal")
                .build()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(diagramRepository);
    }

    @Test
    void distributeVertically() {
        stored();
        String a = diagram.addVertex("A", 0, 0, 40, 40, null);
        String b = diagram.addVertex("B", 0, 50, 40, 40, null);
        String c = diagram.addVertex("C", 0, 300, 40, 40, null);

        LayoutResponse response = diagramService.distribute(diagram.getId(), DistributeRequest.builder()
                .cellIds(List.of(a, b, c))
                .direction("v")
                .build());

        assertThat(response.getAffected()).isEqualTo(3);
        assertThat(geometry(b).getY()).isEqualTo(150.0);
    }

    @Test
    void fitContainerReportsNewSize() {
        stored();
        String group = diagram.addVertex("Group", 0, 0, 100, 100, "swimlane;startSize=30;");
        diagram.addVertex("Child", 20, 50, 100, 60, null, group);

        LayoutResponse response = diagramService.fitContainer(diagram.getId(), group, 20);

        assertThat(response.getWidth()).isEqualTo(140.0);
        assertThat(response.getHeight()).isEqualTo(130.0);
    }

    @Test
    void fitContainerRequiresExistingShape() {
        stored();

        assertThatThrownBy(() -> diagramService.fitContainer(diagram.getId(), "missing", 20))
                .isInstanceOf(CellNotFoundException.class);
    }
}
