package com.architecture.memory.diagrammer.service.layout.layered;

import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.model.diagram.Point;
import com.architecture.memory.diagrammer.service.layout.geometry.DiagramBoundsResolver;
import com.architecture.memory.diagrammer.service.layout.geometry.GridSnapper;
import com.architecture.memory.diagrammer.service.layout.overlap.OverlapResolver;
import com.architecture.memory.diagrammer.service.layout.routing.OrthogonalEdgeRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LayeredLayoutEngineTest {

    private LayeredLayoutEngine engine;
    private LayoutEngineConfig unrouted;

    @BeforeEach
    void setUp() {
        DiagramBoundsResolver boundsResolver = new DiagramBoundsResolver();
        engine = new LayeredLayoutEngine(new CrossingMinimizer(), new CoordinateAssigner(), new NodeSizeEstimator(),
                new OverlapResolver(boundsResolver), new OrthogonalEdgeRouter(boundsResolver));
        unrouted = LayoutEngineConfig.builder().routeEdges(false).build();
    }

    private static CellGeometry geometry(Diagram diagram, String id) {
        return diagram.findCell(id).orElseThrow().getGeometry();
    }

    @Test
    void fanOutPlacesChildrenOnOneRankInOrder() {
        Diagram diagram = new Diagram();
        List<EdgeDefinition> edges = List.of(
                new EdgeDefinition("A", "B"), new EdgeDefinition("A", "C"), new EdgeDefinition("A", "D"));

        Map<String, String> ids = engine.layout(diagram, edges, null, null, unrouted, LayoutDirection.TB);

        assertThat(ids).containsOnlyKeys("A", "B", "C", "D");
        CellGeometry a = geometry(diagram, ids.get("A"));
        CellGeometry b = geometry(diagram, ids.get("B"));
        CellGeometry c = geometry(diagram, ids.get("C"));
        CellGeometry d = geometry(diagram, ids.get("D"));

        assertThat(b.getY()).isEqualTo(c.getY()).isEqualTo(d.getY()).isGreaterThan(a.getY());
        assertThat(b.getHeight()).isEqualTo(c.getHeight()).isEqualTo(d.getHeight());
        assertThat(b.getX()).isLessThan(c.getX());
        assertThat(c.getX()).isLessThan(d.getX());
        // Parent centered over the middle child
        assertThat(a.getX() + a.getWidth() / 2).isEqualTo(c.getX() + c.getWidth() / 2);
    }

    @Test
    void createsOneConnectorPerEdgeWithLabels() {
        Diagram diagram = new Diagram();
        List<EdgeDefinition> edges = List.of(
                new EdgeDefinition("Client", "Gateway", "https"),
                new EdgeDefinition("Gateway", "Orders", "grpc"),
                new EdgeDefinition("Orders", "Gateway", "reply"));

        Map<String, String> ids = engine.layout(diagram, edges, Map.of("Orders", "shape=cylinder;"),
                "endArrow=block;", unrouted, LayoutDirection.TB);

        List<DiagramCell> connectors = diagram.getConnectors();
        assertThat(connectors).hasSize(3);
        assertThat(connectors).extracting(DiagramCell::getValue).containsExactly("https", "grpc", "reply");
        assertThat(connectors.get(2).getSource()).isEqualTo(ids.get("Orders"));
        assertThat(connectors.get(2).getTarget()).isEqualTo(ids.get("Gateway"));
        assertThat(connectors).allMatch(c -> "endArrow=block;".equals(c.getStyle()));
        assertThat(diagram.findCell(ids.get("Orders")).orElseThrow().getStyle()).isEqualTo("shape=cylinder;");
        assertThat(diagram.findCell(ids.get("Client")).orElseThrow().getStyle()).isEqualTo(Diagram.DEFAULT_VERTEX_STYLE);
    }

    @Test
    void equalizesHeightsWithinRankTopToBottom() {
        Diagram diagram = new Diagram();
        List<EdgeDefinition> edges = List.of(
                new EdgeDefinition("Root", "Tall<br>label<br>with<br>lines"),
                new EdgeDefinition("Root", "Short"));

        Map<String, String> ids = engine.layout(diagram, edges, null, null, unrouted, LayoutDirection.TB);

        CellGeometry tall = geometry(diagram, ids.get("Tall<br>label<br>with<br>lines"));
        CellGeometry shorter = geometry(diagram, ids.get("Short"));
        assertThat(tall.getHeight()).isGreaterThan(60);
        assertThat(shorter.getHeight()).isEqualTo(tall.getHeight());
        assertThat(shorter.getWidth()).isEqualTo(120);
    }

    @Test
    void equalizesWidthsWithinRankLeftToRight() {
        Diagram diagram = new Diagram();
        List<EdgeDefinition> edges = List.of(
                new EdgeDefinition("Root", "A rather long service name"),
                new EdgeDefinition("Root", "Db"));

        Map<String, String> ids = engine.layout(diagram, edges, null, null, unrouted, LayoutDirection.LR);

        CellGeometry wide = geometry(diagram, ids.get("A rather long service name"));
        CellGeometry narrow = geometry(diagram, ids.get("Db"));
        CellGeometry root = geometry(diagram, ids.get("Root"));
        assertThat(wide.getWidth()).isGreaterThan(120);
        assertThat(narrow.getWidth()).isEqualTo(wide.getWidth());
        assertThat(narrow.getX()).isEqualTo(wide.getX()).isGreaterThan(root.getX());
    }

    @Test
    void reversedDirectionsPutRootAtFarEnd() {
        Diagram diagram = new Diagram();
        Map<String, String> ids = engine.layout(diagram, List.of(new EdgeDefinition("A", "B")),
                null, null, unrouted, LayoutDirection.BT);

        assertThat(geometry(diagram, ids.get("A")).getY()).isGreaterThan(geometry(diagram, ids.get("B")).getY());
    }

    @Test
    void everyWrittenCoordinateIsOnGrid() {
        Diagram diagram = new Diagram();
        LayoutEngineConfig config = LayoutEngineConfig.builder()
                .rankSpacing(87)
                .nodeSpacing(43)
                .startX(33)
                .startY(47)
                .build();
        List<EdgeDefinition> edges = List.of(
                new EdgeDefinition("Web", "Auth"), new EdgeDefinition("Web", "Catalog service"),
                new EdgeDefinition("Auth", "Users"), new EdgeDefinition("Catalog service", "Users"),
                new EdgeDefinition("Web", "Users"), new EdgeDefinition("Users", "Web"));

        engine.layout(diagram, edges, null, null, config, LayoutDirection.LR);

        int grid = config.getGridSize();
        for (DiagramCell cell : diagram.getVertices()) {
            CellGeometry g = cell.getGeometry();
            assertThat(GridSnapper.isOnGrid(g.getX(), grid)).as("x of %s", cell.getValue()).isTrue();
            assertThat(GridSnapper.isOnGrid(g.getY(), grid)).as("y of %s", cell.getValue()).isTrue();
            assertThat(GridSnapper.isOnGrid(g.getWidth(), grid)).isTrue();
            assertThat(GridSnapper.isOnGrid(g.getHeight(), grid)).isTrue();
        }
        for (DiagramCell connector : diagram.getConnectors()) {
            for (Point p : connector.getGeometry().getPoints()) {
                assertThat(GridSnapper.isOnGrid(p.getX(), grid)).isTrue();
                assertThat(GridSnapper.isOnGrid(p.getY(), grid)).isTrue();
            }
        }
    }

    @Test
    void emptyEdgeListCreatesNothing() {
        Diagram diagram = new Diagram();

        assertThat(engine.layout(diagram, List.of(), null, null, unrouted, LayoutDirection.TB)).isEmpty();
        assertThat(diagram.getCells()).hasSize(2);
    }

    @Test
    void relayoutRanksExistingShapesFromConnectors() {
        Diagram diagram = new Diagram();
        String c = diagram.addVertex("c", 0, 0, 120, 60, null);
        String a = diagram.addVertex("a", 300, 300, 120, 60, null);
        String b = diagram.addVertex("b", 0, 300, 120, 60, null);
        diagram.addEdge(a, b, "", null);
        diagram.addEdge(b, c, "", null);

        Map<String, Point> moved = engine.relayout(diagram, LayoutDirection.TB, unrouted);

        assertThat(moved).containsOnlyKeys(a, b, c);
        assertThat(geometry(diagram, a).getY()).isLessThan(geometry(diagram, b).getY());
        assertThat(geometry(diagram, b).getY()).isLessThan(geometry(diagram, c).getY());
        assertThat(moved.get(a).getY()).isEqualTo(geometry(diagram, a).getY());
    }

    @Test
    void relayoutLeavesNestedShapesInPlace() {
        Diagram diagram = new Diagram();
        String group = diagram.addVertex("group", 0, 0, 300, 200, null);
        String child = diagram.addVertex("child", 10, 40, 80, 40, null, group);
        String other = diagram.addVertex("other", 500, 500, 120, 60, null);
        diagram.addEdge(group, other, "", null);

        Map<String, Point> moved = engine.relayout(diagram, LayoutDirection.TB, unrouted);

        assertThat(moved).containsOnlyKeys(group, other);
        assertThat(geometry(diagram, child).getX()).isEqualTo(10);
        assertThat(geometry(diagram, child).getY()).isEqualTo(40);
    }

    @Test
    void relayoutWithoutConnectorsFallsBackToGrid() {
        Diagram diagram = new Diagram();
        String s1 = diagram.addVertex("1", 700, 10, 120, 60, null);
        String s2 = diagram.addVertex("2", 5, 900, 120, 60, null);
        String s3 = diagram.addVertex("3", 300, 300, 120, 60, null);
        String s4 = diagram.addVertex("4", 0, 0, 120, 60, null);

        Map<String, Point> moved = engine.relayout(diagram, LayoutDirection.TB, unrouted);

        assertThat(moved).hasSize(4);
        assertThat(moved.get(s1)).isEqualTo(new Point(50, 80));
        assertThat(moved.get(s2)).isEqualTo(new Point(230, 80));
        assertThat(moved.get(s3)).isEqualTo(new Point(50, 240));
        assertThat(moved.get(s4)).isEqualTo(new Point(230, 240));
    }
}
