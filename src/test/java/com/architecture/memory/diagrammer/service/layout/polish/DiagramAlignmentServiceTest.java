package com.architecture.memory.diagrammer.service.layout.polish;

import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.service.layout.arrange.ArrangementService;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagramAlignmentServiceTest {

    private final DiagramAlignmentService alignmentService = new DiagramAlignmentService(new ArrangementService());

    private static CellGeometry geometry(Diagram diagram, String id) {
        return diagram.findCell(id).orElseThrow().getGeometry();
    }

    @Test
    void compactClosesRowAndColumnGaps() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 50, 50, 100, 60, null);
        String b = diagram.addVertex("B", 300, 50, 100, 60, null);
        String c = diagram.addVertex("C", 50, 500, 100, 60, null);
        String child = diagram.addVertex("Child", 10, 10, 40, 20, null, a);

        int moved = alignmentService.compact(diagram, 40);

        assertThat(moved).isEqualTo(2);
        assertThat(geometry(diagram, a).getX()).isEqualTo(50.0);
        assertThat(geometry(diagram, a).getY()).isEqualTo(50.0);
        assertThat(geometry(diagram, b).getX()).isEqualTo(190.0);
        assertThat(geometry(diagram, c).getY()).isEqualTo(150.0);
        assertThat(geometry(diagram, child).getX()).isEqualTo(10.0);
        assertThat(geometry(diagram, child).getY()).isEqualTo(10.0);
    }

    @Test
    void compactLeavesSingleShapeAlone() {
        Diagram diagram = new Diagram();
        diagram.addVertex("A", 500, 500, 100, 60, null);

        assertThat(alignmentService.compact(diagram, 40)).isZero();
    }

    @Test
    void alignRankBaselinesMovesNearbyCentersOntoTheirMean() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 0, 100, 100, 60, null);
        String b = diagram.addVertex("B", 200, 112, 100, 60, null);
        String far = diagram.addVertex("Far", 400, 400, 100, 60, null);

        int adjusted = alignmentService.alignRankBaselines(diagram, 20);

        assertThat(adjusted).isEqualTo(2);
        assertThat(geometry(diagram, a).getY()).isEqualTo(110.0);
        assertThat(geometry(diagram, b).getY()).isEqualTo(110.0);
        assertThat(geometry(diagram, far).getY()).isEqualTo(400.0);
    }

    @Test
    void alignColumnCentersUsesHorizontalCenters() {
        Diagram diagram = new Diagram();
        String top = diagram.addVertex("Top", 100, 0, 120, 60, null);
        String bottom = diagram.addVertex("Bottom", 120, 200, 80, 60, null);

        int adjusted = alignmentService.alignColumnCenters(diagram, 20);

        assertThat(adjusted).isZero();
        assertThat(geometry(diagram, top).getX() + 60).isEqualTo(geometry(diagram, bottom).getX() + 40);
    }

    @Test
    void equalizeGrowsShapesInTheSameRank() {
        Diagram diagram = new Diagram();
        String small = diagram.addVertex("Small", 0, 100, 100, 60, null);
        String tall = diagram.addVertex("Tall", 200, 100, 100, 80, null);
        String wide = diagram.addVertex("Wide", 0, 400, 200, 60, null);

        int adjusted = alignmentService.equalizeConnectedSizes(diagram, LayoutDirection.TB, 20);

        assertThat(adjusted).isEqualTo(1);
        assertThat(geometry(diagram, small).getHeight()).isEqualTo(80.0);
        assertThat(geometry(diagram, tall).getHeight()).isEqualTo(80.0);
        assertThat(geometry(diagram, wide).getHeight()).isEqualTo(60.0);
    }

    @Test
    void equalizeInHorizontalFlowUsesWidths() {
        Diagram diagram = new Diagram();
        String narrow = diagram.addVertex("Narrow", 100, 0, 100, 60, null);
        String wide = diagram.addVertex("Wide", 90, 200, 120, 60, null);

        int adjusted = alignmentService.equalizeConnectedSizes(diagram, LayoutDirection.LR, 20);

        assertThat(adjusted).isEqualTo(1);
        assertThat(geometry(diagram, narrow).getWidth()).isEqualTo(120.0);
        assertThat(geometry(diagram, wide).getWidth()).isEqualTo(120.0);
    }

    @Test
    void alignCellsOnLeftEdgeIgnoresUnknownIds() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 30, 0, 100, 60, null);
        String b = diagram.addVertex("B", 80, 100, 60, 60, null);

        int aligned = alignmentService.alignCells(diagram, List.of(a, b, "missing"), CellAlignment.LEFT);

        assertThat(aligned).isEqualTo(2);
        assertThat(geometry(diagram, b).getX()).isEqualTo(30.0);
    }

    @Test
    void alignCellsOnCenterLine() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 0, 0, 100, 60, null);
        String b = diagram.addVertex("B", 200, 100, 60, 40, null);

        alignmentService.alignCells(diagram, List.of(a, b), CellAlignment.CENTER);

        assertThat(geometry(diagram, a).getX()).isEqualTo(90.0);
        assertThat(geometry(diagram, b).getX()).isEqualTo(110.0);
    }

    @Test
    void alignCellsNeedsTwoShapes() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 0, 0, 100, 60, null);

        assertThat(alignmentService.alignCells(diagram, List.of(a), CellAlignment.BOTTOM)).isZero();
    }

    @Test
    void distributeCellsSpacesGapsEvenly() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 0, 0, 40, 40, null);
        String c = diagram.addVertex("C", 300, 0, 40, 40, null);
        String b = diagram.addVertex("B", 50, 0, 40, 40, null);

        int distributed = alignmentService.distributeCells(diagram, List.of(a, c, b), true);

        assertThat(distributed).isEqualTo(3);
        assertThat(geometry(diagram, a).getX()).isEqualTo(0.0);
        assertThat(geometry(diagram, b).getX()).isEqualTo(150.0);
        assertThat(geometry(diagram, c).getX()).isEqualTo(300.0);
    }

    @Test
    void fitContainerWrapsChildrenBelowHeader() {
        Diagram diagram = new Diagram();
        String container = diagram.addVertex("Group", 0, 0, 100, 100, "swimlane;startSize=30;");
        String first = diagram.addVertex("First", 5, 40, 50, 50, null, container);
        String second = diagram.addVertex("Second", 60, 100, 80, 40, null, container);

        double[] size = alignmentService.fitContainer(diagram, diagram.findCell(container).orElseThrow(), 20);

        assertThat(size).containsExactly(180.0, 170.0);
        assertThat(geometry(diagram, container).getWidth()).isEqualTo(180.0);
        assertThat(geometry(diagram, container).getHeight()).isEqualTo(170.0);
        assertThat(geometry(diagram, first).getX()).isEqualTo(20.0);
        assertThat(geometry(diagram, first).getY()).isEqualTo(50.0);
        assertThat(geometry(diagram, second).getY()).isEqualTo(110.0);
    }

    @Test
    void fitContainerWithoutChildrenKeepsSize() {
        Diagram diagram = new Diagram();
        String container = diagram.addVertex("Empty", 0, 0, 160, 90, null);

        assertThat(alignmentService.fitContainer(diagram, diagram.findCell(container).orElseThrow(), 20))
                .containsExactly(160.0, 90.0);
    }

    @Test
    void centerOnPageCentersContent() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 0, 0, 100, 100, null);

        int moved = alignmentService.centerOnPage(diagram, 50);

        assertThat(moved).isEqualTo(1);
        assertThat(geometry(diagram, a).getX()).isEqualTo(360.0);
        assertThat(geometry(diagram, a).getY()).isEqualTo(530.0);
    }

    @Test
    void centerOnPageWithoutPageUsesMargin() {
        Diagram diagram = new Diagram();
        diagram.setPage(false);
        String a = diagram.addVertex("A", 300, 300, 100, 100, null);

        alignmentService.centerOnPage(diagram, 50);

        assertThat(geometry(diagram, a).getX()).isEqualTo(50.0);
        assertThat(geometry(diagram, a).getY()).isEqualTo(50.0);
    }

    @Test
    void ensurePageMarginsShiftsOnlyWhenTooClose() {
        Diagram diagram = new Diagram();
        String a = diagram.addVertex("A", 10, 100, 100, 60, null);

        assertThat(alignmentService.ensurePageMargins(diagram, 40)).isEqualTo(1);
        assertThat(geometry(diagram, a).getX()).isEqualTo(40.0);
        assertThat(geometry(diagram, a).getY()).isEqualTo(100.0);
        assertThat(alignmentService.ensurePageMargins(diagram, 40)).isZero();
    }
}
