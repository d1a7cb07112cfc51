package com.architecture.memory.diagrammer.service.layout.arrange;

import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.service.layout.geometry.Bounds;
import com.architecture.memory.diagrammer.service.layout.geometry.DiagramBoundsResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PortDistributorTest {

    private final PortDistributor portDistributor = new PortDistributor(new DiagramBoundsResolver());

    private final Bounds origin = new Bounds(0, 0, 100, 60);

    @Test
    void chooseBestPortsFollowsDominantAxis() {
        PortAssignment right = portDistributor.chooseBestPorts(origin, new Bounds(400, 20, 100, 60), "auto");
        assertThat(right).isEqualTo(new PortAssignment(new PortPosition(1.0, 0.5), new PortPosition(0.0, 0.5)));

        PortAssignment up = portDistributor.chooseBestPorts(origin, new Bounds(0, -300, 100, 60), null);
        assertThat(up).isEqualTo(new PortAssignment(new PortPosition(0.5, 0.0), new PortPosition(0.5, 1.0)));
    }

    @Test
    void chooseBestPortsPrefersVerticalOnDiagonalTie() {
        PortAssignment diagonal = portDistributor.chooseBestPorts(origin, new Bounds(200, 200, 100, 60), "auto");

        assertThat(diagonal.exit()).isEqualTo(PortSide.BOTTOM.center());
        assertThat(diagonal.entry()).isEqualTo(PortSide.TOP.center());
    }

    @Test
    void chooseBestPortsHonoursForcedDirection() {
        PortAssignment forced = portDistributor.chooseBestPorts(origin, new Bounds(-50, 400, 100, 60), "Horizontal");

        assertThat(forced.exit()).isEqualTo(PortSide.LEFT.center());
        assertThat(forced.entry()).isEqualTo(PortSide.RIGHT.center());
    }

    @Test
    void chooseBestPortsRejectsUnknownDirection() {
        assertThatThrownBy(() -> portDistributor.chooseBestPorts(origin, origin, "diagonal"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("diagonal");
    }

    @Test
    void siblingsOnOneSideAreSpreadInFarEndOrder() {
        Map<String, Bounds> bounds = Map.of(
                "source", new Bounds(0, 200, 100, 60),
                "top", new Bounds(400, 0, 100, 60),
                "middle", new Bounds(400, 200, 100, 60),
                "bottom", new Bounds(400, 400, 100, 60));
        List<Connection> connections = List.of(
                new Connection("source", "bottom"),
                new Connection("source", "top"),
                new Connection("source", "middle"));

        List<PortAssignment> assignments = portDistributor.distributePortsForBatch(connections, bounds);

        assertThat(assignments).hasSize(3);
        assertThat(assignments).allSatisfy(a -> {
            assertThat(a.exit().x()).isEqualTo(1.0);
            assertThat(a.entry()).isEqualTo(PortSide.LEFT.center());
        });
        assertThat(assignments.get(1).exit().y()).isCloseTo(0.15, within(1e-9));
        assertThat(assignments.get(2).exit().y()).isCloseTo(0.5, within(1e-9));
        assertThat(assignments.get(0).exit().y()).isCloseTo(0.85, within(1e-9));
    }

    @Test
    void unknownEndpointsFallBackToRightToLeft() {
        List<PortAssignment> assignments = portDistributor.distributePortsForBatch(
                List.of(new Connection("a", "b")), Map.of());

        assertThat(assignments).containsExactly(new PortAssignment(PortSide.RIGHT.center(), PortSide.LEFT.center()));
        assertThat(portDistributor.distributePortsForBatch(List.of(), Map.of())).isEmpty();
    }

    @Test
    void applyDistributedPortsWritesExitAndEntryFractions() {
        Diagram diagram = new Diagram();
        String hub = diagram.addVertex("Hub", 200, 0, 100, 60, null);
        String left = diagram.addVertex("Left", 0, 300, 100, 60, null);
        String right = diagram.addVertex("Right", 400, 300, 100, 60, null);
        String toLeft = diagram.addEdge(hub, left, "", null);
        String toRight = diagram.addEdge(hub, right, "", null);
        diagram.addEdge(hub, "missing", "", null);

        int updated = portDistributor.applyDistributedPorts(diagram);

        assertThat(updated).isEqualTo(2);
        DiagramCell first = diagram.findCell(toLeft).orElseThrow();
        DiagramCell second = diagram.findCell(toRight).orElseThrow();
        assertThat(first.getExitY()).isEqualTo(1.0);
        assertThat(first.getExitX()).isCloseTo(0.15, within(1e-9));
        assertThat(second.getExitX()).isCloseTo(0.85, within(1e-9));
        assertThat(first.getEntryX()).isEqualTo(0.5);
        assertThat(first.getEntryY()).isEqualTo(0.0);
    }
}
