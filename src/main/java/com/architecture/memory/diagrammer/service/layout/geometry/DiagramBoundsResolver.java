package com.architecture.memory.diagrammer.service.layout.geometry;

import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves absolute bounding boxes for vertices, adding up the offsets of every
 * enclosing container. Parent chains are walked iteratively and a repeated id ends
 * the walk, so a malformed (cyclic) parent chain cannot loop.
 */
@Component
public class DiagramBoundsResolver {

    /**
     * Absolute bounds of every vertex, keyed by cell id in document order.
     */
    public Map<String, Bounds> resolveAll(Diagram diagram) {
        Map<String, DiagramCell> vertices = indexVertices(diagram);
        Map<String, Bounds> bounds = new LinkedHashMap<>();
        for (DiagramCell cell : vertices.values()) {
            double[] origin = absoluteOrigin(cell, vertices);
            CellGeometry g = cell.getGeometry();
            bounds.put(cell.getId(), new Bounds(origin[0], origin[1], g.getWidth(), g.getHeight()));
        }
        return bounds;
    }

    /**
     * Ids of every container enclosing {@code cellId}, nearest first.
     */
    public Set<String> ancestorsOf(Diagram diagram, String cellId) {
        Map<String, DiagramCell> vertices = indexVertices(diagram);
        Set<String> ancestors = new LinkedHashSet<>();
        DiagramCell current = vertices.get(cellId);
        while (current != null && !Diagram.isTopLevelParent(current.getParent())) {
            String parentId = current.getParent();
            if (!ancestors.add(parentId) || parentId.equals(cellId)) {
                break;
            }
            current = vertices.get(parentId);
        }
        return ancestors;
    }

    private Map<String, DiagramCell> indexVertices(Diagram diagram) {
        Map<String, DiagramCell> vertices = new LinkedHashMap<>();
        for (DiagramCell cell : diagram.getVertices()) {
            vertices.put(cell.getId(), cell);
        }
        return vertices;
    }

    private double[] absoluteOrigin(DiagramCell cell, Map<String, DiagramCell> vertices) {
        double x = cell.getGeometry().getX();
        double y = cell.getGeometry().getY();
        Set<String> seen = new HashSet<>();
        seen.add(cell.getId());

        String parentId = cell.getParent();
        while (!Diagram.isTopLevelParent(parentId) && seen.add(parentId)) {
            DiagramCell parent = vertices.get(parentId);
            if (parent == null) {
                break;
            }
            x += parent.getGeometry().getX();
            y += parent.getGeometry().getY();
            parentId = parent.getParent();
        }
        return new double[]{x, y};
    }
}
