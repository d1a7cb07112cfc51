package com.architecture.memory.diagrammer.model.diagram;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A single diagram page: an ordered list of cells plus page and grid settings.
 * Cells "0" (root) and "1" (default layer) always exist.
 */
@Data
public class Diagram {

    public static final String ROOT_ID = "0";
    public static final String DEFAULT_LAYER_ID = "1";
    public static final String DEFAULT_VERTEX_STYLE = "rounded=1;whiteSpace=wrap;html=1;";
    public static final String DEFAULT_EDGE_STYLE = "endArrow=classic;html=1;";

    private String id;
    private String name;
    private int gridSize = 10;
    private boolean page = true;
    private int pageWidth = 827;
    private int pageHeight = 1169;
    private List<DiagramCell> cells = new ArrayList<>();

    @JsonIgnore
    private int nextId = 2;

    public Diagram() {
        this("Page-1");
    }

    public Diagram(String name) {
        this.id = UUID.randomUUID().toString();
        this.name = name;
        cells.add(DiagramCell.builder().id(ROOT_ID).parent("").build());
        cells.add(DiagramCell.builder().id(DEFAULT_LAYER_ID).parent(ROOT_ID).build());
    }

    /**
     * Sequential cell id, unique within this diagram.
     */
    public String nextCellId() {
        String cid = String.valueOf(nextId);
        nextId++;
        return cid;
    }

    public String addVertex(String value, double x, double y, double width, double height, String style) {
        return addVertex(value, x, y, width, height, style, DEFAULT_LAYER_ID);
    }

    public String addVertex(String value, double x, double y, double width, double height,
                            String style, String parent) {
        String cid = nextCellId();
        cells.add(DiagramCell.builder()
                .id(cid)
                .value(value == null ? "" : value)
                .style(style == null ? DEFAULT_VERTEX_STYLE : style)
                .parent(parent == null ? DEFAULT_LAYER_ID : parent)
                .vertex(true)
                .geometry(CellGeometry.builder().x(x).y(y).width(width).height(height).build())
                .build());
        return cid;
    }

    public String addEdge(String source, String target, String value, String style) {
        return addEdge(source, target, value, style, null);
    }

    public String addEdge(String source, String target, String value, String style, List<Point> waypoints) {
        String cid = nextCellId();
        CellGeometry geometry = CellGeometry.builder().relative(true).build();
        if (waypoints != null) {
            geometry.getPoints().addAll(waypoints);
        }
        cells.add(DiagramCell.builder()
                .id(cid)
                .value(value == null ? "" : value)
                .style(style == null ? DEFAULT_EDGE_STYLE : style)
                .edge(true)
                .source(source)
                .target(target)
                .geometry(geometry)
                .build());
        return cid;
    }

    public Optional<DiagramCell> findCell(String cellId) {
        return cells.stream().filter(c -> c.getId().equals(cellId)).findFirst();
    }

    /**
     * Vertices with absolute-style geometry, in document order.
     */
    @JsonIgnore
    public List<DiagramCell> getVertices() {
        return cells.stream()
                .filter(c -> c.isVertex() && c.getGeometry() != null && !c.getGeometry().isRelative())
                .collect(Collectors.toList());
    }

    /**
     * Connectors that name both a source and a target, in document order.
     */
    @JsonIgnore
    public List<DiagramCell> getConnectors() {
        return cells.stream()
                .filter(DiagramCell::isConnected)
                .collect(Collectors.toList());
    }

    /**
     * Deep copy with the same id, settings and id sequence.
     */
    public Diagram copy() {
        Diagram copy = new Diagram(name);
        copy.setId(id);
        copy.setGridSize(gridSize);
        copy.setPage(page);
        copy.setPageWidth(pageWidth);
        copy.setPageHeight(pageHeight);
        copy.setNextId(nextId);
        List<DiagramCell> cellCopies = new ArrayList<>();
        for (DiagramCell cell : cells) {
            cellCopies.add(cell.copy());
        }
        copy.setCells(cellCopies);
        return copy;
    }

    public static boolean isTopLevelParent(String parent) {
        return parent == null || parent.isEmpty() || ROOT_ID.equals(parent) || DEFAULT_LAYER_ID.equals(parent);
    }
}
