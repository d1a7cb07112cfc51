package com.architecture.memory.diagrammer.service.layout.polish;

import com.architecture.memory.diagrammer.model.diagram.CellGeometry;
import com.architecture.memory.diagrammer.model.diagram.Diagram;
import com.architecture.memory.diagrammer.model.diagram.DiagramCell;
import com.architecture.memory.diagrammer.service.layout.arrange.ArrangementService;
import com.architecture.memory.diagrammer.service.layout.geometry.GridSnapper;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.ToDoubleFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whitespace and alignment clean-ups over the top-level shapes of a placed diagram.
 * Nested shapes move with their containers and are never touched directly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagramAlignmentService {

    public static final double DEFAULT_GROUPING_THRESHOLD = 20;

    // Shifts at or below this are not worth a move
    private static final double MIN_SHIFT = 5;

    private static final double DEFAULT_HEADER_HEIGHT = 23;
    private static final Pattern START_SIZE = Pattern.compile("startSize=(\\d+)");

    private final ArrangementService arrangementService;

    // ========================= COMPACTION =========================

    /**
     * Closes the gaps between rows (shapes whose tops lie within 20px), then between the
     * shapes of each row, leaving {@code margin} between neighbors, and finally aligns row
     * baselines and column centers.
     *
     * @return number of distinct shapes whose position changed
     */
    public int compact(Diagram diagram, double margin) {
        List<DiagramCell> cells = topLevelShapes(diagram);
        if (cells.size() < 2) {
            return 0;
        }
        Map<String, double[]> before = positions(cells);
        int grid = diagram.getGridSize();

        List<DiagramCell> byTop = new ArrayList<>(cells);
        byTop.sort(Comparator.comparingDouble(c -> c.getGeometry().getY()));
        List<List<DiagramCell>> rows = groupByProximity(byTop, c -> c.getGeometry().getY(), DEFAULT_GROUPING_THRESHOLD);

        double currentY = byTop.get(0).getGeometry().getY();
        for (List<DiagramCell> row : rows) {
            double rowTop = row.stream().mapToDouble(c -> c.getGeometry().getY()).min().orElse(currentY);
            double rowBottom = row.stream()
                    .mapToDouble(c -> c.getGeometry().getY() + c.getGeometry().getHeight()).max().orElse(currentY);
            double shift = currentY - rowTop;
            if (Math.abs(shift) > MIN_SHIFT) {
                for (DiagramCell cell : row) {
                    cell.getGeometry().setY(GridSnapper.snap(cell.getGeometry().getY() + shift, grid));
                }
            }
            currentY += (rowBottom - rowTop) + margin;
        }

        for (List<DiagramCell> row : rows) {
            if (row.size() < 2) {
                continue;
            }
            List<DiagramCell> byLeft = new ArrayList<>(row);
            byLeft.sort(Comparator.comparingDouble(c -> c.getGeometry().getX()));
            double currentX = byLeft.get(0).getGeometry().getX();
            for (DiagramCell cell : byLeft) {
                CellGeometry g = cell.getGeometry();
                if (Math.abs(currentX - g.getX()) > MIN_SHIFT) {
                    g.setX(GridSnapper.snap(currentX, grid));
                }
                currentX = g.getX() + g.getWidth() + margin;
            }
        }

        alignRankBaselines(diagram, DEFAULT_GROUPING_THRESHOLD);
        alignColumnCenters(diagram, DEFAULT_GROUPING_THRESHOLD);

        int moved = countMoved(cells, before);
        log.info("Compacted diagram {}: {} shapes moved", diagram.getId(), moved);
        return moved;
    }

    // ========================= ALIGNMENT =========================

    /**
     * Shapes whose vertical centers lie within {@code threshold} of their neighbor in
     * center order form a row and are aligned on the row's mean center.
     *
     * @return number of shapes adjusted
     */
    public int alignRankBaselines(Diagram diagram, double threshold) {
        List<DiagramCell> cells = topLevelShapes(diagram);
        if (cells.size() < 2) {
            return 0;
        }
        ToDoubleFunction<DiagramCell> centerY = c -> c.getGeometry().getY() + c.getGeometry().getHeight() / 2;
        cells.sort(Comparator.comparingDouble(centerY));

        int adjusted = 0;
        for (List<DiagramCell> row : groupByProximity(cells, centerY, threshold)) {
            if (row.size() < 2) {
                continue;
            }
            double mean = row.stream().mapToDouble(centerY).average().orElse(0);
            for (DiagramCell cell : row) {
                CellGeometry g = cell.getGeometry();
                double targetY = GridSnapper.snap(mean - g.getHeight() / 2, diagram.getGridSize());
                if (Math.abs(g.getY() - targetY) > 1) {
                    g.setY(targetY);
                    adjusted++;
                }
            }
        }
        log.debug("Aligned {} shapes on row baselines", adjusted);
        return adjusted;
    }

    /**
     * Column counterpart of {@link #alignRankBaselines(Diagram, double)} on horizontal centers.
     */
    public int alignColumnCenters(Diagram diagram, double threshold) {
        List<DiagramCell> cells = topLevelShapes(diagram);
        if (cells.size() < 2) {
            return 0;
        }
        ToDoubleFunction<DiagramCell> centerX = c -> c.getGeometry().getX() + c.getGeometry().getWidth() / 2;
        cells.sort(Comparator.comparingDouble(centerX));

        int adjusted = 0;
        for (List<DiagramCell> column : groupByProximity(cells, centerX, threshold)) {
            if (column.size() < 2) {
                continue;
            }
            double mean = column.stream().mapToDouble(centerX).average().orElse(0);
            for (DiagramCell cell : column) {
                CellGeometry g = cell.getGeometry();
                double targetX = GridSnapper.snap(mean - g.getWidth() / 2, diagram.getGridSize());
                if (Math.abs(g.getX() - targetX) > 1) {
                    g.setX(targetX);
                    adjusted++;
                }
            }
        }
        log.debug("Aligned {} shapes on column centers", adjusted);
        return adjusted;
    }

    /**
     * Grows shapes sharing a row (TB/BT) to the row's tallest height, or shapes sharing a
     * column (LR/RL) to the column's widest width. Shapes never shrink.
     *
     * @return number of shapes resized
     */
    public int equalizeConnectedSizes(Diagram diagram, LayoutDirection direction, double threshold) {
        List<DiagramCell> cells = topLevelShapes(diagram);
        if (cells.size() < 2) {
            return 0;
        }
        boolean vertical = direction.isVertical();
        ToDoubleFunction<DiagramCell> center = vertical
                ? c -> c.getGeometry().getY() + c.getGeometry().getHeight() / 2
                : c -> c.getGeometry().getX() + c.getGeometry().getWidth() / 2;
        cells.sort(Comparator.comparingDouble(center));

        int adjusted = 0;
        for (List<DiagramCell> group : groupByProximity(cells, center, threshold)) {
            if (group.size() < 2) {
                continue;
            }
            if (vertical) {
                double maxHeight = group.stream().mapToDouble(c -> c.getGeometry().getHeight()).max().orElse(0);
                for (DiagramCell cell : group) {
                    if (cell.getGeometry().getHeight() < maxHeight) {
                        cell.getGeometry().setHeight(maxHeight);
                        adjusted++;
                    }
                }
            } else {
                double maxWidth = group.stream().mapToDouble(c -> c.getGeometry().getWidth()).max().orElse(0);
                for (DiagramCell cell : group) {
                    if (cell.getGeometry().getWidth() < maxWidth) {
                        cell.getGeometry().setWidth(maxWidth);
                        adjusted++;
                    }
                }
            }
        }
        log.debug("Equalized {} shape sizes ({})", adjusted, direction);
        return adjusted;
    }

    // ========================= SELECTED SHAPES =========================

    /**
     * Aligns the given shapes on their common left/right/top/bottom edge or on their mean
     * center line. Unknown ids and connectors are ignored.
     *
     * @return number of shapes aligned, 0 when fewer than two qualify
     */
    public int alignCells(Diagram diagram, List<String> cellIds, CellAlignment alignment) {
        List<DiagramCell> cells = selectShapes(diagram, cellIds);
        if (cells.size() < 2) {
            return 0;
        }
        int grid = diagram.getGridSize();
        switch (alignment) {
            case LEFT: {
                double left = cells.stream().mapToDouble(c -> c.getGeometry().getX()).min().orElse(0);
                cells.forEach(c -> c.getGeometry().setX(left));
                break;
            }
            case CENTER: {
                double center = cells.stream()
                        .mapToDouble(c -> c.getGeometry().getX() + c.getGeometry().getWidth() / 2).average().orElse(0);
                cells.forEach(c -> c.getGeometry().setX(GridSnapper.snap(center - c.getGeometry().getWidth() / 2, grid)));
                break;
            }
            case RIGHT: {
                double right = cells.stream()
                        .mapToDouble(c -> c.getGeometry().getX() + c.getGeometry().getWidth()).max().orElse(0);
                cells.forEach(c -> c.getGeometry().setX(GridSnapper.snap(right - c.getGeometry().getWidth(), grid)));
                break;
            }
            case TOP: {
                double top = cells.stream().mapToDouble(c -> c.getGeometry().getY()).min().orElse(0);
                cells.forEach(c -> c.getGeometry().setY(top));
                break;
            }
            case MIDDLE: {
                double middle = cells.stream()
                        .mapToDouble(c -> c.getGeometry().getY() + c.getGeometry().getHeight() / 2).average().orElse(0);
                cells.forEach(c -> c.getGeometry().setY(GridSnapper.snap(middle - c.getGeometry().getHeight() / 2, grid)));
                break;
            }
            default: {
                double bottom = cells.stream()
                        .mapToDouble(c -> c.getGeometry().getY() + c.getGeometry().getHeight()).max().orElse(0);
                cells.forEach(c -> c.getGeometry().setY(GridSnapper.snap(bottom - c.getGeometry().getHeight(), grid)));
            }
        }
        log.info("Aligned {} shapes to {}", cells.size(), alignment);
        return cells.size();
    }

    /**
     * Spreads the given shapes with equal gaps between the first one's start and the last
     * one's end, along x when {@code horizontal}, otherwise along y.
     *
     * @return number of shapes distributed, 0 when fewer than two qualify
     */
    public int distributeCells(Diagram diagram, List<String> cellIds, boolean horizontal) {
        List<DiagramCell> cells = selectShapes(diagram, cellIds);
        if (cells.size() < 2) {
            return 0;
        }
        ToDoubleFunction<DiagramCell> position = horizontal ? c -> c.getGeometry().getX() : c -> c.getGeometry().getY();
        ToDoubleFunction<DiagramCell> size = horizontal ? c -> c.getGeometry().getWidth() : c -> c.getGeometry().getHeight();
        cells.sort(Comparator.comparingDouble(position));

        double start = position.applyAsDouble(cells.get(0));
        DiagramCell last = cells.get(cells.size() - 1);
        double end = position.applyAsDouble(last) + size.applyAsDouble(last);
        List<Double> sizes = new ArrayList<>();
        cells.forEach(c -> sizes.add(size.applyAsDouble(c)));
        List<Double> positions = arrangementService.distributeEvenly(sizes, start, end);

        for (int i = 0; i < cells.size(); i++) {
            double snapped = GridSnapper.snap(positions.get(i), diagram.getGridSize());
            if (horizontal) {
                cells.get(i).getGeometry().setX(snapped);
            } else {
                cells.get(i).getGeometry().setY(snapped);
            }
        }
        log.info("Distributed {} shapes {}", cells.size(), horizontal ? "horizontally" : "vertically");
        return cells.size();
    }

    /**
     * Resizes a container around its direct children, keeping {@code padding} on every side
     * and leaving room for the header ({@code startSize} style key, 23px by default).
     * Children sitting too close to the top-left are shifted in first.
     *
     * @return the new container size as {width, height}
     */
    public double[] fitContainer(Diagram diagram, DiagramCell container, double padding) {
        List<DiagramCell> children = new ArrayList<>();
        for (DiagramCell cell : diagram.getVertices()) {
            if (container.getId().equals(cell.getParent()) && !cell.getId().equals(container.getId())) {
                children.add(cell);
            }
        }
        if (children.isEmpty()) {
            return new double[]{container.getGeometry().getWidth(), container.getGeometry().getHeight()};
        }

        double header = headerHeight(container.getStyle());
        double[] extent = extent(children);
        if (extent[0] < padding) {
            double shift = padding - extent[0];
            children.forEach(c -> c.getGeometry().setX(c.getGeometry().getX() + shift));
            extent[2] += shift;
        }
        if (extent[1] < header + padding) {
            double shift = header + padding - extent[1];
            children.forEach(c -> c.getGeometry().setY(c.getGeometry().getY() + shift));
            extent[3] += shift;
        }

        double width = GridSnapper.snap(extent[2] + padding, diagram.getGridSize());
        double height = GridSnapper.snap(extent[3] + padding, diagram.getGridSize());
        container.getGeometry().setWidth(width);
        container.getGeometry().setHeight(height);
        log.info("Resized container {} to {}x{}", container.getId(), width, height);
        return new double[]{width, height};
    }

    private double headerHeight(String style) {
        if (style != null) {
            Matcher matcher = START_SIZE.matcher(style);
            if (matcher.find()) {
                return Double.parseDouble(matcher.group(1));
            }
        }
        return DEFAULT_HEADER_HEIGHT;
    }

    private List<DiagramCell> selectShapes(Diagram diagram, List<String> cellIds) {
        List<DiagramCell> cells = new ArrayList<>();
        for (String id : cellIds) {
            diagram.findCell(id)
                    .filter(c -> c.isVertex() && c.getGeometry() != null && !c.getGeometry().isRelative())
                    .ifPresent(cells::add);
        }
        return cells;
    }

    // ========================= PAGE PLACEMENT =========================

    /**
     * Moves the content so its bounding box is centered on the page, never closer than
     * {@code margin} to the page origin. Without a page the content goes to (margin, margin).
     *
     * @return number of shapes moved
     */
    public int centerOnPage(Diagram diagram, double margin) {
        List<DiagramCell> cells = topLevelShapes(diagram);
        if (cells.isEmpty()) {
            return 0;
        }
        double[] extent = extent(cells);
        double contentWidth = extent[2] - extent[0];
        double contentHeight = extent[3] - extent[1];

        double targetX = margin;
        double targetY = margin;
        if (diagram.isPage() && diagram.getPageWidth() > 0 && diagram.getPageHeight() > 0) {
            targetX = Math.max(margin, (diagram.getPageWidth() - contentWidth) / 2);
            targetY = Math.max(margin, (diagram.getPageHeight() - contentHeight) / 2);
        }

        double shiftX = targetX - extent[0];
        double shiftY = targetY - extent[1];
        if (Math.abs(shiftX) < MIN_SHIFT && Math.abs(shiftY) < MIN_SHIFT) {
            return 0;
        }
        shiftAll(cells, shiftX, shiftY, diagram.getGridSize());
        log.info("Centered diagram {} on the page: {} shapes shifted by ({}, {})",
                diagram.getId(), cells.size(), shiftX, shiftY);
        return cells.size();
    }

    /**
     * Shifts the content right/down until its top-left corner is at least {@code margin}
     * from the page origin. Content already clear of the margin is left alone.
     *
     * @return number of shapes moved
     */
    public int ensurePageMargins(Diagram diagram, double margin) {
        List<DiagramCell> cells = topLevelShapes(diagram);
        if (cells.isEmpty()) {
            return 0;
        }
        double[] extent = extent(cells);
        double shiftX = Math.max(0.0, margin - extent[0]);
        double shiftY = Math.max(0.0, margin - extent[1]);
        if (shiftX < 1 && shiftY < 1) {
            return 0;
        }
        shiftAll(cells, shiftX, shiftY, diagram.getGridSize());
        return cells.size();
    }

    // ========================= HELPERS =========================

    private List<DiagramCell> topLevelShapes(Diagram diagram) {
        List<DiagramCell> cells = new ArrayList<>();
        for (DiagramCell cell : diagram.getVertices()) {
            if (Diagram.isTopLevelParent(cell.getParent())) {
                cells.add(cell);
            }
        }
        return cells;
    }

    /**
     * Splits an already sorted list wherever two consecutive keys differ by more than
     * {@code threshold}.
     */
    private List<List<DiagramCell>> groupByProximity(List<DiagramCell> sorted, ToDoubleFunction<DiagramCell> key,
                                                     double threshold) {
        List<List<DiagramCell>> groups = new ArrayList<>();
        List<DiagramCell> current = new ArrayList<>();
        double last = 0;
        for (DiagramCell cell : sorted) {
            double value = key.applyAsDouble(cell);
            if (!current.isEmpty() && Math.abs(value - last) > threshold) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(cell);
            last = value;
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    // minX, minY, maxX, maxY
    private double[] extent(List<DiagramCell> cells) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (DiagramCell cell : cells) {
            CellGeometry g = cell.getGeometry();
            minX = Math.min(minX, g.getX());
            minY = Math.min(minY, g.getY());
            maxX = Math.max(maxX, g.getX() + g.getWidth());
            maxY = Math.max(maxY, g.getY() + g.getHeight());
        }
        return new double[]{minX, minY, maxX, maxY};
    }

    private void shiftAll(List<DiagramCell> cells, double shiftX, double shiftY, int grid) {
        for (DiagramCell cell : cells) {
            CellGeometry g = cell.getGeometry();
            g.setX(GridSnapper.snap(g.getX() + shiftX, grid));
            g.setY(GridSnapper.snap(g.getY() + shiftY, grid));
        }
    }

    private Map<String, double[]> positions(List<DiagramCell> cells) {
        Map<String, double[]> positions = new HashMap<>();
        for (DiagramCell cell : cells) {
            positions.put(cell.getId(), new double[]{cell.getGeometry().getX(), cell.getGeometry().getY()});
        }
        return positions;
    }

    private int countMoved(List<DiagramCell> cells, Map<String, double[]> before) {
        int moved = 0;
        for (DiagramCell cell : cells) {
            double[] original = before.get(cell.getId());
            if (original[0] != cell.getGeometry().getX() || original[1] != cell.getGeometry().getY()) {
                moved++;
            }
        }
        return moved;
    }
}
