package com.architecture.memory.diagrammer.service.layout.geometry;

/**
 * Axis-aligned bounding box in absolute diagram coordinates.
 * Used both for shapes and for the obstacles routing has to avoid.
 */
public record Bounds(double x, double y, double width, double height) {

    public Bounds {
        width = Math.max(0, width);
        height = Math.max(0, height);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    /**
     * Grow the box by {@code margin} on every side.
     */
    public Bounds expand(double margin) {
        return new Bounds(x - margin, y - margin, width + 2 * margin, height + 2 * margin);
    }

    /**
     * Two boxes overlap when they share interior area once {@code margin} of required gap
     * is added. Boxes that exactly touch (after the margin) do not overlap.
     */
    public boolean intersects(Bounds other, double margin) {
        return !(right() + margin <= other.x
                || other.right() + margin <= x
                || bottom() + margin <= other.y
                || other.bottom() + margin <= y);
    }

    /**
     * Strict interior test: points on the border are outside.
     */
    public boolean interiorContains(double px, double py) {
        return x < px && px < right() && y < py && py < bottom();
    }
}
