package com.architecture.memory.diagrammer.service.layout.arrange;

/**
 * Side of a shape a connector attaches to.
 */
public enum PortSide {
    TOP(0.5, 0.0),
    BOTTOM(0.5, 1.0),
    LEFT(0.0, 0.5),
    RIGHT(1.0, 0.5);

    private final double centerX;
    private final double centerY;

    PortSide(double centerX, double centerY) {
        this.centerX = centerX;
        this.centerY = centerY;
    }

    public boolean isHorizontalEdge() {
        return this == TOP || this == BOTTOM;
    }

    /**
     * Middle of this side, as fractions of the shape size.
     */
    public PortPosition center() {
        return new PortPosition(centerX, centerY);
    }

    /**
     * Position {@code t} (0..1) along this side.
     */
    public PortPosition at(double t) {
        switch (this) {
            case TOP:
                return new PortPosition(t, 0.0);
            case BOTTOM:
                return new PortPosition(t, 1.0);
            case LEFT:
                return new PortPosition(0.0, t);
            default:
                return new PortPosition(1.0, t);
        }
    }
}
