package com.architecture.memory.diagrammer.service.layout.layered;

import java.util.Locale;

/**
 * Primary flow direction of a layered layout.
 */
public enum LayoutDirection {
    TB,
    BT,
    LR,
    RL;

    /**
     * True when ranks stack along the y axis.
     */
    public boolean isVertical() {
        return this == TB || this == BT;
    }

    /**
     * True when rank 0 sits at the far end of the primary axis.
     */
    public boolean isReversed() {
        return this == BT || this == RL;
    }

    /**
     * Parses a direction leniently: case-insensitive, surrounding blanks ignored, and the
     * long forms ("top-to-bottom", "left-to-right", ...) accepted. Null or blank means TB.
     */
    public static LayoutDirection fromString(String value) {
        if (value == null || value.isBlank()) {
            return TB;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        switch (normalized) {
            case "TB":
            case "TOP-TO-BOTTOM":
            case "VERTICAL":
                return TB;
            case "BT":
            case "BOTTOM-TO-TOP":
                return BT;
            case "LR":
            case "LEFT-TO-RIGHT":
            case "HORIZONTAL":
                return LR;
            case "RL":
            case "RIGHT-TO-LEFT":
                return RL;
            default:
                throw new IllegalArgumentException("Unknown layout direction: " + value);
        }
    }
}
