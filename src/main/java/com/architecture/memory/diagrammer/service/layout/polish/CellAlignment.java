package com.architecture.memory.diagrammer.service.layout.polish;

import java.util.Locale;

/**
 * Edge or center line a set of shapes is aligned on.
 */
public enum CellAlignment {
    LEFT,
    CENTER,
    RIGHT,
    TOP,
    MIDDLE,
    BOTTOM;

    public static CellAlignment fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alignment is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alignment: " + value, e);
        }
    }
}
