package com.architecture.memory.diagrammer.service.layout.layered;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Estimates a shape size that fits a (possibly HTML) label.
 */
@Component
public class NodeSizeEstimator {

    private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    private static final double CHAR_WIDTH = 8;
    private static final double LINE_HEIGHT = 22;
    private static final double MAX_WIDTH = 280;
    private static final double MAX_HEIGHT = 200;

    public record NodeSize(double width, double height) {
    }

    public NodeSize estimate(String label, double defaultWidth, double defaultHeight) {
        String text = label == null ? "" : label;
        text = LINE_BREAK.matcher(text).replaceAll("\n");
        text = TAG.matcher(text).replaceAll("");
        text = text.replace("&amp;", "&").replace("&lt;", "<").replace("&gt;", ">");

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        if (lines.isEmpty()) {
            lines.add(text.isBlank() ? "X" : text.strip());
        }

        int maxChars = 0;
        for (String line : lines) {
            maxChars = Math.max(maxChars, line.length());
        }

        double width = Math.max(defaultWidth, Math.min(MAX_WIDTH, maxChars * CHAR_WIDTH + 20));
        double height = Math.max(defaultHeight, Math.min(MAX_HEIGHT, lines.size() * LINE_HEIGHT + 16));
        return new NodeSize(width, height);
    }
}
