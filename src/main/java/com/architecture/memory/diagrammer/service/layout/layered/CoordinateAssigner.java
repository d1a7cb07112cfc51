package com.architecture.memory.diagrammer.service.layout.layered;

import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns rank/order into absolute coordinates. The primary (rank) axis is y for TB/BT and
 * x for LR/RL; every rank is centered on the cross axis against the widest rank.
 */
@Component
public class CoordinateAssigner {

    /**
     * Gives all real nodes of a rank the rank's largest height (vertical directions) or
     * width (horizontal directions). Ranks with fewer than two real nodes are left alone.
     */
    public void equalizeRankSizes(LayoutGraph graph, LayoutDirection direction) {
        for (List<LayoutNode> rankNodes : graph.ranks()) {
            List<LayoutNode> real = new ArrayList<>();
            for (LayoutNode node : rankNodes) {
                if (!node.isVirtual()) {
                    real.add(node);
                }
            }
            if (real.size() < 2) {
                continue;
            }
            if (direction.isVertical()) {
                double maxHeight = real.stream().mapToDouble(LayoutNode::getHeight).max().orElse(0);
                real.forEach(n -> n.setHeight(maxHeight));
            } else {
                double maxWidth = real.stream().mapToDouble(LayoutNode::getWidth).max().orElse(0);
                real.forEach(n -> n.setWidth(maxWidth));
            }
        }
    }

    public void assign(LayoutGraph graph, LayoutEngineConfig config, LayoutDirection direction) {
        List<List<LayoutNode>> ranks = graph.orderedRanks();
        int rankCount = ranks.size();
        boolean vertical = direction.isVertical();

        // Primary axis: running offset of each rank
        double[] rankOffset = new double[rankCount];
        double cursor = vertical ? config.getStartY() : config.getStartX();
        for (int step = 0; step < rankCount; step++) {
            int r = direction.isReversed() ? rankCount - 1 - step : step;
            rankOffset[r] = cursor;
            cursor += rankExtent(ranks.get(r), config, vertical) + config.getRankSpacing();
        }

        // Cross axis: consecutive placement, centered against the widest rank
        double[] rankWidth = new double[rankCount];
        double widest = 0;
        for (int r = 0; r < rankCount; r++) {
            rankWidth[r] = crossWidth(ranks.get(r), config, vertical);
            widest = Math.max(widest, rankWidth[r]);
        }

        double crossOrigin = vertical ? config.getStartX() : config.getStartY();
        for (int r = 0; r < rankCount; r++) {
            double crossCursor = crossOrigin + (widest - rankWidth[r]) / 2;
            for (LayoutNode node : ranks.get(r)) {
                if (vertical) {
                    node.setY(rankOffset[r]);
                    node.setX(crossCursor);
                } else {
                    node.setX(rankOffset[r]);
                    node.setY(crossCursor);
                }
                if (!node.isVirtual()) {
                    crossCursor += (vertical ? node.getWidth() : node.getHeight()) + config.getNodeSpacing();
                }
            }
        }
    }

    private double rankExtent(List<LayoutNode> rankNodes, LayoutEngineConfig config, boolean vertical) {
        double extent = 0;
        boolean anyReal = false;
        for (LayoutNode node : rankNodes) {
            if (!node.isVirtual()) {
                anyReal = true;
                extent = Math.max(extent, vertical ? node.getHeight() : node.getWidth());
            }
        }
        if (!anyReal) {
            return vertical ? config.getDefaultHeight() : config.getDefaultWidth();
        }
        return extent;
    }

    private double crossWidth(List<LayoutNode> rankNodes, LayoutEngineConfig config, boolean vertical) {
        double total = 0;
        int realCount = 0;
        for (LayoutNode node : rankNodes) {
            if (!node.isVirtual()) {
                total += vertical ? node.getWidth() : node.getHeight();
                realCount++;
            }
        }
        if (realCount > 1) {
            total += config.getNodeSpacing() * (realCount - 1);
        }
        return total;
    }
}
