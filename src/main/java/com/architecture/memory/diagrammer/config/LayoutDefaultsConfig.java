package com.architecture.memory.diagrammer.config;

import com.architecture.memory.diagrammer.service.layout.arrange.ArrangementConfig;
import com.architecture.memory.diagrammer.service.layout.layered.LayoutEngineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-wide layout defaults.
 * Reads spacing, sizes and iteration caps from application.yml properties.
 */
@Configuration
@Slf4j
public class LayoutDefaultsConfig {

    @Value("${layout.engine.rank-spacing:100}")
    private double rankSpacing;

    @Value("${layout.engine.node-spacing:60}")
    private double nodeSpacing;

    @Value("${layout.engine.default-width:120}")
    private double defaultWidth;

    @Value("${layout.engine.default-height:60}")
    private double defaultHeight;

    @Value("${layout.engine.grid-size:10}")
    private int gridSize;

    @Value("${layout.engine.max-overlap-iterations:50}")
    private int maxOverlapIterations;

    @Value("${layout.engine.overlap-padding:20}")
    private double overlapPadding;

    @Value("${layout.engine.barycenter-iterations:4}")
    private int barycenterIterations;

    @Value("${layout.engine.edge-margin:15}")
    private double edgeMargin;

    @Value("${layout.engine.route-edges:true}")
    private boolean routeEdges;

    @Value("${layout.engine.max-route-expansions:20000}")
    private int maxRouteExpansions;

    @Value("${layout.engine.start-x:50}")
    private double startX;

    @Value("${layout.engine.start-y:80}")
    private double startY;

    @Value("${layout.arrange.horizontal-spacing:60}")
    private double horizontalSpacing;

    @Value("${layout.arrange.vertical-spacing:60}")
    private double verticalSpacing;

    /**
     * Defaults for the layered engine. Requests override single fields through
     * {@code toBuilder()}.
     */
    @Bean
    public LayoutEngineConfig layoutEngineConfig() {
        log.info("[Layout Config] rankSpacing={}, nodeSpacing={}, gridSize={}, routeEdges={}",
                rankSpacing, nodeSpacing, gridSize, routeEdges);

        return LayoutEngineConfig.builder()
                .rankSpacing(rankSpacing)
                .nodeSpacing(nodeSpacing)
                .defaultWidth(defaultWidth)
                .defaultHeight(defaultHeight)
                .gridSize(gridSize)
                .maxOverlapIterations(maxOverlapIterations)
                .overlapPadding(overlapPadding)
                .barycenterIterations(barycenterIterations)
                .edgeMargin(edgeMargin)
                .routeEdges(routeEdges)
                .maxRouteExpansions(maxRouteExpansions)
                .startX(startX)
                .startY(startY)
                .build();
    }

    @Bean
    public ArrangementConfig arrangementConfig() {
        return ArrangementConfig.builder()
                .horizontalSpacing(horizontalSpacing)
                .verticalSpacing(verticalSpacing)
                .defaultWidth(defaultWidth)
                .defaultHeight(defaultHeight)
                .gridSize(gridSize)
                .build();
    }
}
