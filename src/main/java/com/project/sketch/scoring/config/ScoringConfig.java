package com.project.sketch.scoring.config;

import com.project.sketch.scoring.engine.EdgeExtractor;
import com.project.sketch.scoring.engine.OpenCvEdgeExtractor;
import com.project.sketch.scoring.engine.ScoringEngine;
import com.project.sketch.scoring.engine.ScoringSettings;
import com.project.sketch.scoring.engine.SobelEdgeExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the scoring pipeline from {@code app.scoring.*}. Defaults are the values every instance
 * should run with; override them only cluster-wide.
 */
@Configuration
public class ScoringConfig {
    private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

    @Bean
    public ScoringSettings scoringSettings(
            @Value("${app.scoring.canonical-size:512}") int canonicalSize,
            @Value("${app.scoring.edge-threshold:30}") double edgeThreshold,
            @Value("${app.scoring.contour-tolerance:3}") int contourTolerance,
            @Value("${app.scoring.keypoint-stride:3}") int keypointStride,
            @Value("${app.scoring.keypoint-max:200}") int keypointMax,
            @Value("${app.scoring.keypoint-response-threshold:1000}") double keypointResponseThreshold,
            @Value("${app.scoring.keypoint-tolerance-ratio:0.05}") double keypointToleranceRatio,
            @Value("${app.scoring.keypoint-empty-score:0.5}") double keypointEmptyScore,
            @Value("${app.scoring.ssim-patch-size:16}") int ssimPatchSize,
            @Value("${app.scoring.spatial-patch-size:32}") int spatialPatchSize,
            @Value("${app.scoring.ink-threshold:200}") int inkThreshold,
            @Value("${app.scoring.side-by-side-gutter:20}") int sideBySideGutter,
            @Value("${app.scoring.overlay-opacity:0.5}") float overlayOpacity) {
        ScoringSettings settings = new ScoringSettings(
                canonicalSize, edgeThreshold, contourTolerance, keypointStride, keypointMax,
                keypointResponseThreshold, keypointToleranceRatio, keypointEmptyScore,
                ssimPatchSize, spatialPatchSize, inkThreshold, sideBySideGutter, overlayOpacity);
        log.info("Scoring settings: {}", settings);
        return settings;
    }

    @Bean
    public EdgeExtractor edgeExtractor(@Value("${app.scoring.edge-backend:java}") String backend) {
        if ("opencv".equalsIgnoreCase(backend)) {
            if (OpenCvEdgeExtractor.isAvailable()) {
                log.info("Using OpenCV edge backend");
                return new OpenCvEdgeExtractor();
            }
            log.error("Edge backend 'opencv' requested but OpenCV is unavailable, using the Java Sobel backend");
        } else if (!"java".equalsIgnoreCase(backend)) {
            throw new IllegalArgumentException("Unknown app.scoring.edge-backend: " + backend);
        }
        return new SobelEdgeExtractor();
    }

    @Bean
    public ScoringEngine scoringEngine(ScoringSettings settings, EdgeExtractor edgeExtractor) {
        return new ScoringEngine(settings, edgeExtractor);
    }
}
