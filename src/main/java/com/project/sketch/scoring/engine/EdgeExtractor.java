package com.project.sketch.scoring.engine;

/**
 * Computes a gradient-magnitude edge strength per pixel, clamped to [0,255], with zero on the
 * one-pixel border.
 */
public interface EdgeExtractor {

    double[] strength(GrayscaleBuffer gray);

    default EdgeMap extract(GrayscaleBuffer gray, double threshold) {
        return EdgeMap.threshold(gray.width(), gray.height(), strength(gray), threshold);
    }
}
