package com.project.sketch.scoring.engine;

/** Share of each component in the raw composite. The three shares sum to 1. */
public record ScoringWeights(double contour, double keypoints, double local) {
    private static final double EPSILON = 1e-9;

    public ScoringWeights {
        if (contour < 0 || keypoints < 0 || local < 0) {
            throw new IllegalArgumentException("Weights must not be negative");
        }
        if (Math.abs(contour + keypoints + local - 1.0) > EPSILON) {
            throw new IllegalArgumentException(
                    "Weights must sum to 1.0 but were " + contour + " + " + keypoints + " + " + local);
        }
    }

    public double sum() {
        return contour + keypoints + local;
    }
}
