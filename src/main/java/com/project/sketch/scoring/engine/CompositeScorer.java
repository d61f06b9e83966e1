package com.project.sketch.scoring.engine;

import com.project.sketch.scoring.DTOs.ScoreBreakdown;

/**
 * Difficulty-weighted combination of the component scores, scaled by the ink penalties.
 */
public final class CompositeScorer {

    private CompositeScorer() {}

    /** Final composite in [0,1]. */
    public static double composite(Difficulty difficulty, double contour, double keypoints, double local,
                                   double inkPenalty, double spatialPenalty) {
        ScoringWeights w = difficulty.weights();
        double raw = w.contour() * contour + w.keypoints() * keypoints + w.local() * local;
        return clamp01(raw * inkPenalty * spatialPenalty);
    }

    public static ScoreBreakdown breakdown(Difficulty difficulty, double contour, double keypoints, double local,
                                           double inkPenalty, double spatialPenalty) {
        double composite = composite(difficulty, contour, keypoints, local, inkPenalty, spatialPenalty);
        return new ScoreBreakdown(
                toPercentage(contour),
                toPercentage(keypoints),
                toPercentage(local),
                toPercentage(composite)
        );
    }

    /** Fraction to percentage rounded to two decimals. */
    public static double toPercentage(double fraction) {
        return Math.round(clamp01(fraction) * 100 * 100) / 100.0;
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
