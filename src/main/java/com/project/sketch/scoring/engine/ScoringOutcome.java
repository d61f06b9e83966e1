package com.project.sketch.scoring.engine;

import com.project.sketch.scoring.DTOs.ScoreBreakdown;
import com.project.sketch.scoring.DTOs.ScoreDetails;

import java.awt.image.BufferedImage;

/**
 * Everything one scoring run produces. The images are fresh buffers owned by the caller.
 */
public record ScoringOutcome(
        Difficulty difficulty,
        ScoreBreakdown breakdown,
        ScoreDetails details,
        BufferedImage normalizedReference,
        BufferedImage normalizedSubmission,
        BufferedImage heatmap,
        BufferedImage sideBySide,
        BufferedImage overlay
) {
    public double score() {
        return breakdown.compositeScore();
    }
}
