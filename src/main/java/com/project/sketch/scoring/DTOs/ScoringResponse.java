package com.project.sketch.scoring.DTOs;

/**
 * Result of scoring one sketch. Image fields are PNG data URIs
 * ({@code data:image/png;base64,...}).
 */
public record ScoringResponse(
        double score,
        String difficulty,
        ScoreBreakdown breakdown,
        ScoreDetails details,
        boolean referenceSubstituted,
        String heatmap,
        String sideBySide,
        String overlay,
        String normalizedReference,
        String normalizedSubmission,
        String submissionUrl
) {}
