package com.project.sketch.scoring.DTOs;

/** Component scores of one submission, each a percentage in [0,100] with two decimals. */
public record ScoreBreakdown(
        double contourScore,
        double keypointScore,
        double localSimilarityScore,
        double compositeScore
) {}
