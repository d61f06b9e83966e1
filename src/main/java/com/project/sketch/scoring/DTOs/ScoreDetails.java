package com.project.sketch.scoring.DTOs;

public record ScoreDetails(
        double contourPrecision,
        double contourRecall,
        int referenceEdgePixels,
        int submissionEdgePixels,
        int referenceKeypoints,
        int submissionKeypoints,
        double inkPenalty,
        double spatialPenalty
) {}
