package com.project.sketch.scoring.engine;

public record ContourMatch(
        double precision,
        double recall,
        double f1,
        int referenceEdges,
        int submissionEdges,
        int matchedReferenceEdges,
        int matchedSubmissionEdges
) {}
