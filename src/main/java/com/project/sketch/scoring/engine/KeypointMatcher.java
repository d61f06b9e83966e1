package com.project.sketch.scoring.engine;

import java.util.List;

/**
 * Fraction of reference keypoints whose nearest submission keypoint lies within the tolerance.
 */
public class KeypointMatcher {
    private final double tolerance;
    private final double emptyReferenceScore;

    public KeypointMatcher(double tolerance, double emptyReferenceScore) {
        this.tolerance = tolerance;
        this.emptyReferenceScore = emptyReferenceScore;
    }

    public double score(List<Keypoint> reference, List<Keypoint> submission) {
        if (reference.isEmpty()) {
            return emptyReferenceScore;
        }

        int matched = 0;
        for (Keypoint ref : reference) {
            double best = Double.POSITIVE_INFINITY;
            for (Keypoint sub : submission) {
                double d = ref.distanceTo(sub);
                if (d < best) best = d;
            }
            if (best <= tolerance) matched++;
        }
        return (double) matched / reference.size();
    }
}
