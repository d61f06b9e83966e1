package com.project.sketch.scoring.engine;

/**
 * Multiplicative penalties against over-inking. Both factors are in (0,1], 1.0 meaning no penalty.
 */
public class InkPenaltyCalculator {
    // tolerated excess of submission ink over reference ink
    static final double INK_SLACK = 1.2;
    static final double MIN_REFERENCE_RATIO = 0.01;

    static final double EMPTY_PATCH_RATIO = 0.02;
    static final double INKED_PATCH_RATIO = 0.05;
    static final double SPATIAL_WEIGHT = 1.5;
    static final double SPATIAL_FLOOR = 0.7;

    private final int inkThreshold;
    private final int patchSize;

    public InkPenaltyCalculator(int inkThreshold, int patchSize) {
        if (patchSize <= 0) {
            throw new IllegalArgumentException("patchSize must be positive: " + patchSize);
        }
        this.inkThreshold = inkThreshold;
        this.patchSize = patchSize;
    }

    /** Fraction of pixels darker than the ink threshold. */
    public double inkRatio(GrayscaleBuffer gray) {
        int dark = 0;
        for (int y = 0; y < gray.height(); y++) {
            for (int x = 0; x < gray.width(); x++) {
                if (gray.get(x, y) < inkThreshold) dark++;
            }
        }
        return (double) dark / (gray.width() * gray.height());
    }

    public double inkDensityFactor(GrayscaleBuffer reference, GrayscaleBuffer submission) {
        GrayscaleBuffer.requireSameSize(reference, submission);
        double refRatio = inkRatio(reference);
        double subRatio = inkRatio(submission);

        if (subRatio <= refRatio * INK_SLACK) return 1.0;

        // absolute coverage first: a mostly inked canvas is never a drawing
        if (subRatio > 0.6) return 0.05;
        if (subRatio > 0.4) return 0.15;
        if (subRatio > 0.3) return 0.3;

        double excess = subRatio / Math.max(refRatio, MIN_REFERENCE_RATIO);
        if (excess > 5) return 0.15;
        if (excess > 3) return 0.35;
        if (excess > 2) return 0.55;
        // below the 1% reference floor the excess can drop under the slack; never reward that
        return Math.min(1.0, Math.max(0.4, 1 - (excess - INK_SLACK) * 0.4));
    }

    /**
     * Penalizes ink in patches the reference leaves blank. A patch is extra when the reference has
     * under 2% ink there and the submission over 5%.
     */
    public double spatialExtraFactor(GrayscaleBuffer reference, GrayscaleBuffer submission) {
        GrayscaleBuffer.requireSameSize(reference, submission);
        final int w = reference.width(), h = reference.height();
        final int n = patchSize * patchSize;

        int totalPatches = 0;
        int extraPatches = 0;
        for (int y = 0; y + patchSize <= h; y += patchSize) {
            for (int x = 0; x + patchSize <= w; x += patchSize) {
                totalPatches++;
                int refInk = 0, subInk = 0;
                for (int dy = 0; dy < patchSize; dy++) {
                    for (int dx = 0; dx < patchSize; dx++) {
                        if (reference.get(x + dx, y + dy) < inkThreshold) refInk++;
                        if (submission.get(x + dx, y + dy) < inkThreshold) subInk++;
                    }
                }
                if ((double) refInk / n < EMPTY_PATCH_RATIO && (double) subInk / n > INKED_PATCH_RATIO) {
                    extraPatches++;
                }
            }
        }

        if (totalPatches == 0) return 1.0;
        double extraRatio = (double) extraPatches / totalPatches;
        return Math.max(SPATIAL_FLOOR, 1 - extraRatio * SPATIAL_WEIGHT);
    }
}
