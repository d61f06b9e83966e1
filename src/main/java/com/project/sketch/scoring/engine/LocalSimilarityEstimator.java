package com.project.sketch.scoring.engine;

/**
 * Mean SSIM over non-overlapping square patches. Trailing partial patches are ignored.
 */
public class LocalSimilarityEstimator {
    static final double C1 = 6.5025;  // (0.01 * 255)^2
    static final double C2 = 58.5225; // (0.03 * 255)^2

    private final int patchSize;

    public LocalSimilarityEstimator(int patchSize) {
        if (patchSize <= 0) {
            throw new IllegalArgumentException("patchSize must be positive: " + patchSize);
        }
        this.patchSize = patchSize;
    }

    public double estimate(GrayscaleBuffer reference, GrayscaleBuffer submission) {
        GrayscaleBuffer.requireSameSize(reference, submission);
        final int w = reference.width(), h = reference.height();
        final int n = patchSize * patchSize;

        double total = 0;
        int count = 0;

        for (int y = 0; y + patchSize <= h; y += patchSize) {
            for (int x = 0; x + patchSize <= w; x += patchSize) {
                double meanR = 0, meanS = 0;
                for (int dy = 0; dy < patchSize; dy++) {
                    for (int dx = 0; dx < patchSize; dx++) {
                        meanR += reference.get(x + dx, y + dy);
                        meanS += submission.get(x + dx, y + dy);
                    }
                }
                meanR /= n;
                meanS /= n;

                double varR = 0, varS = 0, cov = 0;
                for (int dy = 0; dy < patchSize; dy++) {
                    for (int dx = 0; dx < patchSize; dx++) {
                        double dr = reference.get(x + dx, y + dy) - meanR;
                        double ds = submission.get(x + dx, y + dy) - meanS;
                        varR += dr * dr;
                        varS += ds * ds;
                        cov += dr * ds;
                    }
                }
                varR /= n;
                varS /= n;
                cov /= n;

                double ssim = ((2 * meanR * meanS + C1) * (2 * cov + C2))
                        / ((meanR * meanR + meanS * meanS + C1) * (varR + varS + C2));
                total += Math.max(0.0, ssim);
                count++;
            }
        }

        return count == 0 ? 0.0 : total / count;
    }
}
