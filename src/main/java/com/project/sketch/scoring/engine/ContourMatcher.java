package com.project.sketch.scoring.engine;

/**
 * Tolerance-window edge matching. A submission edge pixel counts towards precision when any
 * reference edge pixel lies within {@code tolerance} pixels on both axes; a reference edge pixel
 * counts towards recall when any submission edge pixel lies within the same window.
 *
 * <p>Precision punishes extra strokes and recall punishes missing ones, so flooding the canvas
 * with ink cannot raise F1 the way it would raise a plain overlap ratio.
 */
public class ContourMatcher {
    private final int tolerance;

    public ContourMatcher(int tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must not be negative: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public ContourMatch match(EdgeMap reference, EdgeMap submission) {
        EdgeMap.requireSameSize(reference, submission);
        final int w = reference.width(), h = reference.height();

        boolean[] refMatched = new boolean[w * h];
        int matchedRef = 0;
        int matchedSub = 0;
        int subEdges = 0;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!submission.isEdge(x, y)) continue;
                subEdges++;

                int y0 = Math.max(0, y - tolerance), y1 = Math.min(h - 1, y + tolerance);
                int x0 = Math.max(0, x - tolerance), x1 = Math.min(w - 1, x + tolerance);
                boolean found = false;
                for (int ny = y0; ny <= y1; ny++) {
                    for (int nx = x0; nx <= x1; nx++) {
                        if (!reference.isEdge(nx, ny)) continue;
                        found = true;
                        int idx = ny * w + nx;
                        if (!refMatched[idx]) {
                            refMatched[idx] = true;
                            matchedRef++;
                        }
                    }
                }
                if (found) matchedSub++;
            }
        }

        int refEdges = reference.count();
        // no submission ink matches nothing; an empty reference has nothing to miss
        double precision = subEdges == 0 ? 0.0 : (double) matchedSub / subEdges;
        double recall = refEdges == 0 ? 1.0 : (double) matchedRef / refEdges;
        double f1 = (precision + recall) == 0 ? 0.0 : 2 * precision * recall / (precision + recall);

        return new ContourMatch(precision, recall, f1, refEdges, subEdges, matchedRef, matchedSub);
    }
}
