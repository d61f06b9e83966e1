package com.project.sketch.scoring.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Harris corner response sampled on a coarse grid.
 *
 * <p>For every candidate pixel the central differences are accumulated over a 3x3 window into the
 * second-moment matrix [[Ixx, Ixy], [Ixy, Iyy]]; the response is
 * {@code det - k * trace^2}. Candidates at or below the response threshold are dropped, the rest
 * are ordered by descending response and capped.
 */
public class KeypointDetector {
    static final double HARRIS_K = 0.04;
    // central differences over a 3x3 window reach two pixels from the candidate
    private static final int MARGIN = 2;

    private static final Comparator<Keypoint> BY_STRENGTH_DESC =
            Comparator.comparingDouble(Keypoint::strength).reversed();

    private final int stride;
    private final int maxPoints;
    private final double responseThreshold;

    public KeypointDetector(int stride, int maxPoints, double responseThreshold) {
        if (stride <= 0 || maxPoints <= 0) {
            throw new IllegalArgumentException("stride and maxPoints must be positive");
        }
        this.stride = stride;
        this.maxPoints = maxPoints;
        this.responseThreshold = responseThreshold;
    }

    public List<Keypoint> detect(GrayscaleBuffer gray) {
        final int w = gray.width(), h = gray.height();
        List<Keypoint> responses = new ArrayList<>();

        for (int y = MARGIN; y < h - MARGIN; y += stride) {
            for (int x = MARGIN; x < w - MARGIN; x += stride) {
                double ixx = 0, iyy = 0, ixy = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int px = x + dx, py = y + dy;
                        double ix = gray.get(px + 1, py) - gray.get(px - 1, py);
                        double iy = gray.get(px, py + 1) - gray.get(px, py - 1);
                        ixx += ix * ix;
                        iyy += iy * iy;
                        ixy += ix * iy;
                    }
                }
                double det = ixx * iyy - ixy * ixy;
                double trace = ixx + iyy;
                double r = det - HARRIS_K * trace * trace;
                if (r > responseThreshold) {
                    responses.add(new Keypoint(x, y, r));
                }
            }
        }

        // stable sort: equal responses keep scan order, so the cut is deterministic
        responses.sort(BY_STRENGTH_DESC);
        if (responses.size() > maxPoints) {
            return Collections.unmodifiableList(new ArrayList<>(responses.subList(0, maxPoints)));
        }
        return Collections.unmodifiableList(responses);
    }
}
