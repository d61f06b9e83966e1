package com.project.sketch.scoring.engine;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Renders the visual feedback shown after a round: edge heatmap, side-by-side and overlay.
 */
public class DiagnosticRenderer {
    static final Color MATCH_COLOR = new Color(0, 200, 80, 200);
    static final Color MISS_COLOR  = new Color(220, 40, 40, 180);
    static final Color EXTRA_COLOR = new Color(240, 200, 40, 120);
    static final Color EMPTY_COLOR = new Color(255, 255, 255, 0);

    private final int gutter;
    private final float overlayOpacity;

    public DiagnosticRenderer(int gutter, float overlayOpacity) {
        this.gutter = gutter;
        this.overlayOpacity = overlayOpacity;
    }

    /**
     * Green where both images have an edge, red for reference-only (missed), yellow for
     * submission-only (extra), transparent elsewhere.
     */
    public BufferedImage heatmap(EdgeMap reference, EdgeMap submission) {
        EdgeMap.requireSameSize(reference, submission);
        final int w = reference.width(), h = reference.height();

        int match = MATCH_COLOR.getRGB();
        int miss = MISS_COLOR.getRGB();
        int extra = EXTRA_COLOR.getRGB();
        int empty = EMPTY_COLOR.getRGB();

        int[] argb = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                boolean r = reference.isEdge(x, y);
                boolean s = submission.isEdge(x, y);
                int c;
                if (r && s) c = match;
                else if (r) c = miss;
                else if (s) c = extra;
                else c = empty;
                argb[y * w + x] = c;
            }
        }

        BufferedImage heatmap = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        heatmap.setRGB(0, 0, w, h, argb, 0, w);
        return heatmap;
    }

    /** Reference left, submission right, separated by a transparent gutter. */
    public BufferedImage sideBySide(BufferedImage reference, BufferedImage submission) {
        int width = reference.getWidth() + gutter + submission.getWidth();
        int height = Math.max(reference.getHeight(), submission.getHeight());

        BufferedImage combined = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = combined.createGraphics();
        try {
            g.drawImage(reference, 0, 0, null);
            g.drawImage(submission, reference.getWidth() + gutter, 0, null);
        } finally {
            g.dispose();
        }
        return combined;
    }

    /** Submission drawn at partial opacity on top of the reference. */
    public BufferedImage overlay(BufferedImage reference, BufferedImage submission) {
        BufferedImage combined = new BufferedImage(reference.getWidth(), reference.getHeight(),
                BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = combined.createGraphics();
        try {
            g.drawImage(reference, 0, 0, null);
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, overlayOpacity));
            g.drawImage(submission, 0, 0, null);
        } finally {
            g.dispose();
        }
        return combined;
    }
}
