package com.project.sketch.scoring.engine;

/**
 * 3x3 Sobel gradient magnitude.
 */
public class SobelEdgeExtractor implements EdgeExtractor {
    static final double MAX_STRENGTH = 255.0;

    @Override
    public double[] strength(GrayscaleBuffer gray) {
        final int w = gray.width(), h = gray.height();
        double[] out = new double[w * h];

        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                double gx =
                        -gray.get(x - 1, y - 1) + gray.get(x + 1, y - 1)
                        - 2 * gray.get(x - 1, y) + 2 * gray.get(x + 1, y)
                        - gray.get(x - 1, y + 1) + gray.get(x + 1, y + 1);
                double gy =
                        -gray.get(x - 1, y - 1) - 2 * gray.get(x, y - 1) - gray.get(x + 1, y - 1)
                        + gray.get(x - 1, y + 1) + 2 * gray.get(x, y + 1) + gray.get(x + 1, y + 1);
                out[y * w + x] = Math.min(MAX_STRENGTH, Math.sqrt(gx * gx + gy * gy));
            }
        }
        return out;
    }
}
