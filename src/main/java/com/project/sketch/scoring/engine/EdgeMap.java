package com.project.sketch.scoring.engine;

import com.project.sketch.scoring.exceptions.DimensionMismatchException;

import java.util.Arrays;

/**
 * Binary edge mask, same dimensions as the grayscale buffer it was derived from.
 */
public final class EdgeMap {
    private final int width;
    private final int height;
    private final boolean[] edges;
    private final int count;

    private EdgeMap(int width, int height, boolean[] edges) {
        this.width = width;
        this.height = height;
        this.edges = edges;
        int c = 0;
        for (boolean e : edges) if (e) c++;
        this.count = c;
    }

    /** A pixel is an edge when its strength is strictly above the threshold. */
    public static EdgeMap threshold(int width, int height, double[] strength, double threshold) {
        if (strength.length != width * height) {
            throw new DimensionMismatchException(
                    "Edge strength has " + strength.length + " samples, expected " + (width * height));
        }
        boolean[] edges = new boolean[strength.length];
        for (int i = 0; i < strength.length; i++) {
            edges[i] = strength[i] > threshold;
        }
        return new EdgeMap(width, height, edges);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isEdge(int x, int y) {
        return edges[y * width + x];
    }

    /** Number of edge pixels. */
    public int count() {
        return count;
    }

    public boolean sameSizeAs(EdgeMap other) {
        return width == other.width && height == other.height;
    }

    static void requireSameSize(EdgeMap reference, EdgeMap submission) {
        if (!reference.sameSizeAs(submission)) {
            throw new DimensionMismatchException("Edge maps differ: reference "
                    + reference.width + "x" + reference.height + ", submission "
                    + submission.width + "x" + submission.height);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeMap other)) return false;
        return width == other.width && height == other.height && Arrays.equals(edges, other.edges);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(edges);
    }
}
