package com.project.sketch.scoring.engine;

import com.project.sketch.scoring.exceptions.DimensionMismatchException;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable luminance samples of a raster image, one per pixel, row-major.
 */
public final class GrayscaleBuffer {
    private static final double RED_WEIGHT = 0.299;
    private static final double GREEN_WEIGHT = 0.587;
    private static final double BLUE_WEIGHT = 0.114;

    private final int width;
    private final int height;
    private final double[] samples;

    public GrayscaleBuffer(int width, int height, double[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer dimensions must be positive: " + width + "x" + height);
        }
        if (samples.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " samples for " + width + "x" + height + " but got " + samples.length);
        }
        this.width = width;
        this.height = height;
        this.samples = Arrays.copyOf(samples, samples.length);
    }

    public static GrayscaleBuffer of(BufferedImage image) {
        final int w = image.getWidth(), h = image.getHeight();
        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);

        double[] gray = new double[w * h];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
            gray[i] = RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b;
        }
        return new GrayscaleBuffer(w, h, gray);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public double get(int x, int y) {
        return samples[y * width + x];
    }

    /** Copy of the samples, row-major. */
    public double[] toArray() {
        return Arrays.copyOf(samples, samples.length);
    }

    public boolean sameSizeAs(GrayscaleBuffer other) {
        return width == other.width && height == other.height;
    }

    static void requireSameSize(GrayscaleBuffer reference, GrayscaleBuffer submission) {
        if (!reference.sameSizeAs(submission)) {
            throw new DimensionMismatchException("Grayscale buffers differ: reference "
                    + reference.width + "x" + reference.height + ", submission "
                    + submission.width + "x" + submission.height);
        }
    }
}
