package com.project.sketch.scoring.engine;

/**
 * Fixed thresholds and sizes of the scoring pipeline. Every server instance must run with the same
 * values, otherwise identical submissions would not score identically.
 */
public record ScoringSettings(
        int canonicalSize,
        double edgeThreshold,
        int contourTolerance,
        int keypointStride,
        int keypointMax,
        double keypointResponseThreshold,
        double keypointToleranceRatio,
        double keypointEmptyScore,
        int ssimPatchSize,
        int spatialPatchSize,
        int inkThreshold,
        int sideBySideGutter,
        float overlayOpacity
) {
    public static final int DEFAULT_CANONICAL_SIZE = 512;
    public static final double DEFAULT_EDGE_THRESHOLD = 30.0;
    public static final int DEFAULT_CONTOUR_TOLERANCE = 3;
    public static final int DEFAULT_KEYPOINT_STRIDE = 3;
    public static final int DEFAULT_KEYPOINT_MAX = 200;
    public static final double DEFAULT_KEYPOINT_RESPONSE_THRESHOLD = 1000.0;
    public static final double DEFAULT_KEYPOINT_TOLERANCE_RATIO = 0.05;
    // Neutral value for a reference without corners. Tunable, nothing depends on it being 0.5.
    public static final double DEFAULT_KEYPOINT_EMPTY_SCORE = 0.5;
    public static final int DEFAULT_SSIM_PATCH_SIZE = 16;
    public static final int DEFAULT_SPATIAL_PATCH_SIZE = 32;
    public static final int DEFAULT_INK_THRESHOLD = 200;
    public static final int DEFAULT_SIDE_BY_SIDE_GUTTER = 20;
    public static final float DEFAULT_OVERLAY_OPACITY = 0.5f;

    public ScoringSettings {
        requirePositive(canonicalSize, "canonicalSize");
        requirePositive(keypointStride, "keypointStride");
        requirePositive(keypointMax, "keypointMax");
        requirePositive(ssimPatchSize, "ssimPatchSize");
        requirePositive(spatialPatchSize, "spatialPatchSize");
        if (contourTolerance < 0) {
            throw new IllegalArgumentException("contourTolerance must not be negative: " + contourTolerance);
        }
        if (sideBySideGutter < 0) {
            throw new IllegalArgumentException("sideBySideGutter must not be negative: " + sideBySideGutter);
        }
        if (edgeThreshold < 0 || edgeThreshold > 255) {
            throw new IllegalArgumentException("edgeThreshold must be within [0,255]: " + edgeThreshold);
        }
        if (inkThreshold < 0 || inkThreshold > 255) {
            throw new IllegalArgumentException("inkThreshold must be within [0,255]: " + inkThreshold);
        }
        if (keypointToleranceRatio <= 0 || keypointToleranceRatio > 1) {
            throw new IllegalArgumentException("keypointToleranceRatio must be within (0,1]: " + keypointToleranceRatio);
        }
        if (keypointEmptyScore < 0 || keypointEmptyScore > 1) {
            throw new IllegalArgumentException("keypointEmptyScore must be within [0,1]: " + keypointEmptyScore);
        }
        if (overlayOpacity < 0f || overlayOpacity > 1f) {
            throw new IllegalArgumentException("overlayOpacity must be within [0,1]: " + overlayOpacity);
        }
    }

    public static ScoringSettings defaults() {
        return new ScoringSettings(
                DEFAULT_CANONICAL_SIZE,
                DEFAULT_EDGE_THRESHOLD,
                DEFAULT_CONTOUR_TOLERANCE,
                DEFAULT_KEYPOINT_STRIDE,
                DEFAULT_KEYPOINT_MAX,
                DEFAULT_KEYPOINT_RESPONSE_THRESHOLD,
                DEFAULT_KEYPOINT_TOLERANCE_RATIO,
                DEFAULT_KEYPOINT_EMPTY_SCORE,
                DEFAULT_SSIM_PATCH_SIZE,
                DEFAULT_SPATIAL_PATCH_SIZE,
                DEFAULT_INK_THRESHOLD,
                DEFAULT_SIDE_BY_SIDE_GUTTER,
                DEFAULT_OVERLAY_OPACITY
        );
    }

    /** Match distance for keypoints, in pixels of the canonical image. */
    public double keypointTolerancePx() {
        return canonicalSize * keypointToleranceRatio;
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
