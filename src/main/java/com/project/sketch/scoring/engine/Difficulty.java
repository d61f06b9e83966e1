package com.project.sketch.scoring.engine;

import java.util.Locale;

/**
 * Difficulty tiers. Harder tiers move weight from gross shape (contours) towards fine detail
 * (keypoints and local similarity).
 */
public enum Difficulty {
    EASY("Easy", "Simple shapes and silhouettes", new ScoringWeights(0.65, 0.30, 0.05)),
    MEDIUM("Medium", "Moderate detail objects", new ScoringWeights(0.60, 0.33, 0.07)),
    HARD("Hard", "Fine detail portraits and animals", new ScoringWeights(0.55, 0.35, 0.10));

    public static final Difficulty DEFAULT = MEDIUM;

    private final String label;
    private final String description;
    private final ScoringWeights weights;

    Difficulty(String label, String description, ScoringWeights weights) {
        this.label = label;
        this.description = description;
        this.weights = weights;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public ScoringWeights weights() {
        return weights;
    }

    /**
     * Parses {@code easy}, {@code medium} or {@code hard}, ignoring case. A missing value means
     * {@link #DEFAULT}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Difficulty fromId(String id) {
        if (id == null || id.isBlank()) {
            return DEFAULT;
        }
        for (Difficulty d : values()) {
            if (d.id().equalsIgnoreCase(id.trim())) {
                return d;
            }
        }
        throw new IllegalArgumentException("Invalid difficulty: " + id);
    }
}
