package com.project.sketch.scoring.engine;

/** Corner-like feature: pixel position and Harris response. */
public record Keypoint(int x, int y, double strength) {

    public double distanceTo(Keypoint other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
