package com.visionrelay.detection;

/**
 * Corner-form box in original-image pixel space with its predicted class.
 */
public record BoundingBox(int classId, double confidence, double x1, double y1, double x2, double y2) {

    public double width() {
        return x2 - x1;
    }

    public double height() {
        return y2 - y1;
    }

    public double area() {
        return width() * height();
    }

    /**
     * Axis-aligned intersection-over-union; overlap extents are clamped at zero.
     */
    public double iou(BoundingBox other) {
        double overlapWidth = Math.max(0.0, Math.min(x2, other.x2) - Math.max(x1, other.x1));
        double overlapHeight = Math.max(0.0, Math.min(y2, other.y2) - Math.max(y1, other.y1));
        double intersection = overlapWidth * overlapHeight;
        double union = area() + other.area() - intersection;
        if (union <= 0.0) {
            return 0.0;
        }
        return intersection / union;
    }
}
