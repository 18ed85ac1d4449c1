package com.visionrelay.model;

/**
 * A single detected object. Box corners are normalized to the original image
 * width/height and are not clamped, so values may slightly exceed [0, 1].
 */
public record Detection(String label, double score, double xmin, double ymin, double xmax, double ymax) {
}
