package com.visionrelay.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedList;
import java.util.List;

/**
 * Greedy non-maximum suppression across all classes.
 */
public final class NonMaxSuppression {

    private NonMaxSuppression() {
    }

    /**
     * Keep the most confident box, drop every lower-ranked box overlapping it by
     * more than {@code iouThreshold}, and repeat on what remains.
     *
     * @return kept boxes in descending confidence order
     */
    public static List<BoundingBox> apply(List<BoundingBox> boxes, double iouThreshold) {
        LinkedList<BoundingBox> remaining = new LinkedList<>(boxes);
        remaining.sort(Comparator.comparingDouble(BoundingBox::confidence).reversed());

        List<BoundingBox> kept = new ArrayList<>();
        while (!remaining.isEmpty()) {
            BoundingBox best = remaining.removeFirst();
            kept.add(best);
            remaining.removeIf(candidate -> best.iou(candidate) > iouThreshold);
        }
        return kept;
    }
}
