package com.visionrelay.detection;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes YOLOv5-style predictions into boxes in original-image pixel space.
 *
 * Each prediction row is {@code [cx, cy, w, h, objectness, class scores...]}
 * in letterboxed input-pixel coordinates.
 */
public final class YoloOutputDecoder {

    private static final int BOX_FIELDS = 5;

    private YoloOutputDecoder() {
    }

    public static List<BoundingBox> decode(float[][] predictions, Letterbox letterbox, double objectnessThreshold) {
        List<BoundingBox> boxes = new ArrayList<>();
        for (float[] row : predictions) {
            if (row.length <= BOX_FIELDS || row[4] <= objectnessThreshold) {
                continue;
            }

            int classId = 0;
            float best = row[BOX_FIELDS];
            for (int c = BOX_FIELDS + 1; c < row.length; c++) {
                if (row[c] > best) {
                    best = row[c];
                    classId = c - BOX_FIELDS;
                }
            }

            double halfWidth = row[2] / 2.0;
            double halfHeight = row[3] / 2.0;
            boxes.add(new BoundingBox(
                    classId,
                    best,
                    letterbox.toOriginalX(row[0] - halfWidth),
                    letterbox.toOriginalY(row[1] - halfHeight),
                    letterbox.toOriginalX(row[0] + halfWidth),
                    letterbox.toOriginalY(row[1] + halfHeight)));
        }
        return boxes;
    }
}
