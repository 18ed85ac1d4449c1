package com.visionrelay.detection;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class YoloOutputDecoderTest {

    private static float[] row(float cx, float cy, float w, float h, float objectness, float... classScores) {
        float[] row = new float[5 + classScores.length];
        row[0] = cx;
        row[1] = cy;
        row[2] = w;
        row[3] = h;
        row[4] = objectness;
        System.arraycopy(classScores, 0, row, 5, classScores.length);
        return row;
    }

    @Test
    void dropsCandidatesAtOrBelowObjectnessThreshold() {
        Letterbox identity = Letterbox.of(640, 640, 640);
        float[][] predictions = {
            row(100, 100, 20, 20, 0.5f, 0.9f, 0.1f),
            row(100, 100, 20, 20, 0.3f, 0.9f, 0.1f),
            row(100, 100, 20, 20, 0.51f, 0.9f, 0.1f)
        };

        List<BoundingBox> boxes = YoloOutputDecoder.decode(predictions, identity, 0.5);

        assertEquals(1, boxes.size());
    }

    @Test
    void picksArgmaxClassAndConvertsCentreToCorners() {
        Letterbox identity = Letterbox.of(640, 640, 640);
        float[][] predictions = {row(100, 60, 40, 20, 0.8f, 0.1f, 0.2f, 0.7f)};

        BoundingBox box = YoloOutputDecoder.decode(predictions, identity, 0.5).get(0);

        assertEquals(2, box.classId());
        assertEquals(0.7, box.confidence(), 1e-6);
        assertEquals(80.0, box.x1(), 1e-6);
        assertEquals(50.0, box.y1(), 1e-6);
        assertEquals(120.0, box.x2(), 1e-6);
        assertEquals(70.0, box.y2(), 1e-6);
    }

    @Test
    void undoesLetterboxPaddingAndScale() {
        // 1280x720 -> scale 0.5, padY 140
        Letterbox letterbox = Letterbox.of(1280, 720, 640);
        float[][] predictions = {row(320, 320, 100, 50, 0.9f, 1.0f)};

        BoundingBox box = YoloOutputDecoder.decode(predictions, letterbox, 0.5).get(0);

        assertEquals((270 - 0) / 0.5, box.x1(), 1e-6);
        assertEquals((295 - 140) / 0.5, box.y1(), 1e-6);
        assertEquals((370 - 0) / 0.5, box.x2(), 1e-6);
        assertEquals((345 - 140) / 0.5, box.y2(), 1e-6);
    }

    @Test
    void labelsComeFromTheCocoTable() {
        assertEquals(80, CocoLabels.size());
        assertEquals("person", CocoLabels.labelFor(0));
        assertEquals("car", CocoLabels.labelFor(2));
        assertEquals("toothbrush", CocoLabels.labelFor(79));
        assertEquals("class_80", CocoLabels.labelFor(80));
    }
}
