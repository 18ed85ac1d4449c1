package com.visionrelay.detection;

import java.util.List;

/**
 * The 80 COCO class names the detector was trained on, indexed by class id.
 */
public final class CocoLabels {

    private static final List<String> LABELS = List.of(
            "person", "bicycle", "car", "motorcycle", "airplane", "bus", "train", "truck", "boat",
            "traffic light", "fire hydrant", "stop sign", "parking meter", "bench", "bird", "cat",
            "dog", "horse", "sheep", "cow", "elephant", "bear", "zebra", "giraffe", "backpack",
            "umbrella", "handbag", "tie", "suitcase", "frisbee", "skis", "snowboard", "sports ball",
            "kite", "baseball bat", "baseball glove", "skateboard", "surfboard", "tennis racket",
            "bottle", "wine glass", "cup", "fork", "knife", "spoon", "bowl", "banana", "apple",
            "sandwich", "orange", "broccoli", "carrot", "hot dog", "pizza", "donut", "cake",
            "chair", "couch", "potted plant", "bed", "dining table", "toilet", "tv", "laptop",
            "mouse", "remote", "keyboard", "cell phone", "microwave", "oven", "toaster", "sink",
            "refrigerator", "book", "clock", "vase", "scissors", "teddy bear", "hair drier",
            "toothbrush");

    private CocoLabels() {
    }

    public static int size() {
        return LABELS.size();
    }

    /**
     * Label for a class id; ids outside the table map to {@code class_<id>}.
     */
    public static String labelFor(int classId) {
        if (classId < 0 || classId >= LABELS.size()) {
            return "class_" + classId;
        }
        return LABELS.get(classId);
    }
}
