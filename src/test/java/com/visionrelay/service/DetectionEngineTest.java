package com.visionrelay.service;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.visionrelay.config.VisionRelayProperties;
import com.visionrelay.detection.BoundingBox;
import com.visionrelay.detection.Letterbox;
import com.visionrelay.detection.StubDetector;
import com.visionrelay.detection.TestImages;
import com.visionrelay.exception.InferenceException;
import com.visionrelay.model.Detection;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DetectionEngineTest {

    private static final int INPUT_SIZE = 64;

    private DetectionEngine engine;

    @BeforeEach
    void setUp() {
        VisionRelayProperties properties = new VisionRelayProperties();
        properties.getInference().setInputSize(INPUT_SIZE);
        engine = new DetectionEngine(properties);
    }

    @Test
    void withoutModelReturnsNoDetections() {
        assertFalse(engine.isModelLoaded());
        assertTrue(engine.detect(TestImages.png(32, 32)).isEmpty());
    }

    @Test
    void missingModelFileLeavesEngineDegraded() {
        assertFalse(engine.loadModel(Path.of("target", "does-not-exist.onnx")));
        assertFalse(engine.isModelLoaded());
    }

    @Test
    void undecodableImageReturnsNoDetections() {
        StubDetector detector = new StubDetector(new float[0][]);
        engine.setDetector(detector);

        assertTrue(engine.detect(new byte[] {1, 2, 3, 4}).isEmpty());
        assertEquals(0, detector.getCalls());
    }

    @Test
    void detectorFailureReturnsNoDetections() {
        engine.setDetector(new StubDetector(new float[0][]) {
            @Override
            public float[][][] detect(float[] chwInput, int inputSize) throws InferenceException {
                throw new InferenceException("boom");
            }
        });

        assertTrue(engine.detect(TestImages.png(16, 16)).isEmpty());
    }

    @Test
    void mapsPredictionsBackToNormalizedOriginalCoordinates() {
        // 256x128 into 64: scale 0.25, padY 16. Pixel box (40,20)-(120,100) -> input centre (20,31), size 20x20
        float[] car = new float[5 + 80];
        car[0] = 20f;
        car[1] = 31f;
        car[2] = 20f;
        car[3] = 20f;
        car[4] = 0.9f;
        car[5 + 2] = 0.8f;

        float[] duplicate = car.clone();
        duplicate[0] = 21f;
        duplicate[5 + 2] = 0.6f;

        float[] faint = car.clone();
        faint[4] = 0.4f;

        StubDetector detector = new StubDetector(new float[][] {duplicate, car, faint});
        engine.setDetector(detector);

        List<Detection> detections = engine.detect(TestImages.png(256, 128));

        assertEquals(1, detections.size());
        Detection detection = detections.get(0);
        assertEquals("car", detection.label());
        assertEquals(0.8, detection.score(), 1e-6);
        assertEquals(40.0 / 256, detection.xmin(), 1e-6);
        assertEquals(20.0 / 128, detection.ymin(), 1e-6);
        assertEquals(120.0 / 256, detection.xmax(), 1e-6);
        assertEquals(100.0 / 128, detection.ymax(), 1e-6);

        float[] input = detector.getLastInput();
        assertEquals(3 * INPUT_SIZE * INPUT_SIZE, input.length);
        assertEquals(Letterbox.PAD_VALUE / 255.0f, input[0], 1e-6);
    }

    @Test
    void normalizationDoesNotClamp() {
        Detection detection = DetectionEngine.toDetection(new BoundingBox(0, 0.9, -5, -2, 105, 52), 100, 50);

        assertEquals(-0.05, detection.xmin(), 1e-9);
        assertEquals(1.05, detection.xmax(), 1e-9);
        assertEquals(1.04, detection.ymax(), 1e-9);
    }

    @Test
    void replacingDetectorClosesThePreviousOne() {
        StubDetector first = new StubDetector(new float[0][], Duration.ZERO);
        engine.setDetector(first);
        engine.unload();

        assertTrue(first.isClosed());
        assertFalse(engine.isModelLoaded());
    }
}
