package com.visionrelay.service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.visionrelay.config.VisionRelayProperties;
import com.visionrelay.config.VisionRelayProperties.InferenceSettings;
import com.visionrelay.detection.BoundingBox;
import com.visionrelay.detection.CocoLabels;
import com.visionrelay.detection.Detector;
import com.visionrelay.detection.Letterbox;
import com.visionrelay.detection.NonMaxSuppression;
import com.visionrelay.detection.OnnxDetector;
import com.visionrelay.detection.YoloOutputDecoder;
import com.visionrelay.exception.InferenceException;
import com.visionrelay.model.Detection;

/**
 * Image bytes in, normalized detections out.
 *
 * Stateless across calls apart from the loaded {@link Detector}. Without a
 * detector, or when decoding or invocation fails, the result is an empty list
 * so the relay keeps working without inference.
 */
@Service
public class DetectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(DetectionEngine.class);

    private final InferenceSettings settings;

    private volatile Detector detector;

    public DetectionEngine(VisionRelayProperties properties) {
        this.settings = properties.getInference();
    }

    /**
     * Load the ONNX model. A failure leaves the engine without a detector.
     *
     * @return whether a model is now available
     */
    public boolean loadModel(Path modelPath) {
        logger.info("Loading ONNX model from {}...", modelPath);
        try {
            setDetector(OnnxDetector.load(modelPath));
            logger.info("✅ ONNX model loaded successfully");
            return true;
        } catch (InferenceException | RuntimeException | UnsatisfiedLinkError e) {
            logger.error("❌ Failed to load ONNX model: {}", e.getMessage());
            logger.info("Server will continue without inference capability");
            return false;
        }
    }

    /**
     * Install a detector, closing the previous one.
     */
    public void setDetector(Detector newDetector) {
        Detector previous = this.detector;
        this.detector = newDetector;
        if (previous != null && previous != newDetector) {
            previous.close();
        }
    }

    public void unload() {
        setDetector(null);
    }

    public boolean isModelLoaded() {
        return detector != null;
    }

    public List<Detection> detect(byte[] imageBytes) {
        Detector current = detector;
        if (current == null) {
            logger.warn("ONNX model is not loaded, skipping inference");
            return List.of();
        }

        try {
            BufferedImage image = decodeImage(imageBytes);
            int width = image.getWidth();
            int height = image.getHeight();

            Letterbox letterbox = Letterbox.of(width, height, settings.getInputSize());
            float[][][] output = current.detect(letterbox.toTensor(image), settings.getInputSize());
            if (output.length == 0) {
                return List.of();
            }

            List<BoundingBox> candidates = YoloOutputDecoder.decode(output[0], letterbox, settings.getConfidenceThreshold());
            List<BoundingBox> kept = NonMaxSuppression.apply(candidates, settings.getIouThreshold());

            logger.debug("🔍 {} candidates, {} kept after NMS ({}x{})", candidates.size(), kept.size(), width, height);
            return kept.stream()
                    .map(box -> toDetection(box, width, height))
                    .toList();
        } catch (IOException | InferenceException | RuntimeException e) {
            logger.error("Error during inference: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Divide pixel coordinates by the image size. No clamping.
     */
    static Detection toDetection(BoundingBox box, int imageWidth, int imageHeight) {
        return new Detection(
                CocoLabels.labelFor(box.classId()),
                box.confidence(),
                box.x1() / imageWidth,
                box.y1() / imageHeight,
                box.x2() / imageWidth,
                box.y2() / imageHeight);
    }

    private static BufferedImage decodeImage(byte[] imageBytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        if (image == null) {
            throw new IOException("Unsupported or corrupt image (" + imageBytes.length + " bytes)");
        }
        return image;
    }
}
