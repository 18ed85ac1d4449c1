package com.visionrelay.detection;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visionrelay.exception.InferenceException;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;

/**
 * {@link Detector} backed by an ONNX Runtime CPU session.
 */
public class OnnxDetector implements Detector {

    private static final Logger logger = LoggerFactory.getLogger(OnnxDetector.class);

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final String inputName;

    private OnnxDetector(OrtEnvironment environment, OrtSession session, String inputName) {
        this.environment = environment;
        this.session = session;
        this.inputName = inputName;
    }

    /**
     * Load a model file into a new CPU session.
     */
    public static OnnxDetector load(Path modelPath) throws InferenceException {
        if (!Files.isRegularFile(modelPath)) {
            throw new InferenceException("Model file not found: " + modelPath.toAbsolutePath());
        }

        OrtEnvironment environment = OrtEnvironment.getEnvironment();
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            OrtSession session = environment.createSession(modelPath.toString(), options);
            String inputName = session.getInputNames().iterator().next();
            logger.info("ONNX session created for {} (input: {}, outputs: {})",
                    modelPath, inputName, session.getOutputNames());
            return new OnnxDetector(environment, session, inputName);
        } catch (OrtException e) {
            throw new InferenceException("Failed to load ONNX model " + modelPath, e);
        }
    }

    @Override
    public float[][][] detect(float[] chwInput, int inputSize) throws InferenceException {
        long[] shape = {1, 3, inputSize, inputSize};
        try (OnnxTensor input = OnnxTensor.createTensor(environment, FloatBuffer.wrap(chwInput), shape);
             OrtSession.Result result = session.run(Map.of(inputName, input))) {
            OnnxValue output = result.get(0);
            Object value = output.getValue();
            if (value instanceof float[][][] predictions) {
                return predictions;
            }
            throw new InferenceException("Unexpected model output type: " + output.getInfo());
        } catch (OrtException e) {
            throw new InferenceException("Model invocation failed", e);
        }
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            logger.warn("Failed to close ONNX session: {}", e.getMessage());
        }
    }
}
