package com.visionrelay.detection;

import com.visionrelay.exception.InferenceException;

/**
 * Opaque object-detection model: one named input tensor in, one raw
 * prediction tensor of shape {@code [batch, N, 5 + C]} out.
 */
public interface Detector extends AutoCloseable {

    /**
     * Run the model on a {@code [1, 3, inputSize, inputSize]} tensor.
     *
     * @param chwInput normalized pixels in channel-first order
     * @param inputSize side length of the square input
     */
    float[][][] detect(float[] chwInput, int inputSize) throws InferenceException;

    @Override
    void close();
}
