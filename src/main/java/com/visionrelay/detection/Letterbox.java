package com.visionrelay.detection;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Aspect-preserving resize of an image into the square model input.
 *
 * The longer side is scaled to {@code inputSize}; the shorter side is centred
 * and padded with a constant gray. The same geometry maps model-space
 * coordinates back to the original image.
 */
public record Letterbox(int inputSize, int originalWidth, int originalHeight,
                        double scale, int scaledWidth, int scaledHeight, int padX, int padY) {

    public static final int PAD_VALUE = 114;

    public static Letterbox of(int originalWidth, int originalHeight, int inputSize) {
        if (originalWidth <= 0 || originalHeight <= 0) {
            throw new IllegalArgumentException(
                    "Image dimensions must be positive: " + originalWidth + "x" + originalHeight);
        }
        double scale = inputSize / (double) Math.max(originalWidth, originalHeight);
        int scaledWidth = Math.max(1, (int) (originalWidth * scale));
        int scaledHeight = Math.max(1, (int) (originalHeight * scale));
        int padX = (inputSize - scaledWidth) / 2;
        int padY = (inputSize - scaledHeight) / 2;
        return new Letterbox(inputSize, originalWidth, originalHeight, scale, scaledWidth, scaledHeight, padX, padY);
    }

    /**
     * Render the image into the padded square and return it as a normalized
     * [1, 3, inputSize, inputSize] tensor flattened in channel-first order.
     */
    public float[] toTensor(BufferedImage image) {
        BufferedImage canvas = new BufferedImage(inputSize, inputSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setColor(new Color(PAD_VALUE, PAD_VALUE, PAD_VALUE));
            graphics.fillRect(0, 0, inputSize, inputSize);
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.drawImage(image, padX, padY, scaledWidth, scaledHeight, null);
        } finally {
            graphics.dispose();
        }

        int plane = inputSize * inputSize;
        float[] tensor = new float[3 * plane];
        int[] pixels = canvas.getRGB(0, 0, inputSize, inputSize, null, 0, inputSize);
        for (int i = 0; i < plane; i++) {
            int rgb = pixels[i];
            tensor[i] = ((rgb >> 16) & 0xFF) / 255.0f;
            tensor[plane + i] = ((rgb >> 8) & 0xFF) / 255.0f;
            tensor[2 * plane + i] = (rgb & 0xFF) / 255.0f;
        }
        return tensor;
    }

    public double toOriginalX(double inputX) {
        return (inputX - padX) / scale;
    }

    public double toOriginalY(double inputY) {
        return (inputY - padY) / scale;
    }

    public double toInputX(double originalX) {
        return originalX * scale + padX;
    }

    public double toInputY(double originalY) {
        return originalY * scale + padY;
    }
}
