package com.visionrelay.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the relay
 * Binds to visionrelay.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "visionrelay")
@Validated
public class VisionRelayProperties {

    @Valid
    private WebSocketSettings websocket = new WebSocketSettings();

    @Valid
    private SignalingSettings signaling = new SignalingSettings();

    @Valid
    private InferenceSettings inference = new InferenceSettings();

    public WebSocketSettings getWebsocket() {
        return websocket;
    }

    public void setWebsocket(WebSocketSettings websocket) {
        this.websocket = websocket;
    }

    public SignalingSettings getSignaling() {
        return signaling;
    }

    public void setSignaling(SignalingSettings signaling) {
        this.signaling = signaling;
    }

    public InferenceSettings getInference() {
        return inference;
    }

    public void setInference(InferenceSettings inference) {
        this.inference = inference;
    }

    // Inner classes for nested properties
    public static class WebSocketSettings {
        @NotBlank
        private String path = "/ws";

        @Min(64 * 1024)
        private int maxFramePayloadLength = 10 * 1024 * 1024; // 10MB, base64 frames

        @Min(16)
        private int outboundBufferSize = 1024;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getMaxFramePayloadLength() {
            return maxFramePayloadLength;
        }

        public void setMaxFramePayloadLength(int maxFramePayloadLength) {
            this.maxFramePayloadLength = maxFramePayloadLength;
        }

        public int getOutboundBufferSize() {
            return outboundBufferSize;
        }

        public void setOutboundBufferSize(int outboundBufferSize) {
            this.outboundBufferSize = outboundBufferSize;
        }
    }

    public static class SignalingSettings {
        // offer only from phone, answer only from desktop after an offer
        private boolean enforceRoles = true;

        public boolean isEnforceRoles() {
            return enforceRoles;
        }

        public void setEnforceRoles(boolean enforceRoles) {
            this.enforceRoles = enforceRoles;
        }
    }

    public static class InferenceSettings {
        private boolean enabled = true;

        @NotBlank
        private String modelPath = "models/yolov5n.onnx";

        @Min(32)
        private int inputSize = 640;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.5;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double iouThreshold = 0.45;

        @Min(1)
        private int workers = 2;

        @Min(1)
        private int queueCapacity = 8;

        @NotNull
        private Duration deadline = Duration.ofSeconds(5);

        @Min(1024)
        private int maxImageBytes = 8 * 1024 * 1024;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getModelPath() {
            return modelPath;
        }

        public void setModelPath(String modelPath) {
            this.modelPath = modelPath;
        }

        public int getInputSize() {
            return inputSize;
        }

        public void setInputSize(int inputSize) {
            this.inputSize = inputSize;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public double getIouThreshold() {
            return iouThreshold;
        }

        public void setIouThreshold(double iouThreshold) {
            this.iouThreshold = iouThreshold;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getDeadline() {
            return deadline;
        }

        public void setDeadline(Duration deadline) {
            this.deadline = deadline;
        }

        public int getMaxImageBytes() {
            return maxImageBytes;
        }

        public void setMaxImageBytes(int maxImageBytes) {
            this.maxImageBytes = maxImageBytes;
        }
    }
}
