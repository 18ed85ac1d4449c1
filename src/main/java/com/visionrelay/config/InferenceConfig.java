package com.visionrelay.config;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import com.visionrelay.service.DetectionEngine;
import com.visionrelay.service.InferenceWorkerPool;

import jakarta.annotation.PreDestroy;

/**
 * Loads the detection model once the application is ready and stops the
 * inference workers on shutdown.
 */
@Configuration
public class InferenceConfig {

    private static final Logger logger = LoggerFactory.getLogger(InferenceConfig.class);

    private final DetectionEngine detectionEngine;
    private final InferenceWorkerPool workerPool;
    private final VisionRelayProperties properties;

    public InferenceConfig(DetectionEngine detectionEngine,
                           InferenceWorkerPool workerPool,
                           VisionRelayProperties properties) {
        this.detectionEngine = detectionEngine;
        this.workerPool = workerPool;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadModel() {
        if (!properties.getInference().isEnabled()) {
            logger.info("Server-side inference disabled (visionrelay.inference.enabled=false)");
            return;
        }
        detectionEngine.loadModel(Path.of(properties.getInference().getModelPath()));
    }

    @PreDestroy
    public void shutdownInference() {
        workerPool.shutdown();
        detectionEngine.unload();
    }
}
