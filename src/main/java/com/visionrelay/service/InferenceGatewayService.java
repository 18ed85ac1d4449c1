package com.visionrelay.service;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.visionrelay.config.VisionRelayProperties;
import com.visionrelay.config.VisionRelayProperties.InferenceSettings;
import com.visionrelay.exception.InferenceRejectedException;
import com.visionrelay.model.Detection;
import com.visionrelay.model.FrameResult;
import com.visionrelay.model.PeerRole;
import com.visionrelay.service.InferenceWorkerPool.InferenceTask;

import reactor.core.publisher.Mono;

/**
 * Accepts frame-for-inference requests from the desktop role and runs them on
 * the {@link InferenceWorkerPool} without blocking the socket threads.
 *
 * Every accepted request produces exactly one {@link FrameResult}; failures are
 * reported inside the result rather than raised to the caller.
 */
@Service
public class InferenceGatewayService implements RoomLifecycleListener {

    private static final Logger logger = LoggerFactory.getLogger(InferenceGatewayService.class);

    static final String UNKNOWN_FRAME_ID = "unknown";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final DetectionEngine detectionEngine;
    private final InferenceWorkerPool workerPool;
    private final InferenceSettings settings;

    public InferenceGatewayService(DetectionEngine detectionEngine,
                                   InferenceWorkerPool workerPool,
                                   VisionRelayProperties properties) {
        this.detectionEngine = detectionEngine;
        this.workerPool = workerPool;
        this.settings = properties.getInference();
    }

    /**
     * Decode a frame and schedule detection.
     *
     * @return the result to send back to the desktop, or empty when the request
     *         is ignored (non-desktop sender, missing image, room torn down)
     */
    public Mono<FrameResult> handleFrameForInference(String roomId, PeerRole role, String frameId,
                                                     Double captureTs, String imageDataBase64) {
        if (role != PeerRole.DESKTOP) {
            logger.debug("Ignoring frame from {} in room {}: only desktop may request inference", role, roomId);
            return Mono.empty();
        }
        if (imageDataBase64 == null || imageDataBase64.isEmpty()) {
            logger.debug("Ignoring frame without imageData in room {}", roomId);
            return Mono.empty();
        }

        double recvTs = now();
        String resolvedFrameId = frameId != null ? frameId : UNKNOWN_FRAME_ID;
        double resolvedCaptureTs = captureTs != null ? captureTs : recvTs;

        byte[] imageBytes;
        try {
            imageBytes = decodeImageData(imageDataBase64);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid image data for frame {} in room {}: {}", resolvedFrameId, roomId, e.getMessage());
            return Mono.just(FrameResult.degraded(resolvedFrameId, resolvedCaptureTs, recvTs, now(),
                    "Invalid image data: " + e.getMessage()));
        }

        if (imageBytes.length > settings.getMaxImageBytes()) {
            logger.warn("Frame {} in room {} too large: {} bytes", resolvedFrameId, roomId, imageBytes.length);
            return Mono.just(FrameResult.degraded(resolvedFrameId, resolvedCaptureTs, recvTs, now(),
                    "Image payload too large: " + imageBytes.length + " bytes"));
        }

        if (!settings.isEnabled()) {
            return Mono.just(FrameResult.of(resolvedFrameId, resolvedCaptureTs, recvTs, now(), List.of()));
        }

        InferenceTask<List<Detection>> task = workerPool.submit(roomId, () -> detectionEngine.detect(imageBytes));
        Duration deadline = settings.getDeadline();

        return Mono.fromFuture(task.completion())
                .map(detections -> FrameResult.of(resolvedFrameId, resolvedCaptureTs, recvTs, now(), detections))
                .timeout(deadline, Mono.defer(() -> {
                    task.expire();
                    logger.warn("⏱️ Inference for frame {} in room {} exceeded {} ms",
                            resolvedFrameId, roomId, deadline.toMillis());
                    return Mono.just(FrameResult.degraded(resolvedFrameId, resolvedCaptureTs, recvTs, now(),
                            "timeout: inference exceeded " + deadline.toMillis() + " ms"));
                }))
                // Only a downstream cancel (session gone) reaches here; the deadline is handled above
                .doOnCancel(() -> task.cancel(true))
                .onErrorResume(InferenceRejectedException.class, e -> Mono.just(
                        FrameResult.degraded(resolvedFrameId, resolvedCaptureTs, recvTs, now(), e.getMessage())))
                .onErrorResume(CancellationException.class, e -> {
                    logger.debug("Inference for frame {} cancelled (room {} closed)", resolvedFrameId, roomId);
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    logger.error("Error processing frame-for-inference: {}", e.getMessage());
                    return Mono.just(FrameResult.degraded(resolvedFrameId, resolvedCaptureTs, recvTs, now(),
                            String.valueOf(e.getMessage())));
                });
    }

    @Override
    public void onRoomPurged(String roomId) {
        workerPool.cancelRoom(roomId);
    }

    /**
     * Strip an optional data-URL header ("data:image/jpeg;base64,") and any
     * whitespace or line breaks, then decode.
     *
     * @throws IllegalArgumentException when the payload is not valid base64
     */
    static byte[] decodeImageData(String imageData) {
        int comma = imageData.indexOf(',');
        String encoded = comma >= 0 ? imageData.substring(comma + 1) : imageData;
        byte[] bytes = Base64.getDecoder().decode(WHITESPACE.matcher(encoded).replaceAll(""));
        if (bytes.length == 0) {
            throw new IllegalArgumentException("empty image payload");
        }
        return bytes;
    }

    double now() {
        return System.currentTimeMillis();
    }
}
