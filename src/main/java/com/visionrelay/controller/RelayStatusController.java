package com.visionrelay.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.visionrelay.dto.ErrorResponse.ErrorCode;
import com.visionrelay.dto.RelayStatusResponse;
import com.visionrelay.dto.RelayStatusResponse.InferenceStats;
import com.visionrelay.dto.RoomStatusResponse;
import com.visionrelay.exception.ProtocolViolationException;
import com.visionrelay.handler.SignalingWebSocketHandler;
import com.visionrelay.service.ConnectionRegistry;
import com.visionrelay.service.DetectionEngine;
import com.visionrelay.service.InferenceWorkerPool;
import com.visionrelay.service.RoomStateStore;
import com.visionrelay.service.SignalingRelayService;
import com.visionrelay.validation.InputValidator;

/**
 * Read-only view of relay and inference state
 */
@RestController
@RequestMapping("/api")
public class RelayStatusController {

    private final RoomStateStore roomStore;
    private final ConnectionRegistry connectionRegistry;
    private final SignalingRelayService relayService;
    private final SignalingWebSocketHandler webSocketHandler;
    private final DetectionEngine detectionEngine;
    private final InferenceWorkerPool workerPool;
    private final InputValidator inputValidator;

    public RelayStatusController(RoomStateStore roomStore,
                                 ConnectionRegistry connectionRegistry,
                                 SignalingRelayService relayService,
                                 SignalingWebSocketHandler webSocketHandler,
                                 DetectionEngine detectionEngine,
                                 InferenceWorkerPool workerPool,
                                 InputValidator inputValidator) {
        this.roomStore = roomStore;
        this.connectionRegistry = connectionRegistry;
        this.relayService = relayService;
        this.webSocketHandler = webSocketHandler;
        this.detectionEngine = detectionEngine;
        this.workerPool = workerPool;
        this.inputValidator = inputValidator;
    }

    /**
     * Room, socket and inference counters
     */
    @GetMapping("/status")
    public RelayStatusResponse getStatus() {
        InferenceStats inference = new InferenceStats(
                workerPool.getSubmittedCount(),
                workerPool.getCompletedCount(),
                workerPool.getDroppedCount(),
                workerPool.getTimedOutCount(),
                workerPool.getCancelledCount(),
                workerPool.getQueuedCount(),
                workerPool.getActiveCount());

        return new RelayStatusResponse(
                roomStore.roomCount(),
                connectionRegistry.connectionCount(),
                webSocketHandler.getSessionCount(),
                detectionEngine.isModelLoaded(),
                inference);
    }

    /**
     * Signaling summary of one room
     */
    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<RoomStatusResponse> getRoom(@PathVariable String roomId) {
        if (!inputValidator.isValidRoomId(roomId)) {
            throw new ProtocolViolationException(ErrorCode.JOIN_003, roomId);
        }
        return relayService.describeRoom(inputValidator.sanitize(roomId))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
