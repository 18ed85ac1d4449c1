package com.visionrelay.handler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visionrelay.config.VisionRelayProperties;
import com.visionrelay.dto.ErrorResponse.ErrorCode;
import com.visionrelay.exception.ProtocolViolationException;
import com.visionrelay.model.FrameResult;
import com.visionrelay.model.MessageType;
import com.visionrelay.service.InferenceGatewayService;
import com.visionrelay.service.SignalingPayloadFactory;
import com.visionrelay.service.SignalingRelayService;
import com.visionrelay.service.SignalingRelayService.Membership;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Reactive WebSocket handler for the signaling channel.
 *
 * Parses each text frame, dispatches on its {@code type} to the
 * {@link SignalingRelayService} or the {@link InferenceGatewayService}, and
 * writes replies through the session's {@link WebSocketPeerConnection}.
 * Inference runs detached from the receive loop, so a slow frame never holds
 * up signaling on this or any other socket.
 */
@Component
public class SignalingWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(SignalingWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final SignalingRelayService relayService;
    private final InferenceGatewayService inferenceGateway;
    private final SignalingPayloadFactory payloadFactory;
    private final int outboundBufferSize;

    // Session ID -> per-connection state
    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();

    public SignalingWebSocketHandler(ObjectMapper objectMapper,
                                     SignalingRelayService relayService,
                                     InferenceGatewayService inferenceGateway,
                                     SignalingPayloadFactory payloadFactory,
                                     VisionRelayProperties properties) {
        this.objectMapper = objectMapper;
        this.relayService = relayService;
        this.inferenceGateway = inferenceGateway;
        this.payloadFactory = payloadFactory;
        this.outboundBufferSize = properties.getWebsocket().getOutboundBufferSize();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketPeerConnection connection = new WebSocketPeerConnection(session, outboundBufferSize);
        SessionContext context = new SessionContext(connection);
        sessions.put(session.getId(), context);
        logger.info("🔌 New WebSocket connection: {}", session.getId());

        Mono<Void> input = session.receive()
            .doOnNext(message -> handleMessage(context, message))
            .doOnError(error -> logger.warn("WebSocket error on {}: {}", session.getId(), error.getMessage()))
            .doFinally(signalType -> handleDisconnect(context))
            .then();

        // Single writer; closes with the status chosen by the connection once the sink completes
        Mono<Void> output = session.send(connection.outbound())
            .then(Mono.defer(() -> session.close(connection.getCloseStatus())));

        return Mono.zip(input, output).then();
    }

    private void handleMessage(SessionContext context, WebSocketMessage message) {
        if (message.getType() != WebSocketMessage.Type.TEXT) {
            logger.debug("Ignoring {} message from {}", message.getType(), context.connection.getId());
            return;
        }
        handleTextMessage(context, message.getPayloadAsText());
    }

    /**
     * Handle one JSON record. Failures stay scoped to this message, except
     * protocol violations, which terminate the connection.
     */
    void handleTextMessage(SessionContext context, String payload) {
        if (context.terminated) {
            return;
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.debug("Invalid JSON from {}: {}", context.connection.getId(), e.getOriginalMessage());
            sendError(context, ErrorCode.MSG_001, e.getOriginalMessage());
            return;
        }

        String typeName = textOrNull(json, "type");
        if (typeName == null) {
            sendError(context, ErrorCode.MSG_002, null);
            return;
        }

        MessageType type = MessageType.fromWireName(typeName).orElse(null);
        if (type == null) {
            logger.debug("Ignoring unknown message type '{}' from {}", typeName, context.connection.getId());
            return;
        }

        try {
            switch (type) {
                case JOIN -> handleJoin(context, json);
                case OFFER, ANSWER, ICE_CANDIDATE -> handleSignal(context, type, json);
                case FRAME_FOR_INFERENCE -> handleFrame(context, json);
                default -> logger.debug("Ignoring server-bound type '{}' from {}", type, context.connection.getId());
            }
        } catch (ProtocolViolationException e) {
            logger.warn("⛔ Protocol violation from {}: {}", context.connection.getId(), e.getMessage());
            terminate(context, e);
        } catch (RuntimeException e) {
            logger.error("Error handling '{}' from {}", type, context.connection.getId(), e);
        }
    }

    private void handleJoin(SessionContext context, JsonNode json) {
        String roomId = textOrNull(json, "roomId");
        String role = textOrNull(json, "role");
        String cameraType = textOrNull(json, "cameraType");

        Membership current = context.membership;
        if (current != null && !(current.roomId().equals(roomId) && current.role().getWireName().equals(role))) {
            // Switching room or role: leave the previous one first
            relayService.handleDisconnect(context.connection, current.roomId(), current.role());
            context.membership = null;
        }

        context.membership = relayService.handleJoin(context.connection, roomId, role, cameraType);
    }

    private void handleSignal(SessionContext context, MessageType type, JsonNode json) {
        Membership membership = context.membership;
        if (membership == null) {
            logger.debug("Ignoring {} from {} before join", type, context.connection.getId());
            return;
        }
        relayService.handleSignal(membership.roomId(), membership.role(), type, json);
    }

    private void handleFrame(SessionContext context, JsonNode json) {
        Membership membership = context.membership;
        if (membership == null) {
            logger.debug("Ignoring frame from {} before join", context.connection.getId());
            return;
        }

        JsonNode captureNode = json.get("capture_ts");
        Double captureTs = captureNode != null && captureNode.isNumber() ? captureNode.asDouble() : null;

        // Cancelled with the session so no result is written to a dead socket
        inferenceGateway
            .handleFrameForInference(membership.roomId(), membership.role(), textOrNull(json, "frame_id"),
                    captureTs, textOrNull(json, "imageData"))
            .takeUntilOther(context.closed.asMono())
            .subscribe(
                result -> deliverResult(context, membership.roomId(), result),
                error -> logger.error("Inference pipeline failed for {}: {}", context.connection.getId(), error.getMessage()));
    }

    private void deliverResult(SessionContext context, String roomId, FrameResult result) {
        String text = payloadFactory.serialize(payloadFactory.inferenceResult(roomId, result));
        if (!context.connection.send(text)) {
            logger.warn("Failed to deliver inference result for frame {} in room {}", result.frameId(), roomId);
        } else if (result.hasError()) {
            logger.debug("Inference degraded for frame {}: {}", result.frameId(), result.error());
        } else {
            logger.debug("Inference completed for frame {}: {} detections",
                    result.frameId(), result.detections().size());
        }
    }

    private void terminate(SessionContext context, ProtocolViolationException violation) {
        context.terminated = true;
        context.connection.send(payloadFactory.serialize(
                payloadFactory.error(violation.getErrorCode(), violation.getDetails())));
        context.connection.close(CloseStatus.POLICY_VIOLATION);
    }

    private void sendError(SessionContext context, ErrorCode errorCode, String details) {
        context.connection.send(payloadFactory.serialize(payloadFactory.error(errorCode, details)));
    }

    private void handleDisconnect(SessionContext context) {
        if (sessions.remove(context.connection.getId()) == null) {
            return;
        }
        logger.info("🚪 Session disconnected: {}", context.connection.getId());

        context.closed.tryEmitValue(Boolean.TRUE);
        context.connection.release();

        Membership membership = context.membership;
        if (membership != null) {
            relayService.handleDisconnect(context.connection, membership.roomId(), membership.role());
        }
    }

    private static String textOrNull(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    public int getSessionCount() {
        return sessions.size();
    }

    /**
     * State of one socket: its membership and a signal fired when it goes away.
     */
    static final class SessionContext {
        final WebSocketPeerConnection connection;
        final Sinks.One<Boolean> closed = Sinks.one();
        volatile Membership membership;
        volatile boolean terminated;

        SessionContext(WebSocketPeerConnection connection) {
            this.connection = connection;
        }
    }
}
