package com.visionrelay.service;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visionrelay.dto.ErrorResponse;
import com.visionrelay.dto.ErrorResponse.ErrorCode;
import com.visionrelay.model.FrameResult;
import com.visionrelay.model.MessageType;
import com.visionrelay.model.PeerRole;

/**
 * Builds the outbound records of the signaling channel.
 */
@Component
public class SignalingPayloadFactory {

    private final ObjectMapper objectMapper;

    public SignalingPayloadFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Join notice telling the desktop that the phone is present and which camera it uses.
     */
    public ObjectNode phoneJoined(String roomId, String cameraType) {
        ObjectNode payload = base(MessageType.JOIN, roomId);
        payload.put("role", PeerRole.PHONE.getWireName());
        payload.put("cameraType", cameraType);
        return payload;
    }

    /**
     * Minimal offer/answer/ice-candidate record: sdp or candidate passed through unmodified.
     */
    public ObjectNode signal(MessageType type, String roomId, JsonNode value) {
        if (!type.isSignal()) {
            throw new IllegalArgumentException("Not a signaling message type: " + type);
        }
        ObjectNode payload = base(type, roomId);
        payload.set(type == MessageType.ICE_CANDIDATE ? "candidate" : "sdp", value);
        return payload;
    }

    public ObjectNode inferenceResult(String roomId, FrameResult result) {
        ObjectNode payload = base(MessageType.INFERENCE_RESULT, roomId);
        payload.setAll((ObjectNode) objectMapper.valueToTree(result));
        return payload;
    }

    public ObjectNode error(ErrorCode errorCode, String details) {
        return objectMapper.valueToTree(ErrorResponse.of(errorCode, details));
    }

    public String serialize(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload", e);
        }
    }

    private ObjectNode base(MessageType type, String roomId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("type", type.getWireName());
        payload.put("roomId", roomId);
        return payload;
    }
}
