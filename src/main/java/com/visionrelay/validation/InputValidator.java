package com.visionrelay.validation;

import com.visionrelay.dto.ErrorResponse.ErrorCode;
import com.visionrelay.exception.ProtocolViolationException;
import com.visionrelay.model.PeerRole;
import org.springframework.stereotype.Component;

/**
 * Validation of the identifying fields of inbound messages.
 */
@Component
public class InputValidator {

    private static final int MAX_ROOM_ID_LENGTH = 64;
    private static final int MAX_CAMERA_TYPE_LENGTH = 32;

    /**
     * Sanitize and validate a room id.
     *
     * @return the sanitized id
     */
    public String requireRoomId(String roomId) {
        String sanitized = sanitize(roomId);
        if (sanitized == null || sanitized.isEmpty()) {
            throw new ProtocolViolationException(ErrorCode.JOIN_001);
        }

        if (sanitized.length() > MAX_ROOM_ID_LENGTH) {
            throw new ProtocolViolationException(ErrorCode.JOIN_003,
                    "Room ID exceeds maximum length of " + MAX_ROOM_ID_LENGTH);
        }
        return sanitized;
    }

    /**
     * Resolve the join role; anything but "phone" or "desktop" is a violation.
     */
    public PeerRole requireRole(String role) {
        return PeerRole.fromWireName(role)
                .orElseThrow(() -> new ProtocolViolationException(ErrorCode.JOIN_002,
                        "expected 'phone' or 'desktop' but got '" + role + "'"));
    }

    /**
     * Optional camera type announced by the phone; blank values count as absent.
     */
    public String cameraTypeOrNull(String cameraType) {
        String sanitized = sanitize(cameraType);
        if (sanitized == null || sanitized.isEmpty()) {
            return null;
        }
        return sanitized.length() > MAX_CAMERA_TYPE_LENGTH
                ? sanitized.substring(0, MAX_CAMERA_TYPE_LENGTH)
                : sanitized;
    }

    /**
     * Non-throwing room id check for the status API.
     */
    public boolean isValidRoomId(String roomId) {
        String sanitized = sanitize(roomId);
        return sanitized != null && !sanitized.isEmpty() && sanitized.length() <= MAX_ROOM_ID_LENGTH;
    }

    /**
     * Sanitize string input (remove control characters, trim).
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }
        return input.replaceAll("\\p{Cntrl}", "").trim();
    }

    public int getMaxRoomIdLength() {
        return MAX_ROOM_ID_LENGTH;
    }
}
