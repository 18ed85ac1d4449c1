package com.visionrelay.validation;

import org.junit.jupiter.api.Test;

import com.visionrelay.dto.ErrorResponse.ErrorCode;
import com.visionrelay.exception.ProtocolViolationException;
import com.visionrelay.model.PeerRole;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputValidatorTest {

    private final InputValidator validator = new InputValidator();

    @Test
    void roomIdIsSanitizedAndRequired() {
        assertEquals("abc123", validator.requireRoomId("  abc123\u0007 "));

        ProtocolViolationException missing = assertThrows(ProtocolViolationException.class,
                () -> validator.requireRoomId(null));
        assertEquals(ErrorCode.JOIN_001, missing.getErrorCode());
        assertThrows(ProtocolViolationException.class, () -> validator.requireRoomId("   "));
    }

    @Test
    void overlongRoomIdIsRejected() {
        String longId = "r".repeat(validator.getMaxRoomIdLength() + 1);

        ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> validator.requireRoomId(longId));
        assertEquals(ErrorCode.JOIN_003, e.getErrorCode());
        assertFalse(validator.isValidRoomId(longId));
        assertTrue(validator.isValidRoomId("room-1"));
    }

    @Test
    void onlyPhoneAndDesktopAreRoles() {
        assertEquals(PeerRole.PHONE, validator.requireRole("phone"));
        assertEquals(PeerRole.DESKTOP, validator.requireRole("desktop"));

        ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> validator.requireRole("tablet"));
        assertEquals(ErrorCode.JOIN_002, e.getErrorCode());
        assertThrows(ProtocolViolationException.class, () -> validator.requireRole(null));
        assertThrows(ProtocolViolationException.class, () -> validator.requireRole("Phone"));
    }

    @Test
    void blankCameraTypeCountsAsAbsent() {
        assertNull(validator.cameraTypeOrNull(null));
        assertNull(validator.cameraTypeOrNull("  "));
        assertEquals("rear", validator.cameraTypeOrNull(" rear "));
    }
}
