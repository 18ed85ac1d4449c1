package com.visionrelay.exception;

import com.visionrelay.dto.ErrorResponse.ErrorCode;

/**
 * A client broke the signaling protocol (bad join, role/type mismatch).
 * Fatal to the offending connection only.
 */
public class ProtocolViolationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    public ProtocolViolationException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.details = null;
    }

    public ProtocolViolationException(ErrorCode errorCode, String details) {
        super(errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
        this.details = details;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetails() {
        return details;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
