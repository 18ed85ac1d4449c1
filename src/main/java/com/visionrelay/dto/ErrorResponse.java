package com.visionrelay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Standardized error payload.
 * Sent over the WebSocket as a {@code type: "error"} record and returned by the status API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String type;
    private String code;
    private String message;
    private String details;
    private LocalDateTime timestamp;
    private String path;

    // Default constructor
    public ErrorResponse() {
        this.timestamp = LocalDateTime.now();
    }

    public ErrorResponse(String code, String message) {
        this();
        this.code = code;
        this.message = message;
        this.type = "error";
    }

    // Static factory methods
    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String details) {
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
        response.setDetails(details);
        return response;
    }

    // Error code enum for standardized codes
    public enum ErrorCode {
        // Join errors (JOIN_XXX)
        JOIN_001("JOIN_001", "Missing roomId"),
        JOIN_002("JOIN_002", "Invalid role"),
        JOIN_003("JOIN_003", "Invalid roomId"),

        // Negotiation errors (SIG_XXX)
        SIG_001("SIG_001", "Message type not allowed for role"),
        SIG_002("SIG_002", "Answer received before offer"),

        // Message format errors (MSG_XXX)
        MSG_001("MSG_001", "Invalid JSON"),
        MSG_002("MSG_002", "Missing 'type' field"),

        // Room lookup (ROOM_XXX)
        ROOM_001("ROOM_001", "Room not found"),

        // General errors
        GENERAL("GEN_001", "An error occurred");

        private final String code;
        private final String message;

        ErrorCode(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }

    // Getters and Setters
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
