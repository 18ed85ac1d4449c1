package com.visionrelay.model;

import java.util.Optional;

/**
 * Values of the {@code type} discriminator carried by every message on the channel.
 */
public enum MessageType {
    JOIN("join"),
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),
    FRAME_FOR_INFERENCE("frame-for-inference"),
    INFERENCE_RESULT("inference-result"),
    ERROR("error");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * True for the three negotiation messages that are persisted and relayed.
     */
    public boolean isSignal() {
        return this == OFFER || this == ANSWER || this == ICE_CANDIDATE;
    }

    public static Optional<MessageType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MessageType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
