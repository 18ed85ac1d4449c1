package com.visionrelay.model;

import java.util.Optional;

/**
 * The two roles a room can hold.
 * The phone is the WebRTC offerer, the desktop the answerer.
 */
public enum PeerRole {
    PHONE("phone"),
    DESKTOP("desktop");

    private final String wireName;

    PeerRole(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public PeerRole opposite() {
        return this == PHONE ? DESKTOP : PHONE;
    }

    /**
     * Resolve a role from its wire name ("phone" / "desktop").
     */
    public static Optional<PeerRole> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PeerRole role : values()) {
            if (role.wireName.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
