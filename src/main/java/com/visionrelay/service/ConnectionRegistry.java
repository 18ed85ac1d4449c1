package com.visionrelay.service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.visionrelay.model.PeerConnection;
import com.visionrelay.model.PeerRole;

/**
 * Live sockets per room and role, at most one per role. Rebuilt per process.
 */
@Service
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    // Room ID -> (role -> connection)
    private final Map<String, Map<PeerRole, PeerConnection>> connections = new ConcurrentHashMap<>();

    /**
     * Put the connection into the role slot.
     *
     * @return the connection previously holding the slot, or {@code null}
     */
    public PeerConnection register(String roomId, PeerRole role, PeerConnection connection) {
        return connections.computeIfAbsent(roomId, id -> new ConcurrentHashMap<>()).put(role, connection);
    }

    /**
     * The live connection holding the slot. A closed handle is skipped but keeps
     * the slot until its own disconnect releases it.
     */
    public Optional<PeerConnection> find(String roomId, PeerRole role) {
        Map<PeerRole, PeerConnection> slots = connections.get(roomId);
        if (slots == null) {
            return Optional.empty();
        }
        PeerConnection connection = slots.get(role);
        if (connection == null) {
            return Optional.empty();
        }
        if (!connection.isOpen()) {
            logger.debug("Skipping closed {} socket {} in room {}", role, connection.getId(), roomId);
            return Optional.empty();
        }
        return Optional.of(connection);
    }

    /**
     * Clear the slot only if it is still held by this connection.
     *
     * @return whether the slot was cleared
     */
    public boolean unregister(String roomId, PeerRole role, PeerConnection connection) {
        Map<PeerRole, PeerConnection> slots = connections.get(roomId);
        return slots != null && slots.remove(role, connection);
    }

    public void removeRoom(String roomId) {
        connections.remove(roomId);
    }

    public int connectionCount() {
        return connections.values().stream().mapToInt(Map::size).sum();
    }
}
