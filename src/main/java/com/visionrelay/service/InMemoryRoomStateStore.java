package com.visionrelay.service;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.visionrelay.model.PeerRole;
import com.visionrelay.model.Room;

/**
 * Process-local {@link RoomStateStore}. Nothing survives a restart.
 */
@Service
public class InMemoryRoomStateStore implements RoomStateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRoomStateStore.class);

    // Room ID -> Room mapping
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    @Override
    public Room getOrCreateRoom(String roomId) {
        return rooms.computeIfAbsent(roomId, id -> {
            logger.debug("📦 Room state created: {}", id);
            return new Room(id);
        });
    }

    @Override
    public Optional<Room> findRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    @Override
    public Set<PeerRole> listRoles(String roomId) {
        Room room = rooms.get(roomId);
        Set<PeerRole> roles = EnumSet.noneOf(PeerRole.class);
        if (room == null) {
            return roles;
        }
        synchronized (room) {
            for (PeerRole role : PeerRole.values()) {
                if (room.isConnected(role)) {
                    roles.add(role);
                }
            }
        }
        return roles;
    }

    @Override
    public boolean purgeIfEmpty(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return false;
        }
        synchronized (room) {
            if (room.isPurged() || !room.isEmpty()) {
                return false;
            }
            room.markPurged();
            rooms.remove(roomId, room);
        }
        logger.info("🗑️ Room purged: {}", roomId);
        return true;
    }

    @Override
    public int roomCount() {
        return rooms.size();
    }
}
