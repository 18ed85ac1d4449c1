package com.visionrelay.service;

import java.util.Optional;
import java.util.Set;

import com.visionrelay.model.PeerRole;
import com.visionrelay.model.Room;

/**
 * Owner of per-room signaling state for the lifetime of a session.
 *
 * Callers mutate a returned {@link Room} while holding its monitor; a room
 * removed by {@link #purgeIfEmpty(String)} is marked purged and never handed
 * out again.
 */
public interface RoomStateStore {

    /**
     * Existing room for the id, or a newly created empty one.
     */
    Room getOrCreateRoom(String roomId);

    Optional<Room> findRoom(String roomId);

    /**
     * Roles whose connected flag is set in the room; empty for unknown rooms.
     */
    Set<PeerRole> listRoles(String roomId);

    /**
     * Remove the room if neither role is connected.
     *
     * @return whether the room was removed
     */
    boolean purgeIfEmpty(String roomId);

    int roomCount();
}
