package com.visionrelay.service;

/**
 * Notified after a room has been purged from the state store.
 */
@FunctionalInterface
public interface RoomLifecycleListener {

    void onRoomPurged(String roomId);
}
