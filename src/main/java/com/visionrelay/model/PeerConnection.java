package com.visionrelay.model;

import org.springframework.web.reactive.socket.CloseStatus;

/**
 * Handle on one live client socket.
 *
 * Implementations own the single outbound writer of their socket, so
 * {@link #send(String)} may be called from any thread.
 */
public interface PeerConnection {

    String getId();

    /**
     * Whether the socket can still accept outbound messages.
     */
    boolean isOpen();

    /**
     * Queue a text message for delivery.
     *
     * @return {@code false} when the socket is closed or the message could not be queued
     */
    boolean send(String text);

    /**
     * Flush pending messages and close the socket with the given status.
     */
    void close(CloseStatus status);
}
