package com.visionrelay.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.visionrelay.model.PeerConnection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link PeerConnection} over a WebFlux session.
 *
 * All outbound messages go through one sink subscribed by {@code session.send},
 * which is the only writer of the socket. Emission is synchronized because
 * relay traffic and inference results arrive on different threads.
 */
public class WebSocketPeerConnection implements PeerConnection {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketPeerConnection.class);

    private final WebSocketSession session;
    private final Sinks.Many<WebSocketMessage> outbound;

    private volatile boolean closing;
    private volatile CloseStatus closeStatus = CloseStatus.NORMAL;

    public WebSocketPeerConnection(WebSocketSession session, int bufferSize) {
        this.session = session;
        this.outbound = Sinks.many().multicast().onBackpressureBuffer(bufferSize);
    }

    /**
     * Messages to write, completed once {@link #close(CloseStatus)} or {@link #release()} is called.
     */
    public Flux<WebSocketMessage> outbound() {
        return outbound.asFlux();
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return !closing && session.isOpen();
    }

    @Override
    public synchronized boolean send(String text) {
        if (!isOpen()) {
            return false;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(session.textMessage(text));
        if (result.isFailure()) {
            logger.warn("Failed to emit to {}: {}", session.getId(), result);
            return false;
        }
        return true;
    }

    @Override
    public synchronized void close(CloseStatus status) {
        if (closing) {
            return;
        }
        this.closeStatus = status;
        this.closing = true;
        outbound.tryEmitComplete();
    }

    /**
     * Stop accepting messages after the peer went away.
     */
    public synchronized void release() {
        closing = true;
        outbound.tryEmitComplete();
    }

    public CloseStatus getCloseStatus() {
        return closeStatus;
    }
}
