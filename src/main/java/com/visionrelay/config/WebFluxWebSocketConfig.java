package com.visionrelay.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.visionrelay.handler.SignalingWebSocketHandler;

import reactor.netty.http.server.WebsocketServerSpec;

/**
 * WebFlux WebSocket Configuration
 * Uses Netty for non-blocking WebSocket handling of the signaling channel
 */
@Configuration
public class WebFluxWebSocketConfig {

    private final SignalingWebSocketHandler signalingHandler;
    private final VisionRelayProperties properties;

    public WebFluxWebSocketConfig(SignalingWebSocketHandler signalingHandler,
                                  VisionRelayProperties properties) {
        this.signalingHandler = signalingHandler;
        this.properties = properties;
    }

    /**
     * Map WebSocket handlers to URL paths
     */
    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        Map<String, WebSocketHandler> map = new HashMap<>();
        map.put(properties.getWebsocket().getPath(), signalingHandler);

        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        handlerMapping.setUrlMap(map);
        return handlerMapping;
    }

    @Bean
    public WebSocketHandlerAdapter handlerAdapter() {
        return new WebSocketHandlerAdapter(webSocketService());
    }

    /**
     * Configure WebSocket service with Netty-specific settings
     * - Large max frame size so a base64 camera frame fits in one text frame
     */
    @Bean
    public WebSocketService webSocketService() {
        int maxFramePayloadLength = properties.getWebsocket().getMaxFramePayloadLength();
        ReactorNettyRequestUpgradeStrategy strategy = new ReactorNettyRequestUpgradeStrategy(
            () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxFramePayloadLength)
        );
        return new HandshakeWebSocketService(strategy);
    }
}
