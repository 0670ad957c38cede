package com.cinema.seatselection.config;

import com.cinema.seatselection.websocket.BearerTokenHandshakeInterceptor;
import com.cinema.seatselection.websocket.SeatSelectionWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final SeatSelectionWebSocketHandler seatSelectionWebSocketHandler;
    private final BearerTokenHandshakeInterceptor bearerTokenHandshakeInterceptor;

    @Value("${seat-selection.websocket.endpoint:/ws/seat-selection}")
    private String endpoint;

    @Value("${seat-selection.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(seatSelectionWebSocketHandler, endpoint)
            .addInterceptors(bearerTokenHandshakeInterceptor)
            .setAllowedOriginPatterns(allowedOrigins);
    }
}
