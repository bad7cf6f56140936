package com.phillippitts.callagent.config;

import com.phillippitts.callagent.presentation.websocket.MediaStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the telephony media stream endpoint at {@code /media} and {@code /media/{callId}}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final MediaStreamWebSocketHandler mediaStreamHandler;

    public WebSocketConfig(MediaStreamWebSocketHandler mediaStreamHandler) {
        this.mediaStreamHandler = mediaStreamHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(mediaStreamHandler, "/media", "/media/*")
                .setAllowedOrigins("*");
    }
}
