package com.chatroom.sync.common.config;

import com.chatroom.sync.chat.ws.ChatWsHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String CHAT_PATH = "/ws/chat";

    private final ChatWsHandler chatWsHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            ChatWsHandler chatWsHandler,
            @Value("${app.ws.allowed-origins:*}") String allowedOriginsCsv
    ) {
        this.chatWsHandler = chatWsHandler;
        this.allowedOrigins = parseOrigins(allowedOriginsCsv);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWsHandler, CHAT_PATH)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    private static String[] parseOrigins(String csv) {
        if (csv == null || csv.isBlank()) {
            return new String[]{"*"};
        }
        var parsed = Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
        return parsed.length == 0 ? new String[]{"*"} : parsed;
    }
}
