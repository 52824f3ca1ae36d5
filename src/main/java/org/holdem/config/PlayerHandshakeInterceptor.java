package org.holdem.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Reads the player name from the {@code name} query parameter and keeps it in the
 * WS session. No name, no connection.
 */
@Component
public class PlayerHandshakeInterceptor implements HandshakeInterceptor {

    public static final String PLAYER_ATTR = "player";
    static final int MAX_NAME_LENGTH = 20;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        if (request instanceof ServletServerHttpRequest http) {
            HttpServletRequest req = http.getServletRequest();
            String name = req.getParameter("name");
            if (name == null || name.isBlank()) {
                response.setStatusCode(HttpStatus.BAD_REQUEST);
                return false; // ⛔ stoppe la connexion
            }
            name = name.trim();
            if (name.length() > MAX_NAME_LENGTH) name = name.substring(0, MAX_NAME_LENGTH);
            attributes.put(PLAYER_ATTR, name);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               @Nullable Exception ex) {
    }
}
