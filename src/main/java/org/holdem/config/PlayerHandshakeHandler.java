package org.holdem.config;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.security.Principal;
import java.util.Map;

/** Makes the player name the STOMP user, so user destinations route by name. */
public class PlayerHandshakeHandler extends DefaultHandshakeHandler {

    public record PlayerPrincipal(String name) implements Principal {
        @Override
        public String getName() { return name; }
    }

    @Override
    protected Principal determineUser(ServerHttpRequest request,
                                      WebSocketHandler wsHandler,
                                      Map<String, Object> attributes) {
        Object name = attributes.get(PlayerHandshakeInterceptor.PLAYER_ATTR);
        if (name instanceof String s && !s.isBlank()) return new PlayerPrincipal(s);
        return super.determineUser(request, wsHandler, attributes);
    }
}
