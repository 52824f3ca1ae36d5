package org.holdem.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.*;

@Configuration
@EnableWebSocketMessageBroker
public class WsConfig implements WebSocketMessageBrokerConfigurer {

    private final PlayerHandshakeInterceptor playerHandshakeInterceptor;

    // mêmes origines que CORS
    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOrigins;

    public WsConfig(PlayerHandshakeInterceptor hs) {
        this.playerHandshakeInterceptor = hs;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] patterns = allowedOrigins.split("\\s*,\\s*");
        // les messages d'une même connexion sont traités dans l'ordre de réception
        registry.setPreserveReceiveOrder(true);
        registry.addEndpoint("/ws")
                .addInterceptors(playerHandshakeInterceptor)
                .setHandshakeHandler(new PlayerHandshakeHandler())
                .setAllowedOriginPatterns(patterns)
                .withSockJS();
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
        registry.setMessageSizeLimit(64 * 1024)
                .setSendBufferSizeLimit(512 * 1024)
                .setSendTimeLimit(15_000);
    }

    private ThreadPoolTaskScheduler heartbeatScheduler() {
        ThreadPoolTaskScheduler ts = new ThreadPoolTaskScheduler();
        ts.setPoolSize(1);
        ts.setThreadNamePrefix("ws-heartbeat-");
        ts.initialize();
        return ts;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        var simple = registry.enableSimpleBroker("/topic", "/queue");
        simple.setTaskScheduler(heartbeatScheduler());
        simple.setHeartbeatValue(new long[]{10_000, 10_000});
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
        registry.setPreservePublishOrder(true);
    }
}
