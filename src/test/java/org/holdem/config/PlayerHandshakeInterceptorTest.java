package org.holdem.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PlayerHandshakeInterceptorTest {

    private final PlayerHandshakeInterceptor interceptor = new PlayerHandshakeInterceptor();

    private boolean handshake(String name, MockHttpServletResponse res, Map<String, Object> attrs) {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/ws");
        if (name != null) req.setParameter("name", name);
        return interceptor.beforeHandshake(new ServletServerHttpRequest(req), new ServletServerHttpResponse(res), null, attrs);
    }

    @Test
    void nomPresent_gardeDansLaSession() {
        Map<String, Object> attrs = new HashMap<>();

        assertThat(handshake("  alice ", new MockHttpServletResponse(), attrs)).isTrue();
        assertThat(attrs).containsEntry(PlayerHandshakeInterceptor.PLAYER_ATTR, "alice");
    }

    @Test
    void nomTropLong_tronque() {
        Map<String, Object> attrs = new HashMap<>();

        handshake("abcdefghijklmnopqrstuvwxyz", new MockHttpServletResponse(), attrs);

        assertThat((String) attrs.get(PlayerHandshakeInterceptor.PLAYER_ATTR)).hasSize(20);
    }

    @Test
    void sansNom_connexionRefusee() {
        MockHttpServletResponse res = new MockHttpServletResponse();
        Map<String, Object> attrs = new HashMap<>();

        assertThat(handshake(null, res, attrs)).isFalse();
        assertThat(attrs).isEmpty();
    }
}
