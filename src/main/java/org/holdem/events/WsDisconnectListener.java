package org.holdem.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.service.PokerTableService;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/** A closed socket counts as leaving every table the session sat at. */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsDisconnectListener {

    private final PokerTableService service;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent e) {
        log.debug("Session {} closed ({})", e.getSessionId(), e.getCloseStatus());
        service.disconnect(e.getSessionId());
    }
}
