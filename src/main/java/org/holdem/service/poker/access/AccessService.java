package org.holdem.service.poker.access;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.dto.poker.TableEvent;
import org.holdem.model.poker.PokerTable;
import org.holdem.service.poker.registry.ConnectionRegistry;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Fan-out of table events to the connections registered at a table. Each connection
 * gets its own copy on its user queue, so a failed delivery only costs that connection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessService {
    private final ConnectionRegistry connections;
    private final SimpMessagingTemplate broker;

    public static final String ERROR_QUEUE = "/queue/poker/errors";

    public static String tableQueue(String tableId) {
        return "/queue/poker/table/" + tableId;
    }

    /** Diffuse un événement à tous les joueurs connectés à la table. */
    public void broadcastToTable(PokerTable t, String type, Object payload) {
        TableEvent evt = TableEvent.builder().type(type).payload(payload).build();
        for (String player : connections.playersOf(t.getId())) {
            deliver(t.getId(), player, evt);
        }
    }

    /** Private event, e.g. the hole cards: only {@code player}'s connection receives it. */
    public void sendToPlayer(PokerTable t, String player, String type, Object payload) {
        deliver(t.getId(), player, TableEvent.builder().type(type).payload(payload).build());
    }

    /** Rejected command: reported to the sender only, nothing else changes. */
    public void sendError(String player, String message) {
        TableEvent evt = TableEvent.builder()
                .type(TableEvent.ERROR)
                .payload(Map.of("message", message))
                .build();
        try {
            broker.convertAndSendToUser(player, ERROR_QUEUE, evt);
        } catch (MessagingException ex) {
            log.warn("Could not report error to {}: {}", player, ex.getMessage());
        }
    }

    private void deliver(String tableId, String player, TableEvent evt) {
        // seule la session liée à la table reçoit, pas les autres sockets du même nom
        String session = connections.sessionOf(tableId, player).orElse(null);
        if (session == null) return;
        try {
            broker.convertAndSendToUser(player, tableQueue(tableId), evt, sessionHeaders(session));
        } catch (MessagingException ex) {
            // connexion perdue : on la retire sans toucher à la partie
            log.warn("Delivery of {} to {} at table {} failed, dropping connection: {}",
                    evt.getType(), player, tableId, ex.getMessage());
            connections.remove(tableId, player);
        }
    }

    static MessageHeaders sessionHeaders(String sessionId) {
        SimpMessageHeaderAccessor acc = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        acc.setSessionId(sessionId);
        acc.setLeaveMutable(true);
        return acc.getMessageHeaders();
    }
}
