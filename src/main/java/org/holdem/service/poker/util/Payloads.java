package org.holdem.service.poker.util;

import org.holdem.dto.poker.PlayerView;
import org.holdem.model.poker.HoldemHand;
import org.holdem.model.poker.PokerPlayer;
import org.holdem.model.poker.PokerTable;
import org.springframework.stereotype.Component;

import java.util.*;

/** Builds the maps sent over the wire. Keys follow the client protocol (snake_case). */
@Component
public class Payloads {

    public Map<String, Object> tableAssigned(PokerTable t) {
        return Map.of("table_id", t.getId());
    }

    public Map<String, Object> seating(PokerTable t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("seated", t.seatedNames());
        m.put("waiting", t.waitingNames());
        return m;
    }

    public Map<String, Object> message(String message) {
        return Map.of("message", message);
    }

    public Map<String, Object> privateHand(PokerPlayer p) {
        return Map.of("cards", List.copyOf(p.getHand()));
    }

    public Map<String, Object> update(HoldemHand h, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("message", message);
        m.put("players", h.getPlayers().stream().map(PlayerView::of).toList());
        m.put("pot", h.getPot());
        m.put("phase", h.getPhase().name());
        m.put("current_turn", h.currentTurnPlayer().map(PokerPlayer::getName).orElse(null));
        m.put("community_cards", List.copyOf(h.getCommunityCards()));
        return m;
    }

    /** Lobby view of a table, hand included when one is running. */
    public Map<String, Object> tableState(PokerTable t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("tableId", t.getId());
        m.put("maxSeats", t.getMaxSeats());
        m.putAll(seating(t));
        m.put("startPending", t.isStartPending());
        HoldemHand h = t.getHand();
        m.put("hand", h == null ? null : update(h, h.getLastMessage()));
        return m;
    }
}
