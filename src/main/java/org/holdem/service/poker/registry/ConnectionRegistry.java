package org.holdem.service.poker.registry;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * table → player → STOMP session. A player has at most one connection per table;
 * registering again replaces the previous session.
 */
@Component
public class ConnectionRegistry {

    public record Binding(String tableId, String player) {}

    private final Map<String, Map<String, String>> byTable = new ConcurrentHashMap<>();
    private final Map<String, Set<Binding>> bySession = new ConcurrentHashMap<>();

    public void register(String tableId, String player, String sessionId) {
        String previous = byTable.computeIfAbsent(tableId, k -> new ConcurrentHashMap<>()).put(player, sessionId);
        Binding b = new Binding(tableId, player);
        if (previous != null && !previous.equals(sessionId)) unlink(previous, b);
        if (sessionId != null) bySession.computeIfAbsent(sessionId, k -> ConcurrentHashMap.newKeySet()).add(b);
    }

    /** @return true if a connection was registered for that player */
    public boolean remove(String tableId, String player) {
        Map<String, String> players = byTable.get(tableId);
        if (players == null) return false;
        String session = players.remove(player);
        if (session == null) return false;
        unlink(session, new Binding(tableId, player));
        return true;
    }

    /** Session currently bound to {@code player} at {@code tableId}. */
    public Optional<String> sessionOf(String tableId, String player) {
        Map<String, String> players = byTable.get(tableId);
        return players == null ? Optional.empty() : Optional.ofNullable(players.get(player));
    }

    public boolean isConnected(String tableId, String player) {
        Map<String, String> players = byTable.get(tableId);
        return players != null && players.containsKey(player);
    }

    /** Snapshot of the players with a live connection at {@code tableId}. */
    public List<String> playersOf(String tableId) {
        Map<String, String> players = byTable.get(tableId);
        return players == null ? List.of() : List.copyOf(players.keySet());
    }

    /** Tables a session is bound to, e.g. to clean up after a dropped socket. */
    public Set<Binding> bindingsOf(String sessionId) {
        Set<Binding> b = bySession.get(sessionId);
        return b == null ? Set.of() : Set.copyOf(b);
    }

    public void dropTable(String tableId) {
        Map<String, String> players = byTable.remove(tableId);
        if (players == null) return;
        players.forEach((player, session) -> unlink(session, new Binding(tableId, player)));
    }

    private void unlink(String sessionId, Binding b) {
        bySession.computeIfPresent(sessionId, (k, set) -> {
            set.remove(b);
            return set.isEmpty() ? null : set;
        });
    }
}
