package org.holdem.service.poker.entry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.config.TableSettings;
import org.holdem.dto.poker.TableEvent;
import org.holdem.exception.PokerException;
import org.holdem.model.poker.PokerPlayer;
import org.holdem.model.poker.PokerTable;
import org.holdem.service.poker.access.AccessService;
import org.holdem.service.poker.engine.RoundEngine;
import org.holdem.service.poker.registry.ConnectionRegistry;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.util.Locks;
import org.holdem.service.poker.util.Payloads;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Arrivals and departures: seating, waiting list, connection bookkeeping. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryService {
    private final TableRegistry registry;
    private final ConnectionRegistry connections;
    private final AccessService access;
    private final RoundEngine engine;
    private final Payloads payloads;
    private final Locks locks;
    private final TableSettings settings;

    // un joueur ne peut être inscrit que sur une table à la fois
    private final Map<String, String> userTable = new ConcurrentHashMap<>();

    /**
     * Seats {@code player} at {@code tableId}, or at the first table with room when no id
     * is given. Mid-hand arrivals wait for the next hand.
     */
    public PokerTable join(String player, String tableId, String sessionId) {
        if (tableId != null && !tableId.isBlank()) {
            return enter(registry.getOrCreate(tableId.trim()), player, sessionId);
        }
        String current = userTable.get(player);
        if (current != null) {
            return enter(registry.get(current), player, sessionId);
        }
        Optional<PokerTable> candidate = registry.findNotFull();
        if (candidate.isPresent()) {
            try {
                return enter(candidate.get(), player, sessionId);
            } catch (PokerException ex) {
                if (ex.getReason() != PokerException.Reason.TABLE_FULL) throw ex;
                // remplie entre-temps
            }
        }
        return enter(registry.create(), player, sessionId);
    }

    private PokerTable enter(PokerTable t, String player, String sessionId) {
        synchronized (locks.of(t.getId())) {
            if (registry.find(t.getId()).orElse(null) != t) {
                // table retirée pendant qu'on attendait le verrou
                return enter(registry.getOrCreate(t.getId()), player, sessionId);
            }
            String already = userTable.get(player);
            if (already != null && !already.equals(t.getId())) {
                throw new PokerException(PokerException.Reason.ALREADY_SEATED, "table " + already);
            }

            if (t.find(player).isEmpty()) {
                if (t.isFull()) throw new PokerException(PokerException.Reason.TABLE_FULL);
                PokerPlayer p = new PokerPlayer(player, settings.getStartingChips());
                if (t.isHandActive()) t.addWaiting(p);
                else t.seat(p);
                log.info("Table {}: {} joined ({})", t.getId(), player, t.isHandActive() ? "waiting" : "seated");
            }
            userTable.put(player, t.getId());
            connections.register(t.getId(), player, sessionId);
            t.setLastActiveAt(Instant.now());

            access.sendToPlayer(t, player, TableEvent.TABLE_ASSIGNED, payloads.tableAssigned(t));
            engine.broadcastSeating(t);
            engine.armStartIfEligible(t);
            return t;
        }
    }

    /** Voluntary departure from {@code tableId}. */
    public void leave(String player, String tableId) {
        PokerTable t = registry.find(tableId).orElse(null);
        if (t == null) return;
        synchronized (locks.of(t.getId())) {
            depart(t, player);
        }
    }

    /** The socket behind {@code sessionId} is gone: the player leaves every table it was bound to. */
    public void disconnect(String sessionId) {
        for (ConnectionRegistry.Binding b : connections.bindingsOf(sessionId)) {
            PokerTable t = registry.find(b.tableId()).orElse(null);
            if (t == null) continue;
            synchronized (locks.of(t.getId())) {
                log.info("Table {}: {} disconnected", t.getId(), b.player());
                depart(t, b.player());
            }
        }
    }

    private void depart(PokerTable t, String player) {
        connections.remove(t.getId(), player);
        userTable.remove(player, t.getId());
        boolean removed = t.remove(player);
        t.setLastActiveAt(Instant.now());
        if (!removed) return;

        if (t.isStartPending() && t.playableCount() < settings.getMinSeats()) {
            engine.cancelPendingStart(t, "Not enough players, start cancelled");
        }
        if (t.isHandActive()) {
            // un joueur à tapis n'a plus de jetons mais reste dans la main
            if (t.getSeated().size() < settings.getMinSeats()) engine.abortHand(t, "Not enough players, hand aborted");
            else engine.forfeit(t, player);
        }
        engine.broadcastSeating(t);
    }

    /** Forgets everyone seated at a table that is being removed. */
    public void onTableClosed(PokerTable t) {
        for (String name : t.seatedNames()) userTable.remove(name, t.getId());
        for (String name : t.waitingNames()) userTable.remove(name, t.getId());
        connections.dropTable(t.getId());
    }

    public Optional<String> tableOf(String player) {
        return Optional.ofNullable(userTable.get(player));
    }
}
