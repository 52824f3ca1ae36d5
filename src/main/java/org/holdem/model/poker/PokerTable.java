package org.holdem.model.poker;

import lombok.Data;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ScheduledFuture;

/**
 * A table and everything it owns: seating, the hand in progress and the pending
 * start timer. Callers hold the table's lock for every read-modify-write.
 */
@Data
public class PokerTable {
    private final String id;
    private final int maxSeats;

    private final List<PokerPlayer> seated = new ArrayList<>();
    // arrivés pendant une main, assis à la suivante
    private final List<PokerPlayer> waiting = new ArrayList<>();

    private int dealerIndex = -1;
    private HoldemHand hand;
    private int handCount = 0;

    private ScheduledFuture<?> pendingStart;
    /** Bumped on every arm/cancel so a stale timer can tell it lost. */
    private long startToken = 0;

    private Instant createdAt = Instant.now();
    private Instant lastActiveAt = Instant.now();

    public PokerTable(String id, int maxSeats) {
        this.id = id;
        this.maxSeats = maxSeats;
    }

    public boolean isHandActive() {
        return hand != null;
    }

    public boolean isStartPending() {
        return pendingStart != null;
    }

    public long nextStartToken() {
        return ++startToken;
    }

    public boolean isFull() {
        return seated.size() + waiting.size() >= maxSeats;
    }

    public Optional<PokerPlayer> find(String name) {
        return seatedOrWaiting().filter(p -> p.getName().equals(name)).findFirst();
    }

    /** Adds {@code p} to the seated list unless a player of that name is already there. */
    public boolean seat(PokerPlayer p) {
        return addUnique(seated, p);
    }

    public boolean addWaiting(PokerPlayer p) {
        return addUnique(waiting, p);
    }

    public boolean remove(String name) {
        boolean a = seated.removeIf(p -> p.getName().equals(name));
        boolean b = waiting.removeIf(p -> p.getName().equals(name));
        return a || b;
    }

    /** Moves the waiting players to the seated list, skipping names already seated. */
    public int mergeWaiting() {
        int moved = 0;
        for (PokerPlayer p : waiting) {
            if (seat(p)) moved++;
        }
        waiting.clear();
        return moved;
    }

    /** Seated players with chips, the ones a new hand would deal in. */
    public List<PokerPlayer> playablePlayers() {
        return seated.stream().filter(p -> p.getChips() > 0).toList();
    }

    public int playableCount() {
        return playablePlayers().size();
    }

    public List<String> seatedNames() {
        return seated.stream().map(PokerPlayer::getName).toList();
    }

    public List<String> waitingNames() {
        return waiting.stream().map(PokerPlayer::getName).toList();
    }

    private java.util.stream.Stream<PokerPlayer> seatedOrWaiting() {
        return java.util.stream.Stream.concat(seated.stream(), waiting.stream());
    }

    private static boolean addUnique(List<PokerPlayer> list, PokerPlayer p) {
        for (PokerPlayer q : list) {
            if (q.getName().equals(p.getName())) return false;
        }
        list.add(p);
        return true;
    }
}
