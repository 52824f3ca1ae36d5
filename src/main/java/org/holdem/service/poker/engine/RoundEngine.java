package org.holdem.service.poker.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.config.TableSettings;
import org.holdem.dto.poker.TableEvent;
import org.holdem.exception.PokerException;
import org.holdem.model.poker.HoldemHand;
import org.holdem.model.poker.PlayerAction;
import org.holdem.model.poker.PokerPlayer;
import org.holdem.model.poker.PokerTable;
import org.holdem.model.poker.rules.Settlement;
import org.holdem.service.poker.access.AccessService;
import org.holdem.service.poker.util.DeckFactory;
import org.holdem.service.poker.util.Locks;
import org.holdem.service.poker.util.Payloads;
import org.holdem.service.poker.util.Timeouts;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hand lifecycle of a table: debounced start, action routing, showdown and the hand
 * that follows. Public methods other than the timer callback expect the caller to
 * hold {@code locks.of(table)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundEngine {
    private final TableSettings settings;
    private final AccessService access;
    private final Payloads payloads;
    private final Timeouts timeouts;
    private final Locks locks;
    private final DeckFactory decks;

    static final String START_TIMER = "start";

    /**
     * Arms the start timer once enough players sit at an idle table. Extra joins before
     * it fires ride along in the same hand.
     */
    public void armStartIfEligible(PokerTable t) {
        if (t.isHandActive() || t.isStartPending()) return;
        if (t.playableCount() < settings.getMinSeats()) return;

        long token = t.nextStartToken();
        t.setPendingStart(timeouts.schedule(t.getId(), START_TIMER, settings.getStartDelayMs(),
                () -> onStartTimer(t, token)));
        log.info("Table {}: hand starts in {} ms ({} seated)", t.getId(), settings.getStartDelayMs(), t.getSeated().size());
    }

    /** Timer callback; runs on the timer thread, so it takes the table lock itself. */
    void onStartTimer(PokerTable t, long token) {
        synchronized (locks.of(t.getId())) {
            // annulé ou remplacé entre-temps
            if (t.getStartToken() != token || !t.isStartPending()) return;
            t.setPendingStart(null);
            if (t.isHandActive()) return;
            if (t.playableCount() < settings.getMinSeats()) {
                access.broadcastToTable(t, TableEvent.GAME_CANCELLED,
                        payloads.message("Not enough players to start"));
                return;
            }
            startHand(t);
        }
    }

    /** Cancels a pending start and tells the table. No-op when nothing is pending. */
    public void cancelPendingStart(PokerTable t, String reason) {
        if (!t.isStartPending()) return;
        timeouts.cancel(t.getPendingStart());
        t.setPendingStart(null);
        t.nextStartToken();
        log.info("Table {}: pending start cancelled ({})", t.getId(), reason);
        access.broadcastToTable(t, TableEvent.GAME_CANCELLED, payloads.message(reason));
    }

    /** Deals a new hand. Single-flight: does nothing while a hand is already running. */
    public void startHand(PokerTable t) {
        if (t.isHandActive()) return;
        if (t.isStartPending()) {
            timeouts.cancel(t.getPendingStart());
            t.setPendingStart(null);
            t.nextStartToken();
        }
        List<PokerPlayer> dealtIn = t.playablePlayers();
        if (dealtIn.size() < settings.getMinSeats()) return;

        HoldemHand hand;
        try {
            hand = HoldemHand.start(dealtIn, t.getDealerIndex(),
                    settings.getSmallBlind(), settings.getBigBlind(), decks.newDeck());
        } catch (IllegalStateException ex) {
            log.error("Table {}: could not deal a hand", t.getId(), ex);
            access.broadcastToTable(t, TableEvent.ERROR, payloads.message("Could not deal a hand"));
            return;
        }
        t.setHand(hand);
        t.setDealerIndex(hand.getDealerIndex());
        t.setHandCount(t.getHandCount() + 1);
        log.info("Table {}: hand #{} started, dealer {}", t.getId(), t.getHandCount(),
                hand.getPlayers().get(hand.getDealerIndex()).getName());

        access.broadcastToTable(t, TableEvent.START, payloads.message("Hand #" + t.getHandCount() + " started"));
        for (PokerPlayer p : hand.getPlayers()) {
            if (!p.getHand().isEmpty()) access.sendToPlayer(t, p.getName(), TableEvent.HAND, payloads.privateHand(p));
        }
        broadcastUpdate(t);

        // blindes à tapis : la main peut se terminer sans aucune action
        if (hand.isOver()) finishHand(t, false);
    }

    /**
     * Routes a player action into the running hand. Rule violations surface as
     * {@link PokerException} with the hand untouched.
     */
    public void onPlayerAction(PokerTable t, String player, PlayerAction action) {
        HoldemHand hand = t.getHand();
        if (hand == null) throw new PokerException(PokerException.Reason.INVALID_ACTION, "no hand in progress");
        try {
            hand.takeAction(player, action);
        } catch (PokerException ex) {
            throw ex;
        } catch (IllegalStateException ex) {
            log.error("Table {}: hand corrupted by {}'s action", t.getId(), player, ex);
            abortHand(t, "Hand aborted after an internal error");
            return;
        }
        afterChange(t);
    }

    /** Folds a departed player out of the running hand, if they were dealt in. */
    public void forfeit(PokerTable t, String player) {
        HoldemHand hand = t.getHand();
        if (hand == null || !hand.hasPlayer(player)) return;
        try {
            hand.forfeit(player);
        } catch (IllegalStateException ex) {
            log.error("Table {}: hand corrupted while folding {}", t.getId(), player, ex);
            abortHand(t, "Hand aborted after an internal error");
            return;
        }
        afterChange(t);
    }

    private void afterChange(PokerTable t) {
        HoldemHand hand = t.getHand();
        broadcastUpdate(t);
        if (hand.isOver()) finishHand(t, true);
    }

    /**
     * Drops the running hand without settling it. What was already committed to the
     * pot stays there and is lost.
     */
    public void abortHand(PokerTable t, String message) {
        HoldemHand hand = t.getHand();
        if (hand == null) return;
        t.setHand(null);
        log.warn("Table {}: hand #{} aborted in {}, {} chips left in the pot",
                t.getId(), t.getHandCount(), hand.getPhase(), hand.getPot());
        access.broadcastToTable(t, TableEvent.ERROR, payloads.message(message));
        if (t.mergeWaiting() > 0) broadcastSeating(t);
        armStartIfEligible(t);
    }

    /**
     * Closes a settled hand: waiting players sit down and, with enough players, the
     * next hand is dealt at once. A hand that ended at the deal re-arms the timer
     * instead, so all-in blinds cannot chain hands forever.
     */
    void finishHand(PokerTable t, boolean dealNext) {
        HoldemHand hand = t.getHand();
        Settlement s = hand.getSettlement();
        t.setHand(null);
        log.info("Table {}: hand #{} over, {}", t.getId(), t.getHandCount(), hand.getLastMessage());
        if (s != null && s.unclaimed() > 0)
            log.warn("Table {}: {} chips in pots nobody could claim", t.getId(), s.unclaimed());
        if (s != null && s.oddChips() > 0)
            log.warn("Table {}: {} odd chip(s) left by a split pot", t.getId(), s.oddChips());

        if (t.mergeWaiting() > 0) log.info("Table {}: waiting players seated", t.getId());
        broadcastSeating(t);

        if (t.playableCount() < settings.getMinSeats()) {
            log.info("Table {}: idle, waiting for players", t.getId());
            return;
        }
        if (dealNext) startHand(t);
        else armStartIfEligible(t);
    }

    public void broadcastUpdate(PokerTable t) {
        HoldemHand hand = t.getHand();
        if (hand == null) return;
        access.broadcastToTable(t, TableEvent.UPDATE, payloads.update(hand, hand.getLastMessage()));
    }

    public void broadcastSeating(PokerTable t) {
        access.broadcastToTable(t, TableEvent.TABLE_UPDATE, payloads.seating(t));
    }
}
