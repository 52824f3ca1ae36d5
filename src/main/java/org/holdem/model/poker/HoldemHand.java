package org.holdem.model.poker;

import lombok.Getter;
import org.holdem.exception.PokerException;
import org.holdem.model.poker.rules.PotRules;
import org.holdem.model.poker.rules.Settlement;

import java.util.*;
import java.util.stream.Collectors;

/**
 * One hand of Hold'em, from the blinds to the showdown. The player list is fixed for the
 * life of the hand; chips move between the stacks, the pot and finally the settlement.
 * Not thread-safe: the owning table serializes every call.
 */
@Getter
public class HoldemHand {
    private final List<PokerPlayer> players;
    private final Deck deck;
    private final int dealerIndex;
    private final long smallBlind;
    private final long bigBlind;
    private final List<Card> communityCards = new ArrayList<>();

    private HandPhase phase = HandPhase.PRE_FLOP;
    private long pot = 0;
    /** Amount every player still in must match this round. */
    private long currentBet = 0;
    private int currentTurnIndex = -1;
    private Settlement settlement;
    private String lastMessage;

    private HoldemHand(List<PokerPlayer> players, int dealerIndex, long smallBlind, long bigBlind, Deck deck) {
        this.players = List.copyOf(players);
        this.dealerIndex = dealerIndex;
        this.smallBlind = smallBlind;
        this.bigBlind = bigBlind;
        this.deck = deck;
    }

    /**
     * Deals a new hand: the button moves one seat past {@code previousDealer}, hole cards
     * are dealt and both blinds posted.
     */
    public static HoldemHand start(List<PokerPlayer> players, int previousDealer,
                                   long smallBlind, long bigBlind, Deck deck) {
        int n = players.size();
        if (n < 2) throw new IllegalArgumentException("A hand needs at least two players");
        if (2 * n + 5 > Deck.SIZE) throw new IllegalArgumentException("Too many players for one deck: " + n);

        HoldemHand hand = new HoldemHand(players, Math.floorMod(previousDealer + 1, n), smallBlind, bigBlind, deck);
        hand.deal();
        return hand;
    }

    private void deal() {
        for (PokerPlayer p : players) p.resetForNextHand();
        for (PokerPlayer p : players) {
            if (p.isActive()) p.getHand().addAll(deck.draw(2));
        }

        int n = players.size();
        PokerPlayer sb = players.get((dealerIndex + 1) % n);
        PokerPlayer bb = players.get((dealerIndex + 2) % n);
        long sbPosted = post(sb, smallBlind);
        long bbPosted = post(bb, bigBlind);
        currentBet = bigBlind;

        // heads-up : le bouton (qui est aussi la grosse blinde) parle en premier
        int first = n == 2 ? dealerIndex : (dealerIndex + 3) % n;
        int actor = actorFrom(first);
        currentTurnIndex = actor >= 0 ? actor : activeFrom(first);
        lastMessage = sb.getName() + " posts small blind (" + sbPosted + "), "
                + bb.getName() + " posts big blind (" + bbPosted + ")";

        if (activeCount() == 1) {
            finishUncontested();
        } else if (actorCount() < 2 && isBettingRoundComplete()) {
            advancePhase();
        }
    }

    private long post(PokerPlayer p, long blind) {
        if (!p.isActive()) return 0;
        long amount = Math.min(blind, p.getChips());
        p.commit(amount);
        pot += amount;
        return amount;
    }

    /**
     * Applies {@code action} for {@code playerName}. A rejected action throws
     * {@link PokerException} and leaves the hand untouched.
     */
    public void takeAction(String playerName, PlayerAction action) {
        if (isOver()) throw new PokerException(PokerException.Reason.INVALID_ACTION, "the hand is over");
        int idx = indexOf(playerName);
        if (idx < 0 || idx != currentTurnIndex) throw new PokerException(PokerException.Reason.NOT_YOUR_TURN);
        PokerPlayer p = players.get(idx);

        switch (action.type()) {
            case FOLD -> {
                p.setActive(false);
                lastMessage = p.getName() + " folds";
            }
            case BET -> {
                long amount = action.amount();
                if (amount < 0) throw new PokerException(PokerException.Reason.INVALID_ACTION, "negative bet");
                long required = currentBet - p.getCurrentBet();
                if (amount < required && amount != p.getChips())
                    throw new PokerException(PokerException.Reason.BELOW_MINIMUM_BET, "at least " + required + " required");
                if (amount > p.getChips()) throw new PokerException(PokerException.Reason.INSUFFICIENT_CHIPS);

                lastMessage = describeBet(p, amount, required);
                p.commit(amount);
                pot += amount;
                if (p.getCurrentBet() > currentBet) currentBet = p.getCurrentBet();
            }
        }
        afterAccepted(idx);
    }

    /**
     * Folds a player who left the table, whoever's turn it is. No-op if they are not in
     * the hand any more.
     */
    public void forfeit(String playerName) {
        if (isOver()) return;
        int idx = indexOf(playerName);
        if (idx < 0 || !players.get(idx).isActive()) return;

        players.get(idx).setActive(false);
        lastMessage = playerName + " folds (left the table)";
        if (idx == currentTurnIndex) {
            afterAccepted(idx);
        } else if (activeCount() == 1) {
            finishUncontested();
        } else if (actorCount() < 2 && isBettingRoundComplete()) {
            // plus personne ne peut miser : on déroule le tableau
            advancePhase();
        }
        // sinon le tour et la phase restent ceux du joueur qui doit parler
    }

    private void afterAccepted(int actorIndex) {
        if (activeCount() == 1) {
            finishUncontested();
            return;
        }
        int next = actorFrom(actorIndex + 1);
        currentTurnIndex = next >= 0 ? next : activeFrom(actorIndex + 1);
        if (isBettingRoundComplete()) advancePhase();
    }

    /**
     * True when every player who can still act has put in the same amount this round,
     * and no all-in player has put in more than that.
     */
    public boolean isBettingRoundComplete() {
        Long level = null;
        for (PokerPlayer p : players) {
            if (!p.canAct()) continue;
            if (level == null) level = p.getCurrentBet();
            else if (p.getCurrentBet() != level) return false;
        }
        if (level == null) return true;
        for (PokerPlayer p : players) {
            if (p.isActive() && !p.canAct() && p.getCurrentBet() > level) return false;
        }
        return true;
    }

    private void advancePhase() {
        while (true) {
            phase = phase.next();
            if (phase == HandPhase.SHOWDOWN) {
                showdown();
                return;
            }
            communityCards.addAll(deck.draw(phase.reveal()));
            for (PokerPlayer p : players) p.setCurrentBet(0);
            currentBet = 0;
            int first = actorFrom(dealerIndex + 1);
            currentTurnIndex = first >= 0 ? first : activeFrom(dealerIndex + 1);
            // moins de deux joueurs peuvent encore miser : on déroule le tableau
            if (actorCount() >= 2) return;
        }
    }

    private void showdown() {
        settlement = PotRules.settle(players, communityCards);
        for (Map.Entry<String, Long> e : settlement.payouts().entrySet()) {
            players.get(indexOf(e.getKey())).award(e.getValue());
        }
        lastMessage = describe(settlement);
    }

    private void finishUncontested() {
        PokerPlayer winner = players.stream().filter(PokerPlayer::isActive).findFirst().orElseThrow();
        List<String> contributors = players.stream()
                .filter(p -> p.getTotalContribution() > 0)
                .map(PokerPlayer::getName)
                .toList();
        settlement = Settlement.uncontested(winner.getName(), pot, contributors);
        winner.award(pot);
        phase = HandPhase.SHOWDOWN;
        lastMessage = (lastMessage != null ? lastMessage + ". " : "") + winner.getName() + " wins " + pot;
    }

    public boolean isOver() {
        return phase == HandPhase.SHOWDOWN;
    }

    public boolean hasPlayer(String name) {
        return indexOf(name) >= 0;
    }

    public Optional<PokerPlayer> currentTurnPlayer() {
        if (isOver() || currentTurnIndex < 0) return Optional.empty();
        return Optional.of(players.get(currentTurnIndex));
    }

    /** Stacks plus whatever is still in the pot or left unpaid by the settlement. */
    public long chipsInPlay() {
        long stacks = players.stream().mapToLong(PokerPlayer::getChips).sum();
        return stacks + (settlement == null ? pot : settlement.unresolved());
    }

    int activeCount() {
        return (int) players.stream().filter(PokerPlayer::isActive).count();
    }

    int actorCount() {
        return (int) players.stream().filter(PokerPlayer::canAct).count();
    }

    private int indexOf(String name) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getName().equals(name)) return i;
        }
        return -1;
    }

    /** First player from {@code start} (inclusive, circular) who can still act, or -1. */
    private int actorFrom(int start) {
        int n = players.size();
        for (int k = 0; k < n; k++) {
            int i = (start + k) % n;
            if (players.get(i).canAct()) return i;
        }
        return -1;
    }

    private int activeFrom(int start) {
        int n = players.size();
        for (int k = 0; k < n; k++) {
            int i = (start + k) % n;
            if (players.get(i).isActive()) return i;
        }
        return -1;
    }

    private String describeBet(PokerPlayer p, long amount, long required) {
        if (amount == p.getChips() && amount > 0) return p.getName() + " goes all-in with " + amount;
        if (amount == 0) return p.getName() + " checks";
        if (amount == required) return p.getName() + " calls " + amount;
        return p.getName() + " raises to " + (p.getCurrentBet() + amount);
    }

    private static String describe(Settlement s) {
        return s.layers().stream()
                .filter(r -> !r.winners().isEmpty())
                .map(r -> r.winners().size() == 1
                        ? r.winners().get(0) + " wins " + r.layer().amount()
                        : String.join(", ", r.winners()) + " split " + r.layer().amount())
                .collect(Collectors.joining("; "));
    }
}
