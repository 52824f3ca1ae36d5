package org.holdem.model.poker.rules;

import org.holdem.model.poker.Card;

import java.util.*;

/**
 * Scores the best poker hand among 2 to 7 cards. Pure: the same cards in any order
 * give the same {@link HandScore}.
 */
public final class HandEvaluator {
    private HandEvaluator(){}

    private static final int HAND_SIZE = 5;

    public static HandScore evaluate(Collection<Card> cards) {
        if (cards.size() < 2 || cards.size() > 7)
            throw new IllegalArgumentException("Expected 2 to 7 cards, got " + cards.size());

        int[] rankCounts = new int[15];
        Map<Card.Suit, List<Integer>> bySuit = new EnumMap<>(Card.Suit.class);
        for (Card c : cards) {
            rankCounts[c.value()]++;
            bySuit.computeIfAbsent(c.getSuit(), s -> new ArrayList<>()).add(c.value());
        }

        List<Integer> distinct = new ArrayList<>();
        for (int v = 14; v >= 2; v--) if (rankCounts[v] > 0) distinct.add(v);

        List<Integer> flushRanks = null;
        for (List<Integer> suited : bySuit.values()) {
            if (suited.size() >= HAND_SIZE) {
                flushRanks = new ArrayList<>(new TreeSet<>(suited).descendingSet());
                break;
            }
        }

        // quinte flush: la suite doit être dans la couleur
        if (flushRanks != null) {
            List<Integer> run = straight(flushRanks);
            if (run != null) return new HandScore(HandCategory.STRAIGHT_FLUSH, run);
        }

        List<Integer> quads = ranksWithCount(rankCounts, 4);
        if (!quads.isEmpty()) {
            int q = quads.get(0);
            return new HandScore(HandCategory.FOUR_OF_A_KIND, withKickers(List.of(q), distinct, 1));
        }

        List<Integer> trips = ranksWithCount(rankCounts, 3);
        if (!trips.isEmpty()) {
            int t = trips.get(0);
            Integer pair = null;
            for (int v = 14; v >= 2; v--) {
                if (v != t && rankCounts[v] >= 2) { pair = v; break; }
            }
            if (pair != null) return new HandScore(HandCategory.FULL_HOUSE, List.of(t, pair));
        }

        if (flushRanks != null) {
            return new HandScore(HandCategory.FLUSH, flushRanks.subList(0, HAND_SIZE));
        }

        List<Integer> run = straight(distinct);
        if (run != null) return new HandScore(HandCategory.STRAIGHT, run);

        if (!trips.isEmpty()) {
            int t = trips.get(0);
            return new HandScore(HandCategory.THREE_OF_A_KIND, withKickers(List.of(t), distinct, 2));
        }

        List<Integer> pairs = ranksWithCount(rankCounts, 2);
        if (pairs.size() >= 2) {
            return new HandScore(HandCategory.TWO_PAIR,
                    withKickers(List.of(pairs.get(0), pairs.get(1)), distinct, 1));
        }
        if (pairs.size() == 1) {
            return new HandScore(HandCategory.ONE_PAIR, withKickers(List.of(pairs.get(0)), distinct, 3));
        }
        return new HandScore(HandCategory.HIGH_CARD, withKickers(List.of(), distinct, HAND_SIZE));
    }

    /** Highest five-card run among descending distinct ranks, the wheel counting its ace as 1. */
    static List<Integer> straight(List<Integer> descendingDistinct) {
        List<Integer> ranks = new ArrayList<>(descendingDistinct);
        if (ranks.contains(14)) ranks.add(Card.Rank.LOW_ACE);
        for (int i = 0; i + HAND_SIZE - 1 < ranks.size(); i++) {
            if (ranks.get(i) - ranks.get(i + HAND_SIZE - 1) == HAND_SIZE - 1) {
                return List.copyOf(ranks.subList(i, i + HAND_SIZE));
            }
        }
        return null;
    }

    /** Ranks held exactly {@code count} times, highest first. */
    private static List<Integer> ranksWithCount(int[] rankCounts, int count) {
        List<Integer> out = new ArrayList<>();
        for (int v = 14; v >= 2; v--) if (rankCounts[v] == count) out.add(v);
        return out;
    }

    private static List<Integer> withKickers(List<Integer> defining, List<Integer> distinct, int kickers) {
        List<Integer> out = new ArrayList<>(defining);
        for (int v : distinct) {
            if (kickers == 0) break;
            if (defining.contains(v)) continue;
            out.add(v);
            kickers--;
        }
        return out;
    }
}
