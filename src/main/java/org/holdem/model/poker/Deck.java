package org.holdem.model.poker;

import org.holdem.exception.EmptyDeckException;

import java.security.SecureRandom;
import java.util.*;

public class Deck {
    public static final int SIZE = 52;

    private final Deque<Card> cards = new ArrayDeque<>();

    public Deck() {
        this(new SecureRandom());
    }

    public Deck(Random rnd) {
        List<Card> tmp = standardOrder();
        Collections.shuffle(tmp, rnd);
        cards.addAll(tmp);
    }

    private Deck(List<Card> ordered) {
        cards.addAll(ordered);
    }

    /**
     * Deck whose top cards are {@code top} (first element drawn first), followed by the
     * rest of the 52 cards in standard order. Used to replay a known hand.
     */
    public static Deck stacked(List<Card> top) {
        Set<Card> seen = new HashSet<>();
        List<Card> ordered = new ArrayList<>(SIZE);
        for (Card c : top) {
            if (!seen.add(c)) throw new IllegalArgumentException("Duplicate card " + c);
            ordered.add(c);
        }
        for (Card c : standardOrder()) {
            if (!seen.contains(c)) ordered.add(c);
        }
        return new Deck(ordered);
    }

    /** Removes and returns {@code n} cards from the top, or fails without drawing any. */
    public List<Card> draw(int n) {
        if (n < 0) throw new IllegalArgumentException("n < 0");
        if (n > cards.size()) throw new EmptyDeckException(n, cards.size());
        List<Card> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(cards.pollFirst());
        return out;
    }

    public int remaining() {
        return cards.size();
    }

    private static List<Card> standardOrder() {
        List<Card> tmp = new ArrayList<>(SIZE);
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
        }
        return tmp;
    }
}
