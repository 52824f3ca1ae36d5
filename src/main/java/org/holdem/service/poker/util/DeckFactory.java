package org.holdem.service.poker.util;

import org.holdem.model.poker.Deck;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class DeckFactory {
    private final SecureRandom rnd = new SecureRandom();

    public Deck newDeck() {
        return new Deck(rnd);
    }
}
