package org.holdem.config;

import lombok.Getter;
import org.holdem.model.poker.Deck;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Table limits and stakes, read from application.properties. */
@Getter
@Component
public class TableSettings {
    private final int minSeats;
    private final int maxSeats;
    private final long smallBlind;
    private final long bigBlind;
    private final long startingChips;
    private final long startDelayMs;

    public TableSettings(@Value("${poker.min-seats:2}") int minSeats,
                         @Value("${poker.max-seats:9}") int maxSeats,
                         @Value("${poker.small-blind:10}") long smallBlind,
                         @Value("${poker.big-blind:20}") long bigBlind,
                         @Value("${poker.starting-chips:1000}") long startingChips,
                         @Value("${poker.start-delay-ms:5000}") long startDelayMs) {
        if (minSeats < 2) throw new IllegalArgumentException("poker.min-seats must be >= 2");
        if (maxSeats < minSeats) throw new IllegalArgumentException("poker.max-seats must be >= poker.min-seats");
        if (2 * maxSeats + 5 > Deck.SIZE) throw new IllegalArgumentException("poker.max-seats too large for one deck");
        if (smallBlind <= 0 || bigBlind < smallBlind)
            throw new IllegalArgumentException("blinds must be positive with big >= small");
        if (startingChips <= 0) throw new IllegalArgumentException("poker.starting-chips must be positive");
        if (startDelayMs < 0) throw new IllegalArgumentException("poker.start-delay-ms must be >= 0");
        this.minSeats = minSeats;
        this.maxSeats = maxSeats;
        this.smallBlind = smallBlind;
        this.bigBlind = bigBlind;
        this.startingChips = startingChips;
        this.startDelayMs = startDelayMs;
    }
}
