package org.holdem.dto.poker;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.holdem.model.poker.PokerPlayer;

/** What the rest of the table sees of a player: never the hole cards. */
public record PlayerView(String name,
                         long chips,
                         @JsonProperty("current_bet") long currentBet,
                         boolean active) {

    public static PlayerView of(PokerPlayer p) {
        return new PlayerView(p.getName(), p.getChips(), p.getCurrentBet(), p.isActive());
    }
}
