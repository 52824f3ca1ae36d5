package org.holdem.model.poker;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString(exclude = "hand")
public class PokerPlayer {
    private final String name;
    private long chips;                 // persiste d'une main à l'autre
    private final List<Card> hand = new ArrayList<>();
    private boolean active = false;     // false = couché ou assis dehors
    private long currentBet = 0;        // tour d'enchères courant
    private long totalContribution = 0; // toute la main

    public PokerPlayer(String name, long chips) {
        this.name = name;
        this.chips = chips;
    }

    public void resetForNextHand() {
        hand.clear();
        currentBet = 0;
        totalContribution = 0;
        active = chips > 0;
    }

    /** Moves chips from the stack into this round's bet. */
    public void commit(long amount) {
        chips -= amount;
        currentBet += amount;
        totalContribution += amount;
    }

    /** Still in the hand and holding chips, i.e. able to take a turn. */
    public boolean canAct() {
        return active && chips > 0;
    }

    public void award(long amount) {
        chips += amount;
    }
}
