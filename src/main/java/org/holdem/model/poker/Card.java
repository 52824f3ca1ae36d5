package org.holdem.model.poker;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Card {
    private final Rank rank;
    private final Suit suit;

    /** 2..14, As haut. */
    public int value() {
        return rank.getValue();
    }

    @Override
    public String toString() {
        return rank.getLabel() + " of " + suit.getLabel();
    }

    @Getter
    @AllArgsConstructor
    public enum Suit {
        HEARTS("Hearts"), DIAMONDS("Diamonds"), CLUBS("Clubs"), SPADES("Spades");

        private final String label;
    }

    @Getter
    @AllArgsConstructor
    public enum Rank {
        TWO(2, "2"), THREE(3, "3"), FOUR(4, "4"), FIVE(5, "5"), SIX(6, "6"), SEVEN(7, "7"),
        EIGHT(8, "8"), NINE(9, "9"), TEN(10, "10"), JACK(11, "J"), QUEEN(12, "Q"), KING(13, "K"), ACE(14, "A");

        /** Value of the ace when it closes the wheel (A-2-3-4-5). */
        public static final int LOW_ACE = 1;

        private final int value;
        private final String label;
    }
}
