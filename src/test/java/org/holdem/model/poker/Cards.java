package org.holdem.model.poker;

import java.util.ArrayList;
import java.util.List;

/** Short card notation for tests: "AS" = ace of spades, "TD" = ten of diamonds. */
public final class Cards {
    private Cards(){}

    public static Card c(String code) {
        Card.Rank rank = switch (code.charAt(0)) {
            case 'A' -> Card.Rank.ACE;
            case 'K' -> Card.Rank.KING;
            case 'Q' -> Card.Rank.QUEEN;
            case 'J' -> Card.Rank.JACK;
            case 'T' -> Card.Rank.TEN;
            default -> Card.Rank.values()[code.charAt(0) - '2'];
        };
        Card.Suit suit = switch (code.charAt(1)) {
            case 'H' -> Card.Suit.HEARTS;
            case 'D' -> Card.Suit.DIAMONDS;
            case 'C' -> Card.Suit.CLUBS;
            case 'S' -> Card.Suit.SPADES;
            default -> throw new IllegalArgumentException(code);
        };
        return new Card(rank, suit);
    }

    public static List<Card> cards(String... codes) {
        List<Card> out = new ArrayList<>();
        for (String s : codes) out.add(c(s));
        return out;
    }
}
