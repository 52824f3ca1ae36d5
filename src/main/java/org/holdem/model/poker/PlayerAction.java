package org.holdem.model.poker;

/** What a player may do on their turn. A check is a bet of zero when nothing is owed. */
public record PlayerAction(Type type, long amount) {

    public enum Type { FOLD, BET }

    public static PlayerAction fold() { return new PlayerAction(Type.FOLD, 0); }

    public static PlayerAction bet(long amount) { return new PlayerAction(Type.BET, amount); }
}
