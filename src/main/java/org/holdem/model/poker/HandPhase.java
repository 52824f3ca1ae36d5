package org.holdem.model.poker;

public enum HandPhase {
    PRE_FLOP(0), FLOP(3), TURN(1), RIVER(1), SHOWDOWN(0);

    /** Community cards revealed when the hand enters this phase. */
    private final int reveal;

    HandPhase(int reveal) { this.reveal = reveal; }

    public int reveal() { return reveal; }

    public HandPhase next() {
        return switch (this) {
            case PRE_FLOP -> FLOP;
            case FLOP -> TURN;
            case TURN -> RIVER;
            case RIVER, SHOWDOWN -> SHOWDOWN;
        };
    }
}
