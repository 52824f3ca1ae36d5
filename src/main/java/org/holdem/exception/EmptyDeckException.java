package org.holdem.exception;

/**
 * Raised when a draw asks for more cards than the deck still holds.
 * Table limits make this unreachable, so seeing it means the hand is corrupt.
 */
public class EmptyDeckException extends IllegalStateException {
    public EmptyDeckException(int requested, int remaining) {
        super("Cannot draw " + requested + " card(s), only " + remaining + " left in the deck");
    }
}
