package org.holdem.exception;

import lombok.Getter;

/**
 * Player-facing rejection. The command is refused and table state is left untouched;
 * the message goes back to the offending connection only.
 */
@Getter
public class PokerException extends RuntimeException {

    public enum Reason {
        NOT_YOUR_TURN("Not your turn"),
        BELOW_MINIMUM_BET("Bet is below the amount required to call"),
        INSUFFICIENT_CHIPS("Not enough chips"),
        INVALID_ACTION("Invalid action"),
        TABLE_FULL("Table is full"),
        ALREADY_SEATED("Already playing at another table");

        private final String message;

        Reason(String message) { this.message = message; }

        public String getMessage() { return message; }
    }

    private final Reason reason;

    public PokerException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public PokerException(Reason reason, String detail) {
        super(reason.getMessage() + ": " + detail);
        this.reason = reason;
    }
}
