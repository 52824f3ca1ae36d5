package org.holdem.dto.poker;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.holdem.exception.PokerException;

@Data
public class ActionMsg {
    public enum Type {
        BET, FOLD;

        // "bet" / "fold" acceptés aussi
        @JsonCreator
        public static Type of(String value) {
            if (value == null) return null;
            for (Type t : values()) {
                if (t.name().equalsIgnoreCase(value.trim())) return t;
            }
            throw new PokerException(PokerException.Reason.INVALID_ACTION, "unknown action " + value);
        }
    }

    @NotBlank
    private String tableId;
    @NotNull
    @JsonAlias("action")
    private Type type;
    private long amount; // ignoré pour FOLD
}
