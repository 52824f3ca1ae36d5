package org.holdem.dto.poker;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TableEvent {
    public static final String TABLE_ASSIGNED = "TABLE_ASSIGNED";
    public static final String TABLE_UPDATE = "TABLE_UPDATE";
    public static final String START = "START";
    public static final String GAME_CANCELLED = "GAME_CANCELLED";
    public static final String UPDATE = "UPDATE";
    public static final String HAND = "HAND";
    public static final String ERROR = "ERROR";

    private String type;
    private Object payload;
}
