package org.holdem.dto.poker;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class JoinMsg {
    /** Absent = first table with a free seat, or a new one. */
    @Size(max = 32)
    private String tableId;
}
