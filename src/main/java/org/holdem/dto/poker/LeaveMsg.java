package org.holdem.dto.poker;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LeaveMsg {
    @NotBlank
    private String tableId;
}
