package org.holdem.dto.poker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TableSummaryDTO {
    private String id;
    private Integer maxSeats;
    private List<String> seated;
    private List<String> waiting;
    private String phase;
    private boolean startPending;
}
