package org.holdem.controller;

import lombok.RequiredArgsConstructor;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.service.PokerTableService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/poker")
@RequiredArgsConstructor
public class PokerLobbyController {

    private final PokerTableService service;

    @GetMapping("/tables")
    public List<TableSummaryDTO> list() {
        return service.listTables();
    }

    @GetMapping("/table/{id}")
    public ResponseEntity<Map<String, Object>> table(@PathVariable String id) {
        return service.tableState(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
