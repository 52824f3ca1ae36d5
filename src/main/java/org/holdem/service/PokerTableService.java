package org.holdem.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.dto.poker.ActionMsg;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.PokerTable;
import org.holdem.service.poker.action.ActionService;
import org.holdem.service.poker.entry.EntryService;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.util.Locks;
import org.holdem.service.poker.util.Payloads;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Entry point for the transport layer. Each call locks only the table it touches, so
 * tables never wait on each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PokerTableService {

    private final TableRegistry registry;
    private final EntryService entry;
    private final ActionService actions;
    private final Payloads payloads;
    private final Locks locks;

    static final long IDLE_TABLE_MS = 600_000;

    public PokerTable join(String player, String tableId, String sessionId) {
        return entry.join(player, tableId, sessionId);
    }

    public void action(String player, ActionMsg msg) {
        actions.apply(player, msg);
    }

    public void leave(String player, String tableId) {
        entry.leave(player, tableId);
    }

    public void disconnect(String sessionId) {
        entry.disconnect(sessionId);
    }

    public List<TableSummaryDTO> listTables() {
        List<TableSummaryDTO> out = new ArrayList<>();
        for (PokerTable t : registry.all()) {
            synchronized (locks.of(t.getId())) {
                out.add(new TableSummaryDTO(t.getId(), t.getMaxSeats(), t.seatedNames(), t.waitingNames(),
                        t.getHand() != null ? t.getHand().getPhase().name() : "IDLE", t.isStartPending()));
            }
        }
        out.sort(Comparator.comparing(TableSummaryDTO::getId));
        return out;
    }

    public Optional<Map<String, Object>> tableState(String id) {
        return registry.find(id).map(t -> {
            synchronized (locks.of(t.getId())) {
                return payloads.tableState(t);
            }
        });
    }

    /** Removes tables that stayed empty for a while. */
    @Scheduled(fixedRate = 600_000)
    public void removeIdleTables() {
        Instant now = Instant.now();
        for (PokerTable t : List.copyOf(registry.all())) {
            synchronized (locks.of(t.getId())) {
                boolean empty = t.getSeated().isEmpty() && t.getWaiting().isEmpty() && !t.isHandActive();
                if (!empty || Duration.between(t.getLastActiveAt(), now).toMillis() <= IDLE_TABLE_MS) continue;
                entry.onTableClosed(t);
                registry.remove(t.getId());
                log.info("Table {} removed after being empty for {} s", t.getId(), IDLE_TABLE_MS / 1000);
            }
        }
    }
}
