package org.holdem.service.poker.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.config.TableSettings;
import org.holdem.model.poker.PokerTable;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
@RequiredArgsConstructor
public class TableRegistry {
    private final TableSettings settings;
    private final Map<String, PokerTable> tables = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public Collection<PokerTable> all() { return tables.values(); }

    public PokerTable get(String id) {
        PokerTable t = tables.get(id);
        if (t == null) throw new IllegalArgumentException("Unknown table " + id);
        return t;
    }

    public Optional<PokerTable> find(String id) { return Optional.ofNullable(tables.get(id)); }

    /** Table {@code id}, created empty on first use. */
    public PokerTable getOrCreate(String id) {
        return tables.computeIfAbsent(id, this::newTable);
    }

    public PokerTable create() {
        String id;
        do {
            id = String.valueOf(sequence.incrementAndGet());
        } while (tables.containsKey(id));
        return getOrCreate(id);
    }

    /** First table with a free seat. Racy by nature: callers re-check under the table lock. */
    public Optional<PokerTable> findNotFull() {
        return tables.values().stream()
                .filter(t -> !t.isFull())
                .min(Comparator.comparing(PokerTable::getCreatedAt));
    }

    public void remove(String id) { tables.remove(id); }

    private PokerTable newTable(String id) {
        log.info("Table {} created ({} seats max)", id, settings.getMaxSeats());
        return new PokerTable(id, settings.getMaxSeats());
    }
}
