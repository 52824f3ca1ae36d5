package org.holdem.service;

import org.holdem.config.TableSettings;
import org.holdem.dto.poker.ActionMsg;
import org.holdem.dto.poker.TableSummaryDTO;
import org.holdem.model.poker.PokerPlayer;
import org.holdem.model.poker.PokerTable;
import org.holdem.service.poker.action.ActionService;
import org.holdem.service.poker.entry.EntryService;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.util.Locks;
import org.holdem.service.poker.util.Payloads;
import org.junit.jupiter.api.*;
import org.mockito.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class PokerTableServiceTest {

    @Mock EntryService entry;
    @Mock ActionService actions;

    TableRegistry registry;
    PokerTableService service;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        registry = new TableRegistry(new TableSettings(2, 6, 10, 20, 1000, 5000));
        service = new PokerTableService(registry, entry, actions, new Payloads(), new Locks());
    }

    @Test
    void commandes_deleguees() {
        ActionMsg msg = new ActionMsg();

        service.join("A", "1", "s1");
        service.action("A", msg);
        service.leave("A", "1");
        service.disconnect("s1");

        verify(entry).join("A", "1", "s1");
        verify(actions).apply("A", msg);
        verify(entry).leave("A", "1");
        verify(entry).disconnect("s1");
    }

    @Test
    void listTables_trieesParId() {
        registry.getOrCreate("b").seat(new PokerPlayer("B", 100));
        registry.getOrCreate("a");

        List<TableSummaryDTO> out = service.listTables();

        assertThat(out).extracting(TableSummaryDTO::getId).containsExactly("a", "b");
        assertThat(out.get(1).getSeated()).containsExactly("B");
        assertThat(out.get(0).getPhase()).isEqualTo("IDLE");
    }

    @Test
    void tableState_inconnue_vide() {
        assertThat(service.tableState("nope")).isEmpty();
    }

    @Test
    void tableState_sansMain() {
        registry.getOrCreate("a").seat(new PokerPlayer("A", 100));

        Map<String, Object> state = service.tableState("a").orElseThrow();

        assertThat(state).containsEntry("tableId", "a").containsEntry("seated", List.of("A"));
        assertThat(state.get("hand")).isNull();
    }

    @Test
    void removeIdleTables_seulementLesTablesVidesDepuisLongtemps() {
        PokerTable idle = registry.getOrCreate("idle");
        idle.setLastActiveAt(Instant.now().minusMillis(PokerTableService.IDLE_TABLE_MS + 1000));
        PokerTable recent = registry.getOrCreate("recent");
        PokerTable busy = registry.getOrCreate("busy");
        busy.seat(new PokerPlayer("A", 100));
        busy.setLastActiveAt(Instant.now().minusMillis(PokerTableService.IDLE_TABLE_MS + 1000));

        service.removeIdleTables();

        assertThat(registry.find("idle")).isEmpty();
        assertThat(registry.find("recent")).contains(recent);
        assertThat(registry.find("busy")).contains(busy);
        verify(entry).onTableClosed(idle);
        verifyNoMoreInteractions(entry);
    }
}
