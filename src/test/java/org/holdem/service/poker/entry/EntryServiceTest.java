package org.holdem.service.poker.entry;

import org.holdem.config.TableSettings;
import org.holdem.dto.poker.TableEvent;
import org.holdem.exception.PokerException;
import org.holdem.model.poker.Deck;
import org.holdem.model.poker.PokerTable;
import org.holdem.service.poker.access.AccessService;
import org.holdem.service.poker.engine.RoundEngine;
import org.holdem.service.poker.registry.ConnectionRegistry;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.util.DeckFactory;
import org.holdem.service.poker.util.Locks;
import org.holdem.service.poker.util.Payloads;
import org.holdem.service.poker.util.Timeouts;
import org.junit.jupiter.api.*;
import org.mockito.*;

import java.util.Random;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class EntryServiceTest {

    @Mock AccessService access;
    @Mock Timeouts timeouts;
    @Mock DeckFactory decks;
    @Mock ScheduledFuture<?> future;

    TableSettings settings = new TableSettings(2, 3, 10, 20, 1000, 5000);
    TableRegistry registry;
    ConnectionRegistry connections;
    RoundEngine engine;
    EntryService service;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        doReturn(future).when(timeouts).schedule(anyString(), anyString(), anyLong(), any(Runnable.class));
        when(decks.newDeck()).thenAnswer(inv -> new Deck(new Random(11)));

        Locks locks = new Locks();
        Payloads payloads = new Payloads();
        registry = new TableRegistry(settings);
        connections = new ConnectionRegistry();
        engine = new RoundEngine(settings, access, payloads, timeouts, locks, decks);
        service = new EntryService(registry, connections, access, engine, payloads, locks, settings);
    }

    private Runnable startTimer() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(timeouts).schedule(anyString(), anyString(), anyLong(), task.capture());
        return task.getValue();
    }

    // ---------------------------------------------------------
    // JOIN
    // ---------------------------------------------------------
    @Test
    void join_sansTable_creeUneTableEtAssoitLeJoueur() {
        PokerTable t = service.join("A", null, "s1");

        assertThat(registry.find(t.getId())).contains(t);
        assertThat(t.seatedNames()).containsExactly("A");
        assertThat(t.getSeated().get(0).getChips()).isEqualTo(1000);
        assertThat(connections.isConnected(t.getId(), "A")).isTrue();
        verify(access).sendToPlayer(eq(t), eq("A"), eq(TableEvent.TABLE_ASSIGNED), any());
        verify(access).broadcastToTable(eq(t), eq(TableEvent.TABLE_UPDATE), any());
        verifyNoInteractions(timeouts);
    }

    @Test
    void join_secondJoueur_memeTable_etProgrammeLeDepart() {
        PokerTable first = service.join("A", null, "s1");
        PokerTable second = service.join("B", null, "s2");

        assertThat(second).isSameAs(first);
        assertThat(first.isStartPending()).isTrue();
        verify(timeouts).schedule(eq(first.getId()), eq("start"), eq(5000L), any(Runnable.class));
    }

    @Test
    void join_pendantUneMain_placeEnAttente() {
        PokerTable t = service.join("A", "t1", "s1");
        service.join("B", "t1", "s2");
        startTimer().run();
        assertThat(t.isHandActive()).isTrue();

        service.join("C", "t1", "s3");

        assertThat(t.waitingNames()).containsExactly("C");
        assertThat(t.getHand().hasPlayer("C")).isFalse();
    }

    @Test
    void join_tablePleine_refuse() {
        service.join("A", "t1", "s1");
        service.join("B", "t1", "s2");
        service.join("C", "t1", "s3");

        assertThatThrownBy(() -> service.join("D", "t1", "s4"))
                .isInstanceOf(PokerException.class)
                .extracting(ex -> ((PokerException) ex).getReason())
                .isEqualTo(PokerException.Reason.TABLE_FULL);
        assertThat(service.tableOf("D")).isEmpty();
    }

    @Test
    void join_toutesLesTablesPleines_ouvreUneNouvelleTable() {
        PokerTable full = service.join("A", null, "s1");
        service.join("B", null, "s2");
        service.join("C", null, "s3");

        PokerTable t = service.join("D", null, "s4");

        assertThat(t).isNotSameAs(full);
        assertThat(t.seatedNames()).containsExactly("D");
    }

    @Test
    void join_dejaAUneAutreTable_refuse() {
        service.join("A", "t1", "s1");

        assertThatThrownBy(() -> service.join("A", "t2", "s1"))
                .isInstanceOf(PokerException.class)
                .hasMessageContaining("t1")
                .extracting(ex -> ((PokerException) ex).getReason())
                .isEqualTo(PokerException.Reason.ALREADY_SEATED);
    }

    @Test
    void join_reconnexion_memeJoueurNonDuplique() {
        PokerTable t = service.join("A", "t1", "s1");

        service.join("A", null, "s9");

        assertThat(t.seatedNames()).containsExactly("A");
        assertThat(connections.bindingsOf("s9")).containsExactly(new ConnectionRegistry.Binding("t1", "A"));
        assertThat(connections.bindingsOf("s1")).isEmpty();
    }

    // ---------------------------------------------------------
    // DÉPARTS
    // ---------------------------------------------------------
    @Test
    void disconnect_avantLeDepart_annuleEtAucuneMainNEstCreee() {
        PokerTable t = service.join("A", "t1", "s1");
        service.join("B", "t1", "s2");
        Runnable timer = startTimer();

        service.disconnect("s2");
        timer.run();

        assertThat(t.seatedNames()).containsExactly("A");
        assertThat(t.isStartPending()).isFalse();
        assertThat(t.isHandActive()).isFalse();
        verify(timeouts).cancel(future);
        verify(access).broadcastToTable(eq(t), eq(TableEvent.GAME_CANCELLED), any());
        verify(decks, never()).newDeck();
    }

    @Test
    void disconnect_pendantLaMain_sousLeMinimum_annuleLaMain() {
        PokerTable t = service.join("A", "t1", "s1");
        service.join("B", "t1", "s2");
        startTimer().run();

        service.disconnect("s1");

        assertThat(t.isHandActive()).isFalse();
        assertThat(t.seatedNames()).containsExactly("B");
        verify(access).broadcastToTable(eq(t), eq(TableEvent.ERROR), any());
    }

    @Test
    void leave_pendantLaMain_leJoueurEstCouche_etLaMainContinue() {
        PokerTable t = service.join("A", "t1", "s1");
        service.join("B", "t1", "s2");
        service.join("C", "t1", "s3");
        startTimer().run();

        service.leave("C", "t1");

        assertThat(t.isHandActive()).isTrue();
        assertThat(t.getHand().getPlayers()).filteredOn(p -> p.getName().equals("C"))
                .singleElement().satisfies(p -> assertThat(p.isActive()).isFalse());
        assertThat(t.seatedNames()).containsExactly("A", "B");
        assertThat(service.tableOf("C")).isEmpty();
        assertThat(connections.isConnected("t1", "C")).isFalse();
    }

    @Test
    void leave_tableInconnue_sansEffet() {
        assertThatCode(() -> service.leave("A", "nope")).doesNotThrowAnyException();
    }

    @Test
    void onTableClosed_oublieLesJoueurs() {
        PokerTable t = service.join("A", "t1", "s1");

        service.onTableClosed(t);

        assertThat(service.tableOf("A")).isEmpty();
        assertThat(connections.playersOf("t1")).isEmpty();
    }
}
