package org.holdem.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TableSettingsTest {

    @Test
    void valeursValides() {
        TableSettings s = new TableSettings(2, 9, 10, 20, 1000, 5000);

        assertThat(s.getMaxSeats()).isEqualTo(9);
        assertThat(s.getBigBlind()).isEqualTo(20);
    }

    @Test
    void tropDeSieges_pourUnPaquet() {
        assertThatThrownBy(() -> new TableSettings(2, 24, 10, 20, 1000, 5000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void minimumSousDeux_refuse() {
        assertThatThrownBy(() -> new TableSettings(1, 9, 10, 20, 1000, 5000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blindesIncoherentes_refusees() {
        assertThatThrownBy(() -> new TableSettings(2, 9, 20, 10, 1000, 5000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
