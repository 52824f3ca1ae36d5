package org.holdem.model.poker.rules;

import org.holdem.model.poker.Card;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.holdem.model.poker.Cards.cards;

class HandEvaluatorTest {

    @Test
    void carre_avecKicker() {
        HandScore s = HandEvaluator.evaluate(cards("AS", "AH", "AD", "AC", "2S"));

        assertThat(s.category()).isEqualTo(HandCategory.FOUR_OF_A_KIND);
        assertThat(s.kickers()).containsExactly(14, 2);
    }

    @Test
    void quinteFlushRoyale_surSeptCartes() {
        HandScore s = HandEvaluator.evaluate(cards("AS", "KS", "QS", "JS", "TS", "2H", "3D"));

        assertThat(s.category()).isEqualTo(HandCategory.STRAIGHT_FLUSH);
        assertThat(s.category().getScore()).isEqualTo(9);
        assertThat(s.kickers()).containsExactly(14, 13, 12, 11, 10);
    }

    @Test
    void roue_lAsCompteUn() {
        HandScore s = HandEvaluator.evaluate(cards("AH", "2D", "3C", "4S", "5H", "9D", "KC"));

        assertThat(s.category()).isEqualTo(HandCategory.STRAIGHT);
        assertThat(s.kickers()).containsExactly(5, 4, 3, 2, 1);
    }

    @Test
    void couleurEtSuiteDisjointes_pasDeQuinteFlush() {
        // suite 5-9 toutes couleurs, couleur à coeur sans suite
        HandScore s = HandEvaluator.evaluate(cards("5H", "6H", "7C", "8H", "9D", "2H", "KH"));

        assertThat(s.category()).isEqualTo(HandCategory.FLUSH);
        assertThat(s.kickers()).containsExactly(13, 8, 6, 5, 2);
    }

    @Test
    void deuxBrelans_fontUnFull() {
        HandScore s = HandEvaluator.evaluate(cards("9S", "9H", "9D", "4C", "4S", "4H", "AD"));

        assertThat(s.category()).isEqualTo(HandCategory.FULL_HOUSE);
        assertThat(s.kickers()).containsExactly(9, 4);
    }

    @Test
    void doublePaire_meilleurKicker() {
        HandScore s = HandEvaluator.evaluate(cards("KS", "KH", "7D", "7C", "2S", "2H", "QD"));

        assertThat(s.category()).isEqualTo(HandCategory.TWO_PAIR);
        assertThat(s.kickers()).containsExactly(13, 7, 12);
    }

    @Test
    void paire_etHauteur() {
        assertThat(HandEvaluator.evaluate(cards("8S", "8H", "AD", "5C", "3S")).kickers())
                .containsExactly(8, 14, 5, 3);
        assertThat(HandEvaluator.evaluate(cards("8S", "JH", "AD", "5C", "3S", "2D")).kickers())
                .containsExactly(14, 11, 8, 5, 3);
    }

    @Test
    void ordreDesCartes_sansEffet() {
        List<Card> hand = new ArrayList<>(cards("QS", "QH", "QD", "7C", "7S", "2H", "AD"));
        HandScore expected = HandEvaluator.evaluate(hand);

        Random rnd = new Random(7);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(hand, rnd);
            assertThat(HandEvaluator.evaluate(hand)).isEqualTo(expected);
        }
    }

    @Test
    void comparaison_categorieDAbord_puisKickers() {
        HandScore flush = HandEvaluator.evaluate(cards("2H", "5H", "7H", "9H", "JH"));
        HandScore straight = HandEvaluator.evaluate(cards("TS", "JH", "QD", "KC", "AS"));
        HandScore pairAcesKing = HandEvaluator.evaluate(cards("AS", "AH", "KD", "5C", "3S"));
        HandScore pairAcesQueen = HandEvaluator.evaluate(cards("AD", "AC", "QD", "5H", "3H"));

        assertThat(flush.beats(straight)).isTrue();
        assertThat(pairAcesKing.beats(pairAcesQueen)).isTrue();
        assertThat(pairAcesQueen.beats(pairAcesKing)).isFalse();
    }

    @Test
    void tropPeuOuTropDeCartes_refuse() {
        assertThatThrownBy(() -> HandEvaluator.evaluate(cards("AS")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HandEvaluator.evaluate(cards("AS", "KS", "QS", "JS", "TS", "9S", "8S", "7S")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
