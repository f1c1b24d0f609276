package org.holdem.model.holdem.rules;

import org.holdem.model.holdem.Card;
import org.holdem.model.holdem.Deck;
import org.holdem.model.holdem.HandCategory;
import org.holdem.model.holdem.PokerHand;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class HandRulesTest {

    private static PokerHand best(String... cards) {
        return HandRules.bestHand(Card.parseAll(List.of(cards)));
    }

    // -------------------------------------------------------------------------
    // classification
    // -------------------------------------------------------------------------
    @Test
    void bestHand_reconnaitChaqueCategorie() {
        assertThat(best("Ah", "Kh", "Qh", "Jh", "Th").getCategory()).isEqualTo(HandCategory.ROYAL_FLUSH);
        assertThat(best("9h", "Kh", "Qh", "Jh", "Th").getCategory()).isEqualTo(HandCategory.STRAIGHT_FLUSH);
        assertThat(best("9h", "9d", "9s", "9c", "2h").getCategory()).isEqualTo(HandCategory.FOUR_OF_A_KIND);
        assertThat(best("Kh", "Kd", "Ks", "2c", "2h").getCategory()).isEqualTo(HandCategory.FULL_HOUSE);
        assertThat(best("Ah", "9h", "7h", "4h", "2h").getCategory()).isEqualTo(HandCategory.FLUSH);
        assertThat(best("9c", "8h", "7d", "6s", "5h").getCategory()).isEqualTo(HandCategory.STRAIGHT);
        assertThat(best("7c", "7h", "7d", "Ks", "5h").getCategory()).isEqualTo(HandCategory.THREE_OF_A_KIND);
        assertThat(best("Ac", "Ah", "Kd", "Ks", "5h").getCategory()).isEqualTo(HandCategory.TWO_PAIR);
        assertThat(best("Jc", "Jh", "Kd", "4s", "5h").getCategory()).isEqualTo(HandCategory.PAIR);
        assertThat(best("Ac", "Jh", "9d", "4s", "2h").getCategory()).isEqualTo(HandCategory.HIGH_CARD);
    }

    @Test
    void bestHand_tieBreakers() {
        assertThat(best("9h", "9d", "9s", "9c", "2h").getTieBreakers()).containsExactly(9, 2);
        assertThat(best("Kh", "Kd", "Ks", "2c", "2h").getTieBreakers()).containsExactly(13, 2);
        assertThat(best("7c", "7h", "7d", "Ks", "5h").getTieBreakers()).containsExactly(7, 13, 5);
        assertThat(best("Ac", "Ah", "Kd", "Ks", "5h").getTieBreakers()).containsExactly(14, 13, 5);
        assertThat(best("Jc", "Jh", "Kd", "4s", "5h").getTieBreakers()).containsExactly(11, 13, 5, 4);
        assertThat(best("Ac", "Jh", "9d", "4s", "2h").getTieBreakers()).containsExactly(14, 11, 9, 4, 2);
    }

    // -------------------------------------------------------------------------
    // comparaisons
    // -------------------------------------------------------------------------
    @Test
    void royalFlush_batQuinteFlushRoi() {
        PokerHand royal = best("Ah", "Kh", "Qh", "Jh", "Th");
        PokerHand kingHigh = best("Kh", "Qh", "Jh", "Th", "9h");
        assertThat(royal.beats(kingHigh)).isTrue();
        assertThat(kingHigh.compareTo(royal)).isNegative();
    }

    @Test
    void quinteFlushNeuf_hauteurNeuf() {
        PokerHand nineHigh = best("9s", "8s", "7s", "6s", "5s");
        assertThat(nineHigh.getCategory()).isEqualTo(HandCategory.STRAIGHT_FLUSH);
        assertThat(nineHigh.primaryRank()).isEqualTo(9);
        assertThat(best("Ah", "Kh", "Qh", "Jh", "Th").beats(nineHigh)).isTrue();
    }

    @Test
    void ordreTotal_antisymetriqueEtTransitif() {
        Random rnd = new Random(2024);
        List<PokerHand> hands = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            List<Card> deck = Deck.standard();
            Collections.shuffle(deck, rnd);
            hands.add(HandRules.classify(deck.subList(0, 5)));
        }
        for (PokerHand a : hands) {
            for (PokerHand b : hands) {
                assertThat(Integer.signum(a.compareTo(b))).isEqualTo(-Integer.signum(b.compareTo(a)));
                assertThat(a.compareTo(b) == 0).isEqualTo(a.equals(b));
                for (PokerHand c : hands) {
                    if (a.compareTo(b) > 0 && b.compareTo(c) > 0) assertThat(a.compareTo(c)).isPositive();
                }
            }
        }
    }

    @Test
    void roue_perdContreQuinteSixEtBatCarteHaute() {
        PokerHand wheel = best("Ah", "2d", "3c", "4s", "5h");
        PokerHand sixHigh = best("2d", "3c", "4s", "5h", "6d");
        PokerHand aceHigh = best("Ah", "Kd", "9c", "4s", "2h");

        assertThat(wheel.getCategory()).isEqualTo(HandCategory.STRAIGHT);
        assertThat(wheel.getTieBreakers()).containsExactly(5);
        assertThat(sixHigh.beats(wheel)).isTrue();
        assertThat(wheel.beats(aceHigh)).isTrue();
        // l'as est rangé en bas
        assertThat(wheel.getCards().get(4).getRank()).isEqualTo(Card.Rank.ACE);
    }

    @Test
    void roueEnCouleur_estUneQuinteFlushCinq() {
        PokerHand steelWheel = best("Ah", "2h", "3h", "4h", "5h");
        assertThat(steelWheel.getCategory()).isEqualTo(HandCategory.STRAIGHT_FLUSH);
        assertThat(steelWheel.primaryRank()).isEqualTo(5);
    }

    @Test
    void doublePaire_kickerDepartage() {
        PokerHand kicker2 = best("Ah", "Ad", "Kh", "Kd", "2c");
        PokerHand kicker3 = best("As", "Ac", "Ks", "Kc", "3d");
        assertThat(kicker3.beats(kicker2)).isTrue();
        assertThat(kicker3).isNotEqualTo(kicker2);
    }

    @Test
    void couleursDifferentes_memeValeur_egalite() {
        PokerHand a = best("Ah", "Kd", "9c", "4s", "2h");
        PokerHand b = best("Ad", "Kc", "9s", "4h", "2c");
        assertThat(a.compareTo(b)).isZero();
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void sept_cartes_meilleureQueToutesLesCombinaisons() {
        List<Card> seven = Card.parseAll(List.of("Ah", "Kh", "7d", "7c", "7s", "Kd", "2h"));
        PokerHand best = HandRules.bestHand(seven);
        assertThat(best.getCategory()).isEqualTo(HandCategory.FULL_HOUSE);
        assertThat(best.getTieBreakers()).containsExactly(7, 13);

        int subsets = 0;
        for (int skip1 = 0; skip1 < 7; skip1++) {
            for (int skip2 = skip1 + 1; skip2 < 7; skip2++) {
                List<Card> five = new ArrayList<>(seven);
                five.remove(skip2);
                five.remove(skip1);
                assertThat(best.compareTo(HandRules.classify(five))).isGreaterThanOrEqualTo(0);
                subsets++;
            }
        }
        assertThat(subsets).isEqualTo(21);
    }

    @Test
    void sixCartes_choisitLaQuinte() {
        PokerHand h = best("9c", "8h", "7d", "6s", "5h", "5d");
        assertThat(h.getCategory()).isEqualTo(HandCategory.STRAIGHT);
        assertThat(h.primaryRank()).isEqualTo(9);
    }

    // -------------------------------------------------------------------------
    // erreurs
    // -------------------------------------------------------------------------
    @Test
    void moinsDeCinqCartes_refuse() {
        assertThatThrownBy(() -> best("Ah", "Kh", "Qh", "Jh"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("5 cartes");
    }

    @Test
    void carteEnDouble_refusee() {
        assertThatThrownBy(() -> best("Ah", "Ah", "Qh", "Jh", "9c"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("double");
    }

    // -------------------------------------------------------------------------
    // describe()
    // -------------------------------------------------------------------------
    @Test
    void describe_libellesLisibles() {
        assertThat(best("Kh", "Kd", "Ks", "2c", "2h").describe()).isEqualTo("Full House, Kings full of Twos");
        assertThat(best("Jc", "Jh", "Kd", "4s", "5h").describe()).isEqualTo("Pair of Jacks");
        assertThat(best("Ah", "2d", "3c", "4s", "5h").describe()).isEqualTo("Straight, Five high");
        assertThat(best("Ah", "Kh", "Qh", "Jh", "Th").describe()).isEqualTo("Royal Flush");
        assertThat(best("Ac", "Ah", "Kd", "Ks", "5h").describe()).isEqualTo("Two Pair, Aces and Kings");
        assertThat(best("6c", "6h", "6d", "Ks", "5h").describe()).isEqualTo("Three of a Kind, Sixes");
    }
}
