package org.holdem.model.holdem;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class DeckTest {

    @Test
    void nouveauPaquet_52CartesDistinctes() {
        Deck deck = new Deck(new Random(42));
        List<Card> all = deck.deal(52);
        assertThat(new HashSet<>(all)).hasSize(52);
        assertThat(deck.remaining()).isZero();
    }

    @Test
    void memeGraine_memeOrdre() {
        assertThat(new Deck(new Random(7)).deal(10)).isEqualTo(new Deck(new Random(7)).deal(10));
    }

    @Test
    void paquetVide_exception() {
        Deck deck = Deck.ordered(Card.parseAll(List.of("Ah")));
        deck.deal();
        assertThatThrownBy(deck::deal).isInstanceOf(IllegalStateException.class).hasMessage("Paquet vide");
        assertThatThrownBy(() -> deck.deal(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void ordered_respecteLOrdreEtBrule() {
        Deck deck = Deck.ordered(Card.parseAll(List.of("Ah", "Kd", "2c")));
        assertThat(deck.burn()).isEqualTo(Card.parse("Ah"));
        assertThat(deck.deal()).isEqualTo(Card.parse("Kd"));
        assertThat(deck.remaining()).isEqualTo(1);
    }

    @Test
    void ordered_doublon_refuse() {
        assertThatThrownBy(() -> Deck.ordered(Card.parseAll(List.of("Ah", "Ah"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
