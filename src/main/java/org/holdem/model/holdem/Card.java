package org.holdem.model.holdem;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Carte immuable. Deux cartes sont égales ssi rang et couleur sont identiques.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public final class Card {
    private final Rank rank;
    private final Suit suit;

    public int value() { return rank.getValue(); }

    public int lowAceValue() { return rank.getLowAceValue(); }

    /** Accepte "Ah", "Td", "10s", "K♠" (casse indifférente). */
    @JsonCreator
    public static Card parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Carte vide");
        String t = text.trim();
        if (t.length() < 2) throw new IllegalArgumentException("Carte invalide: " + text);
        Suit suit = Suit.fromSymbol(t.substring(t.length() - 1));
        Rank rank = Rank.fromSymbol(t.substring(0, t.length() - 1));
        return new Card(rank, suit);
    }

    public static List<Card> parseAll(Collection<String> texts) {
        if (texts == null) return List.of();
        List<Card> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(parse(t));
        return out;
    }

    @JsonValue
    @Override
    public String toString() {
        return rank.getSymbol() + suit.getSymbol();
    }

    @Getter
    @AllArgsConstructor
    public enum Suit {
        HEARTS("♥", 'h'), DIAMONDS("♦", 'd'), CLUBS("♣", 'c'), SPADES("♠", 's');

        private final String symbol;
        private final char letter;

        static Suit fromSymbol(String s) {
            for (Suit suit : values()) {
                if (suit.symbol.equals(s) || String.valueOf(suit.letter).equalsIgnoreCase(s)) return suit;
            }
            throw new IllegalArgumentException("Couleur inconnue: " + s);
        }
    }

    @Getter
    @AllArgsConstructor
    public enum Rank {
        TWO(2, "2"), THREE(3, "3"), FOUR(4, "4"), FIVE(5, "5"), SIX(6, "6"), SEVEN(7, "7"),
        EIGHT(8, "8"), NINE(9, "9"), TEN(10, "T"), JACK(11, "J"), QUEEN(12, "Q"), KING(13, "K"), ACE(14, "A");

        private final int value;
        private final String symbol;

        /** 1 pour l'as, utilisé seulement pour la quinte A-2-3-4-5. */
        public int getLowAceValue() { return this == ACE ? 1 : value; }

        public static Rank ofValue(int value) {
            int v = value == 1 ? 14 : value;
            for (Rank r : values()) if (r.value == v) return r;
            throw new IllegalArgumentException("Rang inconnu: " + value);
        }

        static Rank fromSymbol(String s) {
            String u = s.toUpperCase(Locale.ROOT);
            if (u.equals("10")) return TEN;
            for (Rank r : values()) if (r.symbol.equals(u)) return r;
            throw new IllegalArgumentException("Rang inconnu: " + s);
        }
    }
}
