package org.holdem.model.holdem;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * Meilleure main de 5 cartes : catégorie + départageurs (valeurs de rang 2..14, par ordre de priorité).
 *
 * <p>Valeur à ordre total : comparaison par catégorie, puis départageurs dans l'ordre.
 * Deux mains sont égales ssi catégorie et départageurs sont identiques (pot partagé),
 * quelles que soient les couleurs.
 *
 * <ul>
 *   <li>quinte / quinte flush : [carte haute] (la roue A-2-3-4-5 vaut 5)</li>
 *   <li>carré : [rang du carré, kicker]</li>
 *   <li>full : [rang du brelan, rang de la paire]</li>
 *   <li>couleur / carte haute : les 5 rangs décroissants</li>
 *   <li>brelan : [rang, kicker1, kicker2]</li>
 *   <li>double paire : [paire haute, paire basse, kicker]</li>
 *   <li>paire : [rang, kicker1, kicker2, kicker3]</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class PokerHand implements Comparable<PokerHand> {
    @EqualsAndHashCode.Include
    private final HandCategory category;
    @EqualsAndHashCode.Include
    private final List<Integer> tieBreakers;
    private final List<Card> cards;

    public PokerHand(HandCategory category, List<Integer> tieBreakers, List<Card> cards) {
        if (cards.size() != 5) throw new IllegalArgumentException("Une main contient exactement 5 cartes");
        this.category = category;
        this.tieBreakers = List.copyOf(tieBreakers);
        this.cards = List.copyOf(cards);
    }

    @Override
    public int compareTo(PokerHand other) {
        int c = category.compareTo(other.category);
        if (c != 0) return c;
        int n = Math.min(tieBreakers.size(), other.tieBreakers.size());
        for (int i = 0; i < n; i++) {
            int d = Integer.compare(tieBreakers.get(i), other.tieBreakers.get(i));
            if (d != 0) return d;
        }
        return Integer.compare(tieBreakers.size(), other.tieBreakers.size());
    }

    public boolean beats(PokerHand other) { return compareTo(other) > 0; }

    /** Carte haute de la quinte, rang du carré, du brelan ou de la paire haute selon la catégorie. */
    public int primaryRank() { return tieBreakers.get(0); }

    public String describe() {
        int p = primaryRank();
        return switch (category) {
            case ROYAL_FLUSH -> "Royal Flush";
            case STRAIGHT_FLUSH -> "Straight Flush, " + name(p) + " high";
            case FOUR_OF_A_KIND -> "Four of a Kind, " + plural(p);
            case FULL_HOUSE -> "Full House, " + plural(p) + " full of " + plural(tieBreakers.get(1));
            case FLUSH -> "Flush, " + name(p) + " high";
            case STRAIGHT -> "Straight, " + name(p) + " high";
            case THREE_OF_A_KIND -> "Three of a Kind, " + plural(p);
            case TWO_PAIR -> "Two Pair, " + plural(p) + " and " + plural(tieBreakers.get(1));
            case PAIR -> "Pair of " + plural(p);
            case HIGH_CARD -> "High Card, " + name(p);
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(category.getLabel()).append(':');
        for (Card c : cards) sb.append(' ').append(c);
        return sb.toString();
    }

    private static final String[] NAMES = {
            "", "Ace", "Two", "Three", "Four", "Five", "Six", "Seven", "Eight", "Nine", "Ten", "Jack", "Queen", "King", "Ace"
    };

    private static String name(int value) { return NAMES[value]; }

    private static String plural(int value) { return value == 6 ? "Sixes" : NAMES[value] + "s"; }
}
