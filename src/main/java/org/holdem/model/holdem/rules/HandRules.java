package org.holdem.model.holdem.rules;

import org.holdem.model.holdem.Card;
import org.holdem.model.holdem.HandCategory;
import org.holdem.model.holdem.PokerHand;

import java.util.*;

/** Évaluateur de mains : fonctions pures, sans état. */
public final class HandRules {
    private HandRules(){}

    /**
     * Meilleure main de 5 cartes parmi 5 à 7 cartes (toutes les combinaisons C(n,5)).
     *
     * @throws IllegalArgumentException moins de 5 cartes, ou carte en double
     */
    public static PokerHand bestHand(Collection<Card> cards) {
        if (cards == null || cards.size() < 5)
            throw new IllegalArgumentException("Il faut au moins 5 cartes, reçu " + (cards == null ? 0 : cards.size()));
        List<Card> all = new ArrayList<>(cards);
        if (new HashSet<>(all).size() != all.size())
            throw new IllegalArgumentException("Carte en double: " + all);

        int n = all.size();
        PokerHand best = null;
        List<Card> five = new ArrayList<>(5);
        for (int a = 0; a < n - 4; a++)
            for (int b = a + 1; b < n - 3; b++)
                for (int c = b + 1; c < n - 2; c++)
                    for (int d = c + 1; d < n - 1; d++)
                        for (int e = d + 1; e < n; e++) {
                            five.clear();
                            five.add(all.get(a)); five.add(all.get(b)); five.add(all.get(c));
                            five.add(all.get(d)); five.add(all.get(e));
                            PokerHand h = classify(five);
                            if (best == null || h.beats(best)) best = h;
                        }
        return best;
    }

    /** Classe exactement 5 cartes. */
    public static PokerHand classify(List<Card> five) {
        if (five.size() != 5) throw new IllegalArgumentException("classify attend 5 cartes, reçu " + five.size());

        List<Card> sorted = new ArrayList<>(five);
        sorted.sort(Comparator.comparingInt(Card::value).reversed());

        // rang -> nombre, trié par (nombre desc, rang desc)
        Map<Integer, Integer> counts = new HashMap<>();
        for (Card c : sorted) counts.merge(c.value(), 1, Integer::sum);
        List<Integer> groups = new ArrayList<>(counts.keySet());
        groups.sort((x, y) -> {
            int byCount = Integer.compare(counts.get(y), counts.get(x));
            return byCount != 0 ? byCount : Integer.compare(y, x);
        });

        boolean flush = sorted.stream().map(Card::getSuit).distinct().count() == 1;
        int straightHigh = straightHigh(sorted, counts.size());

        if (flush && straightHigh > 0) {
            List<Card> ordered = straightOrder(sorted, straightHigh);
            HandCategory cat = straightHigh == 14 ? HandCategory.ROYAL_FLUSH : HandCategory.STRAIGHT_FLUSH;
            return new PokerHand(cat, List.of(straightHigh), ordered);
        }

        int top = counts.get(groups.get(0));
        List<Card> byGroups = groupOrder(sorted, groups);

        if (top == 4)
            return new PokerHand(HandCategory.FOUR_OF_A_KIND, groups, byGroups);
        if (top == 3 && groups.size() == 2)
            return new PokerHand(HandCategory.FULL_HOUSE, groups, byGroups);
        if (flush)
            return new PokerHand(HandCategory.FLUSH, values(sorted), sorted);
        if (straightHigh > 0)
            return new PokerHand(HandCategory.STRAIGHT, List.of(straightHigh), straightOrder(sorted, straightHigh));
        if (top == 3)
            return new PokerHand(HandCategory.THREE_OF_A_KIND, groups, byGroups);
        if (top == 2 && groups.size() == 3)
            return new PokerHand(HandCategory.TWO_PAIR, groups, byGroups);
        if (top == 2)
            return new PokerHand(HandCategory.PAIR, groups, byGroups);
        return new PokerHand(HandCategory.HIGH_CARD, values(sorted), sorted);
    }

    /** Carte haute de la quinte, 5 pour la roue, 0 sinon. {@code sorted} est décroissant. */
    static int straightHigh(List<Card> sorted, int distinctRanks) {
        if (distinctRanks != 5) return 0;
        int hi = sorted.get(0).value(), lo = sorted.get(4).value();
        if (hi - lo == 4) return hi;
        // roue : l'as compte pour 1 sous le 5
        if (sorted.get(1).value() - sorted.get(0).lowAceValue() == 4) return 5;
        return 0;
    }

    private static List<Card> straightOrder(List<Card> sorted, int high) {
        if (high != 5 || sorted.get(0).value() != 14) return sorted;
        List<Card> wheel = new ArrayList<>(sorted.subList(1, 5));
        wheel.add(sorted.get(0));
        return wheel;
    }

    private static List<Card> groupOrder(List<Card> sorted, List<Integer> groups) {
        List<Card> out = new ArrayList<>(5);
        for (int v : groups)
            for (Card c : sorted) if (c.value() == v) out.add(c);
        return out;
    }

    private static List<Integer> values(List<Card> sorted) {
        List<Integer> out = new ArrayList<>(5);
        for (Card c : sorted) out.add(c.value());
        return out;
    }
}
