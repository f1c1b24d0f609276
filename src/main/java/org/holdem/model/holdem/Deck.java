package org.holdem.model.holdem;

import java.security.SecureRandom;
import java.util.*;

public class Deck {
    private final Deque<Card> cards = new ArrayDeque<>();

    public Deck() { this(new SecureRandom()); }

    /** Random fourni (graine fixe pour rejouer une main). */
    public Deck(Random rnd) {
        List<Card> tmp = standard();
        Collections.shuffle(tmp, rnd);
        cards.addAll(tmp);
    }

    private Deck(List<Card> ordered) {
        if (new HashSet<>(ordered).size() != ordered.size())
            throw new IllegalArgumentException("Paquet avec cartes en double");
        cards.addAll(ordered);
    }

    /** Paquet dont les cartes sortent exactement dans l'ordre donné. */
    public static Deck ordered(List<Card> order) {
        return new Deck(new ArrayList<>(order));
    }

    public static List<Card> standard() {
        List<Card> tmp = new ArrayList<>(52);
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
        }
        return tmp;
    }

    public Card deal() {
        Card c = cards.pollFirst();
        if (c == null) throw new IllegalStateException("Paquet vide");
        return c;
    }

    public List<Card> deal(int count) {
        if (count > cards.size())
            throw new IllegalStateException("Impossible de distribuer " + count + " cartes, il en reste " + cards.size());
        List<Card> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(deal());
        return out;
    }

    public Card burn() { return deal(); }

    public int remaining() { return cards.size(); }
}
