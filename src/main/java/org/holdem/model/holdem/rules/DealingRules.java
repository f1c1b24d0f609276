package org.holdem.model.holdem.rules;

import org.holdem.model.holdem.Card;
import org.holdem.model.holdem.HandState;
import org.holdem.model.holdem.Player;
import org.holdem.model.holdem.Street;

import java.util.List;

public final class DealingRules {
    private DealingRules(){}

    /** Deux tours d'une carte, en commençant par la petite blinde. */
    public static void dealHoleCards(HandState h) {
        List<Player> players = h.getPlayers();
        int n = players.size();
        for (Player p : players) p.getHoleCards().clear();
        for (int i = 0; i < 2; i++) {
            for (int k = 0; k < n; k++) {
                players.get((h.getSmallBlindIndex() + k) % n).getHoleCards().add(h.getDeck().deal());
            }
        }
    }

    /** Brûle une carte puis retourne les cartes communes de la street. */
    public static List<Card> dealBoard(HandState h, Street street) {
        if (street == Street.PREFLOP) return List.of();
        h.getDeck().burn();
        List<Card> cards = h.getDeck().deal(street.boardCards());
        h.getBoard().addAll(cards);
        return cards;
    }
}
