package org.holdem.dto.holdem;

import org.holdem.model.holdem.Card;
import org.holdem.model.holdem.HandCategory;
import org.holdem.model.holdem.PokerHand;

import java.util.List;

public record HandView(HandCategory category, String description, List<String> cards, List<Integer> tieBreakers) {
    public static HandView of(PokerHand h) {
        if (h == null) return null;
        return new HandView(h.getCategory(), h.describe(), h.getCards().stream().map(Card::toString).toList(), h.getTieBreakers());
    }
}
