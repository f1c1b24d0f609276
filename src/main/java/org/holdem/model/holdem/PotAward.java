package org.holdem.model.holdem;

import java.util.List;
import java.util.Map;

/** Attribution d'un pot : gagnants (ex-aequo) et part de chacun. {@code winningHand} est null si gagné sans abattage. */
public record PotAward(PotTier tier, List<String> winners, PokerHand winningHand, Map<String, Long> shares) {
    public PotAward {
        winners = List.copyOf(winners);
        shares = Map.copyOf(shares);
    }
}
