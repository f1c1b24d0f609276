package org.holdem.model.holdem;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Résultat d'un partage : détail par pot et total gagné par joueur (ordre stable). */
public record Distribution(List<PotAward> awards, Map<String, Long> payouts) {
    public Distribution {
        awards = List.copyOf(awards);
        payouts = Collections.unmodifiableMap(payouts);
    }

    public long totalPaid() {
        return payouts.values().stream().mapToLong(Long::longValue).sum();
    }

    public long paidTo(String playerId) { return payouts.getOrDefault(playerId, 0L); }
}
