package org.holdem.model.holdem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Jetons engagés par joueur sur toute la main. Jamais décrémenté.
 * Appartient à la main en cours ; ne se partage pas entre deux mains.
 */
public class ContributionLedger {
    private final Map<String, Long> contributions = new LinkedHashMap<>();
    private long total = 0;

    public void add(String playerId, long amount) {
        if (playerId == null) throw new IllegalArgumentException("Joueur manquant");
        if (amount < 0) throw new IllegalArgumentException("Contribution négative: " + amount);
        contributions.merge(playerId, amount, Long::sum);
        total += amount;
    }

    public long contributionOf(String playerId) { return contributions.getOrDefault(playerId, 0L); }

    public long total() { return total; }

    /** Ordre d'insertion = ordre des premières mises. */
    public Set<String> players() { return Collections.unmodifiableSet(contributions.keySet()); }

    public Map<String, Long> asMap() { return Collections.unmodifiableMap(contributions); }

    public boolean isEmpty() { return contributions.isEmpty(); }

    public static ContributionLedger of(Map<String, Long> amounts) {
        ContributionLedger l = new ContributionLedger();
        amounts.forEach(l::add);
        return l;
    }
}
