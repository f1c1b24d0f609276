package org.holdem.service.holdem.pot;

import lombok.extern.slf4j.Slf4j;
import org.holdem.model.holdem.*;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Pot principal / pots annexes à partir du registre des contributions, et partage à l'abattage.
 * Sans état : le registre appartient à la main en cours.
 */
@Slf4j
@Service
public class PotService {

    public void addContribution(ContributionLedger ledger, String playerId, long amount) {
        ledger.add(playerId, amount);
    }

    /**
     * Paliers de pot. Un palier dont tous les contributeurs sont couchés est reporté sur le
     * palier éligible suivant (ou, à défaut, sur le dernier palier éligible).
     *
     * @throws PotAccountingException si aucun joueur n'est éligible ou si la somme ne correspond pas
     */
    public List<PotTier> derivePots(ContributionLedger ledger, Set<String> folded) {
        Map<String, Long> contrib = ledger.asMap();
        TreeSet<Long> levels = new TreeSet<>();
        for (long v : contrib.values()) if (v > 0) levels.add(v);

        List<PotTier> tiers = new ArrayList<>();
        long previous = 0, carry = 0;
        for (long level : levels) {
            int contributors = 0;
            List<String> eligible = new ArrayList<>();
            for (Map.Entry<String, Long> e : contrib.entrySet()) {
                if (e.getValue() >= level) {
                    contributors++;
                    if (!folded.contains(e.getKey())) eligible.add(e.getKey());
                }
            }
            long amount = (level - previous) * contributors;
            previous = level;
            if (eligible.isEmpty()) {
                carry += amount;
                continue;
            }
            tiers.add(new PotTier(tiers.size(), level, amount + carry, eligible));
            carry = 0;
        }

        if (carry > 0) {
            if (tiers.isEmpty()) throw new PotAccountingException("Aucun joueur éligible pour " + carry + " jetons");
            PotTier last = tiers.remove(tiers.size() - 1);
            tiers.add(new PotTier(last.index(), last.level(), last.amount() + carry, last.eligible()));
        }

        long sum = tiers.stream().mapToLong(PotTier::amount).sum();
        if (sum != ledger.total()) {
            log.error("Pots incohérents: paliers={} registre={}", sum, ledger.total());
            throw new PotAccountingException("Somme des pots " + sum + " != contributions " + ledger.total());
        }
        return tiers;
    }

    /**
     * Partage chaque palier entre les meilleures mains éligibles. Le reste d'une division
     * revient en entier au gagnant le plus proche à gauche du bouton.
     *
     * @param hands     meilleure main de chaque joueur encore en jeu
     * @param seatOrder identifiants en partant de la gauche du bouton
     */
    public Distribution distribute(ContributionLedger ledger, Set<String> folded,
                                   Map<String, PokerHand> hands, List<String> seatOrder) {
        List<String> live = new ArrayList<>();
        for (String p : ledger.players()) if (!folded.contains(p)) live.add(p);

        Map<String, Long> payouts = new LinkedHashMap<>();
        if (live.size() == 1) {
            String winner = live.get(0);
            payouts.put(winner, ledger.total());
            PotTier whole = new PotTier(0, ledger.contributionOf(winner), ledger.total(), live);
            return new Distribution(List.of(new PotAward(whole, live, null, Map.of(winner, ledger.total()))), payouts);
        }

        List<PotAward> awards = new ArrayList<>();
        for (PotTier tier : derivePots(ledger, folded)) {
            PokerHand best = null;
            List<String> winners = new ArrayList<>();
            for (String p : tier.eligible()) {
                PokerHand h = hands.get(p);
                if (h == null) throw new IllegalArgumentException("Main manquante pour " + p);
                int cmp = best == null ? 1 : h.compareTo(best);
                if (cmp > 0) {
                    best = h;
                    winners.clear();
                    winners.add(p);
                } else if (cmp == 0) {
                    winners.add(p);
                }
            }
            winners.sort(Comparator.comparingInt(p -> seatRank(seatOrder, p)));

            long each = tier.amount() / winners.size();
            long remainder = tier.amount() % winners.size();
            Map<String, Long> shares = new LinkedHashMap<>();
            for (String w : winners) shares.put(w, each);
            if (remainder > 0) shares.merge(winners.get(0), remainder, Long::sum);
            shares.forEach((p, v) -> payouts.merge(p, v, Long::sum));
            awards.add(new PotAward(tier, winners, best, shares));
            log.info("Pot {} ({}): {} gagné par {} avec {}", tier.index(), tier.amount(),
                    tier.isMain() ? "principal" : "annexe", winners, best.describe());
        }

        Distribution d = new Distribution(awards, payouts);
        if (d.totalPaid() != ledger.total()) {
            log.error("Partage incohérent: payé={} registre={}", d.totalPaid(), ledger.total());
            throw new PotAccountingException("Jetons distribués " + d.totalPaid() + " != contributions " + ledger.total());
        }
        return d;
    }

    /** Cote du pot : toCall / (pot + toCall), 0 s'il n'y a rien à payer. */
    public double potOdds(long potTotal, long toCall) {
        if (toCall <= 0) return 0.0;
        return (double) toCall / (potTotal + toCall);
    }

    /**
     * Rake de cash game : {@code rate} du pot, arrondi à l'inférieur et plafonné à {@code cap}.
     * Calcul seul, le pot n'est pas modifié.
     */
    public long rake(long potTotal, double rate, long cap) {
        if (potTotal < 0) throw new IllegalArgumentException("Pot négatif: " + potTotal);
        if (rate < 0 || rate > 1) throw new IllegalArgumentException("Taux de rake hors [0,1]: " + rate);
        if (cap < 0) throw new IllegalArgumentException("Plafond de rake négatif: " + cap);
        return Math.min((long) (potTotal * rate), cap);
    }

    private static int seatRank(List<String> seatOrder, String playerId) {
        int i = seatOrder.indexOf(playerId);
        return i < 0 ? Integer.MAX_VALUE : i;
    }
}
