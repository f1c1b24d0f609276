package org.holdem.service.holdem.pot;

import org.holdem.model.holdem.*;
import org.holdem.model.holdem.rules.HandRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class PotServiceTest {

    PotService pots;

    @BeforeEach
    void setup() {
        pots = new PotService();
    }

    private static ContributionLedger ledger(Object... idAmount) {
        Map<String, Long> m = new LinkedHashMap<>();
        for (int i = 0; i < idAmount.length; i += 2) m.put((String) idAmount[i], ((Number) idAmount[i + 1]).longValue());
        return ContributionLedger.of(m);
    }

    private static PokerHand hand(String... cards) {
        return HandRules.bestHand(Card.parseAll(List.of(cards)));
    }

    // -------------------------------------------------------------------------
    // derivePots()
    // -------------------------------------------------------------------------
    @Test
    void derivePots_troisTapisDifferents_troisPaliers() {
        List<PotTier> tiers = pots.derivePots(ledger("A", 1000, "B", 500, "C", 200), Set.of());

        assertThat(tiers).extracting(PotTier::amount).containsExactly(600L, 600L, 500L);
        assertThat(tiers.get(0).eligible()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(tiers.get(1).eligible()).containsExactlyInAnyOrder("A", "B");
        assertThat(tiers.get(2).eligible()).containsExactly("A");
        assertThat(tiers.get(0).isMain()).isTrue();
    }

    @Test
    void derivePots_contributionsEgales_unSeulPot() {
        List<PotTier> tiers = pots.derivePots(ledger("A", 100, "B", 100, "C", 100), Set.of("C"));
        assertThat(tiers).hasSize(1);
        assertThat(tiers.get(0).amount()).isEqualTo(300);
        assertThat(tiers.get(0).eligible()).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    void derivePots_palierDeCouches_reporte() {
        // A a relancé puis s'est couché : son surplus reste dans le dernier pot éligible
        List<PotTier> tiers = pots.derivePots(ledger("A", 100, "B", 50, "C", 50), Set.of("A"));
        assertThat(tiers).hasSize(1);
        assertThat(tiers.get(0).amount()).isEqualTo(200);
        assertThat(tiers.get(0).eligible()).containsExactlyInAnyOrder("B", "C");
    }

    @Test
    void derivePots_sommeEgaleAuRegistre() {
        ContributionLedger l = ledger("A", 37, "B", 120, "C", 5, "D", 120);
        long sum = pots.derivePots(l, Set.of("C")).stream().mapToLong(PotTier::amount).sum();
        assertThat(sum).isEqualTo(l.total());
    }

    @Test
    void derivePots_tousCouches_exception() {
        assertThatThrownBy(() -> pots.derivePots(ledger("A", 10, "B", 10), Set.of("A", "B")))
                .isInstanceOf(PotAccountingException.class);
    }

    @Test
    void addContribution_negative_refusee() {
        ContributionLedger l = new ContributionLedger();
        assertThatThrownBy(() -> pots.addContribution(l, "A", -1)).isInstanceOf(IllegalArgumentException.class);
        pots.addContribution(l, "A", 0);
        pots.addContribution(l, "A", 25);
        assertThat(l.contributionOf("A")).isEqualTo(25);
        assertThat(l.total()).isEqualTo(25);
    }

    // -------------------------------------------------------------------------
    // distribute()
    // -------------------------------------------------------------------------
    @Test
    void distribute_unSeulJoueurRestant_prendToutSansAbattage() {
        Distribution d = pots.distribute(ledger("A", 100, "B", 50), Set.of("B"), Map.of(), List.of("A", "B"));
        assertThat(d.payouts()).containsExactly(Map.entry("A", 150L));
        assertThat(d.awards().get(0).winningHand()).isNull();
    }

    @Test
    void distribute_potsAnnexes_meilleureMainParPalier() {
        Map<String, PokerHand> hands = Map.of(
                "A", hand("2c", "3d", "7h", "9s", "Jc"),       // carte haute
                "B", hand("Kc", "Kd", "7c", "9d", "2s"),       // paire
                "C", hand("Ac", "Ad", "Ah", "9h", "2h"));      // brelan
        Distribution d = pots.distribute(ledger("A", 1000, "B", 500, "C", 200), Set.of(), hands, List.of("A", "B", "C"));

        assertThat(d.paidTo("C")).isEqualTo(600);
        assertThat(d.paidTo("B")).isEqualTo(600);
        assertThat(d.paidTo("A")).isEqualTo(500);
        assertThat(d.totalPaid()).isEqualTo(1700);
    }

    @Test
    void distribute_egalite_resteAuPremierAGaucheDuBouton() {
        Map<String, PokerHand> hands = Map.of(
                "A", hand("Ac", "Kd", "9h", "4s", "2c"),
                "B", hand("Ad", "Kc", "9s", "4h", "2d"));
        Distribution d = pots.distribute(ledger("A", 5, "B", 5, "C", 5), Set.of("C"), hands, List.of("C", "B", "A"));

        assertThat(d.paidTo("B")).isEqualTo(8);
        assertThat(d.paidTo("A")).isEqualTo(7);
        assertThat(d.awards().get(0).winners()).containsExactly("B", "A");
    }

    @Test
    void distribute_mainManquante_exception() {
        Map<String, PokerHand> hands = Map.of("A", hand("Ac", "Kd", "9h", "4s", "2c"));
        assertThatThrownBy(() -> pots.distribute(ledger("A", 10, "B", 10), Set.of(), hands, List.of("A", "B")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("B");
    }

    // -------------------------------------------------------------------------
    // potOdds()
    // -------------------------------------------------------------------------
    @Test
    void rake_tauxPlafonne_potInchange() {
        ContributionLedger l = ledger("A", 100, "B", 100);
        assertThat(pots.rake(l.total(), 0.05, 25)).isEqualTo(10);
        assertThat(pots.rake(1700, 0.05, 25)).isEqualTo(25);
        assertThat(pots.rake(19, 0.05, 25)).isZero();
        assertThat(l.total()).isEqualTo(200);
        assertThatThrownBy(() -> pots.rake(100, 1.5, 25)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void potOdds() {
        assertThat(pots.potOdds(300, 100)).isEqualTo(0.25);
        assertThat(pots.potOdds(300, 0)).isZero();
    }
}
