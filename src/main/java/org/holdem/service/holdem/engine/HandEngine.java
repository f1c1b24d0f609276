package org.holdem.service.holdem.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.model.holdem.*;
import org.holdem.model.holdem.rules.ActionRules;
import org.holdem.model.holdem.rules.DealingRules;
import org.holdem.model.holdem.rules.HandRules;
import org.holdem.service.holdem.betting.BettingService;
import org.holdem.service.holdem.decision.CheckCallDecisionSource;
import org.holdem.service.holdem.decision.Decision;
import org.holdem.service.holdem.decision.DecisionContext;
import org.holdem.service.holdem.decision.DecisionSource;
import org.holdem.service.holdem.pot.PotService;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Déroulé complet d'une main : antes, blindes, distribution, quatre streets, abattage et paiement.
 * Un seul joueur parle à la fois ; l'appel à la source de décision est bloquant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandEngine {
    private final BettingService betting;
    private final PotService pots;

    private static final DecisionSource PASSIVE = new CheckCallDecisionSource();

    /**
     * @param seating     joueurs dans l'ordre des sièges (les tapis vides ne reçoivent pas de cartes)
     * @param buttonIndex siège du bouton dans {@code seating}
     * @param sources     source de décision par joueur ; à défaut check/call
     */
    public HandResult playHand(List<Player> seating, int buttonIndex, Stakes stakes, Deck deck,
                               Map<String, DecisionSource> sources) {
        HandState h = newHand(seating, buttonIndex, stakes);
        h.setDeck(deck);
        log.info("Nouvelle main: {} joueurs, bouton={}, blindes {}/{} ({})", h.getPlayers().size(),
                h.getPlayers().get(h.getButtonIndex()).getId(), stakes.smallBlind(), stakes.bigBlind(), stakes.structure());

        postForcedBets(h);
        DealingRules.dealHoleCards(h);

        for (Street street : Street.values()) {
            if (h.playersInHand().size() <= 1) break;
            DealingRules.dealBoard(h, street);
            if (needsBetting(h, street)) runStreet(h, street, sources);
        }
        return complete(h);
    }

    public HandState newHand(List<Player> seating, int buttonIndex, Stakes stakes) {
        List<Player> dealt = new ArrayList<>();
        int button = -1;
        for (int k = 0; k < seating.size(); k++) {
            int i = (buttonIndex + k) % seating.size();
            Player p = seating.get(i);
            if (p.getStack() <= 0) continue;
            p.resetForNewHand();
            if (button < 0) button = i;
        }
        for (Player p : seating) if (p.getStack() > 0) dealt.add(p);
        if (dealt.size() < 2) throw new IllegalArgumentException("Il faut au moins 2 joueurs avec des jetons");
        return new HandState(dealt, dealt.indexOf(seating.get(button)), stakes);
    }

    /** Antes (argent mort, hors mise de street) puis petite et grosse blinde, plafonnées au tapis. */
    public void postForcedBets(HandState h) {
        Stakes stakes = h.getStakes();
        if (stakes.ante() > 0) {
            for (Player p : h.getPlayers()) {
                long paid = p.commit(stakes.ante());
                p.setCurrentBet(p.getCurrentBet() - paid);
                pots.addContribution(h.getLedger(), p.getId(), paid);
                h.getLog().add(ActionLogEntry.forced(Street.PREFLOP, p.getId(), "ANTE", paid, p.getCurrentBet(), h.potTotal()));
            }
        }
        postBlind(h, h.smallBlindPlayer(), stakes.smallBlind(), "SMALL_BLIND");
        postBlind(h, h.bigBlindPlayer(), stakes.bigBlind(), "BIG_BLIND");
    }

    private void postBlind(HandState h, Player p, long amount, String kind) {
        if (amount <= 0 || p.getStack() <= 0) return;
        long paid = p.commit(amount);
        pots.addContribution(h.getLedger(), p.getId(), paid);
        h.getLog().add(ActionLogEntry.forced(Street.PREFLOP, p.getId(), kind, paid, p.getCurrentBet(), h.potTotal()));
        log.debug("{} poste {} {}{}", p.getId(), kind, paid, p.isAllIn() ? " (tapis)" : "");
    }

    /** Pas de parole si moins de deux joueurs peuvent encore miser et que personne n'a de mise à compléter. */
    private boolean needsBetting(HandState h, Street street) {
        List<Player> inHand = h.playersInHand();
        long highest = street == Street.PREFLOP
                ? inHand.stream().mapToLong(Player::getCurrentBet).max().orElse(0) : 0;
        if (h.actionableCount() >= 2) return true;
        for (Player p : inHand) {
            if (p.canAct() && p.getCurrentBet() < highest) return true;
        }
        return false;
    }

    public void runStreet(HandState h, Street street, Map<String, DecisionSource> sources) {
        BettingRoundState r = betting.startStreet(h, street);
        while (!r.isComplete()) {
            String id = betting.nextToAct(h);
            Player p = h.player(id);
            DecisionContext ctx = context(h, p);
            Decision d = sources.getOrDefault(id, PASSIVE).decide(ctx);
            if (d == null) d = ctx.canCheck() ? Decision.check() : Decision.fold();
            betting.apply(h, id, d.action(), d.amount());
        }
        log.info("Street {} terminée, pot={}", street, h.potTotal());
    }

    public DecisionContext context(HandState h, Player p) {
        ActionRules.Bounds b = betting.legalBounds(h, p);
        BettingRoundState r = h.getRound();
        return new DecisionContext(p.getId(), r.getStreet(), List.copyOf(p.getHoleCards()), List.copyOf(h.getBoard()),
                b.highestBet(), b.currentBet(), b.toCall(), b.stack(),
                r.getMinRaiseIncrement(), b.minRaiseTo(), h.potTotal(), pots.potOdds(h.potTotal(), b.toCall()),
                b.canCheck(), b.raiseAllowed(), b.fixedLimit() ? b.fixedBetSize() : null, h.playersInHand().size());
    }

    /** Abattage (si plus d'un joueur), partage des pots et crédit des tapis. */
    public HandResult complete(HandState h) {
        List<Player> inHand = h.playersInHand();
        Map<String, PokerHand> hands = new LinkedHashMap<>();
        if (inHand.size() > 1) {
            for (Player p : inHand) {
                List<Card> cards = new ArrayList<>(p.getHoleCards());
                cards.addAll(h.getBoard());
                hands.put(p.getId(), HandRules.bestHand(cards));
            }
        }

        long potTotal = h.potTotal();
        Distribution d = pots.distribute(h.getLedger(), h.foldedIds(), hands, h.seatOrderFromButton());
        d.payouts().forEach((id, amount) -> h.player(id).win(amount));

        List<PotTier> tiers = d.awards().stream().map(PotAward::tier).toList();
        Set<String> winners = new LinkedHashSet<>();
        for (PotAward a : d.awards()) winners.addAll(a.winners());
        Map<String, Long> stacks = new LinkedHashMap<>();
        for (Player p : h.getPlayers()) stacks.put(p.getId(), p.getStack());

        log.info("Main terminée: pot={} gagnants={} paiements={}", potTotal, winners, d.payouts());
        return new HandResult(List.copyOf(h.getBoard()), tiers, d, List.copyOf(winners), hands,
                List.copyOf(h.getLog()), stacks, potTotal);
    }
}
