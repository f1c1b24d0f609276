package org.holdem.service.holdem.table;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.config.HoldemProperties;
import org.holdem.dto.holdem.*;
import org.holdem.model.holdem.*;
import org.holdem.model.holdem.rules.HandRules;
import org.holdem.service.holdem.betting.BettingService;
import org.holdem.service.holdem.engine.HandEngine;
import org.holdem.service.holdem.pot.PotService;
import org.springframework.stereotype.Service;

import java.util.*;

/** Façade REST : évaluation de main, calcul des pots et simulation d'une street. */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldemTableService {
    private final PotService pots;
    private final BettingService betting;
    private final HandEngine engine;
    private final HoldemProperties props;

    public HandView evaluate(EvaluateRequest req) {
        List<Card> cards = Card.parseAll(req.getCards());
        if (cards.size() > 7) throw new IllegalArgumentException("7 cartes maximum, reçu " + cards.size());
        PokerHand best = HandRules.bestHand(cards);
        log.debug("Évaluation {} -> {}", cards, best);
        return HandView.of(best);
    }

    public PotResponse pots(PotRequest req) {
        ContributionLedger ledger = ContributionLedger.of(req.getContributions());
        Set<String> folded = new LinkedHashSet<>(req.getFolded() == null ? List.of() : req.getFolded());
        for (String f : folded) {
            if (!ledger.players().contains(f)) throw new IllegalArgumentException("Joueur couché inconnu: " + f);
        }
        if (folded.containsAll(ledger.players()))
            throw new IllegalArgumentException("Aucun contributeur encore en jeu");
        List<PotTier> tiers = pots.derivePots(ledger, folded);
        long rake = pots.rake(ledger.total(), props.getRakeRate(), props.getRakeCap());
        if (req.getHands() == null || req.getHands().isEmpty()) {
            return new PotResponse(ledger.total(), rake, tiers, List.of(), Map.of());
        }

        List<Card> board = Card.parseAll(req.getBoard());
        Set<Card> seen = new HashSet<>();
        for (Card c : board) {
            if (!seen.add(c)) throw new IllegalArgumentException("Carte en double: " + c);
        }
        Map<String, PokerHand> hands = new LinkedHashMap<>();
        req.getHands().forEach((id, hole) -> {
            List<Card> cards = new ArrayList<>(Card.parseAll(hole));
            for (Card c : cards) {
                if (!seen.add(c)) throw new IllegalArgumentException("Carte en double: " + c);
            }
            cards.addAll(board);
            if (cards.size() > 7) throw new IllegalArgumentException("7 cartes maximum pour " + id + ", reçu " + cards.size());
            hands.put(id, HandRules.bestHand(cards));
        });
        List<String> seatOrder = req.getSeatOrder() == null || req.getSeatOrder().isEmpty()
                ? List.copyOf(ledger.players()) : req.getSeatOrder();

        Distribution d = pots.distribute(ledger, folded, hands, seatOrder);
        List<PotResponse.AwardView> awards = d.awards().stream()
                .map(a -> new PotResponse.AwardView(a.tier().index(), a.tier().amount(), a.winners(),
                        HandView.of(a.winningHand()), a.shares()))
                .toList();
        return new PotResponse(ledger.total(), rake, d.awards().stream().map(PotAward::tier).toList(), awards, d.payouts());
    }

    /**
     * Rejoue une street à partir d'une table décrite par la requête. Au préflop les antes et blindes
     * sont postées ; sur les autres streets les contributions passées alimentent le registre.
     */
    public StreetResponse street(StreetRequest req) {
        Street street = req.getStreet() == null ? Street.PREFLOP : req.getStreet();
        Stakes base = props.toStakes();
        Stakes stakes = new Stakes(
                req.getSmallBlind() == null ? base.smallBlind() : req.getSmallBlind(),
                req.getBigBlind() == null ? base.bigBlind() : req.getBigBlind(),
                street == Street.PREFLOP ? base.ante() : 0,
                req.getStructure() == null ? base.structure() : req.getStructure(),
                base.maxBetsPerStreet());

        Map<String, Long> previous = req.getContributions() == null ? Map.of() : req.getContributions();
        if (street == Street.PREFLOP && !previous.isEmpty())
            throw new IllegalArgumentException("Pas de contributions antérieures au préflop");

        List<Player> players = new ArrayList<>();
        for (StreetRequest.Seat s : req.getPlayers()) players.add(new Player(s.getId(), s.getStack()));
        HandState h = new HandState(players, req.getButtonIndex(), stakes);

        previous.forEach((id, amount) -> {
            Player p = h.player(id);
            pots.addContribution(h.getLedger(), id, amount);
            p.setTotalBet(amount);
        });
        for (String id : req.getFolded() == null ? List.<String>of() : req.getFolded()) h.player(id).setFolded(true);
        for (Player p : h.getPlayers()) {
            if (p.getStack() > 0 || p.isFolded()) continue;
            if (p.getTotalBet() == 0) throw new IllegalArgumentException("Tapis vide pour " + p.getId());
            p.setAllIn(true);
        }

        if (street == Street.PREFLOP) engine.postForcedBets(h);
        betting.startStreet(h, street);
        for (StreetRequest.Action a : req.getActions()) {
            betting.apply(h, a.getPlayer(), a.getAction(), a.getAmount());
        }

        BettingRoundState r = h.getRound();
        List<StreetResponse.SeatView> seats = h.getPlayers().stream()
                .map(p -> new StreetResponse.SeatView(p.getId(), p.getStack(), p.getCurrentBet(), p.getTotalBet(),
                        p.isFolded(), p.isAllIn()))
                .toList();
        List<PotTier> tiers = h.getLedger().isEmpty() || h.playersInHand().isEmpty()
                ? List.of() : pots.derivePots(h.getLedger(), h.foldedIds());
        return new StreetResponse(street, List.copyOf(h.getLog()), r.isComplete(), betting.nextToAct(h),
                r.getHighestBet(), r.getMinRaiseIncrement(), h.potTotal(), seats, tiers);
    }
}
