package org.holdem.service.holdem.betting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.config.HoldemProperties;
import org.holdem.model.holdem.*;
import org.holdem.model.holdem.rules.ActionRules;
import org.holdem.service.holdem.pot.PotService;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Machine à états d'une street : ordre de parole, légalité des actions (relance minimale,
 * réouverture, plafond en limite fixe) et report des jetons dans le registre de la main.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BettingService {
    private final PotService pots;
    private final HoldemProperties props;

    public record ActionOutcome(ActionLogEntry entry, ActionRules.Effective effective,
                                boolean roundComplete, String nextToAct) {}

    /**
     * Ouvre une street : remet les mises de street à zéro (sauf préflop, où les blindes comptent),
     * fixe la relance minimale et désigne le premier joueur.
     */
    public BettingRoundState startStreet(HandState h, Street street) {
        if (street != Street.PREFLOP) for (Player p : h.getPlayers()) p.resetForNewStreet();
        h.setStreet(street);

        long highest = h.playersInHand().stream().mapToLong(Player::getCurrentBet).max().orElse(0);
        Stakes stakes = h.getStakes();
        long increment = stakes.isFixedLimit() ? stakes.limitBetSize(street) : stakes.bigBlind();
        BettingRoundState r = new BettingRoundState(street, highest, increment);
        // limite fixe : la big blind compte comme première mise préflop
        if (stakes.isFixedLimit() && street == Street.PREFLOP && highest > 0) r.setBetsThisStreet(1);
        h.setRound(r);

        int start = street == Street.PREFLOP ? h.getBigBlindIndex() + 1 : h.getButtonIndex() + 1;
        r.setToActIndex(firstActor(h, start % h.getPlayers().size()));
        r.setComplete(isRoundComplete(h));
        if (r.isComplete()) r.setToActIndex(null);
        log.info("Street {} ouverte: mise haute={} relance min={} premier={}", street, highest, increment, nextToAct(h));
        return r;
    }

    public ActionRules.Bounds legalBounds(HandState h, Player p) {
        BettingRoundState r = requireRound(h);
        Stakes stakes = h.getStakes();
        long highest = r.getHighestBet();
        long fixed = stakes.isFixedLimit() ? stakes.limitBetSize(r.getStreet()) : 0;
        boolean capped = stakes.isFixedLimit() && r.getBetsThisStreet() >= stakes.maxBetsPerStreet();
        boolean raiseAllowed = !r.getRaiseClosed().contains(p.getId())
                && !capped
                && p.getCurrentBet() + p.getStack() > highest;
        long minRaiseTo = highest + (fixed > 0 ? fixed : r.getMinRaiseIncrement());
        return new ActionRules.Bounds(highest, p.getCurrentBet(), p.getStack(), minRaiseTo, raiseAllowed, fixed);
    }

    /**
     * Applique l'action du joueur qui a la parole, après normalisation.
     *
     * @throws IllegalStateException  street terminée ou joueur hors tour
     * @throws IllegalActionException action illégale en mode strict
     */
    public ActionOutcome apply(HandState h, String playerId, ActionType requested, long amount) {
        BettingRoundState r = requireRound(h);
        if (r.isComplete()) throw new IllegalStateException("Street terminée");
        Integer idx = r.getToActIndex();
        if (idx == null || !h.getPlayers().get(idx).getId().equals(playerId))
            throw new IllegalStateException("Pas ton tour (" + playerId + ")");

        Player p = h.getPlayers().get(idx);
        ActionRules.Bounds bounds = legalBounds(h, p);
        ActionRules.Effective eff = ActionRules.normalize(playerId, requested, amount, bounds, props.isStrictActions());
        if (eff.normalized()) log.warn("Action de {} ajustée: {} {} -> {} {} ({})",
                playerId, requested, amount, eff.type(), eff.betTo(), eff.reason());

        long chips = 0;
        switch (eff.type()) {
            case FOLD -> p.setFolded(true);
            case CHECK -> { }
            case CALL -> chips = commit(h, p, eff.betTo() - p.getCurrentBet());
            case RAISE -> {
                long previousHighest = r.getHighestBet();
                chips = commit(h, p, eff.betTo() - p.getCurrentBet());
                onRaise(h, r, p, previousHighest);
            }
            default -> throw new IllegalStateException("Action effective inattendue: " + eff.type());
        }
        r.getActed().add(playerId);

        String label = (eff.type() == ActionType.CALL || eff.type() == ActionType.RAISE) && p.isAllIn()
                ? ActionType.ALL_IN.name() : eff.type().name();
        ActionLogEntry entry = new ActionLogEntry(r.getStreet(), playerId, requested, label,
                chips, p.getCurrentBet(), h.potTotal(), eff.normalized());
        h.getLog().add(entry);
        log.debug("{} {} {} -> {} (+{}, pot {})", r.getStreet(), playerId, requested, label, chips, h.potTotal());

        advance(h, idx);
        return new ActionOutcome(entry, eff, r.isComplete(), nextToAct(h));
    }

    /**
     * Street terminée si au plus un joueur n'est pas couché, ou si tous les joueurs pouvant
     * encore agir ont parlé et égalisé la mise la plus haute.
     */
    public boolean isRoundComplete(HandState h) {
        BettingRoundState r = requireRound(h);
        List<Player> inHand = h.playersInHand();
        if (inHand.size() <= 1) return true;
        for (Player p : inHand) {
            if (p.isAllIn()) continue;
            if (!r.hasActed(p.getId())) return false;
            if (p.getCurrentBet() != r.getHighestBet()) return false;
        }
        return true;
    }

    public String nextToAct(HandState h) {
        Integer idx = h.getRound() == null ? null : h.getRound().getToActIndex();
        return idx == null ? null : h.getPlayers().get(idx).getId();
    }

    /** Relance complète : rouvre les paroles et fixe le nouvel incrément. Tapis court : ferme la relance à ceux qui ont déjà parlé. */
    private void onRaise(HandState h, BettingRoundState r, Player raiser, long previousHighest) {
        long newHighest = raiser.getCurrentBet();
        long size = newHighest - previousHighest;
        r.setHighestBet(newHighest);
        if (size >= r.getMinRaiseIncrement()) {
            if (!h.getStakes().isFixedLimit()) r.setMinRaiseIncrement(size);
            r.setBetsThisStreet(r.getBetsThisStreet() + 1);
            r.getRaiseClosed().clear();
            for (Player o : h.getPlayers()) {
                if (o != raiser && o.canAct()) r.getActed().remove(o.getId());
            }
        } else {
            for (Player o : h.getPlayers()) {
                if (o != raiser && r.hasActed(o.getId()) && o.canAct()) r.getRaiseClosed().add(o.getId());
            }
        }
    }

    private long commit(HandState h, Player p, long amount) {
        long paid = p.commit(Math.max(0, amount));
        pots.addContribution(h.getLedger(), p.getId(), paid);
        return paid;
    }

    private void advance(HandState h, int fromIndex) {
        BettingRoundState r = h.getRound();
        if (isRoundComplete(h)) {
            r.setComplete(true);
            r.setToActIndex(null);
            return;
        }
        int n = h.getPlayers().size();
        r.setToActIndex(firstActor(h, (fromIndex + 1) % n));
        if (r.getToActIndex() == null) r.setComplete(true);
    }

    /** Premier joueur, dans l'ordre des sièges, qui n'a pas encore parlé ou doit compléter sa mise. */
    private Integer firstActor(HandState h, int start) {
        BettingRoundState r = h.getRound();
        int n = h.getPlayers().size();
        for (int k = 0; k < n; k++) {
            int i = (start + k) % n;
            Player p = h.getPlayers().get(i);
            if (p.canAct() && (!r.hasActed(p.getId()) || p.getCurrentBet() != r.getHighestBet())) return i;
        }
        return null;
    }

    private BettingRoundState requireRound(HandState h) {
        if (h.getRound() == null) throw new IllegalStateException("Aucune street ouverte");
        return h.getRound();
    }
}
