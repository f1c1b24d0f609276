package org.holdem.model.holdem.rules;

import org.holdem.model.holdem.ActionType;
import org.holdem.model.holdem.IllegalActionException;

/**
 * Ramène une action demandée à une action légale. Fonction pure : aucune mutation d'état,
 * l'exécution reste dans le service de mises.
 */
public final class ActionRules {
    private ActionRules(){}

    /**
     * Bornes légales pour le joueur qui doit parler.
     *
     * @param minRaiseTo   plus petite mise totale constituant une relance complète
     * @param raiseAllowed false si la relance est fermée (tapis court), plafonnée (limite fixe) ou impossible (tapis trop court)
     * @param fixedBetSize taille imposée en limite fixe, 0 en no-limit
     */
    public record Bounds(long highestBet, long currentBet, long stack, long minRaiseTo,
                         boolean raiseAllowed, long fixedBetSize) {
        public long toCall() { return Math.max(0, highestBet - currentBet); }
        public boolean canCheck() { return toCall() == 0; }
        public long maxTotal() { return currentBet + stack; }
        public boolean fixedLimit() { return fixedBetSize > 0; }
    }

    /** Action effective. {@code betTo} est la mise totale visée sur la street pour CALL et RAISE. */
    public record Effective(ActionType type, long betTo, boolean normalized, String reason) {
        static Effective of(ActionType type, long betTo) { return new Effective(type, betTo, false, null); }
    }

    public static Effective normalize(String playerId, ActionType requested, long amount, Bounds b, boolean strict) {
        if (requested == null) throw new IllegalArgumentException("Action manquante");
        return switch (requested) {
            case FOLD -> Effective.of(ActionType.FOLD, b.currentBet());
            case CHECK -> b.canCheck()
                    ? Effective.of(ActionType.CHECK, b.currentBet())
                    : downgrade(playerId, requested, amount, strict, fold(b), "Check impossible, il reste " + b.toCall() + " à payer");
            case CALL -> passive(b);
            case RAISE -> raise(playerId, requested, amount, b, strict);
            case ALL_IN -> allIn(playerId, amount, b, strict);
        };
    }

    private static Effective allIn(String playerId, long amount, Bounds b, boolean strict) {
        if (b.maxTotal() <= b.highestBet()) return passive(b);
        // limite fixe : le tapis est une relance comme une autre, ramenée à la taille fixe
        if (b.fixedLimit()) return raise(playerId, ActionType.ALL_IN, amount, b, strict);
        if (!b.raiseAllowed())
            return downgrade(playerId, ActionType.ALL_IN, amount, strict, passive(b), "Relance fermée pour ce joueur");
        return Effective.of(ActionType.RAISE, b.maxTotal());
    }

    private static Effective raise(String playerId, ActionType requested, long amount, Bounds b, boolean strict) {
        if (!b.raiseAllowed())
            return downgrade(playerId, requested, amount, strict, passive(b), "Relance fermée pour ce joueur");

        long target = amount;
        if (b.fixedLimit()) {
            target = Math.min(b.minRaiseTo(), b.maxTotal());
        } else if (target > b.maxTotal()) {
            if (strict) throw new IllegalActionException(playerId, requested, amount, "Relance au-delà du tapis (" + b.maxTotal() + ")");
            target = b.maxTotal();
        }

        if (target <= b.highestBet())
            return downgrade(playerId, requested, amount, strict, passive(b), "Relance sous la mise la plus haute (" + b.highestBet() + ")");
        if (target < b.minRaiseTo() && target < b.maxTotal())
            return downgrade(playerId, requested, amount, strict, passive(b), "Relance insuffisante, minimum " + b.minRaiseTo());

        boolean resized = !b.fixedLimit() && requested == ActionType.RAISE && target != amount;
        return new Effective(ActionType.RAISE, target, resized, resized ? "Relance ajustée à " + target : null);
    }

    private static Effective passive(Bounds b) {
        if (b.canCheck()) return Effective.of(ActionType.CHECK, b.currentBet());
        return Effective.of(ActionType.CALL, Math.min(b.highestBet(), b.maxTotal()));
    }

    private static Effective fold(Bounds b) { return Effective.of(ActionType.FOLD, b.currentBet()); }

    private static Effective downgrade(String playerId, ActionType requested, long amount, boolean strict,
                                       Effective fallback, String reason) {
        if (strict) throw new IllegalActionException(playerId, requested, amount, reason);
        return new Effective(fallback.type(), fallback.betTo(), true, reason);
    }
}
