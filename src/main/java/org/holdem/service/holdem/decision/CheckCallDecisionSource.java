package org.holdem.service.holdem.decision;

/** Joueur passif : check si possible, sinon suit. */
public class CheckCallDecisionSource implements DecisionSource {
    @Override
    public Decision decide(DecisionContext context) {
        return context.canCheck() ? Decision.check() : Decision.call();
    }
}
