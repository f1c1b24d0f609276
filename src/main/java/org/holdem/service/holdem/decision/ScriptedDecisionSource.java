package org.holdem.service.holdem.decision;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Rejoue une liste de décisions dans l'ordre ; une fois épuisée : check, ou fold face à une mise. */
public class ScriptedDecisionSource implements DecisionSource {
    private final Deque<Decision> script;

    public ScriptedDecisionSource(List<Decision> decisions) {
        this.script = new ArrayDeque<>(decisions);
    }

    public static ScriptedDecisionSource of(Decision... decisions) {
        return new ScriptedDecisionSource(List.of(decisions));
    }

    @Override
    public Decision decide(DecisionContext context) {
        Decision next = script.pollFirst();
        if (next != null) return next;
        return context.canCheck() ? Decision.check() : Decision.fold();
    }
}
