package org.holdem.service.holdem.decision;

/**
 * Source de décision d'un joueur : saisie humaine ou stratégie automatique.
 * Le moteur ne dépend que de cette interface ; une décision illégale est ajustée ou refusée par le moteur.
 */
@FunctionalInterface
public interface DecisionSource {
    Decision decide(DecisionContext context);
}
