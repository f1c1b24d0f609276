package org.holdem.service.holdem.decision;

import org.holdem.model.holdem.Card;
import org.holdem.model.holdem.Street;

import java.util.List;

/**
 * Ce que voit le joueur qui a la parole.
 *
 * @param limitBetSize taille de mise imposée en limite fixe, null en no-limit
 */
public record DecisionContext(String playerId, Street street, List<Card> holeCards, List<Card> board,
                              long highestBet, long currentBet, long toCall, long stack,
                              long minRaiseIncrement, long minRaiseTo, long potTotal, double potOdds,
                              boolean canCheck, boolean raiseAllowed, Long limitBetSize, int playersInHand) {
}
