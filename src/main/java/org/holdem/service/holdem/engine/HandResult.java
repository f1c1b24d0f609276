package org.holdem.service.holdem.engine;

import org.holdem.model.holdem.*;

import java.util.List;
import java.util.Map;

/**
 * Sortie d'une main pour la couche persistance/statistiques.
 *
 * @param showdownHands vide si la main s'est terminée sans abattage
 * @param stacks        tapis de chaque joueur après paiement
 */
public record HandResult(List<Card> board, List<PotTier> tiers, Distribution distribution,
                         List<String> winners, Map<String, PokerHand> showdownHands,
                         List<ActionLogEntry> actions, Map<String, Long> stacks, long potTotal) {
}
