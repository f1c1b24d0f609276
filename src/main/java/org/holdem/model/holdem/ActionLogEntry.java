package org.holdem.model.holdem;

/**
 * Ligne du journal d'une main, consommée par la couche de persistance/statistiques.
 *
 * @param requested action demandée par la source de décision (null pour ante et blindes)
 * @param action    action réellement appliquée : nom d'{@link ActionType}, ou ANTE / SMALL_BLIND / BIG_BLIND
 * @param chips     jetons engagés par cette action
 * @param betTo     mise du joueur sur la street après l'action
 * @param normalized true si l'action demandée a été ramenée à l'action légale la plus proche
 */
public record ActionLogEntry(Street street, String playerId, ActionType requested, String action,
                             long chips, long betTo, long potAfter, boolean normalized) {

    public static ActionLogEntry forced(Street street, String playerId, String kind, long chips, long betTo, long potAfter) {
        return new ActionLogEntry(street, playerId, null, kind, chips, betTo, potAfter, false);
    }
}
