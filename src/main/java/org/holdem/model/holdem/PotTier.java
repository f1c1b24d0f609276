package org.holdem.model.holdem;

import java.util.List;

/**
 * Pot principal (index 0) ou pot annexe.
 *
 * @param level    palier de contribution qui ferme ce pot
 * @param amount   jetons du pot (y compris les jetons reportés d'un palier sans éligible)
 * @param eligible joueurs non couchés ayant atteint le palier, dans l'ordre du registre
 */
public record PotTier(int index, long level, long amount, List<String> eligible) {
    public PotTier {
        eligible = List.copyOf(eligible);
    }

    public boolean isMain() { return index == 0; }
}
