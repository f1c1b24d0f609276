package org.holdem.model.holdem;

/**
 * Enjeux d'une main.
 *
 * @param maxBetsPerStreet plafond en limite fixe (mise + relances), ignoré en no-limit
 */
public record Stakes(long smallBlind, long bigBlind, long ante, BettingStructure structure, int maxBetsPerStreet) {
    public Stakes {
        if (smallBlind < 0 || bigBlind <= 0 || ante < 0) throw new IllegalArgumentException("Blindes invalides");
        if (structure == null) structure = BettingStructure.NO_LIMIT;
        if (maxBetsPerStreet <= 0) throw new IllegalArgumentException("Plafond de relances invalide");
    }

    public static Stakes noLimit(long smallBlind, long bigBlind) {
        return new Stakes(smallBlind, bigBlind, 0, BettingStructure.NO_LIMIT, 4);
    }

    public static Stakes fixedLimit(long smallBlind, long bigBlind) {
        return new Stakes(smallBlind, bigBlind, 0, BettingStructure.FIXED_LIMIT, 4);
    }

    public boolean isFixedLimit() { return structure == BettingStructure.FIXED_LIMIT; }

    /** Taille de mise fixe de la street (big blind × unités). */
    public long limitBetSize(Street street) { return bigBlind * street.limitUnits(); }
}
