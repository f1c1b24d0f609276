package org.holdem.model.holdem;

public enum Street {
    PREFLOP, FLOP, TURN, RIVER;

    /** Cartes communes retournées en arrivant sur cette street. */
    public int boardCards() {
        return switch (this) {
            case PREFLOP -> 0;
            case FLOP -> 3;
            case TURN, RIVER -> 1;
        };
    }

    /** Limite fixe : une unité préflop/flop, deux au turn et à la river. */
    public int limitUnits() { return this == TURN || this == RIVER ? 2 : 1; }
}
