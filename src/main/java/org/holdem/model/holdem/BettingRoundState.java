package org.holdem.model.holdem;

import lombok.Data;

import java.util.HashSet;
import java.util.Set;

/** État d'une street, remis à zéro au début de chaque street. */
@Data
public class BettingRoundState {
    private final Street street;
    private long highestBet;
    private long minRaiseIncrement;
    private int betsThisStreet = 0;                            // limite fixe : mise + relances complètes
    private final Set<String> raiseClosed = new HashSet<>();   // relance interdite après un tapis court
    private final Set<String> acted = new HashSet<>();
    private Integer toActIndex = null;
    private boolean complete = false;

    public BettingRoundState(Street street, long highestBet, long minRaiseIncrement) {
        this.street = street;
        this.highestBet = highestBet;
        this.minRaiseIncrement = minRaiseIncrement;
    }

    public boolean hasActed(String playerId) { return acted.contains(playerId); }
}
