package org.holdem.config;

import lombok.Data;
import org.holdem.model.holdem.BettingStructure;
import org.holdem.model.holdem.Stakes;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "holdem")
public class HoldemProperties {
    private long smallBlind = 5;
    private long bigBlind = 10;
    private long ante = 0;
    private BettingStructure structure = BettingStructure.NO_LIMIT;
    /** Limite fixe : mise + 3 relances. */
    private int limitMaxBetsPerStreet = 4;
    /** true = action illégale refusée (IllegalActionException) au lieu d'être ajustée. */
    private boolean strictActions = false;
    /** Rake indicatif (cash game) : taux du pot, plafonné. Jamais prélevé sur le pot. */
    private double rakeRate = 0.05;
    private long rakeCap = 25;

    public Stakes toStakes() {
        return new Stakes(smallBlind, bigBlind, ante, structure, limitMaxBetsPerStreet);
    }
}
