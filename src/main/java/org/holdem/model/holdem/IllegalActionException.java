package org.holdem.model.holdem;

import lombok.Getter;

/** Action refusée en mode strict (holdem.strict-actions=true). */
@Getter
public class IllegalActionException extends RuntimeException {
    private final String playerId;
    private final ActionType requested;
    private final long amount;

    public IllegalActionException(String playerId, ActionType requested, long amount, String reason) {
        super(reason + " (" + playerId + ": " + requested + " " + amount + ")");
        this.playerId = playerId;
        this.requested = requested;
        this.amount = amount;
    }
}
