package org.holdem.service.holdem.decision;

import org.holdem.model.holdem.ActionType;

/** {@code amount} = mise totale visée sur la street pour RAISE, ignoré sinon. */
public record Decision(ActionType action, long amount) {
    public static Decision fold() { return new Decision(ActionType.FOLD, 0); }
    public static Decision check() { return new Decision(ActionType.CHECK, 0); }
    public static Decision call() { return new Decision(ActionType.CALL, 0); }
    public static Decision raiseTo(long amount) { return new Decision(ActionType.RAISE, amount); }
    public static Decision allIn() { return new Decision(ActionType.ALL_IN, 0); }
}
