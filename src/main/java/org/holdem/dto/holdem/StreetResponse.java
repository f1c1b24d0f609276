package org.holdem.dto.holdem;

import org.holdem.model.holdem.ActionLogEntry;
import org.holdem.model.holdem.PotTier;
import org.holdem.model.holdem.Street;

import java.util.List;

public record StreetResponse(Street street, List<ActionLogEntry> actions, boolean roundComplete, String nextToAct,
                             long highestBet, long minRaiseIncrement, long potTotal,
                             List<SeatView> players, List<PotTier> tiers) {

    public record SeatView(String id, long stack, long currentBet, long totalBet, boolean folded, boolean allIn) {}
}
