package org.holdem.dto.holdem;

import org.holdem.model.holdem.PotTier;

import java.util.List;
import java.util.Map;

public record PotResponse(long total, long rake, List<PotTier> tiers, List<AwardView> awards, Map<String, Long> payouts) {

    public record AwardView(int tier, long amount, List<String> winners, HandView winningHand, Map<String, Long> shares) {}
}
