package org.holdem.dto.holdem;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import org.holdem.model.holdem.ActionType;
import org.holdem.model.holdem.BettingStructure;
import org.holdem.model.holdem.Street;

import java.util.List;
import java.util.Map;

@Data
public class StreetRequest {
    @NotEmpty(message = "players obligatoire")
    @Valid
    private List<Seat> players;
    @PositiveOrZero
    private int buttonIndex;
    private Street street = Street.PREFLOP;
    private BettingStructure structure;     // défaut : configuration
    private Long smallBlind;
    private Long bigBlind;
    /** Jetons déjà engagés sur les streets précédentes (seulement hors préflop). */
    private Map<String, Long> contributions = Map.of();
    private List<String> folded = List.of();
    @NotNull
    @Valid
    private List<Action> actions = List.of();

    @Data
    public static class Seat {
        @NotBlank
        private String id;
        @PositiveOrZero
        private long stack;
    }

    @Data
    public static class Action {
        @NotBlank
        private String player;
        @NotNull
        private ActionType action;
        private long amount;   // mise totale visée pour RAISE
    }
}
