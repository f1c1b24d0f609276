package org.holdem.dto.holdem;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class PotRequest {
    @NotNull(message = "contributions obligatoire")
    private Map<String, Long> contributions;
    private List<String> folded = List.of();
    /** Cartes (2 à 7) de chaque joueur en jeu ; si absent, seuls les paliers sont calculés. */
    private Map<String, List<String>> hands;
    /** Cartes communes ajoutées à chaque main. */
    private List<String> board = List.of();
    /** Ordre des sièges en partant de la gauche du bouton (jetons impairs). */
    private List<String> seatOrder = List.of();
}
