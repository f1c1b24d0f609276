package org.holdem.dto.holdem;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class EvaluateRequest {
    @NotNull(message = "cards obligatoire")
    private List<String> cards;   // 5 à 7 cartes, ex. "Ah", "Td", "10s"
}
