package org.holdem.model.holdem;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Ordre croissant : la position ordinale sert de rang de catégorie. */
@Getter
@AllArgsConstructor
public enum HandCategory {
    HIGH_CARD("High Card"),
    PAIR("Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush"),
    ROYAL_FLUSH("Royal Flush");

    private final String label;
}
