package org.holdem.model.holdem;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Joueur assis : tapis, mises et statut pour la main en cours. */
@Data
public class Player {
    private final String id;
    private long stack;
    private long currentBet = 0;   // engagé sur la street en cours
    private long totalBet = 0;     // engagé sur toute la main
    private boolean folded = false;
    private boolean allIn = false;
    private final List<Card> holeCards = new ArrayList<>();

    public Player(String id, long stack) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Identifiant joueur vide");
        if (stack < 0) throw new IllegalArgumentException("Tapis négatif");
        this.id = id;
        this.stack = stack;
    }

    /** Pousse {@code amount} jetons du tapis vers la mise (plafonné au tapis). Retourne le montant réellement engagé. */
    public long commit(long amount) {
        if (amount < 0) throw new IllegalArgumentException("Montant négatif");
        long paid = Math.min(amount, stack);
        stack -= paid;
        currentBet += paid;
        totalBet += paid;
        if (stack == 0 && paid > 0) allIn = true;
        return paid;
    }

    public void win(long amount) { stack += amount; }

    /** Ni couché ni à tapis. */
    public boolean canAct() { return !folded && !allIn; }

    public void resetForNewHand() {
        holeCards.clear();
        currentBet = 0;
        totalBet = 0;
        folded = false;
        allIn = false;
    }

    public void resetForNewStreet() { currentBet = 0; }
}
