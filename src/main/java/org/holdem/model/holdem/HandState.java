package org.holdem.model.holdem;

import lombok.Data;

import java.util.*;

/**
 * État d'une main : créé par l'orchestrateur en début de main, jeté à la fin.
 * Les joueurs sont dans l'ordre des sièges ; le moteur modifie leurs tapis, mises et statuts.
 */
@Data
public class HandState {
    private final List<Player> players;
    private final int buttonIndex;
    private final int smallBlindIndex;
    private final int bigBlindIndex;
    private final Stakes stakes;

    private final ContributionLedger ledger = new ContributionLedger();
    private final List<Card> board = new ArrayList<>();
    private final List<ActionLogEntry> log = new ArrayList<>();
    private Deck deck;
    private Street street = Street.PREFLOP;
    private BettingRoundState round;

    public HandState(List<Player> players, int buttonIndex, Stakes stakes) {
        if (players == null || players.size() < 2) throw new IllegalArgumentException("Il faut au moins 2 joueurs");
        if (buttonIndex < 0 || buttonIndex >= players.size()) throw new IllegalArgumentException("Bouton hors table: " + buttonIndex);
        Set<String> ids = new HashSet<>();
        for (Player p : players) {
            if (!ids.add(p.getId())) throw new IllegalArgumentException("Joueur en double: " + p.getId());
        }
        this.players = List.copyOf(players);
        this.buttonIndex = buttonIndex;
        this.stakes = stakes;
        int n = players.size();
        // heads-up : le bouton paie la petite blinde
        this.smallBlindIndex = n == 2 ? buttonIndex : (buttonIndex + 1) % n;
        this.bigBlindIndex = (smallBlindIndex + 1) % n;
    }

    public Player player(String id) {
        for (Player p : players) if (p.getId().equals(id)) return p;
        throw new IllegalArgumentException("Joueur inconnu: " + id);
    }

    public List<Player> playersInHand() {
        return players.stream().filter(p -> !p.isFolded()).toList();
    }

    public long actionableCount() {
        return players.stream().filter(Player::canAct).count();
    }

    public Set<String> foldedIds() {
        Set<String> out = new LinkedHashSet<>();
        for (Player p : players) if (p.isFolded()) out.add(p.getId());
        return out;
    }

    /** Identifiants dans l'ordre des sièges en partant de la gauche du bouton. */
    public List<String> seatOrderFromButton() {
        List<String> out = new ArrayList<>(players.size());
        for (int k = 1; k <= players.size(); k++) out.add(players.get((buttonIndex + k) % players.size()).getId());
        return out;
    }

    public Player smallBlindPlayer() { return players.get(smallBlindIndex); }

    public Player bigBlindPlayer() { return players.get(bigBlindIndex); }

    public long potTotal() { return ledger.total(); }
}
