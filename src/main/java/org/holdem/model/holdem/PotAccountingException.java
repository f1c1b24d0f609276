package org.holdem.model.holdem;

/** Incohérence de comptabilité des pots : erreur de programmation, la main doit être abandonnée. */
public class PotAccountingException extends IllegalStateException {
    public PotAccountingException(String message) { super(message); }
}
