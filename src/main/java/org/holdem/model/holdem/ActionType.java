package org.holdem.model.holdem;

public enum ActionType { FOLD, CHECK, CALL, RAISE, ALL_IN }
