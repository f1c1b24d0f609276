package org.holdem.model.holdem;

public enum BettingStructure { NO_LIMIT, FIXED_LIMIT }
