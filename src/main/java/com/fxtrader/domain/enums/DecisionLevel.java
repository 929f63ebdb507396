package com.fxtrader.domain.enums;

/** Levels of the decision log. TRADE marks executions and is always written. */
public enum DecisionLevel {
    INFO,
    ERROR,
    TRADE
}
