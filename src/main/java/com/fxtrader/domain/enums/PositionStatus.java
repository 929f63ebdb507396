package com.fxtrader.domain.enums;

/** A position is OPEN until the venue confirms its close. Closed positions are never reopened. */
public enum PositionStatus {
    OPEN,
    CLOSED
}
