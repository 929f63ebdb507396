package com.fxtrader.event;

public enum PositionEventType {
    OPENED,

    /** Price, P&L or protective levels changed. */
    UPDATED,

    CLOSED
}
