package com.fxtrader.event;

/** Broker session lifecycle change carried by a {@link SessionEvent}. */
public enum SessionEventType {

    /** Venue session opened; orders, positions and the account start from the venue's fresh state. */
    SESSION_OPENED,

    SESSION_CLOSED
}
