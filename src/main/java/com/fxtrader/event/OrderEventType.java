package com.fxtrader.event;

/** Classifies the order state change that triggered an {@link OrderEvent}. */
public enum OrderEventType {

    /** Order recorded locally and submitted to the venue. */
    PLACED,

    /** Venue acknowledged the order. */
    ACCEPTED,

    /** Limit price, stop-loss or take-profit changed. */
    MODIFIED,

    FILLED,

    CANCELLED,

    /** Order refused by the venue. The event carries the rejection. */
    REJECTED
}
