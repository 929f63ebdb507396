package com.fxtrader.engine;

/** How a trade cycle ended. Only {@link #ORDER_PLACED} submits an order. */
public enum CycleOutcome {
    ORDER_PLACED,
    NO_SIGNAL,
    POSITION_EXISTS,
    ORDER_PENDING,
    SIZING_REJECTED,
    INSUFFICIENT_MARGIN,
    OUTSIDE_SESSION,
    DRAWDOWN_LIMIT,
    INVALID_INSTRUMENT,
    INDICATORS_UNAVAILABLE,
    NOT_CONNECTED,
    BROKER_ERROR
}
