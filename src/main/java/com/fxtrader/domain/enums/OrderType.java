package com.fxtrader.domain.enums;

/**
 * Order execution type.
 * MARKET fills at the venue's current price; LIMIT requires a requested price.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
