package com.fxtrader.domain.enums;

/** Buy or sell side of an order. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for closing orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Side that opens a position of the given type. */
    public static OrderSide opening(PositionType positionType) {
        return positionType == PositionType.LONG ? BUY : SELL;
    }
}
