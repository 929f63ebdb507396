package com.fxtrader.domain.enums;

/** Direction of an open position. */
public enum PositionType {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies a price difference into a signed P&L. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    /** Position type created when an opening order of the given side fills. */
    public static PositionType openedBy(OrderSide side) {
        return side == OrderSide.BUY ? LONG : SHORT;
    }
}
