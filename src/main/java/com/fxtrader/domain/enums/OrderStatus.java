package com.fxtrader.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an order.
 *
 * <p>PENDING is our internal state between submission and the venue's acknowledgment.
 * Legal transitions:
 * <pre>
 *   PENDING  -> ACCEPTED | REJECTED | CANCELLED
 *   ACCEPTED -> FILLED | REJECTED | CANCELLED
 * </pre>
 * FILLED, REJECTED and CANCELLED are terminal and never revert.
 */
public enum OrderStatus {
    PENDING,
    ACCEPTED,
    FILLED,
    REJECTED,
    CANCELLED;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(FILLED, REJECTED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Whether the state machine allows moving from this status to {@code next}. */
    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case PENDING -> next == ACCEPTED || next == REJECTED || next == CANCELLED;
            case ACCEPTED -> next == FILLED || next == REJECTED || next == CANCELLED;
            case FILLED, REJECTED, CANCELLED -> false;
        };
    }
}
