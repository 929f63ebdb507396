package com.fxtrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Describes a venue's refusal of an order. Delivered inside an order event rather than
 * thrown, since the rejection arrives after {@code placeOrder} has already returned.
 */
@Getter
public class VenueRejectionException extends BaseException {

    private final String orderId;

    public VenueRejectionException(String orderId, String reason) {
        super(
                ErrorCode.VENUE_REJECTION,
                "Order " + orderId + " rejected by venue: " + reason,
                Map.of("reason", reason));
        this.orderId = orderId;
    }
}
