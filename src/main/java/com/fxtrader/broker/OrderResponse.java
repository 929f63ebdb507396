package com.fxtrader.broker;

import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.enums.OrderStatus;
import com.fxtrader.domain.model.Order;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Synchronous acknowledgement of a submitted order. Always PENDING: the fill or rejection
 * arrives later through order and trade events.
 */
@Value
@Builder
public class OrderResponse {

    String orderId;
    OrderStatus status;
    String symbol;
    OrderSide side;
    BigDecimal volume;
    String message;
    LocalDateTime timestamp;

    public static OrderResponse pending(Order order) {
        return OrderResponse.builder()
                .orderId(order.getId())
                .status(OrderStatus.PENDING)
                .symbol(order.getSymbol())
                .side(order.getSide())
                .volume(order.getRequestedVolume())
                .message("Order submitted")
                .timestamp(order.getCreatedAt())
                .build();
    }
}
