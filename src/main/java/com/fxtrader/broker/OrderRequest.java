package com.fxtrader.broker;

import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Parameters for a new order submitted through {@link BrokerGateway#placeOrder(OrderRequest)}.
 *
 * <p>Stop-loss and take-profit are attached to the position the order opens; the venue
 * closes the position when either level is touched.
 */
@Data
@Builder
public class OrderRequest {

    private String symbol;
    private OrderSide side;

    @Builder.Default
    private OrderType type = OrderType.MARKET;

    /** Volume in lots. */
    private BigDecimal volume;

    /** Limit price. Required for LIMIT orders. */
    private BigDecimal price;

    private BigDecimal stopLoss;
    private BigDecimal takeProfit;

    /** Free text carried onto the order, e.g. the signal that produced it. */
    private String comment;
}
