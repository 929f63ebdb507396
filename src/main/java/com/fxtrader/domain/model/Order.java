package com.fxtrader.domain.model;

import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.enums.OrderStatus;
import com.fxtrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A trading order from submission to its terminal state.
 *
 * <p>Created PENDING by the broker gateway when a request is submitted; every later
 * status change comes from a venue notification. Order ids are generated locally and
 * never reused. A closing order ({@link #closing} = true) exits an existing position
 * rather than opening a new one.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;
    private String symbol;
    private OrderType type;
    private OrderSide side;

    /** Requested volume in lots. */
    private BigDecimal requestedVolume;

    /** Limit price. Required for LIMIT orders, null for MARKET. */
    private BigDecimal requestedPrice;

    private BigDecimal stopLoss;
    private BigDecimal takeProfit;

    private OrderStatus status;

    /** True when the order exits an open position. */
    private boolean closing;

    /** Execution price reported by the venue. Null until FILLED. */
    private BigDecimal fillPrice;

    private String rejectionReason;
    private String comment;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Order copy() {
        return toBuilder().build();
    }
}
