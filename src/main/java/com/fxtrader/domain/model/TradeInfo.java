package com.fxtrader.domain.model;

import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * An execution reported by the venue: a position opening fill or a position close.
 *
 * <p>{@code comment} tells the two apart: OPEN for an opening fill, CLOSE for a requested
 * exit, SL / TP when the venue closed the position at a protective level. For opening fills
 * {@code profitLoss} is zero.
 */
@Value
@Builder
public class TradeInfo {

    /** Null when the venue closed the position on its own (SL / TP). */
    String orderId;

    String symbol;
    OrderSide side;
    OrderType orderType;
    BigDecimal volume;
    BigDecimal price;
    BigDecimal profitLoss;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    LocalDateTime executionTime;
    String comment;
}
