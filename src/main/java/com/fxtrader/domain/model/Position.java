package com.fxtrader.domain.model;

import com.fxtrader.domain.enums.PositionStatus;
import com.fxtrader.domain.enums.PositionType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An open (or just closed) position in the trading account, keyed by symbol.
 *
 * <p>The broker gateway holds the authoritative instance and only hands out copies via
 * {@link #copy()}. At most one OPEN position exists per symbol; a closed position is
 * never reopened; a later fill creates a new Position with a new id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private PositionType type;

    /** Volume in lots. */
    private BigDecimal volume;

    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal unrealizedPnl;

    /** Protective stop. Null when none is set. */
    private BigDecimal stopLoss;

    /** Profit target. Null when none is set. */
    private BigDecimal takeProfit;

    private PositionStatus status;

    /** The order whose fill created this position. */
    private String openingOrderId;

    private LocalDateTime openedAt;
    private LocalDateTime closedAt;
    private LocalDateTime lastUpdated;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public Position copy() {
        return toBuilder().build();
    }
}
