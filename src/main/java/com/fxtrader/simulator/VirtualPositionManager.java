package com.fxtrader.simulator;

import com.fxtrader.broker.PositionModifyRequest;
import com.fxtrader.domain.enums.PositionStatus;
import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.MarketData;
import com.fxtrader.domain.model.Order;
import com.fxtrader.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Venue-side book of the paper venue: open positions, cash balance and margin.
 *
 * <p>One position per symbol, no netting. P&L is measured in pips of the instrument's point
 * size: {@code sign * (price - entry) / pointSize * tickValue * volume}. Margin used is
 * {@code volume * marginPerLot / leverage} summed over open positions.
 *
 * <p>Only touched from the venue thread.
 */
@Component
public class VirtualPositionManager {

    private static final Logger log = LoggerFactory.getLogger(VirtualPositionManager.class);

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Map<String, InstrumentInfo> instruments = new HashMap<>();

    private BigDecimal balance = BigDecimal.ZERO;
    private BigDecimal totalRealizedPnl = BigDecimal.ZERO;
    private int leverage = 1;

    /** Protective level touched by a bar. {@code reason} is SL or TP. */
    public record ProtectiveExit(BigDecimal price, String reason) {}

    public void reset(BigDecimal startingBalance, int leverage) {
        positions.clear();
        instruments.clear();
        this.balance = startingBalance;
        this.leverage = leverage;
        this.totalRealizedPnl = BigDecimal.ZERO;
    }

    public boolean hasPosition(String symbol) {
        return positions.containsKey(symbol);
    }

    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol)).map(Position::copy);
    }

    public Position open(Order order, BigDecimal fillPrice, InstrumentInfo instrument, LocalDateTime fillTime) {
        Position position = Position.builder()
                .id(order.getId())
                .symbol(order.getSymbol())
                .type(PositionType.openedBy(order.getSide()))
                .volume(order.getRequestedVolume())
                .entryPrice(fillPrice)
                .currentPrice(fillPrice)
                .unrealizedPnl(BigDecimal.ZERO)
                .stopLoss(order.getStopLoss())
                .takeProfit(order.getTakeProfit())
                .status(PositionStatus.OPEN)
                .openingOrderId(order.getId())
                .openedAt(fillTime)
                .lastUpdated(fillTime)
                .build();
        positions.put(position.getSymbol(), position);
        instruments.put(position.getSymbol(), instrument);
        log.debug(
                "Virtual position opened: {} {} {} @ {}",
                position.getType(),
                position.getVolume(),
                position.getSymbol(),
                fillPrice);
        return position.copy();
    }

    /** Revalues the position at {@code price}. Empty if nothing is open on the symbol. */
    public Optional<Position> markToMarket(String symbol, BigDecimal price, LocalDateTime time) {
        Position position = positions.get(symbol);
        if (position == null) {
            return Optional.empty();
        }
        position.setCurrentPrice(price);
        position.setUnrealizedPnl(calculatePnl(position, price));
        position.setLastUpdated(time);
        return Optional.of(position.copy());
    }

    /**
     * Checks the bar against the position's stop-loss and take-profit. When a bar spans both,
     * the stop-loss wins.
     */
    public Optional<ProtectiveExit> checkProtectiveExit(MarketData bar) {
        Position position = positions.get(bar.getSymbol());
        if (position == null) {
            return Optional.empty();
        }
        BigDecimal stopLoss = position.getStopLoss();
        BigDecimal takeProfit = position.getTakeProfit();

        if (position.getType() == PositionType.LONG) {
            if (stopLoss != null && bar.getLow().compareTo(stopLoss) <= 0) {
                return Optional.of(new ProtectiveExit(stopLoss, "SL"));
            }
            if (takeProfit != null && bar.getHigh().compareTo(takeProfit) >= 0) {
                return Optional.of(new ProtectiveExit(takeProfit, "TP"));
            }
        } else {
            if (stopLoss != null && bar.getHigh().compareTo(stopLoss) >= 0) {
                return Optional.of(new ProtectiveExit(stopLoss, "SL"));
            }
            if (takeProfit != null && bar.getLow().compareTo(takeProfit) <= 0) {
                return Optional.of(new ProtectiveExit(takeProfit, "TP"));
            }
        }
        return Optional.empty();
    }

    /**
     * Closes the position at {@code exitPrice} and books the realized P&L into the balance.
     *
     * @return the realized P&L, or empty if nothing was open
     */
    public Optional<BigDecimal> close(String symbol, BigDecimal exitPrice) {
        Position position = positions.remove(symbol);
        if (position == null) {
            return Optional.empty();
        }
        BigDecimal realized = calculatePnl(position, exitPrice);
        instruments.remove(symbol);
        balance = balance.add(realized);
        totalRealizedPnl = totalRealizedPnl.add(realized);
        log.debug("Virtual position closed: {} @ {} realized P&L={}", symbol, exitPrice, realized);
        return Optional.of(realized);
    }

    /** Applies new protective levels. Empty if nothing is open on the symbol. */
    public Optional<Position> modifyProtection(String symbol, PositionModifyRequest request) {
        Position position = positions.get(symbol);
        if (position == null) {
            return Optional.empty();
        }
        if (request.getStopLoss() != null) {
            position.setStopLoss(request.getStopLoss());
        }
        if (request.getTakeProfit() != null) {
            position.setTakeProfit(request.getTakeProfit());
        }
        return Optional.of(position.copy());
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public BigDecimal getEquity() {
        return positions.values().stream()
                .map(Position::getUnrealizedPnl)
                .reduce(balance, BigDecimal::add);
    }

    public BigDecimal getMarginUsed() {
        return positions.values().stream()
                .map(p -> p.getVolume()
                        .multiply(instruments.get(p.getSymbol()).getMarginPerLot())
                        .divide(BigDecimal.valueOf(leverage), 2, RoundingMode.HALF_UP))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalRealizedPnl() {
        return totalRealizedPnl;
    }

    public int getOpenPositionCount() {
        return positions.size();
    }

    private BigDecimal calculatePnl(Position position, BigDecimal price) {
        InstrumentInfo instrument = instruments.get(position.getSymbol());
        BigDecimal pips = price.subtract(position.getEntryPrice())
                .divide(instrument.getPointSize(), 10, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(position.getType().sign()));
        return pips.multiply(instrument.getTickValue())
                .multiply(position.getVolume())
                .setScale(2, RoundingMode.HALF_UP);
    }
}
