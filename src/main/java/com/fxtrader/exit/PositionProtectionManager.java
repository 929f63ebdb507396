package com.fxtrader.exit;

import com.fxtrader.broker.BrokerGateway;
import com.fxtrader.broker.PositionModifyRequest;
import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.Position;
import com.fxtrader.exception.BaseException;
import com.fxtrader.indicator.IndicatorAdapter;
import com.fxtrader.observability.DecisionLogger;
import com.fxtrader.service.InstrumentService;
import com.fxtrader.signal.SignalConfig;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves the stop-loss of open positions as price moves in their favour.
 *
 * <p>Two adjustments, each enabled separately in {@link ExitLevelConfig}:
 * <ul>
 *   <li>ATR trailing stop: LONG stop at {@code price - atr * trailingAtrMultiplier}, SHORT
 *       mirrored</li>
 *   <li>Breakeven: once the position is {@code breakevenActivationPips} in profit, the stop
 *       moves to {@code entry +/- breakevenOffsetPips}</li>
 * </ul>
 * The most protective candidate wins. A stop only ever tightens: a candidate that is not
 * better than the current stop, or that would sit on the wrong side of the current price, is
 * discarded.
 *
 * <p>Runs at the start of every trade cycle, before the entry logic.
 */
@Service
public class PositionProtectionManager {

    private static final Logger log = LoggerFactory.getLogger(PositionProtectionManager.class);

    private final BrokerGateway brokerGateway;
    private final IndicatorAdapter indicatorAdapter;
    private final InstrumentService instrumentService;
    private final ExitLevelConfig exitLevelConfig;
    private final SignalConfig signalConfig;
    private final DecisionLogger decisionLogger;

    public PositionProtectionManager(
            BrokerGateway brokerGateway,
            IndicatorAdapter indicatorAdapter,
            InstrumentService instrumentService,
            ExitLevelConfig exitLevelConfig,
            SignalConfig signalConfig,
            DecisionLogger decisionLogger) {
        this.brokerGateway = brokerGateway;
        this.indicatorAdapter = indicatorAdapter;
        this.instrumentService = instrumentService;
        this.exitLevelConfig = exitLevelConfig;
        this.signalConfig = signalConfig;
        this.decisionLogger = decisionLogger;
    }

    /**
     * Adjusts the stop of the open position on {@code symbol}, if any.
     *
     * @return the number of positions whose stop was moved (0 or 1)
     */
    public int protect(String symbol, String timeframe) {
        if (!exitLevelConfig.isTrailingEnabled() && !exitLevelConfig.isBreakevenEnabled()) {
            return 0;
        }

        Optional<Position> open = brokerGateway.getPosition(symbol);
        if (open.isEmpty() || !open.get().isOpen()) {
            return 0;
        }
        Position position = open.get();

        Optional<BigDecimal> price = indicatorAdapter.currentPrice(symbol);
        if (price.isEmpty()) {
            return 0;
        }
        List<BigDecimal> atr = indicatorAdapter.atr(symbol, timeframe, signalConfig.getAtrPeriod(), 1);
        BigDecimal latestAtr = atr.isEmpty() ? null : atr.get(atr.size() - 1);

        try {
            InstrumentInfo instrument = instrumentService.getInstrument(symbol);
            Optional<BigDecimal> newStop = computeProtectiveStop(position, price.get(), latestAtr, instrument);
            if (newStop.isEmpty()) {
                return 0;
            }

            PositionModifyRequest request = PositionModifyRequest.builder()
                    .stopLoss(newStop.get())
                    .takeProfit(position.getTakeProfit())
                    .build();
            if (!brokerGateway.modifyPosition(symbol, request)) {
                return 0;
            }
            decisionLogger.info(
                    symbol,
                    "Stop moved from " + plain(position.getStopLoss()) + " to " + plain(newStop.get())
                            + " at price " + plain(price.get()));
            return 1;
        } catch (BaseException e) {
            log.error("Position protection failed for {}: {}", symbol, e.getMessage());
            decisionLogger.error(symbol, "Position protection failed: " + e.getMessage());
            return 0;
        }
    }

    /**
     * Best stop for the position given the current price and ATR, or empty when the current
     * stop should stay. {@code atr} may be null while the indicator is warming up; only the
     * breakeven rule applies then.
     */
    public Optional<BigDecimal> computeProtectiveStop(
            Position position, BigDecimal price, BigDecimal atr, InstrumentInfo instrument) {
        PositionType type = position.getType();
        BigDecimal sign = BigDecimal.valueOf(type.sign());
        List<BigDecimal> candidates = new ArrayList<>(2);

        if (exitLevelConfig.isTrailingEnabled() && atr != null && atr.signum() > 0) {
            candidates.add(price.subtract(sign.multiply(atr.multiply(exitLevelConfig.getTrailingAtrMultiplier()))));
        }

        if (exitLevelConfig.isBreakevenEnabled()) {
            BigDecimal profitPips = price.subtract(position.getEntryPrice())
                    .multiply(sign)
                    .divide(instrument.getPointSize(), 10, RoundingMode.HALF_UP);
            if (profitPips.compareTo(exitLevelConfig.getBreakevenActivationPips()) >= 0) {
                BigDecimal offset = instrument.pipsToPrice(exitLevelConfig.getBreakevenOffsetPips());
                candidates.add(position.getEntryPrice().add(sign.multiply(offset)));
            }
        }

        Optional<BigDecimal> best = candidates.stream()
                .map(instrument::roundToPoint)
                .filter(stop -> isOnProtectedSide(type, stop, price))
                .reduce((a, b) -> isTighter(type, a, b) ? a : b);

        return best.filter(stop -> position.getStopLoss() == null || isTighter(type, stop, position.getStopLoss()));
    }

    // ---- Helpers ----

    /** True when {@code stop} locks in more than {@code other} for a position of this type. */
    private static boolean isTighter(PositionType type, BigDecimal stop, BigDecimal other) {
        return type == PositionType.LONG ? stop.compareTo(other) > 0 : stop.compareTo(other) < 0;
    }

    // A LONG stop must stay below the market, a SHORT stop above it
    private static boolean isOnProtectedSide(PositionType type, BigDecimal stop, BigDecimal price) {
        return type == PositionType.LONG ? stop.compareTo(price) < 0 : stop.compareTo(price) > 0;
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.stripTrailingZeros().toPlainString() : "-";
    }
}
