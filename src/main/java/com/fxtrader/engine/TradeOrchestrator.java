package com.fxtrader.engine;

import com.fxtrader.broker.BrokerGateway;
import com.fxtrader.broker.OrderRequest;
import com.fxtrader.broker.OrderResponse;
import com.fxtrader.calendar.TradingSessionWindow;
import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.enums.OrderType;
import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.enums.SignalIntent;
import com.fxtrader.domain.enums.SignalMode;
import com.fxtrader.domain.model.AccountState;
import com.fxtrader.domain.model.ExitLevels;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.SizingResult;
import com.fxtrader.exception.BaseException;
import com.fxtrader.exception.BrokerConnectionException;
import com.fxtrader.exception.InsufficientMarginException;
import com.fxtrader.exception.InvalidInstrumentDataException;
import com.fxtrader.exception.SizingRejectedException;
import com.fxtrader.exit.ExitLevelCalculator;
import com.fxtrader.exit.ExitLevelConfig;
import com.fxtrader.exit.ExitParams;
import com.fxtrader.exit.PositionProtectionManager;
import com.fxtrader.indicator.IndicatorAdapter;
import com.fxtrader.margin.MarginEstimator;
import com.fxtrader.margin.PositionSizer;
import com.fxtrader.margin.PositionSizingConfig;
import com.fxtrader.observability.DecisionLogger;
import com.fxtrader.risk.DrawdownGuard;
import com.fxtrader.risk.RiskViolation;
import com.fxtrader.service.InstrumentService;
import com.fxtrader.signal.SignalConfig;
import com.fxtrader.signal.SignalEvaluator;
import com.fxtrader.signal.SignalInput;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the trade decision cycle for the configured symbol.
 *
 * <p>One cycle, in order:
 * <ol>
 *   <li>Gates: gateway connected, open-position protection, trading session, drawdown limit</li>
 *   <li>Exposure: an open position or a working order on the symbol ends the cycle</li>
 *   <li>Sizing against the current account snapshot</li>
 *   <li>Indicators, candidate direction (price at or above the moving average is LONG) and
 *       exit levels for that direction</li>
 *   <li>Signal; a signal that disagrees with the candidate direction is ignored</li>
 *   <li>Margin pre-check for the sized volume</li>
 *   <li>Order submission with the hybrid stop and target</li>
 * </ol>
 * Every step that ends the cycle returns a {@link CycleResult} and writes one decision line.
 * Nothing is retried within a cycle; the next market-data event starts a fresh one.
 *
 * <p>Cycles are serialized on this instance.
 */
@Service
public class TradeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TradeOrchestrator.class);

    private final BrokerGateway brokerGateway;
    private final IndicatorAdapter indicatorAdapter;
    private final InstrumentService instrumentService;
    private final PositionSizer positionSizer;
    private final MarginEstimator marginEstimator;
    private final ExitLevelCalculator exitLevelCalculator;
    private final SignalEvaluator signalEvaluator;
    private final PositionProtectionManager positionProtectionManager;
    private final TradingSessionWindow tradingSessionWindow;
    private final DrawdownGuard drawdownGuard;
    private final DecisionLogger decisionLogger;
    private final TradingConfig tradingConfig;
    private final PositionSizingConfig sizingConfig;
    private final ExitLevelConfig exitLevelConfig;
    private final SignalConfig signalConfig;

    public TradeOrchestrator(
            BrokerGateway brokerGateway,
            IndicatorAdapter indicatorAdapter,
            InstrumentService instrumentService,
            PositionSizer positionSizer,
            MarginEstimator marginEstimator,
            ExitLevelCalculator exitLevelCalculator,
            SignalEvaluator signalEvaluator,
            PositionProtectionManager positionProtectionManager,
            TradingSessionWindow tradingSessionWindow,
            DrawdownGuard drawdownGuard,
            DecisionLogger decisionLogger,
            TradingConfig tradingConfig,
            PositionSizingConfig sizingConfig,
            ExitLevelConfig exitLevelConfig,
            SignalConfig signalConfig) {
        this.brokerGateway = brokerGateway;
        this.indicatorAdapter = indicatorAdapter;
        this.instrumentService = instrumentService;
        this.positionSizer = positionSizer;
        this.marginEstimator = marginEstimator;
        this.exitLevelCalculator = exitLevelCalculator;
        this.signalEvaluator = signalEvaluator;
        this.positionProtectionManager = positionProtectionManager;
        this.tradingSessionWindow = tradingSessionWindow;
        this.drawdownGuard = drawdownGuard;
        this.decisionLogger = decisionLogger;
        this.tradingConfig = tradingConfig;
        this.sizingConfig = sizingConfig;
        this.exitLevelConfig = exitLevelConfig;
        this.signalConfig = signalConfig;
    }

    /**
     * Runs one decision cycle.
     *
     * @param marketTime venue-local time of the bar that triggered the cycle; the session
     *                   window is checked against it
     */
    public synchronized CycleResult runCycle(LocalDateTime marketTime) {
        String symbol = tradingConfig.getSymbol();
        String timeframe = tradingConfig.getTimeframe();

        if (!brokerGateway.isConnected()) {
            return finish(symbol, CycleResult.of(CycleOutcome.NOT_CONNECTED, "Broker not connected"));
        }

        try {
            return evaluate(symbol, timeframe, marketTime);
        } catch (BrokerConnectionException e) {
            return finish(symbol, CycleResult.of(CycleOutcome.NOT_CONNECTED, e.getMessage()));
        } catch (InvalidInstrumentDataException e) {
            return finish(symbol, CycleResult.of(CycleOutcome.INVALID_INSTRUMENT, e.getMessage()));
        } catch (BaseException e) {
            log.error("Trade cycle failed for {}: [{}] {}", symbol, e.getErrorCode(), e.getMessage());
            return finish(symbol, CycleResult.of(CycleOutcome.BROKER_ERROR, e.getMessage()));
        }
    }

    private CycleResult evaluate(String symbol, String timeframe, LocalDateTime marketTime) {
        // ---- Gates ----

        positionProtectionManager.protect(symbol, timeframe);

        if (!tradingSessionWindow.isOpenAt(marketTime.toLocalTime())) {
            return finish(
                    symbol,
                    CycleResult.of(
                            CycleOutcome.OUTSIDE_SESSION,
                            "Outside trading session at " + marketTime.toLocalTime()));
        }

        AccountState account = brokerGateway.getAccountInfo();
        Optional<RiskViolation> violation = drawdownGuard.check(account);
        if (violation.isPresent()) {
            return finish(symbol, CycleResult.of(CycleOutcome.DRAWDOWN_LIMIT, violation.get().getMessage()));
        }

        // ---- Exposure ----

        if (brokerGateway.getPosition(symbol).isPresent()) {
            return finish(symbol, CycleResult.of(CycleOutcome.POSITION_EXISTS, "Position already open"));
        }
        if (brokerGateway.hasWorkingOrder(symbol)) {
            return finish(symbol, CycleResult.of(CycleOutcome.ORDER_PENDING, "Order already working"));
        }

        // ---- Sizing ----

        InstrumentInfo instrument = instrumentService.getInstrument(symbol);
        SizingResult sizing = positionSizer.size(
                account,
                instrument,
                sizingConfig.getRiskPercent(),
                sizingConfig.getStopLossPips(),
                sizingConfig.getMinLot(),
                sizingConfig.getMaxLot());
        BigDecimal lots;
        try {
            lots = sizing.requireUsableLots();
        } catch (SizingRejectedException e) {
            return finish(
                    symbol,
                    CycleResult.builder()
                            .outcome(CycleOutcome.SIZING_REJECTED)
                            .reason(sizing.getRejectionReason() != null ? sizing.getRejectionReason() : e.getMessage())
                            .sizing(sizing)
                            .build());
        }
        decisionLogger.info(
                symbol,
                String.format(
                        "Sizing: risk %s, pip value %s, raw %s lots, final %s lots%s",
                        plain(sizing.getRiskAmount()),
                        plain(sizing.getPipValue()),
                        plain(sizing.getRawLots()),
                        plain(lots),
                        sizing.isCapped() ? " (capped)" : ""));

        // ---- Indicators and exit levels ----

        Optional<SignalInput> input = readIndicators(symbol, timeframe);
        List<BigDecimal> atr = indicatorAdapter.atr(symbol, timeframe, signalConfig.getAtrPeriod(), 1);
        if (input.isEmpty() || atr.isEmpty()) {
            return finish(
                    symbol,
                    CycleResult.builder()
                            .outcome(CycleOutcome.INDICATORS_UNAVAILABLE)
                            .reason("Not enough bars (" + indicatorAdapter.barCount(symbol, timeframe) + ")")
                            .sizing(sizing)
                            .build());
        }
        SignalInput signalInput = input.get();
        BigDecimal price = signalInput.getPrice();

        PositionType candidate =
                price.compareTo(signalInput.getMovingAverage()) >= 0 ? PositionType.LONG : PositionType.SHORT;
        ExitLevels levels = exitLevelCalculator.compute(
                price, atr.get(atr.size() - 1), candidate, ExitParams.from(exitLevelConfig, instrument));

        // ---- Signal ----

        SignalIntent intent = signalEvaluator.evaluate(signalInput);
        if (!intent.isActionable() || intent.toPositionType() != candidate) {
            return finish(
                    symbol,
                    CycleResult.builder()
                            .outcome(CycleOutcome.NO_SIGNAL)
                            .reason(describe(signalInput))
                            .intent(SignalIntent.NONE)
                            .sizing(sizing)
                            .exitLevels(levels)
                            .build());
        }

        // ---- Margin ----

        try {
            marginEstimator.requireSufficient(account, instrument, lots);
        } catch (InsufficientMarginException e) {
            return finish(
                    symbol,
                    CycleResult.builder()
                            .outcome(CycleOutcome.INSUFFICIENT_MARGIN)
                            .reason(String.format(
                                    "Required margin %s exceeds free margin %s",
                                    plain(e.getRequired()),
                                    plain(e.getAvailable())))
                            .intent(intent)
                            .sizing(sizing)
                            .exitLevels(levels)
                            .build());
        }

        // ---- Submission ----

        OrderSide side = OrderSide.opening(candidate);
        BigDecimal stopLoss = instrument.roundToPoint(levels.getHybridStop());
        BigDecimal takeProfit = instrument.roundToPoint(levels.getHybridTarget());
        OrderResponse response = brokerGateway.placeOrder(OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .type(OrderType.MARKET)
                .volume(lots)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .comment(intent.name())
                .build());

        return finish(
                symbol,
                CycleResult.builder()
                        .outcome(CycleOutcome.ORDER_PLACED)
                        .reason(String.format(
                                "Submitted %s %s lots at %s, SL %s, TP %s",
                                side,
                                plain(lots),
                                plain(price),
                                plain(stopLoss),
                                plain(takeProfit)))
                        .orderId(response.getOrderId())
                        .intent(intent)
                        .sizing(sizing)
                        .exitLevels(levels)
                        .build());
    }

    /**
     * Reads the values the configured signal mode needs. Empty if any of them is not yet
     * available.
     */
    private Optional<SignalInput> readIndicators(String symbol, String timeframe) {
        Optional<BigDecimal> price = indicatorAdapter.closePrice(symbol, timeframe, 0);
        Optional<BigDecimal> ma = indicatorAdapter.movingAverage(
                symbol, timeframe, signalConfig.getMaType(), signalConfig.getMaPeriod(), 0);
        if (price.isEmpty() || ma.isEmpty()) {
            return Optional.empty();
        }

        SignalInput.SignalInputBuilder input =
                SignalInput.builder().price(price.get()).movingAverage(ma.get());

        if (signalConfig.getMode() == SignalMode.CROSSOVER) {
            Optional<BigDecimal> previousPrice = indicatorAdapter.closePrice(symbol, timeframe, 1);
            Optional<BigDecimal> previousMa = indicatorAdapter.movingAverage(
                    symbol, timeframe, signalConfig.getMaType(), signalConfig.getMaPeriod(), 1);
            if (previousPrice.isEmpty() || previousMa.isEmpty()) {
                return Optional.empty();
            }
            input.previousPrice(previousPrice.get()).previousMovingAverage(previousMa.get());
        } else {
            Optional<BigDecimal> cci = indicatorAdapter.cci(symbol, timeframe, signalConfig.getCciPeriod(), 0);
            if (cci.isEmpty()) {
                return Optional.empty();
            }
            input.cci(cci.get());
        }
        return Optional.of(input.build());
    }

    private CycleResult finish(String symbol, CycleResult result) {
        String line = result.getOutcome() + ": " + result.getReason();
        switch (result.getOutcome()) {
            case BROKER_ERROR, INVALID_INSTRUMENT, NOT_CONNECTED -> decisionLogger.error(symbol, line);
            default -> decisionLogger.info(symbol, line);
        }
        if (result.isOrderPlaced()) {
            log.info("Cycle {} -> {} ({})", symbol, line, result.getOrderId());
        } else {
            log.debug("Cycle {} -> {}", symbol, line);
        }
        return result;
    }

    private static String describe(SignalInput input) {
        StringBuilder sb = new StringBuilder("No signal: price ")
                .append(plain(input.getPrice()))
                .append(", MA ")
                .append(plain(input.getMovingAverage()));
        if (input.getCci() != null) {
            sb.append(", CCI ").append(plain(input.getCci()));
        }
        return sb.toString();
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.stripTrailingZeros().toPlainString() : "-";
    }
}
