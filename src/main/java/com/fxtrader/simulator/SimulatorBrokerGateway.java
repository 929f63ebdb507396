package com.fxtrader.simulator;

import com.fxtrader.broker.AbstractBrokerGateway;
import com.fxtrader.broker.BrokerConnectionSettings;
import com.fxtrader.broker.OrderModifyRequest;
import com.fxtrader.broker.PositionModifyRequest;
import com.fxtrader.domain.enums.OrderType;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.MarketData;
import com.fxtrader.domain.model.Order;
import com.fxtrader.domain.model.Position;
import com.fxtrader.event.EventPublisherHelper;
import com.fxtrader.exception.BrokerException;
import com.fxtrader.exception.InvalidInstrumentDataException;
import com.fxtrader.service.InstrumentService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Paper-trading venue behind the {@link com.fxtrader.broker.BrokerGateway} interface.
 *
 * <p>All venue work runs as tasks on a single venue executor, so notifications reach the
 * gateway one at a time and in order. Orders are checked when their task runs:
 * <ul>
 *   <li>an opening order is rejected if a position is already open on the symbol, or if the
 *       account's free margin cannot carry it</li>
 *   <li>a MARKET order is rejected while no bar has been seen for the symbol</li>
 *   <li>a LIMIT order is accepted and rests in the {@link VirtualOrderBook}</li>
 * </ul>
 *
 * <p>Each bar passed to {@link #publishBar} is processed in a fixed order: resting limit fills,
 * stop-loss/take-profit exits (or mark-to-market), account report, then the market-data event.
 */
@Service
public class SimulatorBrokerGateway extends AbstractBrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatorBrokerGateway.class);

    private final VirtualOrderBook virtualOrderBook;
    private final VirtualPositionManager virtualPositionManager;
    private final InstrumentService instrumentService;
    private final Executor venueExecutor;

    public SimulatorBrokerGateway(
            EventPublisherHelper eventPublisherHelper,
            Clock clock,
            VirtualOrderBook virtualOrderBook,
            VirtualPositionManager virtualPositionManager,
            InstrumentService instrumentService,
            @Qualifier("venueExecutor") Executor venueExecutor) {
        super(eventPublisherHelper, clock);
        this.virtualOrderBook = virtualOrderBook;
        this.virtualPositionManager = virtualPositionManager;
        this.instrumentService = instrumentService;
        this.venueExecutor = venueExecutor;
    }

    /** Feeds one completed bar into the venue. Dropped while the session is closed. */
    public void publishBar(MarketData bar) {
        if (!isConnected()) {
            log.debug("Bar for {} at {} dropped: venue session closed", bar.getSymbol(), bar.getTimestamp());
            return;
        }
        runOnVenue(() -> processBar(bar));
    }

    // ---- Venue hooks ----

    @Override
    protected void openVenueSession(BrokerConnectionSettings settings) {
        runOnVenue(() -> {
            virtualOrderBook.reset();
            virtualPositionManager.reset(settings.getStartingBalance(), settings.getLeverage());
            reportAccount();
            log.info(
                    "Paper venue session opened: balance {} {}, leverage 1:{}",
                    settings.getStartingBalance(),
                    settings.getCurrency(),
                    settings.getLeverage());
        });
    }

    @Override
    protected void closeVenueSession() {
        log.info(
                "Paper venue session closed: {} open positions, {} resting orders, realized P&L {}",
                virtualPositionManager.getOpenPositionCount(),
                virtualOrderBook.getPendingOrderCount(),
                virtualPositionManager.getTotalRealizedPnl());
    }

    @Override
    protected void submitToVenue(Order order) {
        runOnVenue(() -> handleSubmission(order));
    }

    @Override
    protected boolean modifyOrderAtVenue(String orderId, OrderModifyRequest request) {
        runOnVenue(() -> {
            if (virtualOrderBook.modify(orderId, request)) {
                onVenueOrderModified(orderId, request);
            } else {
                log.info("Modify of {} not applied: order no longer resting", orderId);
            }
        });
        return true;
    }

    @Override
    protected boolean cancelAtVenue(String orderId) {
        runOnVenue(() -> {
            if (virtualOrderBook.cancel(orderId)) {
                onVenueOrderCancelled(orderId);
            } else {
                log.info("Cancel of {} not applied: order no longer resting", orderId);
            }
        });
        return true;
    }

    @Override
    protected boolean modifyPositionAtVenue(String symbol, PositionModifyRequest request) {
        runOnVenue(() -> virtualPositionManager.modifyProtection(symbol, request).ifPresent(this::reportPosition));
        return true;
    }

    // ---- Venue-thread logic ----

    private void handleSubmission(Order order) {
        String symbol = order.getSymbol();
        Optional<InstrumentInfo> instrument = lookupInstrument(order);
        if (instrument.isEmpty()) {
            return;
        }

        if (order.isClosing() && !virtualPositionManager.hasPosition(symbol)) {
            onVenueOrderRejected(order.getId(), "No open position on " + symbol);
            return;
        }
        if (!order.isClosing() && virtualPositionManager.hasPosition(symbol)) {
            onVenueOrderRejected(order.getId(), "Position already open on " + symbol);
            return;
        }

        if (order.getType() == OrderType.LIMIT && !order.isClosing()) {
            onVenueOrderAccepted(order.getId());
            virtualOrderBook.addPending(order);
            return;
        }

        Optional<MarketData> lastBar = virtualOrderBook.lastBar(symbol);
        if (lastBar.isEmpty()) {
            onVenueOrderRejected(order.getId(), "No price available for " + symbol);
            return;
        }
        if (!order.isClosing() && !hasMarginFor(order, instrument.get())) {
            onVenueOrderRejected(order.getId(), "Not enough free margin");
            return;
        }

        onVenueOrderAccepted(order.getId());
        BigDecimal fillPrice = virtualOrderBook.applySlippage(
                lastBar.get().getClose(), order.getSide(), instrument.get().getPointSize());
        fill(order, fillPrice, instrument.get(), lastBar.get().getTimestamp());
    }

    private void processBar(MarketData bar) {
        try {
            virtualOrderBook.recordBar(bar);

            for (Order order : virtualOrderBook.matchPendingOrders(bar)) {
                if (virtualPositionManager.hasPosition(order.getSymbol())) {
                    onVenueOrderRejected(order.getId(), "Position already open on " + order.getSymbol());
                    continue;
                }
                lookupInstrument(order).ifPresent(instrument ->
                        fill(order, order.getRequestedPrice(), instrument, bar.getTimestamp()));
            }

            Optional<VirtualPositionManager.ProtectiveExit> exit = virtualPositionManager.checkProtectiveExit(bar);
            if (exit.isPresent()) {
                BigDecimal exitPrice = exit.get().price();
                virtualPositionManager
                        .close(bar.getSymbol(), exitPrice)
                        .ifPresent(realized -> onVenuePositionClosed(
                                bar.getSymbol(), exitPrice, realized, exit.get().reason(), null, bar.getTimestamp()));
            } else {
                virtualPositionManager
                        .markToMarket(bar.getSymbol(), bar.getClose(), bar.getTimestamp())
                        .ifPresent(this::reportPosition);
            }

            reportAccount();
            onVenueMarketData(bar);
        } catch (RuntimeException e) {
            log.error(
                    "Paper venue failed to process bar {} {}: {}",
                    bar.getSymbol(),
                    bar.getTimestamp(),
                    e.getMessage(),
                    e);
        }
    }

    private void fill(Order order, BigDecimal fillPrice, InstrumentInfo instrument, LocalDateTime fillTime) {
        if (order.isClosing()) {
            Optional<BigDecimal> realized = virtualPositionManager.close(order.getSymbol(), fillPrice);
            onVenueOrderFilled(order.getId(), fillPrice, fillTime);
            realized.ifPresent(pnl ->
                    onVenuePositionClosed(order.getSymbol(), fillPrice, pnl, "CLOSE", order.getId(), fillTime));
        } else {
            virtualPositionManager.open(order, fillPrice, instrument, fillTime);
            onVenueOrderFilled(order.getId(), fillPrice, fillTime);
        }
        reportAccount();
    }

    private boolean hasMarginFor(Order order, InstrumentInfo instrument) {
        BigDecimal required = order.getRequestedVolume()
                .multiply(instrument.getMarginPerLot())
                .divide(BigDecimal.valueOf(getSettings().getLeverage()), 2, RoundingMode.HALF_UP);
        BigDecimal free = virtualPositionManager.getEquity().subtract(virtualPositionManager.getMarginUsed());
        return free.compareTo(required) >= 0;
    }

    private Optional<InstrumentInfo> lookupInstrument(Order order) {
        try {
            return Optional.of(instrumentService.getInstrument(order.getSymbol()));
        } catch (InvalidInstrumentDataException e) {
            onVenueOrderRejected(order.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void reportPosition(Position position) {
        onVenuePositionUpdate(
                position.getSymbol(),
                position.getCurrentPrice(),
                position.getUnrealizedPnl(),
                position.getStopLoss(),
                position.getTakeProfit(),
                position.getLastUpdated());
    }

    private void reportAccount() {
        onVenueAccountUpdate(
                virtualPositionManager.getBalance(),
                virtualPositionManager.getEquity(),
                virtualPositionManager.getMarginUsed());
    }

    private void runOnVenue(Runnable task) {
        try {
            venueExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            throw new BrokerException("Paper venue is not accepting work", e);
        }
    }
}
