package com.fxtrader.broker;

import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.enums.OrderStatus;
import com.fxtrader.domain.enums.OrderType;
import com.fxtrader.domain.enums.PositionStatus;
import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.model.AccountState;
import com.fxtrader.domain.model.MarketData;
import com.fxtrader.domain.model.Order;
import com.fxtrader.domain.model.Position;
import com.fxtrader.domain.model.TradeInfo;
import com.fxtrader.event.EventPublisherHelper;
import com.fxtrader.event.OrderEventType;
import com.fxtrader.event.SessionEventType;
import com.fxtrader.exception.BrokerConnectionException;
import com.fxtrader.exception.BrokerException;
import com.fxtrader.exception.InvalidOrderRequestException;
import com.fxtrader.exception.OrderNotFoundException;
import com.fxtrader.exception.PositionNotFoundException;
import com.fxtrader.exception.VenueRejectionException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Venue-independent half of a {@link BrokerGateway}: owns the order map, the position map
 * (keyed by symbol) and the account snapshot, and turns venue notifications into state changes
 * and events.
 *
 * <p>Subclasses implement the venue hooks ({@code openVenueSession}, {@code submitToVenue}, ...)
 * and report everything the venue does through the {@code onVenue...} methods. Those are the
 * only path by which order status, positions and the account change after submission.
 *
 * <p>Each {@link #connect} starts a new session: the previous session's orders, positions and
 * subscriptions are discarded, since the venue reports its state afresh. Terminal orders are
 * kept up to {@code orderHistoryLimit}; working orders are also indexed by symbol.
 *
 * <p>Threading: one {@link ReentrantLock} guards all owned state, so an order transition and
 * the position it creates are observed together. Events are published after the lock is
 * released, on the thread that delivered the venue notification, in notification order.
 */
public abstract class AbstractBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(AbstractBrokerGateway.class);

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Map<String, Order> orders = new LinkedHashMap<>();
    private final Map<String, Position> positions = new HashMap<>();
    private final Set<String> subscriptions = new HashSet<>();
    private final Map<String, Set<String>> workingOrdersBySymbol = new HashMap<>();
    private final Deque<String> terminalOrderIds = new ArrayDeque<>();

    private AccountState accountState = AccountState.empty(null, null);
    private BrokerConnectionSettings settings;
    private volatile boolean connected;

    protected final EventPublisherHelper eventPublisherHelper;
    protected final Clock clock;

    protected AbstractBrokerGateway(EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ---- Session ----

    @Override
    public synchronized void connect(BrokerConnectionSettings settings) {
        if (connected) {
            log.debug("Already connected as {}", settings.getAccountId());
            return;
        }
        stateLock.lock();
        try {
            this.settings = settings;
            this.accountState = AccountState.empty(settings.getAccountId(), settings.getCurrency());
            orders.clear();
            positions.clear();
            subscriptions.clear();
            workingOrdersBySymbol.clear();
            terminalOrderIds.clear();
        } finally {
            stateLock.unlock();
        }

        try {
            openVenueSession(settings);
        } catch (BrokerException e) {
            throw new BrokerConnectionException("Failed to open venue session: " + e.getMessage(), e);
        }
        connected = true;
        eventPublisherHelper.publishSessionEvent(this, SessionEventType.SESSION_OPENED, settings.getAccountId());
        log.info(
                "Connected to venue: account={}, server={}:{}, demo={}",
                settings.getAccountId(),
                settings.getServerAddress(),
                settings.getServerPort(),
                settings.isDemo());
    }

    @Override
    public synchronized void disconnect() {
        if (!connected) {
            return;
        }
        connected = false;
        stateLock.lock();
        try {
            subscriptions.clear();
        } finally {
            stateLock.unlock();
        }
        closeVenueSession();
        log.info("Disconnected from venue");
        eventPublisherHelper.publishSessionEvent(
                this, SessionEventType.SESSION_CLOSED, settings != null ? settings.getAccountId() : null);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void subscribeToMarketData(String symbol, String timeframe) {
        ensureConnected("subscribe to market data");
        stateLock.lock();
        try {
            subscriptions.add(subscriptionKey(symbol, timeframe));
        } finally {
            stateLock.unlock();
        }
        log.info("Subscribed to market data: {} {}", symbol, timeframe);
    }

    // ---- Orders ----

    @Override
    public OrderResponse placeOrder(OrderRequest request) {
        ensureConnected("place order");
        validate(request);

        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.builder()
                .id("ORD-" + UUID.randomUUID())
                .symbol(request.getSymbol())
                .type(request.getType())
                .side(request.getSide())
                .requestedVolume(request.getVolume())
                .requestedPrice(request.getPrice())
                .stopLoss(request.getStopLoss())
                .takeProfit(request.getTakeProfit())
                .status(OrderStatus.PENDING)
                .closing(false)
                .comment(request.getComment())
                .createdAt(now)
                .updatedAt(now)
                .build();
        return submit(order);
    }

    @Override
    public OrderResponse closePosition(String symbol) {
        ensureConnected("close position");
        Position position;
        stateLock.lock();
        try {
            position = positions.get(symbol);
            if (position == null) {
                throw new PositionNotFoundException(symbol);
            }
            position = position.copy();
        } finally {
            stateLock.unlock();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.builder()
                .id("ORD-" + UUID.randomUUID())
                .symbol(symbol)
                .type(OrderType.MARKET)
                .side(OrderSide.opening(position.getType()).opposite())
                .requestedVolume(position.getVolume())
                .status(OrderStatus.PENDING)
                .closing(true)
                .comment("CLOSE")
                .createdAt(now)
                .updatedAt(now)
                .build();
        return submit(order);
    }

    @Override
    public boolean modifyOrder(String orderId, OrderModifyRequest request) {
        ensureConnected("modify order");
        if (request.getPrice() != null && request.getPrice().signum() <= 0) {
            throw new InvalidOrderRequestException("Limit price must be positive");
        }
        stateLock.lock();
        try {
            Order order = requireOrder(orderId);
            if (order.getStatus().isTerminal()) {
                log.info("Modify ignored: order {} is already {}", orderId, order.getStatus());
                return false;
            }
        } finally {
            stateLock.unlock();
        }
        return modifyOrderAtVenue(orderId, request);
    }

    @Override
    public boolean cancelOrder(String orderId) {
        ensureConnected("cancel order");
        OrderStatus status;
        stateLock.lock();
        try {
            status = requireOrder(orderId).getStatus();
        } finally {
            stateLock.unlock();
        }

        if (status == OrderStatus.CANCELLED) {
            return true;
        }
        if (status.isTerminal()) {
            log.info("Cancel ignored: order {} is already {}", orderId, status);
            return false;
        }
        return cancelAtVenue(orderId);
    }

    @Override
    public Order getOrder(String orderId) {
        ensureConnected("read orders");
        stateLock.lock();
        try {
            return requireOrder(orderId).copy();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<Order> getOrders() {
        ensureConnected("read orders");
        stateLock.lock();
        try {
            List<Order> copies = new ArrayList<>(orders.size());
            orders.values().forEach(order -> copies.add(order.copy()));
            return copies;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public boolean hasWorkingOrder(String symbol) {
        ensureConnected("read orders");
        stateLock.lock();
        try {
            return workingOrdersBySymbol.containsKey(symbol);
        } finally {
            stateLock.unlock();
        }
    }

    // ---- Positions ----

    @Override
    public List<Position> getPositions() {
        ensureConnected("read positions");
        stateLock.lock();
        try {
            return positions.values().stream().map(Position::copy).toList();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<Position> getPosition(String symbol) {
        ensureConnected("read positions");
        stateLock.lock();
        try {
            return Optional.ofNullable(positions.get(symbol)).map(Position::copy);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public boolean modifyPosition(String symbol, PositionModifyRequest request) {
        ensureConnected("modify position");
        stateLock.lock();
        try {
            if (!positions.containsKey(symbol)) {
                throw new PositionNotFoundException(symbol);
            }
        } finally {
            stateLock.unlock();
        }
        return modifyPositionAtVenue(symbol, request);
    }

    // ---- Account ----

    @Override
    public AccountState getAccountInfo() {
        ensureConnected("read account");
        stateLock.lock();
        try {
            return accountState;
        } finally {
            stateLock.unlock();
        }
    }

    // ---- Venue hooks ----

    /** Opens the venue session and schedules the initial account report. */
    protected abstract void openVenueSession(BrokerConnectionSettings settings);

    protected abstract void closeVenueSession();

    /**
     * Hands a PENDING order to the venue. Must not block on the outcome.
     *
     * @throws BrokerException if the venue cannot take the order at all
     */
    protected abstract void submitToVenue(Order order);

    /** @return true if the venue took the modification for processing */
    protected abstract boolean modifyOrderAtVenue(String orderId, OrderModifyRequest request);

    /** @return true if the venue took the cancellation for processing */
    protected abstract boolean cancelAtVenue(String orderId);

    protected abstract boolean modifyPositionAtVenue(String symbol, PositionModifyRequest request);

    protected BrokerConnectionSettings getSettings() {
        return settings;
    }

    // ---- Venue events ----

    protected final void onVenueOrderAccepted(String orderId) {
        applyOrderTransition(orderId, OrderStatus.ACCEPTED, OrderEventType.ACCEPTED);
    }

    protected final void onVenueOrderCancelled(String orderId) {
        applyOrderTransition(orderId, OrderStatus.CANCELLED, OrderEventType.CANCELLED);
    }

    /**
     * Marks the order REJECTED and publishes the rejection as an order event. Never throws: the
     * rejection is delivered to listeners, not to the thread that reported it.
     */
    protected final void onVenueOrderRejected(String orderId, String reason) {
        Order snapshot;
        OrderStatus previous;
        stateLock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null) {
                log.warn("Venue rejected unknown order {}: {}", orderId, reason);
                return;
            }
            previous = order.getStatus();
            if (!previous.canTransitionTo(OrderStatus.REJECTED)) {
                log.warn("Ignoring rejection of order {} in state {}", orderId, previous);
                return;
            }
            order.setStatus(OrderStatus.REJECTED);
            order.setRejectionReason(reason);
            order.setUpdatedAt(LocalDateTime.now(clock));
            trackStatus(order);
            snapshot = order.copy();
        } finally {
            stateLock.unlock();
        }

        log.warn("Order {} rejected by venue: {}", orderId, reason);
        eventPublisherHelper.publishOrderRejected(
                this, snapshot, previous, new VenueRejectionException(orderId, reason));
    }

    protected final void onVenueOrderModified(String orderId, OrderModifyRequest applied) {
        Order snapshot;
        OrderStatus status;
        stateLock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null || order.getStatus().isTerminal()) {
                log.warn("Ignoring venue modification of order {}", orderId);
                return;
            }
            if (applied.getPrice() != null) {
                order.setRequestedPrice(applied.getPrice());
            }
            if (applied.getStopLoss() != null) {
                order.setStopLoss(applied.getStopLoss());
            }
            if (applied.getTakeProfit() != null) {
                order.setTakeProfit(applied.getTakeProfit());
            }
            order.setUpdatedAt(LocalDateTime.now(clock));
            status = order.getStatus();
            snapshot = order.copy();
        } finally {
            stateLock.unlock();
        }
        eventPublisherHelper.publishOrderEvent(this, snapshot, OrderEventType.MODIFIED, status);
    }

    /**
     * Marks the order FILLED. An opening order creates the position for its symbol in the same
     * critical section; a closing order leaves the position to {@link #onVenuePositionClosed}.
     */
    protected final void onVenueOrderFilled(String orderId, BigDecimal fillPrice, LocalDateTime fillTime) {
        Order snapshot;
        OrderStatus previous;
        Position opened = null;
        stateLock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null) {
                log.warn("Venue filled unknown order {}", orderId);
                return;
            }
            previous = order.getStatus();
            if (!previous.canTransitionTo(OrderStatus.FILLED)) {
                log.warn("Ignoring fill of order {} in state {}", orderId, previous);
                return;
            }
            order.setStatus(OrderStatus.FILLED);
            order.setFillPrice(fillPrice);
            order.setUpdatedAt(fillTime);
            trackStatus(order);

            if (!order.isClosing()) {
                if (positions.containsKey(order.getSymbol())) {
                    log.error(
                            "Fill of order {} while a position is open on {}; existing position kept",
                            orderId,
                            order.getSymbol());
                } else {
                    Position position = Position.builder()
                            .id("POS-" + UUID.randomUUID())
                            .symbol(order.getSymbol())
                            .type(PositionType.openedBy(order.getSide()))
                            .volume(order.getRequestedVolume())
                            .entryPrice(fillPrice)
                            .currentPrice(fillPrice)
                            .unrealizedPnl(BigDecimal.ZERO)
                            .stopLoss(order.getStopLoss())
                            .takeProfit(order.getTakeProfit())
                            .status(PositionStatus.OPEN)
                            .openingOrderId(orderId)
                            .openedAt(fillTime)
                            .lastUpdated(fillTime)
                            .build();
                    positions.put(position.getSymbol(), position);
                    opened = position.copy();
                }
            }
            snapshot = order.copy();
        } finally {
            stateLock.unlock();
        }

        eventPublisherHelper.publishOrderEvent(this, snapshot, OrderEventType.FILLED, previous);
        if (opened != null) {
            log.info(
                    "Position opened: {} {} {} @ {}",
                    opened.getType(),
                    opened.getVolume(),
                    opened.getSymbol(),
                    opened.getEntryPrice());
            eventPublisherHelper.publishPositionOpened(this, opened);
            eventPublisherHelper.publishTradeExecuted(
                    this,
                    TradeInfo.builder()
                            .orderId(orderId)
                            .symbol(snapshot.getSymbol())
                            .side(snapshot.getSide())
                            .orderType(snapshot.getType())
                            .volume(snapshot.getRequestedVolume())
                            .price(fillPrice)
                            .profitLoss(BigDecimal.ZERO)
                            .stopLoss(snapshot.getStopLoss())
                            .takeProfit(snapshot.getTakeProfit())
                            .executionTime(fillTime)
                            .comment("OPEN")
                            .build());
        }
    }

    /** Venue mark-to-market or protective-level change. The reported values replace the local ones. */
    protected final void onVenuePositionUpdate(
            String symbol,
            BigDecimal currentPrice,
            BigDecimal unrealizedPnl,
            BigDecimal stopLoss,
            BigDecimal takeProfit,
            LocalDateTime updateTime) {
        Position snapshot;
        BigDecimal previousPnl;
        stateLock.lock();
        try {
            Position position = positions.get(symbol);
            if (position == null) {
                log.debug("Position update for {} ignored: no open position", symbol);
                return;
            }
            previousPnl = position.getUnrealizedPnl();
            updatePosition(position, currentPrice, unrealizedPnl, stopLoss, takeProfit, updateTime);
            snapshot = position.copy();
        } finally {
            stateLock.unlock();
        }
        eventPublisherHelper.publishPositionUpdated(this, snapshot, previousPnl);
    }

    /**
     * Venue confirmation that the position on {@code symbol} is closed.
     *
     * @param reason  CLOSE for a requested exit, SL or TP for a protective exit
     * @param orderId the closing order, or null when the venue closed the position itself
     */
    protected final void onVenuePositionClosed(
            String symbol,
            BigDecimal closePrice,
            BigDecimal realizedPnl,
            String reason,
            String orderId,
            LocalDateTime closeTime) {
        Position closed;
        BigDecimal previousPnl;
        stateLock.lock();
        try {
            Position position = removePosition(symbol);
            if (position == null) {
                log.warn("Close of {} reported but no position is open", symbol);
                return;
            }
            previousPnl = position.getUnrealizedPnl();
            position.setStatus(PositionStatus.CLOSED);
            position.setCurrentPrice(closePrice);
            position.setUnrealizedPnl(BigDecimal.ZERO);
            position.setClosedAt(closeTime);
            position.setLastUpdated(closeTime);
            closed = position.copy();
        } finally {
            stateLock.unlock();
        }

        log.info("Position closed ({}): {} {} @ {}, P&L {}", reason, closed.getType(), symbol, closePrice, realizedPnl);
        eventPublisherHelper.publishPositionClosed(this, closed, previousPnl);
        eventPublisherHelper.publishTradeExecuted(
                this,
                TradeInfo.builder()
                        .orderId(orderId)
                        .symbol(symbol)
                        .side(OrderSide.opening(closed.getType()).opposite())
                        .orderType(OrderType.MARKET)
                        .volume(closed.getVolume())
                        .price(closePrice)
                        .profitLoss(realizedPnl)
                        .stopLoss(closed.getStopLoss())
                        .takeProfit(closed.getTakeProfit())
                        .executionTime(closeTime)
                        .comment(reason)
                        .build());
    }

    protected final void onVenueAccountUpdate(BigDecimal balance, BigDecimal equity, BigDecimal marginUsed) {
        AccountState updated;
        stateLock.lock();
        try {
            if (settings == null) {
                log.warn("Account update before session settings are known; ignored");
                return;
            }
            updated = AccountState.of(
                    settings.getAccountId(),
                    balance,
                    equity,
                    marginUsed,
                    settings.getLeverage(),
                    settings.getCurrency(),
                    clock.instant());
            updateAccountInfo(updated);
        } finally {
            stateLock.unlock();
        }
        if (updated.isMarginCall()) {
            log.warn("Margin call: equity {} below margin used {}", equity, marginUsed);
        }
    }

    /** Publishes the bar if its symbol/timeframe is subscribed. */
    protected final void onVenueMarketData(MarketData marketData) {
        boolean subscribed;
        stateLock.lock();
        try {
            subscribed = subscriptions.contains(subscriptionKey(marketData.getSymbol(), marketData.getTimeframe()));
        } finally {
            stateLock.unlock();
        }
        if (subscribed) {
            eventPublisherHelper.publishMarketData(this, marketData);
        }
    }

    // ---- Internal state ----

    private OrderResponse submit(Order order) {
        Order snapshot;
        stateLock.lock();
        try {
            orders.put(order.getId(), order);
            trackStatus(order);
            snapshot = order.copy();
        } finally {
            stateLock.unlock();
        }
        eventPublisherHelper.publishOrderPlaced(this, snapshot);

        try {
            submitToVenue(snapshot.copy());
        } catch (BrokerException e) {
            onVenueOrderRejected(order.getId(), e.getMessage());
            throw e;
        }
        log.info(
                "Order submitted: {} {} {} {} lots{}",
                snapshot.getId(),
                snapshot.getSide(),
                snapshot.getSymbol(),
                snapshot.getRequestedVolume(),
                snapshot.isClosing() ? " (close)" : "");
        return OrderResponse.pending(snapshot);
    }

    private void applyOrderTransition(String orderId, OrderStatus next, OrderEventType eventType) {
        Order snapshot;
        OrderStatus previous;
        stateLock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null) {
                log.warn("Venue reported {} for unknown order {}", next, orderId);
                return;
            }
            previous = order.getStatus();
            if (!previous.canTransitionTo(next)) {
                log.warn("Ignoring transition {} -> {} for order {}", previous, next, orderId);
                return;
            }
            order.setStatus(next);
            order.setUpdatedAt(LocalDateTime.now(clock));
            trackStatus(order);
            snapshot = order.copy();
        } finally {
            stateLock.unlock();
        }
        eventPublisherHelper.publishOrderEvent(this, snapshot, eventType, previous);
    }

    /**
     * Keeps the working-order index and the terminal-order history in line with the order's
     * status. Caller holds {@code stateLock}.
     */
    private void trackStatus(Order order) {
        String symbol = order.getSymbol();
        if (!order.getStatus().isTerminal()) {
            workingOrdersBySymbol.computeIfAbsent(symbol, s -> new HashSet<>()).add(order.getId());
            return;
        }

        Set<String> working = workingOrdersBySymbol.get(symbol);
        if (working != null) {
            working.remove(order.getId());
            if (working.isEmpty()) {
                workingOrdersBySymbol.remove(symbol);
            }
        }
        terminalOrderIds.addLast(order.getId());
        int limit = settings != null ? settings.getOrderHistoryLimit() : Integer.MAX_VALUE;
        while (terminalOrderIds.size() > limit) {
            orders.remove(terminalOrderIds.removeFirst());
        }
    }

    private void updatePosition(
            Position position,
            BigDecimal currentPrice,
            BigDecimal unrealizedPnl,
            BigDecimal stopLoss,
            BigDecimal takeProfit,
            LocalDateTime updateTime) {
        position.setCurrentPrice(currentPrice);
        position.setUnrealizedPnl(unrealizedPnl);
        position.setStopLoss(stopLoss);
        position.setTakeProfit(takeProfit);
        position.setLastUpdated(updateTime);
    }

    private Position removePosition(String symbol) {
        return positions.remove(symbol);
    }

    private void updateAccountInfo(AccountState updated) {
        this.accountState = updated;
    }

    private Order requireOrder(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    private void ensureConnected(String operation) {
        if (!connected) {
            throw new BrokerConnectionException(operation);
        }
    }

    private void validate(OrderRequest request) {
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            throw new InvalidOrderRequestException("Symbol is required");
        }
        if (request.getSide() == null || request.getType() == null) {
            throw new InvalidOrderRequestException("Order side and type are required");
        }
        if (request.getVolume() == null || request.getVolume().signum() <= 0) {
            throw new InvalidOrderRequestException("Volume must be positive");
        }
        if (request.getType() == OrderType.LIMIT
                && (request.getPrice() == null || request.getPrice().signum() <= 0)) {
            throw new InvalidOrderRequestException("LIMIT orders need a positive price");
        }
    }

    private static String subscriptionKey(String symbol, String timeframe) {
        return symbol + "|" + timeframe;
    }
}
