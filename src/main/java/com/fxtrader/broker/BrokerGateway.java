package com.fxtrader.broker;

import com.fxtrader.domain.model.AccountState;
import com.fxtrader.domain.model.Order;
import com.fxtrader.domain.model.Position;
import java.util.List;
import java.util.Optional;

/**
 * Stateful client of the execution venue and owner of the authoritative local view of
 * orders, positions and account equity. Every component that needs to trade or read account
 * state goes through this interface.
 *
 * <p>All operations except {@link #connect}, {@link #disconnect} and {@link #isConnected} throw
 * {@link com.fxtrader.exception.BrokerConnectionException} while disconnected. Returned orders,
 * positions and account snapshots are copies; mutating them has no effect on gateway state.
 *
 * <p>Outcomes of submitted orders are asynchronous: fills, rejections and closes are published
 * as {@code OrderEvent}, {@code PositionEvent} and {@code TradeExecutedEvent} on the venue thread
 * after the corresponding state change is committed.
 */
public interface BrokerGateway {

    // ---- Session ----

    /**
     * Opens the venue session. Idempotent: a second call while connected does nothing.
     * Opening a new session discards the orders and positions of the previous one and starts
     * from the state the venue reports.
     *
     * @throws com.fxtrader.exception.BrokerConnectionException if the venue cannot be reached
     */
    void connect(BrokerConnectionSettings settings);

    /** Closes the venue session. Does nothing when already disconnected. */
    void disconnect();

    boolean isConnected();

    /** Starts delivery of {@code MarketDataEvent}s for the given symbol and timeframe. */
    void subscribeToMarketData(String symbol, String timeframe);

    // ---- Orders ----

    /**
     * Submits a new order. Returns a PENDING acknowledgement; the fill or rejection arrives later.
     *
     * @throws com.fxtrader.exception.InvalidOrderRequestException if the request is malformed
     * @throws com.fxtrader.exception.BrokerException if the venue cannot accept the submission
     */
    OrderResponse placeOrder(OrderRequest request);

    /**
     * Changes a working order.
     *
     * @return false when the order is already terminal
     * @throws com.fxtrader.exception.OrderNotFoundException for an unknown order id
     */
    boolean modifyOrder(String orderId, OrderModifyRequest request);

    /**
     * Cancels a working order. Cancelling an already cancelled order returns true; cancelling a
     * filled or rejected order returns false. Neither changes the order.
     *
     * @throws com.fxtrader.exception.OrderNotFoundException for an unknown order id
     */
    boolean cancelOrder(String orderId);

    /** @throws com.fxtrader.exception.OrderNotFoundException for an unknown order id */
    Order getOrder(String orderId);

    /**
     * Orders of the current session, in submission order. Only the most recent
     * {@code orderHistoryLimit} terminal orders are kept; working orders are never dropped.
     */
    List<Order> getOrders();

    /** Whether an order on {@code symbol} is still PENDING or ACCEPTED. */
    boolean hasWorkingOrder(String symbol);

    // ---- Positions ----

    List<Position> getPositions();

    Optional<Position> getPosition(String symbol);

    /**
     * Moves the stop-loss and/or take-profit of the open position on {@code symbol}.
     *
     * @throws com.fxtrader.exception.PositionNotFoundException if no position is open
     */
    boolean modifyPosition(String symbol, PositionModifyRequest request);

    /**
     * Submits a market order that exits the open position on {@code symbol}.
     *
     * @throws com.fxtrader.exception.PositionNotFoundException if no position is open
     */
    OrderResponse closePosition(String symbol);

    // ---- Account ----

    AccountState getAccountInfo();
}
