package com.fxtrader.simulator;

import com.fxtrader.broker.OrderModifyRequest;
import com.fxtrader.domain.enums.OrderSide;
import com.fxtrader.domain.model.MarketData;
import com.fxtrader.domain.model.Order;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Venue-side order book of the paper venue: the last bar per symbol and the resting LIMIT
 * orders.
 *
 * <p>Fill logic:
 * <ul>
 *   <li>MARKET: last close, moved against the trader by {@code slippagePoints * pointSize}</li>
 *   <li>LIMIT BUY: fills at the limit price when the bar's low reaches it</li>
 *   <li>LIMIT SELL: fills at the limit price when the bar's high reaches it</li>
 * </ul>
 *
 * <p>Only touched from the venue thread, so no internal locking.
 */
@Component
public class VirtualOrderBook {

    private static final Logger log = LoggerFactory.getLogger(VirtualOrderBook.class);

    private final SimulatorConfig simulatorConfig;

    /** Resting LIMIT orders by order id, in arrival order. */
    private final Map<String, Order> pendingOrders = new LinkedHashMap<>();

    private final Map<String, MarketData> lastBars = new LinkedHashMap<>();

    public VirtualOrderBook(SimulatorConfig simulatorConfig) {
        this.simulatorConfig = simulatorConfig;
    }

    public void recordBar(MarketData bar) {
        lastBars.put(bar.getSymbol(), bar);
    }

    public Optional<MarketData> lastBar(String symbol) {
        return Optional.ofNullable(lastBars.get(symbol));
    }

    public void addPending(Order order) {
        pendingOrders.put(order.getId(), order);
        log.debug(
                "Limit order resting: {} {} {} @ {}",
                order.getId(),
                order.getSide(),
                order.getSymbol(),
                order.getRequestedPrice());
    }

    /**
     * Removes and returns the resting orders the bar trades through. Each returned order fills
     * at its limit price.
     */
    public List<Order> matchPendingOrders(MarketData bar) {
        List<Order> matched = new ArrayList<>();
        for (Order order : pendingOrders.values()) {
            if (order.getSymbol().equals(bar.getSymbol()) && touches(order, bar)) {
                matched.add(order);
            }
        }
        matched.forEach(order -> pendingOrders.remove(order.getId()));
        return matched;
    }

    /** @return false if the order is no longer resting */
    public boolean modify(String orderId, OrderModifyRequest request) {
        Order order = pendingOrders.get(orderId);
        if (order == null) {
            return false;
        }
        if (request.getPrice() != null) {
            order.setRequestedPrice(request.getPrice());
        }
        if (request.getStopLoss() != null) {
            order.setStopLoss(request.getStopLoss());
        }
        if (request.getTakeProfit() != null) {
            order.setTakeProfit(request.getTakeProfit());
        }
        return true;
    }

    /** @return false if the order is no longer resting */
    public boolean cancel(String orderId) {
        return pendingOrders.remove(orderId) != null;
    }

    /** BUY fills higher, SELL fills lower. */
    public BigDecimal applySlippage(BigDecimal price, OrderSide side, BigDecimal pointSize) {
        if (simulatorConfig.getSlippagePoints() <= 0) {
            return price;
        }
        BigDecimal slippage = pointSize.multiply(BigDecimal.valueOf(simulatorConfig.getSlippagePoints()));
        return side == OrderSide.BUY ? price.add(slippage) : price.subtract(slippage);
    }

    public int getPendingOrderCount() {
        return pendingOrders.size();
    }

    public void reset() {
        pendingOrders.clear();
        lastBars.clear();
    }

    private boolean touches(Order order, MarketData bar) {
        BigDecimal limit = order.getRequestedPrice();
        return order.getSide() == OrderSide.BUY
                ? bar.getLow().compareTo(limit) <= 0
                : bar.getHigh().compareTo(limit) >= 0;
    }
}
