package com.fxtrader.event;

import com.fxtrader.domain.enums.OrderStatus;
import com.fxtrader.domain.model.MarketData;
import com.fxtrader.domain.model.Order;
import com.fxtrader.domain.model.Position;
import com.fxtrader.domain.model.TradeInfo;
import com.fxtrader.exception.VenueRejectionException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the engine's events.
 *
 * <p>Delivery is synchronous on the calling thread (the venue thread for gateway events). A
 * listener that throws must not corrupt the gateway's venue-event path, so listener failures are
 * logged here and not propagated back to the publisher.
 */
@Component
public class EventPublisherHelper {

    private static final Logger log = LoggerFactory.getLogger(EventPublisherHelper.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Market data ----

    public void publishMarketData(Object source, MarketData marketData) {
        publish(new MarketDataEvent(source, marketData));
    }

    public void publishTradeExecuted(Object source, TradeInfo tradeInfo) {
        publish(new TradeExecutedEvent(source, tradeInfo));
    }

    // ---- Order ----

    public void publishOrderPlaced(Object source, Order order) {
        publish(new OrderEvent(source, order, OrderEventType.PLACED, null));
    }

    public void publishOrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        publish(new OrderEvent(source, order, eventType, previousStatus));
    }

    public void publishOrderRejected(
            Object source, Order order, OrderStatus previousStatus, VenueRejectionException rejection) {
        publish(new OrderEvent(source, order, OrderEventType.REJECTED, previousStatus, rejection));
    }

    // ---- Position ----

    public void publishPositionOpened(Object source, Position position) {
        publish(new PositionEvent(source, position, PositionEventType.OPENED, null));
    }

    public void publishPositionUpdated(Object source, Position position, BigDecimal previousPnl) {
        publish(new PositionEvent(source, position, PositionEventType.UPDATED, previousPnl));
    }

    public void publishPositionClosed(Object source, Position position, BigDecimal previousPnl) {
        publish(new PositionEvent(source, position, PositionEventType.CLOSED, previousPnl));
    }

    // ---- Session ----

    public void publishSessionEvent(Object source, SessionEventType eventType, String accountId) {
        publish(new SessionEvent(source, eventType, accountId));
    }

    private void publish(Object event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
