package com.fxtrader.event;

import com.fxtrader.domain.enums.OrderStatus;
import com.fxtrader.domain.model.Order;
import com.fxtrader.exception.VenueRejectionException;
import java.util.Optional;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the broker gateway after an order's state change has been committed.
 *
 * <p>Each event carries a copy of the order, the type of change and the previous status.
 * REJECTED events also carry the {@link VenueRejectionException} describing the refusal; this
 * is how asynchronous venue rejections reach the rest of the engine.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;
    private final VenueRejectionException rejection;

    public OrderEvent(
            Object source,
            Order order,
            OrderEventType eventType,
            OrderStatus previousStatus,
            VenueRejectionException rejection) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.rejection = rejection;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        this(source, order, eventType, previousStatus, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Null for PLACED events. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }

    public Optional<VenueRejectionException> getRejection() {
        return Optional.ofNullable(rejection);
    }
}
