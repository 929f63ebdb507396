package com.fxtrader.event;

import com.fxtrader.domain.model.Position;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;
    private final BigDecimal previousPnl;

    /**
     * @param source      the component publishing this event
     * @param position    a copy of the position after the change
     * @param eventType   what kind of position change occurred
     * @param previousPnl unrealized P&L before this change (null for OPENED)
     */
    public PositionEvent(Object source, Position position, PositionEventType eventType, BigDecimal previousPnl) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.previousPnl = previousPnl;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public BigDecimal getPreviousPnl() {
        return previousPnl;
    }
}
