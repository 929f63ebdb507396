package com.fxtrader.event;

import com.fxtrader.domain.model.TradeInfo;
import org.springframework.context.ApplicationEvent;

/** Published when the venue reports an opening fill or a position close. */
public class TradeExecutedEvent extends ApplicationEvent {

    private final TradeInfo tradeInfo;

    public TradeExecutedEvent(Object source, TradeInfo tradeInfo) {
        super(source);
        this.tradeInfo = tradeInfo;
    }

    public TradeInfo getTradeInfo() {
        return tradeInfo;
    }
}
