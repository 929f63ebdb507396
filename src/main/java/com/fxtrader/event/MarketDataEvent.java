package com.fxtrader.event;

import com.fxtrader.domain.model.MarketData;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the broker gateway for every completed bar of a subscribed symbol/timeframe.
 *
 * <p>Listener order matters: the indicator adapter ({@code @Order(1)}) appends the bar to its
 * series before the trade cycle trigger ({@code @Order(10)}) evaluates it.
 */
public class MarketDataEvent extends ApplicationEvent {

    private final MarketData marketData;

    public MarketDataEvent(Object source, MarketData marketData) {
        super(source);
        this.marketData = marketData;
    }

    public MarketData getMarketData() {
        return marketData;
    }
}
