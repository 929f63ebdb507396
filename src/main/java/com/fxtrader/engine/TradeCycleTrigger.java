package com.fxtrader.engine;

import com.fxtrader.domain.model.MarketData;
import com.fxtrader.event.MarketDataEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts a trade cycle for every bar of the configured symbol and timeframe.
 *
 * <p>Runs after the indicator adapter has absorbed the bar. Bars of other symbols or
 * timeframes, and all bars while trading is disabled, are ignored.
 */
@Component
public class TradeCycleTrigger {

    private static final Logger log = LoggerFactory.getLogger(TradeCycleTrigger.class);

    private final TradeOrchestrator tradeOrchestrator;
    private final TradingConfig tradingConfig;

    public TradeCycleTrigger(TradeOrchestrator tradeOrchestrator, TradingConfig tradingConfig) {
        this.tradeOrchestrator = tradeOrchestrator;
        this.tradingConfig = tradingConfig;
    }

    @EventListener
    @Order(10)
    public void onMarketData(MarketDataEvent event) {
        if (!tradingConfig.isEnabled()) {
            return;
        }
        MarketData bar = event.getMarketData();
        if (!tradingConfig.getSymbol().equals(bar.getSymbol())
                || !tradingConfig.getTimeframe().equals(bar.getTimeframe())) {
            return;
        }

        CycleResult result = tradeOrchestrator.runCycle(bar.getTimestamp());
        log.debug(
                "Bar {} {} at {} -> {}", bar.getSymbol(), bar.getTimeframe(), bar.getTimestamp(), result.getOutcome());
    }
}
