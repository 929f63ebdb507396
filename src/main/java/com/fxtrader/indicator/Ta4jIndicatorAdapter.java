package com.fxtrader.indicator;

import com.fxtrader.domain.enums.MovingAverageType;
import com.fxtrader.domain.model.MarketData;
import com.fxtrader.event.MarketDataEvent;
import com.fxtrader.signal.SignalConfig;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link IndicatorAdapter} backed by ta4j, one {@link BarSeriesManager} per symbol/timeframe.
 *
 * <p>Series are created on the first bar seen. Runs at {@code @Order(1)} in the
 * {@link MarketDataEvent} listener chain so the bar is in the series before the trade cycle
 * reads it.
 */
@Service
public class Ta4jIndicatorAdapter implements IndicatorAdapter {

    private static final Logger log = LoggerFactory.getLogger(Ta4jIndicatorAdapter.class);

    private final SignalConfig signalConfig;

    private final Map<String, BarSeriesManager> barSeriesManagers = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    public Ta4jIndicatorAdapter(SignalConfig signalConfig) {
        this.signalConfig = signalConfig;
    }

    @EventListener
    @Order(1)
    public void onMarketData(MarketDataEvent event) {
        MarketData bar = event.getMarketData();
        BarSeriesManager manager = barSeriesManagers.computeIfAbsent(key(bar.getSymbol(), bar.getTimeframe()), k -> {
            log.info("Tracking bar series {} {}", bar.getSymbol(), bar.getTimeframe());
            return new BarSeriesManager(bar.getSymbol(), bar.getTimeframe(), signalConfig.getMaxBars());
        });
        if (manager.addBar(bar)) {
            lastPrices.put(bar.getSymbol(), bar.getClose());
        }
    }

    @Override
    public Optional<BigDecimal> currentPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }

    @Override
    public Optional<BigDecimal> closePrice(String symbol, String timeframe, int shift) {
        return manager(symbol, timeframe).flatMap(m -> m.closePrice(shift));
    }

    @Override
    public Optional<BigDecimal> movingAverage(
            String symbol, String timeframe, MovingAverageType type, int period, int shift) {
        return manager(symbol, timeframe).flatMap(m -> m.movingAverage(type, period, shift));
    }

    @Override
    public Optional<BigDecimal> cci(String symbol, String timeframe, int period, int shift) {
        return manager(symbol, timeframe).flatMap(m -> m.cci(period, shift));
    }

    @Override
    public List<BigDecimal> atr(String symbol, String timeframe, int period, int count) {
        return manager(symbol, timeframe).map(m -> m.atr(period, count)).orElse(List.of());
    }

    @Override
    public int barCount(String symbol, String timeframe) {
        return manager(symbol, timeframe).map(BarSeriesManager::getBarCount).orElse(0);
    }

    private Optional<BarSeriesManager> manager(String symbol, String timeframe) {
        return Optional.ofNullable(barSeriesManagers.get(key(symbol, timeframe)));
    }

    private static String key(String symbol, String timeframe) {
        return symbol + "|" + timeframe;
    }
}
