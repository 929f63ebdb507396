package com.fxtrader.indicator;

import com.fxtrader.domain.enums.MovingAverageType;
import com.fxtrader.domain.model.MarketData;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.num.Num;

/**
 * One ta4j {@link BarSeries} for a symbol/timeframe, fed with completed bars, plus the
 * indicators computed over it.
 *
 * <p>Indicators are created once per (kind, period) and reused as the series grows; ta4j
 * caches their values per index. Those caches fill on read, so indicator reads take the write
 * lock. The series keeps at most {@code maxBars} bars; ta4j evicts the oldest.
 */
public class BarSeriesManager {

    private static final Logger log = LoggerFactory.getLogger(BarSeriesManager.class);

    @Getter
    private final String symbol;

    @Getter
    private final String timeframe;

    @Getter
    private final Duration barDuration;

    private final BarSeries barSeries;
    private final Map<String, Indicator<Num>> indicators = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public BarSeriesManager(String symbol, String timeframe, int maxBars) {
        this.symbol = symbol;
        this.timeframe = timeframe;
        this.barDuration = durationOf(timeframe);
        this.barSeries = new BaseBarSeriesBuilder()
                .withName(symbol + "-" + timeframe)
                .withMaxBarCount(maxBars)
                .build();
    }

    /**
     * Appends a completed bar. Bars that do not end after the latest bar are ignored.
     *
     * @return true if the bar was added
     */
    public boolean addBar(MarketData bar) {
        ZonedDateTime endTime = bar.getTimestamp().atZone(ZoneOffset.UTC);
        lock.writeLock().lock();
        try {
            if (!barSeries.isEmpty() && !endTime.isAfter(barSeries.getLastBar().getEndTime())) {
                log.debug("Ignoring out-of-order bar for {} {} at {}", symbol, timeframe, bar.getTimestamp());
                return false;
            }
            barSeries.addBar(
                    barDuration, endTime, bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<BigDecimal> closePrice(int shift) {
        return valueAt("CLOSE:0", () -> IndicatorFactory.closePrice(barSeries), 1, shift);
    }

    public Optional<BigDecimal> movingAverage(MovingAverageType type, int period, int shift) {
        return valueAt(
                IndicatorFactory.buildKey(type.name(), period),
                () -> IndicatorFactory.movingAverage(barSeries, type, period),
                period,
                shift);
    }

    public Optional<BigDecimal> cci(int period, int shift) {
        return valueAt(
                IndicatorFactory.buildKey("CCI", period), () -> IndicatorFactory.cci(barSeries, period), period, shift);
    }

    /** Up to {@code count} ATR values ending at the latest bar, oldest first. */
    public List<BigDecimal> atr(int period, int count) {
        lock.writeLock().lock();
        try {
            List<BigDecimal> values = new ArrayList<>();
            if (barSeries.isEmpty()) {
                return values;
            }
            Indicator<Num> atr = indicators.computeIfAbsent(
                    IndicatorFactory.buildKey("ATR", period), key -> IndicatorFactory.atr(barSeries, period));
            int firstUsable = barSeries.getBeginIndex() + period - 1;
            int start = Math.max(firstUsable, barSeries.getEndIndex() - count + 1);
            for (int i = start; i <= barSeries.getEndIndex(); i++) {
                values.add(BigDecimal.valueOf(atr.getValue(i).doubleValue()));
            }
            return values;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getBarCount() {
        lock.readLock().lock();
        try {
            return barSeries.getBarCount();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Parses MetaTrader-style timeframe labels: M1, M5, M15, M30, H1, H4, D1, W1.
     *
     * @throws IllegalArgumentException for anything else
     */
    static Duration durationOf(String timeframe) {
        if (timeframe == null || timeframe.length() < 2) {
            throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
        }
        long amount;
        try {
            amount = Long.parseLong(timeframe.substring(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported timeframe: " + timeframe, e);
        }
        return switch (Character.toUpperCase(timeframe.charAt(0))) {
            case 'M' -> Duration.ofMinutes(amount);
            case 'H' -> Duration.ofHours(amount);
            case 'D' -> Duration.ofDays(amount);
            case 'W' -> Duration.ofDays(7 * amount);
            default -> throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
        };
    }

    private Optional<BigDecimal> valueAt(String key, Supplier<Indicator<Num>> factory, int period, int shift) {
        lock.writeLock().lock();
        try {
            if (barSeries.isEmpty()) {
                return Optional.empty();
            }
            int index = barSeries.getEndIndex() - shift;
            if (index - barSeries.getBeginIndex() + 1 < period) {
                return Optional.empty();
            }
            Indicator<Num> indicator = indicators.computeIfAbsent(key, k -> factory.get());
            Num value = indicator.getValue(index);
            if (value.isNaN()) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(value.doubleValue()));
        } finally {
            lock.writeLock().unlock();
        }
    }
}
