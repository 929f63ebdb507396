package com.fxtrader.indicator;

import com.fxtrader.domain.enums.MovingAverageType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the technical indicators the trade cycle consumes.
 *
 * <p>{@code shift} counts completed bars back from the latest: 0 is the latest bar, 1 the one
 * before. A value is empty while the series holds too few bars to compute it.
 */
public interface IndicatorAdapter {

    /** Close of the most recent bar seen for the symbol on any timeframe. */
    Optional<BigDecimal> currentPrice(String symbol);

    Optional<BigDecimal> closePrice(String symbol, String timeframe, int shift);

    Optional<BigDecimal> movingAverage(String symbol, String timeframe, MovingAverageType type, int period, int shift);

    Optional<BigDecimal> cci(String symbol, String timeframe, int period, int shift);

    /**
     * The last {@code count} ATR values, oldest first. Shorter than {@code count} (possibly
     * empty) while the series is warming up.
     */
    List<BigDecimal> atr(String symbol, String timeframe, int period, int count);

    int barCount(String symbol, String timeframe);
}
