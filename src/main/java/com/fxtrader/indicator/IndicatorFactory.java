package com.fxtrader.indicator;

import com.fxtrader.domain.enums.MovingAverageType;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.CCIIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;

/** Creates ta4j indicators over a bar series and builds their cache keys. */
public final class IndicatorFactory {

    private IndicatorFactory() {}

    public static Indicator<Num> movingAverage(BarSeries series, MovingAverageType type, int period) {
        ClosePriceIndicator closePrice = new ClosePriceIndicator(series);
        return switch (type) {
            case SMA -> new SMAIndicator(closePrice, period);
            case EMA -> new EMAIndicator(closePrice, period);
        };
    }

    public static Indicator<Num> cci(BarSeries series, int period) {
        return new CCIIndicator(series, period);
    }

    public static Indicator<Num> atr(BarSeries series, int period) {
        return new ATRIndicator(series, period);
    }

    public static Indicator<Num> closePrice(BarSeries series) {
        return new ClosePriceIndicator(series);
    }

    /** e.g. "SMA:50", "CCI:14", "ATR:14". */
    public static String buildKey(String name, int period) {
        return name + ":" + period;
    }
}
