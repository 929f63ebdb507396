package com.fxtrader.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fxtrader.domain.enums.MovingAverageType;
import com.fxtrader.domain.model.MarketData;
import com.fxtrader.event.MarketDataEvent;
import com.fxtrader.indicator.Ta4jIndicatorAdapter;
import com.fxtrader.signal.SignalConfig;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class Ta4jIndicatorAdapterTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 4, 0, 0);

    private Ta4jIndicatorAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new Ta4jIndicatorAdapter(new SignalConfig());
    }

    private void publish(String symbol, String timeframe, int hour, String close) {
        BigDecimal c = new BigDecimal(close);
        adapter.onMarketData(new MarketDataEvent(
                this,
                MarketData.builder()
                        .symbol(symbol)
                        .timeframe(timeframe)
                        .timestamp(T0.plusHours(hour))
                        .open(c)
                        .high(c)
                        .low(c)
                        .close(c)
                        .volume(100)
                        .build()));
    }

    @Test
    void unknownSeries_isEmpty() {
        assertThat(adapter.currentPrice("EURUSD")).isEmpty();
        assertThat(adapter.closePrice("EURUSD", "H1", 0)).isEmpty();
        assertThat(adapter.atr("EURUSD", "H1", 14, 1)).isEmpty();
        assertThat(adapter.barCount("EURUSD", "H1")).isZero();
    }

    @Test
    void marketData_feedsSeriesPerSymbolAndTimeframe() {
        publish("EURUSD", "H1", 0, "1.1000");
        publish("EURUSD", "H1", 1, "1.1010");
        publish("EURUSD", "H4", 4, "1.1050");
        publish("GBPUSD", "H1", 1, "1.2700");

        assertThat(adapter.barCount("EURUSD", "H1")).isEqualTo(2);
        assertThat(adapter.barCount("EURUSD", "H4")).isEqualTo(1);
        assertThat(adapter.barCount("GBPUSD", "H1")).isEqualTo(1);
        assertThat(adapter.currentPrice("GBPUSD")).contains(new BigDecimal("1.2700"));
        assertThat(adapter.movingAverage("EURUSD", "H1", MovingAverageType.SMA, 2, 0))
                .hasValueSatisfying(v -> assertThat(v.doubleValue()).isCloseTo(1.1005, within(1e-9)));
    }

    @Test
    void currentPrice_ignoresStaleBars() {
        publish("EURUSD", "H1", 5, "1.1000");
        publish("EURUSD", "H1", 3, "1.3000");

        assertThat(adapter.currentPrice("EURUSD")).contains(new BigDecimal("1.1000"));
    }
}
