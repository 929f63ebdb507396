package com.fxtrader.engine;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * What the engine trades and when.
 *
 * <p>Properties prefix: {@code fxtrader.trading.*}. The instrument map holds the reference
 * data the sizer and exit calculator need, keyed by symbol.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fxtrader.trading")
public class TradingConfig {

    /** Master switch. When false, market data is still tracked but no cycle runs. */
    private boolean enabled = true;

    @NotBlank
    private String symbol = "EURUSD";

    @NotBlank
    private String timeframe = "H1";

    /** Venue-local start of the session window, {@code HH:mm}. Null disables the window. */
    @DateTimeFormat(pattern = "HH:mm")
    private LocalTime sessionStart;

    @DateTimeFormat(pattern = "HH:mm")
    private LocalTime sessionEnd;

    /** Drawdown from the starting balance, in percent, at which new entries stop. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private BigDecimal maxDrawdownPercent = new BigDecimal("20.0");

    @Valid
    private Map<String, InstrumentProperties> instruments = new LinkedHashMap<>();

    @Data
    public static class InstrumentProperties {

        private BigDecimal tickValue;
        private BigDecimal marginPerLot;
        private BigDecimal pointSize;
        private BigDecimal lotStep = new BigDecimal("0.01");
    }
}
