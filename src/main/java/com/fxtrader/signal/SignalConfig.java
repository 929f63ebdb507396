package com.fxtrader.signal;

import com.fxtrader.domain.enums.MovingAverageType;
import com.fxtrader.domain.enums.SignalMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Entry-signal and indicator settings. Properties prefix: {@code fxtrader.signal.*}.
 *
 * <p>Defaults: OSCILLATOR mode, SMA(50) trend filter, CCI(14) with +/-100 thresholds, ATR(14).
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fxtrader.signal")
public class SignalConfig {

    @NotNull
    private SignalMode mode = SignalMode.OSCILLATOR;

    @NotNull
    private MovingAverageType maType = MovingAverageType.SMA;

    @Min(1)
    private int maPeriod = 50;

    @Min(2)
    private int cciPeriod = 14;

    @Min(1)
    private int atrPeriod = 14;

    @NotNull
    private BigDecimal cciUpperThreshold = new BigDecimal("100");

    @NotNull
    private BigDecimal cciLowerThreshold = new BigDecimal("-100");

    /** When false, OSCILLATOR mode never produces SHORT. */
    private boolean allowShort = true;

    /** Bars kept per series. */
    @Min(10)
    private int maxBars = 500;
}
