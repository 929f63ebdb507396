package com.fxtrader.exit;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Stop-loss / take-profit model and open-position protection settings.
 * Properties prefix: {@code fxtrader.exit.*}.
 *
 * <p>Hybrid weights need not sum to 1; the hybrid level divides by their sum. Typical values
 * lie between 0.3 and 0.7.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fxtrader.exit")
public class ExitLevelConfig {

    // ---- ATR model ----

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal slMultiplier = new BigDecimal("8.5");

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal tpMultiplier = new BigDecimal("8.0");

    // ---- Price-structure model ----

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal slBufferMultiplier = new BigDecimal("1.0");

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal tpBufferMultiplier = new BigDecimal("1.5");

    /** Upper bound on either buffer, in pips. */
    @NotNull
    @DecimalMin("0.0")
    private BigDecimal maxBufferPips = new BigDecimal("50");

    // ---- Hybrid blend ----

    private boolean hybridEnabled = true;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal atrWeight = new BigDecimal("0.5");

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal pivotWeight = new BigDecimal("0.5");

    // ---- Open-position protection ----

    private boolean trailingEnabled = false;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal trailingAtrMultiplier = new BigDecimal("3.0");

    private boolean breakevenEnabled = false;

    /** Profit in pips at which the stop moves to breakeven. */
    @NotNull
    @DecimalMin("0.0")
    private BigDecimal breakevenActivationPips = new BigDecimal("30");

    /** Pips beyond the entry price the breakeven stop is placed at. */
    @NotNull
    @DecimalMin("0.0")
    private BigDecimal breakevenOffsetPips = new BigDecimal("5");
}
