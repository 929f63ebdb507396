package com.fxtrader.margin;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Position sizing parameters. Properties prefix: {@code fxtrader.sizing.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>riskPercent: 1.0 (risk 1% of balance per trade, valid 0.1 to 10)</li>
 *   <li>stopLossPips: 50</li>
 *   <li>minLot / maxLot: 0.10 / 1.00</li>
 *   <li>minPipValue: 0.0001, substituted when tick value times stop distance is not positive</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fxtrader.sizing")
public class PositionSizingConfig {

    @NotNull
    @DecimalMin("0.1")
    @DecimalMax("10.0")
    private BigDecimal riskPercent = new BigDecimal("1.0");

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal stopLossPips = new BigDecimal("50");

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal minLot = new BigDecimal("0.10");

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal maxLot = new BigDecimal("1.00");

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal minPipValue = new BigDecimal("0.0001");
}
