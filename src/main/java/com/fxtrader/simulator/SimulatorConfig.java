package com.fxtrader.simulator;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Paper venue settings. Properties prefix: {@code fxtrader.simulator.*}.
 *
 * <p>The replay file is a classpath resource with a header row and the columns
 * {@code timestamp,open,high,low,close,volume}; timestamps use ISO local date-time.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fxtrader.simulator")
public class SimulatorConfig {

    /** Classpath location of the bar file. Blank disables replay. */
    private String replayFile = "bars/EURUSD_H1.csv";

    /** Delay between replayed bars. */
    @Min(1)
    private long replayIntervalMs = 1000;

    /** Market-order slippage in points, applied against the trader. */
    @Min(0)
    private int slippagePoints = 0;
}
