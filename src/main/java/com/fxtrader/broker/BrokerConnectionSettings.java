package com.fxtrader.broker;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Venue connection and account settings.
 *
 * <p>Properties prefix: {@code fxtrader.broker.*}. The paper venue uses
 * {@code startingBalance}, {@code leverage} and {@code currency} to open its virtual
 * account; credentials and server address are only meaningful for a live venue.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "fxtrader.broker")
public class BrokerConnectionSettings {

    @NotBlank
    private String accountId = "PAPER-001";

    private String apiKey;
    private String secretKey;
    private boolean demo = true;
    private String serverAddress = "localhost";

    @Min(0)
    private int serverPort = 443;

    @NotNull
    @Positive
    private BigDecimal startingBalance = new BigDecimal("10000");

    @Positive
    private int leverage = 100;

    @NotBlank
    private String currency = "USD";

    /** Filled, rejected and cancelled orders kept for lookup; older ones are dropped. */
    @Min(1)
    private int orderHistoryLimit = 500;

    /** Connect and subscribe once the application is ready. */
    private boolean autoConnect = true;
}
