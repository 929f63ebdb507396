package com.fxtrader.broker;

import com.fxtrader.engine.TradingConfig;
import com.fxtrader.exception.BrokerConnectionException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Opens the broker session once the application has fully started and subscribes to the
 * configured symbol and timeframe. Closes the session on shutdown.
 *
 * <p>Does nothing at startup when {@code fxtrader.broker.auto-connect} is false. If the
 * connection fails the application keeps running disconnected; every trade cycle then ends
 * with NOT_CONNECTED.
 */
@Component
public class BrokerSessionRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(BrokerSessionRunner.class);

    private final BrokerGateway brokerGateway;
    private final BrokerConnectionSettings settings;
    private final TradingConfig tradingConfig;

    public BrokerSessionRunner(
            BrokerGateway brokerGateway, BrokerConnectionSettings settings, TradingConfig tradingConfig) {
        this.brokerGateway = brokerGateway;
        this.settings = settings;
        this.tradingConfig = tradingConfig;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!settings.isAutoConnect()) {
            log.info("Auto-connect disabled; broker session not opened");
            return;
        }
        try {
            brokerGateway.connect(settings);
            brokerGateway.subscribeToMarketData(tradingConfig.getSymbol(), tradingConfig.getTimeframe());
            log.info(
                    "Broker session open for account {}, trading {} {}",
                    settings.getAccountId(),
                    tradingConfig.getSymbol(),
                    tradingConfig.getTimeframe());
        } catch (BrokerConnectionException e) {
            log.error("Broker connection failed, running disconnected: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (brokerGateway.isConnected()) {
            log.info("Closing broker session");
            brokerGateway.disconnect();
        }
    }
}
