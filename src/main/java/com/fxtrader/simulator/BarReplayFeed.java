package com.fxtrader.simulator;

import com.fxtrader.domain.model.MarketData;
import com.fxtrader.engine.TradingConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the paper venue from a CSV bar file, one bar per tick of the replay schedule.
 *
 * <p>The file is read lazily on the first tick after the venue session opens. Rows that do
 * not parse are skipped with a warning. Replay stops at the end of the file.
 */
@Component
public class BarReplayFeed {

    private static final Logger log = LoggerFactory.getLogger(BarReplayFeed.class);

    private final SimulatorBrokerGateway simulatorBrokerGateway;
    private final SimulatorConfig simulatorConfig;
    private final TradingConfig tradingConfig;

    private List<MarketData> bars;
    private int cursor;
    private boolean finished;

    public BarReplayFeed(
            SimulatorBrokerGateway simulatorBrokerGateway,
            SimulatorConfig simulatorConfig,
            TradingConfig tradingConfig) {
        this.simulatorBrokerGateway = simulatorBrokerGateway;
        this.simulatorConfig = simulatorConfig;
        this.tradingConfig = tradingConfig;
    }

    @Scheduled(fixedDelayString = "${fxtrader.simulator.replay-interval-ms:1000}")
    public synchronized void replayNext() {
        if (finished || !simulatorBrokerGateway.isConnected()) {
            return;
        }
        if (bars == null) {
            if (simulatorConfig.getReplayFile() == null || simulatorConfig.getReplayFile().isBlank()) {
                finished = true;
                log.info("Bar replay disabled: no replay file configured");
                return;
            }
            try {
                bars = load(new ClassPathResource(simulatorConfig.getReplayFile()));
            } catch (UncheckedIOException e) {
                finished = true;
                log.error("Bar replay stopped: {}", e.getMessage(), e);
                return;
            }
            log.info("Loaded {} bars from {}", bars.size(), simulatorConfig.getReplayFile());
        }
        if (cursor >= bars.size()) {
            finished = true;
            log.info("Bar replay complete: {} bars published", bars.size());
            return;
        }
        simulatorBrokerGateway.publishBar(bars.get(cursor++));
    }

    /** Parses {@code timestamp,open,high,low,close,volume} rows after a header line. */
    List<MarketData> load(Resource resource) {
        List<MarketData> parsed = new ArrayList<>();
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] columns = line.split(",");
                if (columns.length < 6) {
                    log.warn("Skipping bar file line {}: expected 6 columns, got {}", lineNumber, columns.length);
                    continue;
                }
                try {
                    parsed.add(MarketData.builder()
                            .symbol(tradingConfig.getSymbol())
                            .timeframe(tradingConfig.getTimeframe())
                            .timestamp(LocalDateTime.parse(columns[0].trim()))
                            .open(new BigDecimal(columns[1].trim()))
                            .high(new BigDecimal(columns[2].trim()))
                            .low(new BigDecimal(columns[3].trim()))
                            .close(new BigDecimal(columns[4].trim()))
                            .volume(Long.parseLong(columns[5].trim()))
                            .build());
                } catch (DateTimeParseException | NumberFormatException e) {
                    log.warn("Skipping bar file line {}: {}", lineNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bar file " + resource.getDescription(), e);
        }
        return parsed;
    }
}
