package com.fxtrader.observability;

import com.fxtrader.domain.enums.DecisionLevel;
import com.fxtrader.domain.model.DecisionRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Decision log of the trading engine: every cycle outcome, trade and error, one line each.
 *
 * <p>Lines go to the {@code fxtrader.decisions} logger as {@code LEVEL | SYMBOL | message};
 * {@code logback-spring.xml} routes that logger through a non-blocking async appender to an
 * append-only daily file and adds the timestamp. The last {@value #RING_BUFFER_SIZE} records are
 * also kept in memory, newest first.
 *
 * <p>Writing never fails the caller. If the sink throws, the record is reported through this
 * class's own logger instead.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final String DECISIONS_LOGGER = "fxtrader.decisions";
    static final int RING_BUFFER_SIZE = 1000;

    private final Clock clock;
    private final Logger sink;
    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    @Autowired
    public DecisionLogger(Clock clock) {
        this(clock, LoggerFactory.getLogger(DECISIONS_LOGGER));
    }

    DecisionLogger(Clock clock, Logger sink) {
        this.clock = clock;
        this.sink = sink;
    }

    public void info(String symbol, String message) {
        write(DecisionLevel.INFO, symbol, message);
    }

    public void error(String symbol, String message) {
        write(DecisionLevel.ERROR, symbol, message);
    }

    /**
     * Logs an execution as {@code TRADE [action] Price: p, Volume: v, SL: s, TP: t}.
     * Missing protective levels are written as {@code -}.
     */
    public void trade(
            String symbol,
            String action,
            BigDecimal price,
            BigDecimal volume,
            BigDecimal stopLoss,
            BigDecimal takeProfit) {
        String message = String.format(
                "TRADE [%s] Price: %s, Volume: %s, SL: %s, TP: %s",
                action,
                plain(price),
                plain(volume),
                plain(stopLoss),
                plain(takeProfit));
        write(DecisionLevel.TRADE, symbol, message);
    }

    /** Most recent records first. */
    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionLevel level) {
        return ringBuffer.stream()
                .filter(r -> r.getLevel() == level)
                .limit(count)
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    private void write(DecisionLevel level, String symbol, String message) {
        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(LocalDateTime.now(clock))
                .level(level)
                .symbol(symbol)
                .message(message)
                .build();

        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        try {
            if (level == DecisionLevel.ERROR) {
                sink.error("{} | {} | {}", level, symbol, message);
            } else {
                sink.info("{} | {} | {}", level, symbol, message);
            }
        } catch (RuntimeException e) {
            // Decision log must never block the trading path
            logger.warn("Decision log write failed ({}): {} | {} | {}", e.getMessage(), level, symbol, message);
        }
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.stripTrailingZeros().toPlainString() : "-";
    }
}
