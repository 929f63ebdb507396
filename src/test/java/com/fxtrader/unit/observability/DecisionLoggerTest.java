package com.fxtrader.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.fxtrader.domain.enums.DecisionLevel;
import com.fxtrader.domain.model.DecisionRecord;
import com.fxtrader.observability.DecisionLogger;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.springframework.test.util.ReflectionTestUtils;

class DecisionLoggerTest {

    private DecisionLogger decisionLogger;

    @BeforeEach
    void setUp() {
        decisionLogger = new DecisionLogger(Clock.fixed(Instant.parse("2024-03-04T10:15:30Z"), ZoneOffset.UTC));
    }

    @Test
    void records_areTimestampedAndNewestFirst() {
        decisionLogger.info("EURUSD", "first");
        decisionLogger.error("EURUSD", "second");

        List<DecisionRecord> recent = decisionLogger.getRecentDecisions(10);

        assertThat(recent).extracting(DecisionRecord::getMessage).containsExactly("second", "first");
        assertThat(recent.get(0).getLevel()).isEqualTo(DecisionLevel.ERROR);
        assertThat(recent.get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 4, 10, 15, 30));
    }

    @Test
    void trade_usesFixedFormatWithDashForMissingLevels() {
        decisionLogger.trade(
                "EURUSD", "BUY", new BigDecimal("1.10000"), new BigDecimal("0.20"), new BigDecimal("1.0905"), null);

        DecisionRecord trade = decisionLogger.getRecentDecisions(1, DecisionLevel.TRADE).get(0);

        assertThat(trade.getMessage()).isEqualTo("TRADE [BUY] Price: 1.1, Volume: 0.2, SL: 1.0905, TP: -");
        assertThat(trade.getSymbol()).isEqualTo("EURUSD");
    }

    @Test
    void levelFilter_returnsOnlyMatchingRecords() {
        decisionLogger.info("EURUSD", "a");
        decisionLogger.error("EURUSD", "b");
        decisionLogger.info("EURUSD", "c");

        assertThat(decisionLogger.getRecentDecisions(10, DecisionLevel.INFO))
                .extracting(DecisionRecord::getMessage)
                .containsExactly("c", "a");
    }

    @Test
    void ringBuffer_keepsOnlyTheLatestThousand() {
        for (int i = 0; i < 1005; i++) {
            decisionLogger.info("EURUSD", "decision " + i);
        }

        assertThat(decisionLogger.getBufferSize()).isEqualTo(1000);
        assertThat(decisionLogger.getRecentDecisions(1).get(0).getMessage()).isEqualTo("decision 1004");
    }

    @Test
    void failingSink_neverReachesTheCaller() {
        Logger sink = mock(Logger.class);
        doThrow(new IllegalStateException("disk full")).when(sink).info(anyString(), any(Object[].class));
        doThrow(new IllegalStateException("disk full")).when(sink).error(anyString(), any(Object[].class));
        ReflectionTestUtils.setField(decisionLogger, "sink", sink);

        assertThatCode(() -> decisionLogger.info("EURUSD", "still recorded")).doesNotThrowAnyException();
        assertThatCode(() -> decisionLogger.error("EURUSD", "also recorded")).doesNotThrowAnyException();

        assertThat(decisionLogger.getBufferSize()).isEqualTo(2);
    }
}
