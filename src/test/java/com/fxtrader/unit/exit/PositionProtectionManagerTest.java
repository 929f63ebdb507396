package com.fxtrader.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fxtrader.broker.BrokerGateway;
import com.fxtrader.domain.enums.PositionStatus;
import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.Position;
import com.fxtrader.exception.PositionNotFoundException;
import com.fxtrader.exit.ExitLevelConfig;
import com.fxtrader.exit.PositionProtectionManager;
import com.fxtrader.indicator.IndicatorAdapter;
import com.fxtrader.observability.DecisionLogger;
import com.fxtrader.service.InstrumentService;
import com.fxtrader.signal.SignalConfig;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PositionProtectionManagerTest {

    private static final InstrumentInfo EURUSD = InstrumentInfo.builder()
            .symbol("EURUSD")
            .tickValue(new BigDecimal("10"))
            .marginPerLot(new BigDecimal("100000"))
            .pointSize(new BigDecimal("0.0001"))
            .lotStep(new BigDecimal("0.01"))
            .build();

    @Mock
    private BrokerGateway brokerGateway;

    @Mock
    private IndicatorAdapter indicatorAdapter;

    @Mock
    private InstrumentService instrumentService;

    @Mock
    private DecisionLogger decisionLogger;

    private ExitLevelConfig exitLevelConfig;
    private PositionProtectionManager manager;

    @BeforeEach
    void setUp() {
        exitLevelConfig = new ExitLevelConfig();
        manager = new PositionProtectionManager(
                brokerGateway,
                indicatorAdapter,
                instrumentService,
                exitLevelConfig,
                new SignalConfig(),
                decisionLogger);
    }

    private static Position position(PositionType type, String entry, String stopLoss) {
        return Position.builder()
                .id("POS-1")
                .symbol("EURUSD")
                .type(type)
                .volume(new BigDecimal("0.20"))
                .entryPrice(new BigDecimal(entry))
                .stopLoss(stopLoss != null ? new BigDecimal(stopLoss) : null)
                .takeProfit(new BigDecimal("1.1200"))
                .status(PositionStatus.OPEN)
                .build();
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    // ==============================
    // TRAILING STOP
    // ==============================

    @Nested
    @DisplayName("ATR trailing stop")
    class Trailing {

        @BeforeEach
        void enableTrailing() {
            exitLevelConfig.setTrailingEnabled(true);
        }

        @Test
        @DisplayName("LONG stop trails 3 ATR below price")
        void longStopTrailsBelowPrice() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", "1.0950"), bd("1.1100"), bd("0.0010"), EURUSD);

            assertThat(stop).hasValueSatisfying(s -> assertThat(s).isEqualByComparingTo("1.1070"));
        }

        @Test
        @DisplayName("SHORT stop trails 3 ATR above price")
        void shortStopTrailsAbovePrice() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.SHORT, "1.1000", "1.1050"), bd("1.0900"), bd("0.0010"), EURUSD);

            assertThat(stop).hasValueSatisfying(s -> assertThat(s).isEqualByComparingTo("1.0930"));
        }

        @Test
        @DisplayName("Stop never loosens")
        void stopNeverLoosens() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", "1.1080"), bd("1.1100"), bd("0.0010"), EURUSD);

            assertThat(stop).isEmpty();
        }

        @Test
        @DisplayName("Position without a stop gets one")
        void positionWithoutStop() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", null), bd("1.1100"), bd("0.0010"), EURUSD);

            assertThat(stop).hasValueSatisfying(s -> assertThat(s).isEqualByComparingTo("1.1070"));
        }

        @Test
        @DisplayName("No ATR yet: nothing to trail")
        void missingAtr() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", "1.0950"), bd("1.1100"), null, EURUSD);

            assertThat(stop).isEmpty();
        }
    }

    // ==============================
    // BREAKEVEN
    // ==============================

    @Nested
    @DisplayName("Breakeven")
    class Breakeven {

        @BeforeEach
        void enableBreakeven() {
            exitLevelConfig.setBreakevenEnabled(true);
        }

        @Test
        @DisplayName("Activates at 30 pips profit, stop at entry + 5 pips")
        void activatesAtThreshold() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", "1.0950"), bd("1.1030"), null, EURUSD);

            assertThat(stop).hasValueSatisfying(s -> assertThat(s).isEqualByComparingTo("1.1005"));
        }

        @Test
        @DisplayName("SHORT breakeven stop sits below entry")
        void shortBreakeven() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.SHORT, "1.1000", "1.1050"), bd("1.0960"), null, EURUSD);

            assertThat(stop).hasValueSatisfying(s -> assertThat(s).isEqualByComparingTo("1.0995"));
        }

        @Test
        @DisplayName("Below activation: stop stays")
        void belowActivation() {
            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", "1.0950"), bd("1.1029"), null, EURUSD);

            assertThat(stop).isEmpty();
        }

        @Test
        @DisplayName("Candidate on the wrong side of price is discarded")
        void wrongSideDiscarded() {
            exitLevelConfig.setBreakevenActivationPips(BigDecimal.ZERO);

            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", "1.0950"), bd("1.1003"), null, EURUSD);

            assertThat(stop).isEmpty();
        }

        @Test
        @DisplayName("Tightest of trailing and breakeven wins")
        void tightestWins() {
            exitLevelConfig.setTrailingEnabled(true);

            Optional<BigDecimal> stop = manager.computeProtectiveStop(
                    position(PositionType.LONG, "1.1000", "1.0950"), bd("1.1100"), bd("0.0010"), EURUSD);

            assertThat(stop).hasValueSatisfying(s -> assertThat(s).isEqualByComparingTo("1.1070"));
        }
    }

    // ==============================
    // PROTECT
    // ==============================

    @Nested
    @DisplayName("protect")
    class Protect {

        @Test
        @DisplayName("Both rules disabled: venue untouched")
        void disabled() {
            assertThat(manager.protect("EURUSD", "H1")).isZero();

            verifyNoInteractions(brokerGateway);
        }

        @Test
        @DisplayName("No open position: nothing to do")
        void noPosition() {
            exitLevelConfig.setTrailingEnabled(true);
            when(brokerGateway.getPosition("EURUSD")).thenReturn(Optional.empty());

            assertThat(manager.protect("EURUSD", "H1")).isZero();

            verify(brokerGateway, never()).modifyPosition(any(), any());
        }

        @Test
        @DisplayName("Moves the stop and keeps the take-profit")
        void movesStop() {
            exitLevelConfig.setTrailingEnabled(true);
            when(brokerGateway.getPosition("EURUSD"))
                    .thenReturn(Optional.of(position(PositionType.LONG, "1.1000", "1.0950")));
            when(indicatorAdapter.currentPrice("EURUSD")).thenReturn(Optional.of(bd("1.1100")));
            when(indicatorAdapter.atr("EURUSD", "H1", 14, 1)).thenReturn(List.of(bd("0.0010")));
            when(instrumentService.getInstrument("EURUSD")).thenReturn(EURUSD);
            when(brokerGateway.modifyPosition(eq("EURUSD"), any())).thenReturn(true);

            assertThat(manager.protect("EURUSD", "H1")).isEqualTo(1);

            verify(brokerGateway)
                    .modifyPosition(
                            eq("EURUSD"),
                            argThat(r -> r.getStopLoss().compareTo(bd("1.1070")) == 0
                                    && r.getTakeProfit().compareTo(bd("1.1200")) == 0));
            verify(decisionLogger).info("EURUSD", "Stop moved from 1.095 to 1.107 at price 1.11");
        }

        @Test
        @DisplayName("Venue failure is logged, not thrown")
        void venueFailure() {
            exitLevelConfig.setTrailingEnabled(true);
            when(brokerGateway.getPosition("EURUSD"))
                    .thenReturn(Optional.of(position(PositionType.LONG, "1.1000", "1.0950")));
            when(indicatorAdapter.currentPrice("EURUSD")).thenReturn(Optional.of(bd("1.1100")));
            when(indicatorAdapter.atr("EURUSD", "H1", 14, 1)).thenReturn(List.of(bd("0.0010")));
            when(instrumentService.getInstrument("EURUSD")).thenReturn(EURUSD);
            when(brokerGateway.modifyPosition(eq("EURUSD"), any())).thenThrow(new PositionNotFoundException("EURUSD"));

            assertThat(manager.protect("EURUSD", "H1")).isZero();

            verify(decisionLogger).error(eq("EURUSD"), startsWith("Position protection failed"));
        }
    }
}
