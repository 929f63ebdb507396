package com.fxtrader.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;

import com.fxtrader.domain.enums.SignalIntent;
import com.fxtrader.domain.enums.SignalMode;
import com.fxtrader.signal.SignalConfig;
import com.fxtrader.signal.SignalEvaluator;
import com.fxtrader.signal.SignalInput;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SignalEvaluatorTest {

    private SignalConfig signalConfig;
    private SignalEvaluator signalEvaluator;

    @BeforeEach
    void setUp() {
        signalConfig = new SignalConfig();
        signalEvaluator = new SignalEvaluator(signalConfig);
    }

    private static SignalInput oscillatorInput(String price, String ma, String cci) {
        return SignalInput.builder()
                .price(new BigDecimal(price))
                .movingAverage(new BigDecimal(ma))
                .cci(new BigDecimal(cci))
                .build();
    }

    private static SignalInput crossoverInput(String prevPrice, String prevMa, String price, String ma) {
        return SignalInput.builder()
                .previousPrice(new BigDecimal(prevPrice))
                .previousMovingAverage(new BigDecimal(prevMa))
                .price(new BigDecimal(price))
                .movingAverage(new BigDecimal(ma))
                .build();
    }

    // ==============================
    // OSCILLATOR MODE
    // ==============================

    @Nested
    @DisplayName("Oscillator mode")
    class Oscillator {

        @Test
        @DisplayName("Oversold CCI in an uptrend -> LONG")
        void oversoldInUptrend() {
            assertThat(signalEvaluator.evaluate(oscillatorInput("1.1050", "1.1000", "-150")))
                    .isEqualTo(SignalIntent.LONG);
        }

        @Test
        @DisplayName("Overbought CCI in a downtrend -> SHORT")
        void overboughtInDowntrend() {
            assertThat(signalEvaluator.evaluate(oscillatorInput("1.0950", "1.1000", "150")))
                    .isEqualTo(SignalIntent.SHORT);
        }

        @Test
        @DisplayName("Shorts disabled -> overbought downtrend gives NONE")
        void shortsDisabled() {
            signalConfig.setAllowShort(false);

            assertThat(signalEvaluator.evaluate(oscillatorInput("1.0950", "1.1000", "150")))
                    .isEqualTo(SignalIntent.NONE);
        }

        @Test
        @DisplayName("Oversold CCI against the trend -> NONE")
        void oversoldInDowntrend() {
            assertThat(signalEvaluator.evaluate(oscillatorInput("1.0950", "1.1000", "-150")))
                    .isEqualTo(SignalIntent.NONE);
        }

        @Test
        @DisplayName("CCI exactly at the threshold does not trigger")
        void thresholdIsExclusive() {
            assertThat(signalEvaluator.evaluate(oscillatorInput("1.1050", "1.1000", "-100")))
                    .isEqualTo(SignalIntent.NONE);
        }

        @Test
        @DisplayName("Missing CCI -> NONE")
        void missingCci() {
            SignalInput input = SignalInput.builder()
                    .price(new BigDecimal("1.1050"))
                    .movingAverage(new BigDecimal("1.1000"))
                    .build();

            assertThat(signalEvaluator.evaluate(input)).isEqualTo(SignalIntent.NONE);
        }
    }

    // ==============================
    // CROSSOVER MODE
    // ==============================

    @Nested
    @DisplayName("Crossover mode")
    class Crossover {

        @BeforeEach
        void setUp() {
            signalConfig.setMode(SignalMode.CROSSOVER);
        }

        @Test
        @DisplayName("Price crossing above the average -> LONG")
        void crossAbove() {
            assertThat(signalEvaluator.evaluate(crossoverInput("1.0990", "1.1000", "1.1010", "1.1000")))
                    .isEqualTo(SignalIntent.LONG);
        }

        @Test
        @DisplayName("Previous close touching the average counts as below")
        void touchThenCross() {
            assertThat(signalEvaluator.evaluate(crossoverInput("1.1000", "1.1000", "1.1010", "1.1002")))
                    .isEqualTo(SignalIntent.LONG);
        }

        @Test
        @DisplayName("Already above -> NONE")
        void alreadyAbove() {
            assertThat(signalEvaluator.evaluate(crossoverInput("1.1010", "1.1000", "1.1020", "1.1000")))
                    .isEqualTo(SignalIntent.NONE);
        }

        @Test
        @DisplayName("Crossing below never gives SHORT")
        void crossBelowIsNone() {
            assertThat(signalEvaluator.evaluate(crossoverInput("1.1010", "1.1000", "1.0990", "1.1000")))
                    .isEqualTo(SignalIntent.NONE);
        }

        @Test
        @DisplayName("Missing previous values -> NONE")
        void missingPrevious() {
            SignalInput input = SignalInput.builder()
                    .price(new BigDecimal("1.1010"))
                    .movingAverage(new BigDecimal("1.1000"))
                    .build();

            assertThat(signalEvaluator.evaluate(input)).isEqualTo(SignalIntent.NONE);
        }
    }
}
