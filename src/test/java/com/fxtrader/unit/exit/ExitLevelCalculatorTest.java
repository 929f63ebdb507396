package com.fxtrader.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;

import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.model.ExitLevels;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.exit.ExitLevelCalculator;
import com.fxtrader.exit.ExitLevelConfig;
import com.fxtrader.exit.ExitParams;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExitLevelCalculatorTest {

    private static final BigDecimal PRICE = new BigDecimal("1.1000");
    private static final BigDecimal ATR = new BigDecimal("0.0020");

    private ExitLevelCalculator calculator;
    private ExitLevelConfig config;
    private InstrumentInfo instrument;

    @BeforeEach
    void setUp() {
        calculator = new ExitLevelCalculator();
        config = new ExitLevelConfig();
        instrument = InstrumentInfo.builder()
                .symbol("EURUSD")
                .tickValue(BigDecimal.TEN)
                .marginPerLot(new BigDecimal("100000"))
                .pointSize(new BigDecimal("0.0001"))
                .lotStep(new BigDecimal("0.01"))
                .build();
    }

    private ExitLevels compute(BigDecimal atr, PositionType direction) {
        return calculator.compute(PRICE, atr, direction, ExitParams.from(config, instrument));
    }

    // ==============================
    // ATR MODEL
    // ==============================

    @Nested
    @DisplayName("ATR levels")
    class AtrLevels {

        @Test
        @DisplayName("LONG: ATR 0.0020 at 1.1000 with 8.5/8.0 multipliers -> 1.0830 / 1.1160")
        void longExample() {
            ExitLevels levels = compute(ATR, PositionType.LONG);

            assertThat(levels.getAtrStop()).isEqualByComparingTo("1.0830");
            assertThat(levels.getAtrTarget()).isEqualByComparingTo("1.1160");
            assertThat(levels.getDirection()).isEqualTo(PositionType.LONG);
        }

        @Test
        @DisplayName("SHORT mirrors LONG around the price")
        void shortMirrored() {
            ExitLevels levels = compute(ATR, PositionType.SHORT);

            assertThat(levels.getAtrStop()).isEqualByComparingTo("1.1170");
            assertThat(levels.getAtrTarget()).isEqualByComparingTo("1.0840");
        }

        @Test
        @DisplayName("Negative ATR is treated as zero: every level equals the price")
        void negativeAtrClampedToZero() {
            ExitLevels levels = compute(new BigDecimal("-0.0050"), PositionType.LONG);

            assertThat(levels.getAtrStop()).isEqualByComparingTo(PRICE);
            assertThat(levels.getAtrTarget()).isEqualByComparingTo(PRICE);
            assertThat(levels.getHybridStop()).isEqualByComparingTo(PRICE);
            assertThat(levels.getBufferStop()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Same inputs always give the same levels")
        void deterministic() {
            assertThat(compute(ATR, PositionType.LONG)).isEqualTo(compute(ATR, PositionType.LONG));
        }
    }

    // ==============================
    // BUFFERS AND HYBRID
    // ==============================

    @Nested
    @DisplayName("Buffers and hybrid blend")
    class HybridBlend {

        @Test
        @DisplayName("Equal weights average the ATR and price-structure levels")
        void equalWeightsAverage() {
            ExitLevels levels = compute(ATR, PositionType.LONG);

            // buffers 0.0020 / 0.0030 -> pivot levels 1.0980 / 1.1030
            assertThat(levels.getBufferStop()).isEqualByComparingTo("0.0020");
            assertThat(levels.getBufferTarget()).isEqualByComparingTo("0.0030");
            assertThat(levels.getHybridStop()).isEqualByComparingTo("1.0905");
            assertThat(levels.getHybridTarget()).isEqualByComparingTo("1.1095");
        }

        @Test
        @DisplayName("Buffers never exceed maxBufferPips * pointSize")
        void bufferCap() {
            for (String atr : new String[] {"0.0010", "0.0100", "0.5000", "12"}) {
                ExitLevels levels = compute(new BigDecimal(atr), PositionType.LONG);

                assertThat(levels.getBufferStop()).isLessThanOrEqualTo(new BigDecimal("0.0050"));
                assertThat(levels.getBufferTarget()).isLessThanOrEqualTo(new BigDecimal("0.0050"));
            }
        }

        @Test
        @DisplayName("Hybrid level lies between the ATR level and the price-structure level")
        void hybridBetweenComponents() {
            config.setAtrWeight(new BigDecimal("0.3"));
            config.setPivotWeight(new BigDecimal("0.7"));

            for (PositionType direction : PositionType.values()) {
                ExitLevels levels = compute(new BigDecimal("0.0040"), direction);
                BigDecimal sign = BigDecimal.valueOf(direction.sign());
                BigDecimal pivotStop = PRICE.subtract(sign.multiply(levels.getBufferStop()));
                BigDecimal pivotTarget = PRICE.add(sign.multiply(levels.getBufferTarget()));

                assertThat(levels.getHybridStop())
                        .isBetween(levels.getAtrStop().min(pivotStop), levels.getAtrStop().max(pivotStop));
                assertThat(levels.getHybridTarget())
                        .isBetween(levels.getAtrTarget().min(pivotTarget), levels.getAtrTarget().max(pivotTarget));
            }
        }

        @Test
        @DisplayName("Weights that do not sum to one are normalized")
        void weightsNormalized() {
            config.setAtrWeight(new BigDecimal("0.4"));
            config.setPivotWeight(new BigDecimal("0.4"));

            assertThat(compute(ATR, PositionType.LONG).getHybridStop()).isEqualByComparingTo("1.0905");
        }

        @Test
        @DisplayName("Hybrid disabled -> hybrid equals the ATR level")
        void hybridDisabled() {
            config.setHybridEnabled(false);

            ExitLevels levels = compute(ATR, PositionType.LONG);

            assertThat(levels.getHybridStop()).isEqualByComparingTo(levels.getAtrStop());
            assertThat(levels.getHybridTarget()).isEqualByComparingTo(levels.getAtrTarget());
        }

        @Test
        @DisplayName("Zero weight sum -> hybrid equals the ATR level")
        void zeroWeightSum() {
            config.setAtrWeight(BigDecimal.ZERO);
            config.setPivotWeight(BigDecimal.ZERO);

            ExitLevels levels = compute(ATR, PositionType.SHORT);

            assertThat(levels.getHybridStop()).isEqualByComparingTo(levels.getAtrStop());
        }
    }
}
