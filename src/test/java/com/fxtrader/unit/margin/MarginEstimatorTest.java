package com.fxtrader.unit.margin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fxtrader.domain.model.AccountState;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.MarginEstimate;
import com.fxtrader.exception.ErrorCode;
import com.fxtrader.exception.InsufficientMarginException;
import com.fxtrader.margin.MarginEstimator;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MarginEstimatorTest {

    private MarginEstimator marginEstimator;
    private InstrumentInfo instrument;

    @BeforeEach
    void setUp() {
        marginEstimator = new MarginEstimator();
        instrument = InstrumentInfo.builder()
                .symbol("EURUSD")
                .tickValue(BigDecimal.TEN)
                .marginPerLot(new BigDecimal("100000"))
                .pointSize(new BigDecimal("0.0001"))
                .lotStep(new BigDecimal("0.01"))
                .build();
    }

    private static AccountState account(String equity, String marginUsed) {
        return AccountState.of(
                "TEST", new BigDecimal(equity), new BigDecimal(equity), new BigDecimal(marginUsed), 100, "USD",
                Instant.EPOCH);
    }

    @Test
    void estimate_requiredMarginIsLotsTimesMarginPerLotOverLeverage() {
        MarginEstimate estimate = marginEstimator.estimate(account("10000", "0"), instrument, new BigDecimal("0.20"));

        assertThat(estimate.getRequiredMargin()).isEqualByComparingTo("200");
        assertThat(estimate.getAvailableMargin()).isEqualByComparingTo("10000");
        assertThat(estimate.isSufficient()).isTrue();
        assertThat(estimate.getShortfall()).isEqualByComparingTo("0");
    }

    @Test
    void estimate_reportsShortfallAgainstFreeMargin() {
        // free margin = 10000 - 9900 = 100
        MarginEstimate estimate =
                marginEstimator.estimate(account("10000", "9900"), instrument, new BigDecimal("0.20"));

        assertThat(estimate.isSufficient()).isFalse();
        assertThat(estimate.getShortfall()).isEqualByComparingTo("100");
    }

    @Test
    void estimate_exactFitIsSufficient() {
        MarginEstimate estimate =
                marginEstimator.estimate(account("10000", "9800"), instrument, new BigDecimal("0.20"));

        assertThat(estimate.isSufficient()).isTrue();
    }

    @Test
    void requireSufficient_throwsWhenShort() {
        assertThatThrownBy(() ->
                        marginEstimator.requireSufficient(account("10000", "9950"), instrument, new BigDecimal("1.00")))
                .isInstanceOf(InsufficientMarginException.class)
                .satisfies(e -> {
                    InsufficientMarginException shortfall = (InsufficientMarginException) e;
                    assertThat(shortfall.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_MARGIN);
                    assertThat(shortfall.getRequired()).isEqualByComparingTo("1000");
                    assertThat(shortfall.getAvailable()).isEqualByComparingTo("50");
                });
    }
}
