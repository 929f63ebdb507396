package com.fxtrader.margin;

import com.fxtrader.domain.model.AccountState;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.MarginEstimate;
import com.fxtrader.exception.InsufficientMarginException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Estimates the margin a proposed order would block, before it is submitted.
 *
 * <p>Required margin is {@code lots * marginPerLot / leverage}; it is compared against the
 * account's free margin. The trade cycle calls {@link #requireSufficient} before submitting and
 * turns the {@link InsufficientMarginException} into an INSUFFICIENT_MARGIN outcome.
 */
@Service
public class MarginEstimator {

    private static final Logger log = LoggerFactory.getLogger(MarginEstimator.class);

    public MarginEstimate estimate(AccountState account, InstrumentInfo instrument, BigDecimal lots) {
        BigDecimal requiredMargin = account.getLeverage() > 0
                ? lots.multiply(instrument.getMarginPerLot())
                        .divide(BigDecimal.valueOf(account.getLeverage()), 2, RoundingMode.HALF_UP)
                : lots.multiply(instrument.getMarginPerLot());
        BigDecimal availableMargin = account.getFreeMargin();
        boolean sufficient = availableMargin.compareTo(requiredMargin) >= 0;

        MarginEstimate estimate = MarginEstimate.builder()
                .requiredMargin(requiredMargin)
                .availableMargin(availableMargin)
                .sufficient(sufficient)
                .shortfall(sufficient ? BigDecimal.ZERO : requiredMargin.subtract(availableMargin))
                .build();

        log.debug(
                "Margin estimate {} {} lots: required {}, available {}",
                instrument.getSymbol(),
                lots,
                requiredMargin,
                availableMargin);
        return estimate;
    }

    /**
     * @throws InsufficientMarginException if free margin does not cover the order
     */
    public MarginEstimate requireSufficient(AccountState account, InstrumentInfo instrument, BigDecimal lots) {
        MarginEstimate estimate = estimate(account, instrument, lots);
        if (!estimate.isSufficient()) {
            throw new InsufficientMarginException(estimate.getRequiredMargin(), estimate.getAvailableMargin());
        }
        return estimate;
    }
}
