package com.fxtrader.margin;

import com.fxtrader.domain.model.AccountState;
import com.fxtrader.domain.model.InstrumentInfo;
import com.fxtrader.domain.model.SizingResult;
import java.math.BigDecimal;

/**
 * Converts a risk budget into a lot size for a new trade.
 *
 * <p>Implementations must respect the margin constraint: whatever the risk formula produces is
 * capped at what the account's free margin can carry, then bounded by {@code [minLot, maxLot]}.
 * Sizing does not fail on degenerate instrument data; it recovers with a safe default and the
 * margin pre-check before submission decides whether the order is affordable.
 */
public interface PositionSizer {

    /**
     * @param account              snapshot of the account for this cycle
     * @param instrument           reference data of the traded symbol
     * @param riskPercent          share of the balance to risk, in percent
     * @param stopLossDistancePips stop distance the risk is measured against, in pips
     * @param minLot               smallest lot size to return
     * @param maxLot               largest lot size to return
     * @return the sized result; rejected only when the account cannot be sized at all
     */
    SizingResult size(
            AccountState account,
            InstrumentInfo instrument,
            BigDecimal riskPercent,
            BigDecimal stopLossDistancePips,
            BigDecimal minLot,
            BigDecimal maxLot);
}
