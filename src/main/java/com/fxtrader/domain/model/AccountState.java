package com.fxtrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the trading account as last reported by the venue.
 *
 * <p>Owned by the broker gateway and replaced wholesale on every account-update venue
 * event. Everything else (position sizer, margin estimator, drawdown guard) reads a
 * snapshot per cycle and never keeps it across cycles.
 *
 * <p>Invariants: {@code equity = balance + unrealizedPnl} and
 * {@code freeMargin = equity - marginUsed}. A negative free margin means the account is
 * in a margin-call condition.
 */
@Value
@Builder(toBuilder = true)
public class AccountState {

    String accountId;
    BigDecimal balance;
    BigDecimal equity;
    BigDecimal marginUsed;
    BigDecimal freeMargin;
    BigDecimal unrealizedPnl;

    /** Account leverage, e.g. 100 for 1:100. */
    int leverage;

    String currency;
    Instant updatedAt;

    /** Account state before the venue has reported anything. */
    public static AccountState empty(String accountId, String currency) {
        return AccountState.builder()
                .accountId(accountId)
                .balance(BigDecimal.ZERO)
                .equity(BigDecimal.ZERO)
                .marginUsed(BigDecimal.ZERO)
                .freeMargin(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .leverage(1)
                .currency(currency)
                .updatedAt(Instant.EPOCH)
                .build();
    }

    /** Builds a snapshot from the venue's raw figures, deriving free margin and unrealized P&L. */
    public static AccountState of(
            String accountId,
            BigDecimal balance,
            BigDecimal equity,
            BigDecimal marginUsed,
            int leverage,
            String currency,
            Instant updatedAt) {
        return AccountState.builder()
                .accountId(accountId)
                .balance(balance)
                .equity(equity)
                .marginUsed(marginUsed)
                .freeMargin(equity.subtract(marginUsed))
                .unrealizedPnl(equity.subtract(balance))
                .leverage(leverage)
                .currency(currency)
                .updatedAt(updatedAt)
                .build();
    }

    public boolean isMarginCall() {
        return freeMargin.signum() < 0;
    }
}
