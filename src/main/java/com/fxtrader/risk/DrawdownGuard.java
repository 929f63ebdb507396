package com.fxtrader.risk;

import com.fxtrader.domain.model.AccountState;
import com.fxtrader.engine.TradingConfig;
import com.fxtrader.event.SessionEvent;
import com.fxtrader.event.SessionEventType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Blocks new entries once equity has fallen too far below the starting balance.
 *
 * <p>The reference balance is the first positive balance observed after startup, after
 * {@link #reset()} or after a new broker session opens. Drawdown is
 * {@code (reference - equity) / reference * 100}; the guard trips when it reaches
 * {@code fxtrader.trading.max-drawdown-percent}. A limit of zero disables it.
 *
 * <p>The reference is read and written from the cycle thread and from reset calls, so it is
 * held in an {@link AtomicReference}.
 */
@Component
public class DrawdownGuard {

    private static final Logger log = LoggerFactory.getLogger(DrawdownGuard.class);

    private final TradingConfig tradingConfig;
    private final AtomicReference<BigDecimal> referenceBalance = new AtomicReference<>();

    public DrawdownGuard(TradingConfig tradingConfig) {
        this.tradingConfig = tradingConfig;
    }

    public Optional<RiskViolation> check(AccountState account) {
        BigDecimal limit = tradingConfig.getMaxDrawdownPercent();
        if (limit == null || limit.signum() <= 0) {
            return Optional.empty();
        }
        if (account.getBalance().signum() > 0 && referenceBalance.compareAndSet(null, account.getBalance())) {
            log.info("Drawdown reference balance set to {}", account.getBalance());
        }
        BigDecimal reference = referenceBalance.get();
        if (reference == null) {
            return Optional.empty();
        }

        BigDecimal drawdown = drawdownPercent(reference, account.getEquity());
        if (drawdown.compareTo(limit) >= 0) {
            return Optional.of(RiskViolation.of(
                    "MAX_DRAWDOWN_BREACHED",
                    String.format(
                            "Drawdown %s%% reached limit %s%% (equity %s vs reference %s)",
                            drawdown.toPlainString(), limit.toPlainString(), account.getEquity(), reference)));
        }
        return Optional.empty();
    }

    public Optional<BigDecimal> getReferenceBalance() {
        return Optional.ofNullable(referenceBalance.get());
    }

    public void reset() {
        referenceBalance.set(null);
    }

    @EventListener
    public void onSessionEvent(SessionEvent event) {
        if (event.getEventType() == SessionEventType.SESSION_OPENED) {
            log.info("New broker session for {}; drawdown reference cleared", event.getAccountId());
            reset();
        }
    }

    static BigDecimal drawdownPercent(BigDecimal reference, BigDecimal equity) {
        return reference.subtract(equity)
                .multiply(BigDecimal.valueOf(100))
                .divide(reference, 2, RoundingMode.HALF_UP);
    }
}
