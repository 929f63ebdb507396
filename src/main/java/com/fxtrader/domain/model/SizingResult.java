package com.fxtrader.domain.model;

import com.fxtrader.exception.SizingRejectedException;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Output of the position sizer.
 *
 * <p>{@code capped} is true when the requested risk could not be fully honored, either
 * because free margin limited the size or because the min/max lot bounds clamped it.
 * A rejected result has zero lots and a non-null {@code rejectionReason}.
 */
@Value
@Builder
public class SizingResult {

    BigDecimal lots;
    boolean capped;
    String rejectionReason;

    BigDecimal riskAmount;
    BigDecimal pipValue;
    BigDecimal rawLots;

    /** Lots the free margin can support. Null when the instrument has no margin requirement. */
    BigDecimal marginCapLots;

    public static SizingResult rejected(String reason) {
        return SizingResult.builder()
                .lots(BigDecimal.ZERO)
                .capped(false)
                .rejectionReason(reason)
                .build();
    }

    public boolean isRejected() {
        return rejectionReason != null || lots == null || lots.signum() <= 0;
    }

    /**
     * Returns the lot size, or throws if this result cannot be traded.
     *
     * @throws SizingRejectedException when the result is rejected or zero
     */
    public BigDecimal requireUsableLots() {
        if (isRejected()) {
            throw new SizingRejectedException(rejectionReason != null ? rejectionReason : "Computed size is zero");
        }
        return lots;
    }
}
