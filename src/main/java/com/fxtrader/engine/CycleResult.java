package com.fxtrader.engine;

import com.fxtrader.domain.enums.SignalIntent;
import com.fxtrader.domain.model.ExitLevels;
import com.fxtrader.domain.model.SizingResult;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one {@link TradeOrchestrator#runCycle} pass. Fields past {@code reason} are filled
 * in as far as the cycle got: a NO_SIGNAL result carries sizing and exit levels but no order id.
 */
@Value
@Builder
public class CycleResult {

    CycleOutcome outcome;
    String reason;
    String orderId;
    SignalIntent intent;
    SizingResult sizing;
    ExitLevels exitLevels;

    public static CycleResult of(CycleOutcome outcome, String reason) {
        return CycleResult.builder().outcome(outcome).reason(reason).build();
    }

    public boolean isOrderPlaced() {
        return outcome == CycleOutcome.ORDER_PLACED;
    }
}
