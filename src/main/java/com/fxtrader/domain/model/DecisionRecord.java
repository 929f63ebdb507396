package com.fxtrader.domain.model;

import com.fxtrader.domain.enums.DecisionLevel;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** One line of the decision log, kept in memory for recent-decision queries. */
@Value
@Builder
public class DecisionRecord {

    LocalDateTime timestamp;
    DecisionLevel level;
    String symbol;
    String message;
}
