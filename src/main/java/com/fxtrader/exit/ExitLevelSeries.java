package com.fxtrader.exit;

import com.fxtrader.domain.enums.PositionType;
import com.fxtrader.domain.model.ExitLevels;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Exit levels for every sample of a price/ATR series, for one direction.
 *
 * <p>Updated incrementally: each update recomputes from one sample before the previously
 * calculated count (the last sample of the previous update may have been a still-forming bar)
 * to the end. The calculated count is the only state carried between updates.
 */
public class ExitLevelSeries {

    private final ExitLevelCalculator calculator;
    private final PositionType direction;
    private final ExitParams params;
    private final List<ExitLevels> levels = new ArrayList<>();

    public ExitLevelSeries(ExitLevelCalculator calculator, PositionType direction, ExitParams params) {
        this.calculator = calculator;
        this.direction = direction;
        this.params = params;
    }

    /**
     * @param prices               price samples, oldest first
     * @param atrValues            ATR samples aligned with {@code prices}
     * @param previouslyCalculated the value returned by the previous update, 0 on the first
     * @return the number of samples now calculated
     */
    public int update(List<BigDecimal> prices, List<BigDecimal> atrValues, int previouslyCalculated) {
        int total = Math.min(prices.size(), atrValues.size());
        int start = previouslyCalculated > total ? 0 : Math.max(0, previouslyCalculated - 1);

        start = Math.min(start, levels.size());
        levels.subList(start, levels.size()).clear();
        for (int i = start; i < total; i++) {
            levels.add(calculator.compute(prices.get(i), atrValues.get(i), direction, params));
        }
        return total;
    }

    public List<ExitLevels> getLevels() {
        return Collections.unmodifiableList(levels);
    }

    public Optional<ExitLevels> latest() {
        return levels.isEmpty() ? Optional.empty() : Optional.of(levels.get(levels.size() - 1));
    }
}
