package com.fxtrader.calendar;

import com.fxtrader.engine.TradingConfig;
import java.time.LocalTime;
import org.springframework.stereotype.Component;

/**
 * Daily window in which new entries are allowed, in venue-local time.
 *
 * <p>The window includes its start and excludes its end. A start after the end spans midnight
 * (22:00 to 06:00 allows 23:30 and 05:00). Without both bounds configured, or with equal
 * bounds, trading is always allowed.
 */
@Component
public class TradingSessionWindow {

    private final TradingConfig tradingConfig;

    public TradingSessionWindow(TradingConfig tradingConfig) {
        this.tradingConfig = tradingConfig;
    }

    public boolean isOpenAt(LocalTime time) {
        LocalTime start = tradingConfig.getSessionStart();
        LocalTime end = tradingConfig.getSessionEnd();
        if (start == null || end == null || start.equals(end)) {
            return true;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
