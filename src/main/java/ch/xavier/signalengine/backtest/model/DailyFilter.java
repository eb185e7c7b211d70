package ch.xavier.signalengine.backtest.model;

import java.util.Locale;

public enum DailyFilter {
    NONE, BULL, BEAR;

    public static DailyFilter parse(String value) {
        if (value == null) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "bull" -> BULL;
            case "bear" -> BEAR;
            default -> NONE;
        };
    }
}
