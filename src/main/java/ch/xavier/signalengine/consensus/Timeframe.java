package ch.xavier.signalengine.consensus;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum Timeframe {
    ONE_MINUTE("1Min"),
    FIVE_MINUTES("5Min"),
    FIFTEEN_MINUTES("15Min"),
    ONE_HOUR("1Hour"),
    ONE_DAY("1Day");

    private final String label;

    /**
     * Lenient parsing of the usual spellings ("5m", "5min", "1h", "1d", "day"). Anything unrecognised falls back to
     * one minute.
     */
    public static Timeframe parse(String value) {
        if (value == null) {
            return ONE_MINUTE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "5m", "5min" -> FIVE_MINUTES;
            case "15m", "15min" -> FIFTEEN_MINUTES;
            case "1h", "60m", "1hour", "60min" -> ONE_HOUR;
            case "1d", "d", "day", "1day" -> ONE_DAY;
            default -> ONE_MINUTE;
        };
    }

    /**
     * Next slower timeframe used to confirm this one.
     */
    public Optional<Timeframe> secondary() {
        return switch (this) {
            case ONE_MINUTE -> Optional.of(FIVE_MINUTES);
            case FIVE_MINUTES -> Optional.of(FIFTEEN_MINUTES);
            case FIFTEEN_MINUTES -> Optional.of(ONE_HOUR);
            case ONE_HOUR, ONE_DAY -> Optional.empty();
        };
    }
}
