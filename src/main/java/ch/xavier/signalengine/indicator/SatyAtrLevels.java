package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ATR levels projected from a session pivot at Fibonacci multiples of one ATR.
 * <p>
 * Sessions are UTC calendar days of {@link Bar#getTime()}. With {@link PivotAnchor#PRIOR_CLOSE} the pivot is the
 * close of the last bar of the previous session, with {@link PivotAnchor#SESSION_OPEN} it is the open of the first
 * bar of the current session. ATR is always read on the last bar before the current session. When the window holds
 * a single session, the previous bar stands in for the previous session.
 */
@Getter
@AllArgsConstructor
public class SatyAtrLevels implements Indicator<SatyAtrLevels.Result> {
    private static final long SECONDS_PER_DAY = 86_400L;

    private final int atrPeriod;
    private final PivotAnchor anchor;

    public SatyAtrLevels() {
        this(14, PivotAnchor.PRIOR_CLOSE);
    }

    public enum PivotAnchor {
        PRIOR_CLOSE, SESSION_OPEN
    }

    @Getter
    @AllArgsConstructor
    public enum FibLevel {
        TRIGGER(0.236),
        GOLDEN(0.618),
        FULL(1.0),
        EXTENSION(1.236),
        GOLDEN_EXTENSION(1.618);

        private final double multiple;
    }

    @Override
    public Result calculate(List<Bar> bars) {
        if (bars.isEmpty()) {
            return Result.empty();
        }
        double[] atr = SeriesMath.averageTrueRange(bars, atrPeriod);
        int last = bars.size() - 1;
        return resultAt(bars, atr, last, sessionStart(bars, last));
    }

    /**
     * One result per bar, each equal to {@link #calculate(List)} on the prefix ending at that bar.
     */
    public Result[] calculateAll(List<Bar> bars) {
        Result[] out = new Result[bars.size()];
        if (bars.isEmpty()) {
            return out;
        }
        double[] atr = SeriesMath.averageTrueRange(bars, atrPeriod);
        int sessionStart = 0;
        for (int i = 0; i < bars.size(); i++) {
            if (i > 0 && sessionDay(bars.get(i)) != sessionDay(bars.get(i - 1))) {
                sessionStart = i;
            }
            out[i] = resultAt(bars, atr, i, sessionStart);
        }
        return out;
    }

    private Result resultAt(List<Bar> bars, double[] atr, int index, int sessionStart) {
        int atrIndex = sessionStart > 0 ? sessionStart - 1 : index - 1;
        if (atrIndex < 0 || !SeriesMath.isDefined(atr[atrIndex]) || atr[atrIndex] <= 0) {
            return Result.empty();
        }

        double pivot = anchor == PivotAnchor.SESSION_OPEN
                ? bars.get(sessionStart).getOpen()
                : bars.get(atrIndex).getClose();
        double range = atr[atrIndex];

        Map<FibLevel, Level> levels = new EnumMap<>(FibLevel.class);
        for (FibLevel fib : FibLevel.values()) {
            double offset = fib.getMultiple() * range;
            levels.put(fib, new Level(pivot + offset, pivot - offset));
        }

        double close = bars.get(index).getClose();
        double trigger = FibLevel.TRIGGER.getMultiple() * range;
        Direction direction = Direction.NONE;
        if (close >= pivot + trigger) {
            direction = Direction.LONG;
        } else if (close <= pivot - trigger) {
            direction = Direction.SHORT;
        }

        return new Result(pivot, range, Math.abs(close - pivot) / range, Collections.unmodifiableMap(levels), direction);
    }

    private static int sessionStart(List<Bar> bars, int index) {
        long day = sessionDay(bars.get(index));
        int start = index;
        while (start > 0 && sessionDay(bars.get(start - 1)) == day) {
            start--;
        }
        return start;
    }

    private static long sessionDay(Bar bar) {
        return Math.floorDiv(bar.getTime(), SECONDS_PER_DAY);
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class Level {
        private final double up;
        private final double down;
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class Result {
        private final double pivot;
        private final double atr;
        private final double rangeUsed;
        private final Map<FibLevel, Level> levels;
        private final Direction direction;

        public static Result empty() {
            return new Result(SeriesMath.UNDEFINED, SeriesMath.UNDEFINED, SeriesMath.UNDEFINED,
                    Collections.emptyMap(), Direction.NONE);
        }

        public boolean isDefined() {
            return !levels.isEmpty();
        }
    }
}
