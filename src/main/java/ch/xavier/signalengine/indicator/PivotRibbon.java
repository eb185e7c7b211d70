package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Three-EMA ribbon (8/21/34 by default). A bar is bullish when the EMAs are stacked fast &gt; mid &gt; slow, the
 * mid EMA is not falling and price closes above the slow EMA; bearish is the mirror image; anything else,
 * including warmup, is neutral.
 */
@Getter
@AllArgsConstructor
public class PivotRibbon implements Indicator<PivotRibbon.Result> {
    private final int fastPeriod;
    private final int midPeriod;
    private final int slowPeriod;

    public PivotRibbon() {
        this(8, 21, 34);
    }

    @Override
    public Result calculate(List<Bar> bars) {
        double[] close = Bars.closes(bars);
        double[] fast = SeriesMath.ema(close, fastPeriod);
        double[] mid = SeriesMath.ema(close, midPeriod);
        double[] slow = SeriesMath.ema(close, slowPeriod);

        Trend[] states = new Trend[close.length];
        for (int i = 0; i < close.length; i++) {
            states[i] = classify(i, close, fast, mid, slow);
        }
        return new Result(fast, mid, slow, states);
    }

    private Trend classify(int i, double[] close, double[] fast, double[] mid, double[] slow) {
        if (i == 0 || !SeriesMath.isDefined(fast[i]) || !SeriesMath.isDefined(slow[i])
                || !SeriesMath.isDefined(mid[i]) || !SeriesMath.isDefined(mid[i - 1])) {
            return Trend.NEUTRAL;
        }

        double midSlope = mid[i] - mid[i - 1];
        if (fast[i] > mid[i] && mid[i] > slow[i] && midSlope >= 0 && close[i] > slow[i]) {
            return Trend.BULLISH;
        } else if (fast[i] < mid[i] && mid[i] < slow[i] && midSlope <= 0 && close[i] < slow[i]) {
            return Trend.BEARISH;
        }
        return Trend.NEUTRAL;
    }

    @Getter
    @AllArgsConstructor
    public static class Result {
        private final double[] fast;
        private final double[] mid;
        private final double[] slow;
        private final Trend[] states;

        public Trend stateAt(int index) {
            return index >= 0 && index < states.length ? states[index] : Trend.NEUTRAL;
        }

        public Trend current() {
            return stateAt(states.length - 1);
        }
    }
}
