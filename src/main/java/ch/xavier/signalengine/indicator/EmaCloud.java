package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Pair of EMAs drawn as a cloud. The cloud itself carries no interpretation; {@link Result#biasAt(int)} is the
 * reading the score uses for the 34/50 pair.
 */
@Getter
@AllArgsConstructor
public class EmaCloud implements Indicator<EmaCloud.Result> {
    private final int fastPeriod;
    private final int slowPeriod;

    @Override
    public Result calculate(List<Bar> bars) {
        double[] close = Bars.closes(bars);
        return new Result(fastPeriod, slowPeriod, SeriesMath.ema(close, fastPeriod), SeriesMath.ema(close, slowPeriod), close);
    }

    @Getter
    @AllArgsConstructor
    public static class Result {
        private final int fastPeriod;
        private final int slowPeriod;
        private final double[] fast;
        private final double[] slow;
        private final double[] close;

        public Trend biasAt(int index) {
            if (index < 0 || index >= close.length
                    || !SeriesMath.isDefined(fast[index]) || !SeriesMath.isDefined(slow[index])) {
                return Trend.NEUTRAL;
            }
            if (fast[index] > slow[index] && close[index] > slow[index]) {
                return Trend.BULLISH;
            } else if (fast[index] < slow[index] && close[index] < slow[index]) {
                return Trend.BEARISH;
            }
            return Trend.NEUTRAL;
        }

        public Trend currentBias() {
            return biasAt(close.length - 1);
        }
    }
}
