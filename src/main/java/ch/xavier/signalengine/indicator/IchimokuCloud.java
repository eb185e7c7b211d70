package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Ichimoku Kinko Hyo. Span A and span B are projected {@code kijunPeriod} bars ahead of price, so both arrays
 * are {@code bars + shift} long; chikou is the close plotted {@code shift} bars back.
 */
@Getter
@AllArgsConstructor
public class IchimokuCloud implements Indicator<IchimokuCloud.Result> {
    private final int tenkanPeriod;
    private final int kijunPeriod;
    private final int senkouBPeriod;

    public IchimokuCloud() {
        this(9, 26, 52);
    }

    @Override
    public Result calculate(List<Bar> bars) {
        double[] high = Bars.highs(bars);
        double[] low = Bars.lows(bars);
        double[] close = Bars.closes(bars);
        int n = bars.size();
        int shift = kijunPeriod;

        double[] tenkan = rollingMidpoint(high, low, tenkanPeriod);
        double[] kijun = rollingMidpoint(high, low, kijunPeriod);
        double[] senkouB = rollingMidpoint(high, low, senkouBPeriod);

        double[] spanA = SeriesMath.undefinedArray(n + shift);
        double[] spanB = SeriesMath.undefinedArray(n + shift);
        for (int i = 0; i < n; i++) {
            if (SeriesMath.isDefined(tenkan[i]) && SeriesMath.isDefined(kijun[i])) {
                spanA[i + shift] = (tenkan[i] + kijun[i]) / 2;
            }
            spanB[i + shift] = senkouB[i];
        }

        double[] chikou = SeriesMath.undefinedArray(n);
        for (int i = shift; i < n; i++) {
            chikou[i - shift] = close[i];
        }

        return new Result(tenkan, kijun, spanA, spanB, chikou, shift, close);
    }

    private double[] rollingMidpoint(double[] high, double[] low, int period) {
        double[] highest = SeriesMath.rollingHighest(high, period);
        double[] lowest = SeriesMath.rollingLowest(low, period);
        double[] out = SeriesMath.undefinedArray(high.length);
        for (int i = 0; i < out.length; i++) {
            if (SeriesMath.isDefined(highest[i])) {
                out[i] = (highest[i] + lowest[i]) / 2;
            }
        }
        return out;
    }

    @Getter
    @AllArgsConstructor
    public static class Result {
        private final double[] tenkan;
        private final double[] kijun;
        private final double[] spanA;
        private final double[] spanB;
        private final double[] chikou;
        private final int shift;
        private final double[] close;

        /**
         * Price against the cloud drawn under bar {@code index}.
         */
        public Trend regimeAt(int index) {
            if (index < 0 || index >= close.length
                    || !SeriesMath.isDefined(spanA[index]) || !SeriesMath.isDefined(spanB[index])) {
                return Trend.NEUTRAL;
            }
            double top = Math.max(spanA[index], spanB[index]);
            double bottom = Math.min(spanA[index], spanB[index]);
            if (close[index] > top) {
                return Trend.BULLISH;
            } else if (close[index] < bottom) {
                return Trend.BEARISH;
            }
            return Trend.NEUTRAL;
        }

        public Trend currentRegime() {
            return regimeAt(close.length - 1);
        }

        public boolean hasCloudAt(int index) {
            return index >= 0 && index < close.length
                    && SeriesMath.isDefined(spanA[index]) && SeriesMath.isDefined(spanB[index]);
        }

        public boolean isGreenAt(int index) {
            return hasCloudAt(index) && spanA[index] > spanB[index];
        }
    }
}
