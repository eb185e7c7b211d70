package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * ADX with EMA smoothing of true range and directional movement. Output arrays are aligned with the bars; the
 * first bar never has a value since movement needs a previous bar.
 */
@Getter
@AllArgsConstructor
public class AverageDirectionalIndex implements Indicator<AverageDirectionalIndex.Result> {
    private final int period;

    public AverageDirectionalIndex() {
        this(14);
    }

    @Override
    public Result calculate(List<Bar> bars) {
        int n = bars.size();
        double[] plusDi = SeriesMath.undefinedArray(n);
        double[] minusDi = SeriesMath.undefinedArray(n);
        double[] adx = SeriesMath.undefinedArray(n);
        if (n < period + 1) {
            return new Result(plusDi, minusDi, adx);
        }

        double[] tr = new double[n - 1];
        double[] plusDm = new double[n - 1];
        double[] minusDm = new double[n - 1];
        for (int i = 1; i < n; i++) {
            Bar bar = bars.get(i);
            Bar previous = bars.get(i - 1);
            double highDiff = bar.getHigh() - previous.getHigh();
            double lowDiff = previous.getLow() - bar.getLow();

            tr[i - 1] = Math.max(bar.getHigh() - bar.getLow(),
                    Math.max(Math.abs(bar.getHigh() - previous.getClose()), Math.abs(bar.getLow() - previous.getClose())));
            plusDm[i - 1] = highDiff > lowDiff && highDiff > 0 ? highDiff : 0;
            minusDm[i - 1] = lowDiff > highDiff && lowDiff > 0 ? lowDiff : 0;
        }

        double[] smoothedTr = SeriesMath.ema(tr, period);
        double[] smoothedPlus = SeriesMath.ema(plusDm, period);
        double[] smoothedMinus = SeriesMath.ema(minusDm, period);

        double[] dx = SeriesMath.undefinedArray(n - 1);
        for (int i = 0; i < n - 1; i++) {
            if (!SeriesMath.isDefined(smoothedTr[i])) {
                continue;
            }
            double plus = smoothedTr[i] == 0 ? 0 : smoothedPlus[i] / smoothedTr[i] * 100;
            double minus = smoothedTr[i] == 0 ? 0 : smoothedMinus[i] / smoothedTr[i] * 100;
            double sum = plus + minus;
            plusDi[i + 1] = plus;
            minusDi[i + 1] = minus;
            dx[i] = sum == 0 ? 0 : Math.abs(plus - minus) / sum * 100;
        }

        double[] smoothedDx = SeriesMath.ema(dx, period);
        System.arraycopy(smoothedDx, 0, adx, 1, n - 1);
        return new Result(plusDi, minusDi, adx);
    }

    @Getter
    @AllArgsConstructor
    public static class Result {
        private final double[] plusDi;
        private final double[] minusDi;
        private final double[] adx;

        /**
         * Last ADX value, 0 while the indicator is still warming up.
         */
        public double current() {
            if (adx.length == 0 || !SeriesMath.isDefined(adx[adx.length - 1])) {
                return 0;
            }
            return adx[adx.length - 1];
        }
    }
}
