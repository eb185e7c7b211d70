package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Bollinger bands against Keltner channels with linear-regression momentum, the raw input of the squeeze.
 */
@NoArgsConstructor
@AllArgsConstructor
@Setter
@Getter
public class SqueezeBands implements Indicator<SqueezeBands.Result> {
    private int length = 20;
    private double bbMult = 2.0;
    private double kcMult = 1.5;

    @Override
    public Result calculate(List<Bar> bars) {
        int n = bars.size();
        double[] close = Bars.closes(bars);
        double[] basis = SeriesMath.sma(close, length);
        double[] dev = SeriesMath.rollingStd(close, length);
        double[] range = SeriesMath.averageTrueRange(bars, length);
        double[] highest = SeriesMath.rollingHighest(Bars.highs(bars), length);
        double[] lowest = SeriesMath.rollingLowest(Bars.lows(bars), length);

        double[] bbUpper = SeriesMath.undefinedArray(n);
        double[] bbLower = SeriesMath.undefinedArray(n);
        double[] kcUpper = SeriesMath.undefinedArray(n);
        double[] kcLower = SeriesMath.undefinedArray(n);
        double[] momentum = SeriesMath.undefinedArray(n);
        boolean[] squeezeOn = new boolean[n];

        for (int i = length - 1; i < n; i++) {
            bbUpper[i] = basis[i] + bbMult * dev[i];
            bbLower[i] = basis[i] - bbMult * dev[i];
            kcUpper[i] = basis[i] + kcMult * range[i];
            kcLower[i] = basis[i] - kcMult * range[i];
            squeezeOn[i] = bbUpper[i] <= kcUpper[i] && bbLower[i] >= kcLower[i];

            double priceAvg = ((highest[i] + lowest[i]) / 2 + basis[i]) / 2;
            momentum[i] = calculateMomentum(close, i, priceAvg);
        }

        return new Result(basis, bbUpper, bbLower, kcUpper, kcLower, squeezeOn, momentum, Math.min(n, length - 1));
    }

    private double calculateMomentum(double[] close, int index, double priceAvg) {
        double[] window = new double[length];
        for (int j = 0; j < length; j++) {
            window[j] = close[index - length + 1 + j] - priceAvg;
        }
        double slope = SeriesMath.linearRegressionSlope(window);
        return SeriesMath.isDefined(slope) ? slope : 0;
    }

    @Getter
    @AllArgsConstructor
    public static class Result {
        private final double[] basis;
        private final double[] bbUpper;
        private final double[] bbLower;
        private final double[] kcUpper;
        private final double[] kcLower;
        private final boolean[] squeezeOn;
        private final double[] momentum;
        private final int firstDefinedIndex;

        public int size() {
            return squeezeOn.length;
        }
    }
}
