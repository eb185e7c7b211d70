package ch.xavier.signalengine.math;

import ch.xavier.signalengine.bar.Bar;

import java.util.Arrays;
import java.util.List;

/**
 * Moving averages and rolling statistics over plain {@code double} series.
 * <p>
 * Indicator arrays are aligned index-for-index with their input. Entries that are not yet warmed up hold
 * {@link #UNDEFINED}. Nothing here throws on short input: scalar statistics of an empty series are
 * {@link #UNDEFINED}, correlation-like ratios with a zero denominator are 0.
 */
public final class SeriesMath {

    public static final double UNDEFINED = Double.NaN;

    private SeriesMath() {
    }

    public static boolean isDefined(double value) {
        return !Double.isNaN(value);
    }

    public static double[] undefinedArray(int length) {
        double[] out = new double[length];
        Arrays.fill(out, UNDEFINED);
        return out;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Rolling-sum simple moving average, undefined until {@code period} values have been seen.
     */
    public static double[] sma(double[] values, int period) {
        double[] out = undefinedArray(values.length);
        if (period <= 0) {
            return out;
        }

        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Exponential moving average seeded with the simple average of the first {@code period} values.
     * Leading undefined entries of the input are skipped, so an EMA of an indicator series starts where that
     * indicator does.
     */
    public static double[] ema(double[] values, int period) {
        double[] out = undefinedArray(values.length);
        if (period <= 0) {
            return out;
        }

        int start = 0;
        while (start < values.length && !isDefined(values[start])) {
            start++;
        }
        int seedIndex = start + period - 1;
        if (seedIndex >= values.length) {
            return out;
        }

        double sum = 0;
        for (int i = start; i <= seedIndex; i++) {
            sum += values[i];
        }
        double previous = sum / period;
        out[seedIndex] = previous;

        double k = 2.0 / (period + 1);
        for (int i = seedIndex + 1; i < values.length; i++) {
            previous = values[i] * k + previous * (1 - k);
            out[i] = previous;
        }
        return out;
    }

    /**
     * Population standard deviation over each trailing window.
     */
    public static double[] rollingStd(double[] values, int period) {
        double[] out = undefinedArray(values.length);
        if (period <= 0) {
            return out;
        }

        for (int i = period - 1; i < values.length; i++) {
            int start = i - period + 1;
            double mean = 0;
            for (int j = start; j <= i; j++) {
                mean += values[j];
            }
            mean /= period;

            double sum = 0;
            for (int j = start; j <= i; j++) {
                double diff = values[j] - mean;
                sum += diff * diff;
            }
            out[i] = Math.sqrt(sum / period);
        }
        return out;
    }

    public static double[] rollingHighest(double[] values, int period) {
        double[] out = undefinedArray(values.length);
        if (period <= 0) {
            return out;
        }
        for (int i = period - 1; i < values.length; i++) {
            double highest = Double.NEGATIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                highest = Math.max(highest, values[j]);
            }
            out[i] = highest;
        }
        return out;
    }

    public static double[] rollingLowest(double[] values, int period) {
        double[] out = undefinedArray(values.length);
        if (period <= 0) {
            return out;
        }
        for (int i = period - 1; i < values.length; i++) {
            double lowest = Double.POSITIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                lowest = Math.min(lowest, values[j]);
            }
            out[i] = lowest;
        }
        return out;
    }

    /**
     * True range per bar; the first bar has no previous close and uses its high-low range.
     */
    public static double[] trueRange(List<Bar> bars) {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            Bar bar = bars.get(i);
            double highLow = bar.getHigh() - bar.getLow();
            if (i == 0) {
                out[i] = highLow;
                continue;
            }
            double previousClose = bars.get(i - 1).getClose();
            double highClosePrev = Math.abs(bar.getHigh() - previousClose);
            double lowClosePrev = Math.abs(bar.getLow() - previousClose);
            out[i] = Math.max(Math.max(highLow, highClosePrev), lowClosePrev);
        }
        return out;
    }

    /**
     * Simple rolling average of the true range.
     */
    public static double[] averageTrueRange(List<Bar> bars, int period) {
        return sma(trueRange(bars), period);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return UNDEFINED;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double variance(double[] values) {
        if (values.length == 0) {
            return UNDEFINED;
        }
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            double diff = value - mean;
            sum += diff * diff;
        }
        return sum / values.length;
    }

    public static double std(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static double covariance(double[] x, double[] y) {
        if (x.length == 0 || x.length != y.length) {
            return UNDEFINED;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sum = 0;
        for (int i = 0; i < x.length; i++) {
            sum += (x[i] - meanX) * (y[i] - meanY);
        }
        return sum / x.length;
    }

    public static double correlation(double[] x, double[] y) {
        double cov = covariance(x, y);
        if (!isDefined(cov)) {
            return UNDEFINED;
        }
        double denominator = std(x) * std(y);
        return denominator == 0 ? 0 : cov / denominator;
    }

    public static double autocorrelation(double[] series, int lag) {
        int n = series.length;
        if (n == 0 || lag < 0 || lag >= n) {
            return 0;
        }

        double mean = mean(series);
        double numerator = 0;
        for (int i = 0; i < n - lag; i++) {
            numerator += (series[i] - mean) * (series[i + lag] - mean);
        }
        double denominator = 0;
        for (double value : series) {
            denominator += (value - mean) * (value - mean);
        }
        return denominator == 0 ? 0 : numerator / denominator;
    }

    /**
     * Log returns, one fewer entry than the prices. Non-positive prices contribute a zero return.
     */
    public static double[] logReturns(double[] prices) {
        if (prices.length < 2) {
            return new double[0];
        }
        double[] out = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            out[i - 1] = prices[i] > 0 && prices[i - 1] > 0 ? Math.log(prices[i] / prices[i - 1]) : 0;
        }
        return out;
    }

    public static double[] simpleReturns(double[] prices) {
        if (prices.length < 2) {
            return new double[0];
        }
        double[] out = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            out[i - 1] = prices[i - 1] != 0 ? (prices[i] - prices[i - 1]) / prices[i - 1] : 0;
        }
        return out;
    }

    /**
     * Least-squares slope of {@code y} against its index.
     */
    public static double linearRegressionSlope(double[] y) {
        double[] x = new double[y.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
        }
        return linearRegressionSlope(x, y);
    }

    public static double linearRegressionSlope(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return UNDEFINED;
        }
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
        }
        double denominator = n * sumX2 - sumX * sumX;
        return denominator == 0 ? UNDEFINED : (n * sumXY - sumX * sumY) / denominator;
    }

    /**
     * Share of {@code values} strictly below {@code value}, in percent.
     */
    public static double percentileRank(double[] values, double value) {
        if (values.length == 0) {
            return UNDEFINED;
        }
        int below = 0;
        for (double candidate : values) {
            if (candidate < value) {
                below++;
            }
        }
        return below * 100.0 / values.length;
    }

    public static double[] slice(double[] values, int from, int to) {
        return Arrays.copyOfRange(values, Math.max(0, from), Math.min(values.length, to));
    }

    public static double[] tail(double[] values, int count) {
        return slice(values, values.length - count, values.length);
    }
}
