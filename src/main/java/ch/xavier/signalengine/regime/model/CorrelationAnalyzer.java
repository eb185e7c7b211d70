package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

public final class CorrelationAnalyzer {

    private CorrelationAnalyzer() {
    }

    public enum CorrelationRegime {
        HIGH_CORRELATION, LOW_CORRELATION, STABLE
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class DynamicCorrelation {
        private final double currentCorrelation;
        private final double averageCorrelation;
        private final CorrelationRegime regime;
        private final double[] timeSeries;
    }

    /**
     * Correlation over each trailing window, one value per complete window.
     */
    public static double[] rollingCorrelation(double[] x, double[] y, int window) {
        int n = Math.min(x.length, y.length);
        if (window <= 1 || n < window) {
            return new double[0];
        }
        double[] out = new double[n - window + 1];
        for (int end = window; end <= n; end++) {
            out[end - window] = SeriesMath.correlation(
                    SeriesMath.slice(x, end - window, end), SeriesMath.slice(y, end - window, end));
        }
        return out;
    }

    /**
     * Current rolling correlation against the mean plus or minus one standard deviation of its own history.
     */
    public static DynamicCorrelation dynamicCorrelation(double[] x, double[] y, int window) {
        double[] correlations = rollingCorrelation(x, y, window);
        if (correlations.length == 0) {
            return new DynamicCorrelation(SeriesMath.UNDEFINED, SeriesMath.UNDEFINED, CorrelationRegime.STABLE,
                    correlations);
        }
        double current = correlations[correlations.length - 1];
        double average = SeriesMath.mean(correlations);
        double std = SeriesMath.std(correlations);

        CorrelationRegime regime = CorrelationRegime.STABLE;
        if (current > average + std) {
            regime = CorrelationRegime.HIGH_CORRELATION;
        } else if (current < average - std) {
            regime = CorrelationRegime.LOW_CORRELATION;
        }
        return new DynamicCorrelation(current, average, regime, correlations);
    }

    /**
     * Market beta, 1 when the market returns have no variance.
     */
    public static double beta(double[] assetReturns, double[] marketReturns) {
        double marketVariance = SeriesMath.variance(marketReturns);
        double covariance = SeriesMath.covariance(assetReturns, marketReturns);
        if (!(marketVariance > 0) || !SeriesMath.isDefined(covariance)) {
            return 1;
        }
        return covariance / marketVariance;
    }
}
