package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Rescaled-range estimate of the Hurst exponent.
 * <p>
 * The series is cut into non-overlapping chunks of 8, 16, 32, ... observations (up to half its length). For each
 * chunk size the R/S statistic is averaged over the chunks, and H is the slope of log(R/S) against log(size).
 */
public final class HurstExponent {
    public static final double RANDOM_WALK = 0.5;

    private static final int MIN_WINDOW = 8;
    private static final int MIN_OBSERVATIONS = 64;

    private HurstExponent() {
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class Persistence {
        private final MarketRegime regime;
        private final double hurstExponent;
        private final int confidence;
        private final String interpretation;
    }

    /**
     * @return H in [0, 1]; 0.5 when the series is too short or flat to estimate
     */
    public static double calculate(double[] series) {
        if (series.length < MIN_OBSERVATIONS) {
            return RANDOM_WALK;
        }

        List<Double> logWindows = new ArrayList<>();
        List<Double> logRescaledRanges = new ArrayList<>();
        for (int window = MIN_WINDOW; window <= series.length / 2; window *= 2) {
            double rescaledRange = averageRescaledRange(series, window);
            if (SeriesMath.isDefined(rescaledRange) && rescaledRange > 0) {
                logWindows.add(Math.log(window));
                logRescaledRanges.add(Math.log(rescaledRange));
            }
        }
        if (logWindows.size() < 2) {
            return RANDOM_WALK;
        }

        double slope = SeriesMath.linearRegressionSlope(toArray(logWindows), toArray(logRescaledRanges));
        return SeriesMath.isDefined(slope) ? SeriesMath.clamp(slope, 0, 1) : RANDOM_WALK;
    }

    /**
     * Persistence of the bar closes, measured on their log returns.
     */
    public static Persistence classify(List<Bar> bars) {
        double hurst = calculate(SeriesMath.logReturns(Bars.closes(bars)));
        int confidence = (int) Math.round(Math.abs(hurst - RANDOM_WALK) * 200);
        if (hurst > 0.6) {
            return new Persistence(MarketRegime.TRENDING, hurst, confidence, "Persistent trending behavior");
        } else if (hurst < 0.4) {
            return new Persistence(MarketRegime.MEAN_REVERTING, hurst, confidence, "Mean-reverting behavior");
        }
        return new Persistence(MarketRegime.RANDOM, hurst, confidence, "Random walk behavior");
    }

    private static double averageRescaledRange(double[] series, int window) {
        int chunks = series.length / window;
        double sum = 0;
        int counted = 0;
        for (int c = 0; c < chunks; c++) {
            double[] chunk = SeriesMath.slice(series, c * window, (c + 1) * window);
            double std = SeriesMath.std(chunk);
            if (!(std > 0)) {
                continue;
            }
            double mean = SeriesMath.mean(chunk);
            double cumulative = 0;
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            for (double value : chunk) {
                cumulative += value - mean;
                max = Math.max(max, cumulative);
                min = Math.min(min, cumulative);
            }
            sum += (max - min) / std;
            counted++;
        }
        return counted == 0 ? SeriesMath.UNDEFINED : sum / counted;
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
