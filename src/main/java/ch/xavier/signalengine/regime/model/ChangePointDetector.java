package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class ChangePointDetector {
    public static final double DEFAULT_CUSUM_THRESHOLD = 5;
    public static final int DEFAULT_MIN_SEGMENT_LENGTH = 20;
    public static final int DEFAULT_MAX_BREAKS = 5;

    // simplified critical value of the break F statistic
    private static final double CRITICAL_F = 10;

    private ChangePointDetector() {
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class ChangePoint {
        private final int index;
        private final double value;
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class StructuralBreak {
        private final int index;
        private final double fStatistic;
        private final double meanBefore;
        private final double meanAfter;
    }

    public static List<ChangePoint> cusum(double[] series) {
        return cusum(series, DEFAULT_CUSUM_THRESHOLD, 0);
    }

    /**
     * One-sided upward CUSUM around the series mean. The accumulator resets after every detection.
     */
    public static List<ChangePoint> cusum(double[] series, double threshold, double drift) {
        List<ChangePoint> changePoints = new ArrayList<>();
        if (series.length == 0) {
            return changePoints;
        }
        double mean = SeriesMath.mean(series);
        double cumulative = 0;
        for (int i = 0; i < series.length; i++) {
            cumulative = Math.max(0, cumulative + (series[i] - mean - drift));
            if (cumulative > threshold) {
                changePoints.add(new ChangePoint(i, series[i]));
                cumulative = 0;
            }
        }
        return changePoints;
    }

    public static List<StructuralBreak> structuralBreaks(double[] series) {
        return structuralBreaks(series, DEFAULT_MIN_SEGMENT_LENGTH, DEFAULT_MAX_BREAKS);
    }

    /**
     * Single-break F test at every admissible split, strongest first.
     *
     * @param series           observations
     * @param minSegmentLength minimum length of both segments
     * @param maxBreaks        number of splits to report at most
     * @return splits whose F statistic exceeds the critical value, by decreasing F
     */
    public static List<StructuralBreak> structuralBreaks(double[] series, int minSegmentLength, int maxBreaks) {
        int n = series.length;
        List<StructuralBreak> breaks = new ArrayList<>();
        if (n < minSegmentLength * 2 || n < 3) {
            return breaks;
        }

        double fullSsr = SeriesMath.variance(series) * n;
        for (int k = minSegmentLength; k < n - minSegmentLength; k++) {
            double[] before = SeriesMath.slice(series, 0, k);
            double[] after = SeriesMath.slice(series, k, n);
            double meanBefore = SeriesMath.mean(before);
            double meanAfter = SeriesMath.mean(after);
            double splitSsr = SeriesMath.variance(before) * before.length + SeriesMath.variance(after) * after.length;

            double fStatistic;
            if (splitSsr > 0) {
                fStatistic = (fullSsr - splitSsr) / (splitSsr / (n - 2));
            } else {
                fStatistic = fullSsr > 0 ? Double.MAX_VALUE : 0;
            }
            if (fStatistic > CRITICAL_F) {
                breaks.add(new StructuralBreak(k, fStatistic, meanBefore, meanAfter));
            }
        }

        breaks.sort(Comparator.comparingDouble(StructuralBreak::getFStatistic).reversed());
        return breaks.size() > maxBreaks ? new ArrayList<>(breaks.subList(0, maxBreaks)) : breaks;
    }
}
