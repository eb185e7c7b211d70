package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Cycle periods ranked by absolute autocorrelation.
 */
public final class CycleDetector {
    public static final int DEFAULT_MIN_PERIOD = 5;
    public static final int DEFAULT_MAX_PERIOD = 50;
    private static final int TOP_CYCLES = 3;

    private CycleDetector() {
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class Cycle {
        private final int period;
        private final double strength;
        private final String interpretation;
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class CyclePower {
        private final int period;
        private final double power;
    }

    @Getter
    @AllArgsConstructor
    public static class Spectrum {
        private final List<CyclePower> dominantCycles;
        private final List<CyclePower> allSpectra;
    }

    public static Cycle dominantCycle(double[] series) {
        return dominantCycle(series, DEFAULT_MIN_PERIOD, DEFAULT_MAX_PERIOD);
    }

    public static Cycle dominantCycle(double[] series, int minPeriod, int maxPeriod) {
        double strongest = 0;
        int dominantPeriod = minPeriod;
        for (int period = minPeriod; period <= maxPeriod; period++) {
            double strength = Math.abs(SeriesMath.autocorrelation(series, period));
            if (strength > strongest) {
                strongest = strength;
                dominantPeriod = period;
            }
        }

        String interpretation;
        if (strongest > 0.5) {
            interpretation = "Strong cycle detected";
        } else if (strongest > 0.3) {
            interpretation = "Moderate cycle";
        } else {
            interpretation = "Weak or no cycle";
        }
        return new Cycle(dominantPeriod, strongest, interpretation);
    }

    /**
     * Autocorrelation spectrum of the linearly detrended series over periods 2 to n/2.
     */
    public static Spectrum spectrum(double[] series) {
        double[] detrended = detrend(series);
        List<CyclePower> spectra = new ArrayList<>();
        for (int period = 2; period < series.length / 2.0; period++) {
            spectra.add(new CyclePower(period, Math.abs(SeriesMath.autocorrelation(detrended, period))));
        }

        List<CyclePower> ranked = new ArrayList<>(spectra);
        ranked.sort(Comparator.comparingDouble(CyclePower::getPower).reversed());
        List<CyclePower> dominant = ranked.subList(0, Math.min(TOP_CYCLES, ranked.size()));
        return new Spectrum(Collections.unmodifiableList(new ArrayList<>(dominant)),
                Collections.unmodifiableList(spectra));
    }

    private static double[] detrend(double[] series) {
        double slope = SeriesMath.linearRegressionSlope(series);
        if (!SeriesMath.isDefined(slope)) {
            return series.clone();
        }
        double meanIndex = (series.length - 1) / 2.0;
        double intercept = SeriesMath.mean(series) - slope * meanIndex;
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            out[i] = series[i] - (intercept + slope * i);
        }
        return out;
    }
}
