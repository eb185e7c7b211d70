package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import ch.xavier.signalengine.regime.MarketRegime;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Combined reading of persistence, GARCH volatility, HMM state, change points, cycles and liquidity.
 * <p>
 * The regime itself comes from persistence and volatility: trending when H &gt; 0.6 outside a high-volatility
 * regime, mean-reverting when H &lt; 0.4, then high volatility, else neutral. The other models only feed the
 * analysis map.
 */
public class AdvancedRegimeDetector {
    public static final int MIN_BARS = 100;

    private static final int HMM_STATES = 3;
    private static final double CHANGE_POINT_THRESHOLD = 3;
    private static final int ILLIQUIDITY_WINDOW = 20;
    private static final int SPREAD_WINDOW = 100;

    @Getter
    private final int hmmIterations;
    private final Random random;

    public AdvancedRegimeDetector() {
        this(20, new Random());
    }

    public AdvancedRegimeDetector(int hmmIterations, Random random) {
        this.hmmIterations = hmmIterations;
        this.random = random;
    }

    public AdvancedRegimeResult detect(List<Bar> bars) {
        if (bars.size() < MIN_BARS) {
            return AdvancedRegimeResult.unknown();
        }

        double[] closes = Bars.closes(bars);
        double[] returns = SeriesMath.logReturns(closes);

        double hurst = HurstExponent.calculate(returns);
        VolatilityRegime volatility = GarchModel.detectVolatilityRegime(GarchModel.fit(returns).getParameters(), returns);

        HmmParameters hmm = HiddenMarkovModel.train(
                HmmParameters.initial(HMM_STATES, returns, random), returns, hmmIterations);
        int[] states = HiddenMarkovModel.decode(hmm, returns);
        int hmmState = states[states.length - 1];

        List<ChangePointDetector.ChangePoint> changePoints =
                ChangePointDetector.cusum(zScores(closes), CHANGE_POINT_THRESHOLD, 0);
        CycleDetector.Cycle cycle = CycleDetector.dominantCycle(closes);
        double illiquidity = MicrostructureMetrics.amihudIlliquidity(
                bars.subList(bars.size() - ILLIQUIDITY_WINDOW, bars.size()));
        double spread = MicrostructureMetrics.rollSpread(SeriesMath.tail(closes, SPREAD_WINDOW));

        boolean highVolatility = volatility.getRegime() == MarketRegime.HIGH_VOLATILITY;
        MarketRegime regime;
        double confidence;
        if (hurst > 0.6 && !highVolatility) {
            regime = MarketRegime.TRENDING;
            confidence = (hurst - 0.5) * 200;
        } else if (hurst < 0.4) {
            regime = MarketRegime.MEAN_REVERTING;
            confidence = (0.5 - hurst) * 200;
        } else if (highVolatility) {
            regime = MarketRegime.HIGH_VOLATILITY;
            confidence = volatility.getPercentile();
        } else {
            regime = MarketRegime.NEUTRAL;
            confidence = 50;
        }

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("hurstExponent", hurst);
        analysis.put("volatilityRegime", volatility.getRegime());
        analysis.put("hmmState", hmmState);
        analysis.put("hmmRegime", HmmRegimeDetector.labelOf(hmmState, hmm.getStds()));
        analysis.put("recentChangePoint", !changePoints.isEmpty());
        analysis.put("dominantCycle", cycle.getPeriod());
        analysis.put("cycleStrength", cycle.getStrength());
        analysis.put("illiquidity", illiquidity);
        analysis.put("bidAskSpread", spread);

        Map<String, String> interpretation = new LinkedHashMap<>();
        interpretation.put("trend", hurst > 0.6 ? "Persistent trending" : hurst < 0.4 ? "Mean reverting" : "Random");
        interpretation.put("volatility", volatility.getRegime().getLabel());
        interpretation.put("cycle", cycle.getInterpretation());
        interpretation.put("liquidity", illiquidity > 1 ? "Low liquidity" : "Normal liquidity");

        return new AdvancedRegimeResult(regime, (int) Math.round(confidence),
                Collections.unmodifiableMap(analysis), Collections.unmodifiableMap(interpretation));
    }

    private static double[] zScores(double[] values) {
        double mean = SeriesMath.mean(values);
        double std = SeriesMath.std(values);
        double[] out = new double[values.length];
        if (!(std > 0)) {
            return out;
        }
        for (int i = 0; i < values.length; i++) {
            out[i] = (values[i] - mean) / std;
        }
        return out;
    }
}
