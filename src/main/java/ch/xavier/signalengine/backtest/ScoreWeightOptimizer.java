package ch.xavier.signalengine.backtest;

import ch.xavier.signalengine.backtest.model.ComboReport;
import ch.xavier.signalengine.backtest.model.ConditionReport;
import ch.xavier.signalengine.backtest.model.ScoreWeightReport;
import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.indicator.Direction;
import ch.xavier.signalengine.indicator.OverlayBundle;
import ch.xavier.signalengine.indicator.OverlayService;
import ch.xavier.signalengine.indicator.Trend;
import ch.xavier.signalengine.score.ScoreComponent;
import ch.xavier.signalengine.score.ScoreWeights;
import ch.xavier.signalengine.score.SignalScoreService;
import ch.xavier.signalengine.score.SignalState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Measures how often each score condition fires over a history and what the price did afterwards, and suggests
 * a weight for it: rare conditions with a high average forward return deserve more.
 */
@Service
@Slf4j
public class ScoreWeightOptimizer {
    public static final int MIN_BARS = 100;
    public static final int FIRED_LOOKBACK = 5;
    static final String INSUFFICIENT_DATA = "Insufficient data for optimization";
    static final String INSUFFICIENT_OCCURRENCES = "Insufficient occurrences for analysis";
    static final String SUMMARY =
            "Review avgReturn (quality) and rarity. Rare signals with high returns deserve higher weights.";

    private static final ScoreComponent[][] COMBOS = {
            {ScoreComponent.PIVOT_RIBBON, ScoreComponent.RIPSTER_34_50},
            {ScoreComponent.PIVOT_RIBBON, ScoreComponent.SQUEEZE_FIRED},
            {ScoreComponent.RIPSTER_34_50, ScoreComponent.SQUEEZE_FIRED},
            {ScoreComponent.SATY_TRIGGER, ScoreComponent.SQUEEZE_FIRED},
            {ScoreComponent.PIVOT_RIBBON, ScoreComponent.ICHIMOKU},
            {ScoreComponent.SQUEEZE_FIRED, ScoreComponent.ICHIMOKU},
    };

    private final OverlayService overlayService;

    public ScoreWeightOptimizer(OverlayService overlayService) {
        this.overlayService = overlayService;
    }

    public ScoreWeightReport analyze(List<Bar> bars, int horizon, int minOccurrences) {
        if (bars.size() < MIN_BARS) {
            log.warn("Not optimizing score weights on {} bars, need {}", bars.size(), MIN_BARS);
            return ScoreWeightReport.builder()
                    .bars(bars.size())
                    .horizon(horizon)
                    .individual(Collections.emptyMap())
                    .combos(Collections.emptyList())
                    .bestPerformer("N/A")
                    .message(INSUFFICIENT_DATA)
                    .build();
        }
        log.info("Optimizing score weights over {} bars with horizon {}", bars.size(), horizon);

        OverlayBundle overlays = overlayService.compute(bars);
        int n = bars.size();
        List<Map<ScoreComponent, Boolean>> conditions = new ArrayList<>(n);
        boolean[] bull = new boolean[n];
        for (int i = 0; i < n; i++) {
            SignalState state = SignalScoreService.stateAt(overlays, i, ScoreWeights.defaults());
            conditions.add(conditionsAt(overlays, i, state));
            bull[i] = state.getPivotNow() == Trend.BULLISH && state.getIchimokuRegime() == Trend.BULLISH;
        }

        Map<ScoreComponent, ConditionReport> individual = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent component : ScoreComponent.values()) {
            if (component == ScoreComponent.CONSENSUS) {
                continue;
            }
            List<Double> matches = new ArrayList<>();
            List<Double> bullMatches = new ArrayList<>();
            List<Double> bearMatches = new ArrayList<>();
            for (int i = 0; i + horizon < n; i++) {
                if (!conditions.get(i).get(component) || !hasForwardReturn(bars, i)) {
                    continue;
                }
                double forwardReturn = forwardReturnPercent(bars, i, horizon);
                matches.add(forwardReturn);
                (bull[i] ? bullMatches : bearMatches).add(forwardReturn);
            }
            individual.put(component, report(matches, bullMatches, bearMatches, n, minOccurrences));
        }

        List<ComboReport> combos = new ArrayList<>();
        for (ScoreComponent[] combo : COMBOS) {
            List<Double> matches = new ArrayList<>();
            for (int i = 0; i + horizon < n; i++) {
                if (conditions.get(i).get(combo[0]) && conditions.get(i).get(combo[1]) && hasForwardReturn(bars, i)) {
                    matches.add(forwardReturnPercent(bars, i, horizon));
                }
            }
            if (matches.size() >= minOccurrences) {
                combos.add(new ComboReport(combo[0].getKey() + " + " + combo[1].getKey(), matches.size(),
                        matches.size() * 100.0 / n, SignalBacktestService.average(matches)));
            }
        }

        String bestPerformer = individual.entrySet().stream()
                .filter(entry -> entry.getValue().isAnalyzed())
                .max((a, b) -> Double.compare(a.getValue().getAvgReturn(), b.getValue().getAvgReturn()))
                .map(entry -> entry.getKey().getKey())
                .orElse("N/A");
        log.info("Best performing score condition over {} bars: {}", n, bestPerformer);

        return ScoreWeightReport.builder()
                .bars(n)
                .horizon(horizon)
                .individual(Collections.unmodifiableMap(individual))
                .combos(Collections.unmodifiableList(combos))
                .bestPerformer(bestPerformer)
                .message(SUMMARY)
                .build();
    }

    static int recommendedWeight(double avgReturn, double rarity) {
        double rarityPenalty = Math.max(1, rarity / 10);
        long weight = Math.round(avgReturn / rarityPenalty * 10);
        return (int) Math.min(30, Math.max(5, weight));
    }

    private static Map<ScoreComponent, Boolean> conditionsAt(OverlayBundle overlays, int index, SignalState state) {
        Map<ScoreComponent, Boolean> conditions = new EnumMap<>(ScoreComponent.class);
        boolean pivotBullish = state.getPivotNow() == Trend.BULLISH;
        conditions.put(ScoreComponent.PIVOT_RIBBON, pivotBullish);
        conditions.put(ScoreComponent.RIPSTER_34_50, overlays.getCloud34x50().biasAt(index) == Trend.BULLISH);
        conditions.put(ScoreComponent.SATY_TRIGGER, state.getSatyDirection() == Direction.LONG && pivotBullish);
        conditions.put(ScoreComponent.SQUEEZE_ON, state.getSqueeze().isOn());
        Integer firedBarsAgo = state.getSqueeze().getFiredBarsAgo();
        conditions.put(ScoreComponent.SQUEEZE_FIRED,
                state.getSqueeze().isFired() || (firedBarsAgo != null && firedBarsAgo <= FIRED_LOOKBACK));
        conditions.put(ScoreComponent.ICHIMOKU, state.getIchimokuRegime() == Trend.BULLISH);
        return conditions;
    }

    private static boolean hasForwardReturn(List<Bar> bars, int index) {
        return bars.get(index).getClose() > 0;
    }

    private static double forwardReturnPercent(List<Bar> bars, int index, int horizon) {
        double close = bars.get(index).getClose();
        return (bars.get(index + horizon).getClose() - close) / close * 100;
    }

    private static ConditionReport report(List<Double> matches, List<Double> bullMatches, List<Double> bearMatches,
                                          int bars, int minOccurrences) {
        if (matches.size() < minOccurrences) {
            return ConditionReport.builder()
                    .occurrences(matches.size())
                    .note(INSUFFICIENT_OCCURRENCES)
                    .build();
        }
        double avgReturn = SignalBacktestService.average(matches);
        double rarity = matches.size() * 100.0 / bars;
        double bullReturn = SignalBacktestService.average(bullMatches);
        double bearReturn = SignalBacktestService.average(bearMatches);
        return ConditionReport.builder()
                .occurrences(matches.size())
                .rarity(rarity)
                .avgReturn(avgReturn)
                .bullReturn(bullReturn)
                .bearReturn(bearReturn)
                .regimeFit(bullReturn - bearReturn)
                .recommendedWeight(recommendedWeight(avgReturn, rarity))
                .build();
    }
}
