package ch.xavier.signalengine.backtest.model;

import ch.xavier.signalengine.consensus.Timeframe;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Forward-return statistics of score events. Rates and returns are percentages rounded to two decimals.
 */
@Builder
@Getter
@ToString(exclude = {"recentScores", "eventList"})
public class SignalBacktestResult {
    private final String symbol;
    private final Timeframe timeframe;
    private final int bars;
    private final double threshold;
    private final int horizon;
    private final DailyFilter dailyFilter;
    private final int events;
    private final double winRate;
    private final double avgFwd;
    private final double medianFwd;
    private final double avgWin;
    private final double avgLoss;
    /**
     * {@code null} when the events are all wins or all losses.
     */
    private final Double profitFactor;
    private final double scoreAvg;
    private final Map<Integer, Double> scorePcts;
    private final List<Double> recentScores;
    private final List<SignalEvent> eventList;
    private final List<CurvePoint> curve;
    private final List<CurvePoint> curveBull;
    private final List<CurvePoint> curveBear;
}
