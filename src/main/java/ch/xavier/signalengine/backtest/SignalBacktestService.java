package ch.xavier.signalengine.backtest;

import ch.xavier.signalengine.backtest.model.CurvePoint;
import ch.xavier.signalengine.backtest.model.DailyFilter;
import ch.xavier.signalengine.backtest.model.SignalBacktestRequest;
import ch.xavier.signalengine.backtest.model.SignalBacktestResult;
import ch.xavier.signalengine.backtest.model.SignalEvent;
import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.BarSeriesValidator;
import ch.xavier.signalengine.bar.InvalidBarSeriesException;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.indicator.Trend;
import ch.xavier.signalengine.score.SignalScoreService;
import ch.xavier.signalengine.score.SignalState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Replays the score over a bar history and measures what followed each bar scoring at or above a threshold.
 */
@Service
@Slf4j
public class SignalBacktestService {
    private static final int[] SCORE_BUCKETS = {40, 60, 70};

    private final SignalScoreService signalScoreService;
    private final SignalEngineProperties.Backtest properties;
    private final double defaultThreshold;

    public SignalBacktestService(SignalScoreService signalScoreService, SignalEngineProperties properties) {
        this.signalScoreService = signalScoreService;
        this.properties = properties.getBacktest();
        this.defaultThreshold = properties.getScore().getThreshold();
    }

    /**
     * Runs one backtest on the parallel scheduler.
     *
     * @param request bars, thresholds and optional daily regime filter
     * @return statistics over the events of the request
     */
    public Mono<SignalBacktestResult> backtest(SignalBacktestRequest request) {
        return Mono.fromCallable(() -> executeBacktest(request))
                .subscribeOn(Schedulers.parallel());
    }

    /**
     * Backtests several symbols with the same settings. Results come back in the iteration order of
     * {@code barsBySymbol}; a symbol whose bars are rejected is logged and left out.
     *
     * @param barsBySymbol bars of each symbol
     * @param template     settings shared by every symbol, its bars are ignored
     * @return one result per accepted symbol
     */
    public Flux<SignalBacktestResult> backtestBatch(Map<String, List<Bar>> barsBySymbol,
                                                    SignalBacktestRequest template) {
        return Flux.fromIterable(barsBySymbol.entrySet())
                .flatMapSequential(entry -> backtest(template.toBuilder()
                        .symbol(entry.getKey())
                        .bars(entry.getValue())
                        .build())
                        .onErrorResume(InvalidBarSeriesException.class, e -> {
                            log.warn("Skipping {} in batch backtest: {}", entry.getKey(), e.getMessage());
                            return Mono.empty();
                        }));
    }

    /**
     * Scores of every prefix {@code bars[0..i]} for {@code i >= fromIndex}, each recomputed from scratch. The
     * prefixes are scored in parallel and emitted in index order.
     */
    public Flux<Double> replayScores(List<Bar> bars, int fromIndex) {
        BarSeriesValidator.validate(bars);
        int start = Math.max(0, fromIndex);
        if (start >= bars.size()) {
            return Flux.empty();
        }
        return Flux.range(start, bars.size() - start)
                .flatMapSequential(i -> Mono.fromCallable(
                                () -> signalScoreService.computeState(bars.subList(0, i + 1)).getScore())
                        .subscribeOn(Schedulers.parallel()));
    }

    private SignalBacktestResult executeBacktest(SignalBacktestRequest request) {
        List<Bar> bars = request.getBars();
        double threshold = request.getThreshold() != null ? request.getThreshold() : defaultThreshold;
        int horizon = Math.max(1, request.getHorizon() != null ? request.getHorizon() : properties.getHorizon());
        List<Integer> thresholds = new ArrayList<>(new TreeSet<>(request.getCurveThresholds() != null
                ? request.getCurveThresholds() : properties.getCurveThresholds()));
        DailyFilter dailyFilter = request.getDailyFilter();

        log.info("Backtesting {} {} over {} bars (threshold {}, horizon {}, daily filter {})", request.getSymbol(),
                request.getTimeframe().getLabel(), bars.size(), threshold, horizon, dailyFilter);

        List<SignalState> states = signalScoreService.computeStates(bars);
        List<Bar> dailyBars = dailyFilter == DailyFilter.NONE ? Collections.emptyList() : request.getDailyBars();
        List<SignalState> dailyStates = dailyBars.isEmpty()
                ? Collections.emptyList() : signalScoreService.computeStates(dailyBars);

        int n = bars.size();
        int start = Math.min(properties.getWarmupBars(), n / 5);
        Deque<Double> scores = new ArrayDeque<>();
        List<SignalEvent> events = new ArrayList<>();
        List<List<Double>> curve = emptyBins(thresholds.size());
        List<List<Double>> curveBull = emptyBins(thresholds.size());
        List<List<Double>> curveBear = emptyBins(thresholds.size());
        int dailyIndex = -1;

        for (int i = start; i < n; i++) {
            Bar bar = bars.get(i);
            SignalState state = states.get(i);

            SignalState daily = null;
            if (!dailyStates.isEmpty()) {
                while (dailyIndex + 1 < dailyBars.size() && dailyBars.get(dailyIndex + 1).getTime() <= bar.getTime()) {
                    dailyIndex++;
                }
                daily = dailyIndex >= 0 ? dailyStates.get(dailyIndex) : null;
                if (daily != null && !passes(daily, dailyFilter)) {
                    trim(scores);
                    continue;
                }
            }

            scores.addLast(state.getScore());
            // a non-positive close has no defined forward return
            if (i + horizon < n && bar.getClose() > 0) {
                double forwardReturn = (bars.get(i + horizon).getClose() - bar.getClose()) / bar.getClose();
                if (state.getScore() >= threshold) {
                    events.add(new SignalEvent(i, bar.getTime(), bar.getClose(), state.getScore(), forwardReturn));
                }
                addToBins(curve, thresholds, state.getScore(), forwardReturn);
                if (daily != null && isRegime(daily, Trend.BULLISH)) {
                    addToBins(curveBull, thresholds, state.getScore(), forwardReturn);
                }
                if (daily != null && isRegime(daily, Trend.BEARISH)) {
                    addToBins(curveBear, thresholds, state.getScore(), forwardReturn);
                }
            }
            trim(scores);
        }

        SignalBacktestResult result = summarize(request, threshold, horizon, thresholds, scores, events,
                curve, curveBull, curveBear, !dailyStates.isEmpty());
        log.info("Backtest {} done: {} events, win rate {}%, avg forward {}%", request.getSymbol(),
                result.getEvents(), result.getWinRate(), result.getAvgFwd());
        return result;
    }

    private SignalBacktestResult summarize(SignalBacktestRequest request, double threshold, int horizon,
                                           List<Integer> thresholds, Deque<Double> scores, List<SignalEvent> events,
                                           List<List<Double>> curve, List<List<Double>> curveBull,
                                           List<List<Double>> curveBear, boolean withDailyCurves) {
        List<Double> forwardReturns = new ArrayList<>(events.size());
        List<Double> wins = new ArrayList<>();
        List<Double> losses = new ArrayList<>();
        for (SignalEvent event : events) {
            forwardReturns.add(event.getForwardReturn());
            if (event.getForwardReturn() > 0) {
                wins.add(event.getForwardReturn());
            } else {
                losses.add(event.getForwardReturn());
            }
        }

        double avgWin = average(wins);
        double avgLoss = average(losses);
        Double profitFactor;
        if (avgWin > 0 && avgLoss < 0) {
            profitFactor = round2(Math.abs(avgWin / avgLoss));
        } else {
            profitFactor = !wins.isEmpty() && !losses.isEmpty() ? 0.0 : null;
        }

        List<Double> recentScores = new ArrayList<>(scores);
        Map<Integer, Double> scorePcts = new LinkedHashMap<>();
        for (int bucket : SCORE_BUCKETS) {
            long atLeast = recentScores.stream().filter(score -> score >= bucket).count();
            scorePcts.put(bucket, round2(atLeast * 100.0 / Math.max(1, recentScores.size())));
        }

        return SignalBacktestResult.builder()
                .symbol(request.getSymbol())
                .timeframe(request.getTimeframe())
                .bars(request.getBars().size())
                .threshold(threshold)
                .horizon(horizon)
                .dailyFilter(request.getDailyFilter())
                .events(events.size())
                .winRate(events.isEmpty() ? 0 : round2(wins.size() * 100.0 / events.size()))
                .avgFwd(round2(average(forwardReturns) * 100))
                .medianFwd(round2(median(forwardReturns) * 100))
                .avgWin(round2(avgWin * 100))
                .avgLoss(round2(avgLoss * 100))
                .profitFactor(profitFactor)
                .scoreAvg(round2(average(recentScores)))
                .scorePcts(Collections.unmodifiableMap(scorePcts))
                .recentScores(Collections.unmodifiableList(recentScores))
                .eventList(Collections.unmodifiableList(events))
                .curve(toCurve(thresholds, curve))
                .curveBull(withDailyCurves ? toCurve(thresholds, curveBull) : Collections.emptyList())
                .curveBear(withDailyCurves ? toCurve(thresholds, curveBear) : Collections.emptyList())
                .build();
    }

    private static boolean passes(SignalState daily, DailyFilter filter) {
        return switch (filter) {
            case BULL -> isRegime(daily, Trend.BULLISH);
            case BEAR -> isRegime(daily, Trend.BEARISH);
            case NONE -> true;
        };
    }

    private static boolean isRegime(SignalState daily, Trend trend) {
        return daily.getPivotNow() == trend && daily.getIchimokuRegime() == trend;
    }

    private void trim(Deque<Double> scores) {
        while (scores.size() > properties.getMaxRecentScores()) {
            scores.removeFirst();
        }
    }

    private static List<List<Double>> emptyBins(int count) {
        List<List<Double>> bins = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bins.add(new ArrayList<>());
        }
        return bins;
    }

    private static void addToBins(List<List<Double>> bins, List<Integer> thresholds, double score,
                                  double forwardReturn) {
        for (int b = 0; b < thresholds.size(); b++) {
            if (score >= thresholds.get(b)) {
                bins.get(b).add(forwardReturn);
            }
        }
    }

    private static List<CurvePoint> toCurve(List<Integer> thresholds, List<List<Double>> bins) {
        List<CurvePoint> points = new ArrayList<>(thresholds.size());
        for (int b = 0; b < thresholds.size(); b++) {
            List<Double> returns = bins.get(b);
            long wins = returns.stream().filter(r -> r > 0).count();
            double winRate = returns.isEmpty() ? 0 : wins * 100.0 / returns.size();
            points.add(new CurvePoint(thresholds.get(b), returns.size(), round2(winRate),
                    round2(average(returns) * 100)));
        }
        return Collections.unmodifiableList(points);
    }

    static double average(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
