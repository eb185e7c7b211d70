package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.regime.MarketRegime;
import ch.xavier.signalengine.regime.model.AdvancedRegimeResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Rolling regime history with transition statistics. Not thread-safe: one owner, or serialised access as done by
 * {@link RegimeMonitorRegistry}.
 */
@Slf4j
public class RegimeMonitor {
    private static final int STABILITY_WINDOW = 10;
    public static final int MAX_CAPACITY = 100;

    private final Function<List<Bar>, AdvancedRegimeResult> detector;
    @Getter
    private final double alertThreshold;
    @Getter
    private final int capacity;

    private final Deque<RegimeRecord> history = new ArrayDeque<>();
    private TransitionMatrix transitionMatrix;
    @Getter
    private MarketRegime currentRegime;

    /**
     * @param capacity history length, at most {@link #MAX_CAPACITY}; larger values are clamped
     */
    public RegimeMonitor(Function<List<Bar>, AdvancedRegimeResult> detector, double alertThreshold, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        if (capacity > MAX_CAPACITY) {
            log.warn("Regime history capacity {} exceeds {}, clamping", capacity, MAX_CAPACITY);
        }
        this.detector = detector;
        this.alertThreshold = alertThreshold;
        this.capacity = Math.min(capacity, MAX_CAPACITY);
    }

    public RegimeMonitor(Function<List<Bar>, AdvancedRegimeResult> detector) {
        this(detector, 0.7, MAX_CAPACITY);
    }

    /**
     * Detects the regime of {@code bars} and records it under the time of the last bar.
     */
    public RegimeUpdate update(List<Bar> bars) {
        AdvancedRegimeResult result = detector.apply(bars);
        long timestamp = bars.isEmpty() ? 0 : Bars.last(bars).getTime();

        history.addLast(new RegimeRecord(timestamp, result.getRegime(), result.getConfidence()));
        while (history.size() > capacity) {
            history.removeFirst();
        }

        List<MarketRegime> sequence = new ArrayList<>(history.size());
        for (RegimeRecord record : history) {
            sequence.add(record.getRegime());
        }
        transitionMatrix = TransitionMatrix.estimate(sequence).orElse(null);

        boolean changed = currentRegime != result.getRegime();
        if (changed) {
            log.debug("Regime changed from {} to {} at {}", currentRegime, result.getRegime(), timestamp);
        }
        currentRegime = result.getRegime();

        RegimePrediction prediction = transitionMatrix == null ? null : transitionMatrix.predictNext(currentRegime);
        return new RegimeUpdate(result.getRegime(), result.getConfidence(), changed, result.getAnalysis(), prediction);
    }

    /**
     * 100 minus 25 per distinct regime among the last ten records, 0 before ten records exist.
     */
    public int stability() {
        if (history.size() < STABILITY_WINDOW) {
            return 0;
        }
        Set<MarketRegime> distinct = new HashSet<>();
        int skip = history.size() - STABILITY_WINDOW;
        for (RegimeRecord record : history) {
            if (skip-- > 0) {
                continue;
            }
            distinct.add(record.getRegime());
        }
        return Math.max(0, 100 - distinct.size() * 25);
    }

    public TransitionRisk transitionRisk() {
        if (transitionMatrix == null || currentRegime == null) {
            return new TransitionRisk(0, "Insufficient data", null);
        }
        RegimePrediction prediction = transitionMatrix.predictNext(currentRegime);
        if (prediction.getRegime() != currentRegime && prediction.getProbability() > alertThreshold) {
            String message = String.format(Locale.ROOT, "High probability (%.0f%%) of transition to %s",
                    prediction.getProbability() * 100, prediction.getRegime().getLabel());
            log.info("Regime transition alert: {}", message);
            return new TransitionRisk(prediction.getProbability() * 100, message, prediction.getRegime());
        }
        return new TransitionRisk(0, "Regime appears stable", null);
    }

    public List<RegimeRecord> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public RegimeMonitorSnapshot snapshot() {
        return new RegimeMonitorSnapshot(history(), currentRegime, transitionMatrix, stability());
    }
}
