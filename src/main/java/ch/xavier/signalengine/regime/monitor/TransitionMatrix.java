package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Empirical first-order transition probabilities between the regimes of an observed sequence. Rows of regimes
 * that were never left (only seen as the last element) are all zero.
 */
@ToString
public final class TransitionMatrix {
    public static final int MIN_OBSERVATIONS = 10;

    private final Map<MarketRegime, Map<MarketRegime, Double>> probabilities;

    private TransitionMatrix(Map<MarketRegime, Map<MarketRegime, Double>> probabilities) {
        this.probabilities = probabilities;
    }

    /**
     * @return the matrix, or empty when the sequence has fewer than {@link #MIN_OBSERVATIONS} entries
     */
    public static Optional<TransitionMatrix> estimate(List<MarketRegime> sequence) {
        if (sequence.size() < MIN_OBSERVATIONS) {
            return Optional.empty();
        }

        Set<MarketRegime> regimes = new LinkedHashSet<>(sequence);
        Map<MarketRegime, Map<MarketRegime, Double>> counts = new EnumMap<>(MarketRegime.class);
        for (MarketRegime from : regimes) {
            Map<MarketRegime, Double> row = new EnumMap<>(MarketRegime.class);
            for (MarketRegime to : regimes) {
                row.put(to, 0.0);
            }
            counts.put(from, row);
        }
        for (int i = 0; i < sequence.size() - 1; i++) {
            counts.get(sequence.get(i)).merge(sequence.get(i + 1), 1.0, Double::sum);
        }

        Map<MarketRegime, Map<MarketRegime, Double>> probabilities = new EnumMap<>(MarketRegime.class);
        for (Map.Entry<MarketRegime, Map<MarketRegime, Double>> entry : counts.entrySet()) {
            double total = 0;
            for (double count : entry.getValue().values()) {
                total += count;
            }
            Map<MarketRegime, Double> row = new EnumMap<>(MarketRegime.class);
            for (Map.Entry<MarketRegime, Double> cell : entry.getValue().entrySet()) {
                row.put(cell.getKey(), total > 0 ? cell.getValue() / total : 0.0);
            }
            probabilities.put(entry.getKey(), Collections.unmodifiableMap(row));
        }
        return Optional.of(new TransitionMatrix(Collections.unmodifiableMap(probabilities)));
    }

    public double probability(MarketRegime from, MarketRegime to) {
        Map<MarketRegime, Double> row = probabilities.get(from);
        if (row == null) {
            return 0;
        }
        return row.getOrDefault(to, 0.0);
    }

    public Map<MarketRegime, Map<MarketRegime, Double>> asMap() {
        return probabilities;
    }

    /**
     * Most probable successor of {@code current}. A regime without observed transitions predicts itself.
     */
    public RegimePrediction predictNext(MarketRegime current) {
        Map<MarketRegime, Double> row = probabilities.get(current);
        if (row == null) {
            return new RegimePrediction(current, 1.0, Collections.singletonMap(current, 1.0));
        }

        MarketRegime best = current;
        double bestProbability = 0;
        for (Map.Entry<MarketRegime, Double> cell : row.entrySet()) {
            if (cell.getValue() > bestProbability) {
                best = cell.getKey();
                bestProbability = cell.getValue();
            }
        }
        if (bestProbability == 0) {
            return new RegimePrediction(current, 1.0, row);
        }
        return new RegimePrediction(best, bestProbability, row);
    }
}
