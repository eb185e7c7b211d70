package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import ch.xavier.signalengine.regime.MarketRegime;
import lombok.Getter;

import java.util.List;
import java.util.Random;

/**
 * Fits a fresh HMM to the last {@code lookback} bars on every call and reads the regime of the last bar.
 * <p>
 * Hidden states are ordered by their emission standard deviation, the calmest state is
 * {@link MarketRegime#LOW_VOLATILITY} and the widest {@link MarketRegime#HIGH_VOLATILITY}. The transition matrix
 * is initialised from {@code random}, so fits are reproducible only with a seeded generator.
 */
@Getter
public class HmmRegimeDetector {
    private final int numStates;
    private final int lookback;
    private final int iterations;
    private final HmmFeature feature;
    private final Random random;

    public HmmRegimeDetector(int numStates, int lookback, int iterations, HmmFeature feature, Random random) {
        if (numStates < 1) {
            throw new IllegalArgumentException("HMM needs at least one state");
        }
        this.numStates = numStates;
        this.lookback = lookback;
        this.iterations = iterations;
        this.feature = feature;
        this.random = random;
    }

    public HmmRegimeResult detect(List<Bar> bars) {
        if (bars.size() < lookback) {
            return HmmRegimeResult.unknown();
        }
        double[] closes = SeriesMath.tail(Bars.closes(bars), lookback);
        double[] observations = feature.extract(closes);
        if (observations.length < numStates * 2) {
            return HmmRegimeResult.unknown();
        }

        HmmParameters trained = HiddenMarkovModel.train(
                HmmParameters.initial(numStates, observations, random), observations, iterations);
        int[] states = HiddenMarkovModel.decode(trained, observations);
        double[] probabilities = HiddenMarkovModel.stateProbabilities(trained, observations);
        int currentState = states[states.length - 1];

        return new HmmRegimeResult(
                labelOf(currentState, trained.getStds()),
                (int) Math.round(probabilities[currentState] * 100),
                probabilities,
                states,
                currentState,
                trained.getTransitionMatrix());
    }

    static MarketRegime labelOf(int state, double[] stds) {
        if (stds.length == 1) {
            return MarketRegime.MODERATE;
        }
        int rank = 0;
        for (int i = 0; i < stds.length; i++) {
            if (stds[i] < stds[state] || (stds[i] == stds[state] && i < state)) {
                rank++;
            }
        }
        if (rank == 0) {
            return MarketRegime.LOW_VOLATILITY;
        } else if (rank == stds.length - 1) {
            return MarketRegime.HIGH_VOLATILITY;
        }
        return MarketRegime.MODERATE;
    }
}
