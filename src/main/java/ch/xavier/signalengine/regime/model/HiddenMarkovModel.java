package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Baum-Welch training and Viterbi decoding for Gaussian-emission HMMs. Every operation takes a parameter set and
 * returns a new one, nothing is updated in place.
 * <p>
 * Forward and backward passes are rescaled per bar. Emissions are evaluated in log space and shifted by the
 * per-bar maximum before exponentiation so that sharp Gaussians do not underflow.
 */
public final class HiddenMarkovModel {
    private static final double MIN_RELATIVE_STD = 1e-3;
    private static final double MIN_ABSOLUTE_STD = 1e-10;

    private HiddenMarkovModel() {
    }

    @Getter
    @AllArgsConstructor
    public static class Posterior {
        private final double[][] gamma;
        private final double[][][] xi;
        private final double logLikelihood;
    }

    public static HmmParameters train(HmmParameters initial, double[] observations, int iterations) {
        if (observations.length < 2) {
            return initial;
        }
        double stdFloor = stdFloor(observations);
        HmmParameters params = floorStds(initial, stdFloor);
        for (int iteration = 0; iteration < iterations; iteration++) {
            Posterior posterior = forwardBackward(params, observations);
            params = reestimate(params, observations, posterior, stdFloor);
        }
        return params;
    }

    public static Posterior forwardBackward(HmmParameters params, double[] observations) {
        int n = observations.length;
        int m = params.getNumStates();
        double[][] alpha = new double[n][m];
        double[][] beta = new double[n][m];
        double[][] emissions = new double[n][];
        double[] emissionShift = new double[n];
        for (int t = 0; t < n; t++) {
            double[] logEmission = logEmissions(params, observations[t]);
            emissionShift[t] = max(logEmission);
            emissions[t] = new double[m];
            for (int i = 0; i < m; i++) {
                emissions[t][i] = Math.exp(logEmission[i] - emissionShift[t]);
            }
        }

        double logLikelihood = 0;
        for (int t = 0; t < n; t++) {
            for (int i = 0; i < m; i++) {
                double prior;
                if (t == 0) {
                    prior = params.initialProb(i);
                } else {
                    prior = 0;
                    for (int j = 0; j < m; j++) {
                        prior += alpha[t - 1][j] * params.transition(j, i);
                    }
                }
                alpha[t][i] = prior * emissions[t][i];
            }
            double scale = normalize(alpha[t]);
            logLikelihood += Math.log(Math.max(scale, Double.MIN_VALUE)) + emissionShift[t];
        }

        for (int i = 0; i < m; i++) {
            beta[n - 1][i] = 1;
        }
        for (int t = n - 2; t >= 0; t--) {
            for (int i = 0; i < m; i++) {
                double sum = 0;
                for (int j = 0; j < m; j++) {
                    sum += params.transition(i, j) * emissions[t + 1][j] * beta[t + 1][j];
                }
                beta[t][i] = sum;
            }
            normalize(beta[t]);
        }

        double[][] gamma = new double[n][m];
        for (int t = 0; t < n; t++) {
            for (int i = 0; i < m; i++) {
                gamma[t][i] = alpha[t][i] * beta[t][i];
            }
            normalize(gamma[t]);
        }

        double[][][] xi = new double[Math.max(0, n - 1)][m][m];
        for (int t = 0; t < n - 1; t++) {
            double sum = 0;
            for (int i = 0; i < m; i++) {
                for (int j = 0; j < m; j++) {
                    xi[t][i][j] = alpha[t][i] * params.transition(i, j) * emissions[t + 1][j] * beta[t + 1][j];
                    sum += xi[t][i][j];
                }
            }
            for (int i = 0; i < m; i++) {
                for (int j = 0; j < m; j++) {
                    xi[t][i][j] = sum > 0 ? xi[t][i][j] / sum : 1.0 / (m * m);
                }
            }
        }
        return new Posterior(gamma, xi, logLikelihood);
    }

    /**
     * Most likely state path.
     */
    public static int[] decode(HmmParameters params, double[] observations) {
        int n = observations.length;
        int m = params.getNumStates();
        if (n == 0) {
            return new int[0];
        }

        double[][] score = new double[n][m];
        int[][] backPointer = new int[n][m];
        double[] first = logEmissions(params, observations[0]);
        for (int i = 0; i < m; i++) {
            score[0][i] = Math.log(params.initialProb(i)) + first[i];
        }

        for (int t = 1; t < n; t++) {
            double[] logEmission = logEmissions(params, observations[t]);
            for (int i = 0; i < m; i++) {
                double best = Double.NEGATIVE_INFINITY;
                int bestState = 0;
                for (int j = 0; j < m; j++) {
                    double candidate = score[t - 1][j] + Math.log(params.transition(j, i));
                    if (candidate > best) {
                        best = candidate;
                        bestState = j;
                    }
                }
                score[t][i] = best + logEmission[i];
                backPointer[t][i] = bestState;
            }
        }

        int[] states = new int[n];
        states[n - 1] = argMax(score[n - 1]);
        for (int t = n - 2; t >= 0; t--) {
            states[t] = backPointer[t + 1][states[t + 1]];
        }
        return states;
    }

    /**
     * State occupancy probabilities at the last observation.
     */
    public static double[] stateProbabilities(HmmParameters params, double[] observations) {
        if (observations.length == 0) {
            return params.getInitialProbs();
        }
        double[][] gamma = forwardBackward(params, observations).getGamma();
        return gamma[gamma.length - 1].clone();
    }

    private static HmmParameters reestimate(HmmParameters params, double[] observations, Posterior posterior,
                                            double stdFloor) {
        int n = observations.length;
        int m = params.getNumStates();
        double[][] gamma = posterior.getGamma();
        double[][][] xi = posterior.getXi();

        double[] initial = gamma[0].clone();

        double[][] transitions = params.getTransitionMatrix();
        for (int i = 0; i < m; i++) {
            double[] row = new double[m];
            for (int t = 0; t < n - 1; t++) {
                for (int j = 0; j < m; j++) {
                    row[j] += xi[t][i][j];
                }
            }
            if (normalize(row) > 0) {
                transitions[i] = row;
            }
        }

        double[] means = params.getMeans();
        double[] stds = params.getStds();
        for (int i = 0; i < m; i++) {
            double weight = 0;
            double weightedSum = 0;
            for (int t = 0; t < n; t++) {
                weight += gamma[t][i];
                weightedSum += gamma[t][i] * observations[t];
            }
            if (weight <= 0) {
                continue;
            }
            double mean = weightedSum / weight;
            double varianceSum = 0;
            for (int t = 0; t < n; t++) {
                double diff = observations[t] - mean;
                varianceSum += gamma[t][i] * diff * diff;
            }
            means[i] = mean;
            stds[i] = Math.max(stdFloor, Math.sqrt(varianceSum / weight));
        }
        return new HmmParameters(transitions, means, stds, initial);
    }

    private static double[] logEmissions(HmmParameters params, double observation) {
        double[] out = new double[params.getNumStates()];
        for (int i = 0; i < out.length; i++) {
            double variance = params.std(i) * params.std(i);
            double diff = observation - params.mean(i);
            out[i] = -0.5 * Math.log(2 * Math.PI * variance) - diff * diff / (2 * variance);
        }
        return out;
    }

    private static double stdFloor(double[] observations) {
        double std = SeriesMath.std(observations);
        return Math.max(MIN_ABSOLUTE_STD, SeriesMath.isDefined(std) ? std * MIN_RELATIVE_STD : 0);
    }

    private static HmmParameters floorStds(HmmParameters params, double stdFloor) {
        double[] stds = params.getStds();
        for (int i = 0; i < stds.length; i++) {
            if (!(stds[i] >= stdFloor)) {
                stds[i] = stdFloor;
            }
        }
        return new HmmParameters(params.getTransitionMatrix(), params.getMeans(), stds, params.getInitialProbs());
    }

    // in place; an all-zero vector becomes uniform. Returns the sum before normalisation.
    private static double normalize(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        for (int i = 0; i < values.length; i++) {
            values[i] = sum > 0 ? values[i] / sum : 1.0 / values.length;
        }
        return sum;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }

    private static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
