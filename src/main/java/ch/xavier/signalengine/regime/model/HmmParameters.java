package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;
import lombok.Getter;

import java.util.Arrays;
import java.util.Random;

/**
 * Immutable parameter set of a Gaussian-emission hidden Markov model. Arrays are copied on the way in and out.
 */
public final class HmmParameters {
    @Getter
    private final int numStates;
    private final double[][] transitionMatrix;
    private final double[] means;
    private final double[] stds;
    private final double[] initialProbs;

    public HmmParameters(double[][] transitionMatrix, double[] means, double[] stds, double[] initialProbs) {
        int m = initialProbs.length;
        if (transitionMatrix.length != m || means.length != m || stds.length != m) {
            throw new IllegalArgumentException("HMM parameter arrays must all have " + m + " states");
        }
        this.numStates = m;
        this.transitionMatrix = copy(transitionMatrix);
        this.means = means.clone();
        this.stds = stds.clone();
        this.initialProbs = initialProbs.clone();
    }

    /**
     * Starting point for Baum-Welch: uniform initial distribution, random stochastic transition rows, and each
     * state's Gaussian taken from one of {@code numStates} consecutive slices of the observations.
     */
    public static HmmParameters initial(int numStates, double[] observations, Random random) {
        double[] initial = new double[numStates];
        Arrays.fill(initial, 1.0 / numStates);

        double[][] transitions = new double[numStates][numStates];
        for (int i = 0; i < numStates; i++) {
            double sum = 0;
            for (int j = 0; j < numStates; j++) {
                transitions[i][j] = random.nextDouble() + 1e-3;
                sum += transitions[i][j];
            }
            for (int j = 0; j < numStates; j++) {
                transitions[i][j] /= sum;
            }
        }

        double[] means = new double[numStates];
        double[] stds = new double[numStates];
        int sliceLength = observations.length / numStates;
        for (int i = 0; i < numStates; i++) {
            double[] slice = sliceLength > 0
                    ? SeriesMath.slice(observations, i * sliceLength, (i + 1) * sliceLength)
                    : observations;
            means[i] = slice.length > 0 ? SeriesMath.mean(slice) : 0;
            stds[i] = slice.length > 0 ? SeriesMath.std(slice) : 1;
        }
        return new HmmParameters(transitions, means, stds, initial);
    }

    public double[][] getTransitionMatrix() {
        return copy(transitionMatrix);
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double[] getStds() {
        return stds.clone();
    }

    public double[] getInitialProbs() {
        return initialProbs.clone();
    }

    double transition(int from, int to) {
        return transitionMatrix[from][to];
    }

    double mean(int state) {
        return means[state];
    }

    double std(int state) {
        return stds[state];
    }

    double initialProb(int state) {
        return initialProbs[state];
    }

    private static double[][] copy(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            out[i] = matrix[i].clone();
        }
        return out;
    }
}
