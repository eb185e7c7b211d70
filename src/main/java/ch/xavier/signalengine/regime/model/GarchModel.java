package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;
import ch.xavier.signalengine.regime.MarketRegime;

/**
 * GARCH(1,1) fitted by grid search on the Gaussian log-likelihood. The recursion starts from the sample variance
 * of the returns.
 */
public final class GarchModel {
    private static final double[] OMEGA_GRID = {1e-5, 1e-4, 1e-3};
    private static final double[] ALPHA_GRID = {0.05, 0.10, 0.15, 0.20};
    private static final double[] BETA_GRID = {0.70, 0.80, 0.85, 0.90};
    private static final int REGIME_FORECAST_STEPS = 5;

    private GarchModel() {
    }

    /**
     * Best stationary grid point, {@link GarchParameters#DEFAULT} when no grid point has a finite likelihood.
     */
    public static GarchFit fit(double[] returns) {
        GarchParameters best = GarchParameters.DEFAULT;
        double bestLogLikelihood = Double.NEGATIVE_INFINITY;

        for (double omega : OMEGA_GRID) {
            for (double alpha : ALPHA_GRID) {
                for (double beta : BETA_GRID) {
                    if (alpha + beta >= 1) {
                        continue;
                    }
                    GarchParameters candidate = new GarchParameters(omega, alpha, beta);
                    double logLikelihood = logLikelihood(returns, conditionalVariances(candidate, returns));
                    if (logLikelihood > bestLogLikelihood) {
                        bestLogLikelihood = logLikelihood;
                        best = candidate;
                    }
                }
            }
        }
        return new GarchFit(best, bestLogLikelihood, conditionalVariances(best, returns));
    }

    public static double[] conditionalVariances(GarchParameters params, double[] returns) {
        double[] variances = new double[returns.length];
        if (returns.length == 0) {
            return variances;
        }
        variances[0] = SeriesMath.variance(returns);
        for (int i = 1; i < returns.length; i++) {
            variances[i] = params.getOmega()
                    + params.getAlpha() * returns[i - 1] * returns[i - 1]
                    + params.getBeta() * variances[i - 1];
        }
        return variances;
    }

    public static double logLikelihood(double[] returns, double[] variances) {
        if (returns.length == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        double logLikelihood = 0;
        for (int i = 0; i < returns.length; i++) {
            if (!(variances[i] > 0)) {
                return Double.NEGATIVE_INFINITY;
            }
            logLikelihood -= 0.5 * (Math.log(2 * Math.PI) + Math.log(variances[i])
                    + returns[i] * returns[i] / variances[i]);
        }
        return logLikelihood;
    }

    /**
     * Variance forecasts for the next {@code steps} bars, converging to the long-run variance.
     */
    public static double[] forecast(GarchParameters params, double[] returns, int steps) {
        double[] forecasts = new double[Math.max(0, steps)];
        if (returns.length == 0 || steps <= 0) {
            return forecasts;
        }
        double[] variances = conditionalVariances(params, returns);
        double lastReturn = returns[returns.length - 1];
        double current = params.getOmega()
                + params.getAlpha() * lastReturn * lastReturn
                + params.getBeta() * variances[variances.length - 1];
        for (int i = 0; i < steps; i++) {
            forecasts[i] = current;
            current = params.getOmega() + params.persistence() * current;
        }
        return forecasts;
    }

    public static VolatilityRegime detectVolatilityRegime(GarchParameters params, double[] returns) {
        if (returns.length == 0) {
            return VolatilityRegime.unknown();
        }
        double[] variances = conditionalVariances(params, returns);
        double[] volatilities = new double[variances.length];
        for (int i = 0; i < variances.length; i++) {
            volatilities[i] = Math.sqrt(variances[i]);
        }
        double current = volatilities[volatilities.length - 1];
        double percentile = SeriesMath.percentileRank(volatilities, current);

        MarketRegime regime = MarketRegime.MODERATE;
        if (percentile > 80) {
            regime = MarketRegime.HIGH_VOLATILITY;
        } else if (percentile < 20) {
            regime = MarketRegime.LOW_VOLATILITY;
        }
        return new VolatilityRegime(regime, current, percentile,
                forecast(params, returns, REGIME_FORECAST_STEPS), params);
    }
}
