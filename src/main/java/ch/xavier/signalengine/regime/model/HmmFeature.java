package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;

public enum HmmFeature {
    RETURNS,
    VOLATILITY,
    PRICE;

    public double[] extract(double[] closes) {
        return switch (this) {
            case RETURNS -> SeriesMath.logReturns(closes);
            case VOLATILITY -> {
                double[] returns = SeriesMath.logReturns(closes);
                for (int i = 0; i < returns.length; i++) {
                    returns[i] = Math.abs(returns[i]);
                }
                yield returns;
            }
            case PRICE -> closes.clone();
        };
    }
}
