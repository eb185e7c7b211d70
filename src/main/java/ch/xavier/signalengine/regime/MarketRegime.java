package ch.xavier.signalengine.regime;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum MarketRegime {
    TRENDING_BULL("Trending Bull"),
    TRENDING_BEAR("Trending Bear"),
    HIGH_VOLATILITY("High Volatility"),
    LOW_LIQUIDITY("Low Liquidity"),
    RANGING("Choppy Range"),
    WEAK_TREND("Weak Trend"),
    TRENDING("Trending"),
    MEAN_REVERTING("Mean Reverting"),
    RANDOM("Random Walk"),
    LOW_VOLATILITY("Low Volatility"),
    MODERATE("Moderate Volatility"),
    NEUTRAL("Neutral"),
    UNKNOWN("Unknown");

    private final String label;
}
