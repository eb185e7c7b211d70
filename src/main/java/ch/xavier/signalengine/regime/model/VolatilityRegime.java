package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.math.SeriesMath;
import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class VolatilityRegime {
    private final MarketRegime regime;
    private final double volatility;
    /**
     * Share of the fitted volatility path strictly below the current volatility, 0 to 100.
     */
    private final double percentile;
    private final double[] forecast;
    private final GarchParameters parameters;

    public static VolatilityRegime unknown() {
        return new VolatilityRegime(MarketRegime.UNKNOWN, SeriesMath.UNDEFINED, 0, new double[0], null);
    }
}
