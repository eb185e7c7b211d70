package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@ToString
@AllArgsConstructor
public class RegimeUpdate {
    private final MarketRegime regime;
    private final int confidence;
    private final boolean changed;
    private final Map<String, Object> analysis;
    /**
     * Most likely next regime, {@code null} until the history is long enough for a transition matrix.
     */
    private final RegimePrediction prediction;
}
