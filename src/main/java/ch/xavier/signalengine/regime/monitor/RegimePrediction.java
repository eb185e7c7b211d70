package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@ToString
@AllArgsConstructor
public class RegimePrediction {
    private final MarketRegime regime;
    private final double probability;
    private final Map<MarketRegime, Double> allProbabilities;
}
