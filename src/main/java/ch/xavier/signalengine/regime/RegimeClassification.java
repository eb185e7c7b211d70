package ch.xavier.signalengine.regime;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

@Getter
@ToString
@AllArgsConstructor
public class RegimeClassification {
    private final MarketRegime regime;
    private final int confidence;
    private final Map<String, Object> factors;
    private final String recommendation;

    public static RegimeClassification unknown(String recommendation) {
        return new RegimeClassification(MarketRegime.UNKNOWN, 0, Collections.emptyMap(), recommendation);
    }
}
