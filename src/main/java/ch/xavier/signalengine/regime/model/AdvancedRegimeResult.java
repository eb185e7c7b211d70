package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

@Getter
@ToString
@AllArgsConstructor
public class AdvancedRegimeResult {
    private final MarketRegime regime;
    private final int confidence;
    private final Map<String, Object> analysis;
    private final Map<String, String> interpretation;

    public static AdvancedRegimeResult unknown() {
        return new AdvancedRegimeResult(MarketRegime.UNKNOWN, 0, Collections.emptyMap(), Collections.emptyMap());
    }
}
