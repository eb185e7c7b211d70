package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class RegimeRecord {
    private final long timestamp;
    private final MarketRegime regime;
    private final int confidence;
}
