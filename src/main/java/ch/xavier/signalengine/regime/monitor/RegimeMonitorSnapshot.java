package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class RegimeMonitorSnapshot {
    private final List<RegimeRecord> history;
    private final MarketRegime currentRegime;
    private final TransitionMatrix transitionMatrix;
    private final int stability;
}
