package ch.xavier.signalengine.consensus;

import ch.xavier.signalengine.indicator.Trend;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ConsensusResult {
    private final Timeframe primaryTimeframe;
    private final Timeframe secondaryTimeframe;
    private final boolean align;
    private final Trend primary;
    private final Trend secondary;

    public static ConsensusResult none(Timeframe primaryTimeframe) {
        return new ConsensusResult(primaryTimeframe, null, false, Trend.NEUTRAL, Trend.NEUTRAL);
    }
}
