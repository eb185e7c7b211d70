package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class TransitionRisk {
    /**
     * Probability of the predicted transition in percent, 0 when no alert is raised.
     */
    private final double risk;
    private final String message;
    private final MarketRegime predictedRegime;

    public boolean isAlert() {
        return predictedRegime != null;
    }
}
