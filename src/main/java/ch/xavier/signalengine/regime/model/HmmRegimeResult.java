package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.regime.MarketRegime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class HmmRegimeResult {
    private final MarketRegime regime;
    private final int confidence;
    private final double[] probabilities;
    private final int[] states;
    private final int currentState;
    private final double[][] transitionMatrix;

    public static HmmRegimeResult unknown() {
        return new HmmRegimeResult(MarketRegime.UNKNOWN, 0, new double[0], new int[0], -1, new double[0][0]);
    }
}
