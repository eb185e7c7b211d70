package ch.xavier.signalengine.consensus;

import ch.xavier.signalengine.score.SignalState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ConsensusScore {
    private final double baseScore;
    private final int bonus;
    private final double score;
    private final boolean align;
    private final SignalState state;
}
