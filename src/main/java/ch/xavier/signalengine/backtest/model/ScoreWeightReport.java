package ch.xavier.signalengine.backtest.model;

import ch.xavier.signalengine.score.ScoreComponent;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@Builder
public class ScoreWeightReport {
    private final int bars;
    private final int horizon;
    private final Map<ScoreComponent, ConditionReport> individual;
    private final List<ComboReport> combos;
    /**
     * Key of the analyzed condition with the highest average return, {@code "N/A"} when none qualified.
     */
    private final String bestPerformer;
    private final String message;
}
