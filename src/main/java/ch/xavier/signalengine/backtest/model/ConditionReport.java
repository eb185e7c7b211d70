package ch.xavier.signalengine.backtest.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Forward-return profile of one score condition. Returns are in percent; {@code recommendedWeight} is
 * {@code null} when the condition occurred too rarely to be analyzed.
 */
@Getter
@Builder
@ToString
public class ConditionReport {
    private final int occurrences;
    private final double rarity;
    private final double avgReturn;
    private final double bullReturn;
    private final double bearReturn;
    private final double regimeFit;
    private final Integer recommendedWeight;
    private final String note;

    public boolean isAnalyzed() {
        return recommendedWeight != null;
    }
}
