package ch.xavier.signalengine.backtest.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ComboReport {
    private final String name;
    private final int occurrences;
    private final double rarity;
    private final double avgReturn;
}
