package ch.xavier.signalengine.backtest.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class CurvePoint {
    private final int threshold;
    private final int events;
    private final double winRate;
    private final double avgFwd;
}
