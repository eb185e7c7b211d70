package ch.xavier.signalengine.backtest.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class SignalEvent {
    private final int index;
    private final long time;
    private final double close;
    private final double score;
    /**
     * Return over the horizon as a fraction of the entry close.
     */
    private final double forwardReturn;
}
