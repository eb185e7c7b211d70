package ch.xavier.signalengine.backtest.model;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.consensus.Timeframe;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Threshold, horizon and curve thresholds left {@code null} fall back to the configured defaults.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = {"bars", "dailyBars"})
public class SignalBacktestRequest {
    @Builder.Default
    private final String symbol = "";
    @Builder.Default
    private final Timeframe timeframe = Timeframe.ONE_MINUTE;
    @Builder.Default
    private final List<Bar> bars = Collections.emptyList();
    private final Double threshold;
    private final Integer horizon;
    private final List<Integer> curveThresholds;
    @Builder.Default
    private final DailyFilter dailyFilter = DailyFilter.NONE;
    /**
     * Daily bars of the same symbol, only read when {@link #dailyFilter} is not {@link DailyFilter#NONE}.
     */
    @Builder.Default
    private final List<Bar> dailyBars = Collections.emptyList();
}
