package ch.xavier.signalengine.score;

import ch.xavier.signalengine.indicator.Direction;
import ch.xavier.signalengine.indicator.Trend;
import ch.xavier.signalengine.squeeze.SqueezeState;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class SignalState {
    private final long time;
    private final double score;
    private final Map<ScoreComponent, Double> components;
    private final Trend pivotNow;
    private final Direction satyDirection;
    private final Trend ichimokuRegime;
    private final SqueezeState squeeze;

    public double contribution(ScoreComponent component) {
        Double value = components.get(component);
        return value == null ? 0 : value;
    }
}
