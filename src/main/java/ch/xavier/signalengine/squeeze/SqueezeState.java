package ch.xavier.signalengine.squeeze;

import ch.xavier.signalengine.indicator.Direction;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class SqueezeState {
    private static final SqueezeState INITIAL = new SqueezeState(false, false, Direction.NONE, null);

    private final boolean on;
    private final boolean fired;
    private final Direction direction;
    /**
     * Bars since the last fire, {@code null} when nothing fired since the squeeze last turned on.
     */
    private final Integer firedBarsAgo;

    public static SqueezeState initial() {
        return INITIAL;
    }

    public boolean hasFiredWithin(int bars) {
        return firedBarsAgo != null && firedBarsAgo < bars;
    }
}
