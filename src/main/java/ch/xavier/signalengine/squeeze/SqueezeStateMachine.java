package ch.xavier.signalengine.squeeze;

import ch.xavier.signalengine.indicator.Direction;
import ch.xavier.signalengine.indicator.SqueezeBands;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ON / FIRED / OFF derivation over the squeeze bands. Each scan starts from {@link SqueezeState#initial()}, nothing
 * is carried between calls.
 */
public final class SqueezeStateMachine {

    private SqueezeStateMachine() {
    }

    /**
     * Single transition.
     *
     * @param previous state at the previous bar
     * @param on       whether the Bollinger band sits inside the Keltner channel at this bar
     * @param momentum regression momentum at this bar, its sign gives the fire direction
     * @return state at this bar
     */
    public static SqueezeState advance(SqueezeState previous, boolean on, double momentum) {
        if (on) {
            return new SqueezeState(true, false, Direction.NONE, null);
        }
        if (previous.isOn()) {
            return new SqueezeState(false, true, Direction.ofSign(momentum), 0);
        }
        Integer firedBarsAgo = previous.getFiredBarsAgo() == null ? null : previous.getFiredBarsAgo() + 1;
        return new SqueezeState(false, false, previous.getDirection(), firedBarsAgo);
    }

    public static SqueezeHistory scan(SqueezeBands.Result bands) {
        List<SqueezeState> states = new ArrayList<>(bands.size());
        SqueezeState state = SqueezeState.initial();
        boolean[] on = bands.getSqueezeOn();
        double[] momentum = bands.getMomentum();

        for (int i = 0; i < bands.size(); i++) {
            if (i >= bands.getFirstDefinedIndex()) {
                state = advance(state, on[i], momentum[i]);
            }
            states.add(state);
        }
        return new SqueezeHistory(Collections.unmodifiableList(states));
    }
}
