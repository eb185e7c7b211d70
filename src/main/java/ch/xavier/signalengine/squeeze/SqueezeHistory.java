package ch.xavier.signalengine.squeeze;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class SqueezeHistory {
    private final List<SqueezeState> states;

    public SqueezeState stateAt(int index) {
        return index >= 0 && index < states.size() ? states.get(index) : SqueezeState.initial();
    }

    public SqueezeState current() {
        return stateAt(states.size() - 1);
    }
}
