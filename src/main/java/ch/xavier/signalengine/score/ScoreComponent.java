package ch.xavier.signalengine.score;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ScoreComponent {
    PIVOT_RIBBON("pivotRibbon"),
    RIPSTER_34_50("ripster3450"),
    SATY_TRIGGER("satyTrigger"),
    SQUEEZE_ON("squeezeOn"),
    SQUEEZE_FIRED("squeezeFired"),
    ICHIMOKU("ichimoku"),
    CONSENSUS("consensus");

    private final String key;
}
