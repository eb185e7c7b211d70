package ch.xavier.signalengine.score;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class ScoreWeights {
    @Builder.Default
    private final int pivotRibbon = 20;
    @Builder.Default
    private final int ripster3450 = 20;
    @Builder.Default
    private final int satyTrigger = 20;
    @Builder.Default
    private final int squeezeOn = 10;
    @Builder.Default
    private final int squeezeFired = 25;
    @Builder.Default
    private final int ichimoku = 15;

    public static ScoreWeights defaults() {
        return ScoreWeights.builder().build();
    }

    public int weightOf(ScoreComponent component) {
        return switch (component) {
            case PIVOT_RIBBON -> pivotRibbon;
            case RIPSTER_34_50 -> ripster3450;
            case SATY_TRIGGER -> satyTrigger;
            case SQUEEZE_ON -> squeezeOn;
            case SQUEEZE_FIRED -> squeezeFired;
            case ICHIMOKU -> ichimoku;
            case CONSENSUS -> 0;
        };
    }

    /**
     * Fired weight decays linearly to a fifth of itself four bars after the fire, and to nothing after that.
     */
    public double firedWeight(int barsAgo) {
        if (barsAgo < 0 || barsAgo > 4) {
            return 0;
        }
        return squeezeFired * (5 - barsAgo) / 5.0;
    }
}
