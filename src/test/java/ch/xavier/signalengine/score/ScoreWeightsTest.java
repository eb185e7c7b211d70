package ch.xavier.signalengine.score;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreWeightsTest {

    private final ScoreWeights weights = ScoreWeights.defaults();

    @Test
    @DisplayName("default weights")
    void defaults() {
        assertEquals(20, weights.weightOf(ScoreComponent.PIVOT_RIBBON));
        assertEquals(20, weights.weightOf(ScoreComponent.RIPSTER_34_50));
        assertEquals(20, weights.weightOf(ScoreComponent.SATY_TRIGGER));
        assertEquals(10, weights.weightOf(ScoreComponent.SQUEEZE_ON));
        assertEquals(25, weights.weightOf(ScoreComponent.SQUEEZE_FIRED));
        assertEquals(15, weights.weightOf(ScoreComponent.ICHIMOKU));
        assertEquals(0, weights.weightOf(ScoreComponent.CONSENSUS));
    }

    @Test
    @DisplayName("fired weight decays linearly over five bars")
    void decay() {
        assertEquals(25, weights.firedWeight(0), 1e-9);
        assertEquals(20, weights.firedWeight(1), 1e-9);
        assertEquals(10, weights.firedWeight(3), 1e-9);
        assertEquals(5, weights.firedWeight(4), 1e-9);
        assertEquals(0, weights.firedWeight(5), 1e-9);
        assertEquals(0, weights.firedWeight(-1), 1e-9);
    }

    @Test
    @DisplayName("builder overrides single weights")
    void override() {
        ScoreWeights custom = weights.toBuilder().squeezeFired(50).build();
        assertEquals(50, custom.firedWeight(0), 1e-9);
        assertEquals(20, custom.getPivotRibbon());
    }
}
