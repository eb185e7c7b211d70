package ch.xavier.signalengine.backtest;

import ch.xavier.signalengine.TestBars;
import ch.xavier.signalengine.backtest.model.ComboReport;
import ch.xavier.signalengine.backtest.model.ConditionReport;
import ch.xavier.signalengine.backtest.model.ScoreWeightReport;
import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.indicator.OverlayService;
import ch.xavier.signalengine.score.ScoreComponent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoreWeightOptimizerTest {

    private final ScoreWeightOptimizer optimizer =
            new ScoreWeightOptimizer(new OverlayService(new SignalEngineProperties()));

    @Test
    @DisplayName("fewer than 100 bars is not analysed")
    void insufficientData() {
        ScoreWeightReport report = optimizer.analyze(TestBars.rising(99, 100, 1), 10, 10);
        assertEquals(ScoreWeightOptimizer.INSUFFICIENT_DATA, report.getMessage());
        assertTrue(report.getIndividual().isEmpty());
        assertEquals("N/A", report.getBestPerformer());
    }

    @Test
    @DisplayName("uptrend conditions are profitable and frequent conditions are capped")
    void uptrend() {
        ScoreWeightReport report = optimizer.analyze(TestBars.rising(200, 100, 1), 10, 10);
        assertEquals(200, report.getBars());
        assertEquals(6, report.getIndividual().size());
        assertFalse(report.getIndividual().containsKey(ScoreComponent.CONSENSUS));

        ConditionReport ribbon = report.getIndividual().get(ScoreComponent.PIVOT_RIBBON);
        assertTrue(ribbon.isAnalyzed());
        assertTrue(ribbon.getAvgReturn() > 0);
        assertTrue(ribbon.getRarity() > 50);
        assertTrue(ribbon.getRecommendedWeight() >= 5 && ribbon.getRecommendedWeight() <= 30);

        ConditionReport squeeze = report.getIndividual().get(ScoreComponent.SQUEEZE_ON);
        assertEquals(0, squeeze.getOccurrences());
        assertFalse(squeeze.isAnalyzed());
        assertNotNull(squeeze.getNote());

        assertNotEquals("N/A", report.getBestPerformer());
        assertTrue(report.getCombos().stream().map(ComboReport::getName)
                .anyMatch("pivotRibbon + ripster3450"::equals));
    }

    @Test
    @DisplayName("a zero close is left out of the forward returns")
    void zeroClose() {
        List<Bar> bars = new ArrayList<>(TestBars.rising(200, 100, 1));
        bars.set(150, Bar.of(bars.get(150).getTime(), 0, 0, 0, 0, 1_000));
        ScoreWeightReport report = optimizer.analyze(bars, 10, 10);

        report.getIndividual().values().stream()
                .filter(ConditionReport::isAnalyzed)
                .forEach(condition -> {
                    assertTrue(Double.isFinite(condition.getAvgReturn()));
                    assertTrue(Double.isFinite(condition.getRegimeFit()));
                });
        report.getCombos().forEach(combo -> assertTrue(Double.isFinite(combo.getAvgReturn())));
        assertNotEquals("N/A", report.getBestPerformer());
    }

    @Test
    @DisplayName("recommended weight rewards rare, profitable conditions")
    void recommendedWeight() {
        assertEquals(30, ScoreWeightOptimizer.recommendedWeight(5, 5));
        assertEquals(5, ScoreWeightOptimizer.recommendedWeight(-1, 5));
        assertEquals(10, ScoreWeightOptimizer.recommendedWeight(2, 20));
        assertEquals(5, ScoreWeightOptimizer.recommendedWeight(0.5, 80));
    }
}
