package ch.xavier.signalengine.regime;

import ch.xavier.signalengine.TestBars;
import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.indicator.IchimokuCloud;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedRegimeClassifierTest {

    private final RuleBasedRegimeClassifier classifier = new RuleBasedRegimeClassifier();

    private static List<Bar> flatWithRisingVolume(int count) {
        List<Bar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bars.add(Bar.of(TestBars.START + i * TestBars.MINUTE, 100, 101, 99, 100, 1_000 + i));
        }
        return bars;
    }

    @Test
    @DisplayName("30 bars are not enough")
    void insufficientData() {
        RegimeClassification result = classifier.classify(TestBars.rising(30, 100, 1));
        assertEquals(MarketRegime.UNKNOWN, result.getRegime());
        assertEquals(0, result.getConfidence());
        assertEquals(RuleBasedRegimeClassifier.INSUFFICIENT_DATA, result.getRecommendation());
    }

    @Test
    @DisplayName("strong aligned uptrend on rising volume is a bullish trend")
    void trendingBull() {
        RegimeClassification result = classifier.classify(TestBars.rising(80, 100, 1));
        assertEquals(MarketRegime.TRENDING_BULL, result.getRegime());
        assertEquals(100, result.getConfidence());
        assertEquals(Boolean.TRUE, result.getFactors().get("bullishAlignment"));
        assertEquals("strong", result.getFactors().get("trendStrength"));
        assertEquals(100L, result.getFactors().get("volumePercentile"));
    }

    @Test
    @DisplayName("strong aligned downtrend is a bearish trend")
    void trendingBear() {
        RegimeClassification result = classifier.classify(TestBars.rising(80, 300, -1));
        assertEquals(MarketRegime.TRENDING_BEAR, result.getRegime());
        assertTrue(result.getRecommendation().startsWith("Strong downtrend"));
    }

    @Test
    @DisplayName("cloud factors are reported when a cloud is given")
    void withCloud() {
        List<Bar> bars = TestBars.rising(100, 100, 1);
        RegimeClassification result = classifier.classify(bars, new IchimokuCloud().calculate(bars));
        assertEquals(MarketRegime.TRENDING_BULL, result.getRegime());
        assertEquals(Boolean.TRUE, result.getFactors().get("aboveCloud"));
        assertEquals("green", result.getFactors().get("cloudColor"));
    }

    @Test
    @DisplayName("range expansion on the last bar is high volatility")
    void highVolatility() {
        List<Bar> bars = new ArrayList<>(TestBars.flat(119));
        bars.add(Bar.of(TestBars.START + 119 * TestBars.MINUTE, 100, 110, 90, 100, 1_000));
        RegimeClassification result = classifier.classify(bars);
        assertEquals(MarketRegime.HIGH_VOLATILITY, result.getRegime());
        assertEquals(100, result.getConfidence());
        assertEquals("high", result.getFactors().get("volatility"));
    }

    @Test
    @DisplayName("quiet volume is low liquidity")
    void lowLiquidity() {
        RegimeClassification result = classifier.classify(TestBars.flat(60));
        assertEquals(MarketRegime.LOW_LIQUIDITY, result.getRegime());
        assertEquals(100, result.getConfidence());
    }

    @Test
    @DisplayName("no directional movement with normal volume is a range")
    void ranging() {
        RegimeClassification result = classifier.classify(flatWithRisingVolume(60));
        assertEquals(MarketRegime.RANGING, result.getRegime());
        assertEquals(100, result.getConfidence());
        assertEquals(2.0, (Double) result.getFactors().get("rangePercent"), 1e-9);
    }

    @Test
    @DisplayName("minimum bar count is configurable")
    void customMinimum() {
        assertEquals(MarketRegime.UNKNOWN, new RuleBasedRegimeClassifier(100).classify(TestBars.rising(80, 100, 1))
                .getRegime());
    }
}
