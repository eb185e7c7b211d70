package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.TestBars;
import ch.xavier.signalengine.bar.Bar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AverageDirectionalIndexTest {

    @Test
    @DisplayName("one-directional movement drives ADX to 100")
    void strongTrend() {
        AverageDirectionalIndex.Result result = new AverageDirectionalIndex().calculate(TestBars.rising(30, 100, 1));
        assertEquals(100, result.current(), 1e-9);
        assertEquals(0, result.getMinusDi()[29], 1e-9);
        assertTrue(result.getPlusDi()[29] > 0);
        assertTrue(Double.isNaN(result.getAdx()[0]));
    }

    @Test
    @DisplayName("warmup reports zero")
    void warmup() {
        assertEquals(0, new AverageDirectionalIndex().calculate(TestBars.rising(10, 100, 1)).current());
    }

    @Test
    @DisplayName("flat bars have no directional movement")
    void flat() {
        assertEquals(0, new AverageDirectionalIndex().calculate(TestBars.flat(40)).current(), 1e-9);
    }

    @Test
    @DisplayName("repeated calls on the same window are bit-identical")
    void deterministic() {
        List<Bar> bars = TestBars.randomWalk(300, 83, 0.01, TestBars.MINUTE);
        AverageDirectionalIndex.Result first = new AverageDirectionalIndex().calculate(bars);
        AverageDirectionalIndex.Result second = new AverageDirectionalIndex().calculate(bars);
        assertArrayEquals(first.getPlusDi(), second.getPlusDi(), 0);
        assertArrayEquals(first.getMinusDi(), second.getMinusDi(), 0);
        assertArrayEquals(first.getAdx(), second.getAdx(), 0);
    }
}
