package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.TestBars;
import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.InvalidBarSeriesException;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.consensus.Timeframe;
import ch.xavier.signalengine.regime.RegimeDetectionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RegimeMonitorRegistryTest {

    private final RegimeMonitorRegistry registry;

    RegimeMonitorRegistryTest() {
        SignalEngineProperties properties = new SignalEngineProperties();
        properties.getRegime().setHmmSeed(42L);
        properties.getRegime().setHistoryCapacity(3);
        registry = new RegimeMonitorRegistry(new RegimeDetectionService(properties), properties);
    }

    @Test
    @DisplayName("monitors are kept per symbol and timeframe")
    void perKey() {
        List<Bar> bars = TestBars.randomWalk(150, 31, 0.01, TestBars.MINUTE);
        RegimeUpdate first = registry.update("SPY", Timeframe.FIVE_MINUTES, bars);
        assertTrue(first.isChanged());
        registry.update("SPY", Timeframe.FIVE_MINUTES, bars);

        RegimeMonitorSnapshot snapshot = registry.snapshot("SPY", Timeframe.FIVE_MINUTES).orElseThrow();
        assertEquals(2, snapshot.getHistory().size());
        assertEquals(bars.get(149).getTime(), snapshot.getHistory().get(1).getTimestamp());
        assertTrue(registry.snapshot("SPY", Timeframe.ONE_MINUTE).isEmpty());
        assertTrue(registry.snapshot("QQQ", Timeframe.FIVE_MINUTES).isEmpty());
    }

    @Test
    @DisplayName("configured capacity applies to new monitors")
    void capacity() {
        List<Bar> bars = TestBars.randomWalk(120, 37, 0.01, TestBars.MINUTE);
        for (int i = 0; i < 5; i++) {
            registry.update("IWM", Timeframe.ONE_MINUTE, bars);
        }
        assertEquals(3, registry.snapshot("IWM", Timeframe.ONE_MINUTE).orElseThrow().getHistory().size());
        assertFalse(registry.transitionRisk("IWM", Timeframe.ONE_MINUTE).orElseThrow().isAlert());
    }

    @Test
    @DisplayName("removed monitors start over")
    void remove() {
        List<Bar> bars = TestBars.randomWalk(120, 41, 0.01, TestBars.MINUTE);
        registry.update("DIA", Timeframe.ONE_HOUR, bars);
        registry.remove("DIA", Timeframe.ONE_HOUR);
        assertTrue(registry.snapshot("DIA", Timeframe.ONE_HOUR).isEmpty());
        assertTrue(registry.transitionRisk("DIA", Timeframe.ONE_HOUR).isEmpty());

        RegimeUpdate afterRemove = registry.update("DIA", Timeframe.ONE_HOUR, bars);
        assertTrue(afterRemove.isChanged());
        assertEquals(1, registry.snapshot("DIA", Timeframe.ONE_HOUR).orElseThrow().getHistory().size());
    }

    @Test
    @DisplayName("concurrent updates and removes on one key leave a consistent monitor")
    void concurrentRemove() throws Exception {
        List<Bar> bars = TestBars.randomWalk(120, 43, 0.01, TestBars.MINUTE);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                futures.add(i % 3 == 2
                        ? executor.submit(() -> registry.remove("XLF", Timeframe.ONE_MINUTE))
                        : executor.submit(() -> registry.update("XLF", Timeframe.ONE_MINUTE, bars)));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        registry.remove("XLF", Timeframe.ONE_MINUTE);
        assertTrue(registry.snapshot("XLF", Timeframe.ONE_MINUTE).isEmpty());
        registry.update("XLF", Timeframe.ONE_MINUTE, bars);
        assertEquals(1, registry.snapshot("XLF", Timeframe.ONE_MINUTE).orElseThrow().getHistory().size());
    }

    @Test
    @DisplayName("invalid bars never reach a monitor")
    void invalid() {
        List<Bar> bars = List.of(Bar.of(120, 1, 2, 0, 1, 1), Bar.of(120, 1, 2, 0, 1, 1));
        assertThrows(InvalidBarSeriesException.class, () -> registry.update("SPY", Timeframe.ONE_MINUTE, bars));
        assertTrue(registry.snapshot("SPY", Timeframe.ONE_MINUTE).isEmpty());
    }
}
