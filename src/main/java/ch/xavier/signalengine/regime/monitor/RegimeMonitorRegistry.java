package ch.xavier.signalengine.regime.monitor;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.BarSeriesValidator;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.consensus.Timeframe;
import ch.xavier.signalengine.regime.RegimeDetectionService;
import ch.xavier.signalengine.regime.model.AdvancedRegimeDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link RegimeMonitor} per symbol and timeframe. Calls on the same monitor are serialised on it.
 */
@Component
@Slf4j
public class RegimeMonitorRegistry {
    private final RegimeDetectionService regimeDetectionService;
    private final SignalEngineProperties.Regime properties;
    private final Map<String, RegimeMonitor> monitors = new ConcurrentHashMap<>();

    public RegimeMonitorRegistry(RegimeDetectionService regimeDetectionService, SignalEngineProperties properties) {
        this.regimeDetectionService = regimeDetectionService;
        this.properties = properties.getRegime();
    }

    public RegimeUpdate update(String symbol, Timeframe timeframe, List<Bar> bars) {
        BarSeriesValidator.validate(bars);
        String key = key(symbol, timeframe);
        while (true) {
            RegimeMonitor monitor = monitors.computeIfAbsent(key, this::newMonitor);
            synchronized (monitor) {
                // removed while waiting for the lock, retry on a fresh monitor
                if (monitors.get(key) != monitor) {
                    continue;
                }
                RegimeUpdate update = monitor.update(bars);
                if (update.isChanged()) {
                    log.info("{} {} regime is now {} ({}%)", symbol, timeframe.getLabel(),
                            update.getRegime().getLabel(), update.getConfidence());
                }
                return update;
            }
        }
    }

    public Optional<RegimeMonitorSnapshot> snapshot(String symbol, Timeframe timeframe) {
        RegimeMonitor monitor = monitors.get(key(symbol, timeframe));
        if (monitor == null) {
            return Optional.empty();
        }
        synchronized (monitor) {
            return Optional.of(monitor.snapshot());
        }
    }

    public Optional<TransitionRisk> transitionRisk(String symbol, Timeframe timeframe) {
        RegimeMonitor monitor = monitors.get(key(symbol, timeframe));
        if (monitor == null) {
            return Optional.empty();
        }
        synchronized (monitor) {
            return Optional.of(monitor.transitionRisk());
        }
    }

    /**
     * Drops the monitor of a key once any in-flight update on it has finished.
     */
    public void remove(String symbol, Timeframe timeframe) {
        String key = key(symbol, timeframe);
        RegimeMonitor monitor = monitors.get(key);
        if (monitor == null) {
            return;
        }
        synchronized (monitor) {
            monitors.remove(key, monitor);
        }
    }

    private RegimeMonitor newMonitor(String key) {
        log.debug("Creating regime monitor for {}", key);
        AdvancedRegimeDetector detector = regimeDetectionService.newAdvancedDetector();
        return new RegimeMonitor(detector::detect, properties.getAlertThreshold(), properties.getHistoryCapacity());
    }

    private static String key(String symbol, Timeframe timeframe) {
        return symbol + ":" + timeframe.getLabel();
    }
}
