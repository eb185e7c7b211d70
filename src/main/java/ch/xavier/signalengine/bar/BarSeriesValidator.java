package ch.xavier.signalengine.bar;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public final class BarSeriesValidator {

    private BarSeriesValidator() {
    }

    public static void validate(List<Bar> bars) {
        if (bars == null) {
            throw reject(-1, "bar series is null");
        }

        long previousTime = Long.MIN_VALUE;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null) {
                throw reject(i, "bar is null");
            }
            if (!Double.isFinite(bar.getOpen()) || !Double.isFinite(bar.getHigh())
                    || !Double.isFinite(bar.getLow()) || !Double.isFinite(bar.getClose())) {
                throw reject(i, "OHLC values must be finite");
            }
            if (!Double.isFinite(bar.getVolume()) || bar.getVolume() < 0) {
                throw reject(i, "volume must be finite and non-negative, was " + bar.getVolume());
            }
            if (bar.getHigh() < bar.getLow()) {
                throw reject(i, "high " + bar.getHigh() + " is below low " + bar.getLow());
            }
            if (i > 0 && bar.getTime() <= previousTime) {
                throw reject(i, "timestamp " + bar.getTime()
                        + " does not follow " + previousTime);
            }
            previousTime = bar.getTime();
        }
    }

    private static InvalidBarSeriesException reject(int index, String message) {
        InvalidBarSeriesException exception = new InvalidBarSeriesException(index, message);
        log.warn("Rejected bar series: {}", exception.getMessage());
        return exception;
    }
}
