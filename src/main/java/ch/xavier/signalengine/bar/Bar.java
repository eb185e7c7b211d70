package ch.xavier.signalengine.bar;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One OHLCV sample for a fixed time bucket. {@code time} is the bucket start in epoch seconds.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class Bar {
    private final long time;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;

    public static Bar of(long time, double open, double high, double low, double close, double volume) {
        return Bar.builder()
                .time(time)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }
}
