package ch.xavier.signalengine.bar;

import lombok.Getter;

/**
 * Raised when a bar window violates the input contract: ascending unique timestamps, finite prices and
 * non-negative volume. This is the only error the engine surfaces to callers.
 */
@Getter
public class InvalidBarSeriesException extends IllegalArgumentException {
    private final int index;

    public InvalidBarSeriesException(int index, String message) {
        super(index >= 0 ? "Invalid bar at index " + index + ": " + message : message);
        this.index = index;
    }
}
