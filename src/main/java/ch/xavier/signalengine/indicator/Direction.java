package ch.xavier.signalengine.indicator;

public enum Direction {
    LONG, SHORT, NONE;

    public static Direction ofSign(double value) {
        if (value > 0) {
            return LONG;
        } else if (value < 0) {
            return SHORT;
        }
        return NONE;
    }
}
