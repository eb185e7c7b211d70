package ch.xavier.signalengine.indicator;

public enum Trend {
    BULLISH, BEARISH, NEUTRAL
}
