package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;

import java.util.List;

public interface Indicator<T> {
    T calculate(List<Bar> bars);
}
