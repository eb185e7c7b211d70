package ch.xavier.signalengine.regime;

import ch.xavier.signalengine.bar.Bar;

import java.util.List;

public interface RegimeClassifier {
    RegimeClassification classify(List<Bar> bars);
}
