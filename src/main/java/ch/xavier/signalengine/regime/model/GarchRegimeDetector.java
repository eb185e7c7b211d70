package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class GarchRegimeDetector {
    private final int lookback;

    public GarchRegimeDetector() {
        this(252);
    }

    public VolatilityRegime detect(List<Bar> bars) {
        if (bars.size() < lookback) {
            return VolatilityRegime.unknown();
        }
        double[] returns = SeriesMath.logReturns(SeriesMath.tail(Bars.closes(bars), lookback));
        GarchFit fit = GarchModel.fit(returns);
        return GarchModel.detectVolatilityRegime(fit.getParameters(), returns);
    }
}
