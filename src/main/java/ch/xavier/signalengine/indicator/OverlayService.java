package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.BarSeriesValidator;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.squeeze.SqueezeStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class OverlayService {
    private final EmaCloud cloud8x21 = new EmaCloud(8, 21);
    private final EmaCloud cloud5x12 = new EmaCloud(5, 12);
    private final EmaCloud cloud8x9 = new EmaCloud(8, 9);
    private final EmaCloud cloud34x50 = new EmaCloud(34, 50);
    private final IchimokuCloud ichimoku = new IchimokuCloud();
    private final PivotRibbon ribbon = new PivotRibbon();
    private final SqueezeBands squeezeBands = new SqueezeBands();
    private final SatyAtrLevels satyAtrLevels;

    public OverlayService(SignalEngineProperties properties) {
        this.satyAtrLevels = new SatyAtrLevels(14, properties.getScore().getSatyAnchor());
    }

    /**
     * Validates the window and computes every overlay over it.
     *
     * @param bars time-ordered bars, may be empty
     * @return overlays aligned with {@code bars}
     * @throws ch.xavier.signalengine.bar.InvalidBarSeriesException when the bars break the input contract
     */
    public OverlayBundle compute(List<Bar> bars) {
        BarSeriesValidator.validate(bars);

        SqueezeBands.Result bands = squeezeBands.calculate(bars);
        OverlayBundle bundle = OverlayBundle.builder()
                .times(bars.stream().mapToLong(Bar::getTime).toArray())
                .closes(Bars.closes(bars))
                .cloud8x21(cloud8x21.calculate(bars))
                .cloud5x12(cloud5x12.calculate(bars))
                .cloud8x9(cloud8x9.calculate(bars))
                .cloud34x50(cloud34x50.calculate(bars))
                .ichimoku(ichimoku.calculate(bars))
                .ribbon(ribbon.calculate(bars))
                .satyByBar(satyAtrLevels.calculateAll(bars))
                .squeezeBands(bands)
                .squeeze(SqueezeStateMachine.scan(bands))
                .build();

        log.debug("Computed overlays over {} bars", bars.size());
        return bundle;
    }
}
