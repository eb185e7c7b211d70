package ch.xavier.signalengine.score;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.indicator.Direction;
import ch.xavier.signalengine.indicator.OverlayBundle;
import ch.xavier.signalengine.indicator.OverlayService;
import ch.xavier.signalengine.indicator.Trend;
import ch.xavier.signalengine.math.SeriesMath;
import ch.xavier.signalengine.squeeze.SqueezeState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted bullish confluence of the overlays, 0 to 100, with the contribution of every component.
 */
@Service
@Slf4j
public class SignalScoreService {
    private final OverlayService overlayService;
    @Getter
    private final ScoreWeights weights;

    @Autowired
    public SignalScoreService(OverlayService overlayService, SignalEngineProperties properties) {
        this(overlayService, properties.getScore().getWeights().toScoreWeights());
    }

    public SignalScoreService(OverlayService overlayService, ScoreWeights weights) {
        this.overlayService = overlayService;
        this.weights = weights;
    }

    /**
     * Score of the last bar of the window.
     *
     * @param bars time-ordered bars; an empty window gives a neutral zero score
     * @return state at the last bar
     */
    public SignalState computeState(List<Bar> bars) {
        OverlayBundle overlays = overlayService.compute(bars);
        if (overlays.size() == 0) {
            return emptyState();
        }
        SignalState state = stateAt(overlays, overlays.size() - 1, weights);
        log.debug("Score {} at {} (pivot {}, saty {}, ichimoku {})", state.getScore(), state.getTime(),
                state.getPivotNow(), state.getSatyDirection(), state.getIchimokuRegime());
        return state;
    }

    /**
     * One state per bar from a single pass of the overlays. Every overlay is causal, so element {@code i} equals
     * {@code computeState(bars.subList(0, i + 1))}.
     *
     * @param bars time-ordered bars
     * @return states aligned with {@code bars}
     */
    public List<SignalState> computeStates(List<Bar> bars) {
        return computeStates(overlayService.compute(bars), weights);
    }

    public List<SignalState> computeStates(OverlayBundle overlays, ScoreWeights scoreWeights) {
        List<SignalState> states = new ArrayList<>(overlays.size());
        for (int i = 0; i < overlays.size(); i++) {
            states.add(stateAt(overlays, i, scoreWeights));
        }
        return states;
    }

    public static SignalState stateAt(OverlayBundle overlays, int index, ScoreWeights scoreWeights) {
        Trend pivot = overlays.getRibbon().stateAt(index);
        Trend ripster = overlays.getCloud34x50().biasAt(index);
        Direction satyDirection = overlays.satyAt(index).getDirection();
        Trend ichimoku = overlays.getIchimoku().regimeAt(index);
        SqueezeState squeeze = overlays.getSqueeze().stateAt(index);

        Map<ScoreComponent, Double> components = new EnumMap<>(ScoreComponent.class);
        components.put(ScoreComponent.PIVOT_RIBBON,
                pivot == Trend.BULLISH ? scoreWeights.getPivotRibbon() : 0.0);
        components.put(ScoreComponent.RIPSTER_34_50,
                ripster == Trend.BULLISH ? scoreWeights.getRipster3450() : 0.0);
        components.put(ScoreComponent.SATY_TRIGGER,
                satyDirection == Direction.LONG && pivot == Trend.BULLISH ? scoreWeights.getSatyTrigger() : 0.0);
        components.put(ScoreComponent.SQUEEZE_ON,
                squeeze.isOn() ? scoreWeights.getSqueezeOn() : 0.0);
        components.put(ScoreComponent.SQUEEZE_FIRED, firedContribution(squeeze, scoreWeights));
        components.put(ScoreComponent.ICHIMOKU,
                ichimoku == Trend.BULLISH ? scoreWeights.getIchimoku() : 0.0);
        components.put(ScoreComponent.CONSENSUS, 0.0);

        double total = 0;
        for (double contribution : components.values()) {
            total += contribution;
        }

        return SignalState.builder()
                .time(overlays.getTimes()[index])
                .score(SeriesMath.clamp(total, 0, 100))
                .components(Collections.unmodifiableMap(components))
                .pivotNow(pivot)
                .satyDirection(satyDirection)
                .ichimokuRegime(ichimoku)
                .squeeze(squeeze)
                .build();
    }

    private static double firedContribution(SqueezeState squeeze, ScoreWeights scoreWeights) {
        if (squeeze.getDirection() != Direction.LONG || squeeze.getFiredBarsAgo() == null) {
            return 0;
        }
        return scoreWeights.firedWeight(squeeze.getFiredBarsAgo());
    }

    static SignalState emptyState() {
        Map<ScoreComponent, Double> components = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent component : ScoreComponent.values()) {
            components.put(component, 0.0);
        }
        return SignalState.builder()
                .time(0)
                .score(0)
                .components(Collections.unmodifiableMap(components))
                .pivotNow(Trend.NEUTRAL)
                .satyDirection(Direction.NONE)
                .ichimokuRegime(Trend.NEUTRAL)
                .squeeze(SqueezeState.initial())
                .build();
    }
}
