package ch.xavier.signalengine.consensus;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.indicator.OverlayService;
import ch.xavier.signalengine.indicator.Trend;
import ch.xavier.signalengine.score.ScoreComponent;
import ch.xavier.signalengine.score.SignalState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Confirms the primary timeframe's pivot ribbon against the next slower timeframe.
 */
@Service
@Slf4j
public class ConsensusService {
    private final OverlayService overlayService;
    private final int bonus;

    public ConsensusService(OverlayService overlayService, SignalEngineProperties properties) {
        this.overlayService = overlayService;
        this.bonus = properties.getScore().getConsensusBonus();
    }

    /**
     * @param primaryTimeframe timeframe of {@code primaryBars}
     * @param primaryBars      bars of the primary timeframe
     * @param secondaryBars    bars of {@code primaryTimeframe.secondary()}
     * @return alignment of the two ribbons at their last bar
     */
    public ConsensusResult evaluate(Timeframe primaryTimeframe, List<Bar> primaryBars, List<Bar> secondaryBars) {
        Optional<Timeframe> secondaryTimeframe = primaryTimeframe.secondary();
        if (secondaryTimeframe.isEmpty() || primaryBars.isEmpty() || secondaryBars == null || secondaryBars.isEmpty()) {
            return ConsensusResult.none(primaryTimeframe);
        }

        Trend primary = overlayService.compute(primaryBars).getRibbon().current();
        Trend secondary = overlayService.compute(secondaryBars).getRibbon().current();
        boolean align = primary == secondary && primary != Trend.NEUTRAL;

        log.debug("Consensus {} {} vs {} {}: align={}", primaryTimeframe.getLabel(), primary,
                secondaryTimeframe.get().getLabel(), secondary, align);
        return new ConsensusResult(primaryTimeframe, secondaryTimeframe.get(), align, primary, secondary);
    }

    /**
     * Adds the consensus bonus to a score when both timeframes agree. The result is capped at 100.
     */
    public ConsensusScore applyBonus(SignalState state, ConsensusResult consensus, boolean enabled) {
        int applied = enabled && consensus.isAlign() ? bonus : 0;
        double score = Math.min(100, state.getScore() + applied);

        Map<ScoreComponent, Double> components = new EnumMap<>(ScoreComponent.class);
        components.putAll(state.getComponents());
        components.put(ScoreComponent.CONSENSUS, (double) applied);

        SignalState withBonus = state.toBuilder()
                .score(score)
                .components(Collections.unmodifiableMap(components))
                .build();
        return new ConsensusScore(state.getScore(), applied, score, consensus.isAlign(), withBonus);
    }
}
