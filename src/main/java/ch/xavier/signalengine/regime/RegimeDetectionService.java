package ch.xavier.signalengine.regime;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.BarSeriesValidator;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.indicator.IchimokuCloud;
import ch.xavier.signalengine.regime.model.AdvancedRegimeDetector;
import ch.xavier.signalengine.regime.model.AdvancedRegimeResult;
import ch.xavier.signalengine.regime.model.GarchRegimeDetector;
import ch.xavier.signalengine.regime.model.HmmFeature;
import ch.xavier.signalengine.regime.model.HmmRegimeDetector;
import ch.xavier.signalengine.regime.model.HmmRegimeResult;
import ch.xavier.signalengine.regime.model.HurstExponent;
import ch.xavier.signalengine.regime.model.VolatilityRegime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

/**
 * Entry point to every regime model for callers holding a bar window.
 */
@Service
@Slf4j
public class RegimeDetectionService {
    private final SignalEngineProperties.Regime properties;
    private final RuleBasedRegimeClassifier ruleBasedClassifier;
    private final IchimokuCloud ichimoku = new IchimokuCloud();
    private final GarchRegimeDetector garchDetector;

    public RegimeDetectionService(SignalEngineProperties properties) {
        this.properties = properties.getRegime();
        this.ruleBasedClassifier = new RuleBasedRegimeClassifier(this.properties.getMinBars());
        this.garchDetector = new GarchRegimeDetector(this.properties.getGarchLookback());
    }

    public RegimeClassification classify(List<Bar> bars) {
        BarSeriesValidator.validate(bars);
        RegimeClassification classification = ruleBasedClassifier.classify(bars);
        log.debug("Rule-based regime {} ({}%) over {} bars", classification.getRegime(),
                classification.getConfidence(), bars.size());
        return classification;
    }

    /**
     * Same as {@link #classify(List)} but also requires price on the matching side of the Ichimoku cloud for the
     * trending regimes.
     */
    public RegimeClassification classifyWithCloud(List<Bar> bars) {
        BarSeriesValidator.validate(bars);
        return ruleBasedClassifier.classify(bars, ichimoku.calculate(bars));
    }

    public HmmRegimeResult detectHmm(List<Bar> bars, HmmFeature feature) {
        BarSeriesValidator.validate(bars);
        HmmRegimeDetector detector = new HmmRegimeDetector(properties.getHmmStates(), properties.getHmmLookback(),
                properties.getHmmIterations(), feature, newRandom());
        return detector.detect(bars);
    }

    public VolatilityRegime detectVolatility(List<Bar> bars) {
        BarSeriesValidator.validate(bars);
        return garchDetector.detect(bars);
    }

    public HurstExponent.Persistence trendPersistence(List<Bar> bars) {
        BarSeriesValidator.validate(bars);
        return HurstExponent.classify(bars);
    }

    public AdvancedRegimeResult detectAdvanced(List<Bar> bars) {
        BarSeriesValidator.validate(bars);
        return newAdvancedDetector().detect(bars);
    }

    /**
     * Detector with the configured HMM seed, or an unseeded one when no seed is configured.
     */
    public AdvancedRegimeDetector newAdvancedDetector() {
        return new AdvancedRegimeDetector(properties.getAdvancedHmmIterations(), newRandom());
    }

    private Random newRandom() {
        return properties.getHmmSeed() == null ? new Random() : new Random(properties.getHmmSeed());
    }
}
