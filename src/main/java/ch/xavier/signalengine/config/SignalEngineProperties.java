package ch.xavier.signalengine.config;

import ch.xavier.signalengine.indicator.SatyAtrLevels;
import ch.xavier.signalengine.score.ScoreWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "signal-engine")
public class SignalEngineProperties {

    private Score score = new Score();
    private Regime regime = new Regime();
    private Backtest backtest = new Backtest();

    @Data
    public static class Score {
        private Weights weights = new Weights();

        /**
         * Alert and backtest event threshold.
         */
        private double threshold = 70;
        private int consensusBonus = 10;
        private boolean consensusEnabled = true;
        private SatyAtrLevels.PivotAnchor satyAnchor = SatyAtrLevels.PivotAnchor.PRIOR_CLOSE;
    }

    @Data
    public static class Weights {
        private int pivotRibbon = 20;
        private int ripster3450 = 20;
        private int satyTrigger = 20;
        private int squeezeOn = 10;
        private int squeezeFired = 25;
        private int ichimoku = 15;

        public ScoreWeights toScoreWeights() {
            return ScoreWeights.builder()
                    .pivotRibbon(pivotRibbon)
                    .ripster3450(ripster3450)
                    .satyTrigger(satyTrigger)
                    .squeezeOn(squeezeOn)
                    .squeezeFired(squeezeFired)
                    .ichimoku(ichimoku)
                    .build();
        }
    }

    @Data
    public static class Regime {
        /**
         * Minimum bars for the rule-based classifier.
         */
        private int minBars = 50;
        private int hmmStates = 3;
        private int hmmLookback = 252;
        private int hmmIterations = 30;
        /**
         * EM iterations of the HMM inside the combined advanced detector.
         */
        private int advancedHmmIterations = 20;

        /**
         * Seed for HMM initialisation, fits are not reproducible when absent.
         */
        private Long hmmSeed;
        private int garchLookback = 252;
        private double alertThreshold = 0.7;
        private int historyCapacity = 100;
    }

    @Data
    public static class Backtest {
        private int horizon = 10;
        private int warmupBars = 80;
        private List<Integer> curveThresholds = new ArrayList<>(List.of(30, 40, 50, 60, 70, 80, 90));
        private int maxRecentScores = 400;
    }
}
