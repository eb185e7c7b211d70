package ch.xavier.signalengine.regime;

import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.bar.Bars;
import ch.xavier.signalengine.indicator.AverageDirectionalIndex;
import ch.xavier.signalengine.indicator.IchimokuCloud;
import ch.xavier.signalengine.math.SeriesMath;
import lombok.AllArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First-match classification on ADX, EMA stacking, ATR and volume percentiles. When an Ichimoku cloud is given,
 * the trending branches also require price on the matching side of it.
 */
@AllArgsConstructor
public class RuleBasedRegimeClassifier implements RegimeClassifier {
    static final String INSUFFICIENT_DATA = "Insufficient data for regime detection";

    private static final int ATR_PERIOD = 14;
    private static final int ATR_LOOKBACK = 100;
    private static final int VOLUME_LOOKBACK = 20;
    private static final int RANGE_LOOKBACK = 20;

    private final int minBars;
    private final AverageDirectionalIndex adxIndicator;

    public RuleBasedRegimeClassifier() {
        this(50, new AverageDirectionalIndex());
    }

    public RuleBasedRegimeClassifier(int minBars) {
        this(minBars, new AverageDirectionalIndex());
    }

    @Override
    public RegimeClassification classify(List<Bar> bars) {
        return classify(bars, null);
    }

    /**
     * @param bars     time-ordered bars
     * @param ichimoku cloud over the same bars, or {@code null} to classify without it
     * @return regime of the last bar, {@link MarketRegime#UNKNOWN} below the minimum bar count
     */
    public RegimeClassification classify(List<Bar> bars, IchimokuCloud.Result ichimoku) {
        if (bars == null || bars.size() < minBars) {
            return RegimeClassification.unknown(INSUFFICIENT_DATA);
        }

        double[] close = Bars.closes(bars);
        int last = close.length - 1;
        Map<String, Object> factors = new LinkedHashMap<>();

        double adx = adxIndicator.calculate(bars).current();
        factors.put("adx", Math.round(adx));
        factors.put("trendStrength", adx > 25 ? "strong" : adx > 20 ? "moderate" : "weak");

        boolean bullishAlignment = isAligned(close, true);
        boolean bearishAlignment = isAligned(close, false);
        factors.put("bullishAlignment", bullishAlignment);
        factors.put("bearishAlignment", bearishAlignment);

        boolean aboveCloud = true;
        boolean belowCloud = true;
        if (ichimoku != null && ichimoku.hasCloudAt(last)) {
            double top = Math.max(ichimoku.getSpanA()[last], ichimoku.getSpanB()[last]);
            double bottom = Math.min(ichimoku.getSpanA()[last], ichimoku.getSpanB()[last]);
            aboveCloud = close[last] > top;
            belowCloud = close[last] < bottom;
            factors.put("aboveCloud", aboveCloud);
            factors.put("belowCloud", belowCloud);
            factors.put("inCloud", !aboveCloud && !belowCloud);
            factors.put("cloudColor", ichimoku.isGreenAt(last) ? "green" : "red");
        }

        double atrPercentile = atrPercentile(bars);
        factors.put("atrPercentile", Math.round(atrPercentile));
        factors.put("volatility", atrPercentile > 80 ? "high" : atrPercentile > 50 ? "moderate" : "low");

        double volumePercentile = volumePercentile(bars);
        factors.put("volumePercentile", Math.round(volumePercentile));
        factors.put("volume", volumePercentile > 70 ? "high" : volumePercentile > 30 ? "average" : "low");
        factors.put("rangePercent", rangePercent(bars));

        MarketRegime regime;
        double confidence;
        if (adx > 25 && bullishAlignment && aboveCloud && volumePercentile > 30) {
            regime = MarketRegime.TRENDING_BULL;
            confidence = Math.min(100, adx + 20);
        } else if (adx > 25 && bearishAlignment && belowCloud && volumePercentile > 30) {
            regime = MarketRegime.TRENDING_BEAR;
            confidence = Math.min(100, adx + 20);
        } else if (atrPercentile > 80) {
            regime = MarketRegime.HIGH_VOLATILITY;
            confidence = atrPercentile;
        } else if (volumePercentile < 30) {
            regime = MarketRegime.LOW_LIQUIDITY;
            confidence = 100 - volumePercentile;
        } else if (adx < 20) {
            regime = MarketRegime.RANGING;
            confidence = (20 - adx) * 5;
        } else {
            regime = MarketRegime.WEAK_TREND;
            confidence = 50;
        }

        return new RegimeClassification(regime, (int) Math.round(confidence),
                Collections.unmodifiableMap(factors), recommendationFor(regime));
    }

    static String recommendationFor(MarketRegime regime) {
        return switch (regime) {
            case TRENDING_BULL ->
                    "Strong uptrend. Focus on pullback entries and trend continuation. Avoid counter-trend shorts.";
            case TRENDING_BEAR ->
                    "Strong downtrend. Focus on rally fades and trend continuation. Avoid counter-trend longs.";
            case HIGH_VOLATILITY ->
                    "High volatility environment. Use tighter stops and smaller position sizes. Expect whipsaws.";
            case LOW_LIQUIDITY -> "Low volume conditions. Be cautious with entries/exits. Spreads may be wider.";
            case RANGING ->
                    "Choppy, sideways market. Trade support/resistance. Avoid trend-following strategies.";
            case WEAK_TREND -> "Unclear trend. Wait for stronger signals before committing to directional trades.";
            default -> INSUFFICIENT_DATA;
        };
    }

    // price > ema8 > ema21 > ema34 > ema50, or the mirror
    private boolean isAligned(double[] close, boolean bullish) {
        int last = close.length - 1;
        double[] stack = {
                close[last],
                SeriesMath.ema(close, 8)[last],
                SeriesMath.ema(close, 21)[last],
                SeriesMath.ema(close, 34)[last],
                SeriesMath.ema(close, 50)[last]
        };
        for (int i = 1; i < stack.length; i++) {
            if (!SeriesMath.isDefined(stack[i])) {
                return false;
            }
            boolean ordered = bullish ? stack[i - 1] > stack[i] : stack[i - 1] < stack[i];
            if (!ordered) {
                return false;
            }
        }
        return true;
    }

    private double atrPercentile(List<Bar> bars) {
        if (bars.size() < ATR_LOOKBACK) {
            return 50;
        }
        double[] atr = SeriesMath.tail(SeriesMath.averageTrueRange(bars, ATR_PERIOD), ATR_LOOKBACK);
        double current = atr[atr.length - 1];
        double[] history = SeriesMath.slice(atr, 0, atr.length - 1);
        double percentile = SeriesMath.percentileRank(history, current);
        return SeriesMath.isDefined(percentile) ? percentile : 50;
    }

    private double volumePercentile(List<Bar> bars) {
        if (bars.size() < VOLUME_LOOKBACK + 1) {
            return 50;
        }
        double[] volume = Bars.volumes(bars);
        double[] previous = SeriesMath.slice(volume, volume.length - 1 - VOLUME_LOOKBACK, volume.length - 1);
        return SeriesMath.percentileRank(previous, volume[volume.length - 1]);
    }

    private double rangePercent(List<Bar> bars) {
        List<Bar> recent = bars.subList(Math.max(0, bars.size() - RANGE_LOOKBACK), bars.size());
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        double closeSum = 0;
        for (Bar bar : recent) {
            high = Math.max(high, bar.getHigh());
            low = Math.min(low, bar.getLow());
            closeSum += bar.getClose();
        }
        double averageClose = closeSum / recent.size();
        if (averageClose == 0) {
            return 0;
        }
        return Math.round((high - low) / averageClose * 100 * 100) / 100.0;
    }
}
