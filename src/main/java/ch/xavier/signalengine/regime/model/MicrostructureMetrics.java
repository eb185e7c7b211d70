package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.bar.Bar;

import java.util.List;

/**
 * Liquidity estimates that need nothing but OHLCV bars.
 */
public final class MicrostructureMetrics {

    private MicrostructureMetrics() {
    }

    /**
     * Amihud illiquidity: mean absolute open-to-close return per million of dollar volume. Higher is less liquid;
     * bars without dollar volume are skipped and a window without any gives 0.
     */
    public static double amihudIlliquidity(List<Bar> bars) {
        double sum = 0;
        int counted = 0;
        for (Bar bar : bars) {
            double dollarVolume = bar.getClose() * bar.getVolume();
            if (dollarVolume > 0 && bar.getOpen() != 0) {
                double barReturn = Math.abs((bar.getClose() - bar.getOpen()) / bar.getOpen());
                sum += barReturn / (dollarVolume / 1e6);
                counted++;
            }
        }
        return counted == 0 ? 0 : sum / counted;
    }

    /**
     * Roll's bid-ask spread estimate, {@code 2 * sqrt(-cov)} of consecutive price changes, 0 when the serial
     * covariance is not negative.
     */
    public static double rollSpread(double[] prices) {
        if (prices.length < 3) {
            return 0;
        }
        double covariance = 0;
        for (int i = 2; i < prices.length; i++) {
            covariance += (prices[i] - prices[i - 1]) * (prices[i - 1] - prices[i - 2]);
        }
        covariance /= prices.length - 2;
        return covariance < 0 ? 2 * Math.sqrt(-covariance) : 0;
    }

    /**
     * Per-bar signed volume share: +1 for an up bar, -1 for a down bar, 0 for a doji or no volume.
     */
    public static double[] orderFlowImbalance(List<Bar> bars) {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            Bar bar = bars.get(i);
            if (bar.getVolume() <= 0) {
                continue;
            }
            double buyVolume = bar.getClose() > bar.getOpen() ? bar.getVolume() : 0;
            double sellVolume = bar.getClose() < bar.getOpen() ? bar.getVolume() : 0;
            out[i] = (buyVolume - sellVolume) / bar.getVolume();
        }
        return out;
    }
}
