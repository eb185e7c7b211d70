package ch.xavier.signalengine.regime.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationAnalyzerTest {

    @Test
    @DisplayName("one correlation per complete window")
    void rolling() {
        double[] x = {1, 2, 3, 4, 5, 6};
        double[] y = {2, 4, 6, 8, 10, 12};
        double[] correlations = CorrelationAnalyzer.rollingCorrelation(x, y, 3);
        assertEquals(4, correlations.length);
        for (double correlation : correlations) {
            assertEquals(1, correlation, 1e-9);
        }
        assertEquals(0, CorrelationAnalyzer.rollingCorrelation(x, y, 10).length);
    }

    @Test
    @DisplayName("correlation jumping above its history is high correlation")
    void dynamic() {
        double[] x = new double[40];
        double[] y = new double[40];
        for (int i = 0; i < 40; i++) {
            x[i] = Math.sin(i);
            y[i] = i < 30 ? Math.cos(i * 1.7) : x[i];
        }
        CorrelationAnalyzer.DynamicCorrelation result = CorrelationAnalyzer.dynamicCorrelation(x, y, 10);
        assertEquals(1, result.getCurrentCorrelation(), 1e-9);
        assertEquals(CorrelationAnalyzer.CorrelationRegime.HIGH_CORRELATION, result.getRegime());
        assertEquals(31, result.getTimeSeries().length);
    }

    @Test
    @DisplayName("too little data is stable with undefined values")
    void insufficient() {
        CorrelationAnalyzer.DynamicCorrelation result =
                CorrelationAnalyzer.dynamicCorrelation(new double[]{1, 2}, new double[]{1, 2}, 5);
        assertEquals(CorrelationAnalyzer.CorrelationRegime.STABLE, result.getRegime());
        assertTrue(Double.isNaN(result.getCurrentCorrelation()));
    }

    @Test
    @DisplayName("beta is the covariance over market variance")
    void beta() {
        double[] market = {0.01, -0.02, 0.03, -0.01};
        double[] asset = {0.02, -0.04, 0.06, -0.02};
        assertEquals(2, CorrelationAnalyzer.beta(asset, market), 1e-9);
        assertEquals(1, CorrelationAnalyzer.beta(asset, new double[]{0.01, 0.01, 0.01, 0.01}), 1e-12);
    }
}
