package ch.xavier.signalengine.regime.model;

import ch.xavier.signalengine.TestBars;
import ch.xavier.signalengine.math.SeriesMath;
import ch.xavier.signalengine.regime.MarketRegime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HurstExponentTest {

    @Test
    @DisplayName("short series defaults to a random walk")
    void shortSeries() {
        assertEquals(0.5, HurstExponent.calculate(new double[63]), 1e-12);
        assertEquals(0.5, HurstExponent.calculate(new double[0]), 1e-12);
    }

    @Test
    @DisplayName("constant series has no range and defaults to a random walk")
    void flatSeries() {
        assertEquals(0.5, HurstExponent.calculate(new double[256]), 1e-12);
    }

    @Test
    @DisplayName("estimate stays within [0, 1] on noise")
    void bounds() {
        Random random = new Random(13);
        for (int run = 0; run < 5; run++) {
            double[] noise = new double[512];
            for (int i = 0; i < noise.length; i++) {
                noise[i] = random.nextGaussian();
            }
            double hurst = HurstExponent.calculate(noise);
            assertTrue(hurst >= 0 && hurst <= 1, "H=" + hurst);
        }
    }

    @Test
    @DisplayName("alternating prices are mean reverting")
    void alternating() {
        double[] closes = new double[257];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = i % 2 == 0 ? 100 : 101;
        }
        HurstExponent.Persistence persistence = HurstExponent.classify(TestBars.fromCloses(closes));
        assertEquals(MarketRegime.MEAN_REVERTING, persistence.getRegime());
        assertTrue(persistence.getHurstExponent() < 0.1);
        assertEquals("Mean-reverting behavior", persistence.getInterpretation());
    }

    @Test
    @DisplayName("steadily growing increments are persistent")
    void trending() {
        double[] series = new double[256];
        for (int i = 0; i < series.length; i++) {
            series[i] = i;
        }
        assertTrue(HurstExponent.calculate(series) > 0.9);
    }

    @Test
    @DisplayName("classification on a random walk stays away from the extremes")
    void randomWalk() {
        double[] returns = SeriesMath.logReturns(TestBars.closes(TestBars.randomWalk(600, 17, 0.01, 60)));
        double hurst = HurstExponent.calculate(returns);
        assertTrue(hurst > 0.2 && hurst < 0.8, "H=" + hurst);
    }

    @Test
    @DisplayName("repeated estimates on the same series are bit-identical")
    void deterministic() {
        double[] returns = SeriesMath.logReturns(TestBars.closes(TestBars.randomWalk(600, 89, 0.01, 60)));
        assertEquals(Double.doubleToLongBits(HurstExponent.calculate(returns)),
                Double.doubleToLongBits(HurstExponent.calculate(returns.clone())));
    }
}
