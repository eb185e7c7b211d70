package ch.xavier.signalengine.bar;

import java.util.List;

/**
 * Column extraction for bar windows.
 */
public final class Bars {

    private Bars() {
    }

    public static double[] closes(List<Bar> bars) {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).getClose();
        }
        return out;
    }

    public static double[] opens(List<Bar> bars) {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).getOpen();
        }
        return out;
    }

    public static double[] highs(List<Bar> bars) {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).getHigh();
        }
        return out;
    }

    public static double[] lows(List<Bar> bars) {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).getLow();
        }
        return out;
    }

    public static double[] volumes(List<Bar> bars) {
        double[] out = new double[bars.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bars.get(i).getVolume();
        }
        return out;
    }

    public static Bar last(List<Bar> bars) {
        return bars.get(bars.size() - 1);
    }
}
