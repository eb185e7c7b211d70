package ch.xavier.signalengine.indicator;

import ch.xavier.signalengine.squeeze.SqueezeHistory;
import lombok.Builder;
import lombok.Getter;

/**
 * Every overlay computed for one bar window. SATY levels are kept per bar so that any prefix of the window can be
 * read back without recomputing.
 */
@Getter
@Builder
public class OverlayBundle {
    private final long[] times;
    private final double[] closes;
    private final EmaCloud.Result cloud8x21;
    private final EmaCloud.Result cloud5x12;
    private final EmaCloud.Result cloud8x9;
    private final EmaCloud.Result cloud34x50;
    private final IchimokuCloud.Result ichimoku;
    private final PivotRibbon.Result ribbon;
    private final SatyAtrLevels.Result[] satyByBar;
    private final SqueezeBands.Result squeezeBands;
    private final SqueezeHistory squeeze;

    public int size() {
        return times.length;
    }

    public SatyAtrLevels.Result satyAt(int index) {
        return index >= 0 && index < satyByBar.length ? satyByBar[index] : SatyAtrLevels.Result.empty();
    }

    public SatyAtrLevels.Result saty() {
        return satyAt(satyByBar.length - 1);
    }
}
