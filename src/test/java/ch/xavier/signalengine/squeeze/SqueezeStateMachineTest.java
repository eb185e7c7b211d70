package ch.xavier.signalengine.squeeze;

import ch.xavier.signalengine.TestBars;
import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.indicator.Direction;
import ch.xavier.signalengine.indicator.SqueezeBands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqueezeStateMachineTest {

    // ── single transitions ───────────────────────────────────────────────

    @Nested
    @DisplayName("advance()")
    class AdvanceTests {

        @Test
        @DisplayName("ON clears any previous fire")
        void onResets() {
            SqueezeState fired = new SqueezeState(false, true, Direction.LONG, 0);
            SqueezeState next = SqueezeStateMachine.advance(fired, true, 5);
            assertTrue(next.isOn());
            assertFalse(next.isFired());
            assertEquals(Direction.NONE, next.getDirection());
            assertNull(next.getFiredBarsAgo());
        }

        @Test
        @DisplayName("ON to OFF fires in the momentum direction")
        void fires() {
            SqueezeState on = new SqueezeState(true, false, Direction.NONE, null);
            SqueezeState up = SqueezeStateMachine.advance(on, false, 0.3);
            assertTrue(up.isFired());
            assertEquals(Direction.LONG, up.getDirection());
            assertEquals(0, up.getFiredBarsAgo());

            SqueezeState down = SqueezeStateMachine.advance(on, false, -0.3);
            assertEquals(Direction.SHORT, down.getDirection());

            SqueezeState flat = SqueezeStateMachine.advance(on, false, 0);
            assertEquals(Direction.NONE, flat.getDirection());
        }

        @Test
        @DisplayName("bars since fire keep counting while OFF")
        void counts() {
            SqueezeState state = new SqueezeState(false, true, Direction.SHORT, 0);
            for (int i = 1; i <= 6; i++) {
                state = SqueezeStateMachine.advance(state, false, 1);
                assertFalse(state.isFired());
                assertEquals(i, state.getFiredBarsAgo());
                assertEquals(Direction.SHORT, state.getDirection());
            }
            assertFalse(state.hasFiredWithin(5));
        }

        @Test
        @DisplayName("OFF without a previous fire stays idle")
        void idle() {
            SqueezeState next = SqueezeStateMachine.advance(SqueezeState.initial(), false, 1);
            assertEquals(SqueezeState.initial(), next);
        }
    }

    // ── scans over bars ──────────────────────────────────────────────────

    @Nested
    @DisplayName("scan()")
    class ScanTests {

        @Test
        @DisplayName("flat window is ON from the first defined bar")
        void flatIsOn() {
            SqueezeHistory history = SqueezeStateMachine.scan(new SqueezeBands().calculate(TestBars.flat(40)));
            assertEquals(SqueezeState.initial(), history.stateAt(18));
            assertTrue(history.stateAt(19).isOn());
            assertTrue(history.current().isOn());
        }

        @Test
        @DisplayName("breakout after a flat base fires long and then ages")
        void breakoutFires() {
            List<Bar> bars = new ArrayList<>(TestBars.flat(40));
            for (int j = 0; j < 3; j++) {
                double close = 100 + (j + 1) * 5;
                bars.add(Bar.of(TestBars.START + (40 + j) * TestBars.MINUTE, close - 5, close + 1, close - 1,
                        close, 1_000));
            }
            SqueezeHistory history = SqueezeStateMachine.scan(new SqueezeBands().calculate(bars));

            assertTrue(history.stateAt(40).isOn());
            SqueezeState fired = history.stateAt(41);
            assertTrue(fired.isFired());
            assertEquals(Direction.LONG, fired.getDirection());
            assertEquals(0, fired.getFiredBarsAgo());

            SqueezeState after = history.stateAt(42);
            assertFalse(after.isFired());
            assertEquals(1, after.getFiredBarsAgo());
            assertEquals(Direction.LONG, after.getDirection());
            assertTrue(after.hasFiredWithin(5));
        }
    }
}
