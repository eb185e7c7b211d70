package ch.xavier.signalengine.backtest;

import ch.xavier.signalengine.TestBars;
import ch.xavier.signalengine.backtest.model.CurvePoint;
import ch.xavier.signalengine.backtest.model.DailyFilter;
import ch.xavier.signalengine.backtest.model.SignalBacktestRequest;
import ch.xavier.signalengine.backtest.model.SignalBacktestResult;
import ch.xavier.signalengine.backtest.model.SignalEvent;
import ch.xavier.signalengine.bar.Bar;
import ch.xavier.signalengine.config.SignalEngineProperties;
import ch.xavier.signalengine.indicator.OverlayService;
import ch.xavier.signalengine.score.SignalScoreService;
import ch.xavier.signalengine.score.SignalState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalBacktestServiceTest {

    private final SignalEngineProperties properties = new SignalEngineProperties();
    private final SignalScoreService scoreService;
    private final SignalBacktestService backtestService;

    SignalBacktestServiceTest() {
        properties.getBacktest().setMaxRecentScores(50);
        scoreService = new SignalScoreService(new OverlayService(properties), properties);
        backtestService = new SignalBacktestService(scoreService, properties);
    }

    private SignalBacktestResult run(SignalBacktestRequest request) {
        return backtestService.backtest(request).block();
    }

    /**
     * 120 rising daily bars ending the day before the intraday window starts.
     */
    private static List<Bar> bullishDailyBars() {
        List<Bar> bars = new ArrayList<>();
        for (int k = 0; k < 120; k++) {
            double close = 100 + k;
            bars.add(Bar.of(TestBars.START - (120 - k) * TestBars.DAY, close - 0.5, close + 0.5, close - 0.5, close,
                    1_000));
        }
        return bars;
    }

    // ── statistics ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("backtest()")
    class BacktestTests {

        @Test
        @DisplayName("uptrend events all win and have no profit factor")
        void uptrend() {
            List<Bar> bars = TestBars.rising(300, 100, 1);
            SignalBacktestResult result = run(SignalBacktestRequest.builder().symbol("UP").bars(bars).build());

            List<SignalState> states = scoreService.computeStates(bars);
            int expectedEvents = 0;
            for (int i = 60; i + 10 < bars.size(); i++) {
                if (states.get(i).getScore() >= 70) {
                    expectedEvents++;
                }
            }

            assertEquals(300, result.getBars());
            assertEquals(70, result.getThreshold(), 1e-9);
            assertEquals(10, result.getHorizon());
            assertTrue(expectedEvents > 0);
            assertEquals(expectedEvents, result.getEvents());
            assertEquals(100, result.getWinRate(), 1e-9);
            assertTrue(result.getAvgFwd() > 0);
            assertEquals(0, result.getAvgLoss(), 1e-9);
            assertNull(result.getProfitFactor());
        }

        @Test
        @DisplayName("events carry the forward return over the horizon")
        void eventReturns() {
            List<Bar> bars = TestBars.rising(300, 100, 1);
            SignalBacktestResult result = run(SignalBacktestRequest.builder().bars(bars).horizon(5).build());
            for (SignalEvent event : result.getEventList()) {
                double expected = (bars.get(event.getIndex() + 5).getClose() - event.getClose()) / event.getClose();
                assertEquals(expected, event.getForwardReturn(), 1e-12);
                assertTrue(event.getIndex() + 5 < bars.size());
                assertTrue(event.getScore() >= 70);
            }
        }

        @Test
        @DisplayName("downtrend has no events")
        void downtrend() {
            SignalBacktestResult result = run(SignalBacktestRequest.builder()
                    .bars(TestBars.rising(300, 400, -1)).build());
            assertEquals(0, result.getEvents());
            assertEquals(0, result.getWinRate(), 1e-9);
            assertNull(result.getProfitFactor());
        }

        @Test
        @DisplayName("mixed outcomes give the ratio of average win to average loss")
        void profitFactor() {
            List<Bar> bars = TestBars.randomWalk(400, 61, 0.01, TestBars.MINUTE);
            SignalBacktestResult result = run(SignalBacktestRequest.builder().bars(bars).threshold(0.0).build());

            List<Double> wins = new ArrayList<>();
            List<Double> losses = new ArrayList<>();
            for (SignalEvent event : result.getEventList()) {
                (event.getForwardReturn() > 0 ? wins : losses).add(event.getForwardReturn());
            }
            assertFalse(wins.isEmpty());
            assertFalse(losses.isEmpty());
            double expected = Math.abs(SignalBacktestService.average(wins) / SignalBacktestService.average(losses));
            assertEquals(SignalBacktestService.round2(expected), result.getProfitFactor(), 1e-9);
            assertEquals(400 - 80 - 10, result.getEvents());
        }

        @Test
        @DisplayName("bars with a zero close produce no event and keep the statistics finite")
        void zeroClose() {
            List<Bar> bars = new ArrayList<>(TestBars.rising(200, 100, 1));
            bars.set(150, Bar.of(bars.get(150).getTime(), 0, 0, 0, 0, 1_000));
            SignalBacktestResult result = run(SignalBacktestRequest.builder().bars(bars).threshold(0.0).build());

            assertEquals(150 - 1, result.getEvents());
            assertTrue(result.getEventList().stream().noneMatch(event -> event.getIndex() == 150));
            assertTrue(Double.isFinite(result.getAvgFwd()));
            assertTrue(Double.isFinite(result.getMedianFwd()));
            assertNotNull(result.getProfitFactor());
            assertTrue(Double.isFinite(result.getProfitFactor()));
            result.getCurve().forEach(point -> assertTrue(Double.isFinite(point.getAvgFwd())));
        }

        @Test
        @DisplayName("recent scores are capped and summarised")
        void recentScores() {
            SignalBacktestResult result = run(SignalBacktestRequest.builder()
                    .bars(TestBars.rising(300, 100, 1)).build());
            assertEquals(50, result.getRecentScores().size());
            assertEquals(75, result.getScoreAvg(), 1e-9);
            assertEquals(100, result.getScorePcts().get(70), 1e-9);
            assertEquals(List.of(40, 60, 70), new ArrayList<>(result.getScorePcts().keySet()));
        }

        @Test
        @DisplayName("threshold curve is sorted and agrees with the event count")
        void curve() {
            SignalBacktestResult result = run(SignalBacktestRequest.builder()
                    .bars(TestBars.rising(300, 100, 1))
                    .curveThresholds(List.of(70, 30, 70, 90))
                    .build());
            List<CurvePoint> curve = result.getCurve();
            assertEquals(3, curve.size());
            assertEquals(30, curve.get(0).getThreshold());
            assertEquals(70, curve.get(1).getThreshold());
            assertEquals(result.getEvents(), curve.get(1).getEvents());
            assertEquals(0, curve.get(2).getEvents());
            assertTrue(curve.get(0).getEvents() >= curve.get(1).getEvents());
            assertTrue(result.getCurveBull().isEmpty());
        }
    }

    // ── daily regime filter ──────────────────────────────────────────────

    @Nested
    @DisplayName("daily filter")
    class DailyFilterTests {

        @Test
        @DisplayName("bullish daily regime lets every bar through the bull filter")
        void bullPasses() {
            List<Bar> bars = TestBars.rising(300, 100, 1);
            SignalBacktestResult unfiltered = run(SignalBacktestRequest.builder().bars(bars).build());
            SignalBacktestResult filtered = run(SignalBacktestRequest.builder()
                    .bars(bars)
                    .dailyFilter(DailyFilter.BULL)
                    .dailyBars(bullishDailyBars())
                    .build());
            assertEquals(unfiltered.getEvents(), filtered.getEvents());
            assertEquals(filtered.getCurve().size(), filtered.getCurveBull().size());
            assertEquals(filtered.getCurve().get(0).getEvents(), filtered.getCurveBull().get(0).getEvents());
            assertEquals(0, filtered.getCurveBear().get(0).getEvents());
        }

        @Test
        @DisplayName("bullish daily regime blocks every bar under the bear filter")
        void bearBlocks() {
            SignalBacktestResult result = run(SignalBacktestRequest.builder()
                    .bars(TestBars.rising(300, 100, 1))
                    .dailyFilter(DailyFilter.BEAR)
                    .dailyBars(bullishDailyBars())
                    .build());
            assertEquals(0, result.getEvents());
            assertTrue(result.getRecentScores().isEmpty());
        }

        @Test
        @DisplayName("filter names parse leniently")
        void parse() {
            assertEquals(DailyFilter.BULL, DailyFilter.parse(" Bull "));
            assertEquals(DailyFilter.BEAR, DailyFilter.parse("bear"));
            assertEquals(DailyFilter.NONE, DailyFilter.parse("sideways"));
            assertEquals(DailyFilter.NONE, DailyFilter.parse(null));
        }
    }

    // ── reactive drivers ─────────────────────────────────────────────────

    @Nested
    @DisplayName("reactive drivers")
    class ReactiveTests {

        @Test
        @DisplayName("batch keeps symbol order and skips rejected series")
        void batch() {
            Map<String, List<Bar>> barsBySymbol = new LinkedHashMap<>();
            barsBySymbol.put("UP", TestBars.rising(200, 100, 1));
            barsBySymbol.put("BROKEN", List.of(Bar.of(120, 1, 2, 0, 1, 1), Bar.of(60, 1, 2, 0, 1, 1)));
            barsBySymbol.put("DOWN", TestBars.rising(200, 400, -1));

            StepVerifier.create(backtestService.backtestBatch(barsBySymbol,
                            SignalBacktestRequest.builder().horizon(5).build()))
                    .assertNext(result -> {
                        assertEquals("UP", result.getSymbol());
                        assertEquals(5, result.getHorizon());
                    })
                    .assertNext(result -> assertEquals("DOWN", result.getSymbol()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("single backtest of invalid bars errors")
        void invalid() {
            SignalBacktestRequest request = SignalBacktestRequest.builder()
                    .bars(List.of(Bar.of(60, 1, 0, 2, 1, 1)))
                    .build();
            StepVerifier.create(backtestService.backtest(request))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        @DisplayName("replayed scores match the per-bar states in order")
        void replay() {
            List<Bar> bars = TestBars.randomWalk(120, 67, 0.01, 5 * TestBars.MINUTE);
            List<SignalState> states = scoreService.computeStates(bars);
            List<Double> expected = new ArrayList<>();
            for (int i = 90; i < bars.size(); i++) {
                expected.add(states.get(i).getScore());
            }

            StepVerifier.create(backtestService.replayScores(bars, 90).collectList())
                    .assertNext(scores -> assertEquals(expected, scores))
                    .verifyComplete();
            StepVerifier.create(backtestService.replayScores(bars, 500))
                    .verifyComplete();
        }
    }
}
