package org.nowstart.scanner.service.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.nowstart.scanner.data.type.SignalDirection;
import org.nowstart.scanner.service.indicator.IndicatorEngine;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.nowstart.scanner.service.strategy.core.DirectionEvaluation;
import org.nowstart.scanner.service.strategy.core.IndicatorSnapshot;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.nowstart.scanner.service.strategy.core.Signal;
import org.nowstart.scanner.service.strategy.core.SignalAnalysis;
import org.nowstart.scanner.service.strategy.core.SignalCondition;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class SignalEngineTest {

    private static final Instant START = Instant.parse("2026-01-05T00:00:00Z");

    // EMA positioning and the FOMO filter cannot both hold under the default multiplier/fomo pair
    private static final AlgorithmSettings WIDE_FOMO = new AlgorithmSettings(0.5, 0.02, 0.01, 0.005, 1.5, 3.0, "15m");
    private static final AlgorithmSettings WIDE_FOMO_LOW_THRESHOLDS =
            new AlgorithmSettings(0.5, 0.001, 0.001, 0.001, 1.5, 3.0, "15m");

    private final SignalEngine engine = new SignalEngine(new IndicatorEngine());

    @Test
    void generateSignals_skipsWhenHistoryIsShorterThanFiftyBars() {
        List<PriceBar> bars = flat(50);

        SignalAnalysis analysis = engine.generateSignals(bars, List.of(), AlgorithmSettings.defaults());

        assertThat(analysis.signals()).isEmpty();
        assertThat(analysis.skipped()).isTrue();
        assertThat(analysis.skipReason()).contains("50");
    }

    @Test
    void generateSignals_flatSeriesProducesNoSignals() {
        SignalAnalysis analysis = engine.generateSignals(flat(60), List.of(), AlgorithmSettings.defaults());

        assertThat(analysis.skipped()).isFalse();
        assertThat(analysis.signals()).isEmpty();
        assertThat(analysis.evaluations()).hasSize(2);
        DirectionEvaluation longEval = analysis.evaluation(SignalDirection.LONG).orElseThrow();
        assertThat(longEval.passed(SignalCondition.POLAR_FORMATION)).isFalse();
        assertThat(longEval.passed(SignalCondition.VOLATILITY_FILTER)).isFalse();
        assertThat(longEval.totalConditions()).isEqualTo(5);
        assertThat(longEval.rejectionReasons()).contains(SignalCondition.NO_HTF_DATA_REASON);
    }

    @Test
    void generateSignals_risingSeriesPassesPolarFormationAndMomentumUnderDefaults() {
        SignalAnalysis analysis = engine.generateSignals(rising(60, 1.03, 0.045), List.of(), AlgorithmSettings.defaults());

        DirectionEvaluation longEval = analysis.evaluation(SignalDirection.LONG).orElseThrow();
        assertThat(longEval.passed(SignalCondition.POLAR_FORMATION)).isTrue();
        assertThat(longEval.passed(SignalCondition.EMA_MOMENTUM)).isTrue();
        assertThat(longEval.passed(SignalCondition.EMA_POSITIONING)).isFalse();
        assertThat(longEval.valid()).isFalse();
        assertThat(analysis.signals()).isEmpty();
    }

    @Test
    void generateSignals_risingSeriesWithHtfConfirmationFiresLongWithFullConfidence() {
        List<PriceBar> bars = rising(60, 1.03, 0.045);
        List<PriceBar> htfBars = rising(60, 1.03, 0.045);

        SignalAnalysis analysis = engine.generateSignals(bars, htfBars, WIDE_FOMO);

        assertThat(analysis.signals()).hasSize(1);
        Signal signal = analysis.signals().get(0);
        assertThat(signal.direction()).isEqualTo(SignalDirection.LONG);
        assertThat(signal.confidence()).isEqualTo(1.0);
        assertThat(signal.price()).isEqualTo(bars.get(59).close());
        assertThat(signal.timestamp()).isEqualTo(bars.get(59).timestamp());
        assertThat(analysis.evaluation(SignalDirection.LONG).orElseThrow().totalConditions()).isEqualTo(6);
        assertThat(analysis.signal(SignalDirection.SHORT)).isEmpty();
    }

    @Test
    void generateSignals_risingSeriesWithoutHtfFiresOnFiveConditions() {
        SignalAnalysis analysis = engine.generateSignals(rising(60, 1.03, 0.045), null, WIDE_FOMO);

        assertThat(analysis.signal(SignalDirection.LONG)).isPresent();
        DirectionEvaluation longEval = analysis.evaluation(SignalDirection.LONG).orElseThrow();
        assertThat(longEval.conditionsMet()).isEqualTo(5);
        assertThat(longEval.totalConditions()).isEqualTo(5);
        assertThat(longEval.htfAvailable()).isFalse();
    }

    @Test
    void generateSignals_fallingSeriesFiresShort() {
        SignalAnalysis analysis = engine.generateSignals(falling(60, 1.01, 0.013), List.of(), WIDE_FOMO_LOW_THRESHOLDS);

        assertThat(analysis.signals()).extracting(Signal::direction).containsExactly(SignalDirection.SHORT);
        assertThat(analysis.signal(SignalDirection.SHORT).orElseThrow().confidence()).isEqualTo(1.0);
    }

    @Test
    void generateSignals_opposingHtfBlocksLongSignal() {
        List<PriceBar> htfBars = falling(60, 1.01, 0.013);

        SignalAnalysis analysis = engine.generateSignals(rising(60, 1.03, 0.045), htfBars, WIDE_FOMO);

        DirectionEvaluation longEval = analysis.evaluation(SignalDirection.LONG).orElseThrow();
        assertThat(longEval.conditionsMet()).isEqualTo(5);
        assertThat(longEval.totalConditions()).isEqualTo(6);
        assertThat(longEval.confidence()).isEqualTo(5.0 / 6.0);
        assertThat(longEval.valid()).isFalse();
        assertThat(analysis.signals()).isEmpty();
    }

    @Test
    void generateSignals_skipsWholeAnalysisWhenHtfHistoryIsTooShort() {
        List<PriceBar> htfBars = rising(10, 1.03, 0.045);

        SignalAnalysis analysis = engine.generateSignals(rising(60, 1.03, 0.045), htfBars, WIDE_FOMO);

        assertThat(analysis.skipped()).isTrue();
        assertThat(analysis.signals()).isEmpty();
    }

    @Test
    void generateSignals_withoutPreviousSnapshotFailsMomentumClosed() {
        // 51 bars -> 50 history bars: the current snapshot exists but the previous one does not
        SignalAnalysis analysis = engine.generateSignals(rising(51, 1.03, 0.045), List.of(), WIDE_FOMO);

        assertThat(analysis.skipped()).isFalse();
        assertThat(analysis.evaluation(SignalDirection.LONG).orElseThrow().passed(SignalCondition.EMA_MOMENTUM)).isFalse();
        assertThat(analysis.signals()).isEmpty();
    }

    @Test
    void generateSignals_isDeterministic() {
        List<PriceBar> bars = rising(70, 1.03, 0.045);
        List<PriceBar> htfBars = rising(60, 1.03, 0.045);

        SignalAnalysis first = engine.generateSignals(bars, htfBars, WIDE_FOMO);
        SignalAnalysis second = engine.generateSignals(bars, htfBars, WIDE_FOMO);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void generateSignals_emptyOrSingleBarSeriesYieldsNoSignals() {
        SignalAnalysis empty = engine.generateSignals(List.of(), List.of(), WIDE_FOMO);
        SignalAnalysis single = engine.generateSignals(flat(1), null, WIDE_FOMO);

        assertThat(empty.signals()).isEmpty();
        assertThat(empty.skipped()).isTrue();
        assertThat(empty.skipReason()).contains("got 0");
        assertThat(single.signals()).isEmpty();
        assertThat(single.skipped()).isTrue();
    }

    @Test
    void evaluateLong_allConditionsWithHtfGiveFullConfidence() {
        PriceBar bar = bar(START, 100.0, 103.0, 99.0, 102.0);
        IndicatorSnapshot previous = snapshot(97.0, 100.0, 100.5, 1.0, 102.0);
        IndicatorSnapshot current = snapshot(99.9, 101.5, 101.2, 1.0, 102.0);
        PriceBar htfBar = bar(START, 100.0, 101.5, 99.5, 101.0);
        IndicatorSnapshot htf = snapshot(101.0, 100.5, 100.0, 1.0, 101.0);

        DirectionEvaluation evaluation = engine.evaluateLong(
                bar, current, List.of(previous, current), htfBar, htf, AlgorithmSettings.defaults()
        );

        assertThat(evaluation.conditionsMet()).isEqualTo(6);
        assertThat(evaluation.confidence()).isEqualTo(1.0);
        assertThat(evaluation.valid()).isTrue();
        assertThat(evaluation.rejectionReasons()).isEmpty();
        assertThat(evaluation.satisfiedLabels()).contains("HTF confirms uptrend");
    }

    @Test
    void evaluateLong_singleFailingConditionInvalidatesSignal() {
        PriceBar bar = bar(START, 100.0, 103.0, 99.0, 102.0);
        IndicatorSnapshot previous = snapshot(97.0, 100.0, 100.5, 1.0, 102.0);
        // wider ATR pushes the long line below EMA5
        IndicatorSnapshot current = new IndicatorSnapshot(99.9, 101.5, 101.3, 101.2, 100.0, 2.0, 98.0, 106.0);

        DirectionEvaluation evaluation = engine.evaluateLong(
                bar, current, List.of(previous, current), null, null, AlgorithmSettings.defaults()
        );

        assertThat(evaluation.conditionsMet()).isEqualTo(4);
        assertThat(evaluation.failedConditions()).containsExactly(SignalCondition.EMA_POSITIONING);
        assertThat(evaluation.valid()).isFalse();
        assertThat(evaluation.confidence()).isEqualTo(0.8);
    }

    @Test
    void evaluate_conditionErrorCountsAsFailureAndIsLogged(CapturedOutput output) {
        PriceBar bar = bar(START, 100.0, 103.0, 99.0, 102.0);
        IndicatorSnapshot previous = snapshot(0.0, 100.0, 100.5, 1.0, 102.0);
        IndicatorSnapshot current = snapshot(99.9, 101.5, 101.2, 1.0, 102.0);

        DirectionEvaluation evaluation = engine.evaluateLong(
                bar, current, List.of(previous, current), null, null, AlgorithmSettings.defaults()
        );

        assertThat(evaluation.passed(SignalCondition.EMA_MOMENTUM)).isFalse();
        assertThat(evaluation.passed(SignalCondition.POLAR_FORMATION)).isTrue();
        assertThat(output).containsPattern("event=condition_error[^\\n]*condition=ema_momentum");
    }

    @Test
    void evaluateShort_mirrorsLongRules() {
        PriceBar bar = bar(START, 102.0, 103.0, 99.0, 100.0);
        IndicatorSnapshot previous = snapshot(104.9, 102.0, 101.5, 1.0, 100.0);
        IndicatorSnapshot current = snapshot(102.1, 100.5, 100.8, 1.0, 100.0);

        DirectionEvaluation evaluation = engine.evaluateShort(
                bar, current, List.of(previous, current), null, null, AlgorithmSettings.defaults()
        );

        assertThat(evaluation.direction()).isEqualTo(SignalDirection.SHORT);
        assertThat(evaluation.valid()).isTrue();
        assertThat(evaluation.outcomes()).isEqualTo(Map.of(
                SignalCondition.POLAR_FORMATION, true,
                SignalCondition.EMA_POSITIONING, true,
                SignalCondition.EMA_MOMENTUM, true,
                SignalCondition.FOMO_FILTER, true,
                SignalCondition.VOLATILITY_FILTER, true
        ));
    }

    private IndicatorSnapshot snapshot(double ema5, double ema8, double ema21, double atr, double close) {
        double multiplier = AlgorithmSettings.defaults().atrMultiplier();
        return new IndicatorSnapshot(ema5, ema8, (ema8 + ema21) / 2.0, ema21, ema21, atr,
                close - atr * multiplier, close + atr * multiplier);
    }

    private List<PriceBar> flat(int count) {
        List<PriceBar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bars.add(bar(START.plus(Duration.ofMinutes(i)), 100.0, 100.0, 100.0, 100.0));
        }
        return bars;
    }

    private List<PriceBar> rising(int count, double growth, double wick) {
        List<PriceBar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double close = 100.0 * Math.pow(growth, i);
            double open = close / growth;
            bars.add(bar(START.plus(Duration.ofMinutes(i)), open, close * (1 + wick), open * (1 - wick), close));
        }
        return bars;
    }

    private List<PriceBar> falling(int count, double decay, double wick) {
        List<PriceBar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double close = 100.0 / Math.pow(decay, i);
            double open = close * decay;
            bars.add(bar(START.plus(Duration.ofMinutes(i)), open, open * (1 + wick), close * (1 - wick), close));
        }
        return bars;
    }

    private PriceBar bar(Instant timestamp, double open, double high, double low, double close) {
        return new PriceBar("AAPL", timestamp, open, high, low, close, 1_000L);
    }
}
