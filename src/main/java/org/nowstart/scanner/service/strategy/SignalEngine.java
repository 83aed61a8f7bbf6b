package org.nowstart.scanner.service.strategy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scanner.data.exception.IndicatorException;
import org.nowstart.scanner.data.type.SignalDirection;
import org.nowstart.scanner.service.indicator.IndicatorEngine;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.nowstart.scanner.service.strategy.core.DirectionEvaluation;
import org.nowstart.scanner.service.strategy.core.IndicatorSnapshot;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.nowstart.scanner.service.strategy.core.Signal;
import org.nowstart.scanner.service.strategy.core.SignalAnalysis;
import org.nowstart.scanner.service.strategy.core.SignalCondition;
import org.springframework.stereotype.Component;

/**
 * EMA/ATR rule set: polar formation, EMA positioning against the ATR bands, EMA momentum,
 * FOMO and volatility filters, and optional higher-timeframe confirmation.
 *
 * <p>The engine holds no per-call state; everything an evaluation produces is returned in
 * {@link SignalAnalysis}, so one instance is shared by all concurrent symbol tasks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalEngine {

    public static final int MIN_HISTORY_BARS = IndicatorEngine.LONGEST_EMA_PERIOD;

    private final IndicatorEngine indicatorEngine;

    public DirectionEvaluation evaluateLong(
            PriceBar bar,
            IndicatorSnapshot indicators,
            List<IndicatorSnapshot> historicalIndicators,
            PriceBar htfBar,
            IndicatorSnapshot htfIndicators,
            AlgorithmSettings settings
    ) {
        return evaluate(SignalDirection.LONG, bar, indicators, historicalIndicators, htfBar, htfIndicators, settings);
    }

    public DirectionEvaluation evaluateShort(
            PriceBar bar,
            IndicatorSnapshot indicators,
            List<IndicatorSnapshot> historicalIndicators,
            PriceBar htfBar,
            IndicatorSnapshot htfIndicators,
            AlgorithmSettings settings
    ) {
        return evaluate(SignalDirection.SHORT, bar, indicators, historicalIndicators, htfBar, htfIndicators, settings);
    }

    /**
     * Evaluates every condition of one direction.
     *
     * @param historicalIndicators snapshots ordered oldest first; the last one belongs to {@code bar}
     * @param htfBar               higher-timeframe bar, or null
     * @param htfIndicators        higher-timeframe indicators, or null; HTF confirmation only counts when
     *                             both HTF arguments are present
     */
    public DirectionEvaluation evaluate(
            SignalDirection direction,
            PriceBar bar,
            IndicatorSnapshot indicators,
            List<IndicatorSnapshot> historicalIndicators,
            PriceBar htfBar,
            IndicatorSnapshot htfIndicators,
            AlgorithmSettings settings
    ) {
        if (direction == null || bar == null || indicators == null || settings == null) {
            throw new IllegalArgumentException("direction, bar, indicators, and settings are required");
        }

        Map<SignalCondition, Boolean> outcomes = new EnumMap<>(SignalCondition.class);
        outcomes.put(
                SignalCondition.POLAR_FORMATION,
                check(SignalCondition.POLAR_FORMATION, direction, bar, () -> polarFormation(direction, bar, indicators))
        );
        outcomes.put(
                SignalCondition.EMA_POSITIONING,
                check(SignalCondition.EMA_POSITIONING, direction, bar, () -> emaPositioning(direction, indicators))
        );
        outcomes.put(
                SignalCondition.EMA_MOMENTUM,
                check(SignalCondition.EMA_MOMENTUM, direction, bar, () -> emaMomentum(direction, historicalIndicators, settings))
        );
        outcomes.put(
                SignalCondition.FOMO_FILTER,
                check(SignalCondition.FOMO_FILTER, direction, bar, () -> fomoFilter(bar, indicators, settings))
        );
        outcomes.put(
                SignalCondition.VOLATILITY_FILTER,
                check(SignalCondition.VOLATILITY_FILTER, direction, bar, () -> volatilityFilter(indicators, settings))
        );
        if (htfBar != null && htfIndicators != null) {
            outcomes.put(
                    SignalCondition.HTF_CONFIRMATION,
                    check(SignalCondition.HTF_CONFIRMATION, direction, bar, () -> htfConfirmation(direction, htfBar, htfIndicators))
            );
        }

        DirectionEvaluation evaluation = new DirectionEvaluation(direction, outcomes);
        if (evaluation.valid()) {
            log.info(
                    "event=signal_generated symbol={} ts={} direction={} confidence={}",
                    bar.symbol(),
                    bar.timestamp(),
                    direction,
                    evaluation.confidence()
            );
        }
        return evaluation;
    }

    /**
     * Generates the signals for {@code bar} given the bars before it.
     *
     * <p>Never throws for data problems: too little history or an indicator failure yields an analysis
     * without signals and with a skip reason.
     *
     * @param history    base-timeframe bars before {@code bar}, oldest first
     * @param htfBar     current higher-timeframe bar, or null
     * @param htfHistory higher-timeframe bars before {@code htfBar}, or null
     */
    public SignalAnalysis generateSignals(
            PriceBar bar,
            List<PriceBar> history,
            PriceBar htfBar,
            List<PriceBar> htfHistory,
            AlgorithmSettings settings
    ) {
        if (bar == null) {
            throw new IllegalArgumentException("bar is required");
        }
        AlgorithmSettings resolvedSettings = settings == null ? AlgorithmSettings.defaults() : settings;
        List<PriceBar> resolvedHistory = history == null ? List.of() : history;

        if (resolvedHistory.size() < MIN_HISTORY_BARS) {
            return SignalAnalysis.skipped(
                    bar.symbol(),
                    bar.timestamp(),
                    "Need at least " + MIN_HISTORY_BARS + " historical bars, got " + resolvedHistory.size()
            );
        }

        try {
            double multiplier = resolvedSettings.atrMultiplier();
            IndicatorSnapshot indicators = indicatorEngine.computeIndicators(append(resolvedHistory, bar), multiplier);

            List<IndicatorSnapshot> historicalIndicators = new ArrayList<>(2);
            if (resolvedHistory.size() >= IndicatorEngine.REQUIRED_DATA_POINTS) {
                historicalIndicators.add(indicatorEngine.computeIndicators(resolvedHistory, multiplier));
            }
            historicalIndicators.add(indicators);

            IndicatorSnapshot htfIndicators = null;
            if (htfBar != null && htfHistory != null && !htfHistory.isEmpty()) {
                htfIndicators = indicatorEngine.computeIndicators(append(htfHistory, htfBar), multiplier);
            }
            PriceBar htfCurrent = htfIndicators == null ? null : htfBar;

            List<DirectionEvaluation> evaluations = new ArrayList<>(2);
            List<Signal> signals = new ArrayList<>(2);
            for (SignalDirection direction : SignalDirection.values()) {
                DirectionEvaluation evaluation = evaluate(
                        direction,
                        bar,
                        indicators,
                        historicalIndicators,
                        htfCurrent,
                        htfIndicators,
                        resolvedSettings
                );
                evaluations.add(evaluation);
                if (evaluation.valid()) {
                    signals.add(new Signal(
                            bar.symbol(),
                            direction,
                            bar.timestamp(),
                            bar.close(),
                            indicators,
                            evaluation.confidence()
                    ));
                }
            }
            return new SignalAnalysis(bar.symbol(), bar.timestamp(), signals, evaluations, null);
        } catch (IndicatorException e) {
            log.warn("event=indicator_failure symbol={} ts={} reason=\"{}\"", bar.symbol(), bar.timestamp(), e.getMessage());
            return SignalAnalysis.skipped(bar.symbol(), bar.timestamp(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error generating signals for symbol={} ts={}", bar.symbol(), bar.timestamp(), e);
            return SignalAnalysis.skipped(bar.symbol(), bar.timestamp(), "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Treats the last element of {@code bars} as the current bar and the rest as its history.
     */
    public SignalAnalysis generateSignals(List<PriceBar> bars, List<PriceBar> htfBars, AlgorithmSettings settings) {
        if (bars == null || bars.isEmpty()) {
            return SignalAnalysis.skipped(null, null, "Need at least " + MIN_HISTORY_BARS + " historical bars, got 0");
        }
        PriceBar bar = bars.get(bars.size() - 1);
        List<PriceBar> history = bars.subList(0, bars.size() - 1);

        PriceBar htfBar = null;
        List<PriceBar> htfHistory = null;
        if (htfBars != null && !htfBars.isEmpty()) {
            htfBar = htfBars.get(htfBars.size() - 1);
            htfHistory = htfBars.subList(0, htfBars.size() - 1);
        }
        return generateSignals(bar, history, htfBar, htfHistory, settings);
    }

    private boolean check(SignalCondition condition, SignalDirection direction, PriceBar bar, BooleanSupplier rule) {
        try {
            boolean passed = rule.getAsBoolean();
            if (passed) {
                log.debug("event=condition_passed symbol={} direction={} condition={}", bar.symbol(), direction, condition.key());
            }
            return passed;
        } catch (RuntimeException e) {
            log.error(
                    "event=condition_error symbol={} ts={} direction={} condition={}",
                    bar.symbol(),
                    bar.timestamp(),
                    direction,
                    condition.key(),
                    e
            );
            return false;
        }
    }

    private boolean polarFormation(SignalDirection direction, PriceBar bar, IndicatorSnapshot indicators) {
        double close = bar.close();
        if (direction == SignalDirection.LONG) {
            return close > bar.open() && close > indicators.ema8() && close > indicators.ema21();
        }
        return close < bar.open() && close < indicators.ema8() && close < indicators.ema21();
    }

    private boolean emaPositioning(SignalDirection direction, IndicatorSnapshot indicators) {
        if (direction == SignalDirection.LONG) {
            return indicators.ema5() < indicators.atrLongLine();
        }
        return indicators.ema5() > indicators.atrShortLine();
    }

    private boolean emaMomentum(
            SignalDirection direction,
            List<IndicatorSnapshot> historicalIndicators,
            AlgorithmSettings settings
    ) {
        if (historicalIndicators == null || historicalIndicators.size() < 2) {
            log.debug("event=momentum_unavailable direction={} snapshots={}",
                    direction,
                    historicalIndicators == null ? 0 : historicalIndicators.size());
            return false;
        }

        IndicatorSnapshot current = historicalIndicators.get(historicalIndicators.size() - 1);
        IndicatorSnapshot previous = historicalIndicators.get(historicalIndicators.size() - 2);

        double ema5Change = relativeChange(current.ema5(), previous.ema5());
        double ema8Change = relativeChange(current.ema8(), previous.ema8());
        double ema21Change = relativeChange(current.ema21(), previous.ema21());

        if (direction == SignalDirection.LONG) {
            return ema5Change >= settings.ema5RisingThreshold()
                    && ema8Change >= settings.ema8RisingThreshold()
                    && ema21Change >= settings.ema21RisingThreshold();
        }
        return ema5Change <= -settings.ema5RisingThreshold()
                && ema8Change <= -settings.ema8RisingThreshold()
                && ema21Change <= -settings.ema21RisingThreshold();
    }

    private boolean fomoFilter(PriceBar bar, IndicatorSnapshot indicators, AlgorithmSettings settings) {
        double maxDistance = indicators.atr() * settings.fomoFilter();
        double distanceFromEma8 = Math.abs(bar.close() - indicators.ema8());
        double distanceFromEma21 = Math.abs(bar.close() - indicators.ema21());
        return distanceFromEma8 <= maxDistance && distanceFromEma21 <= maxDistance;
    }

    private boolean volatilityFilter(IndicatorSnapshot indicators, AlgorithmSettings settings) {
        return indicators.atr() >= 1.0 / settings.volatilityFilter();
    }

    private boolean htfConfirmation(SignalDirection direction, PriceBar htfBar, IndicatorSnapshot htfIndicators) {
        if (direction == SignalDirection.LONG) {
            return htfIndicators.ema5() > htfIndicators.ema8() && htfBar.close() > htfBar.open();
        }
        return htfIndicators.ema5() < htfIndicators.ema8() && htfBar.close() < htfBar.open();
    }

    private double relativeChange(double current, double previous) {
        if (previous == 0.0) {
            throw new ArithmeticException("previous EMA is zero");
        }
        return (current - previous) / previous;
    }

    private List<PriceBar> append(List<PriceBar> history, PriceBar bar) {
        List<PriceBar> window = new ArrayList<>(history.size() + 1);
        window.addAll(history);
        window.add(bar);
        return window;
    }
}
