package org.nowstart.scanner.service.strategy.core;

import org.nowstart.scanner.data.type.Timeframe;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Rule-set parameters applied to a whole scan or a whole backtest run.
 *
 * <p>Ranges are enforced on construction, so an instance that exists is always usable by
 * the signal engine. Configured defaults live under {@code scanner.algorithm}.
 */
@ConfigurationProperties(prefix = "scanner.algorithm")
public record AlgorithmSettings(
        @DefaultValue("2.0") double atrMultiplier,
        @DefaultValue("0.02") double ema5RisingThreshold,
        @DefaultValue("0.01") double ema8RisingThreshold,
        @DefaultValue("0.005") double ema21RisingThreshold,
        @DefaultValue("1.5") double volatilityFilter,
        @DefaultValue("1.0") double fomoFilter,
        @DefaultValue("15m") String higherTimeframe
) {

    public static final double MIN_ATR_MULTIPLIER = 0.5;
    public static final double MAX_ATR_MULTIPLIER = 10.0;
    public static final double MIN_RISING_THRESHOLD = 0.001;
    public static final double MAX_RISING_THRESHOLD = 0.1;
    public static final double MIN_VOLATILITY_FILTER = 0.1;
    public static final double MAX_VOLATILITY_FILTER = 5.0;
    public static final double MIN_FOMO_FILTER = 0.1;
    public static final double MAX_FOMO_FILTER = 3.0;

    public AlgorithmSettings {
        validateRange("atrMultiplier", atrMultiplier, MIN_ATR_MULTIPLIER, MAX_ATR_MULTIPLIER);
        validateRange("ema5RisingThreshold", ema5RisingThreshold, MIN_RISING_THRESHOLD, MAX_RISING_THRESHOLD);
        validateRange("ema8RisingThreshold", ema8RisingThreshold, MIN_RISING_THRESHOLD, MAX_RISING_THRESHOLD);
        validateRange("ema21RisingThreshold", ema21RisingThreshold, MIN_RISING_THRESHOLD, MAX_RISING_THRESHOLD);
        validateRange("volatilityFilter", volatilityFilter, MIN_VOLATILITY_FILTER, MAX_VOLATILITY_FILTER);
        validateRange("fomoFilter", fomoFilter, MIN_FOMO_FILTER, MAX_FOMO_FILTER);
        higherTimeframe = Timeframe.fromCode(higherTimeframe).code();
    }

    public static AlgorithmSettings defaults() {
        return new AlgorithmSettings(2.0, 0.02, 0.01, 0.005, 1.5, 1.0, Timeframe.M15.code());
    }

    public Timeframe timeframe() {
        return Timeframe.fromCode(higherTimeframe);
    }

    private static void validateRange(String field, double value, double min, double max) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite");
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " must be in [" + min + ", " + max + "], got " + value);
        }
    }
}
