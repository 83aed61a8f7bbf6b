package org.nowstart.scanner.service.strategy.core;

import org.nowstart.scanner.data.type.SignalDirection;

/**
 * Identifiers of the rules evaluated per direction, in evaluation order.
 *
 * <p>{@link #HTF_CONFIRMATION} only takes part when higher-timeframe data is available.
 */
public enum SignalCondition {
    POLAR_FORMATION(
            "polar_formation",
            "Bullish polar formation",
            "Bearish polar formation",
            "No bullish polar formation",
            "No bearish polar formation"
    ),
    EMA_POSITIONING(
            "ema_positioning",
            "EMA5 below ATR long line",
            "EMA5 above ATR short line",
            "EMA5 not below ATR long line",
            "EMA5 not above ATR short line"
    ),
    EMA_MOMENTUM(
            "ema_momentum",
            "EMAs rising",
            "EMAs falling",
            "EMAs not rising past thresholds",
            "EMAs not falling past thresholds"
    ),
    FOMO_FILTER(
            "fomo_filter",
            "FOMO filter passed",
            "FOMO filter passed",
            "Price too extended from EMA8/EMA21",
            "Price too extended from EMA8/EMA21"
    ),
    VOLATILITY_FILTER(
            "volatility_filter",
            "Volatility filter passed",
            "Volatility filter passed",
            "ATR below volatility floor",
            "ATR below volatility floor"
    ),
    HTF_CONFIRMATION(
            "htf_confirmation",
            "HTF confirms uptrend",
            "HTF confirms downtrend",
            "HTF does not confirm uptrend",
            "HTF does not confirm downtrend"
    );

    public static final String NO_HTF_DATA_REASON = "No HTF data available";

    private final String key;
    private final String longPassed;
    private final String shortPassed;
    private final String longFailed;
    private final String shortFailed;

    SignalCondition(String key, String longPassed, String shortPassed, String longFailed, String shortFailed) {
        this.key = key;
        this.longPassed = longPassed;
        this.shortPassed = shortPassed;
        this.longFailed = longFailed;
        this.shortFailed = shortFailed;
    }

    public String key() {
        return key;
    }

    public String passedLabel(SignalDirection direction) {
        return direction == SignalDirection.LONG ? longPassed : shortPassed;
    }

    public String failedReason(SignalDirection direction) {
        return direction == SignalDirection.LONG ? longFailed : shortFailed;
    }
}
