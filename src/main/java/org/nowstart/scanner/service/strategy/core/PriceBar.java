package org.nowstart.scanner.service.strategy.core;

import java.time.Instant;

/**
 * One OHLCV bar. Bars that break the high/low envelope are rejected here, so the engines never see them.
 */
public record PriceBar(
        String symbol,
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        long volume
) {

    public PriceBar {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        requirePositive("open", open);
        requirePositive("high", high);
        requirePositive("low", low);
        requirePositive("close", close);
        if (volume < 0) {
            throw new IllegalArgumentException("volume must be >= 0");
        }
        if (high < Math.max(open, close)) {
            throw new IllegalArgumentException("high must be >= max(open, close) for " + symbol + " at " + timestamp);
        }
        if (low > Math.min(open, close)) {
            throw new IllegalArgumentException("low must be <= min(open, close) for " + symbol + " at " + timestamp);
        }
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(field + " must be a positive finite number");
        }
    }
}
