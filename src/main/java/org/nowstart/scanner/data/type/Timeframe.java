package org.nowstart.scanner.data.type;

import java.util.Arrays;
import java.util.Locale;

/**
 * Bar intervals supported by the market-data port and the higher-timeframe confirmation rule.
 */
public enum Timeframe {
    M1("1m"),
    M2("2m"),
    M5("5m"),
    M15("15m"),
    M30("30m"),
    H1("1h"),
    H2("2h"),
    H4("4h"),
    D1("1d");

    private final String code;

    Timeframe(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Timeframe fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("timeframe is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(timeframe -> timeframe.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid timeframe " + code + ", must be one of " + Arrays.stream(values()).map(Timeframe::code).toList()
                ));
    }
}
