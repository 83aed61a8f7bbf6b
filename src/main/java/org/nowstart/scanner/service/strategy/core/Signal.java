package org.nowstart.scanner.service.strategy.core;

import java.time.Instant;
import org.nowstart.scanner.data.type.SignalDirection;

public record Signal(
        String symbol,
        SignalDirection direction,
        Instant timestamp,
        double price,
        IndicatorSnapshot indicators,
        double confidence
) {

    public Signal {
        if (symbol == null || direction == null || timestamp == null || indicators == null) {
            throw new IllegalArgumentException("symbol, direction, timestamp, and indicators are required");
        }
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]");
        }
    }
}
