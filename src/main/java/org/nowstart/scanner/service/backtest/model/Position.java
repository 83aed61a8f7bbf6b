package org.nowstart.scanner.service.backtest.model;

import java.time.Instant;
import org.nowstart.scanner.data.type.SignalDirection;

public record Position(
        String symbol,
        SignalDirection direction,
        Instant entryTimestamp,
        double entryPrice
) {

    public Position {
        if (symbol == null || direction == null || entryTimestamp == null) {
            throw new IllegalArgumentException("symbol, direction, and entryTimestamp are required");
        }
        if (!Double.isFinite(entryPrice) || entryPrice <= 0.0) {
            throw new IllegalArgumentException("entryPrice must be a positive finite number");
        }
    }

    /**
     * Directional return of the position at {@code price}, as a fraction of the entry price.
     */
    public double returnAt(double price) {
        double change = (price - entryPrice) / entryPrice;
        return direction == SignalDirection.LONG ? change : -change;
    }
}
