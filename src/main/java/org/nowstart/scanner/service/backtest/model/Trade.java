package org.nowstart.scanner.service.backtest.model;

import java.time.Instant;
import org.nowstart.scanner.data.type.ExitReason;
import org.nowstart.scanner.data.type.SignalDirection;

/**
 * A closed round trip.
 *
 * @param pnl        price-unit profit after commission
 * @param pnlPercent directional return as a fraction of the entry price, before commission
 */
public record Trade(
        String symbol,
        SignalDirection direction,
        Instant entryTimestamp,
        Instant exitTimestamp,
        double entryPrice,
        double exitPrice,
        double pnl,
        double pnlPercent,
        ExitReason exitReason
) {

    public Trade {
        if (symbol == null || direction == null || entryTimestamp == null || exitTimestamp == null || exitReason == null) {
            throw new IllegalArgumentException("symbol, direction, timestamps, and exitReason are required");
        }
    }

    public static Trade close(Position position, Instant exitTimestamp, double exitPrice, double commission, ExitReason reason) {
        double grossPnl = position.direction() == SignalDirection.LONG
                ? exitPrice - position.entryPrice()
                : position.entryPrice() - exitPrice;
        return new Trade(
                position.symbol(),
                position.direction(),
                position.entryTimestamp(),
                exitTimestamp,
                position.entryPrice(),
                exitPrice,
                grossPnl - commission,
                position.returnAt(exitPrice),
                reason
        );
    }

    public boolean winning() {
        return pnl > 0.0;
    }
}
