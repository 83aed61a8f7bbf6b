package org.nowstart.scanner.service.backtest.model;

import java.util.List;

/**
 * Simulator output for one symbol.
 *
 * @param barsFailed bars whose processing raised an error and was skipped
 */
public record SymbolBacktest(
        String symbol,
        List<Trade> trades,
        int barsProcessed,
        int barsFailed
) {

    public SymbolBacktest {
        trades = trades == null ? List.of() : List.copyOf(trades);
    }
}
