package org.nowstart.scanner.service.backtest.model;

/**
 * Aggregate statistics over a trade ledger. Return figures are fractions (0.05 = 5%).
 */
public record PerformanceSummary(
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRate,
        double totalReturn,
        double averageReturn,
        double maxDrawdown,
        double sharpeRatio
) {

    public static PerformanceSummary empty() {
        return new PerformanceSummary(0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
