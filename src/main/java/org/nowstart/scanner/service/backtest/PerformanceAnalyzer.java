package org.nowstart.scanner.service.backtest;

import java.util.Comparator;
import java.util.List;
import org.nowstart.scanner.service.backtest.model.PerformanceSummary;
import org.nowstart.scanner.service.backtest.model.Trade;
import org.springframework.stereotype.Component;

@Component
public class PerformanceAnalyzer {

    public PerformanceSummary summarize(List<Trade> trades) {
        if (trades == null || trades.isEmpty()) {
            return PerformanceSummary.empty();
        }

        int total = trades.size();
        int winning = (int) trades.stream().filter(Trade::winning).count();
        int losing = total - winning;

        double[] returns = trades.stream().mapToDouble(Trade::pnlPercent).toArray();
        double totalReturn = 0.0;
        for (double value : returns) {
            totalReturn += value;
        }
        double averageReturn = totalReturn / total;

        return new PerformanceSummary(
                total,
                winning,
                losing,
                winning / (double) total,
                totalReturn,
                averageReturn,
                maxDrawdown(trades),
                sharpeRatio(returns, averageReturn)
        );
    }

    /**
     * Largest drop of the cumulative return from its running peak, trades ordered by exit time.
     * The peak starts at zero, so a losing first trade already counts as drawdown.
     */
    double maxDrawdown(List<Trade> trades) {
        List<Trade> ordered = trades.stream()
                .sorted(Comparator.comparing(Trade::exitTimestamp))
                .toList();

        double cumulative = 0.0;
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (Trade trade : ordered) {
            cumulative += trade.pnlPercent();
            peak = Math.max(peak, cumulative);
            maxDrawdown = Math.max(maxDrawdown, peak - cumulative);
        }
        return maxDrawdown;
    }

    double sharpeRatio(double[] returns, double mean) {
        if (returns.length < 2) {
            return 0.0;
        }
        double squared = 0.0;
        for (double value : returns) {
            double diff = value - mean;
            squared += diff * diff;
        }
        double stdev = Math.sqrt(squared / (returns.length - 1));
        if (stdev == 0.0 || !Double.isFinite(stdev)) {
            return 0.0;
        }
        return mean / stdev;
    }
}
