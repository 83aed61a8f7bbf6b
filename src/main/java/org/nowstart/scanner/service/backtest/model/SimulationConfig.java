package org.nowstart.scanner.service.backtest.model;

/**
 * Trade management rules for a backtest. Percent thresholds are fractions; null disables the rule.
 */
public record SimulationConfig(
        int entryDelayMinutes,
        Double stopLossPercent,
        Double takeProfitPercent,
        Integer maxHoldDays,
        double commissionPerTrade
) {

    public SimulationConfig {
        if (entryDelayMinutes < 0) {
            throw new IllegalArgumentException("entryDelayMinutes must be >= 0");
        }
        requirePositive("stopLossPercent", stopLossPercent);
        requirePositive("takeProfitPercent", takeProfitPercent);
        if (maxHoldDays != null && maxHoldDays <= 0) {
            throw new IllegalArgumentException("maxHoldDays must be > 0");
        }
        if (!Double.isFinite(commissionPerTrade) || commissionPerTrade < 0.0) {
            throw new IllegalArgumentException("commissionPerTrade must be >= 0");
        }
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(1, null, null, null, 0.0);
    }

    public boolean hasStopLoss() {
        return stopLossPercent != null;
    }

    public boolean hasTakeProfit() {
        return takeProfitPercent != null;
    }

    public boolean hasMaxHold() {
        return maxHoldDays != null;
    }

    private static void requirePositive(String field, Double value) {
        if (value != null && (!Double.isFinite(value) || value <= 0.0)) {
            throw new IllegalArgumentException(field + " must be > 0 when set");
        }
    }
}
