package org.nowstart.scanner.data.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.nowstart.scanner.service.backtest.model.PerformanceSummary;
import org.nowstart.scanner.service.backtest.model.SimulationConfig;
import org.nowstart.scanner.service.backtest.model.Trade;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;

/**
 * @param failures symbols that produced no simulation, mapped to the reason
 */
public record BacktestResult(
        String id,
        Instant timestamp,
        LocalDate startDate,
        LocalDate endDate,
        List<String> symbols,
        List<Trade> trades,
        PerformanceSummary performance,
        AlgorithmSettings settingsUsed,
        SimulationConfig simulationConfig,
        Map<String, String> failures
) {
}
