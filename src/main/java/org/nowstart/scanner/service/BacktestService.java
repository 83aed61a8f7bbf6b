package org.nowstart.scanner.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scanner.data.dto.BacktestResult;
import org.nowstart.scanner.data.property.ScannerProperties;
import org.nowstart.scanner.data.type.Timeframe;
import org.nowstart.scanner.repository.MarketDataRepository;
import org.nowstart.scanner.service.backtest.BacktestSimulator;
import org.nowstart.scanner.service.backtest.PerformanceAnalyzer;
import org.nowstart.scanner.service.backtest.model.PerformanceSummary;
import org.nowstart.scanner.service.backtest.model.SimulationConfig;
import org.nowstart.scanner.service.backtest.model.SymbolBacktest;
import org.nowstart.scanner.service.backtest.model.Trade;
import org.nowstart.scanner.service.strategy.SignalEngine;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.springframework.stereotype.Service;

/**
 * Runs one simulator per symbol on daily bars and merges the ledgers into a single report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private static final Comparator<Trade> TRADE_ORDER = Comparator
            .comparing(Trade::exitTimestamp)
            .thenComparing(Trade::symbol)
            .thenComparing(Trade::entryTimestamp);

    private final MarketDataRepository marketDataRepository;
    private final BacktestSimulator backtestSimulator;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final ScanRequestValidationService scanRequestValidationService;
    private final ScannerProperties scannerProperties;
    private final AlgorithmSettings defaultAlgorithmSettings;
    private final ExecutorService scannerExecutor;

    public BacktestResult runBacktest(
            List<String> symbols,
            LocalDate startDate,
            LocalDate endDate,
            AlgorithmSettings settings,
            SimulationConfig simulationConfig
    ) {
        List<String> normalized = scanRequestValidationService.normalizeSymbols(symbols);
        scanRequestValidationService.validateDateRange(startDate, endDate);
        AlgorithmSettings resolvedSettings = settings == null ? defaultAlgorithmSettings : settings;
        SimulationConfig resolvedConfig = simulationConfig == null
                ? scannerProperties.simulation().toConfig()
                : simulationConfig;

        Instant from = startDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = endDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        log.info(
                "event=backtest_started symbols={} start={} end={} htf={}",
                normalized.size(),
                startDate,
                endDate,
                resolvedSettings.higherTimeframe()
        );

        Map<String, String> failures = new LinkedHashMap<>();
        Map<String, Future<SymbolBacktest>> futures = new LinkedHashMap<>();
        for (String symbol : normalized) {
            List<PriceBar> bars = marketDataRepository.findBars(symbol, Timeframe.D1, from, to);
            if (bars.size() <= SignalEngine.MIN_HISTORY_BARS) {
                log.info("event=backtest_symbol_skipped symbol={} bars={}", symbol, bars.size());
                failures.put(symbol, "Insufficient data: " + bars.size() + " daily bars");
                continue;
            }
            List<PriceBar> htfBars = resolvedSettings.timeframe() == Timeframe.D1
                    ? List.of()
                    : marketDataRepository.findBars(symbol, resolvedSettings.timeframe(), from, to);
            futures.put(symbol, scannerExecutor.submit(
                    () -> backtestSimulator.simulate(symbol, bars, htfBars, resolvedSettings, resolvedConfig)
            ));
        }

        List<Trade> trades = new ArrayList<>();
        for (Map.Entry<String, Future<SymbolBacktest>> entry : futures.entrySet()) {
            String symbol = entry.getKey();
            try {
                SymbolBacktest result = entry.getValue().get(scannerProperties.symbolTimeout().toMillis(), TimeUnit.MILLISECONDS);
                trades.addAll(result.trades());
                if (result.barsFailed() > 0) {
                    log.warn("event=backtest_bars_failed symbol={} failed={}", symbol, result.barsFailed());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Backtest interrupted", e);
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                log.warn("event=backtest_symbol_timeout symbol={} timeout={}", symbol, scannerProperties.symbolTimeout());
                failures.put(symbol, "Timed out after " + scannerProperties.symbolTimeout());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("event=backtest_symbol_failed symbol={}", symbol, cause);
                failures.put(symbol, String.valueOf(cause.getMessage()));
            }
        }

        trades.sort(TRADE_ORDER);
        PerformanceSummary performance = performanceAnalyzer.summarize(trades);
        log.info(
                "event=backtest_completed symbols={} trades={} win_rate={} total_return={} max_drawdown={} failures={}",
                normalized.size(),
                performance.totalTrades(),
                performance.winRate(),
                performance.totalReturn(),
                performance.maxDrawdown(),
                failures.size()
        );

        return new BacktestResult(
                UUID.randomUUID().toString(),
                Instant.now(),
                startDate,
                endDate,
                normalized,
                List.copyOf(trades),
                performance,
                resolvedSettings,
                resolvedConfig,
                failures
        );
    }
}
