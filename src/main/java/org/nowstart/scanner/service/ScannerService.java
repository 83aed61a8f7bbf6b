package org.nowstart.scanner.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scanner.data.dto.ScanResult;
import org.nowstart.scanner.data.dto.SymbolScanReport;
import org.nowstart.scanner.data.property.ScannerProperties;
import org.nowstart.scanner.data.type.ScanStatus;
import org.nowstart.scanner.repository.MarketDataRepository;
import org.nowstart.scanner.service.strategy.SignalEngine;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.nowstart.scanner.service.strategy.core.DirectionEvaluation;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.nowstart.scanner.service.strategy.core.SignalAnalysis;
import org.springframework.stereotype.Service;

/**
 * Evaluates the latest bar of many symbols on the shared worker pool.
 * One symbol failing or timing out never aborts the scan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScannerService {

    private final MarketDataRepository marketDataRepository;
    private final SignalEngine signalEngine;
    private final SignalLogService signalLogService;
    private final ScanRequestValidationService scanRequestValidationService;
    private final ScannerProperties scannerProperties;
    private final AlgorithmSettings defaultAlgorithmSettings;
    private final ExecutorService scannerExecutor;

    public ScanResult scan(List<String> symbols, AlgorithmSettings settings) {
        List<String> normalized = scanRequestValidationService.normalizeSymbols(symbols);
        AlgorithmSettings resolvedSettings = settings == null ? defaultAlgorithmSettings : settings;
        long startedAtNanos = System.nanoTime();

        log.info(
                "event=scan_started symbols={} base_timeframe={} htf={}",
                normalized.size(),
                scannerProperties.scanBaseTimeframe(),
                resolvedSettings.higherTimeframe()
        );

        Map<String, Future<SymbolScanReport>> futures = new LinkedHashMap<>();
        for (String symbol : normalized) {
            futures.put(symbol, scannerExecutor.submit(() -> scanSymbol(symbol, resolvedSettings)));
        }

        List<SymbolScanReport> reports = new ArrayList<>(normalized.size());
        for (Map.Entry<String, Future<SymbolScanReport>> entry : futures.entrySet()) {
            reports.add(await(entry.getKey(), entry.getValue()));
        }

        int signalsFound = reports.stream().mapToInt(report -> report.signals().size()).sum();
        long executionTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
        log.info(
                "event=scan_completed symbols={} signals={} elapsed_ms={} statuses={}",
                normalized.size(),
                signalsFound,
                executionTimeMs,
                reports.stream().collect(Collectors.groupingBy(SymbolScanReport::status, Collectors.counting()))
        );

        return new ScanResult(
                UUID.randomUUID().toString(),
                Instant.now(),
                normalized.size(),
                signalsFound,
                reports,
                resolvedSettings,
                executionTimeMs
        );
    }

    SymbolScanReport scanSymbol(String symbol, AlgorithmSettings settings) {
        List<PriceBar> bars = marketDataRepository.findRecentBars(
                symbol,
                scannerProperties.baseTimeframe(),
                scannerProperties.scanLookbackBars()
        );
        if (bars.isEmpty()) {
            return SymbolScanReport.of(symbol, ScanStatus.NO_DATA, "No market data");
        }
        if (bars.size() <= SignalEngine.MIN_HISTORY_BARS) {
            return SymbolScanReport.of(
                    symbol,
                    ScanStatus.INSUFFICIENT_DATA,
                    "Need more than " + SignalEngine.MIN_HISTORY_BARS + " bars, got " + bars.size()
            );
        }

        List<PriceBar> htfBars = marketDataRepository.findRecentBars(
                symbol,
                settings.timeframe(),
                scannerProperties.scanLookbackBars()
        );
        SignalAnalysis analysis = signalEngine.generateSignals(bars, htfBars, settings);
        signalLogService.logAnalysis(analysis);

        if (analysis.skipped()) {
            return SymbolScanReport.of(symbol, ScanStatus.INSUFFICIENT_DATA, analysis.skipReason());
        }
        if (analysis.hasSignals()) {
            return new SymbolScanReport(symbol, ScanStatus.SIGNALS, analysis.signals(), null);
        }
        return SymbolScanReport.of(symbol, ScanStatus.NO_SIGNAL, summarizeRejections(analysis));
    }

    private SymbolScanReport await(String symbol, Future<SymbolScanReport> future) {
        try {
            return future.get(scannerProperties.symbolTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scan interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("event=scan_symbol_timeout symbol={} timeout={}", symbol, scannerProperties.symbolTimeout());
            return SymbolScanReport.of(symbol, ScanStatus.TIMED_OUT, "Timed out after " + scannerProperties.symbolTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("event=scan_symbol_failed symbol={}", symbol, cause);
            return SymbolScanReport.of(symbol, ScanStatus.FAILED, String.valueOf(cause.getMessage()));
        }
    }

    private String summarizeRejections(SignalAnalysis analysis) {
        return analysis.evaluations().stream()
                .map(this::summarize)
                .collect(Collectors.joining(" | "));
    }

    private String summarize(DirectionEvaluation evaluation) {
        return evaluation.direction() + ": " + String.join("; ", evaluation.rejectionReasons());
    }
}
