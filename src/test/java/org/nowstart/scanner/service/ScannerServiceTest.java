package org.nowstart.scanner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.scanner.data.dto.ScanResult;
import org.nowstart.scanner.data.dto.SymbolScanReport;
import org.nowstart.scanner.data.exception.ScannerApiException;
import org.nowstart.scanner.data.property.ScannerProperties;
import org.nowstart.scanner.data.type.ScanStatus;
import org.nowstart.scanner.data.type.SignalDirection;
import org.nowstart.scanner.data.type.Timeframe;
import org.nowstart.scanner.repository.MarketDataRepository;
import org.nowstart.scanner.service.strategy.SignalEngine;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.nowstart.scanner.service.strategy.core.DirectionEvaluation;
import org.nowstart.scanner.service.strategy.core.IndicatorSnapshot;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.nowstart.scanner.service.strategy.core.Signal;
import org.nowstart.scanner.service.strategy.core.SignalAnalysis;
import org.nowstart.scanner.service.strategy.core.SignalCondition;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ScannerServiceTest {

    private static final Instant START = Instant.parse("2026-02-02T14:30:00Z");
    private static final AlgorithmSettings SETTINGS = AlgorithmSettings.defaults();

    @Mock
    private MarketDataRepository marketDataRepository;

    @Mock
    private SignalEngine signalEngine;

    @Mock
    private SignalLogService signalLogService;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void scan_recordsOutcomePerSymbolWithoutAbortingOnFailure() {
        List<PriceBar> aapl = bars("AAPL", 60);
        List<PriceBar> nvda = bars("NVDA", 60);
        List<PriceBar> amzn = bars("AMZN", 60);
        when(marketDataRepository.findRecentBars("AAPL", Timeframe.M1, 400)).thenReturn(aapl);
        when(marketDataRepository.findRecentBars("MSFT", Timeframe.M1, 400)).thenReturn(List.of());
        when(marketDataRepository.findRecentBars("TSLA", Timeframe.M1, 400)).thenReturn(bars("TSLA", 20));
        when(marketDataRepository.findRecentBars("NVDA", Timeframe.M1, 400)).thenReturn(nvda);
        when(marketDataRepository.findRecentBars("AMZN", Timeframe.M1, 400)).thenReturn(amzn);
        when(marketDataRepository.findRecentBars("AAPL", Timeframe.M15, 400)).thenReturn(List.of());
        when(marketDataRepository.findRecentBars("NVDA", Timeframe.M15, 400)).thenReturn(List.of());
        when(marketDataRepository.findRecentBars("AMZN", Timeframe.M15, 400)).thenReturn(List.of());
        when(signalEngine.generateSignals(eq(aapl), anyList(), eq(SETTINGS))).thenReturn(longSignal(aapl));
        when(signalEngine.generateSignals(eq(nvda), anyList(), eq(SETTINGS))).thenThrow(new IllegalStateException("boom"));
        when(signalEngine.generateSignals(eq(amzn), anyList(), eq(SETTINGS))).thenReturn(noSignal(amzn));

        ScanResult result = service(Duration.ofSeconds(5))
                .scan(List.of(" aapl", "MSFT", "AAPL", "", "tsla", "nvda", "amzn"), SETTINGS);

        assertThat(result.symbolsScanned()).isEqualTo(5);
        assertThat(result.signalsFound()).isEqualTo(1);
        assertThat(result.settingsUsed()).isEqualTo(SETTINGS);
        assertThat(result.reports()).extracting(SymbolScanReport::symbol)
                .containsExactly("AAPL", "MSFT", "TSLA", "NVDA", "AMZN");
        assertThat(result.reports()).extracting(SymbolScanReport::status).containsExactly(
                ScanStatus.SIGNALS,
                ScanStatus.NO_DATA,
                ScanStatus.INSUFFICIENT_DATA,
                ScanStatus.FAILED,
                ScanStatus.NO_SIGNAL
        );
        assertThat(result.reports().get(3).detail()).isEqualTo("boom");
        assertThat(result.reports().get(4).detail()).contains("LONG: No bullish polar formation");
        assertThat(result.signals()).extracting(Signal::symbol).containsExactly("AAPL");
        verify(signalLogService).logAnalysis(longSignal(aapl));
    }

    @Test
    void scan_marksSlowSymbolAsTimedOut() {
        List<PriceBar> aapl = bars("AAPL", 60);
        when(marketDataRepository.findRecentBars("AAPL", Timeframe.M1, 400)).thenReturn(aapl);
        when(marketDataRepository.findRecentBars("AAPL", Timeframe.M15, 400)).thenReturn(List.of());
        when(signalEngine.generateSignals(eq(aapl), anyList(), eq(SETTINGS))).thenAnswer(invocation -> {
            Thread.sleep(5_000L);
            return longSignal(aapl);
        });

        ScanResult result = service(Duration.ofMillis(100)).scan(List.of("AAPL"), SETTINGS);

        assertThat(result.reports().get(0).status()).isEqualTo(ScanStatus.TIMED_OUT);
        assertThat(result.signalsFound()).isZero();
    }

    @Test
    void scan_rejectsBlankSymbolList() {
        assertThatThrownBy(() -> service(Duration.ofSeconds(1)).scan(List.of(" ", ""), SETTINGS))
                .isInstanceOfSatisfying(ScannerApiException.class, exception -> {
                    assertThat(exception.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(exception.getCode()).isEqualTo("invalid_symbols");
                });
        verify(signalLogService, never()).logAnalysis(any());
    }

    private ScannerService service(Duration timeout) {
        return new ScannerService(
                marketDataRepository,
                signalEngine,
                signalLogService,
                new ScanRequestValidationService(),
                new ScannerProperties(2, timeout, "data", "1m", 400, new ScannerProperties.Simulation(1, 0.0)),
                SETTINGS,
                executor
        );
    }

    private SignalAnalysis longSignal(List<PriceBar> bars) {
        PriceBar last = bars.get(bars.size() - 1);
        Signal signal = new Signal(
                last.symbol(),
                SignalDirection.LONG,
                last.timestamp(),
                last.close(),
                new IndicatorSnapshot(100, 100, 100, 100, 100, 1, 98, 102),
                1.0
        );
        return new SignalAnalysis(last.symbol(), last.timestamp(), List.of(signal), List.of(), null);
    }

    private SignalAnalysis noSignal(List<PriceBar> bars) {
        PriceBar last = bars.get(bars.size() - 1);
        return new SignalAnalysis(
                last.symbol(),
                last.timestamp(),
                List.of(),
                List.of(evaluation(SignalDirection.LONG), evaluation(SignalDirection.SHORT)),
                null
        );
    }

    private DirectionEvaluation evaluation(SignalDirection direction) {
        Map<SignalCondition, Boolean> outcomes = new EnumMap<>(SignalCondition.class);
        outcomes.put(SignalCondition.POLAR_FORMATION, false);
        outcomes.put(SignalCondition.EMA_POSITIONING, true);
        outcomes.put(SignalCondition.EMA_MOMENTUM, true);
        outcomes.put(SignalCondition.FOMO_FILTER, true);
        outcomes.put(SignalCondition.VOLATILITY_FILTER, true);
        return new DirectionEvaluation(direction, outcomes);
    }

    private List<PriceBar> bars(String symbol, int count) {
        List<PriceBar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bars.add(new PriceBar(symbol, START.plus(Duration.ofMinutes(i)), 100, 101, 99, 100, 500L));
        }
        return bars;
    }
}
