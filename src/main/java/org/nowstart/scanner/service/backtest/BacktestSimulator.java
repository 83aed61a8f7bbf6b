package org.nowstart.scanner.service.backtest;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scanner.data.type.ExitReason;
import org.nowstart.scanner.service.backtest.model.Position;
import org.nowstart.scanner.service.backtest.model.PositionState;
import org.nowstart.scanner.service.backtest.model.SimulationConfig;
import org.nowstart.scanner.service.backtest.model.SymbolBacktest;
import org.nowstart.scanner.service.backtest.model.Trade;
import org.nowstart.scanner.service.strategy.SignalEngine;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.nowstart.scanner.service.strategy.core.PriceBar;
import org.nowstart.scanner.service.strategy.core.Signal;
import org.nowstart.scanner.service.strategy.core.SignalAnalysis;
import org.springframework.stereotype.Component;

/**
 * Replays the signal engine bar by bar over one symbol and keeps a flat/in-position state machine.
 *
 * <p>Each call owns its own state, so one instance can simulate many symbols concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestSimulator {

    public static final double MIN_ENTRY_CONFIDENCE = 0.5;

    private final SignalEngine signalEngine;

    /**
     * @param bars    base-timeframe bars of one symbol, oldest first
     * @param htfBars higher-timeframe bars of the same symbol, oldest first; may be empty
     */
    public SymbolBacktest simulate(
            String symbol,
            List<PriceBar> bars,
            List<PriceBar> htfBars,
            AlgorithmSettings settings,
            SimulationConfig config
    ) {
        if (bars == null || bars.size() <= SignalEngine.MIN_HISTORY_BARS) {
            log.info("event=backtest_symbol_skipped symbol={} bars={}", symbol, bars == null ? 0 : bars.size());
            return new SymbolBacktest(symbol, List.of(), 0, 0);
        }
        SimulationConfig resolvedConfig = config == null ? SimulationConfig.defaults() : config;
        NavigableMap<LocalDate, List<PriceBar>> htfByDate = groupByUtcDate(htfBars);

        List<Trade> trades = new ArrayList<>();
        PositionState state = PositionState.flat();
        int processed = 0;
        int failed = 0;

        for (int i = SignalEngine.MIN_HISTORY_BARS; i < bars.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("event=backtest_symbol_interrupted symbol={} bars_processed={} trades={}", symbol, processed, trades.size());
                return new SymbolBacktest(symbol, trades, processed, failed);
            }
            PriceBar bar = bars.get(i);
            try {
                state = step(state, bar, bars.subList(0, i), htfByDate, settings, resolvedConfig, trades);
                processed++;
            } catch (RuntimeException e) {
                failed++;
                log.error("event=backtest_bar_failed symbol={} ts={}", symbol, bar.timestamp(), e);
            }
        }

        if (state instanceof PositionState.InPosition holding) {
            PriceBar last = bars.get(bars.size() - 1);
            trades.add(closeTrade(holding.position(), last, resolvedConfig, ExitReason.END_OF_PERIOD));
        }

        log.info(
                "event=backtest_symbol_done symbol={} bars_processed={} bars_failed={} trades={}",
                symbol,
                processed,
                failed,
                trades.size()
        );
        return new SymbolBacktest(symbol, trades, processed, failed);
    }

    private PositionState step(
            PositionState state,
            PriceBar bar,
            List<PriceBar> history,
            NavigableMap<LocalDate, List<PriceBar>> htfByDate,
            AlgorithmSettings settings,
            SimulationConfig config,
            List<Trade> trades
    ) {
        LocalDate date = utcDate(bar);
        List<PriceBar> sameDay = htfByDate.getOrDefault(date, List.of());
        PriceBar htfBar = sameDay.isEmpty() ? null : sameDay.get(sameDay.size() - 1);
        List<PriceBar> htfHistory = flatten(htfByDate.headMap(date, false));

        SignalAnalysis analysis = signalEngine.generateSignals(bar, history, htfBar, htfHistory, settings);

        PositionState next = state;
        if (state instanceof PositionState.InPosition holding) {
            Optional<ExitReason> exit = exitReason(holding.position(), bar, analysis, config);
            if (exit.isPresent()) {
                trades.add(closeTrade(holding.position(), bar, config, exit.get()));
                next = PositionState.flat();
            }
        }

        if (next.isFlat()) {
            Optional<Signal> entry = analysis.signals().stream()
                    .filter(signal -> signal.confidence() >= MIN_ENTRY_CONFIDENCE)
                    .findFirst();
            if (entry.isPresent()) {
                Signal signal = entry.get();
                Position position = new Position(
                        bar.symbol(),
                        signal.direction(),
                        bar.timestamp().plus(Duration.ofMinutes(config.entryDelayMinutes())),
                        bar.close()
                );
                log.debug("event=position_opened symbol={} direction={} ts={} price={}",
                        bar.symbol(), signal.direction(), position.entryTimestamp(), position.entryPrice());
                next = PositionState.holding(position);
            }
        }
        return next;
    }

    private Optional<ExitReason> exitReason(Position position, PriceBar bar, SignalAnalysis analysis, SimulationConfig config) {
        if (analysis.signal(position.direction().opposite()).isPresent()) {
            return Optional.of(ExitReason.OPPOSITE_SIGNAL);
        }
        double currentReturn = position.returnAt(bar.close());
        if (config.hasStopLoss() && -currentReturn >= config.stopLossPercent()) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (config.hasTakeProfit() && currentReturn >= config.takeProfitPercent()) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        if (config.hasMaxHold()
                && Duration.between(position.entryTimestamp(), bar.timestamp()).toDays() >= config.maxHoldDays()) {
            return Optional.of(ExitReason.TIMEOUT);
        }
        return Optional.empty();
    }

    private Trade closeTrade(Position position, PriceBar bar, SimulationConfig config, ExitReason reason) {
        Trade trade = Trade.close(position, bar.timestamp(), bar.close(), config.commissionPerTrade(), reason);
        log.debug("event=position_closed symbol={} direction={} reason={} pnl={}",
                trade.symbol(), trade.direction(), reason, trade.pnl());
        return trade;
    }

    private NavigableMap<LocalDate, List<PriceBar>> groupByUtcDate(List<PriceBar> htfBars) {
        NavigableMap<LocalDate, List<PriceBar>> byDate = new TreeMap<>();
        if (htfBars == null) {
            return byDate;
        }
        for (PriceBar htfBar : htfBars) {
            byDate.computeIfAbsent(utcDate(htfBar), ignored -> new ArrayList<>()).add(htfBar);
        }
        return byDate;
    }

    private List<PriceBar> flatten(Map<LocalDate, List<PriceBar>> byDate) {
        List<PriceBar> out = new ArrayList<>();
        byDate.values().forEach(out::addAll);
        return out;
    }

    private LocalDate utcDate(PriceBar bar) {
        return bar.timestamp().atZone(ZoneOffset.UTC).toLocalDate();
    }
}
