package org.nowstart.scanner.service.strategy.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.nowstart.scanner.data.type.SignalDirection;

/**
 * Result of one signal generation pass: the tradable signals plus the per-direction evaluations
 * that produced them.
 *
 * @param skipReason why no evaluation happened (for example too little history), or null
 */
public record SignalAnalysis(
        String symbol,
        Instant timestamp,
        List<Signal> signals,
        List<DirectionEvaluation> evaluations,
        String skipReason
) {

    public SignalAnalysis {
        signals = signals == null ? List.of() : List.copyOf(signals);
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
    }

    public static SignalAnalysis skipped(String symbol, Instant timestamp, String reason) {
        return new SignalAnalysis(symbol, timestamp, List.of(), List.of(), reason);
    }

    public boolean skipped() {
        return skipReason != null;
    }

    public boolean hasSignals() {
        return !signals.isEmpty();
    }

    public Optional<Signal> signal(SignalDirection direction) {
        return signals.stream().filter(signal -> signal.direction() == direction).findFirst();
    }

    public Optional<DirectionEvaluation> evaluation(SignalDirection direction) {
        return evaluations.stream().filter(evaluation -> evaluation.direction() == direction).findFirst();
    }
}
