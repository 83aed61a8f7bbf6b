package org.nowstart.scanner.service.strategy.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.scanner.data.type.SignalDirection;

/**
 * Outcome of every rule for one direction on one bar.
 *
 * <p>The outcome map always holds the five base conditions, plus {@link SignalCondition#HTF_CONFIRMATION}
 * when higher-timeframe data took part. A signal is valid only when every evaluated condition holds;
 * confidence is reported regardless.
 *
 * @param direction evaluated direction
 * @param outcomes  pass/fail per evaluated condition, in {@link SignalCondition} order
 */
public record DirectionEvaluation(
        SignalDirection direction,
        Map<SignalCondition, Boolean> outcomes
) {

    public DirectionEvaluation {
        if (direction == null) {
            throw new IllegalArgumentException("direction is required");
        }
        if (outcomes == null || outcomes.isEmpty()) {
            throw new IllegalArgumentException("outcomes are required");
        }
        EnumMap<SignalCondition, Boolean> copy = new EnumMap<>(outcomes);
        for (SignalCondition condition : SignalCondition.values()) {
            if (condition != SignalCondition.HTF_CONFIRMATION && !copy.containsKey(condition)) {
                throw new IllegalArgumentException("missing outcome for " + condition);
            }
        }
        outcomes = Collections.unmodifiableMap(copy);
    }

    public int conditionsMet() {
        return (int) outcomes.values().stream().filter(Boolean::booleanValue).count();
    }

    public int totalConditions() {
        return outcomes.size();
    }

    public boolean htfAvailable() {
        return outcomes.containsKey(SignalCondition.HTF_CONFIRMATION);
    }

    public double confidence() {
        return conditionsMet() / (double) totalConditions();
    }

    public boolean valid() {
        return conditionsMet() == totalConditions();
    }

    public boolean passed(SignalCondition condition) {
        return Boolean.TRUE.equals(outcomes.get(condition));
    }

    public List<SignalCondition> satisfiedConditions() {
        return outcomes.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .toList();
    }

    public List<SignalCondition> failedConditions() {
        return outcomes.entrySet().stream()
                .filter(entry -> !entry.getValue())
                .map(Map.Entry::getKey)
                .toList();
    }

    public List<String> satisfiedLabels() {
        return satisfiedConditions().stream()
                .map(condition -> condition.passedLabel(direction))
                .toList();
    }

    public List<String> rejectionReasons() {
        List<String> reasons = new ArrayList<>();
        for (SignalCondition condition : failedConditions()) {
            reasons.add(condition.failedReason(direction));
        }
        if (!htfAvailable()) {
            reasons.add(SignalCondition.NO_HTF_DATA_REASON);
        }
        return List.copyOf(reasons);
    }
}
