package org.nowstart.scanner.service;

import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scanner.service.strategy.core.DirectionEvaluation;
import org.nowstart.scanner.service.strategy.core.SignalAnalysis;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SignalLogService {

    public void logAnalysis(SignalAnalysis analysis) {
        if (analysis.skipped()) {
            log.info(
                    "event=signal_skipped symbol={} ts={} reason=\"{}\"",
                    analysis.symbol(),
                    analysis.timestamp(),
                    escape(analysis.skipReason())
            );
            return;
        }

        for (DirectionEvaluation evaluation : analysis.evaluations()) {
            log.info(
                    "event=signal_evaluation symbol={} ts={} direction={} met={} total={} confidence={} valid={} satisfied={} rejected={}",
                    analysis.symbol(),
                    analysis.timestamp(),
                    evaluation.direction(),
                    evaluation.conditionsMet(),
                    evaluation.totalConditions(),
                    sanitizeMetricForLog(evaluation.confidence()),
                    evaluation.valid(),
                    formatLabels(evaluation.satisfiedLabels()),
                    formatLabels(evaluation.rejectionReasons())
            );
        }
    }

    private String formatLabels(List<String> labels) {
        return labels.stream()
                .map(label -> "\"" + escape(label) + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return value == -0.0 ? 0.0 : value;
    }
}
