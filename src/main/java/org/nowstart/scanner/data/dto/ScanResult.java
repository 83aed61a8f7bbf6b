package org.nowstart.scanner.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.nowstart.scanner.service.strategy.core.Signal;

public record ScanResult(
        String id,
        Instant timestamp,
        int symbolsScanned,
        int signalsFound,
        List<SymbolScanReport> reports,
        AlgorithmSettings settingsUsed,
        long executionTimeMs
) {

    public List<Signal> signals() {
        return reports.stream().flatMap(report -> report.signals().stream()).toList();
    }
}
