package org.nowstart.scanner.data.dto;

import java.util.List;
import org.nowstart.scanner.data.type.ScanStatus;
import org.nowstart.scanner.service.strategy.core.Signal;

/**
 * @param detail skip reason, error message, or rejection summary; null when signals were found
 */
public record SymbolScanReport(
        String symbol,
        ScanStatus status,
        List<Signal> signals,
        String detail
) {

    public SymbolScanReport {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static SymbolScanReport of(String symbol, ScanStatus status, String detail) {
        return new SymbolScanReport(symbol, status, List.of(), detail);
    }
}
