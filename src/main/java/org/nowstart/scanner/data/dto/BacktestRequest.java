package org.nowstart.scanner.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

public record BacktestRequest(
        @NotEmpty(message = "symbols must not be empty") List<String> symbols,
        @NotNull(message = "startDate is required") LocalDate startDate,
        @NotNull(message = "endDate is required") LocalDate endDate,
        @Valid AlgorithmSettingsRequest settings,
        @Valid SimulationRequest simulation
) {
}
