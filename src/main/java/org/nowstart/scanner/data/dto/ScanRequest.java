package org.nowstart.scanner.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record ScanRequest(
        @NotEmpty(message = "symbols must not be empty") List<String> symbols,
        @Valid AlgorithmSettingsRequest settings
) {
}
