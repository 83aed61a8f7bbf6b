package org.nowstart.scanner.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;

/**
 * Partial settings override. Null fields keep the configured default.
 */
public record AlgorithmSettingsRequest(
        @DecimalMin("0.5") @DecimalMax("10.0") Double atrMultiplier,
        @DecimalMin("0.001") @DecimalMax("0.1") Double ema5RisingThreshold,
        @DecimalMin("0.001") @DecimalMax("0.1") Double ema8RisingThreshold,
        @DecimalMin("0.001") @DecimalMax("0.1") Double ema21RisingThreshold,
        @DecimalMin("0.1") @DecimalMax("5.0") Double volatilityFilter,
        @DecimalMin("0.1") @DecimalMax("3.0") Double fomoFilter,
        String higherTimeframe
) {

    public AlgorithmSettings mergeOnto(AlgorithmSettings defaults) {
        return new AlgorithmSettings(
                atrMultiplier != null ? atrMultiplier : defaults.atrMultiplier(),
                ema5RisingThreshold != null ? ema5RisingThreshold : defaults.ema5RisingThreshold(),
                ema8RisingThreshold != null ? ema8RisingThreshold : defaults.ema8RisingThreshold(),
                ema21RisingThreshold != null ? ema21RisingThreshold : defaults.ema21RisingThreshold(),
                volatilityFilter != null ? volatilityFilter : defaults.volatilityFilter(),
                fomoFilter != null ? fomoFilter : defaults.fomoFilter(),
                higherTimeframe != null && !higherTimeframe.isBlank() ? higherTimeframe : defaults.higherTimeframe()
        );
    }
}
