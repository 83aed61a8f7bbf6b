package org.nowstart.scanner.data.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.nowstart.scanner.service.backtest.model.SimulationConfig;

public record SimulationRequest(
        @Min(0) Integer entryDelayMinutes,
        @Positive Double stopLossPercent,
        @Positive Double takeProfitPercent,
        @Positive Integer maxHoldDays,
        @DecimalMin("0") Double commissionPerTrade
) {

    public SimulationConfig mergeOnto(SimulationConfig defaults) {
        return new SimulationConfig(
                entryDelayMinutes != null ? entryDelayMinutes : defaults.entryDelayMinutes(),
                stopLossPercent != null ? stopLossPercent : defaults.stopLossPercent(),
                takeProfitPercent != null ? takeProfitPercent : defaults.takeProfitPercent(),
                maxHoldDays != null ? maxHoldDays : defaults.maxHoldDays(),
                commissionPerTrade != null ? commissionPerTrade : defaults.commissionPerTrade()
        );
    }
}
