package org.nowstart.scanner.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.nowstart.scanner.data.type.Timeframe;
import org.nowstart.scanner.service.backtest.model.SimulationConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scanner")
public record ScannerProperties(
        // 심볼별 작업을 실행하는 워커 풀 크기
        @Min(1) @Max(64) @DefaultValue("5") int workerPoolSize,
        // 심볼 하나에 허용되는 최대 처리 시간
        @NotNull @DefaultValue("30s") Duration symbolTimeout,
        // CSV 시세 파일 디렉터리
        @NotBlank @DefaultValue("data/market") String dataDir,
        // 스캔 기준 봉 간격
        @NotBlank @DefaultValue("1m") String scanBaseTimeframe,
        // 스캔 시 불러오는 최근 봉 개수
        @Min(51) @DefaultValue("400") int scanLookbackBars,
        // 백테스트 기본 체결 규칙
        @NotNull @DefaultValue Simulation simulation
) {

    public Timeframe baseTimeframe() {
        return Timeframe.fromCode(scanBaseTimeframe);
    }

    public record Simulation(
            // 신호 발생 후 진입까지 지연(분)
            @Min(0) @DefaultValue("1") int entryDelayMinutes,
            // 거래당 수수료(가격 단위)
            @DecimalMin("0") @DefaultValue("0.0") double commissionPerTrade
    ) {

        public SimulationConfig toConfig() {
            return new SimulationConfig(entryDelayMinutes, null, null, null, commissionPerTrade);
        }
    }
}
