package org.nowstart.scanner.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.scanner.data.dto.AlgorithmSettingsRequest;
import org.nowstart.scanner.data.dto.BacktestRequest;
import org.nowstart.scanner.data.dto.BacktestResult;
import org.nowstart.scanner.data.dto.ScanRequest;
import org.nowstart.scanner.data.dto.ScanResult;
import org.nowstart.scanner.data.property.ScannerProperties;
import org.nowstart.scanner.service.BacktestService;
import org.nowstart.scanner.service.ScannerService;
import org.nowstart.scanner.service.backtest.model.SimulationConfig;
import org.nowstart.scanner.service.strategy.core.AlgorithmSettings;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Scanner", description = "EMA/ATR 신호 스캔 및 백테스트 API")
public class ScannerController {

    private final ScannerService scannerService;
    private final BacktestService backtestService;
    private final AlgorithmSettings defaultAlgorithmSettings;
    private final ScannerProperties scannerProperties;

    public ScannerController(
            ScannerService scannerService,
            BacktestService backtestService,
            AlgorithmSettings defaultAlgorithmSettings,
            ScannerProperties scannerProperties
    ) {
        this.scannerService = scannerService;
        this.backtestService = backtestService;
        this.defaultAlgorithmSettings = defaultAlgorithmSettings;
        this.scannerProperties = scannerProperties;
    }

    @PostMapping("/scan")
    @Operation(summary = "신호 스캔", description = "심볼별 최신 봉에 대해 롱/숏 신호를 평가합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "스캔 완료"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public ScanResult scan(@Valid @RequestBody ScanRequest request) {
        return scannerService.scan(request.symbols(), resolveSettings(request.settings()));
    }

    @PostMapping("/backtest")
    @Operation(summary = "백테스트 실행", description = "기간 내 일봉으로 신호를 재생해 거래 내역과 성과 지표를 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "백테스트 완료"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public BacktestResult backtest(@Valid @RequestBody BacktestRequest request) {
        SimulationConfig defaults = scannerProperties.simulation().toConfig();
        SimulationConfig simulationConfig = request.simulation() == null
                ? defaults
                : request.simulation().mergeOnto(defaults);
        return backtestService.runBacktest(
                request.symbols(),
                request.startDate(),
                request.endDate(),
                resolveSettings(request.settings()),
                simulationConfig
        );
    }

    private AlgorithmSettings resolveSettings(AlgorithmSettingsRequest override) {
        return override == null ? defaultAlgorithmSettings : override.mergeOnto(defaultAlgorithmSettings);
    }
}
