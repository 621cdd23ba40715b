package org.nowstart.beacon.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.beacon.data.dto.ConfirmationRequest;
import org.nowstart.beacon.data.dto.ConfirmationResult;
import org.nowstart.beacon.data.dto.SignalBatchResult;
import org.nowstart.beacon.data.dto.SignalStateDto;
import org.nowstart.beacon.data.exception.SignalApiException;
import org.nowstart.beacon.data.type.EvaluationMode;
import org.nowstart.beacon.service.SignalBatchService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/signals")
@Tag(name = "Signals", description = "장중 미리보기, 마감 확정 평가, 확정 요청 API")
public class SignalController {

    private final SignalBatchService signalBatchService;

    public SignalController(SignalBatchService signalBatchService) {
        this.signalBatchService = signalBatchService;
    }

    @GetMapping
    @Operation(
            summary = "감시 목록 일괄 평가",
            description = "mode=intrabar 는 PREVIEW 신호를, mode=close 는 확정 요청된 신호의 CONFIRMED/INVALIDATED 결과를 반환합니다."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "평가 완료 (심볼별 오류는 errors 에 포함)"),
            @ApiResponse(responseCode = "400", description = "잘못된 mode 또는 minConfidence"),
            @ApiResponse(responseCode = "502", description = "시장 데이터 조회 실패")
    })
    public SignalBatchResult evaluate(
            @RequestParam(value = "mode", required = false) String mode,
            @RequestParam(value = "minConfidence", required = false) Integer minConfidence
    ) {
        if (minConfidence != null && (minConfidence < 0 || minConfidence > 100)) {
            throw new SignalApiException(HttpStatus.BAD_REQUEST, "validation_error", "minConfidence must be between 0 and 100");
        }
        return signalBatchService.evaluate(resolveMode(mode), minConfidence);
    }

    @PostMapping("/confirm")
    @Operation(summary = "마감 확정 요청", description = "PREVIEW 가 있는 심볼을 다음 마감 평가에서 확정하도록 표시합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "요청 처리 (대기 중인 PREVIEW 가 없으면 ok=false)"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패 또는 감시 목록에 없는 심볼")
    })
    public ConfirmationResult requestConfirmation(@RequestBody @Valid ConfirmationRequest request) {
        return signalBatchService.requestConfirmation(request.symbol());
    }

    @GetMapping("/{symbol}/state")
    @Operation(summary = "심볼 상태 조회", description = "쿨다운 종료 시각, 대기 중인 확정 요청, 최근 신호를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "감시 목록에 없는 심볼")
    })
    public SignalStateDto getState(@PathVariable String symbol) {
        return signalBatchService.state(symbol);
    }

    private EvaluationMode resolveMode(String mode) {
        try {
            return EvaluationMode.from(mode);
        } catch (IllegalArgumentException e) {
            throw new SignalApiException(HttpStatus.BAD_REQUEST, "invalid_mode", "mode must be intrabar or close: " + mode);
        }
    }
}
