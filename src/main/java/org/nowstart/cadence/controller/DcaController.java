package org.nowstart.cadence.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.nowstart.cadence.data.dto.BalanceDto;
import org.nowstart.cadence.data.dto.DailySpendDto;
import org.nowstart.cadence.data.dto.Decision;
import org.nowstart.cadence.data.dto.NextPayDateDto;
import org.nowstart.cadence.data.dto.ScheduledBuy;
import org.nowstart.cadence.data.dto.TradeRecord;
import org.nowstart.cadence.data.dto.WorkflowRun;
import org.nowstart.cadence.data.exception.TradingApiException;
import org.nowstart.cadence.service.DcaWorkflowService;
import org.nowstart.cadence.service.PayDateScheduleService;
import org.nowstart.cadence.service.RiskBoundedExecutionService;
import org.nowstart.cadence.service.TradeLogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "/api/dca", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "DCA", description = "매수 결정 미리보기, 워크플로 실행, 지급일 일정/거래 기록/일일 지출/잔고 조회 API")
public class DcaController {

    private final DcaWorkflowService dcaWorkflowService;
    private final PayDateScheduleService payDateScheduleService;
    private final TradeLogService tradeLogService;
    private final RiskBoundedExecutionService riskBoundedExecutionService;

    public DcaController(
            DcaWorkflowService dcaWorkflowService,
            PayDateScheduleService payDateScheduleService,
            TradeLogService tradeLogService,
            RiskBoundedExecutionService riskBoundedExecutionService
    ) {
        this.dcaWorkflowService = dcaWorkflowService;
        this.payDateScheduleService = payDateScheduleService;
        this.tradeLogService = tradeLogService;
        this.riskBoundedExecutionService = riskBoundedExecutionService;
    }

    @GetMapping("/decision")
    @Operation(summary = "매수 결정 미리보기", description = "모든 신호 소스를 수집해 주문 없이 매수 등급과 배수를 계산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "계산 성공")
    })
    public Decision previewDecision() {
        return dcaWorkflowService.preview();
    }

    @PostMapping("/run")
    @Operation(summary = "워크플로 실행", description = "일정 갱신, 결정, 리스크 제한 주문, 기록까지 한 번 실행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "실행 완료(차단/건너뜀 포함)")
    })
    public WorkflowRun run() {
        return dcaWorkflowService.runOnce();
    }

    @GetMapping("/schedule")
    @Operation(summary = "지급일 일정 조회", description = "예정/확정/누락 상태의 지급일 매수 일정을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<ScheduledBuy> getSchedule() {
        return payDateScheduleService.entries();
    }

    @GetMapping("/schedule/next")
    @Operation(summary = "다음 지급일 조회", description = "오늘 이후(오늘 포함) 가장 가까운 지급일을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public NextPayDateDto getNextPayDate() {
        LocalDate today = payDateScheduleService.today();
        LocalDate next = payDateScheduleService.nextPayDate(today);
        return new NextPayDateDto(today, next, ChronoUnit.DAYS.between(today, next));
    }

    @GetMapping("/trades")
    @Operation(summary = "거래 기록 조회", description = "실행/모의/차단된 모든 결정의 기록을 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공")
    })
    public List<TradeRecord> getTrades() {
        return tradeLogService.history();
    }

    @GetMapping("/ledger")
    @Operation(summary = "일일 지출 조회", description = "지정 일자(기본 오늘)의 누적 지출과 남은 한도를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "날짜 형식 오류")
    })
    public DailySpendDto getLedger(@RequestParam(value = "date", required = false) String date) {
        return riskBoundedExecutionService.spendSummary(parseDate(date));
    }

    @GetMapping("/balance")
    @Operation(summary = "거래소 잔고 조회", description = "주문에 묶이지 않은 BTC/USD 잔고를 조회합니다. 조회 실패 시 빈 목록을 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공(실패 시 빈 목록)")
    })
    public List<BalanceDto> getBalance() {
        return riskBoundedExecutionService.balances();
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new TradingApiException(HttpStatus.BAD_REQUEST, "invalid_date", "date must be ISO-8601 (yyyy-MM-dd): " + value);
        }
    }
}
