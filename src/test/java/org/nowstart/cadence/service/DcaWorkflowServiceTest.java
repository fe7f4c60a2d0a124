package org.nowstart.cadence.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.cadence.data.dto.Decision;
import org.nowstart.cadence.data.dto.OrderResult;
import org.nowstart.cadence.data.dto.ScheduledBuy;
import org.nowstart.cadence.data.dto.WorkflowRun;
import org.nowstart.cadence.data.property.OrchestratorProperties;
import org.nowstart.cadence.data.property.TestProperties;
import org.nowstart.cadence.data.type.OrderSide;
import org.nowstart.cadence.data.type.TradeAction;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.signal.SignalAggregator;

@ExtendWith(MockitoExtension.class)
class DcaWorkflowServiceTest {

    private static final LocalDate PAY_DATE = LocalDate.of(2026, 3, 15);

    @Mock
    private SignalAggregator signalAggregator;
    @Mock
    private RiskBoundedExecutionService riskBoundedExecutionService;
    @Mock
    private PayDateScheduleService payDateScheduleService;
    @Mock
    private TradeLogService tradeLogService;

    private CollaboratorResult<BigDecimal> usdCadRate = CollaboratorResult.failure("offline");

    @Test
    void runOnce_skipsOffPayDateWithoutDeciding() {
        LocalDate offDay = LocalDate.of(2026, 3, 16);
        when(payDateScheduleService.today()).thenReturn(offDay);
        when(payDateScheduleService.nextPayDate(offDay)).thenReturn(LocalDate.of(2026, 3, 31));

        WorkflowRun run = service(TestProperties.orchestrator()).runOnce();

        assertThat(run.payDate()).isFalse();
        assertThat(run.note()).isEqualTo(DcaWorkflowService.NOTE_NOT_PAY_DATE);
        assertThat(run.decision()).isNull();
        verify(payDateScheduleService).ensureDueEntries();
        verify(payDateScheduleService).markMissedEntries(offDay);
        verifyNoInteractions(signalAggregator, riskBoundedExecutionService, tradeLogService);
    }

    @Test
    void runOnce_executesSizedOrderAndConfirmsScheduleOnPayDate() {
        Decision decision = decision(TradeAction.STRONG_BUY, 3.0);
        OrderResult result = simulated(new BigDecimal("300.00"));
        when(payDateScheduleService.today()).thenReturn(PAY_DATE);
        when(payDateScheduleService.entryFor(PAY_DATE)).thenReturn(Optional.empty());
        when(signalAggregator.decide()).thenReturn(decision);
        when(riskBoundedExecutionService.execute(new BigDecimal("300.00"))).thenReturn(result);
        when(riskBoundedExecutionService.dailySpend()).thenReturn(new BigDecimal("300.00"));

        WorkflowRun run = service(TestProperties.orchestrator()).runOnce();

        assertThat(run.payDate()).isTrue();
        assertThat(run.orderSizeUsd()).isEqualByComparingTo("300.00");
        assertThat(run.result()).isEqualTo(result);
        verify(tradeLogService).append(decision, result);
        verify(payDateScheduleService).confirmScheduledBuy(PAY_DATE, result, decision);
    }

    @Test
    void runOnce_logsBlockedAttemptButDoesNotConfirm() {
        Decision decision = decision(TradeAction.NORMAL, 1.0);
        OrderResult blocked = OrderResult.blocked(true, "XBTUSD", OrderSide.BUY, new BigDecimal("100.00"), 1, "Kill switch");
        when(payDateScheduleService.today()).thenReturn(PAY_DATE);
        when(payDateScheduleService.entryFor(PAY_DATE)).thenReturn(Optional.empty());
        when(signalAggregator.decide()).thenReturn(decision);
        when(riskBoundedExecutionService.execute(any())).thenReturn(blocked);

        WorkflowRun run = service(TestProperties.orchestrator()).runOnce();

        assertThat(run.note()).isEqualTo("Kill switch");
        verify(tradeLogService).append(decision, blocked);
        verify(payDateScheduleService, never()).confirmScheduledBuy(any(), any(), any());
    }

    @Test
    void runOnce_skipsWhenTodayAlreadyConfirmed() {
        ScheduledBuy confirmed = ScheduledBuy.confirmedDirectly(
                PAY_DATE, "09:00 PT", Instant.parse("2026-03-15T16:05:00Z"), simulated(new BigDecimal("100.00")), decision(TradeAction.NORMAL, 1.0));
        when(payDateScheduleService.today()).thenReturn(PAY_DATE);
        when(payDateScheduleService.entryFor(PAY_DATE)).thenReturn(Optional.of(confirmed));

        WorkflowRun run = service(TestProperties.orchestrator()).runOnce();

        assertThat(run.note()).isEqualTo(DcaWorkflowService.NOTE_ALREADY_CONFIRMED);
        verifyNoInteractions(signalAggregator, riskBoundedExecutionService);
    }

    @Test
    void runOnce_runsOffPayDateWhenRestrictionDisabled() {
        LocalDate offDay = LocalDate.of(2026, 3, 16);
        OrchestratorProperties anyDay = TestProperties.orchestrator(Map.of(), List.of(), false);
        Decision decision = decision(TradeAction.REDUCE, 0.5);
        when(payDateScheduleService.today()).thenReturn(offDay);
        when(payDateScheduleService.entryFor(offDay)).thenReturn(Optional.empty());
        when(signalAggregator.decide()).thenReturn(decision);
        when(riskBoundedExecutionService.execute(new BigDecimal("50.00"))).thenReturn(simulated(new BigDecimal("50.00")));

        WorkflowRun run = service(anyDay).runOnce();

        assertThat(run.payDate()).isFalse();
        assertThat(run.orderSizeUsd()).isEqualByComparingTo("50.00");
    }

    @Test
    void runOnce_keepsGoingWhenScheduleHousekeepingFails() {
        Decision decision = decision(TradeAction.BUY, 1.5);
        OrderResult result = simulated(new BigDecimal("150.00"));
        when(payDateScheduleService.today()).thenReturn(PAY_DATE);
        when(payDateScheduleService.ensureDueEntries()).thenThrow(new IllegalStateException("disk full"));
        when(payDateScheduleService.entryFor(PAY_DATE)).thenReturn(Optional.empty());
        when(signalAggregator.decide()).thenReturn(decision);
        when(riskBoundedExecutionService.execute(new BigDecimal("150.00"))).thenReturn(result);
        doThrow(new IllegalStateException("disk full")).when(tradeLogService).append(decision, result);

        WorkflowRun run = service(TestProperties.orchestrator()).runOnce();

        assertThat(run.result()).isEqualTo(result);
        verify(payDateScheduleService).confirmScheduledBuy(PAY_DATE, result, decision);
    }

    @Test
    void runOnce_reportsDecisionFailure() {
        when(payDateScheduleService.today()).thenReturn(PAY_DATE);
        when(payDateScheduleService.entryFor(PAY_DATE)).thenReturn(Optional.empty());
        when(signalAggregator.decide()).thenThrow(new IllegalStateException("no sources"));

        WorkflowRun run = service(TestProperties.orchestrator()).runOnce();

        assertThat(run.note()).isEqualTo(DcaWorkflowService.NOTE_DECISION_FAILED);
        verifyNoInteractions(riskBoundedExecutionService);
    }

    @Test
    void orderSize_scalesBaseByMultiplier() {
        DcaWorkflowService service = service(TestProperties.orchestrator());

        assertThat(service.orderSize(decision(TradeAction.MINIMAL, 0.2))).isEqualByComparingTo("20.00");
        assertThat(service.orderSize(decision(TradeAction.BUY, 1.5))).isEqualByComparingTo("150.00");
    }

    @Test
    void orderSize_convertsCadBaseAtLiveRate() {
        usdCadRate = CollaboratorResult.success(new BigDecimal("1.25"));
        DcaWorkflowService service = service(TestProperties.orchestratorInCad("272"));

        assertThat(service.orderSize(decision(TradeAction.NORMAL, 1.0))).isEqualByComparingTo("217.60");
    }

    @Test
    void orderSize_usesFallbackRateWhenLookupFails() {
        DcaWorkflowService service = service(TestProperties.orchestratorInCad("272"));

        assertThat(service.orderSize(decision(TradeAction.NORMAL, 1.0))).isEqualByComparingTo("200.00");
        assertThat(service.orderSize(decision(TradeAction.STRONG_BUY, 3.0))).isEqualByComparingTo("600.00");
    }

    private DcaWorkflowService service(OrchestratorProperties properties) {
        return new DcaWorkflowService(
                signalAggregator,
                riskBoundedExecutionService,
                payDateScheduleService,
                tradeLogService,
                properties,
                new BaseDcaAmountService(properties, currency -> usdCadRate)
        );
    }

    private static Decision decision(TradeAction action, double multiplier) {
        return new Decision(action, multiplier, 0.0, List.of(), "", Instant.parse("2026-03-15T16:05:00Z"));
    }

    private static OrderResult simulated(BigDecimal usd) {
        return new OrderResult(
                false,
                true,
                "XBTUSD",
                OrderSide.BUY,
                usd,
                new BigDecimal("0.00100000"),
                new BigDecimal("60000.00"),
                null,
                1,
                RiskBoundedExecutionService.REASON_DRY_RUN
        );
    }
}
