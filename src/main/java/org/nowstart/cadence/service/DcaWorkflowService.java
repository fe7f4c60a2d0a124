package org.nowstart.cadence.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.Decision;
import org.nowstart.cadence.data.dto.OrderResult;
import org.nowstart.cadence.data.dto.ScheduledBuy;
import org.nowstart.cadence.data.dto.WorkflowRun;
import org.nowstart.cadence.data.property.OrchestratorProperties;
import org.nowstart.cadence.data.type.ScheduleStatus;
import org.nowstart.cadence.signal.SignalAggregator;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class DcaWorkflowService {

    public static final String NOTE_NOT_PAY_DATE = "Not a pay date";
    public static final String NOTE_ALREADY_CONFIRMED = "Scheduled buy already confirmed";
    public static final String NOTE_DECISION_FAILED = "Decision failed";

    private final SignalAggregator signalAggregator;
    private final RiskBoundedExecutionService riskBoundedExecutionService;
    private final PayDateScheduleService payDateScheduleService;
    private final TradeLogService tradeLogService;
    private final OrchestratorProperties orchestratorProperties;
    private final BaseDcaAmountService baseDcaAmountService;

    public WorkflowRun runOnce() {
        LocalDate today = payDateScheduleService.today();
        boolean payDate = PayDateScheduleService.isPayDate(today);

        try {
            payDateScheduleService.ensureDueEntries();
        } catch (Exception e) {
            log.error("Failed to create due schedule entries. date={}", today, e);
        }
        try {
            payDateScheduleService.markMissedEntries(today);
        } catch (Exception e) {
            log.error("Failed to mark missed schedule entries. date={}", today, e);
        }

        if (orchestratorProperties.payDatesOnly() && !payDate) {
            log.info("event=workflow_skipped date={} reason=not_pay_date next_pay_date={}", today, payDateScheduleService.nextPayDate(today));
            return WorkflowRun.skipped(today, false, NOTE_NOT_PAY_DATE);
        }
        if (isAlreadyConfirmed(today)) {
            log.info("event=workflow_skipped date={} reason=already_confirmed", today);
            return WorkflowRun.skipped(today, payDate, NOTE_ALREADY_CONFIRMED);
        }

        Decision decision;
        try {
            decision = signalAggregator.decide();
        } catch (Exception e) {
            log.error("Failed to build decision. date={}", today, e);
            return WorkflowRun.skipped(today, payDate, NOTE_DECISION_FAILED);
        }

        BigDecimal orderSize = orderSize(decision);
        OrderResult result = riskBoundedExecutionService.execute(orderSize);

        try {
            tradeLogService.append(decision, result);
        } catch (Exception e) {
            log.error("Failed to append trade log. date={}", today, e);
        }

        if (result.consumedBudget()) {
            try {
                payDateScheduleService.confirmScheduledBuy(today, result, decision);
            } catch (Exception e) {
                log.error("Failed to confirm scheduled buy. date={}", today, e);
            }
        }

        log.info(
                "event=workflow_completed date={} action={} order_size={} executed={} simulated={} reason={} daily_spend={}",
                today,
                decision.action().label(),
                orderSize,
                result.executed(),
                result.simulated(),
                result.reason(),
                riskBoundedExecutionService.dailySpend()
        );
        return new WorkflowRun(today, payDate, decision, orderSize, result, result.reason());
    }

    public Decision preview() {
        return signalAggregator.decide();
    }

    public BigDecimal orderSize(Decision decision) {
        return baseDcaAmountService.baseDcaUsd()
                .multiply(BigDecimal.valueOf(decision.multiplier()))
                .setScale(2, RoundingMode.HALF_UP);
    }

    private boolean isAlreadyConfirmed(LocalDate today) {
        try {
            Optional<ScheduledBuy> entry = payDateScheduleService.entryFor(today);
            return entry.map(buy -> buy.status() == ScheduleStatus.CONFIRMED).orElse(false);
        } catch (Exception e) {
            log.warn("Failed to read schedule entry. date={}", today, e);
            return false;
        }
    }
}
