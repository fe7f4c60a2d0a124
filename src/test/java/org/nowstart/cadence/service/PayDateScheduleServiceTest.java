package org.nowstart.cadence.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.cadence.data.dto.Decision;
import org.nowstart.cadence.data.dto.OrderResult;
import org.nowstart.cadence.data.dto.ScheduledBuy;
import org.nowstart.cadence.data.property.TestProperties;
import org.nowstart.cadence.data.type.OrderSide;
import org.nowstart.cadence.data.type.ScheduleStatus;
import org.nowstart.cadence.data.type.TradeAction;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.repository.InMemoryScheduleStore;

class PayDateScheduleServiceTest {

    private static final Instant CONFIRMED_AT = Instant.parse("2026-03-15T17:00:00Z");

    @Test
    void isPayDate_matchesMidMonthAndMonthEnd() {
        assertThat(PayDateScheduleService.isPayDate(LocalDate.of(2026, 3, 15))).isTrue();
        assertThat(PayDateScheduleService.isPayDate(LocalDate.of(2026, 2, 28))).isTrue();
        assertThat(PayDateScheduleService.isPayDate(LocalDate.of(2028, 2, 29))).isTrue();
        assertThat(PayDateScheduleService.isPayDate(LocalDate.of(2028, 2, 28))).isFalse();
        assertThat(PayDateScheduleService.isPayDate(LocalDate.of(2026, 3, 30))).isFalse();
    }

    @Test
    void payDatesBetween_enumeratesInclusiveRange() {
        List<LocalDate> dates = PayDateScheduleService.payDatesBetween(LocalDate.of(2026, 2, 15), LocalDate.of(2026, 4, 1));

        assertThat(dates).containsExactly(
                LocalDate.of(2026, 2, 15),
                LocalDate.of(2026, 2, 28),
                LocalDate.of(2026, 3, 15),
                LocalDate.of(2026, 3, 31)
        );
        assertThat(PayDateScheduleService.payDatesBetween(LocalDate.of(2026, 4, 2), LocalDate.of(2026, 4, 1))).isEmpty();
    }

    @Test
    void nextPayDate_neverPrecedesScheduleStart() {
        PayDateScheduleService service = service(new InMemoryScheduleStore());

        assertThat(service.nextPayDate(LocalDate.of(2026, 1, 1))).isEqualTo(LocalDate.of(2026, 2, 15));
        assertThat(service.nextPayDate(LocalDate.of(2026, 3, 16))).isEqualTo(LocalDate.of(2026, 3, 31));
        assertThat(service.nextPayDate(LocalDate.of(2026, 3, 31))).isEqualTo(LocalDate.of(2026, 3, 31));
    }

    @Test
    void ensureDueEntries_createsPendingEntriesOnceAndIsIdempotent() {
        InMemoryScheduleStore store = new InMemoryScheduleStore();
        PayDateScheduleService service = service(store);
        ZonedDateTime afterPlannedTime = ZonedDateTime.parse("2026-03-15T10:00:00-07:00[America/Los_Angeles]");

        List<ScheduledBuy> created = service.ensureDueEntries(afterPlannedTime);
        List<ScheduledBuy> again = service.ensureDueEntries(afterPlannedTime);

        assertThat(created).extracting(ScheduledBuy::date).containsExactly(
                LocalDate.of(2026, 2, 15),
                LocalDate.of(2026, 2, 28),
                LocalDate.of(2026, 3, 15)
        );
        assertThat(created).allSatisfy(entry -> {
            assertThat(entry.status()).isEqualTo(ScheduleStatus.PENDING);
            assertThat(entry.plannedTime()).isEqualTo("09:00 PT");
            assertThat(entry.plannedAmountUsd()).isEqualByComparingTo("100");
        });
        assertThat(again).isEmpty();
        assertThat(store.saves()).isEqualTo(1);
    }

    @Test
    void ensureDueEntries_waitsForPlannedTimeOnPayDate() {
        PayDateScheduleService service = service(new InMemoryScheduleStore());

        List<ScheduledBuy> created = service.ensureDueEntries(ZonedDateTime.parse("2026-03-15T08:59:00-07:00[America/Los_Angeles]"));

        assertThat(created).extracting(ScheduledBuy::date)
                .containsExactly(LocalDate.of(2026, 2, 15), LocalDate.of(2026, 2, 28));
    }

    @Test
    void markMissedEntries_flipsOnlyPendingEntriesBeforeToday() {
        InMemoryScheduleStore store = new InMemoryScheduleStore(List.of(
                ScheduledBuy.pending(LocalDate.of(2026, 2, 28), "09:00 PT", new BigDecimal("100")),
                ScheduledBuy.pending(LocalDate.of(2026, 3, 15), "09:00 PT", new BigDecimal("100"))
        ));
        PayDateScheduleService service = service(store);

        int missed = service.markMissedEntries(LocalDate.of(2026, 3, 15));

        assertThat(missed).isEqualTo(1);
        assertThat(service.entryFor(LocalDate.of(2026, 2, 28))).get()
                .extracting(ScheduledBuy::status).isEqualTo(ScheduleStatus.MISSED);
        assertThat(service.entryFor(LocalDate.of(2026, 3, 15))).get()
                .extracting(ScheduledBuy::status).isEqualTo(ScheduleStatus.PENDING);
        assertThat(service.markMissedEntries(LocalDate.of(2026, 3, 15))).isZero();
    }

    @Test
    void confirmScheduledBuy_confirmsPendingEntry() {
        InMemoryScheduleStore store = new InMemoryScheduleStore(List.of(
                ScheduledBuy.pending(LocalDate.of(2026, 3, 15), "09:00 PT", new BigDecimal("100"))
        ));
        PayDateScheduleService service = service(store);

        ScheduledBuy confirmed = service.confirmScheduledBuy(LocalDate.of(2026, 3, 15), simulatedFill(), decision());

        assertThat(confirmed.status()).isEqualTo(ScheduleStatus.CONFIRMED);
        assertThat(confirmed.executedAt()).isEqualTo(CONFIRMED_AT);
        assertThat(confirmed.plannedAmountUsd()).isEqualByComparingTo("100");
        assertThat(confirmed.actualAmountUsd()).isEqualByComparingTo("150.00");
        assertThat(confirmed.action()).isEqualTo(TradeAction.BUY);
        assertThat(confirmed.multiplier()).isEqualTo(1.5);
        assertThat(confirmed.simulated()).isTrue();
    }

    @Test
    void confirmScheduledBuy_synthesizesEntryWhenNoneExists() {
        InMemoryScheduleStore store = new InMemoryScheduleStore();
        PayDateScheduleService service = service(store);

        ScheduledBuy confirmed = service.confirmScheduledBuy(LocalDate.of(2026, 3, 31), simulatedFill(), decision());

        assertThat(confirmed.status()).isEqualTo(ScheduleStatus.CONFIRMED);
        assertThat(confirmed.plannedTime()).isEqualTo("09:00 PT");
        assertThat(confirmed.plannedAmountUsd()).isEqualByComparingTo("150.00");
        assertThat(service.entries()).hasSize(1);
    }

    @Test
    void confirmScheduledBuy_leavesSettledEntriesUnchanged() {
        ScheduledBuy missed = ScheduledBuy.pending(LocalDate.of(2026, 2, 28), "09:00 PT", new BigDecimal("100")).markMissed();
        InMemoryScheduleStore store = new InMemoryScheduleStore(List.of(missed));
        PayDateScheduleService service = service(store);

        ScheduledBuy result = service.confirmScheduledBuy(LocalDate.of(2026, 2, 28), simulatedFill(), decision());

        assertThat(result).isEqualTo(missed);
        assertThat(store.saves()).isZero();
    }

    @Test
    void entries_dropsEntriesBeforeStartAndDuplicateDates() {
        InMemoryScheduleStore store = new InMemoryScheduleStore(List.of(
                ScheduledBuy.pending(LocalDate.of(2026, 2, 28), "09:00 PT", new BigDecimal("100")),
                ScheduledBuy.pending(LocalDate.of(2026, 1, 31), "09:00 PT", new BigDecimal("100")),
                ScheduledBuy.pending(LocalDate.of(2026, 2, 15), "09:00 PT", new BigDecimal("100")),
                ScheduledBuy.pending(LocalDate.of(2026, 2, 15), "09:00 PT", new BigDecimal("200"))
        ));
        PayDateScheduleService service = service(store);

        List<ScheduledBuy> entries = service.entries();

        assertThat(entries).extracting(ScheduledBuy::date)
                .containsExactly(LocalDate.of(2026, 2, 15), LocalDate.of(2026, 2, 28));
        assertThat(entries.get(0).plannedAmountUsd()).isEqualByComparingTo("100");
    }

    private static PayDateScheduleService service(InMemoryScheduleStore store) {
        return new PayDateScheduleService(
                store,
                TestProperties.schedule(),
                new BaseDcaAmountService(TestProperties.orchestrator(), currency -> CollaboratorResult.failure("offline")),
                Clock.fixed(CONFIRMED_AT, ZoneOffset.UTC)
        );
    }

    private static OrderResult simulatedFill() {
        return new OrderResult(
                false,
                true,
                "XBTUSD",
                OrderSide.BUY,
                new BigDecimal("150.00"),
                new BigDecimal("0.00300000"),
                new BigDecimal("50000.00"),
                null,
                1,
                RiskBoundedExecutionService.REASON_DRY_RUN
        );
    }

    private static Decision decision() {
        return new Decision(TradeAction.BUY, 1.5, 0.25, List.of(), "rationale", CONFIRMED_AT);
    }
}
