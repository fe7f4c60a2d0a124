package org.nowstart.cadence.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.Decision;
import org.nowstart.cadence.data.dto.OrderResult;
import org.nowstart.cadence.data.dto.ScheduledBuy;
import org.nowstart.cadence.data.property.ScheduleProperties;
import org.nowstart.cadence.data.type.ScheduleStatus;
import org.nowstart.cadence.repository.ScheduleStore;
import org.springframework.stereotype.Service;

/**
 * Recurring purchase calendar on the 15th and the last day of each month.
 *
 * <p>Entries move from pending to either confirmed or missed and never change afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayDateScheduleService {

    private static final int MID_MONTH_DAY = 15;

    private final ScheduleStore scheduleStore;
    private final ScheduleProperties scheduleProperties;
    private final BaseDcaAmountService baseDcaAmountService;
    private final Clock clock;

    public static boolean isPayDate(LocalDate date) {
        return date.getDayOfMonth() == MID_MONTH_DAY || date.getDayOfMonth() == date.lengthOfMonth();
    }

    /**
     * Pay dates within {@code [from, to]} in ascending order.
     */
    public static List<LocalDate> payDatesBetween(LocalDate from, LocalDate to) {
        List<LocalDate> dates = new ArrayList<>();
        if (from == null || to == null || from.isAfter(to)) {
            return dates;
        }
        LocalDate month = from.withDayOfMonth(1);
        while (!month.isAfter(to)) {
            LocalDate midMonth = month.withDayOfMonth(MID_MONTH_DAY);
            LocalDate monthEnd = month.withDayOfMonth(month.lengthOfMonth());
            for (LocalDate candidate : List.of(midMonth, monthEnd)) {
                if (!candidate.isBefore(from) && !candidate.isAfter(to)) {
                    dates.add(candidate);
                }
            }
            month = month.plusMonths(1);
        }
        return dates;
    }

    /**
     * First pay date on or after both {@code date} and the schedule start.
     */
    public LocalDate nextPayDate(LocalDate date) {
        LocalDate cursor = date.isBefore(scheduleProperties.startDate()) ? scheduleProperties.startDate() : date;
        while (!isPayDate(cursor)) {
            cursor = cursor.plusDays(1);
        }
        return cursor;
    }

    public LocalDate today() {
        return now().toLocalDate();
    }

    public List<ScheduledBuy> entries() {
        return load();
    }

    public Optional<ScheduledBuy> entryFor(LocalDate date) {
        return load().stream().filter(entry -> entry.date().equals(date)).findFirst();
    }

    public List<ScheduledBuy> ensureDueEntries() {
        return ensureDueEntries(now());
    }

    /**
     * Creates a pending entry for every pay date from the start date up to {@code now}. Today's
     * pay date only counts once the planned local time has passed. Running twice adds nothing.
     */
    public List<ScheduledBuy> ensureDueEntries(ZonedDateTime now) {
        ZonedDateTime local = now.withZoneSameInstant(scheduleProperties.zone());
        LocalDate today = local.toLocalDate();
        LocalDate lastDue = local.toLocalTime().isBefore(scheduleProperties.plannedTime()) ? today.minusDays(1) : today;

        List<ScheduledBuy> entries = load();
        Set<LocalDate> existing = new HashSet<>();
        entries.forEach(entry -> existing.add(entry.date()));

        List<ScheduledBuy> created = new ArrayList<>();
        for (LocalDate date : payDatesBetween(scheduleProperties.startDate(), lastDue)) {
            if (existing.add(date)) {
                created.add(ScheduledBuy.pending(date, plannedTimeLabel(), baseDcaAmountService.baseDcaUsd()));
            }
        }
        if (!created.isEmpty()) {
            entries.addAll(created);
            save(entries);
            log.info("event=schedule_entries_created count={} last_due={}", created.size(), lastDue);
        }
        return created;
    }

    /**
     * Flips pending entries dated strictly before {@code today} to missed.
     */
    public int markMissedEntries(LocalDate today) {
        List<ScheduledBuy> entries = load();
        int missed = 0;
        for (int i = 0; i < entries.size(); i++) {
            ScheduledBuy entry = entries.get(i);
            if (entry.status() == ScheduleStatus.PENDING && entry.date().isBefore(today)) {
                entries.set(i, entry.markMissed());
                missed++;
                log.warn("event=schedule_missed date={}", entry.date());
            }
        }
        if (missed > 0) {
            save(entries);
        }
        return missed;
    }

    public ScheduledBuy confirmScheduledBuy(LocalDate date, OrderResult result, Decision decision) {
        List<ScheduledBuy> entries = load();
        for (int i = 0; i < entries.size(); i++) {
            ScheduledBuy entry = entries.get(i);
            if (!entry.date().equals(date)) {
                continue;
            }
            if (entry.status().isTerminal()) {
                log.warn("Scheduled buy already settled, leaving unchanged. date={}, status={}", date, entry.status());
                return entry;
            }
            ScheduledBuy confirmed = entry.confirm(clock.instant(), result, decision);
            entries.set(i, confirmed);
            save(entries);
            log.info("event=schedule_confirmed date={} usd={}", date, result.usdAmount());
            return confirmed;
        }

        ScheduledBuy confirmed = ScheduledBuy.confirmedDirectly(date, plannedTimeLabel(), clock.instant(), result, decision);
        entries.add(confirmed);
        save(entries);
        log.info("event=schedule_confirmed date={} usd={} synthesized=true", date, result.usdAmount());
        return confirmed;
    }

    String plannedTimeLabel() {
        return scheduleProperties.plannedTime() + " " + scheduleProperties.zone().getDisplayName(TextStyle.SHORT, Locale.US);
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(scheduleProperties.zone());
    }

    /**
     * Loads entries sorted by date, dropping those before the start date and repeated dates.
     */
    private List<ScheduledBuy> load() {
        Set<LocalDate> seen = new HashSet<>();
        List<ScheduledBuy> entries = new ArrayList<>();
        for (ScheduledBuy entry : scheduleStore.load()) {
            if (entry == null || entry.date().isBefore(scheduleProperties.startDate())) {
                continue;
            }
            if (seen.add(entry.date())) {
                entries.add(entry);
            }
        }
        entries.sort(Comparator.comparing(ScheduledBuy::date));
        return entries;
    }

    private void save(List<ScheduledBuy> entries) {
        entries.sort(Comparator.comparing(ScheduledBuy::date));
        scheduleStore.save(entries);
    }
}
