package org.nowstart.cadence.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.nowstart.cadence.repository.DailyLedgerStore;
import org.springframework.stereotype.Service;

/**
 * Cumulative USD committed per calendar date. Totals only ever grow.
 */
@Service
@RequiredArgsConstructor
public class DailySpendLedger {

    private final DailyLedgerStore dailyLedgerStore;

    public BigDecimal spentOn(LocalDate date) {
        return dailyLedgerStore.load().getOrDefault(date, BigDecimal.ZERO);
    }

    public BigDecimal record(LocalDate date, BigDecimal usd) {
        if (usd == null || usd.signum() < 0) {
            throw new IllegalArgumentException("ledger amount must be >= 0, got " + usd);
        }
        Map<LocalDate, BigDecimal> spendByDate = new TreeMap<>(dailyLedgerStore.load());
        BigDecimal total = spendByDate.getOrDefault(date, BigDecimal.ZERO).add(usd);
        spendByDate.put(date, total);
        dailyLedgerStore.save(spendByDate);
        return total;
    }
}
