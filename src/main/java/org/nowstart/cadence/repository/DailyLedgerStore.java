package org.nowstart.cadence.repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public interface DailyLedgerStore {

    Map<LocalDate, BigDecimal> load();

    void save(Map<LocalDate, BigDecimal> spendByDate);
}
