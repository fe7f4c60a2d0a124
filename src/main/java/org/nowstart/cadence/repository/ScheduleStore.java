package org.nowstart.cadence.repository;

import java.util.List;
import org.nowstart.cadence.data.dto.ScheduledBuy;

public interface ScheduleStore {

    List<ScheduledBuy> load();

    void save(List<ScheduledBuy> entries);
}
