package org.nowstart.cadence.repository;

import java.util.List;
import org.nowstart.cadence.data.dto.TradeRecord;

public interface TradeLogStore {

    List<TradeRecord> load();

    void save(List<TradeRecord> records);
}
