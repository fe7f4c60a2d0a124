package org.nowstart.cadence.service;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.Decision;
import org.nowstart.cadence.data.dto.OrderResult;
import org.nowstart.cadence.data.dto.TradeRecord;
import org.nowstart.cadence.repository.TradeLogStore;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeLogService {

    private final TradeLogStore tradeLogStore;

    public TradeRecord append(Decision decision, OrderResult result) {
        TradeRecord tradeRecord = TradeRecord.of(decision, result);
        List<TradeRecord> history = new ArrayList<>(tradeLogStore.load());
        history.add(tradeRecord);
        tradeLogStore.save(history);
        log.info(
                "event=trade_logged action={} usd={} executed={} simulated={}",
                tradeRecord.action().label(),
                tradeRecord.amountUsd(),
                tradeRecord.executed(),
                tradeRecord.simulated()
        );
        return tradeRecord;
    }

    public List<TradeRecord> history() {
        return List.copyOf(tradeLogStore.load());
    }
}
