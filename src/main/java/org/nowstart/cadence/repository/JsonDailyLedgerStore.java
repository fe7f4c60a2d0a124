package org.nowstart.cadence.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;
import org.nowstart.cadence.data.property.TradingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JsonDailyLedgerStore extends JsonFileStore<TreeMap<LocalDate, BigDecimal>> implements DailyLedgerStore {

    @Autowired
    public JsonDailyLedgerStore(ObjectMapper objectMapper, TradingProperties tradingProperties) {
        this(objectMapper, Path.of(tradingProperties.ledgerPath()));
    }

    JsonDailyLedgerStore(ObjectMapper objectMapper, Path path) {
        super(objectMapper, path, new TypeReference<>() {}, TreeMap::new);
    }

    @Override
    public Map<LocalDate, BigDecimal> load() {
        return read();
    }

    @Override
    public void save(Map<LocalDate, BigDecimal> spendByDate) {
        write(new TreeMap<>(spendByDate));
    }
}
